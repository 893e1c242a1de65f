/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.wdlparse.ast;

import java.util.List;

/**
 * A lexical token.  Tokens retain their raw source text, so concatenating
 * the text of all tokens in order reproduces the source exactly.
 */
public class Token extends SyntaxElement {
  private final TokenKind kind;
  private final String text;
  private final Span span;

  public Token(TokenKind kind, String text, Span span) {
    super();
    assert(kind != null);
    assert(text != null);
    assert(text.length() == span.length()) : text + " " + span;
    this.kind = kind;
    this.text = text;
    this.span = span;
  }

  public TokenKind getKind() {
    return kind;
  }

  public TokenCategory getCategory() {
    return kind.category;
  }

  @Override
  public String getText() {
    return text;
  }

  @Override
  public Span getSpan() {
    return span;
  }

  public int getLine() {
    return span.startLine;
  }

  public int getColumn() {
    return span.startColumn;
  }

  public boolean isTrivia() {
    return kind.isTrivia();
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  /**
   * @return true if this is trivia containing a line break
   */
  public boolean isNewline() {
    return kind == TokenKind.WHITESPACE && text.indexOf('\n') >= 0;
  }

  @Override
  public boolean isToken() {
    return true;
  }

  @Override
  public void collectTokens(List<Token> out) {
    out.add(this);
  }

  @Override
  public String toString() {
    return kind + "@" + span.start + ".." + span.end + " " + quote(text);
  }

  private static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\n': sb.append("\\n"); break;
        case '\t': sb.append("\\t"); break;
        case '\r': sb.append("\\r"); break;
        case '"': sb.append("\\\""); break;
        case '\\': sb.append("\\\\"); break;
        default: sb.append(c);
      }
    }
    sb.append('"');
    return sb.toString();
  }
}
