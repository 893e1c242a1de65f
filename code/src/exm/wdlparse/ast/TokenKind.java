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

import java.util.HashMap;
import java.util.Map;

public enum TokenKind {
  WHITESPACE(TokenCategory.TRIVIA),
  COMMENT(TokenCategory.COMMENT),

  VERSION(TokenCategory.KEYWORD, "version"),
  IMPORT(TokenCategory.KEYWORD, "import"),
  AS(TokenCategory.KEYWORD, "as"),
  ALIAS(TokenCategory.KEYWORD, "alias"),
  STRUCT(TokenCategory.KEYWORD, "struct"),
  TASK(TokenCategory.KEYWORD, "task"),
  WORKFLOW(TokenCategory.KEYWORD, "workflow"),
  INPUT(TokenCategory.KEYWORD, "input"),
  OUTPUT(TokenCategory.KEYWORD, "output"),
  COMMAND(TokenCategory.KEYWORD, "command"),
  RUNTIME(TokenCategory.KEYWORD, "runtime"),
  META(TokenCategory.KEYWORD, "meta"),
  PARAMETER_META(TokenCategory.KEYWORD, "parameter_meta"),
  CALL(TokenCategory.KEYWORD, "call"),
  SCATTER(TokenCategory.KEYWORD, "scatter"),
  IF(TokenCategory.KEYWORD, "if"),
  THEN(TokenCategory.KEYWORD, "then"),
  ELSE(TokenCategory.KEYWORD, "else"),
  IN(TokenCategory.KEYWORD, "in"),
  OBJECT(TokenCategory.KEYWORD, "object"),
  /** Built-in type names: Int, Float, Boolean, String, File, ... */
  TYPE_NAME(TokenCategory.KEYWORD),

  IDENT(TokenCategory.IDENTIFIER),

  TRUE(TokenCategory.LITERAL, "true"),
  FALSE(TokenCategory.LITERAL, "false"),
  NONE(TokenCategory.LITERAL, "None"),
  NULL(TokenCategory.LITERAL, "null"),
  INTEGER(TokenCategory.LITERAL),
  FLOAT(TokenCategory.LITERAL),
  /** Free-form text following the version keyword */
  VERSION_TEXT(TokenCategory.LITERAL),

  LBRACE(TokenCategory.PUNCTUATION, "{"),
  RBRACE(TokenCategory.PUNCTUATION, "}"),
  LPAREN(TokenCategory.PUNCTUATION, "("),
  RPAREN(TokenCategory.PUNCTUATION, ")"),
  LBRACKET(TokenCategory.PUNCTUATION, "["),
  RBRACKET(TokenCategory.PUNCTUATION, "]"),
  COMMA(TokenCategory.PUNCTUATION, ","),
  COLON(TokenCategory.PUNCTUATION, ":"),
  DOT(TokenCategory.PUNCTUATION, "."),
  ASSIGN(TokenCategory.PUNCTUATION, "="),
  EQ(TokenCategory.PUNCTUATION, "=="),
  NEQ(TokenCategory.PUNCTUATION, "!="),
  LT(TokenCategory.PUNCTUATION, "<"),
  LTE(TokenCategory.PUNCTUATION, "<="),
  GT(TokenCategory.PUNCTUATION, ">"),
  GTE(TokenCategory.PUNCTUATION, ">="),
  PLUS(TokenCategory.PUNCTUATION, "+"),
  MINUS(TokenCategory.PUNCTUATION, "-"),
  STAR(TokenCategory.PUNCTUATION, "*"),
  SLASH(TokenCategory.PUNCTUATION, "/"),
  PERCENT(TokenCategory.PUNCTUATION, "%"),
  AND(TokenCategory.PUNCTUATION, "&&"),
  OR(TokenCategory.PUNCTUATION, "||"),
  NOT(TokenCategory.PUNCTUATION, "!"),
  QUESTION(TokenCategory.PUNCTUATION, "?"),

  /** Opening or closing quote of a string literal */
  QUOTE(TokenCategory.PUNCTUATION),
  STRING_TEXT(TokenCategory.STRING_FRAGMENT),
  /** { opening a brace-delimited command */
  COMMAND_OPEN(TokenCategory.PUNCTUATION, "{"),
  /** } closing a brace-delimited command */
  COMMAND_CLOSE(TokenCategory.PUNCTUATION, "}"),
  HEREDOC_OPEN(TokenCategory.PUNCTUATION, "<<<"),
  HEREDOC_CLOSE(TokenCategory.PUNCTUATION, ">>>"),
  COMMAND_TEXT(TokenCategory.STRING_FRAGMENT),
  /** ~{ or ${ */
  PLACEHOLDER_OPEN(TokenCategory.PUNCTUATION),
  PLACEHOLDER_CLOSE(TokenCategory.PUNCTUATION, "}"),

  ERROR(TokenCategory.ERROR),
  EOF(TokenCategory.END),
  ;

  public final TokenCategory category;
  /** Fixed spelling, or null if the text varies */
  public final String spelling;

  private TokenKind(TokenCategory category) {
    this(category, null);
  }

  private TokenKind(TokenCategory category, String spelling) {
    this.category = category;
    this.spelling = spelling;
  }

  private static final Map<String, TokenKind> keywords =
                                    new HashMap<String, TokenKind>();
  static {
    for (TokenKind k: values()) {
      if ((k.category == TokenCategory.KEYWORD ||
           k.category == TokenCategory.LITERAL) && k.spelling != null) {
        keywords.put(k.spelling, k);
      }
    }
    for (String typeName: new String[] {"Int", "Float", "Boolean", "String",
                "File", "Directory", "Array", "Map", "Pair", "Object"}) {
      keywords.put(typeName, TYPE_NAME);
    }
  }

  /**
   * @return keyword kind for word, or null if it is a plain identifier
   */
  public static TokenKind keyword(String word) {
    return keywords.get(word);
  }

  public boolean isTrivia() {
    return category == TokenCategory.TRIVIA ||
           category == TokenCategory.COMMENT;
  }

  /**
   * @return a readable description for error messages
   */
  public String describe() {
    if (spelling != null) {
      return "'" + spelling + "'";
    }
    switch (this) {
      case IDENT:
        return "identifier";
      case TYPE_NAME:
        return "type name";
      case INTEGER:
      case FLOAT:
        return "number";
      case QUOTE:
        return "quote";
      case EOF:
        return "end of input";
      default:
        return name().toLowerCase().replace('_', ' ');
    }
  }
}
