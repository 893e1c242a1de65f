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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Interior node of the lossless syntax tree.  Children are nodes or
 * tokens; trivia tokens (whitespace and comments) are kept as children,
 * so the leaves of the root reproduce the source text exactly.
 *
 * Nodes are immutable once built.
 */
public class SyntaxNode extends SyntaxElement {
  private final SyntaxKind kind;
  private final List<SyntaxElement> children;
  private final Span span;

  /**
   * @param kind
   * @param children
   * @param emptySpan span to use if there are no children
   */
  public SyntaxNode(SyntaxKind kind, List<SyntaxElement> children,
                    Span emptySpan) {
    super();
    this.kind = kind;
    this.children = Collections.unmodifiableList(
                        new ArrayList<SyntaxElement>(children));
    if (children.isEmpty()) {
      this.span = emptySpan;
    } else {
      this.span = Span.cover(children.get(0).getSpan(),
                    children.get(children.size() - 1).getSpan());
    }
  }

  public SyntaxKind getKind() {
    return kind;
  }

  public boolean is(SyntaxKind k) {
    return kind == k;
  }

  @Override
  public Span getSpan() {
    return span;
  }

  @Override
  public boolean isToken() {
    return false;
  }

  public List<SyntaxElement> children() {
    return children;
  }

  public List<SyntaxNode> childNodes() {
    List<SyntaxNode> result = new ArrayList<SyntaxNode>();
    for (SyntaxElement e: children) {
      if (!e.isToken()) {
        result.add(e.asNode());
      }
    }
    return result;
  }

  public List<SyntaxNode> childrenOfKind(SyntaxKind k) {
    List<SyntaxNode> result = new ArrayList<SyntaxNode>();
    for (SyntaxElement e: children) {
      if (!e.isToken() && e.asNode().kind == k) {
        result.add(e.asNode());
      }
    }
    return result;
  }

  /**
   * @return first child node of kind, or null
   */
  public SyntaxNode firstChild(SyntaxKind k) {
    for (SyntaxElement e: children) {
      if (!e.isToken() && e.asNode().kind == k) {
        return e.asNode();
      }
    }
    return null;
  }

  /**
   * @return first direct child node that is an expression, or null
   */
  public SyntaxNode firstExpression() {
    for (SyntaxElement e: children) {
      if (!e.isToken() && e.asNode().kind.isExpression()) {
        return e.asNode();
      }
    }
    return null;
  }

  public List<SyntaxNode> expressions() {
    List<SyntaxNode> result = new ArrayList<SyntaxNode>();
    for (SyntaxElement e: children) {
      if (!e.isToken() && e.asNode().kind.isExpression()) {
        result.add(e.asNode());
      }
    }
    return result;
  }

  /**
   * @return first direct child token of kind, or null
   */
  public Token firstToken(TokenKind k) {
    for (SyntaxElement e: children) {
      if (e.isToken() && e.asToken().getKind() == k) {
        return e.asToken();
      }
    }
    return null;
  }

  /**
   * @return direct child tokens that are not trivia
   */
  public List<Token> significantTokens() {
    List<Token> result = new ArrayList<Token>();
    for (SyntaxElement e: children) {
      if (e.isToken() && !e.asToken().isTrivia()) {
        result.add(e.asToken());
      }
    }
    return result;
  }

  /**
   * @return all tokens under this node in source order
   */
  public List<Token> leaves() {
    List<Token> result = new ArrayList<Token>();
    collectTokens(result);
    return result;
  }

  @Override
  public void collectTokens(List<Token> out) {
    for (SyntaxElement e: children) {
      e.collectTokens(out);
    }
  }

  /**
   * All descendant nodes of the given kind, in preorder, including this
   */
  public List<SyntaxNode> descendants(SyntaxKind k) {
    List<SyntaxNode> result = new ArrayList<SyntaxNode>();
    ArrayList<SyntaxNode> stack = new ArrayList<SyntaxNode>();
    stack.add(this);
    while (!stack.isEmpty()) {
      SyntaxNode n = stack.remove(stack.size() - 1);
      if (n.kind == k) {
        result.add(n);
      }
      List<SyntaxNode> kids = n.childNodes();
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.add(kids.get(i));
      }
    }
    return result;
  }

  @Override
  public String getText() {
    StringBuilder sb = new StringBuilder(span.length());
    for (Token t: leaves()) {
      sb.append(t.getText());
    }
    return sb.toString();
  }

  /**
   * @return source text without leading or trailing trivia
   */
  public String getTrimmedText() {
    List<Token> toks = leaves();
    int first = 0;
    int last = toks.size() - 1;
    while (first <= last && toks.get(first).isTrivia()) {
      first++;
    }
    while (last >= first && toks.get(last).isTrivia()) {
      last--;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = first; i <= last; i++) {
      sb.append(toks.get(i).getText());
    }
    return sb.toString();
  }

  /**
   * @return span without leading or trailing trivia
   */
  public Span getTrimmedSpan() {
    List<Token> toks = leaves();
    Span result = null;
    for (Token t: toks) {
      if (!t.isTrivia()) {
        result = (result == null) ? t.getSpan()
                                  : Span.cover(result, t.getSpan());
      }
    }
    return result == null ? span : result;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(kind + "@" + span.start + ".." + span.end);
    for (SyntaxElement e: children) {
      if (e.isToken()) {
        indent(writer, indent + 2);
        writer.println(e.asToken().toString());
      } else {
        e.asNode().printTree(writer, indent + 2);
      }
    }
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  @Override
  public String toString() {
    return kind + "@" + span.start + ".." + span.end;
  }
}
