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
package exm.wdlparse.parser;

import java.util.ArrayList;
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxElement;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.common.exceptions.WdlRuntimeError;

/**
 * Assembles the syntax tree bottom-up while the parser runs.
 *
 * Nodes are opened and closed in stack order.  A checkpoint records a
 * position in the current node so that a node can later be opened
 * retroactively around everything added since, which is how binary
 * and postfix expressions wrap their left operand.
 */
class TreeBuilder {

  private static class Frame {
    final SyntaxKind kind;
    final List<SyntaxElement> children;

    Frame(SyntaxKind kind, List<SyntaxElement> children) {
      this.kind = kind;
      this.children = children;
    }
  }

  private final ArrayList<Frame> stack = new ArrayList<Frame>();
  /** Zero-width span just after the last token added */
  private Span lastEnd = Span.point(0, 1, 1);

  public void startNode(SyntaxKind kind) {
    stack.add(new Frame(kind, new ArrayList<SyntaxElement>()));
  }

  /**
   * @return position in the current node, for startNodeAt
   */
  public int checkpoint() {
    return current().children.size();
  }

  /**
   * Open a node containing every element added to the current node
   * since the checkpoint was taken
   */
  public void startNodeAt(int checkpoint, SyntaxKind kind) {
    List<SyntaxElement> siblings = current().children;
    if (checkpoint > siblings.size()) {
      throw new WdlRuntimeError("Checkpoint " + checkpoint +
                      " beyond " + siblings.size() + " children");
    }
    List<SyntaxElement> tail = siblings.subList(checkpoint, siblings.size());
    List<SyntaxElement> moved = new ArrayList<SyntaxElement>(tail);
    tail.clear();
    stack.add(new Frame(kind, moved));
  }

  public void finishNode() {
    if (stack.size() <= 1) {
      throw new WdlRuntimeError("finishNode() would close the root");
    }
    SyntaxNode node = build(stack.remove(stack.size() - 1));
    current().children.add(node);
  }

  public void token(Token token) {
    current().children.add(token);
    Span s = token.getSpan();
    lastEnd = Span.point(s.end, s.endLine, s.endColumn);
  }

  /**
   * Close the root node
   */
  public SyntaxNode finish() {
    if (stack.size() != 1) {
      throw new WdlRuntimeError("Unbalanced tree: " + stack.size() +
                                " open nodes");
    }
    return build(stack.remove(0));
  }

  private Frame current() {
    if (stack.isEmpty()) {
      throw new WdlRuntimeError("No open node");
    }
    return stack.get(stack.size() - 1);
  }

  private SyntaxNode build(Frame f) {
    return new SyntaxNode(f.kind, f.children, lastEnd);
  }
}
