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
package exm.wdlparse.frontend.tree;

import java.util.Collections;
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LogHelper;

/**
 * scatter (variable in collection) { body }
 */
public class ScatterBlock {
  public static final String ID_PREFIX = "scatter_";

  private final String id;
  /** May be null if the source is incomplete */
  private final String variable;
  /** May be null if the source is incomplete */
  private final Expression collection;
  private final List<WorkflowElement> body;
  private final Span span;

  public ScatterBlock(String id, String variable, Expression collection,
                      List<WorkflowElement> body, Span span) {
    this.id = id;
    this.variable = variable;
    this.collection = collection;
    this.body = Collections.unmodifiableList(body);
    this.span = span;
  }

  /**
   * @return id unique within the workflow, e.g. scatter_1
   */
  public String getId() {
    return id;
  }

  public String getVariable() {
    return variable;
  }

  public Expression getCollection() {
    return collection;
  }

  public List<WorkflowElement> getBody() {
    return body;
  }

  public Span getSpan() {
    return span;
  }

  public static ScatterBlock fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.SCATTER_BLOCK));
    // Number before walking the body so ids follow source order
    String id = ID_PREFIX + context.nextCounterVal("scatter");
    Token var = tree.firstToken(TokenKind.IDENT);
    Expression collection = Expression.fromAST(context,
                                               tree.firstExpression());
    if (var == null || collection == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Scatter is missing its " +
          (var == null ? "variable" : "collection"));
    }
    LogHelper.trace(context, id);
    List<WorkflowElement> body = WorkflowElement.listFromAST(context, tree);
    return new ScatterBlock(id, var == null ? null : var.getText(),
                            collection, body, tree.getTrimmedSpan());
  }
}
