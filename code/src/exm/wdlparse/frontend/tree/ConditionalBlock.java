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
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LogHelper;

/**
 * if (condition) { body }
 */
public class ConditionalBlock {
  public static final String ID_PREFIX = "conditional_";

  private final String id;
  /** May be null if the source is incomplete */
  private final Expression condition;
  private final List<WorkflowElement> body;
  private final Span span;

  public ConditionalBlock(String id, Expression condition,
                          List<WorkflowElement> body, Span span) {
    this.id = id;
    this.condition = condition;
    this.body = Collections.unmodifiableList(body);
    this.span = span;
  }

  /**
   * @return id unique within the workflow, e.g. conditional_1
   */
  public String getId() {
    return id;
  }

  public Expression getCondition() {
    return condition;
  }

  public List<WorkflowElement> getBody() {
    return body;
  }

  public Span getSpan() {
    return span;
  }

  public static ConditionalBlock fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.CONDITIONAL_BLOCK));
    String id = ID_PREFIX + context.nextCounterVal("conditional");
    Expression condition = Expression.fromAST(context,
                                              tree.firstExpression());
    if (condition == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "If block is missing its condition");
    }
    LogHelper.trace(context, id);
    List<WorkflowElement> body = WorkflowElement.listFromAST(context, tree);
    return new ConditionalBlock(id, condition, body, tree.getTrimmedSpan());
  }
}
