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

import java.util.ArrayList;
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.common.exceptions.WdlRuntimeError;
import exm.wdlparse.frontend.Context;

/**
 * One element of a workflow body: a call, a scatter or conditional
 * block, or a declaration.  Check getKind() before calling the
 * kind-specific accessors.
 */
public class WorkflowElement {
  public static enum ElementKind {
    CALL,
    SCATTER,
    CONDITIONAL,
    DECLARATION,
  }

  private final ElementKind kind;
  private final Object value;

  private WorkflowElement(ElementKind kind, Object value) {
    assert(value != null);
    this.kind = kind;
    this.value = value;
  }

  public static WorkflowElement createCall(CallStatement call) {
    return new WorkflowElement(ElementKind.CALL, call);
  }

  public static WorkflowElement createScatter(ScatterBlock scatter) {
    return new WorkflowElement(ElementKind.SCATTER, scatter);
  }

  public static WorkflowElement createConditional(ConditionalBlock cond) {
    return new WorkflowElement(ElementKind.CONDITIONAL, cond);
  }

  public static WorkflowElement createDeclaration(Declaration decl) {
    return new WorkflowElement(ElementKind.DECLARATION, decl);
  }

  public ElementKind getKind() {
    return kind;
  }

  public CallStatement getCall() {
    if (kind != ElementKind.CALL) {
      throw new WdlRuntimeError("getCall for " + kind);
    }
    return (CallStatement)value;
  }

  public ScatterBlock getScatter() {
    if (kind != ElementKind.SCATTER) {
      throw new WdlRuntimeError("getScatter for " + kind);
    }
    return (ScatterBlock)value;
  }

  public ConditionalBlock getConditional() {
    if (kind != ElementKind.CONDITIONAL) {
      throw new WdlRuntimeError("getConditional for " + kind);
    }
    return (ConditionalBlock)value;
  }

  public Declaration getDeclaration() {
    if (kind != ElementKind.DECLARATION) {
      throw new WdlRuntimeError("getDeclaration for " + kind);
    }
    return (Declaration)value;
  }

  /**
   * @return nested body for scatter and conditional, else empty list
   */
  public List<WorkflowElement> getBody() {
    switch (kind) {
      case SCATTER:
        return getScatter().getBody();
      case CONDITIONAL:
        return getConditional().getBody();
      default:
        return new ArrayList<WorkflowElement>();
    }
  }

  public Span getSpan() {
    switch (kind) {
      case CALL:
        return getCall().getSpan();
      case SCATTER:
        return getScatter().getSpan();
      case CONDITIONAL:
        return getConditional().getSpan();
      case DECLARATION:
        return getDeclaration().getSpan();
      default:
        throw new WdlRuntimeError("Unknown element kind " + kind);
    }
  }

  @Override
  public String toString() {
    return kind + ": " + value;
  }

  /**
   * @return null if the element is too incomplete to use
   */
  public static WorkflowElement fromAST(Context context, SyntaxNode tree) {
    switch (tree.getKind()) {
      case CALL_STMT: {
        CallStatement call = CallStatement.fromAST(context, tree);
        return call == null ? null : createCall(call);
      }
      case SCATTER_BLOCK:
        return createScatter(ScatterBlock.fromAST(context, tree));
      case CONDITIONAL_BLOCK:
        return createConditional(ConditionalBlock.fromAST(context, tree));
      case DECLARATION: {
        Declaration decl = Declaration.fromAST(context, tree);
        return decl == null ? null : createDeclaration(decl);
      }
      default:
        return null;
    }
  }

  /**
   * Elements directly under a workflow or block node, in source order
   */
  public static List<WorkflowElement> listFromAST(Context context,
                                                  SyntaxNode tree) {
    List<WorkflowElement> result = new ArrayList<WorkflowElement>();
    for (SyntaxNode child: tree.childNodes()) {
      WorkflowElement elem = fromAST(context, child);
      if (elem != null) {
        result.add(elem);
      }
    }
    return result;
  }
}
