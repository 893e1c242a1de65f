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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LocalContext;
import exm.wdlparse.frontend.LogHelper;
import exm.wdlparse.frontend.tree.WorkflowElement.ElementKind;

public class Workflow {
  private final String name;
  private final List<Declaration> inputs;
  private final List<WorkflowElement> body;
  private final List<Declaration> outputs;
  private final Map<String, Expression> meta;
  private final Map<String, Expression> parameterMeta;
  private final Span span;
  private final Span nameSpan;

  public Workflow(String name, List<Declaration> inputs,
      List<WorkflowElement> body, List<Declaration> outputs,
      Map<String, Expression> meta, Map<String, Expression> parameterMeta,
      Span span, Span nameSpan) {
    this.name = name;
    this.inputs = Collections.unmodifiableList(inputs);
    this.body = Collections.unmodifiableList(body);
    this.outputs = Collections.unmodifiableList(outputs);
    this.meta = Collections.unmodifiableMap(meta);
    this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    this.span = span;
    this.nameSpan = nameSpan;
  }

  public String getName() {
    return name;
  }

  public List<Declaration> getInputs() {
    return inputs;
  }

  /**
   * Top-level body elements; scatter and conditional blocks hold their
   * own nested bodies
   */
  public List<WorkflowElement> getBody() {
    return body;
  }

  public List<Declaration> getOutputs() {
    return outputs;
  }

  public Map<String, Expression> getMeta() {
    return meta;
  }

  public Map<String, Expression> getParameterMeta() {
    return parameterMeta;
  }

  public Span getSpan() {
    return span;
  }

  public Span getNameSpan() {
    return nameSpan;
  }

  /**
   * Every body element at every nesting level, in source order
   */
  public List<WorkflowElement> getAllElements() {
    List<WorkflowElement> result = new ArrayList<WorkflowElement>();
    addAll(body, result);
    return result;
  }

  private static void addAll(List<WorkflowElement> elems,
                             List<WorkflowElement> out) {
    for (WorkflowElement e: elems) {
      out.add(e);
      addAll(e.getBody(), out);
    }
  }

  public List<CallStatement> getAllCalls() {
    List<CallStatement> result = new ArrayList<CallStatement>();
    for (WorkflowElement e: getAllElements()) {
      if (e.getKind() == ElementKind.CALL) {
        result.add(e.getCall());
      }
    }
    return result;
  }

  /**
   * @return first call with this effective alias, or null
   */
  public CallStatement getCall(String alias) {
    for (CallStatement call: getAllCalls()) {
      if (call.getAlias().equals(alias)) {
        return call;
      }
    }
    return null;
  }

  public int countElements(ElementKind kind) {
    int count = 0;
    for (WorkflowElement e: getAllElements()) {
      if (e.getKind() == kind) {
        count++;
      }
    }
    return count;
  }

  /**
   * @return null if the workflow has no name
   */
  public static Workflow fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.WORKFLOW_DECL));
    Token name = tree.firstToken(TokenKind.IDENT);
    if (name == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Workflow has no name");
      return null;
    }
    Context wfContext = LocalContext.definitionContext(
                    context.getGlobals(), "workflow " + name.getText());
    LogHelper.trace(wfContext, "walking workflow");

    List<Declaration> inputs = Declaration.sectionsFromAST(wfContext, tree,
                                            SyntaxKind.INPUT_SECTION);
    List<WorkflowElement> body = WorkflowElement.listFromAST(wfContext, tree);
    List<Declaration> outputs = Declaration.sectionsFromAST(wfContext, tree,
                                            SyntaxKind.OUTPUT_SECTION);
    return new Workflow(name.getText(), inputs, body, outputs,
        Task.itemsFromAST(wfContext, tree, SyntaxKind.META_SECTION,
                          SyntaxKind.META_ITEM),
        Task.itemsFromAST(wfContext, tree, SyntaxKind.PARAMETER_META_SECTION,
                          SyntaxKind.META_ITEM),
        tree.getTrimmedSpan(), name.getSpan());
  }
}
