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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.Context.DefInfo;
import exm.wdlparse.frontend.Context.DefKind;
import exm.wdlparse.frontend.LogHelper;

/**
 * A call of a task or workflow, possibly one from an imported document,
 * e.g. call utils.merge_vcfs as merge { input: vcfs = vcfs }
 */
public class CallStatement {

  public static enum TargetKind {
    /** Task of this document */
    TASK,
    /** Workflow of this document */
    WORKFLOW,
    /** Qualified name into an imported document, not checked */
    IMPORTED,
    /** Unqualified name that matches nothing in this document */
    UNRESOLVED,
  }

  private final String target;
  private final String qualifier;
  private final String name;
  private final String explicitAlias;
  private final TargetKind targetKind;
  /** Parameter name -> bound expression, in source order */
  private final Map<String, Expression> inputs;
  private final Span span;
  private final Span targetSpan;

  public CallStatement(String target, String explicitAlias,
      TargetKind targetKind, Map<String, Expression> inputs, Span span,
      Span targetSpan) {
    this.target = target;
    int dot = target.lastIndexOf('.');
    this.qualifier = dot < 0 ? null : target.substring(0, dot);
    this.name = target.substring(dot + 1);
    this.explicitAlias = explicitAlias;
    this.targetKind = targetKind;
    this.inputs = Collections.unmodifiableMap(
                      new LinkedHashMap<String, Expression>(inputs));
    this.span = span;
    this.targetSpan = targetSpan;
  }

  /**
   * @return callee as written, e.g. utils.merge_vcfs
   */
  public String getTarget() {
    return target;
  }

  /**
   * @return import namespace, e.g. utils, or null if unqualified
   */
  public String getQualifier() {
    return qualifier;
  }

  public boolean isQualified() {
    return qualifier != null;
  }

  /**
   * @return callee without qualifier, e.g. merge_vcfs
   */
  public String getName() {
    return name;
  }

  /**
   * @return the "as" name, or null
   */
  public String getExplicitAlias() {
    return explicitAlias;
  }

  /**
   * Name the call's outputs are addressed by: the explicit alias if
   * given, else the unqualified callee name
   */
  public String getAlias() {
    return explicitAlias != null ? explicitAlias : name;
  }

  public TargetKind getTargetKind() {
    return targetKind;
  }

  public Map<String, Expression> getInputs() {
    return inputs;
  }

  public Span getSpan() {
    return span;
  }

  public Span getTargetSpan() {
    return targetSpan;
  }

  @Override
  public String toString() {
    return "call " + target + (explicitAlias == null ? "" :
                               " as " + explicitAlias);
  }

  /**
   * @return null if the call has no target
   */
  public static CallStatement fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.CALL_STMT));
    SyntaxNode targetTree = tree.firstChild(SyntaxKind.CALL_TARGET);
    if (targetTree == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Call has no target");
      return null;
    }
    List<String> parts = new ArrayList<String>();
    for (Token t: targetTree.significantTokens()) {
      if (t.is(TokenKind.IDENT)) {
        parts.add(t.getText());
      }
    }
    String target = StringUtils.join(parts, '.');

    String alias = null;
    SyntaxNode aliasTree = tree.firstChild(SyntaxKind.CALL_ALIAS);
    if (aliasTree != null) {
      Token a = aliasTree.firstToken(TokenKind.IDENT);
      if (a != null) {
        alias = a.getText();
      }
    }

    Map<String, Expression> inputs = new LinkedHashMap<String, Expression>();
    for (SyntaxNode item: tree.childrenOfKind(SyntaxKind.CALL_INPUT_ITEM)) {
      Token param = item.firstToken(TokenKind.IDENT);
      Expression value;
      if (item.firstToken(TokenKind.ASSIGN) == null) {
        // input: x is short for input: x = x
        value = Expression.createIdentifier(param.getSpan(), param.getText());
      } else {
        value = Expression.fromAST(context, item.firstExpression());
      }
      if (inputs.containsKey(param.getText())) {
        context.getDiagnostics().add(DiagnosticCode.DUPLICATE_DECLARATION,
            param.getSpan(), "Input '" + param.getText() +
            "' is bound more than once in call " + target);
      } else if (value != null) {
        inputs.put(param.getText(), value);
      }
    }

    TargetKind kind = resolveTarget(context, parts);
    LogHelper.trace(context, "call " + target + " (" + kind + ")");
    return new CallStatement(target, alias, kind, inputs,
        tree.getTrimmedSpan(), targetTree.getTrimmedSpan());
  }

  private static TargetKind resolveTarget(Context context,
                                          List<String> parts) {
    if (parts.size() > 1) {
      return TargetKind.IMPORTED;
    }
    DefInfo def = context.getGlobals().lookupDef(parts.get(0));
    if (def != null && def.kind == DefKind.TASK) {
      return TargetKind.TASK;
    } else if (def != null && def.kind == DefKind.WORKFLOW) {
      return TargetKind.WORKFLOW;
    }
    return TargetKind.UNRESOLVED;
  }
}
