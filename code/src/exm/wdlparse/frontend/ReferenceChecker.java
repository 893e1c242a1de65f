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
package exm.wdlparse.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.Span;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.frontend.Context.DefInfo;
import exm.wdlparse.frontend.Context.DefKind;
import exm.wdlparse.frontend.tree.CallStatement;
import exm.wdlparse.frontend.tree.CallStatement.TargetKind;
import exm.wdlparse.frontend.tree.Declaration;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.Expression;
import exm.wdlparse.frontend.tree.Expression.ExprKind;
import exm.wdlparse.frontend.tree.ImportRef;
import exm.wdlparse.frontend.tree.ScatterBlock;
import exm.wdlparse.frontend.tree.Struct;
import exm.wdlparse.frontend.tree.Task;
import exm.wdlparse.frontend.tree.TypeDescriptor;
import exm.wdlparse.frontend.tree.Workflow;
import exm.wdlparse.frontend.tree.WorkflowElement;

/**
 * Symbol table checks over an extracted Document: duplicate names,
 * unresolved identifiers and call targets, and unknown types.
 *
 * Declarations are registered for a whole task or workflow before any
 * expression is checked, so references may precede the declaration
 * they refer to.  Scatter variables are only visible inside their
 * scatter block.
 */
public class ReferenceChecker {

  private final Logger logger;
  private final Diagnostics diagnostics;

  public ReferenceChecker(Logger logger, Diagnostics diagnostics) {
    this.logger = logger;
    this.diagnostics = diagnostics;
  }

  public static void check(Document doc, Diagnostics diagnostics) {
    new ReferenceChecker(Logging.getWdlLogger(), diagnostics).check(doc);
  }

  public void check(Document doc) {
    int before = diagnostics.size();
    GlobalContext context = new GlobalContext(logger, diagnostics);
    defineGlobals(context, doc);

    for (Struct struct: doc.getStructs()) {
      checkStruct(context, struct);
    }
    for (Task task: doc.getTasks()) {
      checkTask(context, task);
    }
    for (Workflow wf: doc.getWorkflows()) {
      checkWorkflow(context, wf);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Reference check found " + (diagnostics.size() - before) +
                   " problems");
    }
  }

  /**
   * Structs, tasks and workflows share one namespace.  Checked in source
   * order so that the first definition wins.
   */
  private void defineGlobals(GlobalContext context, Document doc) {
    List<TopLevelDef> defs = new ArrayList<TopLevelDef>();
    for (Struct s: doc.getStructs()) {
      defs.add(new TopLevelDef(s.getName(), DefKind.STRUCT, s.getNameSpan()));
    }
    for (Task t: doc.getTasks()) {
      defs.add(new TopLevelDef(t.getName(), DefKind.TASK, t.getNameSpan()));
    }
    for (Workflow w: doc.getWorkflows()) {
      defs.add(new TopLevelDef(w.getName(), DefKind.WORKFLOW,
                               w.getNameSpan()));
    }
    Collections.sort(defs, new Comparator<TopLevelDef>() {
      @Override
      public int compare(TopLevelDef a, TopLevelDef b) {
        return Integer.compare(a.span.start, b.span.start);
      }
    });

    for (TopLevelDef def: defs) {
      DefInfo old = context.addDef(def.name, def.kind, def.span);
      if (old != null) {
        diagnostics.add(DiagnosticCode.DUPLICATE_DEFINITION, def.span,
            "Duplicate definition of " + def.kind.humanReadable() + " " +
            def.name + ": already defined as " + old.kind.humanReadable() +
            " at line " + old.span.startLine);
      }
      if (def.kind == DefKind.STRUCT) {
        context.defineType(def.name, def.span);
      }
    }

    for (ImportRef imp: doc.getImports()) {
      for (String alias: imp.getStructAliases().values()) {
        context.defineType(alias, imp.getSpan());
      }
    }
  }

  private void checkStruct(GlobalContext globals, Struct struct) {
    Context context = LocalContext.definitionContext(globals,
                                          "struct " + struct.getName());
    for (Declaration field: struct.getFields()) {
      declare(context, field);
    }
  }

  private void checkTask(GlobalContext globals, Task task) {
    Context context = LocalContext.definitionContext(globals,
                                          "task " + task.getName());
    LogHelper.trace(context, "checking references");
    List<Declaration> decls = task.getAllDeclarations();
    for (Declaration decl: decls) {
      declare(context, decl);
    }

    for (Declaration decl: decls) {
      checkExpression(context, decl.getExpression());
    }
    if (task.getCommand() != null) {
      for (Expression e: task.getCommand().getPlaceholders()) {
        checkExpression(context, e);
      }
    }
    for (Expression e: task.getRuntime().values()) {
      checkExpression(context, e);
    }
  }

  private void checkWorkflow(GlobalContext globals, Workflow wf) {
    Context context = LocalContext.definitionContext(globals,
                                          "workflow " + wf.getName());
    LogHelper.trace(context, "checking references");

    for (Declaration decl: wf.getInputs()) {
      declare(context, decl);
    }
    Map<String, Span> aliases = new HashMap<String, Span>();
    declareBody(context, aliases, wf.getBody());
    for (Declaration decl: wf.getOutputs()) {
      declare(context, decl);
    }

    for (Declaration decl: wf.getInputs()) {
      checkExpression(context, decl.getExpression());
    }
    checkBody(context, wf.getBody());
    for (Declaration decl: wf.getOutputs()) {
      checkExpression(context, decl.getExpression());
    }
  }

  /**
   * Register body declarations and call aliases workflow-wide
   */
  private void declareBody(Context context, Map<String, Span> aliases,
                           List<WorkflowElement> body) {
    for (WorkflowElement elem: body) {
      switch (elem.getKind()) {
        case DECLARATION:
          declare(context, elem.getDeclaration());
          break;
        case CALL:
          declareCall(context, aliases, elem.getCall());
          break;
        case SCATTER:
        case CONDITIONAL:
          declareBody(context, aliases, elem.getBody());
          break;
        default:
          throw new IllegalStateException("Unexpected element " + elem);
      }
    }
  }

  private void declareCall(Context context, Map<String, Span> aliases,
                           CallStatement call) {
    String alias = call.getAlias();
    Span old = aliases.get(alias);
    if (old != null) {
      diagnostics.add(DiagnosticCode.DUPLICATE_CALL_ALIAS, call.getSpan(),
          "Duplicate call alias " + alias + ": already used at line " +
          old.startLine);
    } else {
      aliases.put(alias, call.getSpan());
    }
    // Declarations and aliases are separate namespaces
    if (context.lookupLocalDef(alias) == null) {
      context.addDef(alias, DefKind.CALL, call.getSpan());
    }

    if (call.getTargetKind() == TargetKind.UNRESOLVED) {
      diagnostics.add(DiagnosticCode.UNRESOLVED_CALL_TARGET,
          call.getTargetSpan(), "Call target " + call.getTarget() +
          " is not a task or workflow of this document");
    }
  }

  private void checkBody(Context context, List<WorkflowElement> body) {
    for (WorkflowElement elem: body) {
      switch (elem.getKind()) {
        case DECLARATION:
          checkExpression(context, elem.getDeclaration().getExpression());
          break;
        case CALL:
          for (Expression e: elem.getCall().getInputs().values()) {
            checkExpression(context, e);
          }
          break;
        case SCATTER: {
          ScatterBlock scatter = elem.getScatter();
          checkExpression(context, scatter.getCollection());
          Context inner = LocalContext.subcontext(context);
          if (scatter.getVariable() != null) {
            inner.addDef(scatter.getVariable(), DefKind.SCATTER_VARIABLE,
                         scatter.getSpan());
          }
          checkBody(inner, scatter.getBody());
          break;
        }
        case CONDITIONAL:
          checkExpression(context, elem.getConditional().getCondition());
          checkBody(context, elem.getBody());
          break;
        default:
          throw new IllegalStateException("Unexpected element " + elem);
      }
    }
  }

  private void declare(Context context, Declaration decl) {
    DefInfo old = context.addDef(decl.getName(), DefKind.DECLARATION,
                                 decl.getNameSpan());
    if (old != null) {
      diagnostics.add(DiagnosticCode.DUPLICATE_DECLARATION,
          decl.getNameSpan(), context.getLocation() + "duplicate declaration" +
          " of " + decl.getName() + ": already declared at line " +
          old.span.startLine);
    }
    if (decl.hasType()) {
      checkType(context, decl.getType());
    }
  }

  private void checkType(Context context, TypeDescriptor type) {
    String base = type.getBaseName();
    if (!type.isBuiltin() && !context.getGlobals().isTypeDefined(base) &&
        base.indexOf('.') < 0) {
      diagnostics.add(DiagnosticCode.UNKNOWN_TYPE, type.getSpan(),
                      "Unknown type " + base);
    }
    for (TypeDescriptor param: type.getParameters()) {
      checkType(context, param);
    }
  }

  /**
   * Check all identifiers in expression resolve
   * @param expr may be null
   */
  private void checkExpression(Context context, Expression expr) {
    if (expr == null) {
      return;
    }
    if (expr.getKind() == ExprKind.IDENTIFIER) {
      if (!isVisible(context, expr.getName())) {
        diagnostics.add(DiagnosticCode.UNRESOLVED_REFERENCE, expr.getSpan(),
            "Unresolved reference to " + expr.getName());
      }
      return;
    }
    for (Expression operand: expr.getOperands()) {
      checkExpression(context, operand);
    }
  }

  /**
   * Task and workflow names are not values, so only local definitions
   * count
   */
  private static boolean isVisible(Context context, String name) {
    DefInfo def = context.lookupDef(name);
    if (def == null) {
      return false;
    }
    return def.kind == DefKind.DECLARATION || def.kind == DefKind.CALL ||
           def.kind == DefKind.SCATTER_VARIABLE;
  }

  private static class TopLevelDef {
    final String name;
    final DefKind kind;
    final Span span;

    TopLevelDef(String name, DefKind kind, Span span) {
      this.name = name;
      this.kind = kind;
      this.span = span;
    }
  }
}
