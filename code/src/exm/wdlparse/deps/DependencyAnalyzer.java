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
package exm.wdlparse.deps;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.wdlparse.common.Logging;
import exm.wdlparse.common.Settings;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.frontend.tree.CallStatement;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.Expression;
import exm.wdlparse.frontend.tree.Expression.ExprKind;
import exm.wdlparse.frontend.tree.Workflow;
import exm.wdlparse.frontend.tree.WorkflowElement;

/**
 * Finds references of the form alias.field to the outputs of other
 * calls.  All call aliases of a workflow are visible anywhere in it,
 * regardless of nesting or source order.
 */
public class DependencyAnalyzer {

  private final Logger logger = Logging.getWdlLogger();
  private final Settings settings;

  public DependencyAnalyzer(Settings settings) {
    this.settings = settings;
  }

  public DependencyGraph analyze(Document doc) {
    Diagnostics diagnostics = new Diagnostics(settings);
    List<DependencyEdge> edges = new ArrayList<DependencyEdge>();
    for (Workflow wf: doc.getWorkflows()) {
      // Later definitions of a name are errors; the first one stands
      if (doc.getWorkflow(wf.getName()) == wf) {
        analyzeWorkflow(wf, edges, diagnostics);
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Found " + edges.size() + " dependency edges");
    }
    return new DependencyGraph(edges, diagnostics.list());
  }

  private void analyzeWorkflow(Workflow wf, List<DependencyEdge> edges,
                               Diagnostics diagnostics) {
    Set<String> aliases = new HashSet<String>();
    for (CallStatement call: wf.getAllCalls()) {
      aliases.add(call.getAlias());
    }
    WorkflowScan scan = new WorkflowScan(wf.getName(), aliases, edges,
                                         diagnostics);
    scan.scanBody(wf.getBody());
  }

  private static class WorkflowScan {
    private final String workflow;
    private final Set<String> aliases;
    private final List<DependencyEdge> edges;
    private final Diagnostics diagnostics;

    WorkflowScan(String workflow, Set<String> aliases,
                 List<DependencyEdge> edges, Diagnostics diagnostics) {
      this.workflow = workflow;
      this.aliases = aliases;
      this.edges = edges;
      this.diagnostics = diagnostics;
    }

    void scanBody(List<WorkflowElement> body) {
      for (WorkflowElement elem: body) {
        switch (elem.getKind()) {
          case CALL: {
            CallStatement call = elem.getCall();
            for (Expression e: call.getInputs().values()) {
              scanExpression(call.getAlias(), true, e);
            }
            break;
          }
          case SCATTER:
            scanExpression(elem.getScatter().getId(), false,
                           elem.getScatter().getCollection());
            scanBody(elem.getBody());
            break;
          case CONDITIONAL:
            scanExpression(elem.getConditional().getId(), false,
                           elem.getConditional().getCondition());
            scanBody(elem.getBody());
            break;
          case DECLARATION:
            // Declarations are not nodes of the dependency graph
            break;
          default:
            throw new IllegalStateException("Unexpected element " + elem);
        }
      }
    }

    /**
     * @param source id of referencing call or block
     * @param isCall true if source is a call alias
     * @param expr may be null for incomplete blocks
     */
    private void scanExpression(String source, boolean isCall,
                                Expression expr) {
      if (expr == null) {
        return;
      }
      if (expr.getKind() == ExprKind.MEMBER_ACCESS) {
        Expression base = expr.getBase();
        if (base.getKind() == ExprKind.IDENTIFIER &&
            aliases.contains(base.getName())) {
          addEdge(source, isCall, base.getName(), expr);
          return;
        }
      }
      for (Expression operand: expr.getOperands()) {
        scanExpression(source, isCall, operand);
      }
    }

    private void addEdge(String source, boolean isCall, String target,
                         Expression access) {
      if (isCall && source.equals(target)) {
        diagnostics.add(DiagnosticCode.SELF_REFERENCE, access.getSpan(),
            "Call " + source + " references its own output " +
            access.getField());
        return;
      }
      DependencyEdge edge = new DependencyEdge(workflow, source, target,
                                               access.getField(), access);
      for (DependencyEdge old: edges) {
        if (old.sameDependency(edge)) {
          return;
        }
      }
      edges.add(edge);
    }
  }
}
