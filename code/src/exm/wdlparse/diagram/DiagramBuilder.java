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
package exm.wdlparse.diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.wdlparse.common.Logging;
import exm.wdlparse.deps.DependencyEdge;
import exm.wdlparse.deps.DependencyGraph;
import exm.wdlparse.frontend.tree.CallStatement;
import exm.wdlparse.frontend.tree.CallStatement.TargetKind;
import exm.wdlparse.frontend.tree.ConditionalBlock;
import exm.wdlparse.frontend.tree.Declaration;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.ScatterBlock;
import exm.wdlparse.frontend.tree.Task;
import exm.wdlparse.frontend.tree.Workflow;
import exm.wdlparse.frontend.tree.WorkflowElement;

/**
 * Builds the diagram graph of a document.  Tasks come first, then each
 * workflow with its inputs, outputs and body in source order, then the
 * dependency edges.
 *
 * Node ids:
 *  workflow_&lt;wf&gt;, task_&lt;t&gt;, workflow_&lt;wf&gt;_call_&lt;alias&gt;,
 *  workflow_&lt;wf&gt;_scatter_&lt;n&gt;, workflow_&lt;wf&gt;_conditional_&lt;n&gt;,
 *  &lt;owner&gt;_input_&lt;name&gt;, &lt;owner&gt;_output_&lt;name&gt;
 */
public class DiagramBuilder {

  private final Logger logger = Logging.getWdlLogger();

  public static String workflowId(String workflow) {
    return "workflow_" + workflow;
  }

  public static String taskId(String task) {
    return "task_" + task;
  }

  public static String callId(String workflow, String alias) {
    return workflowId(workflow) + "_call_" + alias;
  }

  /**
   * @param blockId id of a scatter or conditional, e.g. scatter_1
   */
  public static String blockId(String workflow, String blockId) {
    return workflowId(workflow) + "_" + blockId;
  }

  public static String inputId(String owner, String name) {
    return owner + "_input_" + name;
  }

  public static String outputId(String owner, String name) {
    return owner + "_output_" + name;
  }

  public DiagramGraph build(Document doc, DependencyGraph deps) {
    DiagramGraph graph = new DiagramGraph();
    for (Task task: doc.getTasks()) {
      if (doc.getTask(task.getName()) != task) {
        logger.trace("skipping duplicate task " + task.getName());
        continue;
      }
      String id = taskId(task.getName());
      graph.addNode(id, task.getName(), NodeKind.TASK);
      addInputsOutputs(graph, id, task.getInputs(), task.getOutputs());
    }

    Set<String> blockIds = new HashSet<String>();
    for (Workflow wf: doc.getWorkflows()) {
      if (doc.getWorkflow(wf.getName()) != wf) {
        logger.trace("skipping duplicate workflow " + wf.getName());
        continue;
      }
      String id = workflowId(wf.getName());
      graph.addNode(id, wf.getName(), NodeKind.WORKFLOW);
      addInputsOutputs(graph, id, wf.getInputs(), wf.getOutputs());
      addBody(graph, wf.getName(), id, wf.getBody(), blockIds);
    }

    for (DependencyEdge dep: deps.edges()) {
      String wf = dep.getWorkflow();
      String consumer = blockId(wf, dep.getSource());
      if (!blockIds.contains(consumer)) {
        consumer = callId(wf, dep.getSource());
      }
      graph.addEdge(callId(wf, dep.getTarget()), consumer,
                    EdgeKind.DEPENDENCY, dep.getField());
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Built " + graph);
    }
    return graph;
  }

  private void addInputsOutputs(DiagramGraph graph, String owner,
          List<Declaration> inputs, List<Declaration> outputs) {
    for (Declaration in: inputs) {
      String id = inputId(owner, in.getName());
      graph.addNode(id, "Input: " + in.getName(), NodeKind.INPUT);
      graph.addEdge(id, owner, EdgeKind.STRUCTURAL_FLOW, null);
    }
    for (Declaration out: outputs) {
      String id = outputId(owner, out.getName());
      graph.addNode(id, "Output: " + out.getName(), NodeKind.OUTPUT);
      graph.addEdge(owner, id, EdgeKind.STRUCTURAL_FLOW, null);
    }
  }

  /**
   * @param container id of the workflow or block holding body
   */
  private void addBody(DiagramGraph graph, String workflow, String container,
          List<WorkflowElement> body, Set<String> blockIds) {
    for (WorkflowElement elem: body) {
      switch (elem.getKind()) {
        case CALL:
          addCall(graph, workflow, container, elem.getCall());
          break;
        case SCATTER: {
          ScatterBlock scatter = elem.getScatter();
          String id = blockId(workflow, scatter.getId());
          String var = scatter.getVariable() == null ? "item"
                                                     : scatter.getVariable();
          graph.addNode(id, "scatter " + var, NodeKind.SCATTER);
          graph.addEdge(container, id, EdgeKind.STRUCTURAL_FLOW, null);
          blockIds.add(id);
          addBody(graph, workflow, id, scatter.getBody(), blockIds);
          break;
        }
        case CONDITIONAL: {
          ConditionalBlock cond = elem.getConditional();
          String id = blockId(workflow, cond.getId());
          String label = cond.getCondition() == null ? "if condition"
                              : "if (" + cond.getCondition().getText() + ")";
          graph.addNode(id, label, NodeKind.CONDITIONAL);
          graph.addEdge(container, id, EdgeKind.STRUCTURAL_FLOW, null);
          blockIds.add(id);
          addBody(graph, workflow, id, cond.getBody(), blockIds);
          break;
        }
        case DECLARATION:
          // Body declarations are not drawn
          break;
        default:
          throw new IllegalStateException("Unexpected element " + elem);
      }
    }
  }

  private void addCall(DiagramGraph graph, String workflow, String container,
                       CallStatement call) {
    String id = callId(workflow, call.getAlias());
    String label = "call " + call.getTarget();
    if (call.getExplicitAlias() != null) {
      label += " as " + call.getExplicitAlias();
    }
    graph.addNode(id, label, NodeKind.CALL);
    graph.addEdge(container, id, EdgeKind.STRUCTURAL_FLOW, null);
    if (call.getTargetKind() == TargetKind.TASK) {
      graph.addEdge(id, taskId(call.getName()), EdgeKind.STRUCTURAL_FLOW,
                    null);
    } else if (call.getTargetKind() == TargetKind.WORKFLOW) {
      graph.addEdge(id, workflowId(call.getName()), EdgeKind.STRUCTURAL_FLOW,
                    null);
    }
  }
}
