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
package exm.wdlparse.mermaid;

import exm.wdlparse.diagram.DiagramEdge;
import exm.wdlparse.diagram.DiagramGraph;
import exm.wdlparse.diagram.DiagramNode;
import exm.wdlparse.diagram.EdgeKind;
import exm.wdlparse.diagram.NodeKind;

/**
 * Renders a diagram graph as a Mermaid flowchart.  Each node kind has
 * its own shape and style class; dependency edges are drawn as
 * labelled open links.
 */
public class MermaidRenderer {

  public static final String HEADER = "flowchart TD";

  private static final String INDENT = "    ";

  private static final String[] CLASS_DEFS = {
    "classDef taskStyle fill:#e1f5fe,stroke:#01579b,stroke-width:2px",
    "classDef callStyle fill:#f3e5f5,stroke:#4a148c,stroke-width:2px",
    "classDef inputStyle fill:#e8f5e8,stroke:#2e7d32,stroke-width:2px",
    "classDef outputStyle fill:#fff3e0,stroke:#ef6c00,stroke-width:2px",
    "classDef conditionalStyle fill:#fff8e1,stroke:#f57f17,stroke-width:2px",
    "classDef scatterStyle fill:#fce4ec,stroke:#c2185b,stroke-width:2px",
    "classDef workflowStyle fill:#f1f8e9,stroke:#33691e,stroke-width:3px",
  };

  public static String render(DiagramGraph graph) {
    StringBuilder sb = new StringBuilder();
    sb.append(HEADER).append('\n');
    for (DiagramNode node: graph.getNodes()) {
      sb.append(INDENT);
      renderNode(sb, node);
      sb.append('\n');
    }
    for (DiagramEdge edge: graph.getEdges()) {
      sb.append(INDENT);
      renderEdge(sb, edge);
      sb.append('\n');
    }
    sb.append('\n');
    for (String classDef: CLASS_DEFS) {
      sb.append(INDENT).append(classDef).append('\n');
    }
    return sb.toString();
  }

  static void renderNode(StringBuilder sb, DiagramNode node) {
    String label = quote(node.getLabel());
    sb.append(node.getId());
    switch (node.getKind()) {
      case TASK:
      case CALL:
        sb.append('[').append(label).append(']');
        break;
      case INPUT:
      case OUTPUT:
        sb.append("((").append(label).append("))");
        break;
      case CONDITIONAL:
        sb.append("{/").append(label).append("/}");
        break;
      case SCATTER:
        sb.append("[/").append(label).append("\\]");
        break;
      case WORKFLOW:
        sb.append("([").append(label).append("])");
        break;
      default:
        throw new IllegalStateException("Unknown node kind " +
                                        node.getKind());
    }
    sb.append(":::").append(styleClass(node.getKind()));
  }

  static void renderEdge(StringBuilder sb, DiagramEdge edge) {
    sb.append(edge.getSource());
    if (edge.getKind() == EdgeKind.DEPENDENCY || edge.hasLabel()) {
      sb.append(" ---|");
      sb.append(edge.hasLabel() ? quote(edge.getLabel()) : "depends on");
      sb.append("| ");
    } else {
      sb.append(" --> ");
    }
    sb.append(edge.getTarget());
  }

  static String styleClass(NodeKind kind) {
    return kind.name().toLowerCase() + "Style";
  }

  /**
   * Quote label text so that brackets and operators in it do not end
   * the node shape
   */
  static String quote(String label) {
    return "\"" + label.replace("\"", "#quot;") + "\"";
  }
}
