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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Render-agnostic graph of nodes and edges, both in insertion order.
 * A node whose id is already present is dropped.
 */
public class DiagramGraph {
  private final Map<String, DiagramNode> nodes =
                          new LinkedHashMap<String, DiagramNode>();
  private final List<DiagramEdge> edges = new ArrayList<DiagramEdge>();

  /**
   * @return false if a node with this id already exists
   */
  public boolean addNode(String id, String label, NodeKind kind) {
    if (nodes.containsKey(id)) {
      return false;
    }
    nodes.put(id, new DiagramNode(id, label, kind));
    return true;
  }

  public void addEdge(String source, String target, EdgeKind kind,
                      String label) {
    edges.add(new DiagramEdge(source, target, kind, label));
  }

  public List<DiagramNode> getNodes() {
    return Collections.unmodifiableList(
                  new ArrayList<DiagramNode>(nodes.values()));
  }

  public List<DiagramEdge> getEdges() {
    return Collections.unmodifiableList(edges);
  }

  /**
   * @return null if no such node
   */
  public DiagramNode getNode(String id) {
    return nodes.get(id);
  }

  public List<DiagramNode> getNodes(NodeKind kind) {
    List<DiagramNode> result = new ArrayList<DiagramNode>();
    for (DiagramNode n: nodes.values()) {
      if (n.getKind() == kind) {
        result.add(n);
      }
    }
    return result;
  }

  public List<DiagramEdge> getEdges(EdgeKind kind) {
    List<DiagramEdge> result = new ArrayList<DiagramEdge>();
    for (DiagramEdge e: edges) {
      if (e.getKind() == kind) {
        result.add(e);
      }
    }
    return result;
  }

  /**
   * @return edges ending at the node, in insertion order
   */
  public List<DiagramEdge> getEdgesTo(String id) {
    List<DiagramEdge> result = new ArrayList<DiagramEdge>();
    for (DiagramEdge e: edges) {
      if (e.getTarget().equals(id)) {
        result.add(e);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "DiagramGraph(" + nodes.size() + " nodes, " + edges.size() +
           " edges)";
  }
}
