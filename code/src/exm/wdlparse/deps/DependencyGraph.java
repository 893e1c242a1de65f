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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.wdlparse.common.diagnostics.Diagnostic;

/**
 * Directed graph of references between calls.  Edges are kept in the
 * order they were found and indexed by both endpoints.  Identities
 * are call aliases or block ids, so the same id may occur in more than
 * one workflow; use getWorkflow() on the edges to tell them apart.
 */
public class DependencyGraph {
  private final List<DependencyEdge> edges;
  private final ListMultimap<String, DependencyEdge> bySource;
  private final ListMultimap<String, DependencyEdge> byTarget;
  private final List<Diagnostic> diagnostics;

  public DependencyGraph(List<DependencyEdge> edges,
                         List<Diagnostic> diagnostics) {
    this.edges = Collections.unmodifiableList(
                        new ArrayList<DependencyEdge>(edges));
    this.bySource = ArrayListMultimap.create();
    this.byTarget = ArrayListMultimap.create();
    for (DependencyEdge e: edges) {
      bySource.put(e.getSource(), e);
      byTarget.put(e.getTarget(), e);
    }
    this.diagnostics = Collections.unmodifiableList(
                        new ArrayList<Diagnostic>(diagnostics));
  }

  public List<DependencyEdge> edges() {
    return edges;
  }

  /**
   * @param id referencing call alias or block id
   */
  public List<DependencyEdge> edgesFrom(String id) {
    return Collections.unmodifiableList(bySource.get(id));
  }

  /**
   * @param id referenced call alias
   */
  public List<DependencyEdge> edgesTo(String id) {
    return Collections.unmodifiableList(byTarget.get(id));
  }

  /**
   * @return distinct aliases of calls that the call or block depends on,
   *         in order of first reference
   */
  public List<String> dependenciesOf(String alias) {
    Set<String> result = new LinkedHashSet<String>();
    for (DependencyEdge e: bySource.get(alias)) {
      result.add(e.getTarget());
    }
    return new ArrayList<String>(result);
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public int size() {
    return edges.size();
  }

  @Override
  public String toString() {
    return edges.toString();
  }
}
