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

import exm.wdlparse.frontend.tree.Expression;

/**
 * The inputs of one call (or the governing expression of a scatter or
 * conditional block) reference an output of another call.
 */
public class DependencyEdge {
  private final String workflow;
  /** Referencing call alias, or block id such as scatter_1 */
  private final String source;
  /** Referenced call alias */
  private final String target;
  private final String field;
  private final Expression reference;

  public DependencyEdge(String workflow, String source, String target,
                        String field, Expression reference) {
    this.workflow = workflow;
    this.source = source;
    this.target = target;
    this.field = field;
    this.reference = reference;
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  public String getField() {
    return field;
  }

  /**
   * @return the member access expression that induced this edge
   */
  public Expression getReference() {
    return reference;
  }

  /**
   * Edges with the same workflow, source, target and field are the same
   * dependency even if induced by different expressions
   */
  public boolean sameDependency(DependencyEdge other) {
    return workflow.equals(other.workflow) && source.equals(other.source) &&
           target.equals(other.target) && field.equals(other.field);
  }

  @Override
  public String toString() {
    return workflow + ": " + source + " -> " + target + "." + field;
  }
}
