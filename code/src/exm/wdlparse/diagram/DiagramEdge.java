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

public class DiagramEdge {
  private final String source;
  private final String target;
  private final EdgeKind kind;
  /** Null if unlabelled */
  private final String label;

  public DiagramEdge(String source, String target, EdgeKind kind,
                     String label) {
    this.source = source;
    this.target = target;
    this.kind = kind;
    this.label = label;
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  public EdgeKind getKind() {
    return kind;
  }

  public String getLabel() {
    return label;
  }

  public boolean hasLabel() {
    return label != null;
  }

  @Override
  public String toString() {
    return source + " -> " + target + " (" + kind +
           (label == null ? "" : " " + label) + ")";
  }
}
