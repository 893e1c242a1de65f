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
package exm.wdlparse.ast;

/**
 * Immutable source region.  Offsets index into the source string
 * (end exclusive), lines and columns are 1-based.  The end line/column
 * is the position just after the last character covered.
 */
public class Span {
  public final int start;
  public final int end;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public Span(int start, int end, int startLine, int startColumn,
              int endLine, int endColumn) {
    super();
    assert(start <= end) : start + " > " + end;
    this.start = start;
    this.end = end;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /**
   * Zero-width span at a position
   */
  public static Span point(int offset, int line, int column) {
    return new Span(offset, offset, line, column, line, column);
  }

  /**
   * Smallest span covering both arguments
   */
  public static Span cover(Span a, Span b) {
    Span first = a.start <= b.start ? a : b;
    Span last = a.end >= b.end ? a : b;
    return new Span(first.start, last.end, first.startLine, first.startColumn,
                    last.endLine, last.endColumn);
  }

  public int length() {
    return end - start;
  }

  public boolean contains(Span other) {
    return start <= other.start && other.end <= end;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + start;
    result = prime * result + end;
    result = prime * result + startLine;
    result = prime * result + startColumn;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Span other = (Span) obj;
    return start == other.start && end == other.end &&
           startLine == other.startLine && startColumn == other.startColumn &&
           endLine == other.endLine && endColumn == other.endColumn;
  }

  @Override
  public String toString() {
    return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
  }
}
