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
package exm.wdlparse.common.diagnostics;

import exm.wdlparse.ast.Span;

/**
 * One problem found in a document.  Immutable.
 */
public class Diagnostic {
  private final Severity severity;
  private final DiagnosticCode code;
  private final String message;
  private final Span span;

  public Diagnostic(Severity severity, DiagnosticCode code, String message,
                    Span span) {
    assert(severity != null);
    assert(message != null);
    assert(span != null);
    this.severity = severity;
    this.code = code;
    this.message = message;
    this.span = span;
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /**
   * @return the code, or null for diagnostics without a stable code
   */
  public DiagnosticCode getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public Span getSpan() {
    return span;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(severity.lowerName());
    if (code != null) {
      sb.append('[').append(code.code()).append(']');
    }
    sb.append(' ').append(span).append(": ").append(message);
    return sb.toString();
  }
}
