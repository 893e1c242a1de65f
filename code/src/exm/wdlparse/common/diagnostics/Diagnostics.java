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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.common.Settings;

/**
 * Appendable, ordered collection of diagnostics threaded through one
 * pipeline stage.  Severities of configurable codes come from Settings.
 */
public class Diagnostics {
  private final Settings settings;
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public Diagnostics(Settings settings) {
    this.settings = settings;
  }

  public Diagnostic add(DiagnosticCode code, Span span, String message) {
    Diagnostic d = new Diagnostic(settings.getSeverity(code), code, message,
                                  span);
    diagnostics.add(d);
    return d;
  }

  public void addAll(List<Diagnostic> other) {
    diagnostics.addAll(other);
  }

  public int size() {
    return diagnostics.size();
  }

  public boolean hasErrors() {
    return hasErrors(diagnostics);
  }

  public List<Diagnostic> list() {
    return Collections.unmodifiableList(diagnostics);
  }

  public static boolean hasErrors(List<Diagnostic> diagnostics) {
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  public static int countErrors(List<Diagnostic> diagnostics) {
    int count = 0;
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        count++;
      }
    }
    return count;
  }
}
