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
package exm.wdlparse.ui;

import java.util.List;

import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.common.diagnostics.Diagnostic;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.common.diagnostics.Severity;
import exm.wdlparse.frontend.tree.Document;

/**
 * Everything produced by one parse.  A result without ERROR diagnostics
 * is usable downstream; it is not necessarily valid.
 */
public class ParseResult {
  private final SyntaxNode tree;
  private final Document document;
  private final List<Diagnostic> diagnostics;

  public ParseResult(SyntaxNode tree, Document document,
                     Diagnostics diagnostics) {
    this.tree = tree;
    this.document = document;
    this.diagnostics = diagnostics.list();
  }

  public SyntaxNode getTree() {
    return tree;
  }

  public Document getDocument() {
    return document;
  }

  /**
   * @return diagnostics of all stages, in the order they were found
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    return Diagnostics.hasErrors(diagnostics);
  }

  public int countErrors() {
    return Diagnostics.countErrors(diagnostics);
  }

  public int countWarnings() {
    int count = 0;
    for (Diagnostic d: diagnostics) {
      if (d.getSeverity() == Severity.WARNING) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "ParseResult(" + countErrors() + " errors, " + countWarnings() +
           " warnings)";
  }
}
