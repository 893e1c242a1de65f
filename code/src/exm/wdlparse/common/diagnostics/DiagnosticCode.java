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

/**
 * Stable identifiers for every problem the pipeline can report.
 * Codes marked configurable are heuristics whose severity can be
 * overridden through Settings.
 */
public enum DiagnosticCode {
  /* Lexical */
  UNEXPECTED_CHARACTER(Category.LEXICAL, Severity.ERROR, false),
  UNTERMINATED_STRING(Category.LEXICAL, Severity.ERROR, false),
  INVALID_ESCAPE(Category.LEXICAL, Severity.ERROR, false),
  UNTERMINATED_COMMAND(Category.LEXICAL, Severity.ERROR, false),
  UNTERMINATED_PLACEHOLDER(Category.LEXICAL, Severity.ERROR, false),
  UNSUPPORTED_ENCODING(Category.LEXICAL, Severity.ERROR, false),

  /* Syntax */
  EMPTY_DOCUMENT(Category.SYNTAX, Severity.ERROR, false),
  MISSING_VERSION(Category.SYNTAX, Severity.ERROR, false),
  UNEXPECTED_TOKEN(Category.SYNTAX, Severity.ERROR, false),
  UNTERMINATED_BLOCK(Category.SYNTAX, Severity.ERROR, false),
  MISSING_SECTION(Category.SYNTAX, Severity.ERROR, false),
  DUPLICATE_SECTION(Category.SYNTAX, Severity.ERROR, false),
  OUT_OF_ORDER_SECTION(Category.SYNTAX, Severity.ERROR, false),

  /* Structural */
  MISSING_TYPE(Category.STRUCTURAL, Severity.ERROR, true),
  UNKNOWN_TYPE(Category.STRUCTURAL, Severity.ERROR, true),
  LITERAL_TYPE_MISMATCH(Category.STRUCTURAL, Severity.ERROR, true),
  MALFORMED_NUMBER(Category.STRUCTURAL, Severity.ERROR, false),
  UNQUOTED_RUNTIME_VALUE(Category.STRUCTURAL, Severity.ERROR, true),
  UNBOUND_DECLARATION(Category.STRUCTURAL, Severity.ERROR, false),
  BOUND_STRUCT_FIELD(Category.STRUCTURAL, Severity.ERROR, false),
  NON_LITERAL_META(Category.STRUCTURAL, Severity.ERROR, true),
  DUPLICATE_DEFINITION(Category.STRUCTURAL, Severity.ERROR, false),
  DUPLICATE_DECLARATION(Category.STRUCTURAL, Severity.ERROR, false),
  DUPLICATE_CALL_ALIAS(Category.STRUCTURAL, Severity.ERROR, false),

  /* Semantic */
  UNRESOLVED_REFERENCE(Category.SEMANTIC, Severity.WARNING, true),
  UNRESOLVED_CALL_TARGET(Category.SEMANTIC, Severity.WARNING, true),
  SELF_REFERENCE(Category.SEMANTIC, Severity.WARNING, false),
  INCOMPLETE_NODE(Category.SEMANTIC, Severity.WARNING, false),
  ;

  public static enum Category {
    LEXICAL,
    SYNTAX,
    STRUCTURAL,
    SEMANTIC,
  }

  public final Category category;
  public final Severity defaultSeverity;
  public final boolean configurable;

  private DiagnosticCode(Category category, Severity defaultSeverity,
                         boolean configurable) {
    this.category = category;
    this.defaultSeverity = defaultSeverity;
    this.configurable = configurable;
  }

  /**
   * @return stable kebab-case name, e.g. "unterminated-string"
   */
  public String code() {
    return name().toLowerCase().replace('_', '-');
  }

  /**
   * @return null if no code has this name
   */
  public static DiagnosticCode fromCode(String code) {
    for (DiagnosticCode c: values()) {
      if (c.code().equals(code)) {
        return c;
      }
    }
    return null;
  }
}
