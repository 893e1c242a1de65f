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

public enum SyntaxKind {
  DOCUMENT,
  VERSION_STMT,
  IMPORT_STMT,
  IMPORT_ALIAS,
  STRUCT_DECL,
  TASK_DECL,
  WORKFLOW_DECL,

  /* Sections */
  INPUT_SECTION,
  OUTPUT_SECTION,
  COMMAND_SECTION,
  RUNTIME_SECTION,
  META_SECTION,
  PARAMETER_META_SECTION,

  /* Section contents */
  DECLARATION,
  TYPE_REF,
  RUNTIME_ITEM,
  META_ITEM,
  PLACEHOLDER,
  /** sep=, true=, false= or default= inside a placeholder */
  PLACEHOLDER_OPTION,

  /* Workflow body */
  CALL_STMT,
  CALL_TARGET,
  CALL_ALIAS,
  CALL_INPUT_ITEM,
  SCATTER_BLOCK,
  CONDITIONAL_BLOCK,

  /* Expressions */
  LITERAL_EXPR,
  STRING_EXPR,
  NAME_REF_EXPR,
  MEMBER_ACCESS_EXPR,
  INDEX_EXPR,
  CALL_EXPR,
  ARG_LIST,
  UNARY_EXPR,
  BINARY_EXPR,
  TERNARY_EXPR,
  PAREN_EXPR,
  PAIR_EXPR,
  ARRAY_LITERAL,
  MAP_LITERAL,
  MAP_ENTRY,
  OBJECT_LITERAL,
  OBJECT_FIELD,

  /** Tokens skipped during error recovery */
  ERROR,
  ;

  public boolean isExpression() {
    switch (this) {
      case LITERAL_EXPR:
      case STRING_EXPR:
      case NAME_REF_EXPR:
      case MEMBER_ACCESS_EXPR:
      case INDEX_EXPR:
      case CALL_EXPR:
      case UNARY_EXPR:
      case BINARY_EXPR:
      case TERNARY_EXPR:
      case PAREN_EXPR:
      case PAIR_EXPR:
      case ARRAY_LITERAL:
      case MAP_LITERAL:
      case OBJECT_LITERAL:
        return true;
      default:
        return false;
    }
  }
}
