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
 * Kinds of literal values
 */
public enum LiteralKind {
  INT,
  FLOAT,
  BOOLEAN,
  STRING,
  NONE;

  /**
   * @return literal kind of a single-token literal, or null
   */
  public static LiteralKind forToken(TokenKind kind) {
    switch (kind) {
      case INTEGER:
        return INT;
      case FLOAT:
        return FLOAT;
      case TRUE:
      case FALSE:
        return BOOLEAN;
      case NONE:
      case NULL:
        return NONE;
      default:
        return null;
    }
  }

  public String typeName() {
    switch (this) {
      case INT:
        return "Int";
      case FLOAT:
        return "Float";
      case BOOLEAN:
        return "Boolean";
      case STRING:
        return "String";
      default:
        return "None";
    }
  }
}
