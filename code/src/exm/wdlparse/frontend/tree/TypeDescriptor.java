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
package exm.wdlparse.frontend.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.TokenKind;

/**
 * A declared type, e.g. Array[File]+ or Map[String, Int]?
 */
public class TypeDescriptor {

  public static final Set<String> PRIMITIVES = Collections.unmodifiableSet(
      new HashSet<String>(Arrays.asList("Int", "Float", "Boolean", "String",
                                        "File", "Directory")));

  public static final Set<String> BUILTINS = Collections.unmodifiableSet(
      new HashSet<String>(Arrays.asList("Int", "Float", "Boolean", "String",
              "File", "Directory", "Array", "Map", "Pair", "Object")));

  private final String baseName;
  private final List<TypeDescriptor> parameters;
  private final boolean optional;
  private final boolean nonEmpty;
  private final String text;
  private final Span span;

  public TypeDescriptor(String baseName, List<TypeDescriptor> parameters,
          boolean optional, boolean nonEmpty, String text, Span span) {
    this.baseName = baseName;
    this.parameters = Collections.unmodifiableList(
                          new ArrayList<TypeDescriptor>(parameters));
    this.optional = optional;
    this.nonEmpty = nonEmpty;
    this.text = text;
    this.span = span;
  }

  public String getBaseName() {
    return baseName;
  }

  public List<TypeDescriptor> getParameters() {
    return parameters;
  }

  public boolean isOptional() {
    return optional;
  }

  /**
   * @return true if marked with +, i.e. an array that must not be empty
   */
  public boolean isNonEmpty() {
    return nonEmpty;
  }

  public boolean isPrimitive() {
    return PRIMITIVES.contains(baseName);
  }

  public boolean isBuiltin() {
    return BUILTINS.contains(baseName);
  }

  public String getText() {
    return text;
  }

  public Span getSpan() {
    return span;
  }

  @Override
  public String toString() {
    return text;
  }

  public static TypeDescriptor fromAST(SyntaxNode tree) {
    assert(tree.is(SyntaxKind.TYPE_REF));
    String base = tree.significantTokens().get(0).getText();
    List<TypeDescriptor> params = new ArrayList<TypeDescriptor>();
    for (SyntaxNode param: tree.childrenOfKind(SyntaxKind.TYPE_REF)) {
      params.add(fromAST(param));
    }
    boolean optional = tree.firstToken(TokenKind.QUESTION) != null;
    boolean nonEmpty = tree.firstToken(TokenKind.PLUS) != null;
    return new TypeDescriptor(base, params, optional, nonEmpty,
                    tree.getTrimmedText(), tree.getTrimmedSpan());
  }
}
