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
import java.util.Collections;
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LocalContext;

public class Struct {
  private final String name;
  private final List<Declaration> fields;
  private final Span span;
  private final Span nameSpan;

  public Struct(String name, List<Declaration> fields, Span span,
                Span nameSpan) {
    this.name = name;
    this.fields = Collections.unmodifiableList(
                      new ArrayList<Declaration>(fields));
    this.span = span;
    this.nameSpan = nameSpan;
  }

  public String getName() {
    return name;
  }

  public List<Declaration> getFields() {
    return fields;
  }

  public Declaration getField(String fieldName) {
    for (Declaration f: fields) {
      if (f.getName().equals(fieldName)) {
        return f;
      }
    }
    return null;
  }

  public Span getSpan() {
    return span;
  }

  public Span getNameSpan() {
    return nameSpan;
  }

  /**
   * @return null if the struct has no name
   */
  public static Struct fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.STRUCT_DECL));
    Token name = tree.firstToken(TokenKind.IDENT);
    if (name == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Struct has no name");
      return null;
    }
    Context structContext = LocalContext.definitionContext(
                  context.getGlobals(), "struct " + name.getText());
    List<Declaration> fields = Declaration.listFromAST(structContext, tree);
    return new Struct(name.getText(), fields, tree.getTrimmedSpan(),
                      name.getSpan());
  }
}
