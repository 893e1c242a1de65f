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
import java.util.List;

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LogHelper;

/**
 * A named, typed value: an input, output, private declaration or
 * struct member.
 */
public class Declaration {
  private final String name;
  /** Null if the source gives no type */
  private final TypeDescriptor type;
  /** Null if there is no initializer */
  private final Expression expression;
  private final Span span;
  private final Span nameSpan;

  public Declaration(String name, TypeDescriptor type, Expression expression,
                     Span span, Span nameSpan) {
    this.name = name;
    this.type = type;
    this.expression = expression;
    this.span = span;
    this.nameSpan = nameSpan;
  }

  public String getName() {
    return name;
  }

  public TypeDescriptor getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public boolean isOptional() {
    return type != null && type.isOptional();
  }

  public Expression getExpression() {
    return expression;
  }

  public boolean hasExpression() {
    return expression != null;
  }

  public Span getSpan() {
    return span;
  }

  public Span getNameSpan() {
    return nameSpan;
  }

  @Override
  public String toString() {
    return (type == null ? "?" : type.getText()) + " " + name +
           (expression == null ? "" : " = " + expression.getText());
  }

  /**
   * @return null if the declaration has no name
   */
  public static Declaration fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.DECLARATION));
    Token name = tree.firstToken(TokenKind.IDENT);
    if (name == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Declaration has no name");
      return null;
    }
    SyntaxNode typeTree = tree.firstChild(SyntaxKind.TYPE_REF);
    TypeDescriptor type = typeTree == null ? null :
                                  TypeDescriptor.fromAST(typeTree);
    Expression expr = Expression.fromAST(context, tree.firstExpression());
    LogHelper.trace(context, "declaration " + name.getText());
    return new Declaration(name.getText(), type, expr, tree.getTrimmedSpan(),
                           name.getSpan());
  }

  /**
   * Declarations directly under a section or block node
   */
  public static List<Declaration> listFromAST(Context context,
                                              SyntaxNode tree) {
    List<Declaration> result = new ArrayList<Declaration>();
    for (SyntaxNode decl: tree.childrenOfKind(SyntaxKind.DECLARATION)) {
      Declaration d = fromAST(context, decl);
      if (d != null) {
        result.add(d);
      }
    }
    return result;
  }

  /**
   * Declarations of every section of the given kind under tree
   */
  public static List<Declaration> sectionsFromAST(Context context,
                                  SyntaxNode tree, SyntaxKind sectionKind) {
    List<Declaration> result = new ArrayList<Declaration>();
    for (SyntaxNode section: tree.childrenOfKind(sectionKind)) {
      result.addAll(listFromAST(context, section));
    }
    return result;
  }
}
