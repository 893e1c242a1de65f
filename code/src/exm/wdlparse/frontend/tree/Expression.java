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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Maps;

import exm.wdlparse.ast.LiteralKind;
import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.exceptions.WdlRuntimeError;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LogHelper;

/**
 * An expression in the document model.  One class covers every kind of
 * expression: check getKind() before calling the kind-specific
 * accessors, which throw WdlRuntimeError on a mismatch.
 *
 * Every expression keeps its source span and text.
 */
public class Expression {

  public static enum ExprKind {
    LITERAL,
    IDENTIFIER,
    MEMBER_ACCESS,
    INDEX,
    FUNCTION_CALL,
    UNARY_OP,
    BINARY_OP,
    TERNARY_IF,
    ARRAY_LITERAL,
    MAP_LITERAL,
    OBJECT_LITERAL,
    PAIR_LITERAL,
    STRING_INTERPOLATION,
  }

  private final ExprKind kind;
  private final Span span;
  private final String text;

  /** Literal kind, for LITERAL */
  private final LiteralKind literalKind;
  /**
   * Identifier name, function name, member field, operator, or the raw
   * literal value (strings without their quotes)
   */
  private final String name;
  /** Sub-expressions in source order */
  private final List<Expression> operands;
  /** Fields of OBJECT_LITERAL */
  private final Map<String, Expression> fields;
  /** Fragments of STRING_INTERPOLATION */
  private final List<TemplatePart> parts;

  private Expression(ExprKind kind, Span span, String text,
      LiteralKind literalKind, String name, List<Expression> operands,
      Map<String, Expression> fields, List<TemplatePart> parts) {
    this.kind = kind;
    this.span = span;
    this.text = text;
    this.literalKind = literalKind;
    this.name = name;
    this.operands = Collections.unmodifiableList(
        operands == null ? new ArrayList<Expression>() : operands);
    this.fields = Collections.unmodifiableMap(fields == null ?
        new LinkedHashMap<String, Expression>() : fields);
    this.parts = Collections.unmodifiableList(
        parts == null ? new ArrayList<TemplatePart>() : parts);
  }

  public static Expression createLiteral(Span span, String text,
                                  LiteralKind literalKind, String value) {
    assert(literalKind != null);
    return new Expression(ExprKind.LITERAL, span, text, literalKind, value,
                          null, null, null);
  }

  public static Expression createIdentifier(Span span, String name) {
    return new Expression(ExprKind.IDENTIFIER, span, name, null, name,
                          null, null, null);
  }

  public static Expression createMemberAccess(Span span, String text,
                                      Expression base, String field) {
    return new Expression(ExprKind.MEMBER_ACCESS, span, text, null, field,
                          list(base), null, null);
  }

  public static Expression createIndex(Span span, String text,
                                       Expression base, Expression index) {
    return new Expression(ExprKind.INDEX, span, text, null, null,
                          list(base, index), null, null);
  }

  public static Expression createFunctionCall(Span span, String text,
                                  String function, List<Expression> args) {
    return new Expression(ExprKind.FUNCTION_CALL, span, text, null, function,
                          new ArrayList<Expression>(args), null, null);
  }

  public static Expression createUnaryOp(Span span, String text, String op,
                                         Expression operand) {
    return new Expression(ExprKind.UNARY_OP, span, text, null, op,
                          list(operand), null, null);
  }

  public static Expression createBinaryOp(Span span, String text, String op,
                                  Expression left, Expression right) {
    return new Expression(ExprKind.BINARY_OP, span, text, null, op,
                          list(left, right), null, null);
  }

  public static Expression createTernary(Span span, String text,
        Expression condition, Expression ifTrue, Expression ifFalse) {
    return new Expression(ExprKind.TERNARY_IF, span, text, null, null,
                          list(condition, ifTrue, ifFalse), null, null);
  }

  public static Expression createArray(Span span, String text,
                                       List<Expression> elems) {
    return new Expression(ExprKind.ARRAY_LITERAL, span, text, null, null,
                          new ArrayList<Expression>(elems), null, null);
  }

  /**
   * @param keysAndValues alternating keys and values
   */
  public static Expression createMap(Span span, String text,
                                     List<Expression> keysAndValues) {
    assert(keysAndValues.size() % 2 == 0);
    return new Expression(ExprKind.MAP_LITERAL, span, text, null, null,
                          new ArrayList<Expression>(keysAndValues), null, null);
  }

  public static Expression createObject(Span span, String text,
                                        Map<String, Expression> fields) {
    List<Expression> values = new ArrayList<Expression>(fields.values());
    return new Expression(ExprKind.OBJECT_LITERAL, span, text, null, null,
        values, new LinkedHashMap<String, Expression>(fields), null);
  }

  public static Expression createPair(Span span, String text,
                                      Expression left, Expression right) {
    return new Expression(ExprKind.PAIR_LITERAL, span, text, null, null,
                          list(left, right), null, null);
  }

  public static Expression createInterpolation(Span span, String text,
                                               List<TemplatePart> parts) {
    List<Expression> placeholders = new ArrayList<Expression>();
    for (TemplatePart part: parts) {
      if (part.isPlaceholder()) {
        placeholders.addAll(part.getOptions().values());
        placeholders.add(part.getExpression());
      }
    }
    return new Expression(ExprKind.STRING_INTERPOLATION, span, text, null,
        null, placeholders, null, new ArrayList<TemplatePart>(parts));
  }

  private static List<Expression> list(Expression... exprs) {
    List<Expression> result = new ArrayList<Expression>(exprs.length);
    for (Expression e: exprs) {
      assert(e != null);
      result.add(e);
    }
    return result;
  }

  public ExprKind getKind() {
    return kind;
  }

  public Span getSpan() {
    return span;
  }

  /**
   * @return source text of the expression, without surrounding trivia
   */
  public String getText() {
    return text;
  }

  /**
   * @return all direct sub-expressions in source order
   */
  public List<Expression> getOperands() {
    return operands;
  }

  public LiteralKind getLiteralKind() {
    checkKind(ExprKind.LITERAL, "getLiteralKind");
    return literalKind;
  }

  /**
   * @return raw literal text; string contents exclude the quotes
   */
  public String getLiteralValue() {
    checkKind(ExprKind.LITERAL, "getLiteralValue");
    return name;
  }

  public String getName() {
    checkKind(ExprKind.IDENTIFIER, "getName");
    return name;
  }

  public String getFunctionName() {
    checkKind(ExprKind.FUNCTION_CALL, "getFunctionName");
    return name;
  }

  public List<Expression> getArgs() {
    checkKind(ExprKind.FUNCTION_CALL, "getArgs");
    return operands;
  }

  public Expression getBase() {
    if (kind != ExprKind.MEMBER_ACCESS && kind != ExprKind.INDEX) {
      throw new WdlRuntimeError("getBase for " + kind);
    }
    return operands.get(0);
  }

  public String getField() {
    checkKind(ExprKind.MEMBER_ACCESS, "getField");
    return name;
  }

  public Expression getIndex() {
    checkKind(ExprKind.INDEX, "getIndex");
    return operands.get(1);
  }

  public String getOperator() {
    if (kind != ExprKind.UNARY_OP && kind != ExprKind.BINARY_OP) {
      throw new WdlRuntimeError("getOperator for " + kind);
    }
    return name;
  }

  public Expression getOperand() {
    checkKind(ExprKind.UNARY_OP, "getOperand");
    return operands.get(0);
  }

  public Expression getLeft() {
    if (kind != ExprKind.BINARY_OP && kind != ExprKind.PAIR_LITERAL) {
      throw new WdlRuntimeError("getLeft for " + kind);
    }
    return operands.get(0);
  }

  public Expression getRight() {
    if (kind != ExprKind.BINARY_OP && kind != ExprKind.PAIR_LITERAL) {
      throw new WdlRuntimeError("getRight for " + kind);
    }
    return operands.get(1);
  }

  public Expression getCondition() {
    checkKind(ExprKind.TERNARY_IF, "getCondition");
    return operands.get(0);
  }

  public Expression getThen() {
    checkKind(ExprKind.TERNARY_IF, "getThen");
    return operands.get(1);
  }

  public Expression getElse() {
    checkKind(ExprKind.TERNARY_IF, "getElse");
    return operands.get(2);
  }

  public List<Expression> getElements() {
    checkKind(ExprKind.ARRAY_LITERAL, "getElements");
    return operands;
  }

  public List<Map.Entry<Expression, Expression>> getMapEntries() {
    checkKind(ExprKind.MAP_LITERAL, "getMapEntries");
    List<Map.Entry<Expression, Expression>> entries =
              new ArrayList<Map.Entry<Expression, Expression>>();
    for (int i = 0; i < operands.size(); i += 2) {
      entries.add(Maps.immutableEntry(operands.get(i), operands.get(i + 1)));
    }
    return entries;
  }

  public Map<String, Expression> getFields() {
    checkKind(ExprKind.OBJECT_LITERAL, "getFields");
    return fields;
  }

  public List<TemplatePart> getParts() {
    checkKind(ExprKind.STRING_INTERPOLATION, "getParts");
    return parts;
  }

  public boolean isLiteral() {
    return kind == ExprKind.LITERAL;
  }

  /**
   * @return true for a literal, or an array or object built only from
   *         literals
   */
  public boolean isConstant() {
    switch (kind) {
      case LITERAL:
        return true;
      case UNARY_OP:
        return name.equals("-") && getOperand().isLiteral();
      case ARRAY_LITERAL:
      case OBJECT_LITERAL:
      case MAP_LITERAL:
      case PAIR_LITERAL:
        for (Expression e: operands) {
          if (!e.isConstant()) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  private void checkKind(ExprKind expected, String method) {
    if (kind != expected) {
      throw new WdlRuntimeError(method + " for non-" + expected +
                                " expression " + kind);
    }
  }

  @Override
  public String toString() {
    return text;
  }

  /**
   * Build an expression from an expression node of the syntax tree.
   * @return null if the node is too broken to use; the parser has
   *         already reported the problem
   */
  public static Expression fromAST(Context context, SyntaxNode tree) {
    if (tree == null) {
      return null;
    }
    Span span = tree.getTrimmedSpan();
    String text = tree.getTrimmedText();
    switch (tree.getKind()) {
      case LITERAL_EXPR: {
        Token tok = tree.significantTokens().get(0);
        return createLiteral(span, text, LiteralKind.forToken(tok.getKind()),
                             tok.getText());
      }
      case STRING_EXPR:
        return stringFromAST(context, tree, span, text);
      case NAME_REF_EXPR:
        return createIdentifier(span, text);
      case MEMBER_ACCESS_EXPR: {
        Expression base = fromAST(context, tree.firstExpression());
        Token field = tree.firstToken(TokenKind.IDENT);
        if (base == null || field == null) {
          return null;
        }
        return createMemberAccess(span, text, base, field.getText());
      }
      case INDEX_EXPR: {
        List<Expression> exprs = operandsFromAST(context, tree);
        if (exprs.size() != 2) {
          return null;
        }
        return createIndex(span, text, exprs.get(0), exprs.get(1));
      }
      case CALL_EXPR: {
        Token fn = tree.firstToken(TokenKind.IDENT);
        SyntaxNode args = tree.firstChild(SyntaxKind.ARG_LIST);
        List<Expression> argExprs = (args == null) ?
            new ArrayList<Expression>() : operandsFromAST(context, args);
        return createFunctionCall(span, text, fn.getText(), argExprs);
      }
      case UNARY_EXPR: {
        Expression operand = fromAST(context, tree.firstExpression());
        if (operand == null) {
          return null;
        }
        String op = tree.significantTokens().get(0).getText();
        return createUnaryOp(span, text, op, operand);
      }
      case BINARY_EXPR: {
        List<Expression> exprs = operandsFromAST(context, tree);
        List<Token> ops = tree.significantTokens();
        if (exprs.size() != 2 || ops.isEmpty()) {
          return null;
        }
        return createBinaryOp(span, text, ops.get(0).getText(),
                              exprs.get(0), exprs.get(1));
      }
      case TERNARY_EXPR: {
        List<Expression> exprs = operandsFromAST(context, tree);
        if (exprs.size() != 3) {
          return null;
        }
        return createTernary(span, text, exprs.get(0), exprs.get(1),
                             exprs.get(2));
      }
      case PAREN_EXPR:
        return fromAST(context, tree.firstExpression());
      case PAIR_EXPR: {
        List<Expression> exprs = operandsFromAST(context, tree);
        if (exprs.size() != 2) {
          return null;
        }
        return createPair(span, text, exprs.get(0), exprs.get(1));
      }
      case ARRAY_LITERAL:
        return createArray(span, text, operandsFromAST(context, tree));
      case MAP_LITERAL: {
        List<Expression> keysAndValues = new ArrayList<Expression>();
        for (SyntaxNode entry: tree.childrenOfKind(SyntaxKind.MAP_ENTRY)) {
          List<Expression> kv = operandsFromAST(context, entry);
          if (kv.size() == 2) {
            keysAndValues.addAll(kv);
          }
        }
        return createMap(span, text, keysAndValues);
      }
      case OBJECT_LITERAL: {
        Map<String, Expression> fields =
                            new LinkedHashMap<String, Expression>();
        for (SyntaxNode f: tree.childrenOfKind(SyntaxKind.OBJECT_FIELD)) {
          String key = f.significantTokens().get(0).getText();
          Expression value = fromAST(context, f.firstExpression());
          if (value != null && !fields.containsKey(key)) {
            fields.put(key, value);
          }
        }
        return createObject(span, text, fields);
      }
      default:
        throw new WdlRuntimeError("Not an expression node: " + tree);
    }
  }

  private static List<Expression> operandsFromAST(Context context,
                                                  SyntaxNode tree) {
    List<Expression> result = new ArrayList<Expression>();
    for (SyntaxNode child: tree.expressions()) {
      Expression e = fromAST(context, child);
      if (e != null) {
        result.add(e);
      } else {
        LogHelper.trace(context, "unusable operand " + child);
      }
    }
    return result;
  }

  private static Expression stringFromAST(Context context, SyntaxNode tree,
                                          Span span, String text) {
    List<TemplatePart> parts = TemplatePart.partsFromAST(context, tree);
    boolean interpolated = false;
    StringBuilder value = new StringBuilder();
    for (TemplatePart part: parts) {
      if (part.isPlaceholder()) {
        interpolated = true;
      } else {
        value.append(part.getText());
      }
    }
    if (interpolated) {
      return createInterpolation(span, text, parts);
    }
    return createLiteral(span, text, LiteralKind.STRING, value.toString());
  }
}
