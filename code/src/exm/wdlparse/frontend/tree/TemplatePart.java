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

import exm.wdlparse.ast.Span;
import exm.wdlparse.ast.SyntaxElement;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.exceptions.WdlRuntimeError;
import exm.wdlparse.frontend.Context;

/**
 * A fragment of a command or interpolated string: either literal text
 * or a placeholder expression, with any placeholder options such as
 * sep=", ".
 */
public class TemplatePart {
  public static enum PartKind {
    TEXT,
    PLACEHOLDER,
  }

  private final PartKind kind;
  private final Span span;
  private final String text;
  private final Expression expression;
  private final Map<String, Expression> options;

  private TemplatePart(PartKind kind, Span span, String text,
        Expression expression, Map<String, Expression> options) {
    this.kind = kind;
    this.span = span;
    this.text = text;
    this.expression = expression;
    this.options = Collections.unmodifiableMap(options);
  }

  public static TemplatePart createText(Span span, String text) {
    return new TemplatePart(PartKind.TEXT, span, text, null,
                            new LinkedHashMap<String, Expression>());
  }

  public static TemplatePart createPlaceholder(Span span, String text,
          Expression expression, Map<String, Expression> options) {
    assert(expression != null);
    return new TemplatePart(PartKind.PLACEHOLDER, span, text, expression,
                    new LinkedHashMap<String, Expression>(options));
  }

  public PartKind getKind() {
    return kind;
  }

  public boolean isPlaceholder() {
    return kind == PartKind.PLACEHOLDER;
  }

  public Span getSpan() {
    return span;
  }

  /**
   * @return literal text, or for a placeholder its source text
   */
  public String getText() {
    return text;
  }

  public Expression getExpression() {
    if (kind != PartKind.PLACEHOLDER) {
      throw new WdlRuntimeError("getExpression for text fragment");
    }
    return expression;
  }

  public Map<String, Expression> getOptions() {
    return options;
  }

  /**
   * Render in ~{} form, whatever delimiter the source used
   */
  public String render() {
    if (kind == PartKind.TEXT) {
      return text;
    }
    StringBuilder sb = new StringBuilder("~{");
    for (Map.Entry<String, Expression> opt: options.entrySet()) {
      sb.append(opt.getKey()).append('=').append(opt.getValue().getText());
      sb.append(' ');
    }
    sb.append(expression.getText()).append('}');
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }

  /**
   * Collect the fragments of a string literal or command section.
   * Adjacent text is merged; a placeholder whose expression cannot be
   * used is kept as text.
   */
  static List<TemplatePart> partsFromAST(Context context, SyntaxNode tree) {
    List<TemplatePart> parts = new ArrayList<TemplatePart>();
    StringBuilder pending = new StringBuilder();
    Span pendingSpan = null;
    for (SyntaxElement child: tree.children()) {
      TemplatePart placeholder = null;
      Span span;
      String text;
      if (child.isToken()) {
        Token t = child.asToken();
        if (!t.is(TokenKind.STRING_TEXT) && !t.is(TokenKind.COMMAND_TEXT)) {
          continue;
        }
        span = t.getSpan();
        text = t.getText();
      } else {
        SyntaxNode n = child.asNode();
        if (!n.is(SyntaxKind.PLACEHOLDER)) {
          continue;
        }
        span = n.getSpan();
        text = n.getText();
        placeholder = placeholderFromAST(context, n);
      }

      if (placeholder == null) {
        pending.append(text);
        pendingSpan = pendingSpan == null ? span : Span.cover(pendingSpan, span);
      } else {
        if (pendingSpan != null) {
          parts.add(createText(pendingSpan, pending.toString()));
          pending.setLength(0);
          pendingSpan = null;
        }
        parts.add(placeholder);
      }
    }
    if (pendingSpan != null) {
      parts.add(createText(pendingSpan, pending.toString()));
    }
    return parts;
  }

  private static TemplatePart placeholderFromAST(Context context,
                                                 SyntaxNode tree) {
    Expression expr = Expression.fromAST(context, tree.firstExpression());
    if (expr == null) {
      return null;
    }
    Map<String, Expression> options = new LinkedHashMap<String, Expression>();
    for (SyntaxNode opt: tree.childrenOfKind(SyntaxKind.PLACEHOLDER_OPTION)) {
      String name = opt.significantTokens().get(0).getText();
      Expression value = Expression.fromAST(context, opt.firstExpression());
      if (value != null) {
        options.put(name, value);
      }
    }
    return createPlaceholder(tree.getSpan(), tree.getText(), expr, options);
  }
}
