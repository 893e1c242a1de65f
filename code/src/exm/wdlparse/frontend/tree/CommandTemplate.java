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
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.frontend.Context;

/**
 * Body of a task's command section, as literal shell text interleaved
 * with placeholders.
 */
public class CommandTemplate {
  public static enum Style {
    /** command { ... } */
    BRACE,
    /** command <<< ... >>> */
    HEREDOC,
  }

  private final Style style;
  private final List<TemplatePart> parts;
  private final Span span;

  public CommandTemplate(Style style, List<TemplatePart> parts, Span span) {
    this.style = style;
    this.parts = Collections.unmodifiableList(
                        new ArrayList<TemplatePart>(parts));
    this.span = span;
  }

  public Style getStyle() {
    return style;
  }

  public List<TemplatePart> getParts() {
    return parts;
  }

  public List<Expression> getPlaceholders() {
    List<Expression> result = new ArrayList<Expression>();
    for (TemplatePart part: parts) {
      if (part.isPlaceholder()) {
        result.addAll(part.getOptions().values());
        result.add(part.getExpression());
      }
    }
    return result;
  }

  public Span getSpan() {
    return span;
  }

  /**
   * Command text with every placeholder written as ~{expr}
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    for (TemplatePart part: parts) {
      sb.append(part.render());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }

  public static CommandTemplate fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.COMMAND_SECTION));
    Style style = tree.firstToken(TokenKind.HEREDOC_OPEN) != null ?
                            Style.HEREDOC : Style.BRACE;
    return new CommandTemplate(style,
        TemplatePart.partsFromAST(context, tree), tree.getTrimmedSpan());
  }
}
