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
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.frontend.Context;
import exm.wdlparse.frontend.LocalContext;
import exm.wdlparse.frontend.LogHelper;

public class Task {
  private final String name;
  private final List<Declaration> inputs;
  private final List<Declaration> privateDecls;
  /** Null if there is no command section */
  private final CommandTemplate command;
  private final List<Declaration> outputs;
  private final Map<String, Expression> runtime;
  private final Map<String, Expression> meta;
  private final Map<String, Expression> parameterMeta;
  private final Span span;
  private final Span nameSpan;

  public Task(String name, List<Declaration> inputs,
      List<Declaration> privateDecls, CommandTemplate command,
      List<Declaration> outputs, Map<String, Expression> runtime,
      Map<String, Expression> meta, Map<String, Expression> parameterMeta,
      Span span, Span nameSpan) {
    this.name = name;
    this.inputs = Collections.unmodifiableList(inputs);
    this.privateDecls = Collections.unmodifiableList(privateDecls);
    this.command = command;
    this.outputs = Collections.unmodifiableList(outputs);
    this.runtime = Collections.unmodifiableMap(runtime);
    this.meta = Collections.unmodifiableMap(meta);
    this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    this.span = span;
    this.nameSpan = nameSpan;
  }

  public String getName() {
    return name;
  }

  public List<Declaration> getInputs() {
    return inputs;
  }

  public List<Declaration> getPrivateDeclarations() {
    return privateDecls;
  }

  public CommandTemplate getCommand() {
    return command;
  }

  public List<Declaration> getOutputs() {
    return outputs;
  }

  /**
   * Runtime attributes, iterating in source order
   */
  public Map<String, Expression> getRuntime() {
    return runtime;
  }

  public Map<String, Expression> getMeta() {
    return meta;
  }

  public Map<String, Expression> getParameterMeta() {
    return parameterMeta;
  }

  public Span getSpan() {
    return span;
  }

  public Span getNameSpan() {
    return nameSpan;
  }

  /**
   * @return null if the task has no name
   */
  public static Task fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.TASK_DECL));
    Token name = tree.firstToken(TokenKind.IDENT);
    if (name == null) {
      context.getDiagnostics().add(DiagnosticCode.INCOMPLETE_NODE,
          tree.getTrimmedSpan(), "Task has no name");
      return null;
    }
    Context taskContext = LocalContext.definitionContext(
                    context.getGlobals(), "task " + name.getText());
    LogHelper.trace(taskContext, "walking task");

    List<Declaration> inputs = Declaration.sectionsFromAST(taskContext, tree,
                                            SyntaxKind.INPUT_SECTION);
    List<Declaration> privateDecls = Declaration.listFromAST(taskContext,
                                                             tree);
    List<Declaration> outputs = Declaration.sectionsFromAST(taskContext, tree,
                                            SyntaxKind.OUTPUT_SECTION);
    SyntaxNode commandTree = tree.firstChild(SyntaxKind.COMMAND_SECTION);
    CommandTemplate command = commandTree == null ? null :
                      CommandTemplate.fromAST(taskContext, commandTree);

    return new Task(name.getText(), inputs, privateDecls, command, outputs,
        itemsFromAST(taskContext, tree, SyntaxKind.RUNTIME_SECTION,
                     SyntaxKind.RUNTIME_ITEM),
        itemsFromAST(taskContext, tree, SyntaxKind.META_SECTION,
                     SyntaxKind.META_ITEM),
        itemsFromAST(taskContext, tree, SyntaxKind.PARAMETER_META_SECTION,
                     SyntaxKind.META_ITEM),
        tree.getTrimmedSpan(), name.getSpan());
  }

  /**
   * Collect key: value items from every section of a kind.  The first
   * value for a key wins.
   */
  static Map<String, Expression> itemsFromAST(Context context,
          SyntaxNode tree, SyntaxKind sectionKind, SyntaxKind itemKind) {
    Map<String, Expression> result = new LinkedHashMap<String, Expression>();
    for (SyntaxNode section: tree.childrenOfKind(sectionKind)) {
      for (SyntaxNode item: section.childrenOfKind(itemKind)) {
        String key = item.significantTokens().get(0).getText();
        Expression value = Expression.fromAST(context,
                                              item.firstExpression());
        if (value != null && !result.containsKey(key)) {
          result.put(key, value);
        }
      }
    }
    return result;
  }

  /**
   * All declarations of the task, in the order inputs, private, outputs
   */
  public List<Declaration> getAllDeclarations() {
    List<Declaration> result = new ArrayList<Declaration>();
    result.addAll(inputs);
    result.addAll(privateDecls);
    result.addAll(outputs);
    return result;
  }
}
