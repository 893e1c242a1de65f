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
import exm.wdlparse.frontend.Context;

/**
 * An import statement.  The imported document is never read: the
 * import only makes its namespace and struct aliases known.
 */
public class ImportRef {
  private final String uri;
  private final String alias;
  /** Imported struct name -> local name */
  private final Map<String, String> structAliases;
  private final Span span;

  public ImportRef(String uri, String alias, Map<String, String> structAliases,
                   Span span) {
    this.uri = uri;
    this.alias = alias;
    this.structAliases = Collections.unmodifiableMap(
                  new LinkedHashMap<String, String>(structAliases));
    this.span = span;
  }

  public String getUri() {
    return uri;
  }

  /**
   * @return explicit "as" name, or null
   */
  public String getAlias() {
    return alias;
  }

  /**
   * Name that qualifies calls into the imported document: the alias if
   * given, else the file name of the URI without its .wdl extension
   */
  public String getNamespace() {
    if (alias != null) {
      return alias;
    }
    String name = uri;
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    if (name.endsWith(".wdl")) {
      name = name.substring(0, name.length() - ".wdl".length());
    }
    return name;
  }

  public Map<String, String> getStructAliases() {
    return structAliases;
  }

  public Span getSpan() {
    return span;
  }

  @Override
  public String toString() {
    return "import \"" + uri + "\"" + (alias == null ? "" : " as " + alias);
  }

  public static ImportRef fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.IMPORT_STMT));
    StringBuilder uri = new StringBuilder();
    SyntaxNode str = tree.firstChild(SyntaxKind.STRING_EXPR);
    if (str != null) {
      for (SyntaxElement e: str.children()) {
        if (e.isToken() && e.asToken().is(TokenKind.STRING_TEXT)) {
          uri.append(e.getText());
        }
      }
    }

    String alias = null;
    boolean afterAs = false;
    for (Token t: tree.significantTokens()) {
      if (t.is(TokenKind.AS)) {
        afterAs = true;
      } else if (afterAs && t.is(TokenKind.IDENT)) {
        alias = t.getText();
        break;
      }
    }

    Map<String, String> structAliases = new LinkedHashMap<String, String>();
    for (SyntaxNode a: tree.childrenOfKind(SyntaxKind.IMPORT_ALIAS)) {
      List<Token> toks = a.significantTokens();
      String from = null;
      String to = null;
      for (Token t: toks) {
        if (t.is(TokenKind.IDENT)) {
          if (from == null) {
            from = t.getText();
          } else if (to == null) {
            to = t.getText();
          }
        }
      }
      if (from != null && to != null) {
        structAliases.put(from, to);
      }
    }
    return new ImportRef(uri.toString(), alias, structAliases,
                         tree.getTrimmedSpan());
  }
}
