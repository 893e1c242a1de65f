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
package exm.wdlparse.frontend;

import java.util.Map;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.common.Logging;
import exm.wdlparse.common.diagnostics.Diagnostics;
import exm.wdlparse.frontend.Context.DefKind;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.ImportRef;

/**
 * Turns a syntax tree into a Document.
 *
 * The walk is done in two passes: the first collects the names of all
 * top-level definitions so that calls can be resolved regardless of
 * where the callee is defined, the second builds the model.
 */
public class TreeWalker {

  private final Logger logger;
  private final Diagnostics diagnostics;

  public TreeWalker(Logger logger, Diagnostics diagnostics) {
    this.logger = logger;
    this.diagnostics = diagnostics;
  }

  public static Document walk(SyntaxNode root, Diagnostics diagnostics) {
    return new TreeWalker(Logging.getWdlLogger(), diagnostics).walk(root);
  }

  public Document walk(SyntaxNode root) {
    assert(root.is(SyntaxKind.DOCUMENT));
    GlobalContext context = new GlobalContext(logger, diagnostics);
    collectDefinitions(context, root);
    if (logger.isDebugEnabled()) {
      logger.debug("Document-level names: " + context.getScopeNames());
    }
    Document doc = Document.fromAST(context, root);
    if (logger.isDebugEnabled()) {
      logger.debug("Extracted " + doc.getImports().size() + " imports, " +
                   doc.getStructs().size() + " structs, " +
                   doc.getTasks().size() + " tasks, " +
                   doc.getWorkflows().size() + " workflows");
    }
    return doc;
  }

  /**
   * First pass: record names only.  Duplicates are left for the
   * ReferenceChecker to report.
   */
  private void collectDefinitions(GlobalContext context, SyntaxNode root) {
    LogHelper.logChildren(0, root);
    for (SyntaxNode child: root.childNodes()) {
      switch (child.getKind()) {
        case STRUCT_DECL: {
          Token name = child.firstToken(TokenKind.IDENT);
          if (name != null) {
            context.addDef(name.getText(), DefKind.STRUCT, name.getSpan());
            context.defineType(name.getText(), name.getSpan());
          }
          break;
        }
        case TASK_DECL: {
          Token name = child.firstToken(TokenKind.IDENT);
          if (name != null) {
            context.addDef(name.getText(), DefKind.TASK, name.getSpan());
          }
          break;
        }
        case WORKFLOW_DECL: {
          Token name = child.firstToken(TokenKind.IDENT);
          if (name != null) {
            context.addDef(name.getText(), DefKind.WORKFLOW, name.getSpan());
          }
          break;
        }
        case IMPORT_STMT:
          collectImport(context, ImportRef.fromAST(context, child));
          break;
        default:
          break;
      }
    }
  }

  private void collectImport(GlobalContext context, ImportRef imp) {
    String ns = imp.getNamespace();
    if (ns.length() > 0) {
      context.addDef(ns, DefKind.IMPORT, imp.getSpan());
    }
    for (Map.Entry<String, String> alias: imp.getStructAliases().entrySet()) {
      context.defineType(alias.getValue(), imp.getSpan());
    }
  }
}
