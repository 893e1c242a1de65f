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

import exm.wdlparse.ast.SyntaxElement;
import exm.wdlparse.ast.SyntaxKind;
import exm.wdlparse.ast.SyntaxNode;
import exm.wdlparse.ast.Token;
import exm.wdlparse.ast.TokenKind;
import exm.wdlparse.frontend.Context;

/**
 * Model of a whole document.  Owns every declaration and expression in
 * it.  Definitions keep source order; lookups by name return the first
 * definition with that name.
 */
public class Document {
  /** Null if the document has no version statement */
  private final String version;
  private final List<ImportRef> imports;
  private final List<Struct> structs;
  private final List<Task> tasks;
  private final List<Workflow> workflows;

  public Document(String version, List<ImportRef> imports,
      List<Struct> structs, List<Task> tasks, List<Workflow> workflows) {
    this.version = version;
    this.imports = Collections.unmodifiableList(imports);
    this.structs = Collections.unmodifiableList(structs);
    this.tasks = Collections.unmodifiableList(tasks);
    this.workflows = Collections.unmodifiableList(workflows);
  }

  public static Document empty() {
    return new Document(null, new ArrayList<ImportRef>(),
        new ArrayList<Struct>(), new ArrayList<Task>(),
        new ArrayList<Workflow>());
  }

  public String getVersion() {
    return version;
  }

  public List<ImportRef> getImports() {
    return imports;
  }

  public List<Struct> getStructs() {
    return structs;
  }

  public List<Task> getTasks() {
    return tasks;
  }

  public List<Workflow> getWorkflows() {
    return workflows;
  }

  public Struct getStruct(String name) {
    for (Struct s: structs) {
      if (s.getName().equals(name)) {
        return s;
      }
    }
    return null;
  }

  public Task getTask(String name) {
    for (Task t: tasks) {
      if (t.getName().equals(name)) {
        return t;
      }
    }
    return null;
  }

  public Workflow getWorkflow(String name) {
    for (Workflow w: workflows) {
      if (w.getName().equals(name)) {
        return w;
      }
    }
    return null;
  }

  public static Document fromAST(Context context, SyntaxNode tree) {
    assert(tree.is(SyntaxKind.DOCUMENT));
    String version = null;
    List<ImportRef> imports = new ArrayList<ImportRef>();
    List<Struct> structs = new ArrayList<Struct>();
    List<Task> tasks = new ArrayList<Task>();
    List<Workflow> workflows = new ArrayList<Workflow>();

    for (SyntaxElement child: tree.children()) {
      if (child.isToken()) {
        continue;
      }
      SyntaxNode node = child.asNode();
      switch (node.getKind()) {
        case VERSION_STMT: {
          Token v = node.firstToken(TokenKind.VERSION_TEXT);
          if (v != null && version == null) {
            version = v.getText();
          }
          break;
        }
        case IMPORT_STMT:
          imports.add(ImportRef.fromAST(context, node));
          break;
        case STRUCT_DECL: {
          Struct s = Struct.fromAST(context, node);
          if (s != null) {
            structs.add(s);
          }
          break;
        }
        case TASK_DECL: {
          Task t = Task.fromAST(context, node);
          if (t != null) {
            tasks.add(t);
          }
          break;
        }
        case WORKFLOW_DECL: {
          Workflow w = Workflow.fromAST(context, node);
          if (w != null) {
            workflows.add(w);
          }
          break;
        }
        default:
          // Error nodes carry nothing for the model
          break;
      }
    }
    return new Document(version, imports, structs, tasks, workflows);
  }
}
