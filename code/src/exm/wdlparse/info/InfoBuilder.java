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
package exm.wdlparse.info;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.wdlparse.frontend.tree.CallStatement;
import exm.wdlparse.frontend.tree.Declaration;
import exm.wdlparse.frontend.tree.Document;
import exm.wdlparse.frontend.tree.Expression;
import exm.wdlparse.frontend.tree.ImportRef;
import exm.wdlparse.frontend.tree.Struct;
import exm.wdlparse.frontend.tree.Task;
import exm.wdlparse.frontend.tree.Workflow;
import exm.wdlparse.frontend.tree.WorkflowElement.ElementKind;
import exm.wdlparse.info.DocumentInfo.CallInfo;
import exm.wdlparse.info.DocumentInfo.DeclInfo;
import exm.wdlparse.info.DocumentInfo.ImportInfo;
import exm.wdlparse.info.DocumentInfo.StructInfo;
import exm.wdlparse.info.DocumentInfo.TaskInfo;
import exm.wdlparse.info.DocumentInfo.WorkflowInfo;

public class InfoBuilder {

  public static DocumentInfo build(Document doc) {
    List<ImportInfo> imports = new ArrayList<ImportInfo>();
    for (ImportRef imp: doc.getImports()) {
      imports.add(new ImportInfo(imp.getUri(), imp.getAlias()));
    }
    List<StructInfo> structs = new ArrayList<StructInfo>();
    for (Struct s: doc.getStructs()) {
      structs.add(new StructInfo(s.getName(), declInfos(s.getFields())));
    }
    List<TaskInfo> tasks = new ArrayList<TaskInfo>();
    for (Task t: doc.getTasks()) {
      tasks.add(taskInfo(t));
    }
    List<WorkflowInfo> workflows = new ArrayList<WorkflowInfo>();
    for (Workflow w: doc.getWorkflows()) {
      workflows.add(workflowInfo(w));
    }
    return new DocumentInfo(doc.getVersion(), imports, structs, tasks,
                            workflows);
  }

  private static TaskInfo taskInfo(Task task) {
    String command = null;
    if (task.getCommand() != null) {
      command = task.getCommand().render();
    }
    return new TaskInfo(task.getName(), declInfos(task.getInputs()),
        declInfos(task.getOutputs()), command, texts(task.getRuntime()),
        texts(task.getMeta()), texts(task.getParameterMeta()));
  }

  private static WorkflowInfo workflowInfo(Workflow wf) {
    List<CallInfo> calls = new ArrayList<CallInfo>();
    for (CallStatement call: wf.getAllCalls()) {
      calls.add(new CallInfo(call.getTarget(), call.getAlias(),
                             texts(call.getInputs())));
    }
    return new WorkflowInfo(wf.getName(), declInfos(wf.getInputs()),
        declInfos(wf.getOutputs()), calls,
        wf.countElements(ElementKind.SCATTER),
        wf.countElements(ElementKind.CONDITIONAL),
        texts(wf.getMeta()), texts(wf.getParameterMeta()));
  }

  private static List<DeclInfo> declInfos(List<Declaration> decls) {
    List<DeclInfo> result = new ArrayList<DeclInfo>(decls.size());
    for (Declaration d: decls) {
      String type = d.hasType() ? d.getType().getText() : "";
      String expr = d.hasExpression() ? d.getExpression().getText() : null;
      result.add(new DeclInfo(d.getName(), type, d.isOptional(), expr));
    }
    return result;
  }

  private static Map<String, String> texts(Map<String, Expression> exprs) {
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (Map.Entry<String, Expression> e: exprs.entrySet()) {
      result.put(e.getKey(), e.getValue().getText());
    }
    return result;
  }
}
