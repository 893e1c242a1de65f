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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Structural summary of a document, as plain values that a consumer can
 * print or serialize without touching the model classes.
 */
public class DocumentInfo {
  /** Null if no version statement */
  public final String version;
  public final List<ImportInfo> imports;
  public final List<StructInfo> structs;
  public final List<TaskInfo> tasks;
  public final List<WorkflowInfo> workflows;

  public DocumentInfo(String version, List<ImportInfo> imports,
      List<StructInfo> structs, List<TaskInfo> tasks,
      List<WorkflowInfo> workflows) {
    this.version = version;
    this.imports = Collections.unmodifiableList(imports);
    this.structs = Collections.unmodifiableList(structs);
    this.tasks = Collections.unmodifiableList(tasks);
    this.workflows = Collections.unmodifiableList(workflows);
  }

  public static class ImportInfo {
    public final String uri;
    /** Null if no alias */
    public final String alias;

    public ImportInfo(String uri, String alias) {
      this.uri = uri;
      this.alias = alias;
    }
  }

  /**
   * An input, output, private declaration or struct field
   */
  public static class DeclInfo {
    public final String name;
    /** Empty if the type is missing */
    public final String type;
    public final boolean optional;
    /** Default or bound expression text, null if unbound */
    public final String expression;

    public DeclInfo(String name, String type, boolean optional,
                    String expression) {
      this.name = name;
      this.type = type;
      this.optional = optional;
      this.expression = expression;
    }

    @Override
    public String toString() {
      return type + " " + name + (expression == null ? "" :
                                  " = " + expression);
    }
  }

  public static class StructInfo {
    public final String name;
    public final List<DeclInfo> fields;

    public StructInfo(String name, List<DeclInfo> fields) {
      this.name = name;
      this.fields = Collections.unmodifiableList(fields);
    }
  }

  public static class TaskInfo {
    public final String name;
    public final List<DeclInfo> inputs;
    public final List<DeclInfo> outputs;
    /** Command with placeholders rendered as ~{expr}, null if none */
    public final String command;
    public final Map<String, String> runtime;
    public final Map<String, String> meta;
    public final Map<String, String> parameterMeta;

    public TaskInfo(String name, List<DeclInfo> inputs,
        List<DeclInfo> outputs, String command, Map<String, String> runtime,
        Map<String, String> meta, Map<String, String> parameterMeta) {
      this.name = name;
      this.inputs = Collections.unmodifiableList(inputs);
      this.outputs = Collections.unmodifiableList(outputs);
      this.command = command;
      this.runtime = Collections.unmodifiableMap(runtime);
      this.meta = Collections.unmodifiableMap(meta);
      this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    }
  }

  public static class CallInfo {
    public final String target;
    /** Effective alias */
    public final String alias;
    /** Parameter name to bound expression text */
    public final Map<String, String> inputs;

    public CallInfo(String target, String alias, Map<String, String> inputs) {
      this.target = target;
      this.alias = alias;
      this.inputs = Collections.unmodifiableMap(inputs);
    }
  }

  public static class WorkflowInfo {
    public final String name;
    public final List<DeclInfo> inputs;
    public final List<DeclInfo> outputs;
    /** Calls at all nesting levels, in source order */
    public final List<CallInfo> calls;
    public final int callCount;
    public final int scatterCount;
    public final int conditionalCount;
    public final Map<String, String> meta;
    public final Map<String, String> parameterMeta;

    public WorkflowInfo(String name, List<DeclInfo> inputs,
        List<DeclInfo> outputs, List<CallInfo> calls, int scatterCount,
        int conditionalCount, Map<String, String> meta,
        Map<String, String> parameterMeta) {
      this.name = name;
      this.inputs = Collections.unmodifiableList(inputs);
      this.outputs = Collections.unmodifiableList(outputs);
      this.calls = Collections.unmodifiableList(calls);
      this.callCount = calls.size();
      this.scatterCount = scatterCount;
      this.conditionalCount = conditionalCount;
      this.meta = Collections.unmodifiableMap(meta);
      this.parameterMeta = Collections.unmodifiableMap(parameterMeta);
    }
  }
}
