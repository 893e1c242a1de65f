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
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version, first workflow name and task names found in raw source text
 * by pattern matching.  Works on text that is too malformed to parse.
 */
public class BasicMetadata {

  private static final Pattern VERSION =
          Pattern.compile("^\\s*version\\s+(\\S+)", Pattern.MULTILINE);
  private static final Pattern WORKFLOW = Pattern.compile(
          "^\\s*workflow\\s+([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\{",
          Pattern.MULTILINE);
  private static final Pattern TASK = Pattern.compile(
          "^\\s*task\\s+([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\{", Pattern.MULTILINE);

  /** Null if not found */
  private final String version;
  /** Null if not found */
  private final String workflowName;
  /** Sorted, no duplicates */
  private final List<String> taskNames;

  public BasicMetadata(String version, String workflowName,
                       List<String> taskNames) {
    this.version = version;
    this.workflowName = workflowName;
    this.taskNames = Collections.unmodifiableList(taskNames);
  }

  public static BasicMetadata fromText(String text) {
    String version = firstGroup(VERSION, text);
    String workflow = firstGroup(WORKFLOW, text);
    TreeSet<String> tasks = new TreeSet<String>();
    Matcher m = TASK.matcher(text);
    while (m.find()) {
      tasks.add(m.group(1));
    }
    return new BasicMetadata(version, workflow,
                             new ArrayList<String>(tasks));
  }

  private static String firstGroup(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    if (m.find()) {
      return m.group(1);
    }
    return null;
  }

  public String getVersion() {
    return version;
  }

  public String getWorkflowName() {
    return workflowName;
  }

  public List<String> getTaskNames() {
    return taskNames;
  }

  @Override
  public String toString() {
    return "version: " + version + ", workflow: " + workflowName +
           ", tasks: " + taskNames;
  }
}
