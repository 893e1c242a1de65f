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

import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.Span;
import exm.wdlparse.common.diagnostics.Diagnostics;

/**
 * Document-level context: struct, task and workflow names, import
 * namespaces and struct types.
 */
public class GlobalContext extends Context {

  private final Diagnostics diagnostics;

  /**
   * Struct types by name, including aliases introduced by imports
   */
  private final Map<String, DefInfo> types = new HashMap<String, DefInfo>();

  private final Map<String, Long> counters = new HashMap<String, Long>();

  public GlobalContext(Logger logger, Diagnostics diagnostics) {
    super(logger, ROOT_LEVEL);
    this.diagnostics = diagnostics;
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public DefInfo lookupDef(String name) {
    return allDefs.get(name);
  }

  @Override
  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  @Override
  public long nextCounterVal(String counterName) {
    return nextCounterVal(counters, counterName);
  }

  static long nextCounterVal(Map<String, Long> counters, String counterName) {
    Long val = counters.get(counterName);
    long next = (val == null) ? 1 : val + 1;
    counters.put(counterName, next);
    return next;
  }

  @Override
  public String getLocation() {
    return "";
  }

  /**
   * @return earlier definition of the type, or null if newly defined
   */
  public DefInfo defineType(String typeName, Span span) {
    DefInfo old = types.get(typeName);
    if (old != null) {
      return old;
    }
    types.put(typeName, new DefInfo(DefKind.STRUCT, level, span));
    return null;
  }

  public boolean isTypeDefined(String typeName) {
    return types.containsKey(typeName);
  }
}
