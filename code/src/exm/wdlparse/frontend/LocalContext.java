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

/**
 * Context within a struct, task or workflow.  New child contexts are
 * created for every scatter block, which introduces its own variable.
 */
public class LocalContext extends Context {
  private final Context parent;
  private final GlobalContext globals;
  private final String location;
  /** Non-null only for the outermost context of a definition */
  private final Map<String, Long> counters;

  private LocalContext(Context parent, String location, boolean owner) {
    super(parent.getLogger(), parent.getLevel() + 1);
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.location = location;
    this.counters = owner ? new HashMap<String, Long>() : null;
  }

  /**
   * Context for the top level of a struct, task or workflow
   * @param global
   * @param description e.g. "workflow main"
   */
  public static LocalContext definitionContext(GlobalContext global,
                                               String description) {
    return new LocalContext(global, description, true);
  }

  /**
   * Nested scope, e.g. a scatter body
   */
  public static LocalContext subcontext(Context parent) {
    return new LocalContext(parent, null, false);
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public DefInfo lookupDef(String name) {
    DefInfo result = allDefs.get(name);
    if (result != null) {
      return result;
    } else {
      return parent.lookupDef(name);
    }
  }

  @Override
  public long nextCounterVal(String counterName) {
    if (counters != null) {
      return GlobalContext.nextCounterVal(counters, counterName);
    }
    return parent.nextCounterVal(counterName);
  }

  @Override
  public String getLocation() {
    if (location != null) {
      return location + ": ";
    }
    return parent.getLocation();
  }
}
