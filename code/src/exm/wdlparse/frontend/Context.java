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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.wdlparse.ast.Span;
import exm.wdlparse.common.diagnostics.Diagnostics;

/**
 * Abstract interface used to track names visible at different points
 * of a document.  Contexts form a chain from nested blocks up to the
 * document-level GlobalContext.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
   * Definitions made in this scope, first definition wins
   */
  protected final Map<String, DefInfo> allDefs =
                                         new HashMap<String, DefInfo>();

  /**
   * Names in definition order, for logging and tests
   */
  protected final List<String> defOrder = new ArrayList<String>();

  public Context(Logger logger, int level) {
    super();
    this.level = level;
    this.logger = logger;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * Lookup definition corresponding to name in this or enclosing scopes
   * @param name
   * @return the definition info, or null if not defined
   */
  public abstract DefInfo lookupDef(String name);

  /**
   * Get next value of a named counter.  Counters are scoped to the
   * enclosing task or workflow.
   */
  public abstract long nextCounterVal(String counterName);

  /**
   * @return prefix for log messages describing where we are
   */
  public abstract String getLocation();

  /**
   * Add definition to this scope.
   * @param name
   * @param kind
   * @param span where the name is defined
   * @return the earlier definition of name in this scope, or null if
   *         the name was not yet defined here
   */
  public DefInfo addDef(String name, DefKind kind, Span span) {
    DefInfo old = allDefs.get(name);
    if (old != null) {
      return old;
    }
    allDefs.put(name, new DefInfo(kind, level, span));
    defOrder.add(name);
    if (logger.isTraceEnabled()) {
      LogHelper.trace(this, "define " + kind.humanReadable() + " " + name);
    }
    return null;
  }

  /**
   * Lookup only in this scope
   */
  public DefInfo lookupLocalDef(String name) {
    return allDefs.get(name);
  }

  /**
   * @return names defined directly in this scope, in definition order
   */
  public List<String> getScopeNames() {
    return Collections.unmodifiableList(defOrder);
  }

  public Diagnostics getDiagnostics() {
    return getGlobals().getDiagnostics();
  }

  public final int getLevel() {
    return level;
  }

  public final Logger getLogger() {
    return logger;
  }

  public static enum DefKind {
    STRUCT, TASK, WORKFLOW, IMPORT, DECLARATION, CALL, SCATTER_VARIABLE;

    public String humanReadable() {
      switch (this) {
        case SCATTER_VARIABLE:
          return "scatter variable";
        case CALL:
          return "call";
        case IMPORT:
          return "import namespace";
        default:
          return this.toString().toLowerCase();
      }
    }
  }

  public static class DefInfo {
    public DefInfo(DefKind kind, int level, Span span) {
      this.kind = kind;
      this.level = level;
      this.span = span;
    }
    public final DefKind kind;
    public final int level; /* Context level */
    public final Span span;
  }
}
