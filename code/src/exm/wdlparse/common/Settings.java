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

package exm.wdlparse.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import exm.wdlparse.common.diagnostics.DiagnosticCode;
import exm.wdlparse.common.diagnostics.Severity;
import exm.wdlparse.common.exceptions.InvalidOptionException;

/**
 * Parser settings, layered as built-in defaults, then Java system
 * properties, then explicit overrides.  Instances are immutable once
 * built, so one can be shared between threads.
 *
 * Keys:
 *  wdlparse.severity.&lt;code&gt;: error or warning, for configurable codes
 *  wdlparse.log.file: log file for Logging.setupLogging, empty for none
 *  wdlparse.log.trace: true to log at TRACE level
 */
public class Settings
{
  public static final String SEVERITY_PREFIX = "wdlparse.severity.";
  public static final String LOG_FILE = "wdlparse.log.file";
  public static final String LOG_TRACE = "wdlparse.log.trace";

  private static final Properties defaults;

  static {
    defaults = new Properties();
    for (DiagnosticCode code: DiagnosticCode.values()) {
      if (code.configurable) {
        defaults.setProperty(severityKey(code),
                             code.defaultSeverity.lowerName());
      }
    }
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
  }

  private final Properties properties;
  private final Map<DiagnosticCode, Severity> severities;

  private Settings(Properties properties) throws InvalidOptionException {
    this.properties = properties;
    this.severities = new EnumMap<DiagnosticCode, Severity>(DiagnosticCode.class);
    validateProperties();
  }

  /**
   * Built-in defaults only
   */
  public static Settings defaults() {
    try {
      return new Settings(new Properties(defaults));
    } catch (InvalidOptionException e) {
      throw new IllegalStateException("Built-in defaults are invalid", e);
    }
  }

  /**
   * Defaults overridden by any matching Java system properties
   */
  public static Settings fromSystemProperties() throws InvalidOptionException {
    return create(new Properties());
  }

  /**
   * Defaults, then system properties, then the given overrides
   * @param overrides
   */
  public static Settings create(Properties overrides)
                                      throws InvalidOptionException {
    Properties props = new Properties(defaults);
    // Pull in properties set on the command line
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        props.setProperty(key, sysVal);
      }
    }
    for (String key: overrides.stringPropertyNames()) {
      if (!defaults.containsKey(key)) {
        throw new InvalidOptionException("Unknown option " + key);
      }
      props.setProperty(key, overrides.getProperty(key));
    }
    return new Settings(props);
  }

  /**
   * Copy of these settings with the severity of one code replaced
   */
  public Settings withSeverity(DiagnosticCode code, Severity severity)
                                            throws InvalidOptionException {
    Properties props = new Properties(defaults);
    for (String key: properties.stringPropertyNames()) {
      props.setProperty(key, properties.getProperty(key));
    }
    props.setProperty(severityKey(code), severity.lowerName());
    return new Settings(props);
  }

  public static String severityKey(DiagnosticCode code) {
    return SEVERITY_PREFIX + code.code();
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private void validateProperties() throws InvalidOptionException {
    for (DiagnosticCode code: DiagnosticCode.values()) {
      if (!code.configurable) {
        severities.put(code, code.defaultSeverity);
        continue;
      }
      String key = severityKey(code);
      String val = get(key);
      Severity sev = Severity.fromString(val);
      if (sev == null) {
        throw new InvalidOptionException("Expected property " + key +
            " to be one of: 'error', 'warning' but was '" + val + "'");
      }
      severities.put(code, sev);
    }
    for (String key: properties.stringPropertyNames()) {
      if (key.startsWith(SEVERITY_PREFIX)) {
        DiagnosticCode code = DiagnosticCode.fromCode(
                          key.substring(SEVERITY_PREFIX.length()));
        if (code == null || !code.configurable) {
          throw new InvalidOptionException("Severity of " + key +
                                           " cannot be configured");
        }
      }
    }
    getBoolean(LOG_TRACE);
  }

  public Severity getSeverity(DiagnosticCode code) {
    return severities.get(code);
  }

  public String get(String key) {
    return properties.getProperty(key);
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
