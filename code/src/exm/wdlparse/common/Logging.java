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

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.wdlparse.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String WDL_LOGGER_NAME = "exm.wdlparse";
  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  public static Logger getWdlLogger()
  {
    return Logger.getLogger(WDL_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the parser logger.
   * @param logfile log file path, or empty/null to leave appenders alone
   * @param trace true to log everything down to TRACE
   * @return the parser logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                      throws InvalidOptionException
  {
    Logger wdlLogger = getWdlLogger();
    if (StringUtils.isBlank(logfile)) {
      // Even if logging is disabled, this must be valid:
      return wdlLogger;
    }
    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile.trim(), false);
      wdlLogger.addAppender(appender);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file " + logfile +
                                       ": " + e.getMessage());
    }
    wdlLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return wdlLogger;
  }

  public static Logger setupLogging(Settings settings)
                                      throws InvalidOptionException
  {
    return setupLogging(settings.get(Settings.LOG_FILE),
                        settings.getBoolean(Settings.LOG_TRACE));
  }
}
