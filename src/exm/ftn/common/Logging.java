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

package exm.ftn.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.ftn.common.exceptions.FTNRuntimeError;

public class Logging {
  private static final String FTN_LOGGER_NAME = "exm.ftn";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getFTNLogger() {
    return Logger.getLogger(FTN_LOGGER_NAME);
  }

  /**
   * Configure the front end logger.
   * @param logfile file to log to, or empty/null to only report warnings
   *                on the console
   * @param trace log at TRACE level rather than DEBUG
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger ftnLogger = getFTNLogger();
    ftnLogger.removeAllAppenders();
    ftnLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (logfile != null && logfile.length() > 0) {
      try {
        ftnLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new FTNRuntimeError("Could not open log file " + logfile, e);
      }
      ftnLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ftnLogger.addAppender(new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR));
      ftnLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    return ftnLogger;
  }

  /**
   * Configure logging from the log settings
   */
  public static Logger setupLogging() {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Boolean.parseBoolean(Settings.get(Settings.LOG_TRACE)));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getFTNLogger().warn(msg);
    } else {
      getFTNLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
