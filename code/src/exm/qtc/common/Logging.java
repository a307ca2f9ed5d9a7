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
package exm.qtc.common;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.qtc.common.exceptions.InvalidOptionException;
import exm.qtc.common.util.Pair;

public class Logging {
  private static final String QTC_LOGGER_NAME = "exm.qtc";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.  Definitions may be checked concurrently.
   */
  private static final Set<Pair<Level, String>> emitted =
      Collections.synchronizedSet(new HashSet<Pair<Level, String>>());

  public static Logger getQTCLogger() {
    return Logger.getLogger(QTC_LOGGER_NAME);
  }

  /**
   * Attach a log file to the compiler logger.
   * @param logfile path of log file, or empty/null for no file
   * @param trace if true, log at TRACE level, otherwise DEBUG when a log
   *              file is present
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger qtcLogger = getQTCLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
            new PatternLayout(LOG_PATTERN), logfile, false);
        qtcLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
            + logfile + ": " + e.getMessage());
      }
      qtcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      qtcLogger.setLevel(Level.TRACE);
    }
    return qtcLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getQTCLogger().warn(msg);
    } else {
      getQTCLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
