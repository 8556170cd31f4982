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
package exm.cst2d.common;

import java.io.IOException;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.cst2d.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String CST2D_LOGGER_NAME = "exm.cst2d";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getLogger()
  {
    return Logger.getLogger(CST2D_LOGGER_NAME);
  }

  /**
   * Attach a file appender if a log file is given and set the level.
   * @param logfile path of log file, or empty for no file output
   * @param trace log everything down to TRACE
   * @return the library logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                    throws InvalidOptionException
  {
    Logger logger = getLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                          new PatternLayout(LOG_PATTERN), logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                         + logfile + ": " + e.getMessage());
      }
    }
    logger.setLevel(trace ? Level.TRACE : Level.INFO);
    return logger;
  }

  public static Logger setupLogging(Settings settings)
                                    throws InvalidOptionException
  {
    return setupLogging(settings.get(Settings.LOG_FILE),
                        settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param emitted messages already emitted by the caller
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Set<Pair<Level, String>> emitted,
                                   Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(Pair.of(level, msg));
    }
  }

  /**
   * Warn unless the same warning is already in emitted
   */
  public static void uniqueWarn(Set<Pair<Level, String>> emitted,
                                String msg)
  {
    if (addEmitted(emitted, Level.WARN, msg))
      getLogger().warn(msg);
    else
      getLogger().debug("Duplicate Warning: " + msg);
  }
}
