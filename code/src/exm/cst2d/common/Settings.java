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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.cst2d.common.exceptions.InvalidOptionException;

/**
 * Builder settings.
 *
 * Each builder holds its own instance, so builders configured
 * differently can run side by side.  Defaults are kept in a separate
 * property table; values can be overridden with {@link #set} or taken
 * from JVM system properties of the same name.
 * */
public class Settings
{
  /** Reject text tokens that embed a line break */
  public static final String REJECT_LINE_BREAKS =
                                  "cst2d.text.reject-line-breaks";
  /** Line terminator written for each newline: lf or crlf */
  public static final String LINE_TERMINATOR = "cst2d.line-terminator";

  public static final String LOG_FILE = "cst2d.log.file";
  public static final String LOG_TRACE = "cst2d.log.trace";

  private static final List<String> LINE_TERMINATORS =
                                        Arrays.asList("lf", "crlf");

  private static final Properties defaults;

  static {
    defaults = new Properties();
    defaults.setProperty(REJECT_LINE_BREAKS, "true");
    defaults.setProperty(LINE_TERMINATOR, "lf");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
  }

  private final Properties properties;

  public Settings() {
    this.properties = new Properties(defaults);
  }

  /**
   * Settings with each known key overridden by the system property
   * of the same name, if set.
   */
  public static Settings fromSystemProperties()
                               throws InvalidOptionException {
    Settings settings = new Settings();
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        settings.properties.setProperty(key, sysVal);
      }
    }
    settings.validate();
    return settings;
  }

  public void set(String key, String value) {
    properties.setProperty(key, value);
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

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public void validate() throws InvalidOptionException {
    getBoolean(REJECT_LINE_BREAKS);
    getBoolean(LOG_TRACE);
    checkOneOf(LINE_TERMINATOR, LINE_TERMINATORS);
  }

  /**
   * @return the characters written for each newline
   * @throws InvalidOptionException
   */
  public String lineTerminator() throws InvalidOptionException {
    checkOneOf(LINE_TERMINATOR, LINE_TERMINATORS);
    if (get(LINE_TERMINATOR).equalsIgnoreCase("crlf")) {
      return "\r\n";
    } else {
      return "\n";
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private void checkOneOf(String key, List<String> validVals)
                                      throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key
        + " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }

  public long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
          key + ": " + strVal);
    }
  }
}
