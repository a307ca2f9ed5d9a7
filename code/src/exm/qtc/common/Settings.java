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

import java.util.Properties;

import exm.qtc.common.exceptions.InvalidOptionException;

/**
 * General QTC settings.  Defaults are set here and can be overridden
 * through Java system properties of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "qtc.log.file";
  public static final String LOG_TRACE = "qtc.log.trace";

  /** Worker threads used to check independent definitions */
  public static final String CHECK_THREADS = "qtc.check.threads";
  public static final String WARN_UNUSED = "qtc.check.warn-unused";

  /** Longest chain of nested specialisations before giving up */
  public static final String MONO_MAX_DEPTH = "qtc.mono.max-depth";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(CHECK_THREADS, "1");
    defaults.setProperty(WARN_UNUSED, "true");
    defaults.setProperty(MONO_MAX_DEPTH, "64");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initQTCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(WARN_UNUSED);
    if (getInt(CHECK_THREADS) < 1) {
      throw new InvalidOptionException(CHECK_THREADS + " must be at least 1"
          + " but was " + get(CHECK_THREADS));
    }
    if (getInt(MONO_MAX_DEPTH) < 1) {
      throw new InvalidOptionException(MONO_MAX_DEPTH + " must be at least 1"
          + " but was " + get(MONO_MAX_DEPTH));
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
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
