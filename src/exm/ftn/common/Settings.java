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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.ftn.common.exceptions.InvalidOptionException;

/**
 * General front end settings.  Defaults are set here and may be
 * overridden with Java system properties of the same name.
 * */
public class Settings
{
  /** Bit width of decimal integer literals */
  public static final String INT_LITERAL_WIDTH = "ftn.ast.int-literal-width";
  /** Minimum bit width of B/O/Z literals */
  public static final String BOZ_MIN_WIDTH = "ftn.ast.boz-min-width";

  public static final String LOG_FILE = "ftn.log.file";
  public static final String LOG_TRACE = "ftn.log.trace";

  public static final int DEFAULT_INT_LITERAL_WIDTH = 64;
  public static final int DEFAULT_BOZ_MIN_WIDTH = 64;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INT_LITERAL_WIDTH,
                         Integer.toString(DEFAULT_INT_LITERAL_WIDTH));
    defaults.setProperty(BOZ_MIN_WIDTH,
                         Integer.toString(DEFAULT_BOZ_MIN_WIDTH));
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initFTNProperties() throws InvalidOptionException {
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

  /**
   * Drop any value set since startup, so the default applies again
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getPositiveInt(INT_LITERAL_WIDTH);
    getPositiveInt(BOZ_MIN_WIDTH);
    getBoolean(LOG_TRACE);
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

  public static int getPositiveInt(String key) throws InvalidOptionException {
    int val = getInt(key);
    if (val <= 0) {
      throw new InvalidOptionException("Option " + key +
                          " must be a positive integer, but was " + val);
    }
    return val;
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
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
