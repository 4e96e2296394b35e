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
package exm.fml.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.fml.common.exceptions.InvalidOptionException;

/**
 * General FML engine settings, held as Java properties.
 *
 * Each key has a default which can be overridden by a system property
 * of the same name, e.g. -Dfml.serializer.indent=4
 */
public class Settings {

  /** Spaces per nesting level in default layout */
  public static final String SERIALIZER_INDENT = "fml.serializer.indent";
  /** Line separator used in default layout */
  public static final String SERIALIZER_NEWLINE = "fml.serializer.newline";
  /** Also send syntax errors to the log */
  public static final String LOG_SYNTAX_ERRORS = "fml.parser.log-syntax-errors";

  private static final Properties defaults = new Properties();
  private static Properties properties;

  static {
    defaults.setProperty(SERIALIZER_INDENT, "2");
    defaults.setProperty(SERIALIZER_NEWLINE, "\n");
    defaults.setProperty(LOG_SYNTAX_ERRORS, "true");
    reset();
  }

  /**
   * Discard any values set with {@link #set(String, String)} and pull in
   * overrides from system properties again.
   */
  public static synchronized void reset() {
    properties = new Properties(defaults);
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
  }

  /**
   * Check that all current values are of the right form
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    long indent = getLong(SERIALIZER_INDENT);
    if (indent < 0) {
      throw new InvalidOptionException("Expected property " +
          SERIALIZER_INDENT + " to be non-negative but was " + indent);
    }
    getBoolean(LOG_SYNTAX_ERRORS);
    String newline = get(SERIALIZER_NEWLINE);
    if (!newline.equals("\n") && !newline.equals("\r\n")) {
      throw new InvalidOptionException("Expected property " +
          SERIALIZER_NEWLINE + " to be a line break");
    }
  }

  public static synchronized void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static synchronized String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(defaults.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = get(key);
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

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = get(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    strVal = strVal.trim();
    if (strVal.equalsIgnoreCase("true")) {
      return true;
    } else if (strVal.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }

  /**
   * Lookup boolean, falling back to default and warning once if the
   * configured value is malformed.
   */
  public static boolean getBooleanOrDefault(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn(e.getMessage() + ", using default");
      return Boolean.parseBoolean(defaults.getProperty(key));
    }
  }

  /**
   * Lookup integer, falling back to default and warning once if the
   * configured value is malformed.
   */
  public static int getIntOrDefault(String key) {
    try {
      long val = getLong(key);
      if (val < 0 || val > Integer.MAX_VALUE) {
        throw new InvalidOptionException("Value for option " + key +
            " out of range: " + val);
      }
      return (int)val;
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn(e.getMessage() + ", using default");
      return Integer.parseInt(defaults.getProperty(key));
    }
  }
}
