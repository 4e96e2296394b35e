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
package exm.fml.common.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Quoting and escaping of FML string literals and names
 */
public class StringUtil {

  /**
   * Quote a string value for output as a literal.  Single quotes are
   * preferred; double quotes are used if the value contains a single
   * quote.
   */
  public static String quoteLiteral(String value) {
    char quote = value.indexOf('\'') >= 0 ? '"' : '\'';
    return quote(value, quote);
  }

  /**
   * Quote with double quotes, as used for urls and rule names
   */
  public static String doubleQuote(String value) {
    return quote(value, '"');
  }

  public static String quote(String value, char quote) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append(quote);
    escape(sb, value, quote);
    sb.append(quote);
    return sb.toString();
  }

  /**
   * Append escaped value.  Only the backslash, the quote character in use
   * and line breaks/tabs are escaped.
   */
  public static void escape(StringBuilder sb, String value, char quote) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c == quote) {
            sb.append('\\');
          }
          sb.append(c);
          break;
      }
    }
  }

  /**
   * Remove the surrounding quotes (single, double, backtick or triple
   * double) from a token and process escape codes.  Text that is not
   * quoted is returned unchanged.
   */
  public static String unquote(String text) {
    if (text.length() >= 6 && text.startsWith("\"\"\"")
                           && text.endsWith("\"\"\"")) {
      // Block strings are raw
      return text.substring(3, text.length() - 3);
    }
    if (text.length() >= 2) {
      char first = text.charAt(0);
      char last = text.charAt(text.length() - 1);
      if (first == last && (first == '\'' || first == '"' || first == '`')) {
        return unescape(text.substring(1, text.length() - 1));
      }
    }
    return text;
  }

  /**
   * Process FHIRPath escape codes.  Unrecognised escapes keep the
   * escaped character.
   */
  public static String unescape(String escapedString) {
    if (escapedString.indexOf('\\') < 0) {
      return escapedString;
    }
    StringBuilder realString = new StringBuilder(escapedString.length());
    for (int i = 0; i < escapedString.length(); i++) {
      char c = escapedString.charAt(i);
      if (c != '\\' || i == escapedString.length() - 1) {
        realString.append(c);
        continue;
      }
      i++;
      c = escapedString.charAt(i);
      switch (c) {
        case 'n':
          realString.append('\n');
          break;
        case 'r':
          realString.append('\r');
          break;
        case 't':
          realString.append('\t');
          break;
        case 'f':
          realString.append('\f');
          break;
        case 'u':
          // Unicode escape: four hex digits
          if (i + 4 < escapedString.length() &&
              isHex(escapedString.substring(i + 1, i + 5))) {
            realString.append((char)Integer.parseInt(
                escapedString.substring(i + 1, i + 5), 16));
            i += 4;
          } else {
            realString.append(c);
          }
          break;
        default:
          // \\ \' \" \` \/
          realString.append(c);
          break;
      }
    }
    return realString.toString();
  }

  private static boolean isHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.digit(s.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true if name can be written without backtick delimiters
   */
  public static boolean isPlainIdentifier(String name) {
    if (StringUtils.isEmpty(name)) {
      return false;
    }
    char first = name.charAt(0);
    if (!(Character.isLetter(first) && first < 128) && first != '_') {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) && c < 128) && c != '_') {
        return false;
      }
    }
    return true;
  }

  /**
   * Render a name, delimiting it with backticks if needed
   */
  public static String identifier(String name) {
    if (isPlainIdentifier(name)) {
      return name;
    }
    return quote(name, '`');
  }

  /**
   * Render a dotted path, delimiting each segment as needed
   */
  public static String path(String path) {
    String[] segments = StringUtils.split(path, '.');
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.length; i++) {
      if (i > 0) {
        sb.append('.');
      }
      sb.append(identifier(segments[i]));
    }
    return sb.toString();
  }

  /**
   * @return true if the text contains a line break
   */
  public static boolean hasLineBreak(String text) {
    return StringUtils.containsAny(text, '\n', '\r');
  }
}
