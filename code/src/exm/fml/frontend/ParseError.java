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
package exm.fml.frontend;

/**
 * A problem found while parsing mapping text.  Immutable.
 */
public class ParseError {

  public static enum Severity {
    ERROR,
    WARNING,
    INFORMATION,
  }

  /** Input was null or empty; the grammar was not run */
  public static final String EMPTY_INPUT = "empty-input";
  /** Lexer or parser rejected the input */
  public static final String SYNTAX = "syntax";
  /** The model builder did not produce the expected root */
  public static final String VISITOR_ERROR = "visitor-error";
  /** Unexpected fault while processing */
  public static final String EXCEPTION = "exception";

  private final Severity severity;
  private final String code;
  private final String message;
  private final int line;
  private final int column;

  public ParseError(Severity severity, String code, String message,
                    int line, int column) {
    this.severity = severity;
    this.code = code;
    this.message = message;
    this.line = line;
    this.column = column;
  }

  public static ParseError error(String code, String message,
                                 int line, int column) {
    return new ParseError(Severity.ERROR, code, message, line, column);
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  /**
   * @return "@line:col"
   */
  public String getLocation() {
    return "@" + line + ":" + column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String toString() {
    return severity + " " + code + " " + getLocation() + ": " + message;
  }
}
