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
package exm.fml.common.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fml.frontend.ParseError;

/**
 * Represents a failure to parse mapping text caused by user input.
 * Carries the full list of structured errors rather than a flattened
 * message.
 */
public class FmlParseException extends Exception {

  private final ImmutableList<ParseError> errors;

  public FmlParseException(String message, List<ParseError> errors) {
    super(message + describe(errors));
    this.errors = ImmutableList.copyOf(errors);
  }

  public List<ParseError> getErrors() {
    return errors;
  }

  private static String describe(List<ParseError> errors) {
    if (errors.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(": ");
    sb.append(errors.get(0));
    if (errors.size() > 1) {
      sb.append(" (and " + (errors.size() - 1) + " more)");
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 1L;
}
