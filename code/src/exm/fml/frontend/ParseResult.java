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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.fml.common.exceptions.FmlRuntimeError;
import exm.fml.tree.MappingNode;

/**
 * Outcome of a parse: either a value or a non-empty list of errors,
 * never both.
 */
public class ParseResult<T extends MappingNode> {

  private final T value;
  private final ImmutableList<ParseError> errors;

  private ParseResult(T value, ImmutableList<ParseError> errors) {
    this.value = value;
    this.errors = errors;
  }

  public static <T extends MappingNode> ParseResult<T> success(T value) {
    Preconditions.checkNotNull(value, "value");
    return new ParseResult<T>(value, ImmutableList.<ParseError>of());
  }

  public static <T extends MappingNode> ParseResult<T> failure(
                                              List<ParseError> errors) {
    Preconditions.checkArgument(!errors.isEmpty(), "no errors given");
    return new ParseResult<T>(null, ImmutableList.copyOf(errors));
  }

  public boolean isSuccess() {
    return value != null;
  }

  /**
   * @return the parsed value
   * @throws FmlRuntimeError if the parse failed
   */
  public T getValue() {
    if (value == null) {
      throw new FmlRuntimeError("No value: parse failed with " + errors);
    }
    return value;
  }

  public List<ParseError> getErrors() {
    return errors;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success(" + value + ")" : "Failure" + errors;
  }
}
