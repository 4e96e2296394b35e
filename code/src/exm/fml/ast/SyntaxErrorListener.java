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
package exm.fml.ast;

/**
 * Receives errors from the generated lexer and parser in place of the
 * default ANTLR behaviour of printing to stderr.
 */
public interface SyntaxErrorListener {

  /**
   * @param line 1-based line of offending input
   * @param column 0-based column of offending input
   * @param message ANTLR's description of the problem
   */
  public void syntaxError(int line, int column, String message);
}
