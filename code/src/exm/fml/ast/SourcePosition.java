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
 * Span of source text covered by a node.  Lines are 1-based, columns are
 * 0-based, and indices are character offsets into the input with the end
 * index inclusive.
 */
public class SourcePosition {
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  public final int startIndex;
  public final int endIndex;

  public SourcePosition(int startLine, int startColumn,
                        int endLine, int endColumn,
                        int startIndex, int endIndex) {
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.startIndex = startIndex;
    this.endIndex = endIndex;
  }

  /**
   * @return location in the "@line:col" form used by error reports
   */
  public String location() {
    return "@" + startLine + ":" + startColumn;
  }

  /**
   * @return number of characters covered
   */
  public int length() {
    return endIndex - startIndex + 1;
  }

  @Override
  public String toString() {
    return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
  }
}
