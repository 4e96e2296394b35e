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
package exm.fml.tree;

import java.util.Collections;
import java.util.List;

/**
 * A {@code /// path = value} line at the top of a document
 */
public class MetadataDeclaration extends MappingNode {

  private String path;
  /** Null if no value given */
  private Literal value;

  public MetadataDeclaration(String path, Literal value) {
    this.path = path;
    this.value = value;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public Literal getValue() {
    return value;
  }

  public void setValue(Literal value) {
    this.value = value;
  }

  /**
   * @return true if the value is a triple-quoted markdown block
   */
  public boolean isMarkdown() {
    return value != null && value.getKind() == Literal.Kind.BLOCK_STRING;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "/// " + path + " = " + value;
  }
}
