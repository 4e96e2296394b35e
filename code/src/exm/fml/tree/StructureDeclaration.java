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
 * A {@code uses} declaration naming a structure definition the map reads
 * or writes.
 */
public class StructureDeclaration extends MappingNode {

  public static enum Mode {
    SOURCE,
    QUERIED,
    TARGET,
    PRODUCED,
  }

  private String url;
  /** Null if no alias */
  private String alias;
  private Mode mode;

  public StructureDeclaration(String url, String alias, Mode mode) {
    this.url = url;
    this.alias = alias;
    this.mode = mode;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getAlias() {
    return alias;
  }

  public void setAlias(String alias) {
    this.alias = alias;
  }

  public Mode getMode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "uses " + url + (alias != null ? " alias " + alias : "") +
           " as " + mode;
  }
}
