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

import exm.fml.schema.SchemaElement;

/**
 * A formal parameter of a group: {@code source src : Patient}
 */
public class GroupParameter extends MappingNode {

  public static enum Mode {
    SOURCE,
    TARGET,
  }

  private Mode mode;
  private String name;
  /** Null if untyped */
  private String type;

  /**
   * Schema element the parameter type resolved to.  Filled in by
   * validation tools; never written out.
   */
  private transient SchemaElement resolvedElement = null;

  public GroupParameter(Mode mode, String name, String type) {
    this.mode = mode;
    this.name = name;
    this.type = type;
  }

  public Mode getMode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public SchemaElement getResolvedElement() {
    return resolvedElement;
  }

  public void setResolvedElement(SchemaElement resolvedElement) {
    this.resolvedElement = resolvedElement;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return mode + " " + name + (type != null ? " : " + type : "");
  }
}
