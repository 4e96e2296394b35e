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

import java.util.ArrayList;
import java.util.List;

/**
 * A named, parameterised group of rules.  Groups can be invoked from
 * rules in other groups, and may extend another group.
 */
public class GroupDeclaration extends BlockNode {

  /** Type-based dispatch: {@code <<types>>} or {@code <<type+>>} */
  public static enum TypeMode {
    TYPES,
    TYPE_PLUS,
  }

  private String name;
  private final List<GroupParameter> parameters =
                                  new ArrayList<GroupParameter>();
  /** Null if not extending */
  private String extendsGroup = null;
  /** Null if no type mode */
  private TypeMode typeMode = null;
  private final List<Rule> rules = new ArrayList<Rule>();

  public GroupDeclaration(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<GroupParameter> getParameters() {
    return parameters;
  }

  public String getExtends() {
    return extendsGroup;
  }

  public void setExtends(String extendsGroup) {
    this.extendsGroup = extendsGroup;
  }

  public TypeMode getTypeMode() {
    return typeMode;
  }

  public void setTypeMode(TypeMode typeMode) {
    this.typeMode = typeMode;
  }

  public List<Rule> getRules() {
    return rules;
  }

  /**
   * @return the parameter with the name, or null
   */
  public GroupParameter getParameter(String paramName) {
    for (GroupParameter param: parameters) {
      if (param.getName().equals(paramName)) {
        return param;
      }
    }
    return null;
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>();
    result.addAll(parameters);
    result.addAll(rules);
    return result;
  }

  @Override
  public String toString() {
    return "group " + name + parameters;
  }
}
