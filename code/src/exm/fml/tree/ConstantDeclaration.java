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
 * {@code let name = fhirpath;}.  The expression is kept as source text.
 */
public class ConstantDeclaration extends MappingNode {

  private String name;
  private String expression;

  public ConstantDeclaration(String name, String expression) {
    this.name = name;
    this.expression = expression;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getExpression() {
    return expression;
  }

  public void setExpression(String expression) {
    this.expression = expression;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "let " + name + " = " + expression;
  }
}
