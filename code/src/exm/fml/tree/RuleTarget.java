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

import org.apache.commons.lang3.StringUtils;

/**
 * The target side of a rule.  The context is empty for a target that is
 * only an expression or a function call, e.g. {@code -> (a + b) as v}.
 */
public class RuleTarget extends MappingNode {

  public static enum ListMode {
    FIRST,
    SHARE,
    LAST,
    SINGLE,
  }

  private String context;
  private String element = null;
  private Transform transform = null;
  private String variable = null;
  private ListMode listMode = null;

  public RuleTarget(String context) {
    this.context = context;
  }

  public RuleTarget(String context, String element) {
    this.context = context;
    this.element = element;
  }

  public String getContext() {
    return context;
  }

  public void setContext(String context) {
    this.context = context;
  }

  public String getElement() {
    return element;
  }

  public void setElement(String element) {
    this.element = element;
  }

  public String getPath() {
    return element == null ? context : context + "." + element;
  }

  /**
   * @return true if there is no context, so the target is only its
   *         transform
   */
  public boolean isBare() {
    return StringUtils.isEmpty(context);
  }

  public Transform getTransform() {
    return transform;
  }

  public void setTransform(Transform transform) {
    this.transform = transform;
  }

  public String getVariable() {
    return variable;
  }

  public void setVariable(String variable) {
    this.variable = variable;
  }

  public ListMode getListMode() {
    return listMode;
  }

  public void setListMode(ListMode listMode) {
    this.listMode = listMode;
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>(1);
    if (transform != null) {
      result.add(transform);
    }
    return result;
  }

  @Override
  public String toString() {
    return getPath() + (transform != null ? " = " + transform : "");
  }
}
