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
 * The source side of a rule.  Conditions (where, check, log) and the
 * default value are kept as FHIRPath source text.
 */
public class RuleSource extends MappingNode {

  public static enum ListMode {
    FIRST,
    NOT_FIRST,
    LAST,
    NOT_LAST,
    ONLY_ONE,
  }

  /** Cardinality upper bound meaning unbounded */
  public static final String UNBOUNDED = "*";

  private String context;
  private String element = null;
  private String type = null;
  private Integer min = null;
  /** Digits or "*" */
  private String max = null;
  private String defaultValue = null;
  private ListMode listMode = null;
  private String variable = null;
  private String condition = null;
  private String check = null;
  private String log = null;

  public RuleSource(String context) {
    this.context = context;
  }

  public RuleSource(String context, String element) {
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

  /**
   * @return context and element joined with a dot
   */
  public String getPath() {
    return element == null ? context : context + "." + element;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Integer getMin() {
    return min;
  }

  public String getMax() {
    return max;
  }

  /**
   * @param min lower bound, or null to clear cardinality
   * @param max upper bound digits or {@link #UNBOUNDED}
   */
  public void setCardinality(Integer min, String max) {
    this.min = min;
    this.max = max;
  }

  public String getDefaultValue() {
    return defaultValue;
  }

  public void setDefaultValue(String defaultValue) {
    this.defaultValue = defaultValue;
  }

  public ListMode getListMode() {
    return listMode;
  }

  public void setListMode(ListMode listMode) {
    this.listMode = listMode;
  }

  public String getVariable() {
    return variable;
  }

  public void setVariable(String variable) {
    this.variable = variable;
  }

  public String getCondition() {
    return condition;
  }

  public void setCondition(String condition) {
    this.condition = condition;
  }

  public String getCheck() {
    return check;
  }

  public void setCheck(String check) {
    this.check = check;
  }

  public String getLog() {
    return log;
  }

  public void setLog(String log) {
    this.log = log;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return getPath() + (variable != null ? " as " + variable : "");
  }
}
