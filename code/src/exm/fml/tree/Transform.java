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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * How a target value is produced.
 *
 * <ul>
 * <li>COPY: {@code tgt.x = v} or {@code tgt.x = 'value'}: a single
 *     identifier or literal argument</li>
 * <li>EVALUATE: {@code tgt.x = (fhirpath)}: a single expression
 *     argument</li>
 * <li>INVOCATION: {@code tgt.x = create('Coding')}: a named function
 *     with any arguments</li>
 * </ul>
 */
public class Transform extends MappingNode {

  public static enum Kind {
    COPY,
    EVALUATE,
    INVOCATION,
  }

  private Kind kind;
  /** Function name, only for INVOCATION */
  private String functionName;
  private final List<Argument> arguments = new ArrayList<Argument>();

  public Transform(Kind kind, String functionName) {
    this.kind = kind;
    this.functionName = functionName;
  }

  public static Transform copy(Argument source) {
    Preconditions.checkArgument(source.getKind() != Argument.Kind.EXPRESSION,
                                "copy source cannot be an expression");
    Transform t = new Transform(Kind.COPY, null);
    t.arguments.add(source);
    return t;
  }

  public static Transform evaluate(String expression) {
    Transform t = new Transform(Kind.EVALUATE, null);
    t.arguments.add(Argument.expression(expression));
    return t;
  }

  public static Transform invoke(String functionName, Argument ...args) {
    Preconditions.checkNotNull(functionName, "functionName");
    Transform t = new Transform(Kind.INVOCATION, functionName);
    t.arguments.addAll(Arrays.asList(args));
    return t;
  }

  public Kind getKind() {
    return kind;
  }

  public void setKind(Kind kind) {
    this.kind = kind;
  }

  /**
   * @return "copy", "evaluate", or the invoked function's name
   */
  public String getType() {
    if (kind == null) {
      return null;
    }
    switch (kind) {
      case COPY:
        return "copy";
      case EVALUATE:
        return "evaluate";
      default:
        return functionName;
    }
  }

  public String getFunctionName() {
    return functionName;
  }

  public void setFunctionName(String functionName) {
    this.functionName = functionName;
  }

  public List<Argument> getArguments() {
    return arguments;
  }

  /**
   * @return expression text of an EVALUATE transform
   */
  public String getExpression() {
    assert(kind == Kind.EVALUATE && arguments.size() == 1);
    return arguments.get(0).getText();
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return getType() + arguments;
  }
}
