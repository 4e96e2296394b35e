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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import exm.fml.common.exceptions.FmlRuntimeError;

/**
 * An actual parameter of a transform function or group invocation:
 * either a literal, a (possibly dotted) variable name, or raw FHIRPath
 * text.  Immutable.
 */
public class Argument {

  public static enum Kind {
    LITERAL,
    IDENTIFIER,
    EXPRESSION,
  }

  private final Kind kind;
  private final Literal literal;
  /** Identifier or expression text */
  private final String text;

  private Argument(Kind kind, Literal literal, String text) {
    this.kind = kind;
    this.literal = literal;
    this.text = text;
  }

  public static Argument literal(Literal literal) {
    Preconditions.checkNotNull(literal, "literal");
    return new Argument(Kind.LITERAL, literal, null);
  }

  public static Argument identifier(String name) {
    Preconditions.checkNotNull(name, "name");
    return new Argument(Kind.IDENTIFIER, null, name);
  }

  public static Argument expression(String expression) {
    Preconditions.checkNotNull(expression, "expression");
    return new Argument(Kind.EXPRESSION, null, expression);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isLiteral() {
    return kind == Kind.LITERAL;
  }

  public Literal getLiteral() {
    assert(kind == Kind.LITERAL);
    return literal;
  }

  /**
   * @return identifier name or expression text
   */
  public String getText() {
    assert(kind != Kind.LITERAL);
    return text;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Argument)) {
      return false;
    }
    Argument other = (Argument)obj;
    return kind == other.kind && Objects.equal(literal, other.literal)
        && Objects.equal(text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, literal, text);
  }

  @Override
  public String toString() {
    switch (kind) {
      case LITERAL:
        return literal.toString();
      case IDENTIFIER:
        return text;
      case EXPRESSION:
        return "(" + text + ")";
      default:
        throw new FmlRuntimeError("Unknown argument kind " + kind);
    }
  }
}
