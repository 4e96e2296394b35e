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

import java.math.BigDecimal;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import exm.fml.common.exceptions.FmlRuntimeError;

/**
 * An immutable literal value.
 *
 * Literals read from source remember how they were spelled, so that
 * quoting style and escapes are reproduced exactly.  To change a value,
 * replace the literal.
 */
public class Literal {

  public static enum Kind {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATE_TIME,
    TIME,
    NULL,
    /** Triple-quoted text, kept raw */
    BLOCK_STRING,
  }

  private final Kind kind;
  /**
   * Unescaped string content, number or boolean text, or date/time text
   * without the leading @.  Empty for NULL.
   */
  private final String value;
  /** Spelling in source text, or null for constructed literals */
  private final String sourceText;

  private Literal(Kind kind, String value, String sourceText) {
    Preconditions.checkNotNull(kind, "kind");
    Preconditions.checkNotNull(value, "value");
    this.kind = kind;
    this.value = value;
    this.sourceText = sourceText;
  }

  public static Literal string(String value) {
    return new Literal(Kind.STRING, value, null);
  }

  public static Literal integer(long value) {
    return new Literal(Kind.INTEGER, Long.toString(value), null);
  }

  public static Literal decimal(BigDecimal value) {
    return new Literal(Kind.DECIMAL, value.toPlainString(), null);
  }

  public static Literal bool(boolean value) {
    return new Literal(Kind.BOOLEAN, Boolean.toString(value), null);
  }

  public static Literal date(String isoDate) {
    return new Literal(Kind.DATE, isoDate, null);
  }

  public static Literal dateTime(String isoDateTime) {
    return new Literal(Kind.DATE_TIME, isoDateTime, null);
  }

  /**
   * @param isoTime time text starting with T, e.g. T10:00
   */
  public static Literal time(String isoTime) {
    return new Literal(Kind.TIME, isoTime, null);
  }

  public static Literal nullValue() {
    return new Literal(Kind.NULL, "", null);
  }

  public static Literal blockString(String value) {
    return new Literal(Kind.BLOCK_STRING, value, null);
  }

  /**
   * Literal read from source text
   */
  public static Literal fromSource(Kind kind, String value,
                                   String sourceText) {
    return new Literal(kind, value, sourceText);
  }

  public Kind getKind() {
    return kind;
  }

  public String getValue() {
    return value;
  }

  public String getSourceText() {
    return sourceText;
  }

  public long asLong() {
    checkKind(Kind.INTEGER);
    return Long.parseLong(value);
  }

  public BigDecimal asDecimal() {
    if (kind != Kind.INTEGER && kind != Kind.DECIMAL) {
      throw new FmlRuntimeError("Not a number: " + this);
    }
    return new BigDecimal(value);
  }

  public boolean asBoolean() {
    checkKind(Kind.BOOLEAN);
    return Boolean.parseBoolean(value);
  }

  private void checkKind(Kind expected) {
    if (kind != expected) {
      throw new FmlRuntimeError("Expected " + expected + " literal but was "
                                + this);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Literal)) {
      return false;
    }
    Literal other = (Literal)obj;
    return kind == other.kind && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, value);
  }

  @Override
  public String toString() {
    return kind + ":" + value;
  }
}
