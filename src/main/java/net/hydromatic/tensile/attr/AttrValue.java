/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tensile.attr;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.tensile.type.DataType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of an attribute field, tagged with its kind.
 *
 * <p>The set of kinds is closed. {@link Kind#OPAQUE} and {@link Kind#NDARRAY}
 * exist so that a schema can describe such a field, but the printer rejects
 * them.
 */
public final class AttrValue {
  public final Kind kind;
  private final @Nullable Object value;

  private AttrValue(Kind kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  public static AttrValue ofDouble(double d) {
    return new AttrValue(Kind.DOUBLE, d);
  }

  public static AttrValue ofInt(long i) {
    return new AttrValue(Kind.INT, i);
  }

  public static AttrValue ofUnsigned(long i) {
    checkArgument(i >= 0, "negative unsigned value %s", i);
    return new AttrValue(Kind.UINT, i);
  }

  public static AttrValue ofBool(boolean b) {
    return new AttrValue(Kind.BOOL, b);
  }

  public static AttrValue ofString(String s) {
    return new AttrValue(Kind.STRING, requireNonNull(s));
  }

  public static AttrValue ofDtype(DataType dtype) {
    return new AttrValue(Kind.DTYPE, requireNonNull(dtype));
  }

  /**
   * Creates a reference to an IR object: an expression, struct info, list or
   * symbolic expression. The value may be null.
   */
  public static AttrValue ofObject(@Nullable Object o) {
    return new AttrValue(Kind.OBJECT, o);
  }

  /** Creates an untyped reference. */
  public static AttrValue ofOpaque(@Nullable Object o) {
    return new AttrValue(Kind.OPAQUE, o);
  }

  /** Creates a reference to a multidimensional buffer. */
  public static AttrValue ofNdArray(Object buffer) {
    return new AttrValue(Kind.NDARRAY, requireNonNull(buffer));
  }

  public double doubleValue() {
    checkKind(Kind.DOUBLE);
    return (Double) requireNonNull(value);
  }

  public long longValue() {
    checkState(
        kind == Kind.INT || kind == Kind.UINT,
        "attribute value of kind %s is not an integer",
        kind);
    return (Long) requireNonNull(value);
  }

  public boolean booleanValue() {
    checkKind(Kind.BOOL);
    return (Boolean) requireNonNull(value);
  }

  public String stringValue() {
    checkKind(Kind.STRING);
    return (String) requireNonNull(value);
  }

  public DataType dtypeValue() {
    checkKind(Kind.DTYPE);
    return (DataType) requireNonNull(value);
  }

  /** Returns the referenced object, for any of the reference kinds. */
  public @Nullable Object objectValue() {
    checkState(
        kind == Kind.OBJECT || kind == Kind.OPAQUE || kind == Kind.NDARRAY,
        "attribute value of kind %s is not a reference",
        kind);
    return value;
  }

  private void checkKind(Kind expected) {
    checkState(
        kind == expected,
        "attribute value of kind %s is not %s",
        kind,
        expected);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof AttrValue
            && kind == ((AttrValue) o).kind
            && Objects.equals(value, ((AttrValue) o).value);
  }

  @Override
  public String toString() {
    return kind + ":" + value;
  }

  /** Kind of attribute value. */
  public enum Kind {
    DOUBLE,
    INT,
    UINT,
    BOOL,
    STRING,
    DTYPE,
    OBJECT,
    OPAQUE,
    NDARRAY
  }
}

// End AttrValue.java
