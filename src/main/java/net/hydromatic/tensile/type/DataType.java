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
package net.hydromatic.tensile.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;

/**
 * Data type of the elements of a tensor, such as {@code float32}.
 *
 * <p>{@link #VOID} stands for "not known".
 */
public final class DataType {
  public static final DataType VOID = new DataType(Code.VOID, 0, 0);
  public static final DataType BOOL = new DataType(Code.UINT, 1, 1);
  public static final DataType INT32 = new DataType(Code.INT, 32, 1);
  public static final DataType INT64 = new DataType(Code.INT, 64, 1);
  public static final DataType FLOAT16 = new DataType(Code.FLOAT, 16, 1);
  public static final DataType FLOAT32 = new DataType(Code.FLOAT, 32, 1);
  public static final DataType FLOAT64 = new DataType(Code.FLOAT, 64, 1);

  public final Code code;
  public final int bits;
  public final int lanes;

  private DataType(Code code, int bits, int lanes) {
    this.code = requireNonNull(code);
    this.bits = bits;
    this.lanes = lanes;
  }

  /** Creates a data type. */
  public static DataType of(Code code, int bits, int lanes) {
    if (code == Code.VOID) {
      return VOID;
    }
    checkArgument(bits > 0, "bits must be positive: %s", bits);
    checkArgument(lanes > 0, "lanes must be positive: %s", lanes);
    return new DataType(code, bits, lanes);
  }

  /**
   * Parses a data type such as "float32", "int64", "uint8x4", "bool" or
   * "void".
   */
  public static DataType of(String s) {
    switch (s) {
      case "":
      case "void":
        return VOID;
      case "bool":
        return BOOL;
      default:
        break;
    }
    for (Code code : Code.values()) {
      if (code == Code.VOID || !s.startsWith(code.prefix)) {
        continue;
      }
      final String rest = s.substring(code.prefix.length());
      final int x = rest.indexOf('x');
      try {
        final int bits =
            x < 0
                ? rest.isEmpty() ? code.defaultBits : Integer.parseInt(rest)
                : Integer.parseInt(rest.substring(0, x));
        final int lanes = x < 0 ? 1 : Integer.parseInt(rest.substring(x + 1));
        return of(code, bits, lanes);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid data type: " + s, e);
      }
    }
    throw new IllegalArgumentException("unknown data type: " + s);
  }

  /** Whether this is {@link #VOID}, the unknown data type. */
  public boolean isVoid() {
    return code == Code.VOID;
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, bits, lanes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DataType
            && code == ((DataType) o).code
            && bits == ((DataType) o).bits
            && lanes == ((DataType) o).lanes;
  }

  @Override
  public String toString() {
    if (isVoid()) {
      return "void";
    }
    if (equals(BOOL)) {
      return "bool";
    }
    return code.prefix + bits + (lanes > 1 ? "x" + lanes : "");
  }

  /** Type code. */
  public enum Code {
    INT(32),
    UINT(32),
    FLOAT(32),
    BFLOAT(16),
    HANDLE(64),
    VOID(0);

    final String prefix = name().toLowerCase(Locale.ROOT);
    final int defaultBits;

    Code(int defaultBits) {
      this.defaultBits = defaultBits;
    }
  }
}

// End DataType.java
