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
package net.hydromatic.tensile.layout;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Data layout of a tensor: one letter per axis, such as "NCHW".
 *
 * <p>The letters are primal axes: "N" batch, "C" channel, "H" height, "W"
 * width, and for kernels "O" output channel and "I" input channel. Two
 * layouts with the same letters in a different order describe the same data
 * permuted.
 */
public final class Layout {
  public final String name;

  private Layout(String name) {
    this.name = requireNonNull(name);
  }

  /**
   * Parses a layout.
   *
   * @throws IllegalArgumentException if the name is empty, contains anything
   *     other than upper-case letters, or repeats an axis
   */
  public static Layout of(String name) {
    if (name.isEmpty()) {
      throw new IllegalArgumentException("empty layout");
    }
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (c < 'A' || c > 'Z') {
        throw new IllegalArgumentException(
            "invalid axis '" + c + "' in layout " + name);
      }
      if (name.indexOf(c) != i) {
        throw new IllegalArgumentException(
            "repeated axis '" + c + "' in layout " + name);
      }
    }
    return new Layout(name);
  }

  /** Parses a layout, or returns null if the name is not valid. */
  public static @Nullable Layout tryParse(String name) {
    try {
      return of(name);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /** Returns the number of axes. */
  public int ndim() {
    return name.length();
  }

  /** Returns the axis at a given position. */
  public char axis(int i) {
    return name.charAt(i);
  }

  /** Returns the position of an axis, or -1 if not present. */
  public int indexOf(char axis) {
    return name.indexOf(axis);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Layout && name.equals(((Layout) o).name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Layout.java
