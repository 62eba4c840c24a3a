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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.calcite.util.Permutation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversion between two layouts that have the same axes in different orders.
 *
 * <p>For example, between "NHWC" (source) and "NCHW" (destination),
 * {@link #forwardShape} maps the shape {@code [1, 28, 28, 3]} to
 * {@code [1, 3, 28, 28]} and {@link #backwardShape} maps it back.
 */
public final class BijectiveLayout {
  public final Layout src;
  public final Layout dst;

  /** Maps the position of each axis in {@link #src} to its position in
   * {@link #dst}. */
  private final Permutation permutation;

  private BijectiveLayout(Layout src, Layout dst, Permutation permutation) {
    this.src = requireNonNull(src);
    this.dst = requireNonNull(dst);
    this.permutation = requireNonNull(permutation);
  }

  /**
   * Creates a conversion, or returns null if {@code src} is not a permutation
   * of {@code dst}.
   */
  public static @Nullable BijectiveLayout of(Layout src, Layout dst) {
    if (src.ndim() != dst.ndim()) {
      return null;
    }
    final int[] targets = new int[src.ndim()];
    for (int j = 0; j < targets.length; j++) {
      targets[j] = dst.indexOf(src.axis(j));
      if (targets[j] < 0) {
        return null;
      }
    }
    return new BijectiveLayout(src, dst, new Permutation(targets));
  }

  /** Converts a shape in the source layout to the destination layout. */
  public <E> ImmutableList<E> forwardShape(List<E> shape) {
    checkArgument(
        shape.size() == src.ndim(),
        "shape %s does not have rank of layout %s",
        shape,
        src);
    final Object[] out = new Object[shape.size()];
    for (int j = 0; j < shape.size(); j++) {
      out[permutation.getTarget(j)] = shape.get(j);
    }
    return copy(out);
  }

  /** Converts a shape in the destination layout to the source layout. */
  public <E> ImmutableList<E> backwardShape(List<E> shape) {
    checkArgument(
        shape.size() == dst.ndim(),
        "shape %s does not have rank of layout %s",
        shape,
        dst);
    final Object[] out = new Object[shape.size()];
    for (int j = 0; j < shape.size(); j++) {
      out[j] = shape.get(permutation.getTarget(j));
    }
    return copy(out);
  }

  /** Returns the conversion in the opposite direction. */
  public BijectiveLayout inverse() {
    return new BijectiveLayout(dst, src, permutation.inverse());
  }

  /** Whether the two layouts are the same, so that conversion is a no-op. */
  public boolean isIdentity() {
    return permutation.isIdentity();
  }

  @SuppressWarnings("unchecked")
  private static <E> ImmutableList<E> copy(Object[] elements) {
    return (ImmutableList<E>) ImmutableList.copyOf(elements);
  }

  @Override
  public String toString() {
    return src + "->" + dst;
  }
}

// End BijectiveLayout.java
