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
package net.hydromatic.tensile.arith;

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import com.google.common.math.LongMath;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Interval arithmetic on integer ranges.
 *
 * <p>Every range produced here is closed at each end that has a bound. A
 * computation that would overflow a {@code long} loses that bound.
 */
public final class Bounds {
  private Bounds() {}

  /** Range that contains every integer. */
  public static final Range<Long> ALL = Range.all();

  /** Range of values that are known to be non-negative. */
  public static final Range<Long> NON_NEGATIVE = Range.atLeast(0L);

  /** Creates a range; a null bound means unbounded at that end. */
  public static Range<Long> of(@Nullable Long lo, @Nullable Long hi) {
    if (lo != null && (lo == Long.MIN_VALUE || lo == Long.MAX_VALUE)) {
      lo = null;
    }
    if (hi != null && (hi == Long.MIN_VALUE || hi == Long.MAX_VALUE)) {
      hi = null;
    }
    if (lo == null) {
      return hi == null ? ALL : Range.atMost(hi);
    }
    return hi == null ? Range.atLeast(lo) : Range.closed(lo, hi);
  }

  /** Returns the lowest value in a range, or null if unbounded below. */
  public static @Nullable Long lo(Range<Long> r) {
    if (!r.hasLowerBound()) {
      return null;
    }
    return r.lowerBoundType() == BoundType.CLOSED
        ? r.lowerEndpoint()
        : r.lowerEndpoint() + 1;
  }

  /** Returns the highest value in a range, or null if unbounded above. */
  public static @Nullable Long hi(Range<Long> r) {
    if (!r.hasUpperBound()) {
      return null;
    }
    return r.upperBoundType() == BoundType.CLOSED
        ? r.upperEndpoint()
        : r.upperEndpoint() - 1;
  }

  /** Returns the range of {@code a + b}. */
  public static Range<Long> add(Range<Long> a, Range<Long> b) {
    return of(add(lo(a), lo(b)), add(hi(a), hi(b)));
  }

  private static @Nullable Long add(@Nullable Long x, @Nullable Long y) {
    return x == null || y == null ? null : LongMath.saturatedAdd(x, y);
  }

  private static @Nullable Long mul(@Nullable Long x, long k) {
    return x == null ? null : LongMath.saturatedMultiply(x, k);
  }

  /** Returns the range of {@code a * k}. */
  public static Range<Long> scale(Range<Long> a, long k) {
    if (k == 0) {
      return Range.singleton(0L);
    }
    if (k > 0) {
      return of(mul(lo(a), k), mul(hi(a), k));
    }
    return of(mul(hi(a), k), mul(lo(a), k));
  }

  /** Returns the range of {@code a * b}. */
  public static Range<Long> multiply(Range<Long> a, Range<Long> b) {
    final Long aLo = lo(a);
    final Long aHi = hi(a);
    final Long bLo = lo(b);
    final Long bHi = hi(b);
    if (aLo != null && aLo.equals(aHi)) {
      return scale(b, aLo);
    }
    if (bLo != null && bLo.equals(bHi)) {
      return scale(a, bLo);
    }
    if (aLo != null && aHi != null && bLo != null && bHi != null) {
      final long p1 = LongMath.saturatedMultiply(aLo, bLo);
      final long p2 = LongMath.saturatedMultiply(aLo, bHi);
      final long p3 = LongMath.saturatedMultiply(aHi, bLo);
      final long p4 = LongMath.saturatedMultiply(aHi, bHi);
      return of(
          Math.min(Math.min(p1, p2), Math.min(p3, p4)),
          Math.max(Math.max(p1, p2), Math.max(p3, p4)));
    }
    if (aLo != null && aLo >= 0 && bLo != null && bLo >= 0) {
      return of(LongMath.saturatedMultiply(aLo, bLo), null);
    }
    return ALL;
  }

  /** Returns the range of {@code a // c}, where {@code c} is not zero. */
  public static Range<Long> floorDiv(Range<Long> a, long c) {
    final Long lo = lo(a);
    final Long hi = hi(a);
    final Long q1 = lo == null ? null : Math.floorDiv(lo, c);
    final Long q2 = hi == null ? null : Math.floorDiv(hi, c);
    return c > 0 ? of(q1, q2) : of(q2, q1);
  }

  /** Returns the range of {@code a % c}, where {@code c} is not zero. */
  public static Range<Long> floorMod(Range<Long> a, long c) {
    final Range<Long> full =
        c > 0 ? Range.closed(0L, c - 1) : Range.closed(c + 1, 0L);
    if (full.encloses(a)) {
      return a;
    }
    return full;
  }
}

// End Bounds.java
