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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.tensile.ast.Arith.arith;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import com.google.common.math.LongMath;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.tensile.ast.PrimExpr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integer polynomial in canonical form.
 *
 * <p>Each term is a coefficient times a monomial; a monomial is a sorted list
 * of atoms (variables, and divisions that could not be reduced). The constant
 * term has the empty monomial. Terms with a zero coefficient are not stored,
 * so two forms are equal if and only if they are the same polynomial.
 */
public final class LinearForm {
  /** Orders atoms by their text, then by kind. */
  static final Ordering<PrimExpr> ATOM_ORDER =
      Ordering.from(
          Comparator.<PrimExpr, String>comparing(PrimExpr::toString)
              .thenComparing((PrimExpr e) -> e.op));

  static final Ordering<Iterable<PrimExpr>> MONOMIAL_ORDER =
      ATOM_ORDER.lexicographical();

  private static final ImmutableList<PrimExpr> ONE = ImmutableList.of();

  public final ImmutableSortedMap<ImmutableList<PrimExpr>, Long> terms;

  private LinearForm(TreeMap<ImmutableList<PrimExpr>, Long> terms) {
    terms.values().removeIf(c -> c == 0L);
    this.terms = ImmutableSortedMap.copyOfSorted(terms);
  }

  private static TreeMap<ImmutableList<PrimExpr>, Long> newMap() {
    return new TreeMap<>(MONOMIAL_ORDER);
  }

  /** Creates a constant. */
  public static LinearForm constant(long value) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    map.put(ONE, value);
    return new LinearForm(map);
  }

  /** Creates a form consisting of a single atom. */
  public static LinearForm atom(PrimExpr atom) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    map.put(ImmutableList.of(atom), 1L);
    return new LinearForm(map);
  }

  /** Whether this form has no terms other than the constant. */
  public boolean isConstant() {
    return terms.isEmpty() || terms.size() == 1 && terms.containsKey(ONE);
  }

  /** Returns the constant term. */
  public long constantTerm() {
    final Long c = terms.get(ONE);
    return c == null ? 0L : c;
  }

  /** Returns the sum of this form and another. */
  public LinearForm plus(LinearForm other) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    map.putAll(terms);
    other.terms.forEach((m, c) -> map.merge(m, c, LongMath::checkedAdd));
    return new LinearForm(map);
  }

  /** Returns this form minus another. */
  public LinearForm minus(LinearForm other) {
    return plus(other.scale(-1));
  }

  /** Returns this form multiplied by a constant. */
  public LinearForm scale(long k) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    terms.forEach((m, c) -> map.put(m, LongMath.checkedMultiply(c, k)));
    return new LinearForm(map);
  }

  /** Returns the product of this form and another. */
  public LinearForm times(LinearForm other) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    for (Map.Entry<ImmutableList<PrimExpr>, Long> e1 : terms.entrySet()) {
      for (Map.Entry<ImmutableList<PrimExpr>, Long> e2
          : other.terms.entrySet()) {
        final ImmutableList<PrimExpr> m =
            ATOM_ORDER.immutableSortedCopy(
                Iterables.concat(e1.getKey(), e2.getKey()));
        map.merge(
            m,
            LongMath.checkedMultiply(e1.getValue(), e2.getValue()),
            LongMath::checkedAdd);
      }
    }
    return new LinearForm(map);
  }

  /** Returns this form without its constant term. */
  public LinearForm withoutConstant() {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    map.putAll(terms);
    map.remove(ONE);
    return new LinearForm(map);
  }

  /**
   * Returns the greatest common divisor of the coefficients of the
   * non-constant terms, or 0 if there are none.
   */
  public long coefficientGcd() {
    long g = 0;
    for (Map.Entry<ImmutableList<PrimExpr>, Long> e : terms.entrySet()) {
      if (!e.getKey().isEmpty()) {
        g = LongMath.gcd(g, Math.abs(e.getValue()));
      }
    }
    return g;
  }

  /**
   * Returns this form with every coefficient divided by {@code k}.
   *
   * @throws IllegalArgumentException if a coefficient is not a multiple of
   *     {@code k}
   */
  public LinearForm divideExact(long k) {
    final TreeMap<ImmutableList<PrimExpr>, Long> map = newMap();
    terms.forEach((m, c) -> {
      checkArgument(c % k == 0, "%s is not a multiple of %s", c, k);
      map.put(m, c / k);
    });
    return new LinearForm(map);
  }

  /**
   * Converts this form back to an expression. Non-constant terms come first,
   * in a deterministic order, followed by the constant.
   */
  public PrimExpr toExpr() {
    @Nullable PrimExpr e = null;
    for (Map.Entry<ImmutableList<PrimExpr>, Long> term : terms.entrySet()) {
      if (term.getKey().isEmpty()) {
        continue;
      }
      final PrimExpr m = monomial(term.getKey());
      final long c = term.getValue();
      if (e == null) {
        e = c == 1 ? m : arith.mul(m, c);
      } else if (c > 0) {
        e = arith.add(e, c == 1 ? m : arith.mul(m, c));
      } else {
        e = arith.sub(e, c == -1 ? m : arith.mul(m, -c));
      }
    }
    final long k = constantTerm();
    if (e == null) {
      return arith.intImm(k);
    }
    if (k > 0) {
      return arith.add(e, k);
    }
    if (k < 0) {
      return arith.sub(e, -k);
    }
    return e;
  }

  private static PrimExpr monomial(ImmutableList<PrimExpr> atoms) {
    PrimExpr e = atoms.get(0);
    for (PrimExpr atom : atoms.subList(1, atoms.size())) {
      e = arith.mul(e, atom);
    }
    return e;
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LinearForm && terms.equals(((LinearForm) o).terms);
  }

  @Override
  public String toString() {
    return toExpr().toString();
  }
}

// End LinearForm.java
