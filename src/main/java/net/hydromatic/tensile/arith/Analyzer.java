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

import static net.hydromatic.tensile.ast.Arith.arith;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Map;
import net.hydromatic.tensile.ast.Op;
import net.hydromatic.tensile.ast.PrimExpr;

/**
 * Symbolic analyzer of integer expressions.
 *
 * <p>Answers questions such as "is {@code n * 2 - 1 >= 0}?" for expressions
 * whose variables are unknown. It is conservative: {@link #canProve} returns
 * false when the answer is "no" and also when the analyzer cannot tell.
 *
 * <p>An analyzer is used by one inference pass on one thread.
 */
public class Analyzer {
  /** Creates an Analyzer. */
  public Analyzer() {}

  /** Whether a condition holds for all values of its variables. */
  public boolean canProve(PrimExpr cond) {
    return prove(cond) == Proof.PROVEN;
  }

  /** Whether two expressions have equal values for all their variables. */
  public boolean canProveEqual(PrimExpr a, PrimExpr b) {
    return canProve(arith.eq(a, b));
  }

  /**
   * Simplifies an expression.
   *
   * <ul>
   *   <li>{@code (n + 2) - 1} &rarr; {@code n + 1}
   *   <li>{@code n * 3 - n} &rarr; {@code n * 2}
   *   <li>{@code (n * 4 + 6) // 2} &rarr; {@code n * 2 + 3}
   *   <li>{@code (n * 4 + 6) % 2} &rarr; {@code 0}
   *   <li>{@code 14 // 3} &rarr; {@code 4}
   * </ul>
   *
   * <p>Arithmetic expressions come back in canonical form, so two expressions
   * that are equal as polynomials simplify to equal expressions.
   */
  public PrimExpr simplify(PrimExpr e) {
    if (e.op.isArithmetic()
        || e.op == Op.INT_IMM
        || e.op == Op.INT_VAR
        || e.op == Op.SIZE_VAR) {
      return linear(e).toExpr();
    }
    if (e.op == Op.NOT) {
      return arith.not(simplify(((PrimExpr.Not) e).a));
    }
    final PrimExpr.Binary b = (PrimExpr.Binary) e;
    return arith.binary(b.op, simplify(b.a), simplify(b.b));
  }

  /** Converts an arithmetic expression to canonical form. */
  public LinearForm linear(PrimExpr e) {
    switch (e.op) {
      case INT_IMM:
        return LinearForm.constant(e.longValue());
      case INT_VAR:
      case SIZE_VAR:
        return LinearForm.atom(e);
      case PLUS:
        return linear(((PrimExpr.Binary) e).a)
            .plus(linear(((PrimExpr.Binary) e).b));
      case MINUS:
        return linear(((PrimExpr.Binary) e).a)
            .minus(linear(((PrimExpr.Binary) e).b));
      case TIMES:
        return linear(((PrimExpr.Binary) e).a)
            .times(linear(((PrimExpr.Binary) e).b));
      case FLOOR_DIV:
      case FLOOR_MOD:
        return division(
            e.op,
            linear(((PrimExpr.Binary) e).a),
            linear(((PrimExpr.Binary) e).b));
      default:
        throw new IllegalArgumentException("not arithmetic: " + e);
    }
  }

  /** Simplifies {@code a // b} or {@code a % b}. */
  private LinearForm division(Op op, LinearForm a, LinearForm b) {
    final boolean div = op == Op.FLOOR_DIV;
    if (b.isConstant() && b.constantTerm() != 0) {
      final long c = b.constantTerm();
      final long k = a.constantTerm();
      if (a.isConstant()) {
        return LinearForm.constant(
            div ? Math.floorDiv(k, c) : Math.floorMod(k, c));
      }
      final LinearForm rest = a.withoutConstant();
      if (rest.coefficientGcd() % c == 0) {
        // (c * x + k) // c = x + k // c, and (c * x + k) % c = k % c
        return div
            ? rest.divideExact(c).plus(LinearForm.constant(Math.floorDiv(k, c)))
            : LinearForm.constant(Math.floorMod(k, c));
      }
      if (c > 0 && Range.closed(0L, c - 1).encloses(bounds(a))) {
        return div ? LinearForm.constant(0) : a;
      }
    }
    final PrimExpr atom =
        div
            ? arith.floorDiv(a.toExpr(), b.toExpr())
            : arith.floorMod(a.toExpr(), b.toExpr());
    return LinearForm.atom(atom);
  }

  /** Returns the range of values an arithmetic expression may take. */
  public Range<Long> bounds(PrimExpr e) {
    return bounds(linear(e));
  }

  private Range<Long> bounds(LinearForm f) {
    Range<Long> r = Range.singleton(0L);
    for (Map.Entry<ImmutableList<PrimExpr>, Long> term
        : f.terms.entrySet()) {
      Range<Long> m = Range.singleton(1L);
      for (PrimExpr atom : term.getKey()) {
        m = Bounds.multiply(m, atomBounds(atom));
      }
      r = Bounds.add(r, Bounds.scale(m, term.getValue()));
    }
    return r;
  }

  private Range<Long> atomBounds(PrimExpr atom) {
    switch (atom.op) {
      case SIZE_VAR:
        return Bounds.NON_NEGATIVE;
      case FLOOR_DIV:
      case FLOOR_MOD:
        final PrimExpr.Binary b = (PrimExpr.Binary) atom;
        if (b.b.isConstant() && b.b.longValue() != 0) {
          final Range<Long> r = bounds(b.a);
          return atom.op == Op.FLOOR_DIV
              ? Bounds.floorDiv(r, b.b.longValue())
              : Bounds.floorMod(r, b.b.longValue());
        }
        return Bounds.ALL;
      default:
        return Bounds.ALL;
    }
  }

  /**
   * Tries to prove a condition.
   *
   * <p>A comparison is decided by moving everything to one side and
   * examining the difference: first as a constant, then by a divisibility
   * test on its coefficients (equalities only), then by its bounds.
   */
  public Proof prove(PrimExpr cond) {
    switch (cond.op) {
      case NOT:
        return prove(((PrimExpr.Not) cond).a).negate();
      case ANDALSO:
        return prove(((PrimExpr.Binary) cond).a)
            .and(prove(((PrimExpr.Binary) cond).b));
      case ORELSE:
        return prove(((PrimExpr.Binary) cond).a)
            .or(prove(((PrimExpr.Binary) cond).b));
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        final PrimExpr.Binary b = (PrimExpr.Binary) cond;
        return compare(cond.op, linear(b.a).minus(linear(b.b)));
      default:
        // A non-zero integer is true
        final LinearForm f = linear(cond);
        if (f.isConstant()) {
          return Proof.of(f.constantTerm() != 0);
        }
        return compare(Op.NE, f);
    }
  }

  /** Decides {@code d op 0}. */
  private Proof compare(Op op, LinearForm d) {
    switch (op) {
      case NE:
        return compare(Op.EQ, d).negate();
      case GT:
        return compare(Op.LT, d.scale(-1));
      case GE:
        return compare(Op.LE, d.scale(-1));
      default:
        break;
    }
    if (d.isConstant()) {
      final long k = d.constantTerm();
      return Proof.of(op == Op.EQ ? k == 0 : op == Op.LT ? k < 0 : k <= 0);
    }
    if (op == Op.EQ) {
      final long g = d.coefficientGcd();
      if (g > 1 && d.constantTerm() % g != 0) {
        return Proof.DISPROVEN;
      }
    }
    final Range<Long> r = bounds(d);
    final Long lo = Bounds.lo(r);
    final Long hi = Bounds.hi(r);
    switch (op) {
      case EQ:
        if (!r.contains(0L)) {
          return Proof.DISPROVEN;
        }
        return lo != null && lo == 0L && hi != null && hi == 0L
            ? Proof.PROVEN
            : Proof.UNKNOWN;
      case LT:
        if (hi != null && hi < 0) {
          return Proof.PROVEN;
        }
        return lo != null && lo >= 0 ? Proof.DISPROVEN : Proof.UNKNOWN;
      case LE:
        if (hi != null && hi <= 0) {
          return Proof.PROVEN;
        }
        return lo != null && lo > 0 ? Proof.DISPROVEN : Proof.UNKNOWN;
      default:
        throw new AssertionError(op);
    }
  }
}

// End Analyzer.java
