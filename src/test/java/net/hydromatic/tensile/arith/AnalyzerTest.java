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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.Range;
import net.hydromatic.tensile.ast.PrimExpr;
import org.junit.jupiter.api.Test;

/** Tests for {@link Analyzer}. */
public class AnalyzerTest {
  private static void checkSimplify(PrimExpr e, String expected) {
    final Analyzer analyzer = new Analyzer();
    assertThat("simplify " + e, analyzer.simplify(e), hasToString(expected));
  }

  private static void checkProve(PrimExpr cond, Proof expected) {
    assertThat("prove " + cond, new Analyzer().prove(cond), is(expected));
  }

  @Test void testSimplifyLinear() {
    final Fixture f = new Fixture();
    checkSimplify(arith.sub(arith.add(f.n, 2), 1), "n + 1");
    checkSimplify(arith.sub(arith.mul(f.n, 3), f.n), "n * 2");
    checkSimplify(arith.sub(f.n, f.n), "0");
    checkSimplify(arith.sub(arith.add(f.n, 1), 3), "n - 2");
    checkSimplify(arith.add(arith.intImm(2), arith.intImm(5)), "7");
  }

  @Test void testSimplifyIsCanonical() {
    final Fixture f = new Fixture();
    final Analyzer analyzer = new Analyzer();
    final PrimExpr e1 = analyzer.simplify(arith.add(f.m, f.n));
    final PrimExpr e2 = analyzer.simplify(arith.add(f.n, f.m));
    assertThat(e1, is(e2));
    assertThat(e1, hasToString("m + n"));
    checkSimplify(arith.mul(f.n, f.m), "m * n");
    checkSimplify(
        arith.mul(arith.add(f.n, 1), arith.add(f.n, 1)),
        "n * 2 + n * n + 1");
  }

  @Test void testSimplifyDivision() {
    final Fixture f = new Fixture();
    final PrimExpr fourNPlusSix = arith.add(arith.mul(f.n, 4), 6);
    checkSimplify(arith.floorDiv(fourNPlusSix, 2), "n * 2 + 3");
    checkSimplify(arith.floorMod(fourNPlusSix, 2), "0");
    checkSimplify(arith.floorDiv(arith.intImm(14), 3), "4");
    checkSimplify(arith.floorDiv(arith.intImm(-7), 2), "-4");
    checkSimplify(arith.floorMod(arith.intImm(-7), 2), "1");
    checkSimplify(arith.floorDiv(f.n, 1), "n");

    // Division that cannot be reduced stays as an atom
    checkSimplify(
        arith.floorDiv(arith.add(f.n, 1), 2), "(n + 1) // 2");
    checkSimplify(arith.floorMod(f.n, 2), "n % 2");

    // The dividend is known to lie in [0, 3]
    checkSimplify(arith.floorDiv(arith.floorMod(f.x, 4), 4), "0");
    checkSimplify(arith.floorMod(arith.floorMod(f.x, 4), 4), "x % 4");
  }

  @Test void testProveConstant() {
    checkProve(arith.eq(arith.intImm(4), arith.intImm(4)), Proof.PROVEN);
    checkProve(arith.eq(arith.intImm(4), arith.intImm(3)), Proof.DISPROVEN);
    checkProve(arith.lt(arith.intImm(0), arith.intImm(2)), Proof.PROVEN);
    checkProve(arith.ge(arith.intImm(0), arith.intImm(2)), Proof.DISPROVEN);
    checkProve(arith.intImm(1), Proof.PROVEN);
    checkProve(arith.intImm(0), Proof.DISPROVEN);
  }

  @Test void testProveSymbolic() {
    final Fixture f = new Fixture();
    checkProve(arith.eq(f.n, f.n), Proof.PROVEN);
    checkProve(arith.eq(arith.add(f.n, 1), f.n), Proof.DISPROVEN);
    checkProve(arith.eq(f.n, f.m), Proof.UNKNOWN);
    checkProve(arith.ne(f.n, f.m), Proof.UNKNOWN);
    checkProve(
        arith.eq(arith.mul(f.n, 2), arith.add(f.n, f.n)), Proof.PROVEN);

    // A size variable is never negative; an integer variable may be
    checkProve(arith.ge(f.n, arith.intImm(0)), Proof.PROVEN);
    checkProve(arith.lt(f.n, arith.intImm(0)), Proof.DISPROVEN);
    checkProve(arith.ge(f.x, arith.intImm(0)), Proof.UNKNOWN);
    checkProve(arith.gt(arith.add(f.n, 1), arith.intImm(0)), Proof.PROVEN);
  }

  @Test void testProveDivisibility() {
    final Fixture f = new Fixture();
    // 2 * n is even, so can never equal 7
    checkProve(arith.eq(arith.mul(f.n, 2), arith.intImm(7)), Proof.DISPROVEN);
    checkProve(arith.eq(arith.mul(f.n, 2), arith.intImm(8)), Proof.UNKNOWN);
    checkProve(
        arith.eq(arith.floorMod(arith.mul(f.n, 4), 2), arith.intImm(0)),
        Proof.PROVEN);
    checkProve(
        arith.eq(arith.floorMod(f.n, 2), arith.intImm(0)), Proof.UNKNOWN);
  }

  @Test void testProveBounds() {
    final Fixture f = new Fixture();
    checkProve(arith.lt(arith.floorMod(f.x, 4), arith.intImm(4)),
        Proof.PROVEN);
    checkProve(arith.ge(arith.floorMod(f.x, 4), arith.intImm(0)),
        Proof.PROVEN);
    checkProve(arith.eq(arith.floorMod(f.x, 4), arith.intImm(4)),
        Proof.DISPROVEN);
    checkProve(arith.lt(arith.floorMod(f.x, 4), arith.intImm(3)),
        Proof.UNKNOWN);
    checkProve(arith.le(arith.floorMod(f.x, 4), arith.intImm(3)),
        Proof.PROVEN);
  }

  @Test void testProveLogic() {
    final Fixture f = new Fixture();
    final PrimExpr t = arith.ge(f.n, arith.intImm(0));
    final PrimExpr u = arith.eq(f.n, f.m);
    final PrimExpr fa = arith.lt(f.n, arith.intImm(0));
    checkProve(arith.and(t, t), Proof.PROVEN);
    checkProve(arith.and(t, u), Proof.UNKNOWN);
    checkProve(arith.and(u, fa), Proof.DISPROVEN);
    checkProve(arith.or(u, t), Proof.PROVEN);
    checkProve(arith.or(fa, u), Proof.UNKNOWN);
    checkProve(arith.or(fa, fa), Proof.DISPROVEN);
    checkProve(arith.not(fa), Proof.PROVEN);
    checkProve(arith.not(u), Proof.UNKNOWN);
  }

  @Test void testCanProve() {
    final Fixture f = new Fixture();
    final Analyzer analyzer = new Analyzer();
    assertThat(analyzer.canProve(arith.ge(f.n, arith.intImm(0))), is(true));
    assertThat(analyzer.canProve(arith.eq(f.n, f.m)), is(false));
    assertThat(
        analyzer.canProveEqual(
            arith.sub(arith.mul(f.n, 3), f.n), arith.mul(f.n, 2)),
        is(true));
    assertThat(analyzer.canProveEqual(f.n, arith.add(f.n, 1)), is(false));
  }

  @Test void testBounds() {
    final Fixture f = new Fixture();
    final Analyzer analyzer = new Analyzer();
    assertThat(analyzer.bounds(arith.intImm(5)), is(Range.singleton(5L)));
    assertThat(analyzer.bounds(f.n), is(Range.atLeast(0L)));
    assertThat(analyzer.bounds(arith.sub(arith.intImm(3), f.n)),
        is(Range.atMost(3L)));
    assertThat(analyzer.bounds(arith.floorMod(f.x, 4)),
        is(Range.closed(0L, 3L)));
    assertThat(analyzer.bounds(arith.floorDiv(arith.floorMod(f.x, 8), 2)),
        is(Range.closed(0L, 3L)));
    assertThat(analyzer.bounds(f.x), is(Range.all()));
  }

  /** Variables used in tests. */
  private static class Fixture {
    final PrimExpr n = arith.sizeVar("n");
    final PrimExpr m = arith.sizeVar("m");
    final PrimExpr x = arith.var("x");
  }
}

// End AnalyzerTest.java
