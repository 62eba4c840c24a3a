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
package net.hydromatic.tensile.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Builds {@link PrimExpr} nodes. */
public enum Arith {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  arith;

  private final PrimExpr.IntImm zero = new PrimExpr.IntImm(0);
  private final PrimExpr.IntImm one = new PrimExpr.IntImm(1);

  /** Creates an integer constant. */
  public PrimExpr.IntImm intImm(long value) {
    return value == 0 ? zero : value == 1 ? one : new PrimExpr.IntImm(value);
  }

  /** Creates a variable that may take any integer value. */
  public PrimExpr.Var var(String name) {
    return new PrimExpr.Var(Op.INT_VAR, name);
  }

  /** Creates a variable that is never negative, such as a dimension. */
  public PrimExpr.Var sizeVar(String name) {
    return new PrimExpr.Var(Op.SIZE_VAR, name);
  }

  /** Creates a call to a binary operator. */
  public PrimExpr binary(Op op, PrimExpr a, PrimExpr b) {
    checkArgument(
        op.isArithmetic()
            || op.isComparison()
            || op == Op.ANDALSO
            || op == Op.ORELSE,
        "not a binary operator: %s",
        op);
    return new PrimExpr.Binary(op, a, b);
  }

  /** Creates {@code a + b}. */
  public PrimExpr add(PrimExpr a, PrimExpr b) {
    return binary(Op.PLUS, a, b);
  }

  /** Creates {@code a + b}. */
  public PrimExpr add(PrimExpr a, long b) {
    return add(a, intImm(b));
  }

  /** Creates {@code a - b}. */
  public PrimExpr sub(PrimExpr a, PrimExpr b) {
    return binary(Op.MINUS, a, b);
  }

  /** Creates {@code a - b}. */
  public PrimExpr sub(PrimExpr a, long b) {
    return sub(a, intImm(b));
  }

  /** Creates {@code a * b}. */
  public PrimExpr mul(PrimExpr a, PrimExpr b) {
    return binary(Op.TIMES, a, b);
  }

  /** Creates {@code a * b}. */
  public PrimExpr mul(PrimExpr a, long b) {
    return mul(a, intImm(b));
  }

  /** Creates {@code a // b}, division rounding towards negative infinity. */
  public PrimExpr floorDiv(PrimExpr a, PrimExpr b) {
    return binary(Op.FLOOR_DIV, a, b);
  }

  /** Creates {@code a // b}. */
  public PrimExpr floorDiv(PrimExpr a, long b) {
    return floorDiv(a, intImm(b));
  }

  /** Creates {@code a % b}, whose sign is the sign of {@code b}. */
  public PrimExpr floorMod(PrimExpr a, PrimExpr b) {
    return binary(Op.FLOOR_MOD, a, b);
  }

  /** Creates {@code a % b}. */
  public PrimExpr floorMod(PrimExpr a, long b) {
    return floorMod(a, intImm(b));
  }

  /** Creates {@code a == b}. */
  public PrimExpr eq(PrimExpr a, PrimExpr b) {
    return binary(Op.EQ, a, b);
  }

  /** Creates {@code a != b}. */
  public PrimExpr ne(PrimExpr a, PrimExpr b) {
    return binary(Op.NE, a, b);
  }

  /** Creates {@code a < b}. */
  public PrimExpr lt(PrimExpr a, PrimExpr b) {
    return binary(Op.LT, a, b);
  }

  /** Creates {@code a <= b}. */
  public PrimExpr le(PrimExpr a, PrimExpr b) {
    return binary(Op.LE, a, b);
  }

  /** Creates {@code a > b}. */
  public PrimExpr gt(PrimExpr a, PrimExpr b) {
    return binary(Op.GT, a, b);
  }

  /** Creates {@code a >= b}. */
  public PrimExpr ge(PrimExpr a, PrimExpr b) {
    return binary(Op.GE, a, b);
  }

  /** Creates {@code a and b}. */
  public PrimExpr and(PrimExpr a, PrimExpr b) {
    return binary(Op.ANDALSO, a, b);
  }

  /** Creates {@code a or b}. */
  public PrimExpr or(PrimExpr a, PrimExpr b) {
    return binary(Op.ORELSE, a, b);
  }

  /** Creates {@code not a}. */
  public PrimExpr not(PrimExpr a) {
    return new PrimExpr.Not(a);
  }
}

// End Arith.java
