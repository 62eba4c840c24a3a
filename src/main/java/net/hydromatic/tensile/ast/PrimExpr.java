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
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Symbolic integer expression.
 *
 * <p>Shapes of tensors are lists of these. An expression may contain
 * variables whose value is not known until run time, such as a dynamic batch
 * size {@code n}; then {@code n - 2} is as good a dimension as {@code 5}.
 *
 * <p>Expressions are immutable and compare structurally. Create them using
 * {@link Arith#arith}.
 */
public abstract class PrimExpr {
  public final Op op;

  PrimExpr(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this expression to a string, inserting parentheses where
   * operator precedence requires them.
   */
  @Override
  public final String toString() {
    return unparse(new ExprWriter(), 0, 0).toString();
  }

  abstract ExprWriter unparse(ExprWriter w, int left, int right);

  /** Whether this expression is an integer constant. */
  public boolean isConstant() {
    return op == Op.INT_IMM;
  }

  /**
   * Returns the value of this constant.
   *
   * @throws IllegalArgumentException if this is not a constant
   */
  public long longValue() {
    checkArgument(isConstant(), "not a constant: %s", this);
    return ((IntImm) this).value;
  }

  /** Integer constant. */
  public static class IntImm extends PrimExpr {
    public final long value;

    IntImm(long value) {
      super(Op.INT_IMM);
      this.value = value;
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (value < 0 && left > 0) {
        return w.append("(").append(Long.toString(value)).append(")");
      }
      return w.append(Long.toString(value));
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof IntImm && value == ((IntImm) o).value;
    }
  }

  /**
   * Variable. If its op is {@link Op#SIZE_VAR} its value is known to be
   * non-negative.
   */
  public static class Var extends PrimExpr {
    public final String name;

    Var(Op op, String name) {
      super(op);
      checkArgument(op == Op.INT_VAR || op == Op.SIZE_VAR);
      this.name = requireNonNull(name);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && op == ((Var) o).op
              && name.equals(((Var) o).name);
    }
  }

  /** Call to a binary operator: arithmetic, comparison or logical. */
  public static class Binary extends PrimExpr {
    public final PrimExpr a;
    public final PrimExpr b;

    Binary(Op op, PrimExpr a, PrimExpr b) {
      super(op);
      this.a = requireNonNull(a);
      this.b = requireNonNull(b);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, a, op, b, right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a, b);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && op == ((Binary) o).op
              && a.equals(((Binary) o).a)
              && b.equals(((Binary) o).b);
    }
  }

  /** Logical negation. */
  public static class Not extends PrimExpr {
    public final PrimExpr a;

    Not(PrimExpr a) {
      super(Op.NOT);
      this.a = requireNonNull(a);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && a.equals(((Not) o).a);
    }
  }
}

// End PrimExpr.java
