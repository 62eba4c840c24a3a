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

/** Kinds of {@link PrimExpr} and {@link Ir.Expr} nodes. */
public enum Op {
  // symbolic integer expressions
  INT_IMM(true),
  /** Integer variable; may take any value. */
  INT_VAR(true),
  /** Size variable; never negative. */
  SIZE_VAR(true),

  TIMES(" * ", 7),
  FLOOR_DIV(" // ", 7),
  FLOOR_MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  NOT("not ", 3),
  ANDALSO(" and ", 2),
  ORELSE(" or ", 1),

  // IR expressions
  VAR(true),
  GLOBAL_VAR(true),
  EXTERN_FUNC(true),
  PRIMITIVE_OP(true),
  CALL(true),
  TUPLE(true),
  SHAPE_EXPR(true),
  PRIM_VALUE(true),
  STRING_IMM(true);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Whether this is a binary arithmetic operator. */
  public boolean isArithmetic() {
    switch (this) {
      case PLUS:
      case MINUS:
      case TIMES:
      case FLOOR_DIV:
      case FLOOR_MOD:
        return true;
      default:
        return false;
    }
  }

  /** Whether this is a comparison operator. */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
