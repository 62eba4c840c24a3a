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

import static net.hydromatic.tensile.util.Static.allMatch;
import static net.hydromatic.tensile.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.attr.Attrs;
import net.hydromatic.tensile.type.ShapeStructInfo;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TupleStructInfo;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds IR nodes.
 *
 * <p>Calls built here have no struct info; pass them through
 * {@link net.hydromatic.tensile.compile.BlockBuilder#normalize} to infer it.
 */
public enum IrBuilder {
  /**
   * The singleton instance of the IR builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ir;

  /** Creates a local variable. */
  public Ir.Var var(String name, StructInfo structInfo) {
    return new Ir.Var(Pos.ZERO, name, structInfo);
  }

  /** Creates a reference to a function in the module. */
  public Ir.GlobalVar globalVar(String name) {
    return new Ir.GlobalVar(Pos.ZERO, name);
  }

  /** Creates a reference to an external function. */
  public Ir.ExternFunc externFunc(String globalSymbol) {
    return new Ir.ExternFunc(Pos.ZERO, globalSymbol);
  }

  /** Creates a reference to a registered operator. */
  public Ir.PrimitiveOp op(String name) {
    return new Ir.PrimitiveOp(Pos.ZERO, name);
  }

  /** Creates a call. */
  public Ir.Call call(
      Pos pos,
      Ir.Expr callee,
      List<? extends Ir.Expr> args,
      @Nullable Attrs attrs,
      List<? extends StructInfo> sinfoArgs) {
    return new Ir.Call(
        pos,
        callee,
        ImmutableList.copyOf(args),
        attrs,
        ImmutableList.copyOf(sinfoArgs),
        null);
  }

  /** Creates a call with no declared result struct info. */
  public Ir.Call call(
      Ir.Expr callee, List<? extends Ir.Expr> args, @Nullable Attrs attrs) {
    return call(Pos.ZERO, callee, args, attrs, ImmutableList.of());
  }

  /**
   * Creates a tuple. Its struct info is known if the struct info of every
   * field is known.
   */
  public Ir.Tuple tuple(List<? extends Ir.Expr> fields) {
    final ImmutableList<Ir.Expr> fieldList = ImmutableList.copyOf(fields);
    final StructInfo structInfo =
        allMatch(fieldList, e -> e.structInfo != null)
            ? TupleStructInfo.of(transformEager(fieldList, e -> e.structInfo))
            : null;
    return new Ir.Tuple(Pos.ZERO, fieldList, structInfo);
  }

  /** Creates a tuple. */
  public Ir.Tuple tuple(Ir.Expr... fields) {
    return tuple(ImmutableList.copyOf(fields));
  }

  /** Creates a shape value. */
  public Ir.ShapeExpr shape(List<? extends PrimExpr> values) {
    final ImmutableList<PrimExpr> valueList = ImmutableList.copyOf(values);
    return new Ir.ShapeExpr(
        Pos.ZERO, valueList, ShapeStructInfo.of(valueList));
  }

  /** Creates a symbolic integer value. */
  public Ir.PrimValue primValue(PrimExpr value) {
    return new Ir.PrimValue(Pos.ZERO, value);
  }

  /** Creates a string value. */
  public Ir.StringImm string(String value) {
    return new Ir.StringImm(Pos.ZERO, value);
  }
}

// End IrBuilder.java
