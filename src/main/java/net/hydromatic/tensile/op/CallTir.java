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
package net.hydromatic.tensile.op;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.tensile.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.ast.Pos;
import net.hydromatic.tensile.compile.InferContext;
import net.hydromatic.tensile.compile.OpDef;
import net.hydromatic.tensile.print.CallExprPrinter;
import net.hydromatic.tensile.print.Doc;
import net.hydromatic.tensile.print.IrDocsifier;
import net.hydromatic.tensile.type.DTensorStructInfo;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TupleStructInfo;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Pseudo-operators that call a lower-level function in destination-passing
 * style: the callee writes its results into buffers that the caller
 * allocates, so the shape of the result must be declared in the call.
 *
 * <ul>
 *   <li>"relax.call_tir" calls a tensor-level function of the module;
 *   <li>"relax.call_dps_packed" calls an external packed function.
 * </ul>
 */
public final class CallTir {
  private CallTir() {}

  public static final String CALL_TIR = "relax.call_tir";
  public static final String CALL_DPS_PACKED = "relax.call_dps_packed";

  public static final OpDef CALL_TIR_DEF =
      OpDef.builder(CALL_TIR)
          .numInputs(3)
          .addArgument("func", "Expr", "The function to call.")
          .addArgument("args", "Tuple", "The input arguments.")
          .addArgument(
              "packed_ints",
              "Expr",
              "Symbolic integers to unpack at run time.")
          .inferrer(CallTir::inferCallTir)
          .printer(CallTir::print)
          .build();

  public static final OpDef CALL_DPS_PACKED_DEF =
      OpDef.builder(CALL_DPS_PACKED)
          .numInputs(2)
          .addArgument("func", "Expr", "The function to call.")
          .addArgument("args", "Tuple", "The input arguments.")
          .inferrer(CallTir::inferCallTir)
          .printer(CallTir::print)
          .build();

  /**
   * Creates a call to a tensor-level function.
   *
   * @param func Function
   * @param args Input arguments
   * @param outSinfo Struct info of the output; a tuple if there are several
   * @param tirVars Values of symbolic variables to pass to the function, or
   *     null
   */
  public static Ir.Call callTir(
      Ir.Expr func,
      Ir.Tuple args,
      StructInfo outSinfo,
      Ir.@Nullable Expr tirVars) {
    final List<Ir.Expr> operands = new ArrayList<>();
    operands.add(func);
    operands.add(args);
    if (tirVars != null) {
      operands.add(tirVars);
    }
    return ir.call(
        Pos.ZERO, ir.op(CALL_TIR), operands, null, ImmutableList.of(outSinfo));
  }

  /** Creates a call to an external packed function. */
  public static Ir.Call callDpsPacked(
      Ir.Expr func, Ir.Tuple args, StructInfo outSinfo) {
    return ir.call(
        Pos.ZERO,
        ir.op(CALL_DPS_PACKED),
        ImmutableList.of(func, args),
        null,
        ImmutableList.of(outSinfo));
  }

  /** The struct info of the result is the declared one. */
  static StructInfo inferCallTir(Ir.Call call, InferContext ctx) {
    if (call.sinfoArgs.size() != 1) {
      throw ctx.reportFatal(
          call, "sinfo_args should have exactly 1 output struct info.");
    }
    return call.sinfoArgs.get(0);
  }

  /**
   * Prints a call as {@code R.call_tir(func, (args), out_sinfo=...,
   * tir_vars=...)}, {@code R.dist.call_tir(...)} if an output is a
   * distributed tensor, or {@code R.call_dps_packed("func", (args),
   * out_sinfo=...)}.
   */
  static @Nullable Doc print(Ir.Call call, ObjectPath path, IrDocsifier d) {
    final boolean isCallTir = call.isCallTo(CALL_TIR);
    if (!isCallTir && !call.isCallTo(CALL_DPS_PACKED)) {
      return null;
    }
    checkArgument(
        call.args.size() == 2 || call.args.size() == 3,
        "%s must have 2 or 3 arguments: %s",
        call.calleeName(),
        call.args.size());
    checkArgument(
        call.sinfoArgs.size() == 1,
        "%s must have exactly one sinfo arg: %s",
        call.calleeName(),
        call.sinfoArgs.size());
    final List<Doc> args = new ArrayList<>();
    final List<Pair<String, Doc>> kwargs = new ArrayList<>();
    final ObjectPath argsPath = path.attr("args");

    // Step 1. The callee, and its input arguments
    args.add(
        CallExprPrinter.calleeArgDoc(
            call.args.get(0), argsPath.arrayIndex(0), d));
    args.add(d.asDoc(call.args.get(1), argsPath.arrayIndex(1)));

    // Step 2. The output struct info
    final StructInfo outSinfo = call.sinfoArgs.get(0);
    final ObjectPath outPath = path.attr("sinfo_args").arrayIndex(0);
    boolean distributed = false;
    if (outSinfo instanceof TupleStructInfo) {
      final List<StructInfo> fields = ((TupleStructInfo) outSinfo).fields;
      final List<Doc> fieldDocs = new ArrayList<>();
      for (int i = 0; i < fields.size(); i++) {
        if (fields.get(i) instanceof DTensorStructInfo) {
          distributed = true;
        }
        fieldDocs.add(
            d.asDoc(fields.get(i), outPath.attr("fields").arrayIndex(i)));
      }
      kwargs.add(Pair.of("out_sinfo", new Doc.ListDoc(fieldDocs)));
    } else {
      distributed = outSinfo instanceof DTensorStructInfo;
      kwargs.add(Pair.of("out_sinfo", d.asDoc(outSinfo, outPath)));
    }
    if (!isCallTir) {
      return d.prefixed("call_dps_packed").call(args, kwargs);
    }

    // Step 3. Values of symbolic variables
    if (call.args.size() == 3) {
      kwargs.add(
          Pair.of(
              "tir_vars", d.asDoc(call.args.get(2), argsPath.arrayIndex(2))));
    }
    return d.prefixed(distributed ? "dist.call_tir" : "call_tir")
        .call(args, kwargs);
  }
}

// End CallTir.java
