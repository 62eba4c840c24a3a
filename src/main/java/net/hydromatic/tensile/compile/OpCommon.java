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
package net.hydromatic.tensile.compile;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.PrimExpr;
import net.hydromatic.tensile.layout.BijectiveLayout;
import net.hydromatic.tensile.layout.Layout;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TensorStructInfo;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities shared by the definitions of operators. */
public final class OpCommon {
  private OpCommon() {}

  /**
   * Returns the struct info of each argument of a call, checking that there
   * are as many arguments as the operator has inputs and that each is a
   * tensor.
   */
  public static ImmutableList<TensorStructInfo> inputTensorStructInfo(
      Ir.Call call, OpDef def, InferContext ctx) {
    if (call.args.size() != def.numInputs) {
      throw ctx.reportFatal(
          call, def.name + " op should have " + def.numInputs + " arguments");
    }
    final ImmutableList.Builder<TensorStructInfo> list =
        ImmutableList.builder();
    for (int i = 0; i < call.args.size(); i++) {
      final StructInfo sinfo = call.args.get(i).structInfo;
      if (!(sinfo instanceof TensorStructInfo)) {
        throw ctx.reportFatal(
            call,
            def.name
                + " requires the input "
                + def.arguments.get(i).name
                + " to be Tensor. However, the given one has a "
                + (sinfo == null ? "null" : sinfo.getClass().getSimpleName()));
      }
      list.add((TensorStructInfo) sinfo);
    }
    return list.build();
  }

  /**
   * Parses a tensor's layout and creates the conversion to the operator's
   * canonical layout.
   *
   * @param layout Layout given in the call's attributes, such as "NHWC"
   * @param target Canonical layout, such as "NCHW"
   * @param tensorName Name of the tensor for messages, such as "data"
   */
  public static Pair<Layout, BijectiveLayout> checkTensorLayout(
      Ir.Call call,
      InferContext ctx,
      String layout,
      String target,
      String tensorName) {
    final Layout src = Layout.tryParse(layout);
    final BijectiveLayout bijective =
        src == null ? null : BijectiveLayout.of(src, Layout.of(target));
    if (src == null || bijective == null) {
      throw ctx.reportFatal(
          call,
          call.calleeName()
              + " requires the given "
              + tensorName
              + " layout to be convertible from "
              + target
              + " layout. However, the given layout "
              + layout
              + " is not convertible.");
    }
    return Pair.of(src, bijective);
  }

  /**
   * Returns the shape of a tensor if it is known and has the rank of its
   * layout; otherwise null, and the caller gives up on computing the output
   * shape.
   */
  public static @Nullable ImmutableList<PrimExpr> shapeIfRankMatches(
      TensorStructInfo sinfo, Layout layout) {
    if (!sinfo.isUnknownNdim() && sinfo.ndim != layout.ndim()) {
      return null;
    }
    return sinfo.shape;
  }

  /**
   * Returns the data type of the result of a binary arithmetic operator:
   * void if either input's is unknown, otherwise their common type.
   */
  public static DataType inferBinaryArithOutDtype(
      Ir.Call call,
      InferContext ctx,
      TensorStructInfo lhs,
      TensorStructInfo rhs) {
    if (lhs.dtype.isVoid() || rhs.dtype.isVoid()) {
      return DataType.VOID;
    }
    if (!lhs.dtype.equals(rhs.dtype)) {
      throw ctx.reportFatal(
          call,
          "Data types "
              + lhs.dtype
              + " and "
              + rhs.dtype
              + " must be equal for binary operators");
    }
    return lhs.dtype;
  }

  /**
   * Expands a padding of 1, 2 or 4 values to 4 values: top, left, bottom,
   * right.
   *
   * <p>One value pads every side; two values are the vertical and horizontal
   * padding.
   */
  public static ImmutableList<Long> completePadding2d(List<Long> padding) {
    switch (padding.size()) {
      case 1:
        return ImmutableList.of(
            padding.get(0), padding.get(0), padding.get(0), padding.get(0));
      case 2:
        return ImmutableList.of(
            padding.get(0), padding.get(1), padding.get(0), padding.get(1));
      case 4:
        return ImmutableList.copyOf(padding);
      default:
        throw new ConstructionException(
            "The input padding length is expected to be 1, 2 or 4. However, "
                + "the given padding is "
                + padding);
    }
  }

  /** Repeats the value of a list of length 1; other lists are unchanged. */
  public static ImmutableList<Long> broadcastTo2(List<Long> values) {
    if (values.size() == 1) {
      return ImmutableList.of(values.get(0), values.get(0));
    }
    return ImmutableList.copyOf(values);
  }

  /** Checks that a list attribute has the expected length. */
  public static void checkLength(
      List<Long> values, String name, int expected) {
    if (values.size() != expected) {
      throw new ConstructionException(
          "The input "
              + name
              + " length is expected to be "
              + expected
              + ". However, the given "
              + name
              + " is "
              + values);
    }
  }

  /** Checks that the number of groups of a convolution is positive. */
  public static void checkGroups(int groups) {
    if (groups <= 0) {
      throw new ConstructionException(
          "The number of groups in convolution is expected to be positive. "
              + "However, the given number of groups is "
              + groups);
    }
  }
}

// End OpCommon.java
