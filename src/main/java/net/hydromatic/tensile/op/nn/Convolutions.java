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
package net.hydromatic.tensile.op.nn;

import static net.hydromatic.tensile.ast.Arith.arith;
import static net.hydromatic.tensile.ast.IrBuilder.ir;
import static net.hydromatic.tensile.compile.OpCommon.broadcastTo2;
import static net.hydromatic.tensile.compile.OpCommon.checkGroups;
import static net.hydromatic.tensile.compile.OpCommon.checkLength;
import static net.hydromatic.tensile.compile.OpCommon.checkTensorLayout;
import static net.hydromatic.tensile.compile.OpCommon.completePadding2d;
import static net.hydromatic.tensile.compile.OpCommon.inferBinaryArithOutDtype;
import static net.hydromatic.tensile.compile.OpCommon.inputTensorStructInfo;
import static net.hydromatic.tensile.compile.OpCommon.shapeIfRankMatches;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tensile.arith.Analyzer;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.PrimExpr;
import net.hydromatic.tensile.compile.InferContext;
import net.hydromatic.tensile.compile.OpDef;
import net.hydromatic.tensile.layout.BijectiveLayout;
import net.hydromatic.tensile.layout.Layout;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TensorStructInfo;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** 2-D convolution and transposed 2-D convolution. */
public final class Convolutions {
  private Convolutions() {}

  public static final String CONV2D = "relax.nn.conv2d";
  public static final String CONV2D_TRANSPOSE = "relax.nn.conv2d_transpose";

  /** Definition of the "relax.nn.conv2d" operator. */
  public static final OpDef CONV2D_DEF =
      OpDef.builder(CONV2D)
          .numInputs(2)
          .addArgument("data", "Tensor", "The input tensor.")
          .addArgument("weight", "Tensor", "The weight tensor.")
          .attrsTypeKey(Conv2DAttrs.TYPE_KEY)
          .inferrer(Convolutions::inferConv2d)
          .build();

  /** Definition of the "relax.nn.conv2d_transpose" operator. */
  public static final OpDef CONV2D_TRANSPOSE_DEF =
      OpDef.builder(CONV2D_TRANSPOSE)
          .numInputs(2)
          .addArgument("data", "Tensor", "The input tensor.")
          .addArgument("weight", "Tensor", "The weight tensor.")
          .attrsTypeKey(Conv2DTransposeAttrs.TYPE_KEY)
          .inferrer(Convolutions::inferConv2dTranspose)
          .build();

  /**
   * Creates a call to 2-D convolution.
   *
   * @param data Input, such as a batch of images
   * @param weight Kernel
   * @param strides Strides; 1 or 2 values
   * @param padding Padding; 1, 2 or 4 values
   * @param dilation Dilation; 1 or 2 values
   * @param groups Number of groups into which the channels are split
   * @param dataLayout Layout of the data, such as "NCHW"
   * @param kernelLayout Layout of the kernel, such as "OIHW"
   * @param outLayout Layout of the output; if null, same as the data
   * @param outDtype Data type of the output; if void, derived from the inputs
   * @throws net.hydromatic.tensile.compile.ConstructionException if the
   *     attributes are invalid
   */
  public static Ir.Call conv2d(
      Ir.Expr data,
      Ir.Expr weight,
      List<Long> strides,
      List<Long> padding,
      List<Long> dilation,
      int groups,
      String dataLayout,
      String kernelLayout,
      @Nullable String outLayout,
      DataType outDtype) {
    final ImmutableList<Long> padding4 = completePadding2d(padding);
    final ImmutableList<Long> strides2 = broadcastTo2(strides);
    final ImmutableList<Long> dilation2 = broadcastTo2(dilation);
    checkGroups(groups);
    checkLength(strides2, "strides", 2);
    checkLength(dilation2, "dilation", 2);
    final Conv2DAttrs attrs =
        new Conv2DAttrs(
            strides2,
            padding4,
            dilation2,
            groups,
            dataLayout,
            kernelLayout,
            outLayout == null ? dataLayout : outLayout,
            outDtype);
    return ir.call(ir.op(CONV2D), ImmutableList.of(data, weight), attrs);
  }

  /** Creates a call to 2-D convolution with default attributes: unit
   * strides and dilation, no padding, one group, NCHW data and OIHW
   * kernel. */
  public static Ir.Call conv2d(Ir.Expr data, Ir.Expr weight) {
    return conv2d(
        data,
        weight,
        ImmutableList.of(1L, 1L),
        ImmutableList.of(0L, 0L),
        ImmutableList.of(1L, 1L),
        1,
        "NCHW",
        "OIHW",
        null,
        DataType.VOID);
  }

  /**
   * Creates a call to transposed 2-D convolution.
   *
   * <p>Parameters are as {@link #conv2d}, plus {@code outputPadding} (1 or 2
   * values); the kernel layout is typically "IOHW".
   */
  public static Ir.Call conv2dTranspose(
      Ir.Expr data,
      Ir.Expr weight,
      List<Long> strides,
      List<Long> padding,
      List<Long> outputPadding,
      List<Long> dilation,
      int groups,
      String dataLayout,
      String kernelLayout,
      @Nullable String outLayout,
      DataType outDtype) {
    final ImmutableList<Long> padding4 = completePadding2d(padding);
    final ImmutableList<Long> outputPadding2 = broadcastTo2(outputPadding);
    final ImmutableList<Long> strides2 = broadcastTo2(strides);
    final ImmutableList<Long> dilation2 = broadcastTo2(dilation);
    checkGroups(groups);
    checkLength(outputPadding2, "output_padding", 2);
    checkLength(strides2, "strides", 2);
    checkLength(dilation2, "dilation", 2);
    final Conv2DTransposeAttrs attrs =
        new Conv2DTransposeAttrs(
            strides2,
            padding4,
            outputPadding2,
            dilation2,
            groups,
            dataLayout,
            kernelLayout,
            outLayout == null ? dataLayout : outLayout,
            outDtype);
    return ir.call(
        ir.op(CONV2D_TRANSPOSE), ImmutableList.of(data, weight), attrs);
  }

  /** Creates a call to transposed 2-D convolution with default
   * attributes. */
  public static Ir.Call conv2dTranspose(Ir.Expr data, Ir.Expr weight) {
    return conv2dTranspose(
        data,
        weight,
        ImmutableList.of(1L, 1L),
        ImmutableList.of(0L, 0L),
        ImmutableList.of(0L, 0L),
        ImmutableList.of(1L, 1L),
        1,
        "NCHW",
        "IOHW",
        null,
        DataType.VOID);
  }

  /** Infers the struct info of a call to "relax.nn.conv2d". */
  static StructInfo inferConv2d(Ir.Call call, InferContext ctx) {
    final List<TensorStructInfo> inputs =
        inputTensorStructInfo(call, CONV2D_DEF, ctx);
    final TensorStructInfo data = inputs.get(0);
    final TensorStructInfo weight = inputs.get(1);
    final Conv2DAttrs attrs = call.attrs(Conv2DAttrs.class);

    final Pair<Layout, BijectiveLayout> dataLayout =
        checkTensorLayout(call, ctx, attrs.dataLayout, "NCHW", "data");
    final Pair<Layout, BijectiveLayout> weightLayout =
        checkTensorLayout(call, ctx, attrs.kernelLayout, "OIHW", "kernel");
    final Pair<Layout, BijectiveLayout> outLayout =
        checkTensorLayout(call, ctx, attrs.outLayout, "NCHW", "output");

    final List<PrimExpr> dataShape = shapeIfRankMatches(data, dataLayout.left);
    final List<PrimExpr> weightShape =
        shapeIfRankMatches(weight, weightLayout.left);

    final DataType outDtype =
        attrs.outDtype.isVoid()
            ? inferBinaryArithOutDtype(call, ctx, data, weight)
            : attrs.outDtype;
    if (dataShape == null || weightShape == null) {
      return TensorStructInfo.ofNdim(outDtype, outLayout.left.ndim());
    }

    final List<PrimExpr> dataNchw = dataLayout.right.forwardShape(dataShape);
    final List<PrimExpr> weightOihw =
        weightLayout.right.forwardShape(weightShape);

    final PrimExpr groups = arith.intImm(attrs.groups);
    final PrimExpr channelData = dataNchw.get(1);
    final PrimExpr channelKernel = weightOihw.get(1);
    ctx.require(
        call,
        arith.eq(channelData, arith.mul(channelKernel, groups)),
        () -> "The channel size of the data should equal to the product of "
            + "input channel size of the weight and the number of groups. "
            + "However, the data channel size is "
            + channelData
            + " while the weight input channel size and number of groups "
            + "are "
            + channelKernel
            + " and "
            + groups);
    ctx.require(
        call,
        arith.eq(arith.floorMod(weightOihw.get(0), groups), arith.intImm(0)),
        () -> "Conv2d expects the number of output channels to be divisible "
            + "by the number of groups. However, the number of output "
            + "channels is "
            + weightOihw.get(0)
            + " while the number of groups is "
            + groups);

    final Analyzer analyzer = ctx.analyzer;
    final PrimExpr outH =
        outExtent(
            analyzer,
            dataNchw.get(2),
            weightOihw.get(2),
            attrs.padding.get(0) + attrs.padding.get(2),
            attrs.dilation.get(0),
            attrs.strides.get(0));
    final PrimExpr outW =
        outExtent(
            analyzer,
            dataNchw.get(3),
            weightOihw.get(3),
            attrs.padding.get(1) + attrs.padding.get(3),
            attrs.dilation.get(1),
            attrs.strides.get(1));
    final List<PrimExpr> outNchw =
        ImmutableList.of(dataNchw.get(0), weightOihw.get(0), outH, outW);
    return TensorStructInfo.of(
        outLayout.right.backwardShape(outNchw), outDtype);
  }

  /** Returns the extent of a spatial axis of the output of a convolution:
   * {@code (in + pad - dilation * (k - 1) - 1) // stride + 1}. */
  private static PrimExpr outExtent(
      Analyzer analyzer,
      PrimExpr in,
      PrimExpr kernel,
      long pad,
      long dilation,
      long stride) {
    final PrimExpr numerator =
        arith.sub(
            arith.sub(
                arith.add(in, pad),
                arith.mul(arith.intImm(dilation), arith.sub(kernel, 1))),
            1);
    return analyzer.simplify(arith.add(arith.floorDiv(numerator, stride), 1));
  }

  /** Infers the struct info of a call to "relax.nn.conv2d_transpose". */
  static StructInfo inferConv2dTranspose(Ir.Call call, InferContext ctx) {
    final List<TensorStructInfo> inputs =
        inputTensorStructInfo(call, CONV2D_TRANSPOSE_DEF, ctx);
    final TensorStructInfo data = inputs.get(0);
    final TensorStructInfo weight = inputs.get(1);
    final Conv2DTransposeAttrs attrs = call.attrs(Conv2DTransposeAttrs.class);

    final Pair<Layout, BijectiveLayout> dataLayout =
        checkTensorLayout(call, ctx, attrs.dataLayout, "NCHW", "data");
    final Pair<Layout, BijectiveLayout> weightLayout =
        checkTensorLayout(call, ctx, attrs.kernelLayout, "IOHW", "kernel");
    final Pair<Layout, BijectiveLayout> outLayout =
        checkTensorLayout(call, ctx, attrs.outLayout, "NCHW", "output");

    final List<PrimExpr> dataShape = shapeIfRankMatches(data, dataLayout.left);
    final List<PrimExpr> weightShape =
        shapeIfRankMatches(weight, weightLayout.left);

    final DataType outDtype =
        attrs.outDtype.isVoid()
            ? inferBinaryArithOutDtype(call, ctx, data, weight)
            : attrs.outDtype;
    if (dataShape == null || weightShape == null) {
      return TensorStructInfo.ofNdim(outDtype, outLayout.left.ndim());
    }

    final List<PrimExpr> dataNchw = dataLayout.right.forwardShape(dataShape);
    final List<PrimExpr> weightIohw =
        weightLayout.right.forwardShape(weightShape);

    final PrimExpr groups = arith.intImm(attrs.groups);
    final PrimExpr channelData = dataNchw.get(1);
    final PrimExpr channelKernel = weightIohw.get(0);
    ctx.require(
        call,
        arith.eq(channelData, channelKernel),
        () -> "Conv2dTranspose expects the channel size of the data should "
            + "equal to the input channel size of the weight. However, the "
            + "data channel size is "
            + channelData
            + " while the weight input channel size is "
            + channelKernel);
    ctx.require(
        call,
        arith.eq(arith.floorMod(channelKernel, groups), arith.intImm(0)),
        () -> "Conv2dTranspose expects the number of input channels to be "
            + "divisible by the number of groups. However, the number of "
            + "input channels is "
            + channelKernel
            + " while the number of groups is "
            + groups);
    ctx.require(
        call,
        arith.and(
            arith.lt(
                arith.intImm(attrs.outputPadding.get(0)),
                arith.intImm(attrs.strides.get(0))),
            arith.lt(
                arith.intImm(attrs.outputPadding.get(1)),
                arith.intImm(attrs.strides.get(1)))),
        () -> "Conv2dTranspose expects the output padding less than the "
            + "strides, but the output padding is "
            + attrs.outputPadding
            + " while the strides are "
            + attrs.strides);

    final Analyzer analyzer = ctx.analyzer;
    final PrimExpr outH =
        transposeOutExtent(
            analyzer,
            dataNchw.get(2),
            weightIohw.get(2),
            attrs.padding.get(0) + attrs.padding.get(2),
            attrs.dilation.get(0),
            attrs.strides.get(0),
            attrs.outputPadding.get(0));
    final PrimExpr outW =
        transposeOutExtent(
            analyzer,
            dataNchw.get(3),
            weightIohw.get(3),
            attrs.padding.get(1) + attrs.padding.get(3),
            attrs.dilation.get(1),
            attrs.strides.get(1),
            attrs.outputPadding.get(1));
    final List<PrimExpr> outNchw =
        ImmutableList.of(
            dataNchw.get(0),
            analyzer.simplify(arith.mul(weightIohw.get(1), groups)),
            outH,
            outW);
    return TensorStructInfo.of(
        outLayout.right.backwardShape(outNchw), outDtype);
  }

  /** Returns the extent of a spatial axis of the output of a transposed
   * convolution: {@code (in - 1) * stride - pad + dilation * (k - 1)
   * + outputPadding + 1}. */
  private static PrimExpr transposeOutExtent(
      Analyzer analyzer,
      PrimExpr in,
      PrimExpr kernel,
      long pad,
      long dilation,
      long stride,
      long outputPadding) {
    final PrimExpr e =
        arith.add(
            arith.add(
                arith.add(
                    arith.sub(arith.mul(arith.sub(in, 1), stride), pad),
                    arith.mul(arith.intImm(dilation), arith.sub(kernel, 1))),
                outputPadding),
            1);
    return analyzer.simplify(e);
  }
}

// End Convolutions.java
