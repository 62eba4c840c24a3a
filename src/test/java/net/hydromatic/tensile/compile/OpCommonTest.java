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

import static net.hydromatic.tensile.Matchers.hasMessage;
import static net.hydromatic.tensile.ast.IrBuilder.ir;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.tensile.arith.Analyzer;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.layout.Layout;
import net.hydromatic.tensile.op.nn.Convolutions;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.TensorStructInfo;
import org.junit.jupiter.api.Test;

/** Tests for {@link OpCommon}. */
public class OpCommonTest {
  private static void checkPadding(List<Long> padding, List<Long> expected) {
    assertThat(OpCommon.completePadding2d(padding), is(expected));
  }

  @Test void testCompletePadding() {
    checkPadding(ImmutableList.of(1L), ImmutableList.of(1L, 1L, 1L, 1L));
    checkPadding(ImmutableList.of(1L, 2L), ImmutableList.of(1L, 2L, 1L, 2L));
    checkPadding(ImmutableList.of(1L, 2L, 3L, 4L),
        ImmutableList.of(1L, 2L, 3L, 4L));

    final ConstructionException e =
        assertThrows(ConstructionException.class,
            () -> OpCommon.completePadding2d(ImmutableList.of(1L, 2L, 3L)));
    assertThat(e,
        hasMessage("The input padding length is expected to be 1, 2 or 4. "
            + "However, the given padding is [1, 2, 3]"));
    assertThrows(ConstructionException.class,
        () -> OpCommon.completePadding2d(ImmutableList.of()));
  }

  @Test void testBroadcast() {
    assertThat(OpCommon.broadcastTo2(ImmutableList.of(3L)),
        is(ImmutableList.of(3L, 3L)));
    assertThat(OpCommon.broadcastTo2(ImmutableList.of(3L, 4L)),
        is(ImmutableList.of(3L, 4L)));
    // Other lengths are left for checkLength to reject
    assertThat(OpCommon.broadcastTo2(ImmutableList.of(1L, 1L, 1L)),
        is(ImmutableList.of(1L, 1L, 1L)));
  }

  @Test void testCheckLength() {
    OpCommon.checkLength(ImmutableList.of(1L, 1L), "strides", 2);
    final ConstructionException e =
        assertThrows(ConstructionException.class,
            () -> OpCommon.checkLength(ImmutableList.of(1L, 1L, 1L),
                "strides", 2));
    assertThat(e,
        hasMessage("The input strides length is expected to be 2. "
            + "However, the given strides is [1, 1, 1]"));
  }

  @Test void testCheckGroups() {
    OpCommon.checkGroups(1);
    OpCommon.checkGroups(32);
    final ConstructionException e =
        assertThrows(ConstructionException.class,
            () -> OpCommon.checkGroups(0));
    assertThat(e,
        hasMessage("The number of groups in convolution is expected to be "
            + "positive. However, the given number of groups is 0"));
    assertThrows(ConstructionException.class,
        () -> OpCommon.checkGroups(-2));
  }

  @Test void testBinaryArithOutDtype() {
    final Fixture f = new Fixture();
    final TensorStructInfo float32 =
        TensorStructInfo.ofNdim(DataType.FLOAT32, 4);
    final TensorStructInfo float16 =
        TensorStructInfo.ofNdim(DataType.FLOAT16, 4);
    final TensorStructInfo unknown =
        TensorStructInfo.ofNdim(DataType.VOID, 4);
    assertThat(
        OpCommon.inferBinaryArithOutDtype(f.call, f.ctx, float32, float32),
        is(DataType.FLOAT32));
    assertThat(
        OpCommon.inferBinaryArithOutDtype(f.call, f.ctx, float32, unknown),
        is(DataType.VOID));
    assertThat(
        OpCommon.inferBinaryArithOutDtype(f.call, f.ctx, unknown, float16),
        is(DataType.VOID));
    final TypeException e =
        assertThrows(TypeException.class,
            () -> OpCommon.inferBinaryArithOutDtype(f.call, f.ctx, float32,
                float16));
    assertThat(e,
        hasMessage("Data types float32 and float16 must be equal for "
            + "binary operators"));
    assertThat(e.opName(), is("relax.nn.conv2d"));
  }

  @Test void testCheckTensorLayout() {
    final Fixture f = new Fixture();
    assertThat(
        OpCommon.checkTensorLayout(f.call, f.ctx, "NHWC", "NCHW", "data")
            .right.isIdentity(),
        is(false));
    assertThat(
        OpCommon.checkTensorLayout(f.call, f.ctx, "NCHW", "NCHW", "data")
            .right.isIdentity(),
        is(true));
    final TypeException e =
        assertThrows(TypeException.class,
            () -> OpCommon.checkTensorLayout(f.call, f.ctx, "NCHW", "OIHW",
                "kernel"));
    assertThat(e,
        hasMessage("relax.nn.conv2d requires the given kernel layout to be "
            + "convertible from OIHW layout. However, the given layout "
            + "NCHW is not convertible."));
    assertThrows(TypeException.class,
        () -> OpCommon.checkTensorLayout(f.call, f.ctx, "nchw", "NCHW",
            "data"));
  }

  @Test void testShapeIfRankMatches() {
    final Layout nchw = Layout.of("NCHW");
    final TensorStructInfo t = TensorStructInfo.of(DataType.FLOAT32, 1, 2);
    assertThat(OpCommon.shapeIfRankMatches(t, nchw), nullValue());
    final TensorStructInfo t4 =
        TensorStructInfo.of(DataType.FLOAT32, 1, 2, 3, 4);
    assertThat(OpCommon.shapeIfRankMatches(t4, nchw), is(t4.shape));
    final TensorStructInfo unknown =
        TensorStructInfo.ofNdim(DataType.FLOAT32, -1);
    assertThat(OpCommon.shapeIfRankMatches(unknown, nchw), nullValue());
  }

  /** A call and a context in which to report errors about it. */
  private static class Fixture {
    final Ir.Var x =
        ir.var("x", TensorStructInfo.of(DataType.FLOAT32, 1, 3, 7, 7));
    final Ir.Var w =
        ir.var("w", TensorStructInfo.of(DataType.FLOAT32, 6, 3, 3, 3));
    final Ir.Call call = Convolutions.conv2d(x, w);
    final InferContext ctx =
        new InferContext(new Analyzer(), Tracers.empty(), ImmutableMap.of());
  }
}

// End OpCommonTest.java
