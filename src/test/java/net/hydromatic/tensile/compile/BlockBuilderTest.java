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
import static net.hydromatic.tensile.Matchers.hasStructInfo;
import static net.hydromatic.tensile.Matchers.isStructInfo;
import static net.hydromatic.tensile.ast.Arith.arith;
import static net.hydromatic.tensile.ast.IrBuilder.ir;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.PrimExpr;
import net.hydromatic.tensile.op.nn.Convolutions;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TensorStructInfo;
import org.apache.calcite.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link BlockBuilder}. */
public class BlockBuilderTest {
  @Test void testNormalizeCall() {
    final Fixture f = new Fixture();
    final List<Pair<Ir.Call, StructInfo>> events = new ArrayList<>();
    final BlockBuilder bb =
        new BlockBuilder(OpRegistry.builtIn(),
            Tracers.withOnStructInfo(Tracers.empty(),
                (call, sinfo) -> events.add(Pair.of(call, sinfo))),
            ImmutableMap.of());
    final Ir.Call call = Convolutions.conv2d(f.x, f.w);
    assertThat(call.structInfo == null, is(true));

    final Ir.Call call2 = bb.normalize(call);
    assertThat(call2,
        hasStructInfo("R.Tensor((1, 6, 5, 5), dtype=\"float32\")"));
    assertThat(events, hasSize(1));
    assertThat(events.get(0).left, sameInstance(call2));

    // A call that already has struct info is not inferred again
    assertThat(bb.normalize(call2), sameInstance(call2));
    assertThat(events, hasSize(1));
  }

  @Test void testNormalizeNested() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = BlockBuilder.create();
    final Ir.Var w2 =
        ir.var("w2", TensorStructInfo.of(DataType.FLOAT32, 2, 6, 3, 3));
    // The inner call is normalized before the outer call needs its struct
    // info
    final Ir.Call call =
        Convolutions.conv2d(Convolutions.conv2d(f.x, f.w), w2);
    final Ir.Call call2 = bb.normalize(call);
    assertThat(call2,
        hasStructInfo("R.Tensor((1, 2, 3, 3), dtype=\"float32\")"));
    assertThat(call2.args.get(0),
        hasStructInfo("R.Tensor((1, 6, 5, 5), dtype=\"float32\")"));
  }

  @Test void testNormalizeTuple() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = BlockBuilder.create();
    final Ir.Expr tuple =
        bb.normalize(ir.tuple(f.x, Convolutions.conv2d(f.x, f.w)));
    assertThat(tuple,
        hasStructInfo("R.Tuple(R.Tensor((1, 3, 7, 7), dtype=\"float32\"), "
            + "R.Tensor((1, 6, 5, 5), dtype=\"float32\"))"));
  }

  @Test void testEmit() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = BlockBuilder.create();
    final Ir.Var y = bb.emit("y", Convolutions.conv2d(f.x, f.w));
    assertThat(y, hasToString("y"));
    assertThat(y, hasStructInfo("R.Tensor((1, 6, 5, 5), dtype=\"float32\")"));
    final Ir.Var z =
        bb.emit("z", Convolutions.conv2dTranspose(y, f.wt));
    assertThat(z, hasStructInfo("R.Tensor((1, 3, 7, 7), dtype=\"float32\")"));

    final List<Pair<Ir.Var, Ir.Expr>> bindings = bb.bindings();
    assertThat(bindings, hasSize(2));
    assertThat(bindings.get(0).left, sameInstance(y));
    assertThat(
        ((Ir.Call) bindings.get(1).right)
            .isCallTo(Convolutions.CONV2D_TRANSPOSE),
        is(true));
  }

  @Test void testExternFunc() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = BlockBuilder.create();
    final TensorStructInfo sinfo = TensorStructInfo.of(DataType.INT64, 5);
    final Ir.Call call =
        ir.call(f.x.pos, ir.externFunc("my_func"), ImmutableList.of(f.x),
            null, ImmutableList.of(sinfo));
    assertThat(bb.normalize(call).structInfo, is((StructInfo) sinfo));

    // Without declared struct info, the result is an object
    final Ir.Call call2 =
        ir.call(ir.externFunc("my_func"), ImmutableList.of(f.x), null);
    assertThat(bb.normalize(call2).structInfo, isStructInfo("R.Object"));

    final Ir.Call call3 =
        ir.call(ir.globalVar("main"), ImmutableList.of(f.x), null);
    assertThat(bb.normalize(call3).structInfo, isStructInfo("R.Object"));
  }

  @Test void testUnknownOperator() {
    final Fixture f = new Fixture();
    final List<CompileException> errors = new ArrayList<>();
    final BlockBuilder bb =
        new BlockBuilder(OpRegistry.builtIn(),
            Tracers.withOnCompileException(Tracers.empty(), errors::add),
            ImmutableMap.of());
    final Ir.Call call =
        ir.call(ir.op("relax.nn.conv3d"), ImmutableList.of(f.x, f.w), null);
    final TypeException e =
        assertThrows(TypeException.class, () -> bb.normalize(call));
    assertThat(e,
        hasMessage("Operator relax.nn.conv3d does not have a struct info "
            + "inference function"));
    assertThat(e.opName(), is("relax.nn.conv3d"));
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0), sameInstance(e));
  }

  @Test void testDeferredAssumptions() {
    final Fixture f = new Fixture();
    final List<DeferredAssumption> assumptions = new ArrayList<>();
    final Map<Prop, Object> props =
        ImmutableMap.of(Prop.REPORT_DEFERRED_ASSUMPTIONS, true);
    final BlockBuilder bb =
        new BlockBuilder(OpRegistry.builtIn(),
            Tracers.withOnDeferredAssumption(Tracers.empty(),
                assumptions::add),
            props);
    final Ir.Var y = bb.emit("y", Convolutions.conv2d(f.xSym, f.wSym));
    assertThat(y,
        hasStructInfo("R.Tensor((n, o, h - 2, w - 2), dtype=\"float32\")"));
    assertThat(assumptions, hasSize(1));
    assertThat(assumptions.get(0),
        hasToString("relax.nn.conv2d: assumed c == ci"));
    assertThat(bb.context().deferredAssumptions(), is(assumptions));
  }

  @Test void testDeferredAssumptionsNotReported() {
    final Fixture f = new Fixture();
    final BlockBuilder bb = BlockBuilder.create();
    bb.emit("y", Convolutions.conv2d(f.xSym, f.wSym));
    assertThat(bb.context().deferredAssumptions(), hasSize(0));
  }

  /** Variables used in tests. */
  private static class Fixture {
    final Ir.Var x =
        ir.var("x", TensorStructInfo.of(DataType.FLOAT32, 1, 3, 7, 7));
    final Ir.Var w =
        ir.var("w", TensorStructInfo.of(DataType.FLOAT32, 6, 3, 3, 3));
    final Ir.Var wt =
        ir.var("wt", TensorStructInfo.of(DataType.FLOAT32, 6, 3, 3, 3));

    final PrimExpr n = arith.sizeVar("n");
    final PrimExpr c = arith.sizeVar("c");
    final PrimExpr h = arith.sizeVar("h");
    final PrimExpr wd = arith.sizeVar("w");
    final PrimExpr o = arith.sizeVar("o");
    final PrimExpr ci = arith.sizeVar("ci");
    final Ir.Var xSym =
        ir.var("x",
            TensorStructInfo.of(ImmutableList.of(n, c, h, wd),
                DataType.FLOAT32));
    final Ir.Var wSym =
        ir.var("w",
            TensorStructInfo.of(
                ImmutableList.of(o, ci, arith.intImm(3), arith.intImm(3)),
                DataType.FLOAT32));
  }
}

// End BlockBuilderTest.java
