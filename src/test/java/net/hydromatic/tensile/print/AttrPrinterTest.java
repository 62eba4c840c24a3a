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
package net.hydromatic.tensile.print;

import static net.hydromatic.tensile.ast.Arith.arith;
import static net.hydromatic.tensile.ast.IrBuilder.ir;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.attr.AttrField;
import net.hydromatic.tensile.attr.AttrValue;
import net.hydromatic.tensile.attr.Attrs;
import net.hydromatic.tensile.attr.DictAttrs;
import net.hydromatic.tensile.op.nn.Conv2DAttrs;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.TensorStructInfo;
import org.apache.calcite.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link AttrPrinter}. */
public class AttrPrinterTest {
  private static List<Pair<String, Doc>> print(Attrs attrs) {
    return AttrPrinter.print(attrs, ObjectPath.root().attr("attrs"),
        IrDocsifier.create());
  }

  @Test void testKinds() {
    final Fixture f = new Fixture();
    final List<Pair<String, Doc>> docs =
        print(
            new Fixture.MyAttrs(
                ImmutableList.of(
                    AttrField.of("d", AttrValue.ofDouble(0.25)),
                    AttrField.of("i", AttrValue.ofInt(-4)),
                    AttrField.of("u", AttrValue.ofUnsigned(7)),
                    AttrField.of("b", AttrValue.ofBool(false)),
                    AttrField.of("s", AttrValue.ofString("same")),
                    AttrField.of("t", AttrValue.ofDtype(DataType.INT64)),
                    AttrField.of("o", AttrValue.ofObject(null)),
                    AttrField.of("e", AttrValue.ofObject(f.shape)),
                    AttrField.of("p",
                        AttrValue.ofObject(arith.sizeVar("n"))))));
    assertThat(Pair.left(docs),
        is(ImmutableList.of("d", "i", "u", "b", "s", "t", "o", "e", "p")));
    assertThat(Pair.right(docs).toString(),
        is("[0.25, -4, 7, False, \"same\", \"int64\", None, "
            + "R.shape([2, 3]), n]"));
  }

  @Test void testConv2dAttrs() {
    final Conv2DAttrs attrs =
        new Conv2DAttrs(ImmutableList.of(1L, 1L), ImmutableList.of(0L, 0L,
            0L, 0L), ImmutableList.of(1L, 1L), 1, "NCHW", "OIHW", "NCHW",
            DataType.VOID);
    assertThat(attrs.typeKey(), is("relax.attrs.Conv2DAttrs"));
    assertThat(Pair.left(print(attrs)),
        is(
            ImmutableList.of("strides", "padding", "dilation", "groups",
                "data_layout", "kernel_layout", "out_layout", "out_dtype")));
  }

  @Test void testDictAttrsSorted() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("zeta", 3L);
    map.put("alpha", "a");
    map.put("mid", true);
    final List<Pair<String, Doc>> docs = print(DictAttrs.of(map));
    assertThat(Pair.left(docs), is(ImmutableList.of("alpha", "mid", "zeta")));
    assertThat(Pair.right(docs).toString(), is("[\"a\", True, 3]"));
  }

  @Test void testOpaque() {
    final PrinterTypeException e =
        assertThrows(PrinterTypeException.class,
            () -> print(
                new Fixture.MyAttrs(
                    ImmutableList.of(
                        AttrField.of("a", AttrValue.ofInt(1)),
                        AttrField.of("handle",
                            AttrValue.ofOpaque(new Object()))))));
    assertThat(e.getMessage(), is("TypeError: void is not allowed in Attrs"));
    assertThat(e.path(), hasToString("<root>.attrs.handle"));
  }

  @Test void testNdArray() {
    final Fixture f = new Fixture();
    final Ir.Call call =
        ir.call(ir.op("relax.my_op"), ImmutableList.of(f.x),
            new Fixture.MyAttrs(
                ImmutableList.of(
                    AttrField.of("data",
                        AttrValue.ofNdArray(new float[] {1f, 2f})))));
    final PrinterTypeException e =
        assertThrows(PrinterTypeException.class, call::toString);
    assertThat(e.getMessage(),
        is("TypeError: NDArray is not allowed in Attrs"));
    assertThat(e.path(), hasToString("<root>.attrs.data"));
  }

  /** Values used in tests. */
  private static class Fixture {
    final Ir.Var x =
        ir.var("x", TensorStructInfo.of(DataType.FLOAT32, 2, 3));
    final Ir.ShapeExpr shape =
        ir.shape(ImmutableList.of(arith.intImm(2), arith.intImm(3)));

    /** Attributes with arbitrary fields. */
    static class MyAttrs implements Attrs {
      final ImmutableList<AttrField> fields;

      MyAttrs(ImmutableList<AttrField> fields) {
        this.fields = fields;
      }

      @Override public String typeKey() {
        return "test.MyAttrs";
      }

      @Override public List<AttrField> fields() {
        return fields;
      }
    }
  }
}

// End AttrPrinterTest.java
