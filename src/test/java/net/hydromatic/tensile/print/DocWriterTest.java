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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.ast.Op;
import net.hydromatic.tensile.type.DataType;
import org.apache.calcite.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link DocWriter}. */
public class DocWriterTest {
  private static void check(Doc doc, String expected) {
    assertThat(new DocWriter(-1, 4).write(doc), is(expected));
  }

  private static Doc.IdDoc id(String name) {
    return new Doc.IdDoc(name);
  }

  @Test void testLiterals() {
    check(Doc.LiteralDoc.none(), "None");
    check(Doc.LiteralDoc.bool(true), "True");
    check(Doc.LiteralDoc.bool(false), "False");
    check(Doc.LiteralDoc.integer(-3), "-3");
    check(Doc.LiteralDoc.real(1.5), "1.5");
    check(Doc.LiteralDoc.str("a\"b\\c\nd"), "\"a\\\"b\\\\c\\nd\"");
    check(Doc.LiteralDoc.dtype(DataType.FLOAT16), "\"float16\"");
    check(Doc.LiteralDoc.dtype(DataType.VOID), "\"void\"");
  }

  @Test void testContainers() {
    check(new Doc.TupleDoc(ImmutableList.of()), "()");
    check(new Doc.TupleDoc(ImmutableList.of(id("a"))), "(a,)");
    check(new Doc.TupleDoc(ImmutableList.of(id("a"), id("b"))), "(a, b)");
    check(new Doc.ListDoc(ImmutableList.of()), "[]");
    check(new Doc.ListDoc(ImmutableList.of(id("a"))), "[a]");
    check(
        new Doc.DictDoc(
            ImmutableList.of(
                Pair.of(Doc.LiteralDoc.str("a"), Doc.LiteralDoc.integer(1)),
                Pair.of(Doc.LiteralDoc.str("b"), Doc.LiteralDoc.none()))),
        "{\"a\": 1, \"b\": None}");
  }

  @Test void testCall() {
    check(id("R").attr("nn").attr("conv2d"), "R.nn.conv2d");
    check(id("f").call(), "f()");
    check(id("f").call(id("x"), Doc.LiteralDoc.integer(2)), "f(x, 2)");
    check(
        id("f").call(ImmutableList.of(id("x")),
            ImmutableList.of(Pair.of("k", Doc.LiteralDoc.str("v")))),
        "f(x, k=\"v\")");
    check(
        id("f").call(ImmutableList.of(),
            ImmutableList.of(Pair.of("k", Doc.LiteralDoc.bool(true)))),
        "f(k=True)");
    final Doc.CallDoc call =
        id("f").call(ImmutableList.of(),
            ImmutableList.of(Pair.of("a", id("x")), Pair.of("b", id("y"))));
    assertThat(call.kwargKeys(), is(ImmutableList.of("a", "b")));
  }

  @Test void testOperation() {
    final Doc a = id("a");
    final Doc b = id("b");
    final Doc c = id("c");
    final Doc sum = new Doc.OperationDoc(Op.PLUS, ImmutableList.of(a, b));
    check(sum, "a + b");
    check(new Doc.OperationDoc(Op.TIMES, ImmutableList.of(sum, c)),
        "(a + b) * c");
    check(new Doc.OperationDoc(Op.PLUS, ImmutableList.of(c, sum)),
        "c + (a + b)");
    check(new Doc.OperationDoc(Op.MINUS, ImmutableList.of(sum, c)),
        "a + b - c");
    check(
        new Doc.OperationDoc(Op.FLOOR_DIV,
            ImmutableList.of(
                new Doc.OperationDoc(Op.MINUS, ImmutableList.of(a, b)),
                Doc.LiteralDoc.integer(2))),
        "(a - b) // 2");
    check(
        new Doc.OperationDoc(Op.PLUS,
            ImmutableList.of(a, Doc.LiteralDoc.integer(-1))),
        "a + (-1)");
    check(new Doc.OperationDoc(Op.NOT, ImmutableList.of(a)), "not a");
  }

  @Test void testBreak() {
    final Doc call =
        id("f").call(
            ImmutableList.of(id("aaaaaaaaaa"), id("bbbbbbbbbb")),
            ImmutableList.of(Pair.of("k", Doc.LiteralDoc.integer(1))));
    assertThat(new DocWriter(40, 2).write(call),
        is("f(aaaaaaaaaa, bbbbbbbbbb, k=1)"));
    assertThat(new DocWriter(20, 2).write(call),
        is("f(\n"
            + "  aaaaaaaaaa,\n"
            + "  bbbbbbbbbb,\n"
            + "  k=1,\n"
            + ")"));
    assertThat(new DocWriter(-1, 2).write(call),
        is("f(aaaaaaaaaa, bbbbbbbbbb, k=1)"));
  }

  @Test void testBreakNested() {
    final Doc list =
        new Doc.ListDoc(ImmutableList.of(id("aaaaaaaaaa"), id("bbbbbbbbbb")));
    final Doc call = id("g").call(id("x"), list);
    assertThat(new DocWriter(20, 2).write(call),
        is("g(\n"
            + "  x,\n"
            + "  [\n"
            + "    aaaaaaaaaa,\n"
            + "    bbbbbbbbbb,\n"
            + "  ],\n"
            + ")"));
    // The inner list fits once its call is broken
    assertThat(new DocWriter(28, 4).write(call),
        is("g(\n"
            + "    x,\n"
            + "    [aaaaaaaaaa, bbbbbbbbbb],\n"
            + ")"));
  }

  @Test void testToString() {
    final Doc tuple =
        new Doc.TupleDoc(ImmutableList.of(id("x"), Doc.LiteralDoc.integer(1)));
    assertThat(tuple, hasToString("(x, 1)"));
  }
}

// End DocWriterTest.java
