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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.op.nn.Convolutions;
import net.hydromatic.tensile.type.ObjectStructInfo;
import org.junit.jupiter.api.Test;

/** Tests for {@link OpRegistry} and {@link OpDef}. */
public class OpRegistryTest {
  @Test void testBuiltIn() {
    final OpRegistry registry = OpRegistry.builtIn();
    assertThat(OpRegistry.builtIn(), sameInstance(registry));
    assertThat(registry.names(),
        is(
            ImmutableList.of("relax.nn.conv2d", "relax.nn.conv2d_transpose",
                "relax.call_tir", "relax.call_dps_packed")));
    final OpDef conv2d = registry.get("relax.nn.conv2d");
    assertThat(conv2d, sameInstance(Convolutions.CONV2D_DEF));
    assertThat(conv2d.numInputs, is(2));
    assertThat(conv2d.arguments.get(0).name, is("data"));
    assertThat(conv2d.arguments.get(1).name, is("weight"));
    assertThat(conv2d.attrsTypeKey, is("relax.attrs.Conv2DAttrs"));
    assertThat(conv2d.inferrer, notNullValue());
    assertThat(conv2d.printer, nullValue());
    assertThat(registry.get("relax.call_tir").printer, notNullValue());
  }

  @Test void testLookup() {
    final OpRegistry registry = OpRegistry.builtIn();
    assertThat(registry.lookup("relax.nn.conv3d"), nullValue());
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> registry.get("relax.nn.conv3d"));
    assertThat(e.getMessage(), is("operator relax.nn.conv3d not found"));
  }

  @Test void testRegister() {
    final OpRegistry registry = OpRegistry.withBuiltIns();
    assertThat(registry.register(Fixture.MY_OP), sameInstance(registry));
    assertThat(registry.get("my.op"), sameInstance(Fixture.MY_OP));
    assertThat(registry.names().size(), is(5));
    // The built-in registry is not affected
    assertThat(OpRegistry.builtIn().lookup("my.op"), nullValue());

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> registry.register(Convolutions.CONV2D_DEF));
    assertThat(e.getMessage(),
        is("operator relax.nn.conv2d is already registered"));
  }

  @Test void testBuiltInIsReadOnly() {
    final OpRegistry registry = OpRegistry.builtIn();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> registry.register(Fixture.MY_OP));
    assertThat(e.getMessage(),
        is("cannot register operator my.op in read-only registry"));
    assertThat(registry.lookup("my.op"), nullValue());
    assertThat(registry.names().size(), is(4));
  }

  @Test void testArgumentCount() {
    assertThrows(IllegalArgumentException.class,
        () -> OpDef.builder("my.bad_op")
            .numInputs(2)
            .addArgument("x", "Tensor", "The input.")
            .build());
  }

  /** Operators used in tests. */
  private static class Fixture {
    static final OpDef MY_OP =
        OpDef.builder("my.op")
            .numInputs(1)
            .addArgument("x", "Tensor", "The input.")
            .inferrer((call, ctx) -> ObjectStructInfo.INSTANCE)
            .build();
  }
}

// End OpRegistryTest.java
