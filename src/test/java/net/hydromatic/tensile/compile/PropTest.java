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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.REPORT_DEFERRED_ASSUMPTIONS.booleanValue(map), is(false));
    assertThat(Prop.LINE_WIDTH.intValue(map), is(100));
    assertThat(Prop.INDENT_SPACES.intValue(map), is(4));
    assertThat(Prop.PRINTER_PREFIX.stringValue(map), is("R"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.LINE_WIDTH.set(map, 40);
    assertThat(Prop.LINE_WIDTH.intValue(map), is(40));
    Prop.REPORT_DEFERRED_ASSUMPTIONS.set(map, true);
    assertThat(Prop.REPORT_DEFERRED_ASSUMPTIONS.booleanValue(map), is(true));
    assertThat(Prop.LINE_WIDTH.remove(map), is(40));
    assertThat(Prop.LINE_WIDTH.intValue(map), is(100));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.LINE_WIDTH.set(map, "wide"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PRINTER_PREFIX.set(map, null));
    // Asking for a value of the wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LINE_WIDTH.booleanValue(map));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("lineWidth"), is(Prop.LINE_WIDTH));
    assertThat(Prop.lookup("LINE_WIDTH"), is(Prop.LINE_WIDTH));
    assertThat(Prop.lookup("reportDeferredAssumptions"),
        is(Prop.REPORT_DEFERRED_ASSUMPTIONS));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("lineLength"));
    assertThat(e.getMessage(), is("property lineLength not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.INDENT_SPACES));
  }
}

// End PropTest.java
