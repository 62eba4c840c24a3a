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
package net.hydromatic.tensile.type;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link DataType}. */
public class DataTypeTest {
  @Test void testParse() {
    assertThat(DataType.of("float64"), is(DataType.FLOAT64));
    assertThat(DataType.of("float"), is(DataType.FLOAT32));
    assertThat(DataType.of("int"), is(DataType.INT32));
    assertThat(DataType.of("bool"), sameInstance(DataType.BOOL));
    assertThat(DataType.of(""), sameInstance(DataType.VOID));
    assertThat(DataType.of("void").isVoid(), is(true));

    final DataType u8x4 = DataType.of("uint8x4");
    assertThat(u8x4.code, is(DataType.Code.UINT));
    assertThat(u8x4.bits, is(8));
    assertThat(u8x4.lanes, is(4));
    assertThat(DataType.of("bfloat").bits, is(16));
    assertThat(DataType.of("handle").code, is(DataType.Code.HANDLE));
  }

  @Test void testToString() {
    assertThat(DataType.FLOAT16, hasToString("float16"));
    assertThat(DataType.INT64, hasToString("int64"));
    assertThat(DataType.BOOL, hasToString("bool"));
    assertThat(DataType.VOID, hasToString("void"));
    assertThat(DataType.of(DataType.Code.BFLOAT, 16, 1),
        hasToString("bfloat16"));
    assertThat(DataType.of(DataType.Code.UINT, 8, 4), hasToString("uint8x4"));
  }

  @Test void testInvalid() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> DataType.of("complex64"));
    assertThat(e.getMessage(), is("unknown data type: complex64"));
    e = assertThrows(IllegalArgumentException.class,
        () -> DataType.of("floatx"));
    assertThat(e.getMessage(), is("invalid data type: floatx"));
    e = assertThrows(IllegalArgumentException.class,
        () -> DataType.of(DataType.Code.INT, 0, 1));
    assertThat(e.getMessage(), is("bits must be positive: 0"));
  }
}

// End DataTypeTest.java
