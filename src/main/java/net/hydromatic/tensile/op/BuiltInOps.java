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

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.compile.OpDef;
import net.hydromatic.tensile.compile.OpRegistry;
import net.hydromatic.tensile.op.nn.Convolutions;

/** Built-in operators. */
public final class BuiltInOps {
  private BuiltInOps() {}

  /** Definitions of the built-in operators. */
  public static final ImmutableList<OpDef> ALL =
      ImmutableList.of(
          Convolutions.CONV2D_DEF,
          Convolutions.CONV2D_TRANSPOSE_DEF,
          CallTir.CALL_TIR_DEF,
          CallTir.CALL_DPS_PACKED_DEF);

  /** Registers the built-in operators. */
  public static void registerAll(OpRegistry registry) {
    ALL.forEach(registry::register);
  }
}

// End BuiltInOps.java
