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

import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.type.StructInfo;

/**
 * Infers the struct info of a call to an operator from the struct info of its
 * arguments and its attributes.
 *
 * <p>Each operator registers one in its {@link OpDef}.
 */
@FunctionalInterface
public interface StructInfoInferrer {
  /**
   * Infers the struct info of a call.
   *
   * <p>The arguments of {@code call} have been normalized, so each has struct
   * info. Reports errors via {@link InferContext#reportFatal}.
   */
  StructInfo infer(Ir.Call call, InferContext ctx);
}

// End StructInfoInferrer.java
