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

/** Called on various events during inference. */
public interface Tracer {
  /** Called when the struct info of a call has been inferred. */
  void onStructInfo(Ir.Call call, StructInfo structInfo);

  /**
   * Called when a relation is assumed because it could not be decided. Only
   * called if {@link Prop#REPORT_DEFERRED_ASSUMPTIONS} is true.
   */
  void onDeferredAssumption(DeferredAssumption assumption);

  /**
   * Called with the exception thrown during inference. The exception is
   * rethrown after the call.
   */
  void handleCompileException(CompileException e);
}

// End Tracer.java
