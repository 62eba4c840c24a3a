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

import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.ObjectPath;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Prints calls to a particular operator in a special way.
 *
 * <p>Registered in an operator's {@link net.hydromatic.tensile.compile.OpDef};
 * operators without one are printed by {@link CallExprPrinter}'s generic
 * rules.
 */
@FunctionalInterface
public interface CallPrinter {
  /** Converts a call to a document, or returns null to use the generic
   * rules. */
  @Nullable Doc print(Ir.Call call, ObjectPath path, IrDocsifier d);
}

// End CallPrinter.java
