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

import static java.util.Objects.requireNonNull;

import net.hydromatic.tensile.print.IrDocsifier;

/**
 * Structural information about an IR value: what kind of value it is and,
 * for tensors, its data type and shape.
 *
 * <p>Inference computes one for each call as the call is built. Struct info
 * is immutable.
 */
public abstract class StructInfo {
  public final Kind kind;

  StructInfo(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the script text of this struct info, e.g. {@code R.Object}. */
  @Override
  public String toString() {
    return IrDocsifier.repr(this);
  }

  /** Kinds of struct info. */
  public enum Kind {
    OBJECT,
    SHAPE,
    TENSOR,
    /** Tensor that is distributed over a device mesh. */
    DTENSOR,
    TUPLE
  }
}

// End StructInfo.java
