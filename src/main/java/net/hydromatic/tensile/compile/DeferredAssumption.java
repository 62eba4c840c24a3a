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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.tensile.ast.Pos;

/**
 * Relation between the operands of a call that could be neither proven nor
 * disproven, and was therefore assumed to hold.
 *
 * <p>For example, the number of input channels of a convolution equals the
 * number of channels of its data, when both are symbolic.
 */
public final class DeferredAssumption {
  public final String opName;
  /** The relation that was assumed, such as {@code c == ci * 2}. */
  public final String relation;
  public final Pos pos;

  public DeferredAssumption(String opName, String relation, Pos pos) {
    this.opName = requireNonNull(opName);
    this.relation = requireNonNull(relation);
    this.pos = requireNonNull(pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(opName, relation, pos);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DeferredAssumption
            && opName.equals(((DeferredAssumption) o).opName)
            && relation.equals(((DeferredAssumption) o).relation)
            && pos.equals(((DeferredAssumption) o).pos);
  }

  @Override
  public String toString() {
    return opName + ": assumed " + relation;
  }
}

// End DeferredAssumption.java
