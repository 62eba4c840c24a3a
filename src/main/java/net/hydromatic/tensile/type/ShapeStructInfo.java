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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tensile.ast.PrimExpr;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Struct info of a shape value, such as the argument to a reshape. */
public class ShapeStructInfo extends StructInfo {
  public final @Nullable ImmutableList<PrimExpr> values;
  /** Number of dimensions, or -1 if not known. */
  public final int ndim;

  private ShapeStructInfo(@Nullable ImmutableList<PrimExpr> values, int ndim) {
    super(Kind.SHAPE);
    this.values = values;
    this.ndim = ndim;
    checkArgument(ndim >= -1, "invalid ndim %s", ndim);
  }

  /** Creates a shape struct info whose values are known. */
  public static ShapeStructInfo of(List<PrimExpr> values) {
    return new ShapeStructInfo(ImmutableList.copyOf(values), values.size());
  }

  /** Creates a shape struct info with known rank but unknown values. */
  public static ShapeStructInfo ofNdim(int ndim) {
    return new ShapeStructInfo(null, ndim);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, ndim);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ShapeStructInfo
            && Objects.equals(values, ((ShapeStructInfo) o).values)
            && ndim == ((ShapeStructInfo) o).ndim;
  }
}

// End ShapeStructInfo.java
