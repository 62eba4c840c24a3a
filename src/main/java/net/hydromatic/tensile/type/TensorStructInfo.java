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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensile.ast.Arith.arith;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tensile.ast.PrimExpr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Struct info of a tensor.
 *
 * <p>The data type may be {@link DataType#VOID} (unknown). The shape is
 * either a list of symbolic extents, or unknown; if the shape is unknown the
 * rank may still be known.
 */
public class TensorStructInfo extends StructInfo {
  public final DataType dtype;
  public final @Nullable ImmutableList<PrimExpr> shape;
  /** Number of dimensions, or -1 if not known. */
  public final int ndim;

  private TensorStructInfo(
      DataType dtype, @Nullable ImmutableList<PrimExpr> shape, int ndim) {
    super(Kind.TENSOR);
    this.dtype = requireNonNull(dtype);
    this.shape = shape;
    this.ndim = ndim;
    checkArgument(ndim >= -1, "invalid ndim %s", ndim);
    checkArgument(shape == null || shape.size() == ndim);
  }

  /** Creates a tensor struct info with a known shape. */
  public static TensorStructInfo of(List<PrimExpr> shape, DataType dtype) {
    return new TensorStructInfo(
        dtype, ImmutableList.copyOf(shape), shape.size());
  }

  /** Creates a tensor struct info with a constant shape. */
  public static TensorStructInfo of(DataType dtype, long... dims) {
    final ImmutableList.Builder<PrimExpr> b = ImmutableList.builder();
    for (long dim : dims) {
      b.add(arith.intImm(dim));
    }
    return of(b.build(), dtype);
  }

  /**
   * Creates a tensor struct info whose shape is not known. If {@code ndim} is
   * -1, the rank is not known either.
   */
  public static TensorStructInfo ofNdim(DataType dtype, int ndim) {
    return new TensorStructInfo(dtype, null, ndim);
  }

  /** Whether the rank is unknown. */
  public boolean isUnknownNdim() {
    return ndim == -1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(dtype, shape, ndim);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TensorStructInfo
            && dtype.equals(((TensorStructInfo) o).dtype)
            && Objects.equals(shape, ((TensorStructInfo) o).shape)
            && ndim == ((TensorStructInfo) o).ndim;
  }
}

// End TensorStructInfo.java
