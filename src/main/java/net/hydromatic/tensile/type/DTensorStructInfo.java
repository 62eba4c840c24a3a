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

import java.util.Objects;

/**
 * Struct info of a tensor that is distributed over a mesh of devices.
 *
 * <p>The placement says, for each dimension of the mesh, whether the tensor
 * is split ("S[axis]") or replicated ("R") along it.
 */
public class DTensorStructInfo extends StructInfo {
  public final TensorStructInfo tensor;
  public final String deviceMesh;
  public final String placement;

  private DTensorStructInfo(
      TensorStructInfo tensor, String deviceMesh, String placement) {
    super(Kind.DTENSOR);
    this.tensor = requireNonNull(tensor);
    this.deviceMesh = requireNonNull(deviceMesh);
    this.placement = requireNonNull(placement);
  }

  /** Creates a DTensorStructInfo. */
  public static DTensorStructInfo of(
      TensorStructInfo tensor, String deviceMesh, String placement) {
    return new DTensorStructInfo(tensor, deviceMesh, placement);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tensor, deviceMesh, placement);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DTensorStructInfo
            && tensor.equals(((DTensorStructInfo) o).tensor)
            && deviceMesh.equals(((DTensorStructInfo) o).deviceMesh)
            && placement.equals(((DTensorStructInfo) o).placement);
  }
}

// End DTensorStructInfo.java
