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
package net.hydromatic.tensile.op.nn;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tensile.attr.AttrField;
import net.hydromatic.tensile.attr.AttrValue;
import net.hydromatic.tensile.attr.Attrs;
import net.hydromatic.tensile.type.DataType;

/**
 * Attributes of a transposed 2-D convolution.
 *
 * <p>Create via {@link Convolutions#conv2dTranspose}.
 */
public final class Conv2DTransposeAttrs implements Attrs {
  public static final String TYPE_KEY = "relax.attrs.Conv2DTransposeAttrs";

  public final ImmutableList<Long> strides;
  public final ImmutableList<Long> padding;
  /** Extra size added to one side of each spatial axis of the output. */
  public final ImmutableList<Long> outputPadding;
  public final ImmutableList<Long> dilation;
  public final int groups;
  public final String dataLayout;
  public final String kernelLayout;
  public final String outLayout;
  public final DataType outDtype;

  public Conv2DTransposeAttrs(
      List<Long> strides,
      List<Long> padding,
      List<Long> outputPadding,
      List<Long> dilation,
      int groups,
      String dataLayout,
      String kernelLayout,
      String outLayout,
      DataType outDtype) {
    this.strides = ImmutableList.copyOf(strides);
    this.padding = ImmutableList.copyOf(padding);
    this.outputPadding = ImmutableList.copyOf(outputPadding);
    this.dilation = ImmutableList.copyOf(dilation);
    this.groups = groups;
    this.dataLayout = requireNonNull(dataLayout);
    this.kernelLayout = requireNonNull(kernelLayout);
    this.outLayout = requireNonNull(outLayout);
    this.outDtype = requireNonNull(outDtype);
  }

  @Override
  public String typeKey() {
    return TYPE_KEY;
  }

  @Override
  public ImmutableList<AttrField> fields() {
    return ImmutableList.of(
        AttrField.of("strides", AttrValue.ofObject(strides)),
        AttrField.of("padding", AttrValue.ofObject(padding)),
        AttrField.of("output_padding", AttrValue.ofObject(outputPadding)),
        AttrField.of("dilation", AttrValue.ofObject(dilation)),
        AttrField.of("groups", AttrValue.ofInt(groups)),
        AttrField.of("data_layout", AttrValue.ofString(dataLayout)),
        AttrField.of("kernel_layout", AttrValue.ofString(kernelLayout)),
        AttrField.of("out_layout", AttrValue.ofString(outLayout)),
        AttrField.of("out_dtype", AttrValue.ofDtype(outDtype)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        strides,
        padding,
        outputPadding,
        dilation,
        groups,
        dataLayout,
        kernelLayout,
        outLayout,
        outDtype);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Conv2DTransposeAttrs
            && fields().equals(((Conv2DTransposeAttrs) o).fields());
  }

  @Override
  public String toString() {
    return fields().toString();
  }
}

// End Conv2DTransposeAttrs.java
