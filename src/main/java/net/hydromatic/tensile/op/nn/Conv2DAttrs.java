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
 * Attributes of a 2-D convolution.
 *
 * <p>Create via {@link Convolutions#conv2d}, which normalizes padding to four
 * values and strides and dilation to two.
 */
public final class Conv2DAttrs implements Attrs {
  public static final String TYPE_KEY = "relax.attrs.Conv2DAttrs";

  /** Strides along height and width. */
  public final ImmutableList<Long> strides;
  /** Padding: top, left, bottom, right. */
  public final ImmutableList<Long> padding;
  /** Dilation along height and width. */
  public final ImmutableList<Long> dilation;
  public final int groups;
  public final String dataLayout;
  public final String kernelLayout;
  public final String outLayout;
  /** Data type of the output, or void to derive it from the inputs. */
  public final DataType outDtype;

  public Conv2DAttrs(
      List<Long> strides,
      List<Long> padding,
      List<Long> dilation,
      int groups,
      String dataLayout,
      String kernelLayout,
      String outLayout,
      DataType outDtype) {
    this.strides = ImmutableList.copyOf(strides);
    this.padding = ImmutableList.copyOf(padding);
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
        || o instanceof Conv2DAttrs
            && fields().equals(((Conv2DAttrs) o).fields());
  }

  @Override
  public String toString() {
    return fields().toString();
  }
}

// End Conv2DAttrs.java
