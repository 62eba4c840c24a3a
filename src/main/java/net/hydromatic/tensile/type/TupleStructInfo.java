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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Struct info of a tuple. */
public class TupleStructInfo extends StructInfo {
  public final ImmutableList<StructInfo> fields;

  private TupleStructInfo(ImmutableList<StructInfo> fields) {
    super(Kind.TUPLE);
    this.fields = fields;
  }

  /** Creates a TupleStructInfo. */
  public static TupleStructInfo of(List<? extends StructInfo> fields) {
    return new TupleStructInfo(ImmutableList.copyOf(fields));
  }

  /** Creates a TupleStructInfo. */
  public static TupleStructInfo of(StructInfo... fields) {
    return new TupleStructInfo(ImmutableList.copyOf(fields));
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleStructInfo
            && fields.equals(((TupleStructInfo) o).fields);
  }
}

// End TupleStructInfo.java
