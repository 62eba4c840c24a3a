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
package net.hydromatic.tensile.attr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes held in an untyped dictionary.
 *
 * <p>Unlike a schema'd bag, the keys are not known to the operator, so the
 * printer emits them in key order rather than insertion order.
 */
public class DictAttrs implements Attrs {
  public static final String TYPE_KEY = "DictAttrs";

  /** Entries, in insertion order. */
  public final ImmutableMap<String, Object> dict;

  private DictAttrs(ImmutableMap<String, Object> dict) {
    this.dict = dict;
  }

  /** Creates a DictAttrs. */
  public static DictAttrs of(Map<String, ?> dict) {
    return new DictAttrs(ImmutableMap.copyOf(dict));
  }

  @Override
  public String typeKey() {
    return TYPE_KEY;
  }

  /** Returns the entries sorted by key. */
  public ImmutableSortedMap<String, Object> sorted() {
    return ImmutableSortedMap.copyOf(dict);
  }

  /** Returns the fields, sorted by key. */
  @Override
  public ImmutableList<AttrField> fields() {
    final ImmutableList.Builder<AttrField> b = ImmutableList.builder();
    sorted().forEach((k, v) -> b.add(AttrField.of(k, AttrValue.ofObject(v))));
    return b.build();
  }

  @Override
  public int hashCode() {
    return dict.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DictAttrs && Objects.equals(dict, ((DictAttrs) o).dict);
  }
}

// End DictAttrs.java
