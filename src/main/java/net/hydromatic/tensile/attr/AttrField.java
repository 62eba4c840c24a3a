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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Name and value of one field of an {@link Attrs}. */
public final class AttrField {
  public final String name;
  public final AttrValue value;

  private AttrField(String name, AttrValue value) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
  }

  /** Creates an AttrField. */
  public static AttrField of(String name, AttrValue value) {
    return new AttrField(name, value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof AttrField
            && name.equals(((AttrField) o).name)
            && value.equals(((AttrField) o).value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}

// End AttrField.java
