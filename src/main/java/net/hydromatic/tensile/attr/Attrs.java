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

import java.util.List;

/**
 * Bag of attributes of a call, such as the strides and padding of a
 * convolution.
 *
 * <p>Each kind of operator has a fixed schema. Code that does not know the
 * schema, such as the printer, reads the attributes through {@link #fields()}.
 * Attributes are immutable.
 */
public interface Attrs {
  /**
   * Returns the registered name of this schema, for example
   * "relax.attrs.Conv2DAttrs".
   */
  String typeKey();

  /** Returns every field of this bag, in declaration order. */
  List<AttrField> fields();
}

// End Attrs.java
