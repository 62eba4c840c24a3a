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
package net.hydromatic.tensile.print;

import com.google.common.collect.ImmutableList;
import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.attr.AttrField;
import net.hydromatic.tensile.attr.AttrValue;
import net.hydromatic.tensile.attr.Attrs;
import org.apache.calcite.util.Pair;

/**
 * Prints the fields of an attribute bag as keyword arguments.
 *
 * <p>Works for any schema, by visiting its fields in declaration order; no
 * operator needs its own attribute printing code.
 */
public final class AttrPrinter {
  private AttrPrinter() {}

  /** Returns a (name, document) pair for each field of {@code attrs}. */
  public static ImmutableList<Pair<String, Doc>> print(
      Attrs attrs, ObjectPath path, IrDocsifier d) {
    final ImmutableList.Builder<Pair<String, Doc>> list =
        ImmutableList.builder();
    for (AttrField field : attrs.fields()) {
      list.add(Pair.of(field.name, print(field, path.attr(field.name), d)));
    }
    return list.build();
  }

  private static Doc print(AttrField field, ObjectPath path, IrDocsifier d) {
    final AttrValue value = field.value;
    switch (value.kind) {
      case DOUBLE:
        return Doc.LiteralDoc.real(value.doubleValue());
      case INT:
      case UINT:
        return Doc.LiteralDoc.integer(value.longValue());
      case BOOL:
        return Doc.LiteralDoc.bool(value.booleanValue());
      case STRING:
        return Doc.LiteralDoc.str(value.stringValue());
      case DTYPE:
        return Doc.LiteralDoc.dtype(value.dtypeValue());
      case OBJECT:
        return d.asDoc(value.objectValue(), path);
      case OPAQUE:
        throw new PrinterTypeException(
            "TypeError: void is not allowed in Attrs", path);
      case NDARRAY:
        throw new PrinterTypeException(
            "TypeError: NDArray is not allowed in Attrs", path);
      default:
        throw new AssertionError(value.kind);
    }
  }
}

// End AttrPrinter.java
