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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.ast.PrimExpr;
import net.hydromatic.tensile.compile.OpRegistry;
import net.hydromatic.tensile.compile.Prop;
import net.hydromatic.tensile.type.DTensorStructInfo;
import net.hydromatic.tensile.type.DataType;
import net.hydromatic.tensile.type.ObjectStructInfo;
import net.hydromatic.tensile.type.ShapeStructInfo;
import net.hydromatic.tensile.type.StructInfo;
import net.hydromatic.tensile.type.TensorStructInfo;
import net.hydromatic.tensile.type.TupleStructInfo;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts IR objects to documents.
 *
 * <p>Printing is pure: the same object with the same configuration always
 * gives the same text. An IrDocsifier holds no mutable state, so may be
 * shared between threads.
 */
public class IrDocsifier {
  private final OpRegistry registry;
  private final Map<Prop, Object> props;
  private final String prefix;

  public IrDocsifier(OpRegistry registry, Map<Prop, Object> props) {
    this.registry = requireNonNull(registry);
    this.props = ImmutableMap.copyOf(props);
    this.prefix = Prop.PRINTER_PREFIX.stringValue(this.props);
  }

  /** Creates an IrDocsifier with the built-in operators and default
   * properties. */
  public static IrDocsifier create() {
    return new IrDocsifier(OpRegistry.builtIn(), ImmutableMap.of());
  }

  /** Converts an object to script text with default settings. Used by the
   * {@code toString} methods of IR nodes. */
  public static String repr(Object o) {
    return create().print(o);
  }

  /** Returns the registry in which operators' printers are found. */
  public OpRegistry registry() {
    return registry;
  }

  /** Converts an object to script text. */
  public String print(Object o) {
    return DocWriter.of(props).write(asDoc(o, ObjectPath.root()));
  }

  /**
   * Returns a reference to a builder function, such as {@code R.Tensor} for
   * "Tensor" or {@code R.nn.conv2d} for "nn.conv2d".
   */
  public Doc prefixed(String name) {
    Doc doc = new Doc.IdDoc(prefix);
    for (String part : name.split("\\.")) {
      doc = doc.attr(part);
    }
    return doc;
  }

  /**
   * Converts an object to a document.
   *
   * @param o Object; may be an IR expression, struct info, symbolic
   *     expression, data type, list, map, string, number or boolean
   * @param path Path of the object from the root of what is being printed
   * @throws PrinterTypeException if the object cannot be printed
   */
  public Doc asDoc(@Nullable Object o, ObjectPath path) {
    if (o == null) {
      return Doc.LiteralDoc.none();
    } else if (o instanceof Doc) {
      return (Doc) o;
    } else if (o instanceof Ir.Expr) {
      return exprDoc((Ir.Expr) o, path);
    } else if (o instanceof StructInfo) {
      return structInfoDoc((StructInfo) o, path);
    } else if (o instanceof PrimExpr) {
      return primExprDoc((PrimExpr) o);
    } else if (o instanceof DataType) {
      return Doc.LiteralDoc.dtype((DataType) o);
    } else if (o instanceof String) {
      return Doc.LiteralDoc.str((String) o);
    } else if (o instanceof Boolean) {
      return Doc.LiteralDoc.bool((Boolean) o);
    } else if (o instanceof Long
        || o instanceof Integer
        || o instanceof Short
        || o instanceof Byte) {
      return Doc.LiteralDoc.integer(((Number) o).longValue());
    } else if (o instanceof Double || o instanceof Float) {
      return Doc.LiteralDoc.real(((Number) o).doubleValue());
    } else if (o instanceof List) {
      return new Doc.ListDoc(listDocs((List<?>) o, path));
    } else if (o instanceof Map) {
      final List<Pair<Doc, Doc>> entries = new ArrayList<>();
      ((Map<?, ?>) o).forEach((k, v) ->
          entries.add(
              Pair.of(
                  asDoc(k, path),
                  asDoc(v, path.attr(String.valueOf(k))))));
      return new Doc.DictDoc(entries);
    } else {
      throw new PrinterTypeException(
          "TypeError: Cannot print object of type "
              + o.getClass().getSimpleName(),
          path);
    }
  }

  /** Converts each element of a list, with paths {@code path[i]}. */
  List<Doc> listDocs(List<?> list, ObjectPath path) {
    final ImmutableList.Builder<Doc> docs = ImmutableList.builder();
    for (int i = 0; i < list.size(); i++) {
      docs.add(asDoc(list.get(i), path.arrayIndex(i)));
    }
    return docs.build();
  }

  private Doc exprDoc(Ir.Expr e, ObjectPath path) {
    switch (e.op) {
      case VAR:
        return new Doc.IdDoc(((Ir.Var) e).name);
      case GLOBAL_VAR:
        return new Doc.IdDoc(((Ir.GlobalVar) e).name);
      case EXTERN_FUNC:
        return prefixed("ExternFunc")
            .call(Doc.LiteralDoc.str(((Ir.ExternFunc) e).globalSymbol));
      case PRIMITIVE_OP:
        return CallExprPrinter.opDoc(((Ir.PrimitiveOp) e).name, this);
      case CALL:
        return CallExprPrinter.print((Ir.Call) e, path, this);
      case TUPLE:
        return new Doc.TupleDoc(
            listDocs(((Ir.Tuple) e).fields, path.attr("fields")));
      case SHAPE_EXPR:
        return prefixed("shape")
            .call(
                new Doc.ListDoc(
                    listDocs(((Ir.ShapeExpr) e).values, path.attr("values"))));
      case PRIM_VALUE:
        return prefixed("prim_value")
            .call(primExprDoc(((Ir.PrimValue) e).value));
      case STRING_IMM:
        return prefixed("str")
            .call(Doc.LiteralDoc.str(((Ir.StringImm) e).value));
      default:
        throw new PrinterTypeException(
            "TypeError: Cannot print expression " + e.op, path);
    }
  }

  private Doc structInfoDoc(StructInfo sinfo, ObjectPath path) {
    final List<Doc> args = new ArrayList<>();
    final List<Pair<String, Doc>> kwargs = new ArrayList<>();
    switch (sinfo.kind) {
      case OBJECT:
        assert sinfo == ObjectStructInfo.INSTANCE;
        return prefixed("Object");
      case SHAPE:
        final ShapeStructInfo shape = (ShapeStructInfo) sinfo;
        if (shape.values != null) {
          args.add(
              new Doc.ListDoc(listDocs(shape.values, path.attr("values"))));
        } else if (shape.ndim >= 0) {
          kwargs.add(Pair.of("ndim", Doc.LiteralDoc.integer(shape.ndim)));
        }
        return prefixed("Shape").call(args, kwargs);
      case TENSOR:
        final TensorStructInfo tensor = (TensorStructInfo) sinfo;
        if (tensor.shape != null) {
          args.add(
              new Doc.TupleDoc(listDocs(tensor.shape, path.attr("shape"))));
        } else if (!tensor.isUnknownNdim()) {
          kwargs.add(Pair.of("ndim", Doc.LiteralDoc.integer(tensor.ndim)));
        }
        if (!tensor.dtype.isVoid()) {
          kwargs.add(Pair.of("dtype", Doc.LiteralDoc.dtype(tensor.dtype)));
        }
        return prefixed("Tensor").call(args, kwargs);
      case DTENSOR:
        final DTensorStructInfo dtensor = (DTensorStructInfo) sinfo;
        final TensorStructInfo t = dtensor.tensor;
        args.add(
            t.shape != null
                ? new Doc.TupleDoc(listDocs(t.shape, path.attr("shape")))
                : Doc.LiteralDoc.none());
        args.add(Doc.LiteralDoc.dtype(t.dtype));
        args.add(Doc.LiteralDoc.str(dtensor.deviceMesh));
        args.add(Doc.LiteralDoc.str(dtensor.placement));
        if (t.shape == null && !t.isUnknownNdim()) {
          kwargs.add(Pair.of("ndim", Doc.LiteralDoc.integer(t.ndim)));
        }
        return prefixed("DTensor").call(args, kwargs);
      case TUPLE:
        return prefixed("Tuple")
            .call(
                listDocs(((TupleStructInfo) sinfo).fields, path.attr("fields")),
                ImmutableList.of());
      default:
        throw new AssertionError(sinfo.kind);
    }
  }

  /** Converts a symbolic expression to a document. */
  Doc primExprDoc(PrimExpr e) {
    switch (e.op) {
      case INT_IMM:
        return Doc.LiteralDoc.integer(e.longValue());
      case INT_VAR:
      case SIZE_VAR:
        return new Doc.IdDoc(((PrimExpr.Var) e).name);
      case NOT:
        return new Doc.OperationDoc(
            e.op, ImmutableList.of(primExprDoc(((PrimExpr.Not) e).a)));
      default:
        final PrimExpr.Binary b = (PrimExpr.Binary) e;
        return new Doc.OperationDoc(
            e.op, ImmutableList.of(primExprDoc(b.a), primExprDoc(b.b)));
    }
  }
}

// End IrDocsifier.java
