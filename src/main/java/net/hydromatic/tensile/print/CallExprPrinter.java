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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.ast.Op;
import net.hydromatic.tensile.attr.DictAttrs;
import net.hydromatic.tensile.compile.OpDef;
import org.apache.calcite.util.Pair;

/**
 * Prints calls.
 *
 * <p>An operator may print its calls its own way by registering a
 * {@link CallPrinter}; otherwise the call is printed as
 * {@code R.op(args..., attrs..., sinfo_args=(...))}.
 */
public final class CallExprPrinter {
  private static final String RELAX_PREFIX = "relax.";

  private CallExprPrinter() {}

  /** Converts a call to a document. */
  public static Doc print(Ir.Call call, ObjectPath path, IrDocsifier d) {
    if (call.calleeKind() == Ir.CalleeKind.PRIMITIVE_OP) {
      final OpDef def = d.registry().lookup(call.calleeName());
      if (def != null && def.printer != null) {
        final Doc doc = def.printer.print(call, path, d);
        if (doc != null) {
          return doc;
        }
      }
    }

    final List<Doc> args = new ArrayList<>();
    final List<Pair<String, Doc>> kwargs = new ArrayList<>();

    // Step 1. The operator
    final Doc calleeDoc;
    switch (call.calleeKind()) {
      case EXTERN_FUNC:
        calleeDoc = d.prefixed("call_packed");
        args.add(Doc.LiteralDoc.str(call.calleeName()));
        break;
      case PRIMITIVE_OP:
        calleeDoc = opDoc(call.calleeName(), d);
        break;
      case REFERENCE:
        calleeDoc = d.asDoc(call.callee, path.attr("op"));
        break;
      default:
        throw new AssertionError(call.calleeKind());
    }

    // Step 2. Arguments
    final ObjectPath argsPath = path.attr("args");
    for (int i = 0; i < call.args.size(); i++) {
      args.add(
          i == 0
              ? calleeArgDoc(call.args.get(i), argsPath.arrayIndex(i), d)
              : d.asDoc(call.args.get(i), argsPath.arrayIndex(i)));
    }

    // Step 3. Attributes
    if (call.attrs != null) {
      final ObjectPath attrsPath = path.attr("attrs");
      if (call.calleeKind() == Ir.CalleeKind.EXTERN_FUNC) {
        kwargs.add(
            Pair.of(
                "attrs_type_key", Doc.LiteralDoc.str(call.attrs.typeKey())));
      }
      if (call.attrs instanceof DictAttrs) {
        for (Map.Entry<String, Object> entry
            : ((DictAttrs) call.attrs).sorted().entrySet()) {
          kwargs.add(
              Pair.of(
                  entry.getKey(),
                  d.asDoc(entry.getValue(), attrsPath.attr(entry.getKey()))));
        }
      } else {
        kwargs.addAll(AttrPrinter.print(call.attrs, attrsPath, d));
      }
    }

    // Step 4. Declared struct info of the result
    if (!call.sinfoArgs.isEmpty()) {
      kwargs.add(
          Pair.of(
              "sinfo_args",
              new Doc.TupleDoc(
                  d.listDocs(call.sinfoArgs, path.attr("sinfo_args")))));
    }
    return calleeDoc.call(args, kwargs);
  }

  /**
   * Converts an operator name to a document: "relax.nn.conv2d" becomes
   * {@code R.nn.conv2d}, and a name without the "relax." prefix becomes a
   * plain identifier.
   */
  public static Doc opDoc(String name, IrDocsifier d) {
    if (name.startsWith(RELAX_PREFIX)) {
      return d.prefixed(name.substring(RELAX_PREFIX.length()));
    }
    return new Doc.IdDoc(name);
  }

  /**
   * Converts an argument that is a function to a document. An external
   * function is printed as its symbol.
   */
  public static Doc calleeArgDoc(Ir.Expr e, ObjectPath path, IrDocsifier d) {
    if (e.op == Op.EXTERN_FUNC) {
      return Doc.LiteralDoc.str(((Ir.ExternFunc) e).globalSymbol);
    }
    return d.asDoc(e, path);
  }
}

// End CallExprPrinter.java
