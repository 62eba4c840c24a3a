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
package net.hydromatic.tensile.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.tensile.ast.IrBuilder.ir;
import static net.hydromatic.tensile.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.tensile.arith.Analyzer;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.type.ObjectStructInfo;
import net.hydromatic.tensile.type.StructInfo;
import org.apache.calcite.util.Pair;

/**
 * Builds a block of bindings, normalizing each expression so that every call
 * in it carries struct info.
 */
public class BlockBuilder {
  private final OpRegistry registry;
  private final InferContext ctx;
  private final List<Pair<Ir.Var, Ir.Expr>> bindings = new ArrayList<>();

  public BlockBuilder(
      OpRegistry registry, Tracer tracer, Map<Prop, Object> props) {
    this.registry = requireNonNull(registry);
    this.ctx = new InferContext(new Analyzer(), tracer, props);
  }

  /**
   * Creates a block builder with the built-in operators, no tracing and
   * default properties.
   */
  public static BlockBuilder create() {
    return new BlockBuilder(
        OpRegistry.builtIn(), Tracers.empty(), ImmutableMap.of());
  }

  /** Returns the inference context. */
  public InferContext context() {
    return ctx;
  }

  /**
   * Normalizes an expression. Arguments are normalized before the calls
   * that use them.
   */
  public Ir.Expr normalize(Ir.Expr expr) {
    switch (expr.op) {
      case CALL:
        return normalize((Ir.Call) expr);
      case TUPLE:
        final Ir.Tuple tuple = (Ir.Tuple) expr;
        final List<Ir.Expr> fields =
            transformEager(tuple.fields, this::normalize);
        return fields.equals(tuple.fields) && tuple.structInfo != null
            ? tuple
            : ir.tuple(fields);
      default:
        return expr;
    }
  }

  /** Normalizes a call, inferring its struct info if it has none. */
  public Ir.Call normalize(Ir.Call call) {
    final Ir.Call call2 =
        call.withArgs(transformEager(call.args, this::normalize));
    if (call2.structInfo != null) {
      return call2;
    }
    final StructInfo structInfo;
    try {
      structInfo = infer(call2);
    } catch (CompileException e) {
      ctx.tracer.handleCompileException(e);
      throw e;
    }
    final Ir.Call call3 = call2.withStructInfo(structInfo);
    ctx.tracer.onStructInfo(call3, structInfo);
    return call3;
  }

  private StructInfo infer(Ir.Call call) {
    switch (call.calleeKind()) {
      case PRIMITIVE_OP:
        final OpDef def = registry.lookup(call.calleeName());
        if (def == null || def.inferrer == null) {
          throw ctx.reportFatal(
              call,
              "Operator "
                  + call.calleeName()
                  + " does not have a struct info inference function");
        }
        return def.inferrer.infer(call, ctx);
      case EXTERN_FUNC:
      case REFERENCE:
        return call.sinfoArgs.isEmpty()
            ? ObjectStructInfo.INSTANCE
            : call.sinfoArgs.get(0);
      default:
        throw new AssertionError(call.calleeKind());
    }
  }

  /**
   * Normalizes an expression and binds it to a new variable.
   *
   * @return Variable carrying the struct info of the expression
   */
  public Ir.Var emit(String name, Ir.Expr expr) {
    final Ir.Expr normalized = normalize(expr);
    final Ir.Var var =
        ir.var(name, requireNonNull(normalized.structInfo, "structInfo"));
    bindings.add(Pair.of(var, normalized));
    return var;
  }

  /** Returns the bindings emitted so far. */
  public ImmutableList<Pair<Ir.Var, Ir.Expr>> bindings() {
    return ImmutableList.copyOf(bindings);
  }
}

// End BlockBuilder.java
