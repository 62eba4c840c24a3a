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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.tensile.arith.Analyzer;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.ast.PrimExpr;

/**
 * State of an inference pass: the analyzer that decides shape relations, the
 * tracer, and configuration.
 *
 * <p>Belongs to one pass on one thread.
 */
public class InferContext {
  public final Analyzer analyzer;
  public final Tracer tracer;
  private final Map<Prop, Object> props;
  private final List<DeferredAssumption> deferredAssumptions =
      new ArrayList<>();

  public InferContext(
      Analyzer analyzer, Tracer tracer, Map<Prop, Object> props) {
    this.analyzer = requireNonNull(analyzer);
    this.tracer = requireNonNull(tracer);
    this.props = requireNonNull(props);
  }

  /**
   * Reports an error in a call. Never returns normally; the return type
   * allows callers to write {@code throw ctx.reportFatal(...)}.
   */
  public TypeException reportFatal(Ir.Call call, String message) {
    throw new TypeException(message, call.calleeName(), call.pos);
  }

  /**
   * Requires that a relation between the operands of a call holds.
   *
   * <p>If the relation is disproven, reports a fatal error with the given
   * message. If it cannot be decided, accepts it as a
   * {@link DeferredAssumption}.
   */
  public void require(
      Ir.Call call, PrimExpr relation, Supplier<String> message) {
    switch (analyzer.prove(relation)) {
      case DISPROVEN:
        throw reportFatal(call, message.get());
      case UNKNOWN:
        defer(call, relation);
        break;
      default:
        break;
    }
  }

  /** Records that a relation has been assumed. */
  public void defer(Ir.Call call, PrimExpr relation) {
    if (!Prop.REPORT_DEFERRED_ASSUMPTIONS.booleanValue(props)) {
      return;
    }
    final DeferredAssumption assumption =
        new DeferredAssumption(
            call.calleeName(), analyzer.simplify(relation).toString(),
            call.pos);
    deferredAssumptions.add(assumption);
    tracer.onDeferredAssumption(assumption);
  }

  /**
   * Returns the assumptions made so far; empty unless
   * {@link Prop#REPORT_DEFERRED_ASSUMPTIONS} is set.
   */
  public List<DeferredAssumption> deferredAssumptions() {
    return ImmutableList.copyOf(deferredAssumptions);
  }
}

// End InferContext.java
