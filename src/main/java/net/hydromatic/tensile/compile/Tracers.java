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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.tensile.ast.Ir;
import net.hydromatic.tensile.type.StructInfo;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each inferred struct
   * info, then calls the underlying tracer.
   */
  public static Tracer withOnStructInfo(
      Tracer tracer, BiConsumer<Ir.Call, StructInfo> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStructInfo(Ir.Call call, StructInfo structInfo) {
        consumer.accept(call, structInfo);
        super.onStructInfo(call, structInfo);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each deferred
   * assumption, then calls the underlying tracer.
   */
  public static Tracer withOnDeferredAssumption(
      Tracer tracer, Consumer<DeferredAssumption> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDeferredAssumption(DeferredAssumption assumption) {
        consumer.accept(assumption);
        super.onDeferredAssumption(assumption);
      }
    };
  }

  public static Tracer withOnCompileException(
      Tracer tracer, Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStructInfo(Ir.Call call, StructInfo structInfo) {}

    @Override
    public void onDeferredAssumption(DeferredAssumption assumption) {}

    @Override
    public void handleCompileException(CompileException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStructInfo(Ir.Call call, StructInfo structInfo) {
      tracer.onStructInfo(call, structInfo);
    }

    @Override
    public void onDeferredAssumption(DeferredAssumption assumption) {
      tracer.onDeferredAssumption(assumption);
    }

    @Override
    public void handleCompileException(CompileException e) {
      tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
