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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tensile.print.CallPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of an operator: its name, arguments, the schema of its
 * attributes, and how to infer and print calls to it.
 *
 * <p>Create using {@link #builder(String)}, and register in an
 * {@link OpRegistry}.
 */
public final class OpDef {
  /** Name, such as "relax.nn.conv2d". */
  public final String name;
  /** Number of inputs, or -1 if variadic. */
  public final int numInputs;
  public final ImmutableList<Argument> arguments;
  /** Type key of the attributes, or null if calls have no attributes. */
  public final @Nullable String attrsTypeKey;
  public final @Nullable StructInfoInferrer inferrer;
  public final @Nullable CallPrinter printer;

  private OpDef(
      String name,
      int numInputs,
      ImmutableList<Argument> arguments,
      @Nullable String attrsTypeKey,
      @Nullable StructInfoInferrer inferrer,
      @Nullable CallPrinter printer) {
    this.name = requireNonNull(name);
    this.numInputs = numInputs;
    this.arguments = requireNonNull(arguments);
    this.attrsTypeKey = attrsTypeKey;
    this.inferrer = inferrer;
    this.printer = printer;
    checkArgument(
        numInputs < 0 || numInputs == arguments.size(),
        "operator %s has %s inputs but %s arguments are described",
        name,
        numInputs,
        arguments.size());
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Description of an argument. */
  public static final class Argument {
    public final String name;
    /** Kind of value expected, such as "Tensor". */
    public final String typeKey;
    public final String description;

    Argument(String name, String typeKey, String description) {
      this.name = requireNonNull(name);
      this.typeKey = requireNonNull(typeKey);
      this.description = requireNonNull(description);
    }

    @Override
    public String toString() {
      return name + ": " + typeKey;
    }
  }

  /** Builder for {@link OpDef}. */
  public static final class Builder {
    private final String name;
    private int numInputs = -1;
    private final List<Argument> arguments = new ArrayList<>();
    private @Nullable String attrsTypeKey;
    private @Nullable StructInfoInferrer inferrer;
    private @Nullable CallPrinter printer;

    private Builder(String name) {
      this.name = requireNonNull(name);
    }

    public Builder numInputs(int numInputs) {
      this.numInputs = numInputs;
      return this;
    }

    public Builder addArgument(
        String name, String typeKey, String description) {
      arguments.add(new Argument(name, typeKey, description));
      return this;
    }

    public Builder attrsTypeKey(String attrsTypeKey) {
      this.attrsTypeKey = attrsTypeKey;
      return this;
    }

    public Builder inferrer(StructInfoInferrer inferrer) {
      this.inferrer = inferrer;
      return this;
    }

    public Builder printer(CallPrinter printer) {
      this.printer = printer;
      return this;
    }

    public OpDef build() {
      return new OpDef(
          name,
          numInputs,
          ImmutableList.copyOf(arguments),
          attrsTypeKey,
          inferrer,
          printer);
    }
  }
}

// End OpDef.java
