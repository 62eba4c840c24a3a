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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tensile.ast.Op;
import net.hydromatic.tensile.type.DataType;
import org.apache.calcite.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Document: a tree of script expressions, produced by {@link IrDocsifier}
 * and converted to text by {@link DocWriter}.
 *
 * <p>This class functions as a namespace for its sub-classes.
 */
public abstract class Doc {
  Doc() {}

  /** Returns {@code this.name}. */
  public AttrAccessDoc attr(String name) {
    return new AttrAccessDoc(this, name);
  }

  /** Returns {@code this(args...)}. */
  public CallDoc call(Doc... args) {
    return call(ImmutableList.copyOf(args), ImmutableList.of());
  }

  /** Returns {@code this(args..., key=value...)}. */
  public CallDoc call(
      List<? extends Doc> args, List<Pair<String, Doc>> kwargs) {
    return new CallDoc(this, args, kwargs);
  }

  @Override
  public String toString() {
    return DocWriter.DEFAULT.write(this);
  }

  /** Literal: None, a boolean, an integer, a float or a string. */
  public static final class LiteralDoc extends Doc {
    public final @Nullable Object value;

    private LiteralDoc(@Nullable Object value) {
      this.value = value;
    }

    public static LiteralDoc none() {
      return new LiteralDoc(null);
    }

    public static LiteralDoc bool(boolean b) {
      return new LiteralDoc(b);
    }

    public static LiteralDoc integer(long i) {
      return new LiteralDoc(i);
    }

    public static LiteralDoc real(double d) {
      return new LiteralDoc(d);
    }

    public static LiteralDoc str(String s) {
      return new LiteralDoc(requireNonNull(s));
    }

    /** Data types are written as strings, such as "float32". */
    public static LiteralDoc dtype(DataType dtype) {
      return str(dtype.toString());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LiteralDoc
              && Objects.equals(value, ((LiteralDoc) o).value);
    }
  }

  /** Identifier. */
  public static final class IdDoc extends Doc {
    public final String name;

    public IdDoc(String name) {
      this.name = requireNonNull(name);
    }
  }

  /** Attribute access, {@code value.name}. */
  public static final class AttrAccessDoc extends Doc {
    public final Doc value;
    public final String name;

    AttrAccessDoc(Doc value, String name) {
      this.value = requireNonNull(value);
      this.name = requireNonNull(name);
    }
  }

  /** Call, {@code callee(arg, ..., key=value, ...)}. */
  public static final class CallDoc extends Doc {
    public final Doc callee;
    public final ImmutableList<Doc> args;
    public final ImmutableList<Pair<String, Doc>> kwargs;

    CallDoc(
        Doc callee,
        List<? extends Doc> args,
        List<Pair<String, Doc>> kwargs) {
      this.callee = requireNonNull(callee);
      this.args = ImmutableList.copyOf(args);
      this.kwargs = ImmutableList.copyOf(kwargs);
    }

    /** Returns the names of the keyword arguments. */
    public List<String> kwargKeys() {
      return Pair.left(kwargs);
    }
  }

  /** Tuple, {@code (a, b)}. */
  public static final class TupleDoc extends Doc {
    public final ImmutableList<Doc> elements;

    public TupleDoc(List<? extends Doc> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }
  }

  /** List, {@code [a, b]}. */
  public static final class ListDoc extends Doc {
    public final ImmutableList<Doc> elements;

    public ListDoc(List<? extends Doc> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }
  }

  /** Dictionary, {@code {k: v, ...}}. */
  public static final class DictDoc extends Doc {
    public final ImmutableList<Pair<Doc, Doc>> entries;

    public DictDoc(List<Pair<Doc, Doc>> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }
  }

  /** Application of a prefix or infix operator. */
  public static final class OperationDoc extends Doc {
    public final Op op;
    public final ImmutableList<Doc> operands;

    public OperationDoc(Op op, List<? extends Doc> operands) {
      this.op = requireNonNull(op);
      this.operands = ImmutableList.copyOf(operands);
      checkArgument(
          operands.size() == (op == Op.NOT ? 1 : 2),
          "wrong number of operands for %s",
          op);
    }
  }
}

// End Doc.java
