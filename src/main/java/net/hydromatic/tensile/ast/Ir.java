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
package net.hydromatic.tensile.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.tensile.attr.Attrs;
import net.hydromatic.tensile.print.IrDocsifier;
import net.hydromatic.tensile.type.ObjectStructInfo;
import net.hydromatic.tensile.type.StructInfo;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * IR expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Create nodes using {@link IrBuilder#ir}.
 */
public class Ir {
  private Ir() {}

  /** Base class of IR expressions. */
  public abstract static class Expr {
    public final Pos pos;
    public final Op op;

    /**
     * Struct info, or null if it has not been inferred yet. Calls receive
     * theirs during normalization; other expressions are created with it.
     */
    public final @Nullable StructInfo structInfo;

    Expr(Pos pos, Op op, @Nullable StructInfo structInfo) {
      this.pos = requireNonNull(pos);
      this.op = requireNonNull(op);
      this.structInfo = structInfo;
    }

    /** Returns the script text of this expression. */
    @Override
    public String toString() {
      return IrDocsifier.repr(this);
    }
  }

  /** Local variable. */
  public static class Var extends Expr {
    public final String name;

    Var(Pos pos, String name, StructInfo structInfo) {
      super(pos, Op.VAR, requireNonNull(structInfo));
      this.name = requireNonNull(name);
    }
  }

  /** Reference to a function defined in the module. */
  public static class GlobalVar extends Expr {
    public final String name;

    GlobalVar(Pos pos, String name) {
      super(pos, Op.GLOBAL_VAR, ObjectStructInfo.INSTANCE);
      this.name = requireNonNull(name);
    }
  }

  /** Function that is known only by its symbol, and is linked at run time. */
  public static class ExternFunc extends Expr {
    public final String globalSymbol;

    ExternFunc(Pos pos, String globalSymbol) {
      super(pos, Op.EXTERN_FUNC, ObjectStructInfo.INSTANCE);
      this.globalSymbol = requireNonNull(globalSymbol);
    }
  }

  /** Reference to a registered operator, such as "relax.nn.conv2d". */
  public static class PrimitiveOp extends Expr {
    public final String name;

    PrimitiveOp(Pos pos, String name) {
      super(pos, Op.PRIMITIVE_OP, ObjectStructInfo.INSTANCE);
      this.name = requireNonNull(name);
    }
  }

  /** Tuple of expressions. */
  public static class Tuple extends Expr {
    public final ImmutableList<Expr> fields;

    Tuple(
        Pos pos, ImmutableList<Expr> fields, @Nullable StructInfo structInfo) {
      super(pos, Op.TUPLE, structInfo);
      this.fields = requireNonNull(fields);
    }
  }

  /** Shape value, a list of symbolic extents. */
  public static class ShapeExpr extends Expr {
    public final ImmutableList<PrimExpr> values;

    ShapeExpr(Pos pos, ImmutableList<PrimExpr> values, StructInfo structInfo) {
      super(pos, Op.SHAPE_EXPR, structInfo);
      this.values = requireNonNull(values);
    }
  }

  /** Symbolic integer used as a value. */
  public static class PrimValue extends Expr {
    public final PrimExpr value;

    PrimValue(Pos pos, PrimExpr value) {
      super(pos, Op.PRIM_VALUE, ObjectStructInfo.INSTANCE);
      this.value = requireNonNull(value);
    }
  }

  /** String constant. */
  public static class StringImm extends Expr {
    public final String value;

    StringImm(Pos pos, String value) {
      super(pos, Op.STRING_IMM, ObjectStructInfo.INSTANCE);
      this.value = requireNonNull(value);
    }
  }

  /**
   * Call of an operator, external function or function reference.
   *
   * <p>{@link #sinfoArgs} are hints, declared by whoever built the call,
   * about the struct info of the result; pseudo-calls such as
   * "relax.call_tir" need them because their callee is opaque.
   */
  public static class Call extends Expr {
    /** The callee. Its kind is given by {@link #calleeKind()}. */
    public final Expr callee;
    public final ImmutableList<Expr> args;
    public final @Nullable Attrs attrs;
    public final ImmutableList<StructInfo> sinfoArgs;

    Call(
        Pos pos,
        Expr callee,
        ImmutableList<Expr> args,
        @Nullable Attrs attrs,
        ImmutableList<StructInfo> sinfoArgs,
        @Nullable StructInfo structInfo) {
      super(pos, Op.CALL, structInfo);
      this.callee = requireNonNull(callee);
      this.args = requireNonNull(args);
      this.attrs = attrs;
      this.sinfoArgs = requireNonNull(sinfoArgs);
      checkArgument(
          isCallee(callee.op), "TypeError: Unsupported op: %s", callee.op);
    }

    private static boolean isCallee(Op op) {
      switch (op) {
        case EXTERN_FUNC:
        case PRIMITIVE_OP:
        case VAR:
        case GLOBAL_VAR:
          return true;
        default:
          return false;
      }
    }

    /** Returns which kind of thing is being called. */
    public CalleeKind calleeKind() {
      switch (callee.op) {
        case EXTERN_FUNC:
          return CalleeKind.EXTERN_FUNC;
        case PRIMITIVE_OP:
          return CalleeKind.PRIMITIVE_OP;
        default:
          return CalleeKind.REFERENCE;
      }
    }

    /** Returns a name for the callee, for use in messages. */
    public String calleeName() {
      switch (callee.op) {
        case EXTERN_FUNC:
          return ((ExternFunc) callee).globalSymbol;
        case PRIMITIVE_OP:
          return ((PrimitiveOp) callee).name;
        case VAR:
          return ((Var) callee).name;
        default:
          return ((GlobalVar) callee).name;
      }
    }

    /** Whether this is a call to the primitive operator of a given name. */
    public boolean isCallTo(String opName) {
      return callee.op == Op.PRIMITIVE_OP
          && ((PrimitiveOp) callee).name.equals(opName);
    }

    /**
     * Returns the attributes, cast to the schema class.
     *
     * @throws IllegalArgumentException if the attributes are missing or of a
     *     different schema
     */
    public <A extends Attrs> A attrs(Class<A> attrsClass) {
      checkArgument(
          attrsClass.isInstance(attrs),
          "call to %s has attributes %s; expected %s",
          calleeName(),
          attrs == null ? null : attrs.typeKey(),
          attrsClass.getSimpleName());
      return attrsClass.cast(attrs);
    }

    /** Returns a copy of this call with the given struct info. */
    public Call withStructInfo(StructInfo structInfo) {
      if (Objects.equals(structInfo, this.structInfo)) {
        return this;
      }
      return new Call(pos, callee, args, attrs, sinfoArgs, structInfo);
    }

    /** Returns a copy of this call with different arguments. */
    public Call withArgs(ImmutableList<Expr> args) {
      if (args.equals(this.args)) {
        return this;
      }
      return new Call(pos, callee, args, attrs, sinfoArgs, structInfo);
    }
  }

  /** The three kinds of callee. */
  public enum CalleeKind {
    /** An {@link ExternFunc}. */
    EXTERN_FUNC,
    /** A {@link PrimitiveOp}. */
    PRIMITIVE_OP,
    /** A {@link Var} or {@link GlobalVar}. */
    REFERENCE
  }
}

// End Ir.java
