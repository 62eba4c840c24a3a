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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Path from the root of a printed object to one of its parts, such as
 * {@code <root>.args[1]} or {@code <root>.attrs.strides}.
 *
 * <p>The printer passes a path down as it descends into an object, so that
 * an error can say which part of the object could not be printed.
 */
public abstract class ObjectPath {
  private static final ObjectPath ROOT = new Root();

  final @Nullable ObjectPath parent;

  private ObjectPath(@Nullable ObjectPath parent) {
    this.parent = parent;
  }

  /** Returns the root path. */
  public static ObjectPath root() {
    return ROOT;
  }

  /** Returns the path of a named attribute of this object. */
  public ObjectPath attr(String name) {
    return new Attr(this, name);
  }

  /** Returns the path of an element of this array. */
  public ObjectPath arrayIndex(int index) {
    return new ArrayIndex(this, index);
  }

  /** Returns the parent path, or null if this is the root. */
  public @Nullable ObjectPath parent() {
    return parent;
  }

  /** Returns whether this path is {@code other} or lies under it. */
  public boolean startsWith(ObjectPath other) {
    for (ObjectPath p = this; p != null; p = p.parent) {
      if (p.equals(other)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  abstract StringBuilder describeTo(StringBuilder buf);

  /** The root of all paths. */
  private static class Root extends ObjectPath {
    Root() {
      super(null);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return buf.append("<root>");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Root;
    }

    @Override
    public int hashCode() {
      return 0;
    }
  }

  /** Path of a named attribute. */
  private static class Attr extends ObjectPath {
    final String name;

    Attr(ObjectPath parent, String name) {
      super(requireNonNull(parent));
      this.name = requireNonNull(name);
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return requireNonNull(parent).describeTo(buf).append('.').append(name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Attr
              && name.equals(((Attr) o).name)
              && requireNonNull(parent).equals(((Attr) o).parent);
    }

    @Override
    public int hashCode() {
      return requireNonNull(parent).hashCode() * 31 + name.hashCode();
    }
  }

  /** Path of an array element. */
  private static class ArrayIndex extends ObjectPath {
    final int index;

    ArrayIndex(ObjectPath parent, int index) {
      super(requireNonNull(parent));
      this.index = index;
    }

    @Override
    StringBuilder describeTo(StringBuilder buf) {
      return requireNonNull(parent)
          .describeTo(buf)
          .append('[')
          .append(index)
          .append(']');
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayIndex
              && index == ((ArrayIndex) o).index
              && requireNonNull(parent).equals(((ArrayIndex) o).parent);
    }

    @Override
    public int hashCode() {
      return requireNonNull(parent).hashCode() * 37 + index;
    }
  }
}

// End ObjectPath.java
