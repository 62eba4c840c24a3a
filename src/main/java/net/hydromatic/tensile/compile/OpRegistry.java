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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.tensile.op.BuiltInOps;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of operators, keyed by name.
 *
 * <p>Operators are registered once, before any compilation, and then only
 * read.
 */
public class OpRegistry {
  private final Map<String, OpDef> map;
  private final boolean mutable;

  /** Creates an empty registry. */
  public OpRegistry() {
    this(new LinkedHashMap<>(), true);
  }

  private OpRegistry(Map<String, OpDef> map, boolean mutable) {
    this.map = map;
    this.mutable = mutable;
  }

  /**
   * Returns the registry of built-in operators.
   *
   * <p>It is shared and read-only; to add operators, start from
   * {@link #withBuiltIns()}.
   */
  public static OpRegistry builtIn() {
    return BuiltInHolder.INSTANCE;
  }

  /**
   * Creates a registry that contains the built-in operators, to which more
   * operators may be added.
   */
  public static OpRegistry withBuiltIns() {
    final OpRegistry registry = new OpRegistry();
    BuiltInOps.registerAll(registry);
    return registry;
  }

  /**
   * Registers an operator.
   *
   * @throws IllegalArgumentException if an operator of the same name is
   *     already registered
   * @throws IllegalStateException if this registry is read-only
   */
  public OpRegistry register(OpDef def) {
    if (!mutable) {
      throw new IllegalStateException("cannot register operator " + def.name
          + " in read-only registry");
    }
    if (map.containsKey(def.name)) {
      throw new IllegalArgumentException(
          "operator " + def.name + " is already registered");
    }
    map.put(def.name, def);
    return this;
  }

  /** Looks up an operator by name; returns null if not found. */
  public @Nullable OpDef lookup(String name) {
    return map.get(name);
  }

  /** Looks up an operator by name. Throws if not found; never returns null. */
  public OpDef get(String name) {
    final OpDef def = map.get(name);
    if (def == null) {
      throw new IllegalArgumentException("operator " + name + " not found");
    }
    return def;
  }

  /** Returns the names of registered operators, in order of registration. */
  public ImmutableList<String> names() {
    return ImmutableList.copyOf(map.keySet());
  }

  /** Holds the built-in registry, created on first use. */
  private static class BuiltInHolder {
    static final OpRegistry INSTANCE =
        new OpRegistry(ImmutableMap.copyOf(withBuiltIns().map), false);
  }
}

// End OpRegistry.java
