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
package net.hydromatic.tensile.arith;

/**
 * Outcome of trying to prove a condition.
 *
 * <p>{@link #UNKNOWN} is not an error. It means that the condition depends on
 * the values of variables in a way the analyzer cannot see through; the caller
 * decides whether to accept the condition as an assumption.
 */
public enum Proof {
  /** The condition holds for every value of its variables. */
  PROVEN,
  /** The condition holds for no value of its variables. */
  DISPROVEN,
  /** The condition may or may not hold. */
  UNKNOWN;

  /** Returns the outcome of proving the negated condition. */
  public Proof negate() {
    switch (this) {
      case PROVEN:
        return DISPROVEN;
      case DISPROVEN:
        return PROVEN;
      default:
        return UNKNOWN;
    }
  }

  /** Combines the outcomes of the two arms of a conjunction. */
  public Proof and(Proof other) {
    if (this == DISPROVEN || other == DISPROVEN) {
      return DISPROVEN;
    }
    return this == PROVEN && other == PROVEN ? PROVEN : UNKNOWN;
  }

  /** Combines the outcomes of the two arms of a disjunction. */
  public Proof or(Proof other) {
    if (this == PROVEN || other == PROVEN) {
      return PROVEN;
    }
    return this == DISPROVEN && other == DISPROVEN ? DISPROVEN : UNKNOWN;
  }

  /** Converts a known truth value. */
  public static Proof of(boolean b) {
    return b ? PROVEN : DISPROVEN;
  }
}

// End Proof.java
