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

import net.hydromatic.tensile.ast.Pos;

/**
 * Error in inferring the struct info of a call.
 *
 * <p>Thrown when a relation that an operator requires between its operands is
 * proven false, or when the operands are malformed. The enclosing function
 * cannot be compiled.
 */
public class TypeException extends CompileException {
  private final String opName;

  public TypeException(String message, String opName, Pos pos) {
    super(message, pos);
    this.opName = requireNonNull(opName);
  }

  /** Returns the name of the operator whose call failed. */
  public String opName() {
    return opName;
  }
}

// End TypeException.java
