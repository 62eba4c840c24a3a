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

import static java.util.Objects.requireNonNull;

import net.hydromatic.tensile.ast.ObjectPath;
import net.hydromatic.tensile.ast.Pos;
import net.hydromatic.tensile.compile.CompileException;

/** Error while printing: the object, or a field of it, cannot be printed. */
public class PrinterTypeException extends CompileException {
  private final ObjectPath path;

  public PrinterTypeException(String message, ObjectPath path) {
    super(message, Pos.ZERO);
    this.path = requireNonNull(path);
  }

  /** Returns the path, from the object being printed, of the culprit. */
  public ObjectPath path() {
    return path;
  }

  @Override
  public String toString() {
    return getClass().getName() + ": " + getMessage() + " at " + path;
  }
}

// End PrinterTypeException.java
