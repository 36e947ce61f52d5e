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
package net.hydromatic.forth.eval;

import static java.util.Objects.requireNonNull;

import net.hydromatic.forth.util.ForthException;

/** An error occurred while executing tokens. */
public class ForthRuntimeException extends RuntimeException
    implements ForthException {
  private final Kind kind;

  /** Creates a ForthRuntimeException. */
  public ForthRuntimeException(Kind kind, String detail) {
    super(kind.message(detail));
    this.kind = requireNonNull(kind);
  }

  public static ForthRuntimeException divisionByZero() {
    return new ForthRuntimeException(Kind.DIVISION_BY_ZERO, "");
  }

  public static ForthRuntimeException stackUnderflow() {
    return new ForthRuntimeException(Kind.STACK_UNDERFLOW, "");
  }

  public static ForthRuntimeException unknownWord(String name) {
    return new ForthRuntimeException(Kind.UNKNOWN_WORD, name);
  }

  public static ForthRuntimeException invalidWord(String detail) {
    return new ForthRuntimeException(Kind.INVALID_WORD, detail);
  }

  /** Creates the signal raised by "bye" and "quit". */
  public static ForthRuntimeException userQuit() {
    return new ForthRuntimeException(Kind.USER_QUIT, "");
  }

  @Override
  public Kind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return kind + ": " + getMessage();
  }
}

// End ForthRuntimeException.java
