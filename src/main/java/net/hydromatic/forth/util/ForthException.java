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
package net.hydromatic.forth.util;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error that can be reported to the user of a session.
 *
 * <p>Implemented by {@link net.hydromatic.forth.compile.CompileException},
 * for errors detected while compiling a line, and {@link
 * net.hydromatic.forth.eval.ForthRuntimeException}, for errors detected while
 * executing it.
 */
public interface ForthException {
  /** Returns the kind of error. */
  Kind kind();

  /** Returns the message, without the "Error:" prefix. */
  String getMessage();

  /** Writes a description of this error, as shown to the user. */
  default StringBuilder describeTo(StringBuilder buf) {
    return buf.append("? Error: ").append(getMessage());
  }

  /** Kinds of error. */
  enum Kind {
    DIVISION_BY_ZERO("Division by zero"),
    STACK_UNDERFLOW("Stack underflow"),
    UNKNOWN_WORD("Unknown word"),
    INVALID_WORD("Invalid word"),
    UNTERMINATED("Unterminated definition"),
    /** Not a true error; raised by "bye" and "quit" to end the session. */
    USER_QUIT("Quit");

    public final String description;

    Kind(String description) {
      this.description = description;
    }

    /** Creates a message for this kind of error. */
    public String message(@Nullable String detail) {
      return detail == null || detail.isEmpty()
          ? description
          : description + ": " + detail;
    }
  }
}

// End ForthException.java
