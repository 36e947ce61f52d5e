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
package net.hydromatic.forth.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.forth.util.ForthException;

/** An error occurred during compilation. */
public class CompileException extends RuntimeException
    implements ForthException {
  private final Kind kind;

  public CompileException(Kind kind, String detail) {
    super(kind.message(detail));
    this.kind = requireNonNull(kind);
  }

  /** Creates an exception for a reference to a word that does not exist. */
  public static CompileException unknownWord(String name) {
    return new CompileException(Kind.UNKNOWN_WORD, name);
  }

  /** Creates an exception for a malformed definition. */
  public static CompileException invalidWord(String detail) {
    return new CompileException(Kind.INVALID_WORD, detail);
  }

  /** Creates an exception for a definition that has no ";". */
  public static CompileException unterminated() {
    return new CompileException(Kind.UNTERMINATED, "");
  }

  @Override
  public Kind kind() {
    return kind;
  }
}

// End CompileException.java
