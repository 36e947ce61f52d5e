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
package net.hydromatic.forth.ast;

/** Sub-types of {@link Token}. */
public enum Op {
  NUMBER(true),
  OPERATOR(true),
  BUILTIN(true),
  /** Reference to a word, not yet resolved; occurs only at top level. */
  WORD(false),
  DEFINITION(true),
  /** Raw body of a definition; consumed by the compiler. */
  DEFINITION_BLOCK(false);

  /**
   * Whether a token of this kind is resolved, and may therefore occur in the
   * body of a {@link Token.Definition}.
   */
  public final boolean resolved;

  Op(boolean resolved) {
    this.resolved = resolved;
  }
}

// End Op.java
