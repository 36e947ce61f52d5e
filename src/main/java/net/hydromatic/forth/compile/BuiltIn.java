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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in words.
 *
 * <p>A built-in is recognized by name, independent of the dictionary. Its
 * behavior is implemented in {@link net.hydromatic.forth.eval.Machine}.
 */
public enum BuiltIn {
  /** Stack effect "a -- ". */
  DROP("drop", 1, "a --"),

  /** Stack effect "a -- a a". */
  DUP("dup", 1, "a -- a a"),

  /** Stack effect "a b -- b a". */
  SWAP("swap", 2, "a b -- b a"),

  /** Stack effect "a b -- a b a". */
  OVER("over", 2, "a b -- a b a"),

  /** Stack effect "a b c -- b c a". */
  ROT("rot", 3, "a b c -- b c a"),

  /** Stack effect "a b -- ". */
  TWO_DROP("2drop", 2, "a b --"),

  /** Stack effect "a b -- a b a b". */
  TWO_DUP("2dup", 2, "a b -- a b a b"),

  /** Stack effect "a b c d -- a b c d a b". */
  TWO_OVER("2over", 4, "a b c d -- a b c d a b"),

  /** Stack effect "a b c d -- c d a b". */
  TWO_SWAP("2swap", 4, "a b c d -- c d a b"),

  /** Writes the top of the stack as a character. */
  EMIT("emit", 1, "n --"),

  /** Writes a newline. */
  CR("cr", 0, "--"),

  /** Writes a space. */
  SPACE("space", 0, "--"),

  /** Writes as many spaces as the top of the stack. */
  SPACES("spaces", 1, "n --"),

  /** Writes the top of the stack as a number. */
  DISPLAY(".", 1, "n --"),

  /** Writes the whole stack, leaving it unchanged. */
  SHOW(".s", 0, "--"),

  /** Ends the session. */
  BYE("bye", "quit", 0, "--"),

  /** Remainder. */
  MOD("mod", 2, "a b -- a%b"),

  /** Remainder and quotient. */
  SLASH_MOD("/mod", 2, "a b -- a%b a/b");

  /** Name, as it appears in source code. */
  public final String word;

  /** Alternative name, or null. */
  public final @Nullable String alias;

  /** Number of values that must be on the stack before this word runs. */
  public final int arity;

  /** Stack effect, in conventional notation. */
  public final String stackEffect;

  /** Map of built-ins, keyed by {@link #word} and {@link #alias}. */
  public static final ImmutableMap<String, BuiltIn> BY_WORD;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.word, builtIn);
      if (builtIn.alias != null) {
        b.put(builtIn.alias, builtIn);
      }
    }
    BY_WORD = b.build();
  }

  BuiltIn(String word, int arity, String stackEffect) {
    this(word, null, arity, stackEffect);
  }

  BuiltIn(
      String word, @Nullable String alias, int arity, String stackEffect) {
    this.word = requireNonNull(word, "word");
    this.alias = alias;
    this.arity = arity;
    this.stackEffect = requireNonNull(stackEffect, "stackEffect");
  }

  /** Returns the built-in with a given name, or null. */
  public static @Nullable BuiltIn lookup(String word) {
    return BY_WORD.get(word);
  }

  @Override
  public String toString() {
    return word;
  }
}

// End BuiltIn.java
