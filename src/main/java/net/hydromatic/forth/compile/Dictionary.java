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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.forth.ast.Op;
import net.hydromatic.forth.ast.Token;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mapping from word names to their meanings.
 *
 * <p>Names are case-insensitive. Each entry is either a number (a {@link
 * Token.Literal}) or a fully resolved {@link Token.Definition}. An entry
 * captures the meaning of every word it uses at the time it was defined, so
 * redefining a word does not change the entries that used it.
 *
 * <p>Entries can be added or overwritten, but not removed.
 */
public class Dictionary {
  private final Map<String, Token> map = new LinkedHashMap<>();

  /** Creates an empty Dictionary. */
  public Dictionary() {}

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  /**
   * Binds a name to a number or a definition, replacing any previous binding.
   *
   * @throws CompileException if the value is neither a number nor a
   *     definition
   */
  public void define(String name, Token value) {
    requireNonNull(name, "name");
    if (value.op != Op.NUMBER && value.op != Op.DEFINITION) {
      throw CompileException.invalidWord(
          "cannot bind '" + name + "' to " + value.op);
    }
    map.put(key(name), value);
  }

  /** Returns the meaning of a word, or null if it is not defined. */
  public @Nullable Token lookup(String name) {
    return map.get(key(name));
  }

  /** Returns whether a word is defined. */
  public boolean contains(String name) {
    return map.containsKey(key(name));
  }

  /** Returns the names of the defined words, in order of first definition. */
  public ImmutableList<String> names() {
    return ImmutableList.copyOf(map.keySet());
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End Dictionary.java
