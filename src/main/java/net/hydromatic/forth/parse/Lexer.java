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
package net.hydromatic.forth.parse;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.Locale;

/**
 * Splits a line of input into lexemes.
 *
 * <p>A lexeme is the text between two whitespace characters, converted to
 * lower case. Each whitespace character is a separator, so a run of
 * whitespace produces empty lexemes.
 */
public class Lexer {
  private static final Splitter SPLITTER =
      Splitter.on(CharMatcher.whitespace());

  private Lexer() {}

  /** Splits a line into lexemes. Never fails. */
  public static ImmutableList<String> lex(String line) {
    if (line.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<String> lexemes = ImmutableList.builder();
    for (String s : SPLITTER.split(line)) {
      lexemes.add(s.toLowerCase(Locale.ROOT));
    }
    return lexemes.build();
  }
}

// End Lexer.java
