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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests {@link Lexer}. */
public class LexerTest {
  @Test void testLex() {
    assertThat(Lexer.lex("1 2 +"), is(ImmutableList.of("1", "2", "+")));
    assertThat(Lexer.lex(": foo 5 ;"),
        is(ImmutableList.of(":", "foo", "5", ";")));
    assertThat(Lexer.lex("dup"), is(ImmutableList.of("dup")));
  }

  @Test void testEmpty() {
    assertThat(Lexer.lex(""), is(ImmutableList.of()));
  }

  /** Tests that lexemes are converted to lower case. */
  @Test void testLowerCase() {
    assertThat(Lexer.lex("DUP Swap 2DROP"),
        is(ImmutableList.of("dup", "swap", "2drop")));
    assertThat(Lexer.lex("1E3 INF"), is(ImmutableList.of("1e3", "inf")));
  }

  /** Tests that each whitespace character separates, so that a run of
   * whitespace yields empty lexemes. */
  @Test void testWhitespace() {
    assertThat(Lexer.lex("1  2"), is(ImmutableList.of("1", "", "2")));
    assertThat(Lexer.lex("1\t2\u000B3"),
        is(ImmutableList.of("1", "2", "3")));
    assertThat(Lexer.lex(" 1"), is(ImmutableList.of("", "1")));
  }

  /** Tests that characters other than whitespace are never separators. */
  @Test void testPunctuation() {
    assertThat(Lexer.lex("1+2 ;;"), is(ImmutableList.of("1+2", ";;")));
    assertThat(Lexer.lex(".s ."), is(ImmutableList.of(".s", ".")));
  }
}

// End LexerTest.java
