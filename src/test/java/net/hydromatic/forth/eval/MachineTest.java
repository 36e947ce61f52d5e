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

import static net.hydromatic.forth.Matchers.isError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.io.StringWriter;
import net.hydromatic.forth.ast.Token;
import net.hydromatic.forth.compile.BuiltIn;
import net.hydromatic.forth.compile.Dictionary;
import net.hydromatic.forth.compile.Operator;
import net.hydromatic.forth.util.ForthException.Kind;
import org.junit.jupiter.api.Test;

/** Tests {@link Machine}. */
public class MachineTest {
  private final DataStack stack = new DataStack();
  private final Dictionary dictionary = new Dictionary();
  private final StringWriter sw = new StringWriter();
  private final Machine machine =
      new Machine(stack, dictionary, new PrintWriter(sw, true));

  @Test void testRun() {
    final Double value =
        machine.run(
            ImmutableList.of(Token.literal(2), Token.literal(3),
                Token.operation(Operator.MULTIPLY)));
    assertThat(value, is(6d));
    assertThat(stack.toList(), is(ImmutableList.of(6d)));
    assertThat(machine.run(ImmutableList.of()), nullValue());
  }

  /** Tests that the value is the last produced, even if a later token
   * consumes it. */
  @Test void testLastProduced() {
    final Double value =
        machine.run(
            ImmutableList.of(Token.literal(2), Token.literal(3),
                Token.primitive(BuiltIn.SWAP)));
    assertThat(value, is(3d));
    assertThat(stack.toList(), is(ImmutableList.of(3d, 2d)));
  }

  @Test void testDivide() {
    stack.push(1);
    stack.push(4);
    assertThat(machine.eval(Token.operation(Operator.DIVIDE)), is(0.25d));
    stack.push(1);
    stack.push(0);
    assertThat(
        assertThrows(ForthRuntimeException.class,
            () -> machine.eval(Token.operation(Operator.DIVIDE))),
        isError(Kind.DIVISION_BY_ZERO));
    assertThat(stack.toList(), is(ImmutableList.of(1d, 0d)));
  }

  @Test void testSlashMod() {
    stack.push(7);
    stack.push(-2);
    assertThat(machine.eval(Token.primitive(BuiltIn.SLASH_MOD)), is(-3.5d));
    assertThat(stack.toList(), is(ImmutableList.of(1d)));
  }

  /** Tests a word that is not in the dictionary but has the name of a
   * built-in or operator. */
  @Test void testWordFallback() {
    stack.push(5);
    assertThat(machine.eval(Token.word("dup")), is(5d));
    stack.push(5);
    assertThat(machine.eval(Token.word("+")), is(10d));
    assertThat(
        assertThrows(ForthRuntimeException.class,
            () -> machine.eval(Token.word("foo"))),
        isError(Kind.UNKNOWN_WORD));
  }

  @Test void testVariable() {
    dictionary.define("x", Token.literal(42));
    dictionary.define("y",
        Token.definition(ImmutableList.of(Token.literal(43))));
    assertThat(machine.eval(Token.word("x")), is(42d));
    assertThat(machine.eval(Token.word("y")), is(43d));
    // eval does not push; run does
    assertThat(stack.isEmpty(), is(true));
  }

  /** Tests that a definition with more than one token pushes its values and
   * produces nothing. */
  @Test void testDefinition() {
    final Token.Definition definition =
        Token.definition(
            ImmutableList.of(Token.literal(1), Token.literal(2),
                Token.primitive(BuiltIn.OVER)));
    assertThat(machine.eval(definition), nullValue());
    assertThat(stack.toList(), is(ImmutableList.of(1d, 2d, 1d)));
  }

  @Test void testDefinitionBlock() {
    assertThat(
        assertThrows(ForthRuntimeException.class,
            () -> machine.eval(
                Token.definitionBlock("foo", ImmutableList.of("1")))),
        isError(Kind.INVALID_WORD));
  }

  @Test void testOutput() {
    machine.run(
        ImmutableList.of(Token.literal(79), Token.primitive(BuiltIn.EMIT),
            Token.literal(75), Token.primitive(BuiltIn.EMIT),
            Token.primitive(BuiltIn.SPACE), Token.literal(1.5),
            Token.primitive(BuiltIn.DISPLAY), Token.literal(2),
            Token.primitive(BuiltIn.SPACES), Token.primitive(BuiltIn.SHOW)));
    assertThat(sw.toString(), is("OK 1.5   <0> "));
  }

  /** Tests that "spaces" rejects a count too large to write, and leaves the
   * stack as it was. */
  @Test void testSpacesLimit() {
    stack.push(3e9);
    assertThat(
        assertThrows(ForthRuntimeException.class,
            () -> machine.eval(Token.primitive(BuiltIn.SPACES))),
        isError(Kind.INVALID_WORD));
    assertThat(stack.toList(), is(ImmutableList.of(3e9)));
    stack.push(Double.POSITIVE_INFINITY);
    assertThrows(ForthRuntimeException.class,
        () -> machine.eval(Token.primitive(BuiltIn.SPACES)));
    stack.push(Machine.MAX_SPACES);
    assertThat(machine.eval(Token.primitive(BuiltIn.SPACES)), nullValue());
    assertThat(sw.toString().length(), is(Machine.MAX_SPACES));
    assertThat(stack.toList(),
        is(ImmutableList.of(3e9, Double.POSITIVE_INFINITY)));
  }

  /** Tests that "emit" writes only ASCII characters. */
  @Test void testEmitRange() {
    for (double n : new double[] {65601, 128, -1, Double.NaN}) {
      stack.push(n);
      assertThat(
          assertThrows(ForthRuntimeException.class,
              () -> machine.eval(Token.primitive(BuiltIn.EMIT))),
          isError(Kind.INVALID_WORD));
      assertThat(stack.toList(), is(ImmutableList.of(n)));
      stack.pop();
    }
    stack.push(0);
    stack.push(127);
    machine.eval(Token.primitive(BuiltIn.EMIT));
    machine.eval(Token.primitive(BuiltIn.EMIT));
    assertThat(sw.toString(), is("\u007f\u0000"));
    assertThat(stack.isEmpty(), is(true));
  }

  @Test void testBye() {
    stack.push(1);
    assertThat(
        assertThrows(ForthRuntimeException.class,
            () -> machine.eval(Token.primitive(BuiltIn.BYE))),
        isError(Kind.USER_QUIT));
    assertThat(stack.toList(), is(ImmutableList.of(1d)));
  }
}

// End MachineTest.java
