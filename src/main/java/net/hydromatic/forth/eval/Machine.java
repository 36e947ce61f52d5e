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
import static net.hydromatic.forth.util.Static.format;

import java.io.PrintWriter;
import java.util.List;
import net.hydromatic.forth.ast.Token;
import net.hydromatic.forth.compile.BuiltIn;
import net.hydromatic.forth.compile.Dictionary;
import net.hydromatic.forth.compile.Operator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Stack machine that executes tokens.
 *
 * <p>Executing a token may produce a value. The machine pushes each produced
 * value onto the stack before it executes the next token.
 *
 * <p>Every operation checks that the stack holds enough values (and, for
 * division, that the divisor is not zero; for "emit" and "spaces", that the
 * operand is in range) before it removes anything. So an operation that
 * fails leaves the stack as it found it; but values pushed by earlier tokens
 * remain.
 */
public class Machine {
  /** Largest count that "spaces" accepts. */
  static final int MAX_SPACES = 1 << 16;

  private final DataStack stack;
  private final Dictionary dictionary;
  private final PrintWriter out;

  /** Creates a Machine. */
  public Machine(DataStack stack, Dictionary dictionary, PrintWriter out) {
    this.stack = requireNonNull(stack, "stack");
    this.dictionary = requireNonNull(dictionary, "dictionary");
    this.out = requireNonNull(out, "out");
  }

  /**
   * Executes a list of tokens.
   *
   * @return the last value produced by any of the tokens, or null if none of
   *     them produced a value
   */
  public @Nullable Double run(List<Token> tokens) {
    Double last = null;
    for (Token token : tokens) {
      final Double value = eval(token);
      if (value != null) {
        stack.push(value);
        last = value;
      }
    }
    return last;
  }

  /** Executes a token and returns the value it produces, or null. */
  @Nullable Double eval(Token token) {
    switch (token.op) {
      case NUMBER:
        return ((Token.Literal) token).value;
      case OPERATOR:
        return apply(((Token.Operation) token).operator);
      case BUILTIN:
        return apply(((Token.Primitive) token).builtIn);
      case WORD:
        return call(((Token.Word) token).name);
      case DEFINITION:
        return execute((Token.Definition) token);
      case DEFINITION_BLOCK:
        throw ForthRuntimeException.invalidWord(
            "definition of '"
                + ((Token.DefinitionBlock) token).name
                + "' cannot be executed");
      default:
        throw new AssertionError("unknown op " + token.op);
    }
  }

  /** Executes the word with a given name. */
  private @Nullable Double call(String name) {
    final Token token = dictionary.lookup(name);
    if (token != null) {
      switch (token.op) {
        case NUMBER:
          return ((Token.Literal) token).value;
        case DEFINITION:
          return execute((Token.Definition) token);
        default:
          throw ForthRuntimeException.invalidWord(
              "'" + name + "' is bound to " + token.op);
      }
    }
    final Operator operator = Operator.lookup(name);
    if (operator != null) {
      return apply(operator);
    }
    final BuiltIn builtIn = BuiltIn.lookup(name);
    if (builtIn != null) {
      return apply(builtIn);
    }
    throw ForthRuntimeException.unknownWord(name);
  }

  /**
   * Executes a definition. A definition that is a single literal produces
   * that literal; any other definition pushes the values produced by its
   * body, and produces nothing itself.
   */
  private @Nullable Double execute(Token.Definition definition) {
    if (definition.isVariable()) {
      return ((Token.Literal) definition.body.get(0)).value;
    }
    run(definition.body);
    return null;
  }

  private double apply(Operator operator) {
    stack.require(2);
    if (operator == Operator.DIVIDE) {
      checkDivisor();
    }
    final double b = stack.pop();
    final double a = stack.pop();
    return operator.apply(a, b);
  }

  private void checkDivisor() {
    if (stack.peek(0) == 0d) {
      throw ForthRuntimeException.divisionByZero();
    }
  }

  private @Nullable Double apply(BuiltIn builtIn) {
    stack.require(builtIn.arity);
    double a;
    double b;
    double c;
    double d;
    switch (builtIn) {
      case DROP:
        stack.pop();
        return null;

      case DUP:
        return stack.peek(0);

      case SWAP:
        b = stack.pop();
        a = stack.pop();
        stack.push(b);
        stack.push(a);
        return null;

      case OVER:
        return stack.peek(1);

      case ROT:
        c = stack.pop();
        b = stack.pop();
        a = stack.pop();
        stack.push(b);
        stack.push(c);
        stack.push(a);
        return null;

      case TWO_DROP:
        stack.pop();
        stack.pop();
        return null;

      case TWO_DUP:
        stack.push(stack.peek(1));
        return stack.peek(1);

      case TWO_OVER:
        stack.push(stack.peek(3));
        return stack.peek(3);

      case TWO_SWAP:
        d = stack.pop();
        c = stack.pop();
        b = stack.pop();
        a = stack.pop();
        stack.push(c);
        stack.push(d);
        stack.push(a);
        stack.push(b);
        return null;

      case EMIT:
        a = stack.peek(0);
        if (!(a >= 0 && a < 128)) {
          throw ForthRuntimeException.invalidWord(
              "emit: " + format(a) + " is not an ASCII character");
        }
        stack.pop();
        out.print((char) (int) a);
        return null;

      case CR:
        out.println();
        return null;

      case SPACE:
        out.print(' ');
        return null;

      case SPACES:
        a = stack.peek(0);
        if (a > MAX_SPACES) {
          throw ForthRuntimeException.invalidWord(
              "spaces: count " + format(a) + " exceeds " + MAX_SPACES);
        }
        stack.pop();
        for (int i = 0, n = (int) a; i < n; i++) {
          out.print(' ');
        }
        return null;

      case DISPLAY:
        out.print(format(stack.pop()));
        out.print(' ');
        return null;

      case SHOW:
        out.print('<');
        out.print(stack.size());
        out.print("> ");
        for (Double value : stack.toList()) {
          out.print(format(value));
          out.print(' ');
        }
        return null;

      case BYE:
        throw ForthRuntimeException.userQuit();

      case MOD:
        checkDivisor();
        b = stack.pop();
        a = stack.pop();
        return a % b;

      case SLASH_MOD:
        checkDivisor();
        b = stack.pop();
        a = stack.pop();
        stack.push(a % b);
        return a / b;

      default:
        throw new AssertionError("unknown built-in " + builtIn);
    }
  }
}

// End Machine.java
