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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.forth.compile.BuiltIn;
import net.hydromatic.forth.compile.Operator;
import net.hydromatic.forth.util.Static;

/**
 * Executable token.
 *
 * <p>The set of sub-classes is closed; each has a distinct {@link Op}, and
 * code that processes tokens switches on {@link #op}.
 */
public abstract class Token {
  public final Op op;

  Token(Op op) {
    this.op = requireNonNull(op);
  }

  /** Creates a number literal. */
  public static Literal literal(double value) {
    return new Literal(value);
  }

  /** Creates a token for an arithmetic operator. */
  public static Operation operation(Operator operator) {
    return new Operation(operator);
  }

  /** Creates a token for a built-in word. */
  public static Primitive primitive(BuiltIn builtIn) {
    return new Primitive(builtIn);
  }

  /** Creates an unresolved reference to a word. */
  public static Word word(String name) {
    return new Word(name);
  }

  /** Creates a definition from a list of resolved tokens. */
  public static Definition definition(List<? extends Token> body) {
    return new Definition(ImmutableList.copyOf(body));
  }

  /** Creates a definition block. */
  public static DefinitionBlock definitionBlock(
      String name, List<String> lexemes) {
    return new DefinitionBlock(name, ImmutableList.copyOf(lexemes));
  }

  /** Writes this token to a builder. */
  abstract StringBuilder unparse(StringBuilder buf);

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Numeric literal. */
  public static class Literal extends Token {
    public final double value;

    Literal(double value) {
      super(Op.NUMBER);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && Double.compare(value, ((Literal) o).value) == 0;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(Static.format(value));
    }
  }

  /** Arithmetic operator, such as "+". */
  public static class Operation extends Token {
    public final Operator operator;

    Operation(Operator operator) {
      super(Op.OPERATOR);
      this.operator = requireNonNull(operator);
    }

    @Override
    public int hashCode() {
      return operator.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Operation && operator == ((Operation) o).operator;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(operator.symbol);
    }
  }

  /** Built-in word, such as "dup". */
  public static class Primitive extends Token {
    public final BuiltIn builtIn;

    Primitive(BuiltIn builtIn) {
      super(Op.BUILTIN);
      this.builtIn = requireNonNull(builtIn);
    }

    @Override
    public int hashCode() {
      return builtIn.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Primitive && builtIn == ((Primitive) o).builtIn;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(builtIn.word);
    }
  }

  /**
   * Reference to a word by name. Resolved against the dictionary when
   * executed.
   */
  public static class Word extends Token {
    public final String name;

    Word(String name) {
      super(Op.WORD);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Word && name.equals(((Word) o).name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /**
   * Body of a user-defined word.
   *
   * <p>Every token in the body is resolved: a number, an operator, a built-in,
   * or another definition. A definition never contains a {@link Word}, so
   * executing it never consults the dictionary.
   */
  public static class Definition extends Token {
    public final ImmutableList<Token> body;

    Definition(ImmutableList<Token> body) {
      super(Op.DEFINITION);
      this.body = requireNonNull(body);
      for (Token token : body) {
        checkArgument(token.op.resolved, "unresolved token %s", token);
      }
    }

    /**
     * Returns whether this definition consists of a single literal. Such a
     * definition acts as a variable: invoking it produces the literal.
     */
    public boolean isVariable() {
      return body.size() == 1 && body.get(0).op == Op.NUMBER;
    }

    @Override
    public int hashCode() {
      return body.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Definition && body.equals(((Definition) o).body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append('[');
      for (int i = 0; i < body.size(); i++) {
        if (i > 0) {
          buf.append(' ');
        }
        body.get(i).unparse(buf);
      }
      return buf.append(']');
    }
  }

  /** Raw text of a definition, between ":" and ";". */
  public static class DefinitionBlock extends Token {
    public final String name;
    public final ImmutableList<String> lexemes;

    DefinitionBlock(String name, ImmutableList<String> lexemes) {
      super(Op.DEFINITION_BLOCK);
      this.name = requireNonNull(name);
      this.lexemes = requireNonNull(lexemes);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, lexemes);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DefinitionBlock
              && name.equals(((DefinitionBlock) o).name)
              && lexemes.equals(((DefinitionBlock) o).lexemes);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(": ").append(name);
      lexemes.forEach(lexeme -> buf.append(' ').append(lexeme));
      return buf.append(" ;");
    }
  }
}

// End Token.java
