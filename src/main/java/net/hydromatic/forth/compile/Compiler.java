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
import static net.hydromatic.forth.util.Static.parseNumber;
import static net.hydromatic.forth.util.Static.skip;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.forth.ast.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts lexemes into tokens.
 *
 * <p>Definitions (text between ":" and ";") are not returned as tokens. When
 * the compiler reaches the ";" that closes a definition, it resolves every
 * word in the body against the dictionary as it is at that moment, and binds
 * the result in the dictionary.
 */
public class Compiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

  static final String COLON = ":";
  static final String SEMICOLON = ";";

  private final Dictionary dictionary;

  /** Creates a Compiler that reads and writes a given dictionary. */
  public Compiler(Dictionary dictionary) {
    this.dictionary = requireNonNull(dictionary, "dictionary");
  }

  /**
   * Compiles a list of lexemes into a list of top-level tokens, and defines
   * any words whose definitions occur in the list.
   *
   * <p>Definitions are installed as soon as their ";" is reached. If
   * compilation fails, definitions that were closed earlier in the list
   * remain installed.
   *
   * @throws CompileException if a definition is malformed, refers to an
   *     unknown word, or is not terminated
   */
  public ImmutableList<Token> compile(List<String> lexemes) {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (int i = 0; i < lexemes.size(); i++) {
      final String lexeme = lexemes.get(i);
      if (lexeme.isEmpty()) {
        continue;
      }
      if (lexeme.equals(COLON)) {
        final List<String> captured = new ArrayList<>();
        int j = i + 1;
        for (; ; ++j) {
          if (j >= lexemes.size()) {
            throw CompileException.unterminated();
          }
          final String lexeme2 = lexemes.get(j);
          if (lexeme2.equals(SEMICOLON)) {
            break;
          }
          if (!lexeme2.isEmpty()) {
            captured.add(lexeme2);
          }
        }
        if (captured.isEmpty()) {
          throw CompileException.invalidWord("definition has no name");
        }
        define(Token.definitionBlock(captured.get(0), skip(captured)));
        i = j;
      } else if (lexeme.equals(SEMICOLON)) {
        throw CompileException.invalidWord("';' outside of a definition");
      } else {
        tokens.add(topLevel(lexeme));
      }
    }
    return tokens.build();
  }

  /** Converts a lexeme that is not part of a definition. */
  private Token topLevel(String lexeme) {
    final Double value = parseNumber(lexeme);
    if (value != null) {
      return Token.literal(value);
    }
    if (dictionary.contains(lexeme)) {
      // Resolved when it runs; user-defined words hide built-ins.
      return Token.word(lexeme);
    }
    final Operator operator = Operator.lookup(lexeme);
    if (operator != null) {
      return Token.operation(operator);
    }
    final BuiltIn builtIn = BuiltIn.lookup(lexeme);
    if (builtIn != null) {
      return Token.primitive(builtIn);
    }
    return Token.word(lexeme);
  }

  /**
   * Resolves a definition block and binds it in the dictionary, replacing
   * any previous definition of the same name.
   */
  public void define(Token.DefinitionBlock block) {
    final Token.Definition definition = resolve(block);
    dictionary.define(block.name, definition);
    LOGGER.debug("defined '{}' as {}", block.name, definition);
  }

  /**
   * Converts a definition block to a definition, resolving each word in its
   * body against the current state of the dictionary.
   *
   * <p>Does not modify the dictionary. The body may refer to the name being
   * defined, and gets its current meaning.
   */
  public Token.Definition resolve(Token.DefinitionBlock block) {
    if (parseNumber(block.name) != null) {
      throw CompileException.invalidWord(
          "cannot use number '" + block.name + "' as a name");
    }
    if (block.name.equals(COLON)) {
      throw CompileException.invalidWord("cannot use ':' as a name");
    }
    final List<Token> body = new ArrayList<>();
    for (String lexeme : block.lexemes) {
      body.add(resolve(lexeme));
    }
    return Token.definition(body);
  }

  /** Resolves a lexeme in the body of a definition. */
  private Token resolve(String lexeme) {
    final Double value = parseNumber(lexeme);
    if (value != null) {
      return Token.literal(value);
    }
    if (lexeme.equals(COLON)) {
      throw CompileException.invalidWord("definitions cannot be nested");
    }
    final Token token = dictionary.lookup(lexeme);
    if (token != null) {
      // A number, or a definition whose body is already resolved.
      return token;
    }
    final Operator operator = Operator.lookup(lexeme);
    if (operator != null) {
      return Token.operation(operator);
    }
    final BuiltIn builtIn = BuiltIn.lookup(lexeme);
    if (builtIn != null) {
      return Token.primitive(builtIn);
    }
    throw CompileException.unknownWord(lexeme);
  }
}

// End Compiler.java
