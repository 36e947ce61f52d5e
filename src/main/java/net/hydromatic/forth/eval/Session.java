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

import com.google.common.collect.ImmutableList;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import net.hydromatic.forth.ast.Token;
import net.hydromatic.forth.compile.Compiler;
import net.hydromatic.forth.compile.Dictionary;
import net.hydromatic.forth.parse.Lexer;
import net.hydromatic.forth.util.ForthException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session.
 *
 * <p>Owns the stack and the dictionary. They are created empty, and live
 * as long as the session. Each call to {@link #eval(String)} compiles and
 * executes one line against them.
 *
 * <p>Not thread-safe.
 */
public class Session {
  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  /** Property values. */
  public final Map<Prop, Object> map;

  private final DataStack stack = new DataStack();
  private final Dictionary dictionary = new Dictionary();
  private final Compiler compiler = new Compiler(dictionary);
  private final PrintWriter out;
  private final Machine machine;

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied.
   *
   * @param map Map that contains property values
   * @param out Writer that receives the characters written by words such as
   *     "emit" and "."
   */
  public Session(Map<Prop, Object> map, Writer out) {
    this.map = requireNonNull(map, "map");
    this.out =
        out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    this.machine = new Machine(stack, dictionary, this.out);
  }

  /** Creates a Session with default properties that discards output. */
  public Session() {
    this(new LinkedHashMap<>(), Writer.nullWriter());
  }

  /**
   * Evaluates a line.
   *
   * <p>An empty line, or a line that consists only of whitespace, has no
   * effect and returns null.
   *
   * <p>If evaluation fails, changes made by tokens before the one that failed
   * remain: definitions closed, values pushed and popped, characters written.
   *
   * @param line Line of input
   * @return the last value produced, or null if no value was produced
   * @throws RuntimeException that implements {@link ForthException} if
   *     compilation or execution fails; if "bye" or "quit" is executed, its
   *     {@link ForthException#kind()} is {@link ForthException.Kind#USER_QUIT}
   */
  public @Nullable Double eval(String line) {
    final String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      final List<String> lexemes = Lexer.lex(trimmed);
      if (Prop.DEBUG.booleanValue(map)) {
        out.println("lexemes " + lexemes);
      }
      final List<Token> tokens = compiler.compile(lexemes);
      if (Prop.DEBUG.booleanValue(map)) {
        out.println("tokens " + tokens);
      }
      return machine.run(tokens);
    } catch (RuntimeException e) {
      if (e instanceof ForthException) {
        LOGGER.debug("line [{}] failed: {}", trimmed, e.getMessage());
      }
      throw e;
    } finally {
      out.flush();
    }
  }

  /**
   * Evaluates a line and writes its result as one line of output.
   *
   * <p>The output line starts with the characters written by the line,
   * followed by the value (if any) and " Ok", or by a description of the
   * error. If the line executes "bye" or "quit", the output line contains
   * only the characters, and is omitted if there are none.
   *
   * @param line Line of input
   * @param chars Supplies the characters written since the previous call
   * @param outLines Receives the line of output
   * @return whether to continue reading lines
   */
  public boolean command(String line, Supplier<String> chars,
      Consumer<String> outLines) {
    final StringBuilder buf = new StringBuilder();
    try {
      final Double value = eval(line);
      buf.append(chars.get());
      if (value != null) {
        buf.append(format(value));
      }
      outLines.accept(buf.append(" Ok").toString());
      return true;
    } catch (RuntimeException e) {
      buf.append(chars.get());
      if (isQuit(e)) {
        if (buf.length() > 0) {
          outLines.accept(buf.toString());
        }
        return false;
      }
      handle(e, buf);
      outLines.accept(buf.toString());
      return true;
    }
  }

  /** Binds a word to a number, as if it were defined ": name value ;". */
  public void define(String name, double value) {
    dictionary.define(
        name, Token.definition(ImmutableList.of(Token.literal(value))));
  }

  /** Returns the contents of the stack, bottom first. */
  public ImmutableList<Double> stack() {
    return stack.toList();
  }

  /** Returns the dictionary. */
  public Dictionary dictionary() {
    return dictionary;
  }

  /** Writes a description of an error to a buffer. */
  public void handle(RuntimeException e, StringBuilder buf) {
    if (e instanceof ForthException) {
      ((ForthException) e).describeTo(buf);
    } else {
      buf.append(e);
    }
  }

  /** Returns whether an exception is the signal to end the session. */
  public static boolean isQuit(RuntimeException e) {
    return e instanceof ForthException
        && ((ForthException) e).kind() == ForthException.Kind.USER_QUIT;
  }
}

// End Session.java
