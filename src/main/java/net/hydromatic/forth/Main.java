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
package net.hydromatic.forth;

import static net.hydromatic.forth.util.Static.str;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.forth.eval.Prop;
import net.hydromatic.forth.eval.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forth REPL that reads from a stream and writes to a stream. */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final BufferedReader in;
  private final PrintWriter out;
  private final StringWriter chars = new StringWriter();
  final boolean idempotent;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Main main =
        new Main(argList, System.in, System.out, new LinkedHashMap<>(), false);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(
      List<String> argList,
      InputStream in,
      PrintStream out,
      Map<Prop, Object> propMap,
      boolean idempotent) {
    this(
        argList,
        new InputStreamReader(in),
        new OutputStreamWriter(out),
        propMap,
        idempotent);
  }

  /**
   * Creates a Main.
   *
   * <p>In idempotent mode, lines of input that start with "> " are ignored,
   * and each line of output is prefixed with "> ". If the input is a script
   * whose output lines are up to date, and "--echo" is specified, the output
   * is identical to the input.
   */
  public Main(
      List<String> argList,
      Reader in,
      Writer out,
      Map<Prop, Object> propMap,
      boolean idempotent) {
    this.in = buffer(idempotent ? stripOutLines(in) : in);
    this.out = buffer(out);
    this.idempotent = idempotent;
    this.session = new Session(parseArgs(argList, propMap), chars);
  }

  /** Applies command-line arguments to a property map, and returns it. */
  static Map<Prop, Object> parseArgs(
      List<String> argList, Map<Prop, Object> propMap) {
    for (String arg : argList) {
      if (arg.equals("--echo")) {
        Prop.ECHO.set(propMap, true);
      } else if (arg.equals("--debug")) {
        Prop.DEBUG.set(propMap, true);
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap, arg.substring(i + 1));
      }
    }
    return propMap;
  }

  private static Reader stripOutLines(Reader in) {
    final StringBuilder b = new StringBuilder();
    try (BufferedReader r = buffer(in)) {
      for (; ; ) {
        final String line = r.readLine();
        if (line == null) {
          break;
        }
        if (line.startsWith("> ") || line.equals(">")) {
          continue;
        }
        b.append(line).append('\n');
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return new StringReader(b.toString());
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  /**
   * Reads and evaluates lines until the end of input, or until a line
   * executes "bye" or "quit".
   */
  public void run() {
    final Consumer<String> outLines =
        idempotent ? x -> out.println(prefixLines(x)) : out::println;
    final boolean echo = Prop.ECHO.booleanValue(session.map);
    try {
      for (; ; ) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          out.println(line);
        }
        if (!command(line, outLines)) {
          break;
        }
      }
    } catch (IOException e) {
      LOGGER.warn("error reading input", e);
    }
    out.flush();
  }

  /**
   * Evaluates a line and writes its result.
   *
   * @return whether to continue reading lines
   */
  boolean command(String line, Consumer<String> outLines) {
    return session.command(line, () -> str(chars), outLines);
  }

  /** Precedes every line in 's' with a caret. */
  private static String prefixLines(String s) {
    String s2 = "> " + s.replace("\n", "\n> ");
    return s2.replace("> \n", ">\n");
  }
}

// End Main.java
