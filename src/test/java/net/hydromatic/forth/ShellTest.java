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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.StringContains.containsString;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.forth.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests the Shell. */
public class ShellTest {
  private static final List<String> DUMB_ARG_LIST =
      ImmutableList.of("--system=false", "--terminal=dumb", "--banner=false");

  /** Runs a shell on a dumb terminal, and returns its output. */
  private static String shell(List<String> argList, String in)
      throws IOException {
    final ByteArrayInputStream inStream =
        new ByteArrayInputStream(in.getBytes(UTF_8));
    final ByteArrayOutputStream outStream = new ByteArrayOutputStream();
    final Shell shell = Shell.create(argList, inStream, outStream);
    shell.run();
    return outStream.toString(UTF_8);
  }

  /** Runs a sub-shell on some lines, and returns its lines of output. */
  private static List<String> subShell(String in, boolean echo,
      Map<Prop, Object> propMap) {
    final List<String> lines = new ArrayList<>();
    final Shell.LineFn lineFn =
        new Shell.ReaderLineFn(new BufferedReader(new StringReader(in)));
    new Shell.SubShell(lineFn, echo, lines::add, propMap).run();
    return lines;
  }

  /** Tests {@link Shell} with empty input. */
  @Test void testShell() throws IOException {
    final List<String> argList =
        ImmutableList.of("--system=false", "--terminal=dumb");
    assertThat(shell(argList, ""), containsString("forth version"));
  }

  /** Tests {@link Shell} with one line. */
  @Test void testOneLine() throws IOException {
    assertThat(shell(DUMB_ARG_LIST, "5 6 +\n"), containsString("11 Ok"));
  }

  @Test void testHelpLine() throws IOException {
    final String out = shell(DUMB_ARG_LIST, "help\n");
    assertThat(out, containsString("List of available commands:"));
    assertThat(out, containsString("Built-in words:"));
  }

  @Test void testUsage() throws IOException {
    final List<String> argList =
        ImmutableList.of("--system=false", "--terminal=dumb", "--help");
    assertThat(shell(argList, "1 2 +\n"),
        containsString("Usage: java net.hydromatic.forth.Shell"));
  }

  @Test void testHelp() {
    final List<String> lines = new ArrayList<>();
    Shell.help(lines::add);
    assertThat(lines.get(0), is("List of available commands:"));
    assertThat(lines, hasItem("    +             a b -- a+b"));
    assertThat(lines, hasItem("    dup           a -- a a"));
    assertThat(lines, hasItem("    bye, quit     --"));
  }

  @Test void testSubShell() {
    final String in = "5 6 +\n"
        + ": sq dup * ;\n"
        + "sq\n"
        + ".s\n"
        + "1 0 /\n"
        + "bye\n"
        + "7\n";
    final List<String> expected =
        ImmutableList.of("11 Ok",
            " Ok",
            " Ok",
            "<1> 121  Ok",
            "? Error: Division by zero");
    assertThat(subShell(in, false, new LinkedHashMap<>()), is(expected));
  }

  @Test void testSubShellEcho() {
    final List<String> expected =
        ImmutableList.of("65 emit", "A65 Ok", "quit");
    assertThat(subShell("65 emit\nquit\n", true, new LinkedHashMap<>()),
        is(expected));
  }

  /** Tests that output written before "bye" is shown. */
  @Test void testSubShellQuit() {
    assertThat(subShell("65 emit bye\n", false, new LinkedHashMap<>()),
        is(ImmutableList.of("A")));
  }

  @Test void testSubShellDebug() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DEBUG.set(propMap, true);
    assertThat(subShell("1\n", false, propMap),
        is(ImmutableList.of("lexemes [1]\ntokens [1]\n1 Ok")));
  }
}

// End ShellTest.java
