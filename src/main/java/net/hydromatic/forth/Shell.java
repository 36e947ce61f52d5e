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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.forth.util.Static.str;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Runnables;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.forth.compile.BuiltIn;
import net.hydromatic.forth.compile.Operator;
import net.hydromatic.forth.eval.Prop;
import net.hydromatic.forth.eval.Session;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Command shell for Forth, powered by JLine3. */
public class Shell {
  private final ConfigImpl config;
  private final Terminal terminal;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Shell main = create(ImmutableList.copyOf(args), System.in,
          System.out);
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(List<String> args, InputStream in,
      OutputStream out) throws IOException {
    final Config config = parse(ConfigImpl.DEFAULT, args);
    return create(config, in, out);
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in,
      OutputStream out) throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    final ConfigImpl configImpl = (ConfigImpl) config;
    builder.system(configImpl.system);
    builder.dumb(configImpl.dumb);
    if (configImpl.dumb) {
      builder.type("dumb");
    }
    final Terminal terminal = builder.build();
    return new Shell(config, terminal);
  }

  /** Creates a Shell. */
  public Shell(Config config, Terminal terminal) {
    this.config = (ConfigImpl) config;
    this.terminal = terminal;
  }

  /** Parses an argument list to an equivalent Config. */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    final Map<Prop, Object> propMap = new LinkedHashMap<>(c.propMap);
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      } else if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      } else if (arg.equals("--echo")) {
        c = c.withEcho(true);
      } else if (arg.equals("--help")) {
        c = c.withHelp(true);
      } else if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      } else if (arg.equals("--debug")) {
        Prop.DEBUG.set(propMap, true);
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Prop.lookup(arg.substring(2, i))
            .setLenient(propMap, arg.substring(i + 1));
      }
    }
    return c.withPropMap(propMap);
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
        "Usage: java " + Shell.class.getName()
            + " [--banner=false] [--terminal=dumb] [--system=false]"
            + " [--echo] [--debug] [--prompt=<prompt>] [--help]",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    outLines.accept("List of available commands:");
    outLines.accept("    help          Print this help");
    outLines.accept("    bye, quit     Quit shell");
    outLines.accept("    : name ... ;  Define a word");
    outLines.accept("Built-in words:");
    for (Operator operator : Operator.values()) {
      outLines.accept(
          String.format(Locale.ROOT, "    %-13s a b -- a%sb",
              operator.symbol, operator.symbol));
    }
    for (BuiltIn builtIn : BuiltIn.values()) {
      final String name = builtIn.alias == null
          ? builtIn.word
          : builtIn.word + ", " + builtIn.alias;
      outLines.accept(
          String.format(Locale.ROOT, "    %-13s %s", name,
              builtIn.stackEffect));
    }
  }

  /**
   * Pauses after creating the terminal.
   *
   * <p>Calls the value set by {@link Config#withPauseFn(Runnable)} which,
   * for the default config, does nothing;
   * the instance used in testing pauses for a few milliseconds,
   * which gives classes time to load and makes test deterministic.
   */
  protected final void pause() {
    config.pauseFn.run();
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "forth version 0.1.0"
        + " (java version \"" + System.getProperty("java.version")
        + "\", JRE " + System.getProperty("java.vendor.version")
        + " (build " + System.getProperty("java.vm.version")
        + "), " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    if (config.help) {
      usage(terminal.writer()::println);
      terminal.writer().flush();
      return;
    }

    final String prompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold())
        .append(Prop.PROMPT.stringValue(config.propMap))
        .style(AttributedStyle.DEFAULT)
        .toAnsi(terminal);

    if (config.banner) {
      terminal.writer().println(banner());
    }
    final LineReader lineReader = LineReaderBuilder.builder()
        .appName("forth")
        .terminal(terminal)
        .build();

    pause();
    final LineFn lineFn = new TerminalLineFn(prompt, lineReader);
    final SubShell subShell =
        new SubShell(lineFn, config.echo, terminal.writer()::println,
            new LinkedHashMap<>(config.propMap));
    subShell.run();
    terminal.writer().flush();
  }

  /** Shell configuration. */
  @SuppressWarnings("unused")
  public interface Config {
    Config DEFAULT =
        new ConfigImpl(true, false, true, false, false, ImmutableMap.of(),
            Runnables.doNothing());

    Config withBanner(boolean banner);
    Config withDumb(boolean dumb);
    Config withSystem(boolean system);
    Config withEcho(boolean echo);
    Config withHelp(boolean help);
    Config withPropMap(Map<Prop, Object> propMap);
    Config withPauseFn(Runnable runnable);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final boolean banner;
    private final boolean dumb;
    private final boolean echo;
    private final boolean help;
    private final boolean system;
    private final ImmutableMap<Prop, Object> propMap;
    private final Runnable pauseFn;

    private ConfigImpl(boolean banner, boolean dumb, boolean system,
        boolean echo, boolean help, ImmutableMap<Prop, Object> propMap,
        Runnable pauseFn) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.echo = echo;
      this.help = help;
      this.propMap = requireNonNull(propMap, "propMap");
      this.pauseFn = requireNonNull(pauseFn, "pauseFn");
    }

    @Override public ConfigImpl withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withEcho(boolean echo) {
      if (this.echo == echo) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withPropMap(Map<Prop, Object> propMap) {
      if (this.propMap.equals(propMap)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help,
          ImmutableMap.copyOf(propMap), pauseFn);
    }

    @Override public ConfigImpl withPauseFn(Runnable pauseFn) {
      if (this.pauseFn.equals(pauseFn)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }
  }

  /**
   * Abstraction of a terminal's line reader. Can read lines from an input
   * (terminal or file) and categorize the lines.
   */
  interface LineFn {
    Line read();
  }

  /** Type of line from {@link LineFn}. */
  enum LineType {
    EOF,
    INTERRUPT,
    HELP,
    REGULAR
  }

  /** Line read by a {@link LineFn}. */
  static class Line {
    static final Line EOF = new Line(LineType.EOF, "");
    static final Line INTERRUPT = new Line(LineType.INTERRUPT, "");
    static final Line HELP = new Line(LineType.HELP, "");

    final LineType type;
    final String text;

    Line(LineType type, String text) {
      this.type = requireNonNull(type);
      this.text = requireNonNull(text);
    }

    static Line regular(String text) {
      return new Line(LineType.REGULAR, text);
    }
  }

  /**
   * Simplified shell that works in both interactive mode (where input and
   * output is a terminal) and batch mode (where input is a file, and output
   * is to an array of lines).
   */
  static class SubShell {
    private final LineFn lineFn;
    private final boolean echo;
    private final Consumer<String> outLines;
    private final StringWriter chars = new StringWriter();
    private final Session session;

    SubShell(LineFn lineFn, boolean echo, Consumer<String> outLines,
        Map<Prop, Object> propMap) {
      this.lineFn = lineFn;
      this.echo = echo;
      this.outLines = outLines;
      this.session = new Session(propMap, chars);
    }

    void run() {
      for (;;) {
        final Line line = lineFn.read();
        switch (line.type) {
        case EOF:
          return;

        case INTERRUPT:
          continue;

        case HELP:
          help(outLines);
          continue;

        case REGULAR:
          if (echo) {
            outLines.accept(line.text);
          }
          if (!command(line.text)) {
            return;
          }
          break;

        default:
          throw new AssertionError(line.type);
        }
      }
    }

    /** Evaluates a line; returns whether to keep reading. */
    private boolean command(String code) {
      return session.command(code, () -> str(chars), outLines);
    }
  }

  /** Implementation of {@link LineFn} that reads from a reader. */
  static class ReaderLineFn implements LineFn {
    private final BufferedReader reader;

    ReaderLineFn(BufferedReader reader) {
      this.reader = reader;
    }

    @Override public Line read() {
      try {
        final String line = reader.readLine();
        if (line == null) {
          return Line.EOF;
        }
        return Line.regular(line);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }

  /**
   * Implementation of {@link LineFn} that reads from JLine's terminal.
   * It is used for interactive sessions.
   */
  private static class TerminalLineFn implements LineFn {
    private final String prompt;
    private final LineReader lineReader;

    TerminalLineFn(String prompt, LineReader lineReader) {
      this.prompt = prompt;
      this.lineReader = lineReader;
    }

    @Override public Line read() {
      final String line;
      try {
        line = lineReader.readLine(prompt);
      } catch (UserInterruptException e) {
        return Line.INTERRUPT;
      } catch (EndOfFileException e) {
        return Line.EOF;
      }
      final String trimmed = line.trim();
      if (trimmed.equalsIgnoreCase("help") || trimmed.equals("?")) {
        return Line.HELP;
      }
      return Line.regular(line);
    }
  }
}

// End Shell.java
