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
package net.hydromatic.forth.util;

import java.io.StringWriter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities. */
public class Static {
  private Static() {}

  /** Largest magnitude at which every integral double prints exactly. */
  private static final double MAX_EXACT = 1e15;

  /**
   * Decimal floating-point literal: optional sign, digits with an optional
   * fraction (or a fraction alone), and an optional exponent.
   */
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)(e[+-]?\\d+)?");

  /**
   * Parses a lexeme as a 64-bit floating-point number; returns null if it is
   * not a number.
   *
   * <p>Accepts decimal literals such as "1", "-2.5", ".5", "1e3", and the
   * special values "inf", "infinity" and "nan", with optional sign. Unlike
   * {@link Double#parseDouble(String)}, does not accept hexadecimal literals,
   * type suffixes such as "1d", or surrounding whitespace.
   */
  public static @Nullable Double parseNumber(String s) {
    final String lower = s.toLowerCase(Locale.ROOT);
    if (DECIMAL.matcher(lower).matches()) {
      return Double.parseDouble(lower);
    }
    final boolean negative = lower.startsWith("-");
    final String unsigned =
        negative || lower.startsWith("+") ? lower.substring(1) : lower;
    switch (unsigned) {
      case "inf":
      case "infinity":
        return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      case "nan":
        return Double.NaN;
      default:
        return null;
    }
  }

  /**
   * Formats a number for output.
   *
   * <p>Integral values print without a fractional part ("11", not "11.0");
   * other values print as {@link Double#toString(double)} does.
   */
  public static String format(double d) {
    if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT) {
      if (d == 0d) {
        return "0"; // also negative zero
      }
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  /**
   * Returns the contents of a {@link StringWriter} and clears it for the next
   * use.
   */
  public static String str(StringWriter w) {
    final StringBuffer b = w.getBuffer();
    final String s = b.toString();
    b.setLength(0);
    return s;
  }

  /** Returns every element of a list but its first element. */
  public static <E> List<E> skip(List<E> list) {
    return list.subList(1, list.size());
  }
}

// End Static.java
