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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Binary arithmetic operator. */
public enum Operator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/");

  /** Symbol, as it appears in source code. */
  public final String symbol;

  private static final ImmutableMap<String, Operator> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Operator> b = ImmutableMap.builder();
    for (Operator operator : values()) {
      b.put(operator.symbol, operator);
    }
    BY_SYMBOL = b.build();
  }

  Operator(String symbol) {
    this.symbol = symbol;
  }

  /** Returns the operator with a given symbol, or null. */
  public static @Nullable Operator lookup(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  /**
   * Applies this operator to two operands, {@code a} being the one further
   * from the top of the stack.
   *
   * <p>Does not check for division by zero; the caller does that.
   */
  public double apply(double a, double b) {
    switch (this) {
      case ADD:
        return a + b;
      case SUBTRACT:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return a / b;
      default:
        throw new AssertionError("unknown operator " + this);
    }
  }

  @Override
  public String toString() {
    return symbol;
  }
}

// End Operator.java
