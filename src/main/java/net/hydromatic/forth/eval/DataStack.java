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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Stack of numbers.
 *
 * <p>An operation that needs several values calls {@link #require(int)}
 * before it pops any of them, so that if there are not enough values the
 * stack is left unchanged.
 */
public class DataStack {
  private final List<Double> values = new ArrayList<>();

  /** Adds a value to the top of the stack. */
  public void push(double value) {
    values.add(value);
  }

  /** Removes and returns the value on top of the stack. */
  public double pop() {
    require(1);
    return values.remove(values.size() - 1);
  }

  /**
   * Returns the value at a given depth without removing it; depth 0 is the
   * top of the stack.
   */
  public double peek(int depth) {
    require(depth + 1);
    return values.get(values.size() - 1 - depth);
  }

  /**
   * Checks that the stack holds at least {@code n} values.
   *
   * @throws ForthRuntimeException if there are fewer than {@code n} values
   */
  public void require(int n) {
    if (values.size() < n) {
      throw ForthRuntimeException.stackUnderflow();
    }
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Returns a copy of the contents, bottom first. */
  public ImmutableList<Double> toList() {
    return ImmutableList.copyOf(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

// End DataStack.java
