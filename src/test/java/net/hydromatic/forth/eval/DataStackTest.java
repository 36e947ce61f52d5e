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

import static net.hydromatic.forth.Matchers.isError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.forth.util.ForthException.Kind;
import org.junit.jupiter.api.Test;

/** Tests {@link DataStack}. */
public class DataStackTest {
  @Test void testPushPop() {
    final DataStack stack = new DataStack();
    assertThat(stack.isEmpty(), is(true));
    stack.push(1);
    stack.push(2.5);
    stack.push(3);
    assertThat(stack.size(), is(3));
    assertThat(stack.toList(), is(ImmutableList.of(1d, 2.5d, 3d)));
    assertThat(stack.toString(), is("[1.0, 2.5, 3.0]"));
    assertThat(stack.peek(0), is(3d));
    assertThat(stack.peek(2), is(1d));
    assertThat(stack.pop(), is(3d));
    assertThat(stack.pop(), is(2.5d));
    assertThat(stack.size(), is(1));
  }

  @Test void testUnderflow() {
    final DataStack stack = new DataStack();
    assertThat(assertThrows(ForthRuntimeException.class, stack::pop),
        isError(Kind.STACK_UNDERFLOW));
    stack.push(7);
    assertThat(assertThrows(ForthRuntimeException.class, () -> stack.peek(1)),
        isError(Kind.STACK_UNDERFLOW));
    assertThat(assertThrows(ForthRuntimeException.class,
            () -> stack.require(2)),
        isError(Kind.STACK_UNDERFLOW));
    stack.require(1);
    stack.require(0);
    // A failed check leaves the stack unchanged
    assertThat(stack.toList(), is(ImmutableList.of(7d)));
  }

  /** Tests that {@link DataStack#toList()} returns a copy. */
  @Test void testToList() {
    final DataStack stack = new DataStack();
    stack.push(1);
    final ImmutableList<Double> list = stack.toList();
    stack.push(2);
    assertThat(list, is(ImmutableList.of(1d)));
  }
}

// End DataStackTest.java
