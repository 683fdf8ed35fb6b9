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
package net.hydromatic.verity.ast;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Name}. */
class NameTest {
  @Test
  void testInterned() {
    final Name name = Name.of("nat.succ");
    assertThat(name, sameInstance(Name.of("nat").str("succ")));
    assertThat(Name.of("a.1"), sameInstance(Name.of("a").num(1)));
    assertThat(Name.of("a.1") == Name.of("a").str("x"), is(false));
  }

  @Test
  void testComponents() {
    final Name name = Name.of("foo.bar.12");
    assertThat(name.components(), is(ImmutableList.of("foo", "bar", "12")));
    assertThat(name.last(), is("12"));
    assertThat(name.prefix(), sameInstance(Name.of("foo.bar")));
    assertThat(name.toString(), is("foo.bar.12"));
  }

  @Test
  void testAnonymous() {
    assertThat(Name.of(""), sameInstance(Name.ANONYMOUS));
    assertThat(Name.ANONYMOUS.isAnonymous(), is(true));
    assertThat(Name.of("x").isAnonymous(), is(false));
    assertThat(Name.ANONYMOUS.toString(), is("[anonymous]"));
    assertThat(Name.ANONYMOUS.components().isEmpty(), is(true));
    assertThrows(NullPointerException.class, Name.ANONYMOUS::prefix);
  }

  @Test
  void testFresh() {
    final Name l = Name.of("l");
    assertThat(l.fresh(ImmutableSet.of(Name.of("u"))), sameInstance(l));
    assertThat(l.fresh(ImmutableSet.of(l)), is(Name.of("l_1")));
    assertThat(l.fresh(ImmutableSet.of(l, Name.of("l_1"))),
        is(Name.of("l_2")));
  }

  @Test
  void testCompare() {
    assertThat(Name.of("a.b").compareTo(Name.of("a.c")) < 0, is(true));
    assertThat(Name.of("b").compareTo(Name.of("a.c")) > 0, is(true));
    assertThat(Name.of("a.b").compareTo(Name.of("a.b")), is(0));
  }
}

// End NameTest.java
