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

import static net.hydromatic.verity.ast.ExprBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit test for {@link Expr}, {@link ExprBuilder} and {@link Exprs}. */
class ExprTest {
  private final Expr nat = term.constant(Name.of("nat"));
  private final Expr zero = term.constant(Name.of("nat.zero"));
  private final Expr succ = term.constant(Name.of("nat.succ"));
  private final Expr.Local x =
      term.local(1L, Name.of("x"), nat, BinderInfo.DEFAULT);
  private final Expr.Local y =
      term.local(2L, Name.of("y"), nat, BinderInfo.DEFAULT);

  @Test
  void testInterned() {
    assertThat(term.app(succ, zero), sameInstance(term.app(succ, zero)));
    assertThat(term.lambda("n", nat, term.var(0)),
        sameInstance(term.lambda("n", nat, term.var(0))));
    assertThat(term.var(100), sameInstance(term.var(100)));
    assertThat(term.local(1L, Name.of("x"), nat, BinderInfo.DEFAULT),
        sameInstance(x));
    // Binder names and binder info take part in identity.
    assertThat(term.lambda("m", nat, term.var(0))
        == term.lambda("n", nat, term.var(0)), is(false));
  }

  @Test
  void testCachedProperties() {
    assertThat(term.var(3).looseBound(), is(4));
    assertThat(term.lambda("n", nat, term.var(1)).looseBound(), is(1));
    assertThat(term.lambda("n", nat, term.var(0)).looseBound(), is(0));
    assertThat(term.pi("n", term.var(2), term.var(0)).looseBound(), is(3));
    assertThat(term.app(succ, x).hasLocals(), is(true));
    assertThat(term.app(succ, x).isClosed(), is(false));
    assertThat(term.app(succ, zero).isClosed(), is(true));
    assertThat(term.sort(Level.param("u")).hasLevelParams(), is(true));
    assertThat(term.constant(Name.of("c"), ImmutableList.of(Level.ONE))
        .hasLevelParams(), is(false));
  }

  @Test
  void testApps() {
    final Expr f = term.constant(Name.of("f"));
    final Expr e = term.apps(f, x, y, zero);
    assertThat(e.getAppFn(), sameInstance(f));
    assertThat(e.getAppArgs(), is(ImmutableList.<Expr>of(x, y, zero)));
    assertThat(e.getAppNumArgs(), is(3));
    assertThat(f.getAppArgs().isEmpty(), is(true));
    assertThat(f.isConst(Name.of("f")), is(true));
    assertThat(e.isConst(Name.of("f")), is(false));
  }

  /** The last value replaces {@code #0}. */
  @Test
  void testInstantiate() {
    final Expr e = term.app(term.var(1), term.var(0));
    assertThat(Exprs.instantiate(e, ImmutableList.of(x, y)),
        sameInstance(term.app(x, y)));
    assertThat(Exprs.instantiate(e, zero),
        sameInstance(term.app(term.var(0), zero)));

    // Under a binder, the replaced variables are shifted.
    final Expr lambda = term.lambda("n", nat, term.app(term.var(1),
        term.var(0)));
    assertThat(Exprs.instantiate(lambda, x),
        sameInstance(term.lambda("n", nat, term.app(x, term.var(0)))));

    // A value with loose variables is lifted under binders.
    assertThat(Exprs.instantiate(lambda, term.var(5)),
        sameInstance(
            term.lambda("n", nat, term.app(term.var(6), term.var(0)))));

    // Variables beyond the values are renumbered down.
    assertThat(Exprs.instantiate(term.var(3), ImmutableList.of(x, y)),
        sameInstance(term.var(1)));
  }

  /** Returns {@code fun ... => e} with {@code n} binders. */
  private Expr lambdas(int n, Expr e) {
    for (int i = 0; i < n; i++) {
      e = term.lambda("a" + i, nat, e);
    }
    return e;
  }

  /** Returns a term of depth {@code depth} in which each node is
   * {@code app(child, child)}, so it has only {@code depth + 1} distinct
   * sub-terms. */
  private static Expr shared(Expr leaf, int depth) {
    Expr e = leaf;
    for (int i = 0; i < depth; i++) {
      e = term.app(e, e);
    }
    return e;
  }

  /** Substitution visits each shared sub-term once, however many binders
   * enclose it. */
  @Test
  @Timeout(value = 30)
  void testSharingUnderManyBinders() {
    final int n = 12;
    final int depth = 40;
    final Expr e = lambdas(n, shared(term.var(n), depth));
    assertThat(Exprs.instantiate(e, zero),
        sameInstance(lambdas(n, shared(zero, depth))));
    assertThat(Exprs.lift(e, 2),
        sameInstance(lambdas(n, shared(term.var(n + 2), depth))));
    assertThat(
        Exprs.abstractLocals(lambdas(n, shared(x, depth)),
            ImmutableList.of(x)),
        sameInstance(e));
  }

  @Test
  void testAbstractLocals() {
    final Expr e = term.app(x, y);
    assertThat(Exprs.abstractLocals(e, ImmutableList.of(x, y)),
        sameInstance(term.app(term.var(1), term.var(0))));
    assertThat(Exprs.abstractLocals(e, ImmutableList.of(y)),
        sameInstance(term.app(x, term.var(0))));
    final Expr abstracted =
        Exprs.abstractLocals(e, ImmutableList.of(x, y));
    assertThat(Exprs.instantiate(abstracted, ImmutableList.of(x, y)),
        sameInstance(e));
  }

  @Test
  void testBind() {
    final Expr.Local n =
        term.local(3L, Name.of("n"), nat, BinderInfo.IMPLICIT);
    final Expr.Local h =
        term.local(4L, Name.of("h"), term.app(term.constant(Name.of("p")), n),
            BinderInfo.DEFAULT);
    final Expr pi = term.pi(ImmutableList.of(n, h), term.app(succ, n));
    final Expr expected =
        term.pi(BinderInfo.IMPLICIT, Name.of("n"), nat,
            term.pi(BinderInfo.DEFAULT, Name.of("h"),
                term.app(term.constant(Name.of("p")), term.var(0)),
                term.app(succ, term.var(1))));
    assertThat(pi, sameInstance(expected));
    assertThat(pi.isClosed(), is(true));
  }

  @Test
  void testLift() {
    final Expr e = term.lambda("n", nat, term.app(term.var(0), term.var(1)));
    assertThat(Exprs.lift(e, 2),
        sameInstance(
            term.lambda("n", nat, term.app(term.var(0), term.var(3)))));
    assertThat(Exprs.lift(zero, 2), sameInstance(zero));
    assertThat(term.arrow(nat, term.var(0)),
        sameInstance(term.pi("a", nat, term.var(1))));
  }

  @Test
  void testLet() {
    final Expr let =
        term.let(Name.of("k"), nat, zero, term.app(succ, term.var(0)));
    assertThat(let.op, is(Op.LET));
    assertThat(let.isClosed(), is(true));
    assertThat(Exprs.instantiate(((Expr.Let) let).body, zero),
        sameInstance(term.app(succ, zero)));
  }

  @Test
  void testInstantiateLevelParams() {
    final Name u = Name.of("u");
    final Expr e =
        term.pi("a", term.sort(Level.param(u)),
            term.constant(Name.of("c"), ImmutableList.of(Level.param(u))));
    final Expr e2 =
        Exprs.instantiateLevelParams(e, ImmutableList.of(u),
            ImmutableList.of(Level.ONE));
    assertThat(e2,
        sameInstance(
            term.pi("a", term.type(),
                term.constant(Name.of("c"), ImmutableList.of(Level.ONE)))));
    assertThat(e2.hasLevelParams(), is(false));
  }

  @Test
  void testCollect() {
    final Expr e =
        term.apps(term.constant(Name.of("f"),
                ImmutableList.of(Level.param("u"))),
            term.constant(Name.of("g")),
            term.sort(Level.max(Level.param("v"), Level.ONE)),
            term.constant(Name.of("g")));
    final List<Name> names = new ArrayList<>();
    Exprs.forEachConst(e, c -> names.add(c.name));
    assertThat(ImmutableSet.copyOf(names),
        is(ImmutableSet.of(Name.of("f"), Name.of("g"))));
    final Set<Name> params = new HashSet<>();
    Exprs.collectLevelParams(e, params);
    assertThat(params, is(ImmutableSet.of(Name.of("u"), Name.of("v"))));
  }

  @Test
  void testToString() {
    assertThat(term.app(succ, zero).toString(), is("(nat.succ nat.zero)"));
  }
}

// End ExprTest.java
