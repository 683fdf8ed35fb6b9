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
package net.hydromatic.verity.kernel;

import static net.hydromatic.verity.Fixtures.BOOL;
import static net.hydromatic.verity.Fixtures.EQ;
import static net.hydromatic.verity.Fixtures.FF;
import static net.hydromatic.verity.Fixtures.NAT;
import static net.hydromatic.verity.Fixtures.SUCC;
import static net.hydromatic.verity.Fixtures.TT;
import static net.hydromatic.verity.Fixtures.ZERO;
import static net.hydromatic.verity.Fixtures.basicEnv;
import static net.hydromatic.verity.Fixtures.bool;
import static net.hydromatic.verity.Fixtures.nat;
import static net.hydromatic.verity.Fixtures.natEq;
import static net.hydromatic.verity.Fixtures.natLit;
import static net.hydromatic.verity.ast.ExprBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.Fixtures;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import org.junit.jupiter.api.Test;

/** Unit test for {@link InductiveChecker}, and for reduction of the
 * recursors that it derives. */
class InductiveTest {
  private static final Name L = Name.of("l");

  private static Declaration.Recursor recursor(Environment env, Name name) {
    return (Declaration.Recursor) env.get(name.str("rec"));
  }

  /** Certifies an inductive family in an environment, and returns the
   * verdict. */
  private static Verdict certify(Environment env, String name,
      List<Name> levelParams, int numParams, Expr type,
      Map<Name, Expr> constructors) {
    final Certifier certifier = new Certifier(env, Tracers.empty());
    return certifier.certify(
        Declaration.inductive(Name.of(name), levelParams, numParams, type,
            constructors));
  }

  @Test
  void testBoolRecursor() {
    final Environment env = basicEnv();
    final Declaration.Recursor rec = recursor(env, BOOL);
    assertThat(rec.levelParams, is(ImmutableList.of(L)));
    assertThat(rec.numParams, is(0));
    assertThat(rec.numIndices, is(0));
    assertThat(rec.numMinors, is(2));
    assertThat(rec.motiveIndex(), is(0));
    assertThat(rec.majorIndex(), is(3));
    assertThat(rec.k, is(false));
    assertThat(rec.rules.size(), is(2));
    assertThat(rec.ruleFor(TT).numFields, is(0));
    assertThat(rec.ruleFor(NAT), nullValue());

    // {C : bool -> Sort l} -> C tt -> C ff -> (x : bool) -> C x
    final Expr expected =
        term.pi(BinderInfo.IMPLICIT, Name.of("C"),
            term.pi("t", bool(), term.sort(Level.param(L))),
            term.pi("tt", term.app(term.var(0), term.constant(TT)),
                term.pi("ff", term.app(term.var(1), term.constant(FF)),
                    term.pi("x", bool(),
                        term.app(term.var(3), term.var(0))))));
    final TypeChecker tc = new TypeChecker(env);
    assertThat(tc.isDefEq(rec.type, expected), is(true));
  }

  @Test
  void testBoolIota() {
    final Environment env = basicEnv();
    final TypeChecker tc = new TypeChecker(env);
    final Expr rec =
        term.constant(BOOL.str("rec"), ImmutableList.of(Level.ONE));
    final Expr motive = term.lambda("b", bool(), nat());
    final Expr onTrue =
        term.apps(rec, motive, natLit(0), natLit(1), term.constant(TT));
    final Expr onFalse =
        term.apps(rec, motive, natLit(0), natLit(1), term.constant(FF));
    assertThat(tc.whnf(onTrue), sameInstance(natLit(0)));
    assertThat(tc.whnf(onFalse), sameInstance(natLit(1)));
    assertThat(tc.isDefEq(tc.infer(onTrue), nat()), is(true));
  }

  /** Doubling by recursion: 2 + 2 = 4. */
  @Test
  void testNatRecursion() {
    final Environment env = basicEnv();
    final Declaration.Recursor rec = recursor(env, NAT);
    assertThat(rec.numMinors, is(2));
    assertThat(rec.ruleFor(SUCC).numFields, is(1));

    final TypeChecker tc = new TypeChecker(env);
    final Expr double2 =
        term.apps(term.constant(NAT.str("rec"), ImmutableList.of(Level.ONE)),
            term.lambda("n", nat(), nat()),
            term.constant(ZERO),
            term.lambda("n", nat(),
                term.lambda("ih_n", nat(),
                    term.app(term.constant(SUCC),
                        term.app(term.constant(SUCC), term.var(0))))),
            natLit(2));
    assertThat(tc.isDefEq(tc.infer(double2), nat()), is(true));
    assertThat(tc.isDefEq(double2, natLit(4)), is(true));
    assertThat(tc.isDefEq(double2, natLit(3)), is(false));
  }

  @Test
  void testEqRecursor() {
    final Environment env = basicEnv();
    final Declaration.Recursor rec = recursor(env, EQ);
    assertThat(rec.levelParams, is(ImmutableList.of(L, Fixtures.U)));
    assertThat(rec.numParams, is(2));
    assertThat(rec.numIndices, is(1));
    assertThat(rec.numMinors, is(1));
    assertThat(rec.majorIndex(), is(5));
    assertThat(rec.k, is(true));
  }

  /** A proof of {@code eq} reduces as if it were {@code eq.refl} when its
   * type says that both sides are equal. */
  @Test
  void testKReduction() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Name h = Name.of("h");
    final Name h2 = Name.of("h2");
    assertThat(
        certifier.certify(
            Declaration.axiom(h, ImmutableList.of(),
                natEq(natLit(0), natLit(0)))).isCommitted(),
        is(true));
    assertThat(
        certifier.certify(
            Declaration.axiom(h2, ImmutableList.of(),
                natEq(natLit(0), natLit(1)))).isCommitted(),
        is(true));

    final TypeChecker tc = new TypeChecker(env);
    final Expr rec =
        term.constant(EQ.str("rec"), ImmutableList.of(Level.ONE, Level.ONE));
    final Expr motive = term.lambda("b", nat(), nat());
    final Expr e =
        term.apps(rec, nat(), natLit(0), motive, natLit(3), natLit(0),
            term.constant(h));
    assertThat(tc.isDefEq(tc.infer(e), nat()), is(true));
    assertThat(tc.whnf(e), sameInstance(natLit(3)));

    // The type of h2 is not that of a reflexivity proof.
    final Expr stuck =
        term.apps(rec, nat(), natLit(0), motive, natLit(3), natLit(1),
            term.constant(h2));
    assertThat(tc.whnf(stuck).getAppFn(), sameInstance(rec));
  }

  @Test
  void testConclusionIsNotTheFamily() {
    final Verdict verdict =
        certify(basicEnv(), "foo", ImmutableList.of(), 0, term.type(),
            ImmutableMap.of(Name.of("foo.mk"), bool()));
    assertThat(verdict.errorKind(), is(ErrorKind.MALFORMED_CONSTRUCTOR));
  }

  @Test
  void testFieldTooBig() {
    final Expr box = term.constant(Name.of("box"));
    final Environment env = basicEnv();
    final Verdict verdict =
        certify(env, "box", ImmutableList.of(), 0, term.type(),
            ImmutableMap.of(Name.of("box.mk"),
                term.arrow(term.type(), box)));
    assertThat(verdict.errorKind(), is(ErrorKind.MALFORMED_CONSTRUCTOR));
    assertThat(env.lookup(Name.of("box")), nullValue());
    assertThat(env.lookup(Name.of("box.mk")), nullValue());

    // In a big enough universe, the field fits.
    final Verdict verdict2 =
        certify(env, "box", ImmutableList.of(), 0, term.sort(Level.of(2)),
            ImmutableMap.of(Name.of("box.mk"),
                term.arrow(term.type(), box)));
    assertThat(verdict2.isCommitted(), is(true));
  }

  @Test
  void testTooManyParameters() {
    final Verdict verdict =
        certify(basicEnv(), "two", ImmutableList.of(), 1, term.type(),
            ImmutableMap.of(Name.of("two.mk"), term.constant(Name.of("two"))));
    assertThat(verdict.errorKind(), is(ErrorKind.MALFORMED_CONSTRUCTOR));
  }

  @Test
  void testFamilyNotASort() {
    final Verdict verdict =
        certify(basicEnv(), "foo", ImmutableList.of(), 0, nat(),
            ImmutableMap.of());
    assertThat(verdict.errorKind(), is(ErrorKind.NOT_A_SORT));
  }

  /** A proposition with two constructors eliminates only into Prop. */
  @Test
  void testPropWithTwoConstructors() {
    final Environment env = basicEnv();
    final Expr or2 = term.constant(Name.of("or2"));
    final Verdict verdict =
        certify(env, "or2", ImmutableList.of(), 0, term.prop(),
            ImmutableMap.of(Name.of("or2.a"), or2, Name.of("or2.b"), or2));
    assertThat(verdict.isCommitted(), is(true));
    final Declaration.Recursor rec = recursor(env, Name.of("or2"));
    assertThat(rec.levelParams.isEmpty(), is(true));
    assertThat(rec.k, is(false));
  }

  /** A proposition whose only constructor has a proof field eliminates into
   * any universe. */
  @Test
  void testPropWithProofField() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Name p = Name.of("p");
    assertThat(
        certifier.certify(
            Declaration.axiom(p, ImmutableList.of(), term.prop()))
            .isCommitted(),
        is(true));
    final Verdict verdict =
        certify(env, "wrapP", ImmutableList.of(), 0, term.prop(),
            ImmutableMap.of(Name.of("wrapP.mk"),
                term.pi("h", term.constant(p),
                    term.constant(Name.of("wrapP")))));
    assertThat(verdict.isCommitted(), is(true));
    final Declaration.Recursor rec = recursor(env, Name.of("wrapP"));
    assertThat(rec.levelParams, is(ImmutableList.of(L)));
    assertThat(rec.k, is(false));
  }

  /** A proposition with a data field eliminates only into Prop. */
  @Test
  void testPropWithDataField() {
    final Environment env = basicEnv();
    final Verdict verdict =
        certify(env, "exN", ImmutableList.of(), 0, term.prop(),
            ImmutableMap.of(Name.of("exN.mk"),
                term.pi("n", nat(), term.constant(Name.of("exN")))));
    assertThat(verdict.isCommitted(), is(true));
    assertThat(recursor(env, Name.of("exN")).levelParams.isEmpty(),
        is(true));
  }

  /** The recursor's universe parameter does not clash with the family's. */
  @Test
  void testFreshUniverseParameter() {
    final Environment env = basicEnv();
    final Level l = Level.param(L);
    final Expr wrap = term.constant(Name.of("wrap"), ImmutableList.of(l));
    final Verdict verdict =
        certify(env, "wrap", ImmutableList.of(L), 1,
            term.pi("α", term.sort(l),
                term.sort(Level.max(Level.ONE, l))),
            ImmutableMap.of(Name.of("wrap.mk"),
                term.pi(BinderInfo.IMPLICIT, Name.of("α"), term.sort(l),
                    term.pi("a", term.var(0),
                        term.app(wrap, term.var(1))))));
    assertThat(verdict.isCommitted(), is(true));
    final Declaration.Recursor rec = recursor(env, Name.of("wrap"));
    assertThat(rec.levelParams, is(ImmutableList.of(Name.of("l_1"), L)));
    assertThat(rec.numParams, is(1));
  }
}

// End InductiveTest.java
