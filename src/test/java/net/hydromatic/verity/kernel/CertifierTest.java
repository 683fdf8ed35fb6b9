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

import static net.hydromatic.verity.Fixtures.ZERO;
import static net.hydromatic.verity.Fixtures.basicEnv;
import static net.hydromatic.verity.Fixtures.nat;
import static net.hydromatic.verity.Fixtures.natDef;
import static net.hydromatic.verity.Fixtures.natEq;
import static net.hydromatic.verity.Fixtures.natLit;
import static net.hydromatic.verity.Fixtures.natRefl;
import static net.hydromatic.verity.ast.ExprBuilder.term;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.verity.Fixtures;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import org.junit.jupiter.api.Test;

/** Unit test for {@link Certifier}. */
class CertifierTest {
  private static final Name A = Name.of("A");
  private static final Name B = Name.of("B");

  /** {@code axiom A : Sort 1; def B : A := A} fails because the value of
   * {@code B} is a type, not an inhabitant of {@code A}. */
  @Test
  void testValueHasWrongType() {
    final Environment env = Environment.empty();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Verdict a =
        certifier.certify(
            Declaration.axiom(A, ImmutableList.of(), term.type()));
    assertThat(a.isCommitted(), is(true));

    final Verdict b =
        certifier.certify(
            Declaration.definition(B, ImmutableList.of(), term.constant(A),
                term.constant(A)));
    assertThat(b.isCommitted(), is(false));
    assertThat(b.state, is(Verdict.State.REJECTED));
    assertThat(b.errorKind(), is(ErrorKind.TYPE_MISMATCH));
    final KernelException error = Objects.requireNonNull(b.error);
    assertThat(error.declName, sameInstance(B));
    assertThat(error.expected, sameInstance(term.constant(A)));
    assertThat(error.actual, sameInstance(term.type()));
    assertThat(env.lookup(B), nullValue());
    assertThat(env.size(), is(1));

    final String description =
        error.describeTo(new StringBuilder()).toString();
    assertThat(description.startsWith("B: TYPE_MISMATCH: "), is(true));
  }

  /** A proof that needs definitions to be unfolded. */
  @Test
  void testDelta() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Expr one = term.constant(Name.of("one"));
    final Expr two = term.constant(Name.of("two"));
    assertThat(certifier.certify(natDef("one", natLit(1))).isCommitted(),
        is(true));
    assertThat(
        certifier.certify(
            natDef("two", term.app(term.constant(Fixtures.SUCC), one)))
            .isCommitted(),
        is(true));
    final Declaration theorem =
        Declaration.definition(Name.of("two_eq"), ImmutableList.of(),
            natEq(two, natLit(2)), natRefl(two));
    assertThat(certifier.certify(theorem).isCommitted(), is(true));

    final Declaration wrong =
        Declaration.definition(Name.of("two_eq_three"), ImmutableList.of(),
            natEq(two, natLit(3)), natRefl(two));
    assertThat(certifier.certify(wrong).errorKind(),
        is(ErrorKind.TYPE_MISMATCH));
  }

  @Test
  void testAxiomMustHaveType() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Verdict verdict =
        certifier.certify(
            Declaration.axiom(A, ImmutableList.of(), term.constant(ZERO)));
    assertThat(verdict.errorKind(), is(ErrorKind.NOT_A_SORT));
  }

  @Test
  void testDuplicate() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final int size = env.size();
    final Verdict verdict =
        certifier.certify(
            Declaration.axiom(Fixtures.NAT, ImmutableList.of(),
                term.type()));
    assertThat(verdict.errorKind(), is(ErrorKind.DUPLICATE_NAME));
    assertThat(env.size(), is(size));
  }

  /** A definition cannot refer to itself. */
  @Test
  void testSelfReference() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    final Verdict verdict =
        certifier.certify(natDef("loop", term.constant(Name.of("loop"))));
    assertThat(verdict.errorKind(), is(ErrorKind.UNKNOWN_REFERENCE));
    assertThat(env.lookup(Name.of("loop")), nullValue());
  }

  @Test
  void testInductiveCommitsConstructorsAndRecursor() {
    final Environment env = basicEnv();
    assertThat(env.get(Fixtures.NAT),
        instanceOf(Declaration.Inductive.class));
    assertThat(env.get(ZERO), instanceOf(Declaration.Constructor.class));
    assertThat(env.get(Name.of("nat.rec")),
        instanceOf(Declaration.Recursor.class));
    final List<Name> names = new ArrayList<>();
    env.declarations().forEach(d -> names.add(d.name));
    assertThat(names.indexOf(Fixtures.NAT) < names.indexOf(ZERO),
        is(true));
    assertThat(names.indexOf(ZERO) < names.indexOf(Name.of("nat.rec")),
        is(true));

    // Derived declarations cannot be certified directly.
    final Certifier certifier = new Certifier(Environment.empty(),
        Tracers.empty());
    assertThrows(IllegalArgumentException.class,
        () -> certifier.certify(env.get(ZERO)));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer =
        Tracers.withOnTransition(Tracers.empty(),
            (d, state) -> events.add(d.name + " " + state));
    tracer = Tracers.withOnCommit(tracer, d -> events.add("commit " + d.name));
    tracer =
        Tracers.withOnReject(tracer,
            (d, e) -> events.add("reject " + d.name + " " + e.kind));
    final Certifier certifier = new Certifier(Environment.empty(), tracer);
    certifier.certify(Declaration.axiom(A, ImmutableList.of(), term.type()));
    certifier.certify(Declaration.axiom(A, ImmutableList.of(), term.type()));
    assertThat(events,
        is(
            ImmutableList.of("A RECEIVED", "A TYPE_CHECKING", "commit A",
                "A COMMITTED", "A RECEIVED", "A TYPE_CHECKING",
                "A REJECTED", "reject A DUPLICATE_NAME")));
  }

  /** Registering a definition commits it before its value is checked; the
   * value is checked against the environment as it was before. */
  @Test
  void testRegister() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());

    final Certifier.Registration axiom =
        certifier.register(
            Declaration.axiom(A, ImmutableList.of(), nat()));
    assertThat(axiom.verdict, notNullValue());
    assertThat(axiom.valueCheck, nullValue());

    final Certifier.Registration good =
        certifier.register(natDef("three", natLit(3)));
    assertThat(good.verdict, nullValue());
    assertThat(env.lookup(Name.of("three")), notNullValue());
    final Verdict verdict = Objects.requireNonNull(good.valueCheck).get();
    assertThat(verdict.isCommitted(), is(true));

    final Certifier.Registration bad =
        certifier.register(natDef("bad", term.constant(Fixtures.TT)));
    assertThat(bad.verdict, nullValue());
    assertThat(Objects.requireNonNull(bad.valueCheck).get().errorKind(),
        is(ErrorKind.TYPE_MISMATCH));

    // A definition whose type is not a type fails at registration.
    final Certifier.Registration badType =
        certifier.register(
            Declaration.definition(Name.of("c"), ImmutableList.of(),
                term.constant(ZERO), term.constant(ZERO)));
    assertThat(Objects.requireNonNull(badType.verdict).errorKind(),
        is(ErrorKind.NOT_A_SORT));
    assertThat(badType.valueCheck, nullValue());
  }
  @Test
  void testRegisterTracesCommitAfterValueCheck() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCommit(Tracers.empty(),
            d -> events.add("commit " + d.name));
    final Certifier certifier = new Certifier(basicEnv(), tracer);
    final Certifier.Registration registration =
        certifier.register(natDef("three", natLit(3)));
    assertThat(events.isEmpty(), is(true));
    Objects.requireNonNull(registration.valueCheck).get();
    assertThat(events, is(ImmutableList.of("commit three")));

    final Certifier.Registration bad =
        certifier.register(natDef("bad", term.constant(Fixtures.TT)));
    Objects.requireNonNull(bad.valueCheck).get();
    assertThat(events, is(ImmutableList.of("commit three")));
  }

  /** Names and references are checked before types, so a duplicate with an
   * ill-typed value is a duplicate. */
  @Test
  void testNamesCheckedFirst() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    assertThat(
        certifier.certify(natDef("nat.zero", term.constant(Fixtures.TT)))
            .errorKind(),
        is(ErrorKind.DUPLICATE_NAME));
    assertThat(
        certifier.certify(
            natDef("d",
                term.constant(ZERO,
                    ImmutableList.of(Level.ONE))))
            .errorKind(),
        is(ErrorKind.UNKNOWN_REFERENCE));
    assertThat(
        certifier.register(natDef("nat.zero", term.constant(Fixtures.TT)))
            .verdict.errorKind(),
        is(ErrorKind.DUPLICATE_NAME));
  }

  @Test
  void testQuotientPackage() {
    final Environment env = basicEnv();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    assertThat(certifier.certify(Declaration.quotPackage()).isCommitted(),
        is(true));
    assertThat(env.lookup(Quotients.QUOT), notNullValue());
    assertThat(env.lookup(Quotients.MK), notNullValue());
    assertThat(env.lookup(Quotients.LIFT), notNullValue());
    assertThat(env.lookup(Quotients.IND), notNullValue());

    // Only once.
    assertThat(certifier.certify(Declaration.quotPackage()).errorKind(),
        is(ErrorKind.DUPLICATE_NAME));
  }

  /** The quotient package cannot be declared before {@code eq}. */
  @Test
  void testQuotientPackageRequiresEq() {
    final Environment env = Fixtures.env(Fixtures.boolDecl());
    final Certifier certifier = new Certifier(env, Tracers.empty());
    assertThat(certifier.certify(Declaration.quotPackage()).errorKind(),
        is(ErrorKind.UNKNOWN_REFERENCE));
    assertThat(env.lookup(Quotients.QUOT), nullValue());
  }
}

// End CertifierTest.java
