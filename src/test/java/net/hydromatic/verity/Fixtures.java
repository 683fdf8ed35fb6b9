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
package net.hydromatic.verity;

import static net.hydromatic.verity.ast.ExprBuilder.term;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import net.hydromatic.verity.kernel.Certifier;
import net.hydromatic.verity.kernel.Declaration;
import net.hydromatic.verity.kernel.Environment;
import net.hydromatic.verity.kernel.Tracers;
import net.hydromatic.verity.kernel.Verdict;

/** Declarations and environments shared by tests. */
public abstract class Fixtures {
  private Fixtures() {}

  public static final Name BOOL = Name.of("bool");
  public static final Name TT = Name.of("bool.tt");
  public static final Name FF = Name.of("bool.ff");
  public static final Name NAT = Name.of("nat");
  public static final Name ZERO = Name.of("nat.zero");
  public static final Name SUCC = Name.of("nat.succ");
  public static final Name EQ = Name.of("eq");
  public static final Name EQ_REFL = Name.of("eq.refl");
  public static final Name U = Name.of("u");

  public static Expr bool() {
    return term.constant(BOOL);
  }

  public static Expr nat() {
    return term.constant(NAT);
  }

  /** Returns the numeral {@code n}: {@code nat.succ} applied {@code n}
   * times to {@code nat.zero}. */
  public static Expr natLit(int n) {
    Expr e = term.constant(ZERO);
    for (int i = 0; i < n; i++) {
      e = term.app(term.constant(SUCC), e);
    }
    return e;
  }

  /** Returns {@code eq.{1} nat a b}. */
  public static Expr natEq(Expr a, Expr b) {
    return term.apps(term.constant(EQ, ImmutableList.of(Level.ONE)), nat(),
        a, b);
  }

  /** Returns {@code eq.refl.{1} nat a}. */
  public static Expr natRefl(Expr a) {
    return term.apps(term.constant(EQ_REFL, ImmutableList.of(Level.ONE)),
        nat(), a);
  }

  /** {@code inductive bool : Sort 1 | tt | ff}. */
  public static Declaration.Inductive boolDecl() {
    return Declaration.inductive(BOOL, ImmutableList.of(), 0, term.type(),
        ImmutableMap.of(TT, bool(), FF, bool()));
  }

  /** {@code inductive nat : Sort 1 | zero | succ (n : nat)}. */
  public static Declaration.Inductive natDecl() {
    return Declaration.inductive(NAT, ImmutableList.of(), 0, term.type(),
        ImmutableMap.of(ZERO, nat(),
            SUCC, term.pi("n", nat(), nat())));
  }

  /** {@code inductive eq.{u} {α : Sort u} (a : α) : α -> Prop
   * | refl : eq a a}. */
  public static Declaration.Inductive eqDecl() {
    final Expr sortU = term.sort(Level.param(U));
    final Expr eqU = term.constant(EQ, ImmutableList.of(Level.param(U)));
    final Expr type =
        term.pi(BinderInfo.IMPLICIT, Name.of("α"), sortU,
            term.pi("a", term.var(0),
                term.pi("b", term.var(1), term.prop())));
    final Expr reflType =
        term.pi(BinderInfo.IMPLICIT, Name.of("α"), sortU,
            term.pi("a", term.var(0),
                term.apps(eqU, term.var(1), term.var(0), term.var(0))));
    return Declaration.inductive(EQ, ImmutableList.of(U), 2, type,
        ImmutableMap.of(EQ_REFL, reflType));
  }

  /** Returns {@code def name : nat := value}. */
  public static Declaration.Definition natDef(String name, Expr value) {
    return Declaration.definition(Name.of(name), ImmutableList.of(), nat(),
        value);
  }

  /** Certifies declarations in order into a new environment; throws if any
   * is rejected. */
  public static Environment env(Declaration... declarations) {
    return env(ImmutableList.copyOf(declarations));
  }

  /** Certifies declarations in order into a new environment; throws if any
   * is rejected. */
  public static Environment env(List<? extends Declaration> declarations) {
    final Environment env = Environment.empty();
    final Certifier certifier = new Certifier(env, Tracers.empty());
    for (Declaration declaration : declarations) {
      final Verdict verdict = certifier.certify(declaration);
      if (!verdict.isCommitted()) {
        throw new AssertionError("could not certify " + declaration.name
            + ": " + verdict.error);
      }
    }
    return env;
  }

  /** Returns an environment containing {@code bool}, {@code nat} and
   * {@code eq}. */
  public static Environment basicEnv() {
    return env(boolDecl(), natDecl(), eqDecl());
  }
}

// End Fixtures.java
