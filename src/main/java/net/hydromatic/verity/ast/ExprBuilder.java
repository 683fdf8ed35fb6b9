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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.List;

/**
 * Builds expressions.
 *
 * <p>Every expression is interned, so that two structurally identical
 * expressions built by this builder are the same object. The interner is
 * thread-safe and holds its entries weakly.
 */
@SuppressWarnings("UnstableApiUsage")
public enum ExprBuilder {
  /** The singleton instance; use via {@code import static}. */
  term;

  private final Interner<Expr> interner = Interners.newWeakInterner();

  private final ImmutableList<Expr.Var> vars = buildVars(64);

  private ImmutableList<Expr.Var> buildVars(int n) {
    final ImmutableList.Builder<Expr.Var> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add((Expr.Var) interner.intern(new Expr.Var(i)));
    }
    return b.build();
  }

  private Expr intern(Expr e) {
    return interner.intern(e);
  }

  /** Creates a bound variable. */
  public Expr var(int index) {
    if (index < vars.size()) {
      return vars.get(index);
    }
    return intern(new Expr.Var(index));
  }

  /** Creates a sort. */
  public Expr sort(Level level) {
    return intern(new Expr.Sort(level));
  }

  /** Returns {@code Prop}, the sort at level zero. */
  public Expr prop() {
    return sort(Level.ZERO);
  }

  /** Returns {@code Sort 1}, the sort of small types. */
  public Expr type() {
    return sort(Level.ONE);
  }

  /** Creates a reference to a constant. */
  public Expr constant(Name name, List<Level> levels) {
    return intern(new Expr.Const(name, ImmutableList.copyOf(levels)));
  }

  /** Creates a reference to a constant that has no universe parameters. */
  public Expr constant(Name name) {
    return constant(name, ImmutableList.of());
  }

  /** Creates an application. */
  public Expr app(Expr fn, Expr arg) {
    return intern(new Expr.App(fn, arg));
  }

  /** Creates a chain of applications. */
  public Expr apps(Expr fn, List<? extends Expr> args) {
    Expr e = fn;
    for (Expr arg : args) {
      e = app(e, arg);
    }
    return e;
  }

  /** Creates a chain of applications. */
  public Expr apps(Expr fn, Expr... args) {
    return apps(fn, ImmutableList.copyOf(args));
  }

  /** Creates a lambda or a Pi. */
  public Expr binder(Op op, BinderInfo binderInfo, Name name, Expr type,
      Expr body) {
    if (!op.isBinder()) {
      throw new IllegalArgumentException("not a binder: " + op);
    }
    return intern(new Expr.Binder(op, binderInfo, name, type, body));
  }

  /** Creates a lambda. */
  public Expr lambda(BinderInfo binderInfo, Name name, Expr type,
      Expr body) {
    return binder(Op.LAMBDA, binderInfo, name, type, body);
  }

  /** Creates a lambda with an explicit argument. */
  public Expr lambda(String name, Expr type, Expr body) {
    return lambda(BinderInfo.DEFAULT, Name.of(name), type, body);
  }

  /** Creates a Pi. */
  public Expr pi(BinderInfo binderInfo, Name name, Expr type, Expr body) {
    return binder(Op.PI, binderInfo, name, type, body);
  }

  /** Creates a Pi with an explicit argument. */
  public Expr pi(String name, Expr type, Expr body) {
    return pi(BinderInfo.DEFAULT, Name.of(name), type, body);
  }

  /** Creates a non-dependent function type, {@code domain -> range}. */
  public Expr arrow(Expr domain, Expr range) {
    return pi(BinderInfo.DEFAULT, Name.of("a"), domain,
        Exprs.lift(range, 1));
  }

  /** Creates a local definition. */
  public Expr let(Name name, Expr type, Expr value, Expr body) {
    return intern(new Expr.Let(name, type, value, body));
  }

  /** Creates a local (free variable). The caller is responsible for the
   * uniqueness of {@code serial}; usually it comes from a
   * {@code LocalContext}. */
  public Expr.Local local(long serial, Name name, Expr type,
      BinderInfo binderInfo) {
    return (Expr.Local) intern(new Expr.Local(serial, name, type, binderInfo));
  }

  /** Abstracts a list of locals out of a body, wrapping it in binders
   * of type {@code op}, innermost last.
   *
   * <p>For example, {@code bind(PI, [x, y], b)} returns
   * {@code Pi (x : X), Pi (y : Y), b}, where the occurrences of {@code x}
   * and {@code y} in {@code b} (and of {@code x} in {@code Y}) have become
   * bound variables. */
  public Expr bind(Op op, List<Expr.Local> locals, Expr body) {
    Expr e = Exprs.abstractLocals(body, locals);
    for (int i = locals.size() - 1; i >= 0; i--) {
      final Expr.Local local = locals.get(i);
      final Expr type =
          Exprs.abstractLocals(local.type, locals.subList(0, i));
      e = binder(op, local.binderInfo, local.name, type, e);
    }
    return e;
  }

  /** Abstracts locals to build a Pi type. */
  public Expr pi(List<Expr.Local> locals, Expr body) {
    return bind(Op.PI, locals, body);
  }

  /** Abstracts locals to build a lambda. */
  public Expr lambda(List<Expr.Local> locals, Expr body) {
    return bind(Op.LAMBDA, locals, body);
  }
}

// End ExprBuilder.java
