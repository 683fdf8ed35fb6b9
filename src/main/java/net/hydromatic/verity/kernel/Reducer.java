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

import static net.hydromatic.verity.ast.ExprBuilder.term;
import static net.hydromatic.verity.util.Static.skip;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Exprs;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.util.StackGuard;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reduces expressions to weak head normal form.
 *
 * <p>{@link #whnfCore(Expr)} applies beta, zeta, iota and quotient
 * reduction; {@link #whnf(Expr)} also unfolds definitions (delta) when no
 * other rule applies.
 */
class Reducer {
  private final TypeChecker tc;
  private final Map<Expr, Expr> whnfCoreCache = new HashMap<>();
  private final Map<Expr, Expr> whnfCache = new HashMap<>();

  Reducer(TypeChecker tc) {
    this.tc = tc;
  }

  /** Reduces to weak head normal form, without unfolding definitions. */
  Expr whnfCore(Expr e) {
    switch (e.op) {
    case VAR:
    case SORT:
    case CONST:
    case LAMBDA:
    case PI:
    case LOCAL:
      return e;
    default:
      break;
    }
    final Expr cached = whnfCoreCache.get(e);
    if (cached != null) {
      return cached;
    }
    final Expr r = StackGuard.guard(() -> whnfCore0(e));
    whnfCoreCache.put(e, r);
    return r;
  }

  private Expr whnfCore0(Expr e) {
    for (;;) {
      switch (e.op) {
      case LET:
        final Expr.Let let = (Expr.Let) e;
        e = Exprs.instantiate(let.body, let.value);
        continue;
      case APP:
        final Expr fn0 = e.getAppFn();
        final Expr fn = whnfCore(fn0);
        if (fn.op == Op.LAMBDA) {
          e = beta(fn, e.getAppArgs());
          continue;
        }
        if (fn != fn0) {
          e = term.apps(fn, e.getAppArgs());
          continue;
        }
        final Expr r = reduceRecursor(e);
        if (r == null) {
          return e;
        }
        e = r;
        continue;
      default:
        return e;
      }
    }
  }

  /** Applies a lambda to arguments, substituting as many arguments as the
   * lambda has binders. */
  static Expr beta(Expr fn, List<Expr> args) {
    int n = 0;
    Expr body = fn;
    while (body.op == Op.LAMBDA && n < args.size()) {
      body = ((Expr.Binder) body).body;
      ++n;
    }
    return term.apps(Exprs.instantiate(body, args.subList(0, n)),
        skip(args, n));
  }

  /** Reduces to weak head normal form, unfolding definitions. */
  Expr whnf(Expr e) {
    switch (e.op) {
    case VAR:
    case SORT:
    case LAMBDA:
    case PI:
    case LOCAL:
      return e;
    default:
      break;
    }
    final Expr cached = whnfCache.get(e);
    if (cached != null) {
      return cached;
    }
    final Expr r = StackGuard.guard(() -> whnf0(e));
    whnfCache.put(e, r);
    return r;
  }

  private Expr whnf0(Expr e) {
    Expr t = e;
    for (;;) {
      final Expr t1 = whnfCore(t);
      final Expr t2 = unfoldDefinition(t1);
      if (t2 == null) {
        return t1;
      }
      t = t2;
    }
  }

  /** Returns the definition at the head of an expression, if it is an
   * application of a definition that may be unfolded; otherwise null. */
  Declaration.@Nullable Definition unfoldable(Expr e) {
    final Expr fn = e.getAppFn();
    if (fn.op != Op.CONST) {
      return null;
    }
    final Expr.Const c = (Expr.Const) fn;
    final Declaration d = tc.env().lookup(c.name);
    if (!(d instanceof Declaration.Definition)) {
      return null;
    }
    final Declaration.Definition definition = (Declaration.Definition) d;
    if (!definition.hint().isUnfoldable()
        || definition.levelParams.size() != c.levels.size()) {
      return null;
    }
    return definition;
  }

  /** Unfolds the definition at the head of an expression; returns null if
   * the head is not an unfoldable definition. */
  @Nullable Expr unfoldDefinition(Expr e) {
    final Declaration.Definition definition = unfoldable(e);
    if (definition == null) {
      return null;
    }
    final Expr.Const c = (Expr.Const) e.getAppFn();
    final Expr value =
        Exprs.instantiateLevelParams(definition.value,
            definition.levelParams, c.levels);
    return term.apps(value, e.getAppArgs());
  }

  /** Applies iota reduction, if the head of {@code e} is a recursor, or
   * quotient reduction, if it is {@code quot.lift} or {@code quot.ind}. */
  private @Nullable Expr reduceRecursor(Expr e) {
    final Expr fn = e.getAppFn();
    if (fn.op != Op.CONST) {
      return null;
    }
    final Declaration d = tc.env().lookup(((Expr.Const) fn).name);
    if (d instanceof Declaration.Recursor) {
      return iota((Declaration.Recursor) d, (Expr.Const) fn, e.getAppArgs());
    }
    if (d instanceof Declaration.QuotConstant) {
      return Quotients.reduce(((Declaration.QuotConstant) d).kind,
          e.getAppArgs(), this::whnf);
    }
    return null;
  }

  private @Nullable Expr iota(Declaration.Recursor rec, Expr.Const recConst,
      List<Expr> args) {
    final int majorIndex = rec.majorIndex();
    if (args.size() <= majorIndex) {
      return null;
    }
    Expr major = args.get(majorIndex);
    if (rec.k) {
      major = toConstructorWhenK(rec, major);
    }
    major = whnf(major);
    final Expr majorFn = major.getAppFn();
    if (majorFn.op != Op.CONST) {
      return null;
    }
    final Declaration.RecursorRule rule =
        rec.ruleFor(((Expr.Const) majorFn).name);
    if (rule == null) {
      return null;
    }
    final List<Expr> majorArgs = major.getAppArgs();
    if (majorArgs.size() != rec.numParams + rule.numFields) {
      return null;
    }
    if (rec.levelParams.size() != recConst.levels.size()) {
      return null;
    }
    Expr rhs =
        Exprs.instantiateLevelParams(rule.rhs, rec.levelParams,
            recConst.levels);
    rhs = term.apps(rhs, args.subList(0, rec.numParams + 1 + rec.numMinors));
    rhs = term.apps(rhs, skip(majorArgs, rec.numParams));
    return term.apps(rhs, skip(args, majorIndex + 1));
  }

  /** For a recursor that supports K-like reduction, returns the
   * constructor application that the major premise must be equal to, if
   * their types agree; otherwise returns the major premise. */
  private Expr toConstructorWhenK(Declaration.Recursor rec, Expr major) {
    final Expr majorType = whnf(tc.inferOnly(major));
    final Expr typeFn = majorType.getAppFn();
    if (!typeFn.isConst(rec.inductName)) {
      return major;
    }
    final List<Expr> typeArgs = majorType.getAppArgs();
    if (typeArgs.size() != rec.numParams + rec.numIndices) {
      return major;
    }
    final Declaration d = tc.env().lookup(rec.inductName);
    if (!(d instanceof Declaration.Inductive)
        || ((Declaration.Inductive) d).constructors.size() != 1) {
      return major;
    }
    final Declaration.Constructor ctor =
        ((Declaration.Inductive) d).constructors.get(0);
    final Expr ctorApp =
        term.apps(term.constant(ctor.name, ((Expr.Const) typeFn).levels),
            typeArgs.subList(0, rec.numParams));
    final Expr ctorType = tc.inferOnly(ctorApp);
    if (!tc.isDefEq(majorType, ctorType)) {
      return major;
    }
    return ctorApp;
  }
}

// End Reducer.java
