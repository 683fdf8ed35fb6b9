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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Exprs;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.util.StackGuard;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides definitional equality of two expressions.
 *
 * <p>The procedure is sound but incomplete. It tries, in order: identity;
 * structural comparison of sorts and binders; weak head normalization
 * without delta; proof irrelevance; lazy unfolding of definitions, taller
 * definitions first; comparison of constants, locals and applications;
 * eta expansion.
 *
 * <p>Within one query (an outermost call to {@link #isDefEq}), results for
 * pairs of sub-terms are memoized. The memo table is discarded when the
 * query returns.
 */
class DefEqChecker {
  private final TypeChecker tc;
  private @Nullable Map<Pair, Boolean> memo;

  DefEqChecker(TypeChecker tc) {
    this.tc = tc;
  }

  boolean isDefEq(Expr t, Expr s) {
    if (t == s) {
      return true;
    }
    if (memo != null) {
      return StackGuard.guard(() -> isDefEqMemo(t, s));
    }
    memo = new HashMap<>();
    try {
      return StackGuard.guard(() -> isDefEqMemo(t, s));
    } finally {
      memo = null;
    }
  }

  private boolean isDefEqMemo(Expr t, Expr s) {
    final Boolean quick = quickIsDefEq(t, s);
    if (quick != null) {
      return quick;
    }
    final Pair pair = new Pair(t, s);
    final Boolean cached = memo.get(pair);
    if (cached != null) {
      return cached;
    }
    final boolean b = isDefEqCore(t, s);
    memo.put(pair, b);
    return b;
  }

  /** Compares sorts and binders structurally; returns null if the
   * expressions are of some other kind. */
  private @Nullable Boolean quickIsDefEq(Expr t, Expr s) {
    if (t == s) {
      return true;
    }
    if (t.op != s.op) {
      return null;
    }
    switch (t.op) {
    case SORT:
      return ((Expr.Sort) t).level.isEquivalent(((Expr.Sort) s).level);
    case LAMBDA:
    case PI:
      return isDefEqBinders(t, s);
    default:
      return null;
    }
  }

  private boolean isDefEqCore(Expr t0, Expr s0) {
    final Expr t = tc.reducer.whnfCore(t0);
    final Expr s = tc.reducer.whnfCore(s0);
    if (t != t0 || s != s0) {
      final Boolean quick = quickIsDefEq(t, s);
      if (quick != null) {
        return quick;
      }
    }

    final Boolean proofIrrelevant = isDefEqProofIrrelevant(t, s);
    if (proofIrrelevant != null) {
      return proofIrrelevant;
    }

    final LazyDelta lazy = lazyDelta(t, s);
    if (lazy.result != null) {
      return lazy.result;
    }
    final Expr t2 = lazy.t;
    final Expr s2 = lazy.s;

    if (t2.op == Op.CONST && s2.op == Op.CONST
        && ((Expr.Const) t2).name == ((Expr.Const) s2).name
        && isDefEqLevels((Expr.Const) t2, (Expr.Const) s2)) {
      return true;
    }
    if (t2.op == Op.LOCAL && s2.op == Op.LOCAL) {
      return t2 == s2;
    }
    if (isDefEqApp(t2, s2)) {
      return true;
    }
    return tryEta(t2, s2) || tryEta(s2, t2);
  }

  /** Compares two chains of binders of the same kind, opening both with
   * the same fresh locals. */
  private boolean isDefEqBinders(Expr t, Expr s) {
    final Op op = t.op;
    final List<Expr.Local> locals = new ArrayList<>();
    while (t.op == op && s.op == op) {
      final Expr.Binder tb = (Expr.Binder) t;
      final Expr.Binder sb = (Expr.Binder) s;
      final Expr tDomain = Exprs.instantiate(tb.type, locals);
      if (tb.type != sb.type) {
        final Expr sDomain = Exprs.instantiate(sb.type, locals);
        if (!isDefEq(tDomain, sDomain)) {
          return false;
        }
      }
      locals.add(
          tc.localContext.fresh(tb.name, tDomain, tb.binderInfo));
      t = tb.body;
      s = sb.body;
    }
    return isDefEq(Exprs.instantiate(t, locals),
        Exprs.instantiate(s, locals));
  }

  /** If {@code t} is a proof, returns whether {@code s} is a proof of the
   * same proposition; otherwise returns null. */
  private @Nullable Boolean isDefEqProofIrrelevant(Expr t, Expr s) {
    final Expr tType = tc.inferOnly(t);
    if (!tc.isProp(tType)) {
      return null;
    }
    final Expr sType = tc.inferOnly(s);
    return isDefEq(tType, sType);
  }

  /** Unfolds definitions on one or both sides until the two sides are
   * known to be equal or unequal, or neither can be unfolded. When both
   * sides can be unfolded, unfolds the taller first; when they have the
   * same height and the same head, first tries comparing arguments. */
  private LazyDelta lazyDelta(Expr t, Expr s) {
    final Reducer reducer = tc.reducer;
    for (;;) {
      final Declaration.Definition dt = reducer.unfoldable(t);
      final Declaration.Definition ds = reducer.unfoldable(s);
      if (dt == null && ds == null) {
        return new LazyDelta(null, t, s);
      }
      if (ds == null) {
        t = unfold(t);
      } else if (dt == null) {
        s = unfold(s);
      } else {
        final int c = dt.hint().compareHeight(ds.hint());
        if (c > 0) {
          t = unfold(t);
        } else if (c < 0) {
          s = unfold(s);
        } else {
          if (dt == ds
              && t.op == Op.APP
              && s.op == Op.APP
              && isDefEqLevels((Expr.Const) t.getAppFn(),
                  (Expr.Const) s.getAppFn())
              && isDefEqArgs(t, s)) {
            return new LazyDelta(true, t, s);
          }
          t = unfold(t);
          s = unfold(s);
        }
      }
      final Boolean quick = quickIsDefEq(t, s);
      if (quick != null) {
        return new LazyDelta(quick, t, s);
      }
    }
  }

  private Expr unfold(Expr e) {
    final Expr e2 = tc.reducer.unfoldDefinition(e);
    if (e2 == null) {
      throw new AssertionError("not unfoldable: " + e);
    }
    return tc.reducer.whnfCore(e2);
  }

  private boolean isDefEqLevels(Expr.Const t, Expr.Const s) {
    if (t.levels.size() != s.levels.size()) {
      return false;
    }
    for (int i = 0; i < t.levels.size(); i++) {
      final Level tl = t.levels.get(i);
      if (!tl.isEquivalent(s.levels.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Compares two applications by their functions and arguments. */
  private boolean isDefEqApp(Expr t, Expr s) {
    if (t.op != Op.APP || s.op != Op.APP) {
      return false;
    }
    return isDefEq(t.getAppFn(), s.getAppFn()) && isDefEqArgs(t, s);
  }

  private boolean isDefEqArgs(Expr t, Expr s) {
    final List<Expr> tArgs = t.getAppArgs();
    final List<Expr> sArgs = s.getAppArgs();
    if (tArgs.size() != sArgs.size()) {
      return false;
    }
    for (int i = 0; i < tArgs.size(); i++) {
      if (!isDefEq(tArgs.get(i), sArgs.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Tries eta expansion: if {@code t} is a lambda and {@code s} is not,
   * compares {@code t} with {@code fun x => s x}. */
  private boolean tryEta(Expr t, Expr s) {
    if (t.op != Op.LAMBDA || s.op == Op.LAMBDA) {
      return false;
    }
    final Expr sType = tc.whnf(tc.inferOnly(s));
    if (sType.op != Op.PI) {
      return false;
    }
    final Expr.Binder pi = (Expr.Binder) sType;
    final Expr expanded =
        term.lambda(pi.binderInfo, pi.name, pi.type,
            term.app(Exprs.lift(s, 1), term.var(0)));
    return isDefEq(t, expanded);
  }

  /** Unordered pair of expressions, the key of the memo table. */
  private static class Pair {
    final Expr a;
    final Expr b;

    Pair(Expr a, Expr b) {
      this.a = a;
      this.b = b;
    }

    @Override
    public int hashCode() {
      return a.hashCode() ^ b.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pair)) {
        return false;
      }
      final Pair that = (Pair) o;
      return a == that.a && b == that.b
          || a == that.b && b == that.a;
    }
  }

  /** Outcome of lazy delta reduction: a result, if known, and the two
   * expressions as far as they were reduced. */
  private static class LazyDelta {
    final @Nullable Boolean result;
    final Expr t;
    final Expr s;

    LazyDelta(@Nullable Boolean result, Expr t, Expr s) {
      this.result = result;
      this.t = t;
      this.s = s;
    }
  }
}

// End DefEqChecker.java
