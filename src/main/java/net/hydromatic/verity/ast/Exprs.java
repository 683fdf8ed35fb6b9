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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.verity.util.StackGuard;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for {@link Expr}: substitution of bound variables, locals and
 * universe parameters.
 *
 * <p>All traversals skip sub-expressions whose cached properties show that
 * there is nothing to replace, and memoize the result for each
 * (sub-expression, binder depth) pair, so shared sub-terms are visited
 * once.
 */
public abstract class Exprs {
  private Exprs() {}

  /** Replaces loose variables {@code 0 .. n-1} by values.
   *
   * <p>{@code values} is in binder order: the outermost binder's value
   * first. So the loose variable {@code #0} is replaced by the last value,
   * and variables {@code #n} and above are renumbered down by {@code n}. */
  public static Expr instantiate(Expr e, List<? extends Expr> values) {
    if (values.isEmpty() || !e.hasLooseVars()) {
      return e;
    }
    final int n = values.size();
    return new Replacer() {
      @Override
      @Nullable Expr replace(Expr e, int offset) {
        if (e.looseBound() <= offset) {
          return e;
        }
        if (e.op == Op.VAR) {
          final int index = ((Expr.Var) e).index;
          if (index < offset + n) {
            return lift(values.get(n - 1 - (index - offset)), offset);
          }
          return term.var(index - n);
        }
        return null;
      }
    }.apply(e);
  }

  /** Replaces the loose variable {@code #0} by a value. */
  public static Expr instantiate(Expr e, Expr value) {
    return instantiate(e, ImmutableList.of(value));
  }

  /** Returns the body of a binder with its bound variable replaced by a
   * value. */
  public static Expr instantiateBody(Expr.Binder binder, Expr value) {
    return instantiate(binder.body, value);
  }

  /** Replaces locals by variables; the inverse of
   * {@link #instantiate(Expr, List)}. The last local becomes {@code #0}. */
  public static Expr abstractLocals(Expr e, List<Expr.Local> locals) {
    if (locals.isEmpty() || !e.hasLocals()) {
      return e;
    }
    final int n = locals.size();
    return new Replacer() {
      @Override
      @Nullable Expr replace(Expr e, int offset) {
        if (!e.hasLocals()) {
          return e;
        }
        if (e.op == Op.LOCAL) {
          for (int i = n - 1; i >= 0; i--) {
            if (locals.get(i) == e) {
              return term.var(offset + n - 1 - i);
            }
          }
          return e;
        }
        return null;
      }
    }.apply(e);
  }

  /** Adds {@code d} to the index of every loose variable. */
  public static Expr lift(Expr e, int d) {
    if (d == 0 || !e.hasLooseVars()) {
      return e;
    }
    return new Replacer() {
      @Override
      @Nullable Expr replace(Expr e, int offset) {
        if (e.looseBound() <= offset) {
          return e;
        }
        if (e.op == Op.VAR) {
          return term.var(((Expr.Var) e).index + d);
        }
        return null;
      }
    }.apply(e);
  }

  /** Replaces universe parameters by levels. */
  public static Expr instantiateLevelParams(Expr e, List<Name> names,
      List<Level> levels) {
    if (names.isEmpty() || !e.hasLevelParams()) {
      return e;
    }
    if (names.size() != levels.size()) {
      throw new IllegalArgumentException("expected " + names.size()
          + " levels, got " + levels.size());
    }
    final ImmutableMap.Builder<Name, Level> b = ImmutableMap.builder();
    for (int i = 0; i < names.size(); i++) {
      b.put(names.get(i), levels.get(i));
    }
    final Map<Name, Level> map = b.buildKeepingLast();
    return new Replacer() {
      @Override
      @Nullable Expr replace(Expr e, int offset) {
        if (!e.hasLevelParams()) {
          return e;
        }
        switch (e.op) {
        case SORT:
          return term.sort(((Expr.Sort) e).level.instantiate(map));
        case CONST:
          final Expr.Const c = (Expr.Const) e;
          final List<Level> list = new ArrayList<>();
          c.levels.forEach(level -> list.add(level.instantiate(map)));
          return term.constant(c.name, list);
        default:
          return null;
        }
      }
    }.apply(e);
  }

  /** Calls a consumer for each distinct constant in an expression. */
  public static void forEachConst(Expr e, Consumer<Expr.Const> consumer) {
    new Visitor() {
      @Override
      boolean visit(Expr e) {
        if (e.op == Op.CONST) {
          consumer.accept((Expr.Const) e);
        }
        return true;
      }
    }.apply(e);
  }

  /** Adds to a set the universe parameters mentioned in an expression. */
  public static void collectLevelParams(Expr e, Set<Name> names) {
    new Visitor() {
      @Override
      boolean visit(Expr e) {
        if (!e.hasLevelParams()) {
          return false;
        }
        switch (e.op) {
        case SORT:
          ((Expr.Sort) e).level.collectParams(names);
          return false;
        case CONST:
          ((Expr.Const) e).levels.forEach(l -> l.collectParams(names));
          return false;
        default:
          return true;
        }
      }
    }.apply(e);
  }

  /** Returns the children of an expression; the type of a local is not
   * considered a child. */
  static List<Expr> children(Expr e) {
    switch (e.op) {
    case APP:
      final Expr.App app = (Expr.App) e;
      return ImmutableList.of(app.fn, app.arg);
    case LAMBDA:
    case PI:
      final Expr.Binder binder = (Expr.Binder) e;
      return ImmutableList.of(binder.type, binder.body);
    case LET:
      final Expr.Let let = (Expr.Let) e;
      return ImmutableList.of(let.type, let.value, let.body);
    default:
      return ImmutableList.of();
    }
  }

  /** Traversal that rebuilds an expression bottom-up, replacing nodes as
   * directed by {@link #replace(Expr, int)}. */
  private abstract static class Replacer {
    /** Caches indexed by binder depth. */
    private final List<Map<Expr, Expr>> caches = new ArrayList<>();

    /** Returns the replacement for an expression at a given binder depth,
     * or null to replace its children. */
    abstract @Nullable Expr replace(Expr e, int offset);

    Expr apply(Expr e) {
      return apply(e, 0);
    }

    private Map<Expr, Expr> cache(int offset) {
      while (caches.size() <= offset) {
        caches.add(new HashMap<>());
      }
      return caches.get(offset);
    }

    private Expr apply(Expr e, int offset) {
      final Expr r = replace(e, offset);
      if (r != null) {
        return r;
      }
      final Map<Expr, Expr> cache = cache(offset);
      final Expr cached = cache.get(e);
      if (cached != null) {
        return cached;
      }
      final Expr result = StackGuard.guard(() -> rebuild(e, offset));
      cache.put(e, result);
      return result;
    }

    private Expr rebuild(Expr e, int offset) {
      switch (e.op) {
      case APP:
        final Expr.App app = (Expr.App) e;
        final Expr fn = apply(app.fn, offset);
        final Expr arg = apply(app.arg, offset);
        return fn == app.fn && arg == app.arg ? e : term.app(fn, arg);
      case LAMBDA:
      case PI:
        final Expr.Binder binder = (Expr.Binder) e;
        final Expr type = apply(binder.type, offset);
        final Expr body = apply(binder.body, offset + 1);
        return type == binder.type && body == binder.body
            ? e
            : term.binder(e.op, binder.binderInfo, binder.name, type, body);
      case LET:
        final Expr.Let let = (Expr.Let) e;
        final Expr letType = apply(let.type, offset);
        final Expr value = apply(let.value, offset);
        final Expr letBody = apply(let.body, offset + 1);
        return letType == let.type && value == let.value
            && letBody == let.body
            ? e
            : term.let(let.name, letType, value, letBody);
      default:
        return e;
      }
    }
  }

  /** Traversal that visits each distinct sub-expression once. */
  private abstract static class Visitor {
    private final Set<Expr> visited = new HashSet<>();

    /** Visits an expression; returns whether to visit its children. */
    abstract boolean visit(Expr e);

    void apply(Expr e) {
      if (!visited.add(e) || !visit(e)) {
        return;
      }
      StackGuard.guardRun(() -> children(e).forEach(this::apply));
    }
  }
}

// End Exprs.java
