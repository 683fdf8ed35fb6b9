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

import static java.util.Objects.requireNonNull;
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

/**
 * Infers the types of expressions against an environment.
 *
 * <p>A type checker is one checking episode. It owns the caches for type
 * inference, weak head normal forms and the source of fresh locals, and it
 * must be used by one thread at a time. Create a new type checker for each
 * declaration; it is cheap.
 *
 * <p>Reduction is delegated to a {@link Reducer} and definitional equality
 * to a {@link DefEqChecker}; both share this checker's state.
 */
public class TypeChecker {
  private final Environment env;
  final LocalContext localContext = new LocalContext();
  final Reducer reducer;
  final DefEqChecker defEqChecker;

  private final Map<Expr, Expr> inferCache = new HashMap<>();
  private final Map<Expr, Expr> inferOnlyCache = new HashMap<>();

  /** Creates a TypeChecker. */
  public TypeChecker(Environment env) {
    this.env = requireNonNull(env);
    this.reducer = new Reducer(this);
    this.defEqChecker = new DefEqChecker(this);
  }

  public Environment env() {
    return env;
  }

  /** Infers the type of a closed expression, checking that it is well
   * typed. */
  public Expr infer(Expr e) {
    return infer(e, false);
  }

  /** Infers the type of an expression whose loose variables refer to the
   * locals of a context. */
  public Expr infer(Expr e, LocalContext context) {
    if (!e.hasLooseVars()) {
      return infer(e);
    }
    if (e.op == Op.VAR) {
      return context.fromEnd(((Expr.Var) e).index).type;
    }
    final List<Expr.Local> locals = context.locals();
    if (e.looseBound() > locals.size()) {
      throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
          "bound variable #" + (e.looseBound() - 1) + " escapes its binder");
    }
    return infer(Exprs.instantiate(e, locals));
  }

  /** Infers the type of an expression that is known to be well typed.
   * Does not check arguments against their function's domain. */
  public Expr inferOnly(Expr e) {
    return infer(e, true);
  }

  Expr infer(Expr e, boolean inferOnly) {
    final Map<Expr, Expr> cache = inferOnly ? inferOnlyCache : inferCache;
    final Expr cached = cache.get(e);
    if (cached != null) {
      return cached;
    }
    final Expr type = StackGuard.guard(() -> infer0(e, inferOnly));
    cache.put(e, type);
    if (!inferOnly) {
      // A checked type is also a valid unchecked one.
      inferOnlyCache.put(e, type);
    }
    return type;
  }

  private Expr infer0(Expr e, boolean inferOnly) {
    switch (e.op) {
    case VAR:
      throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
          "bound variable #" + ((Expr.Var) e).index + " escapes its binder");
    case SORT:
      return term.sort(Level.succ(((Expr.Sort) e).level));
    case CONST:
      return inferConst((Expr.Const) e);
    case LOCAL:
      return ((Expr.Local) e).type;
    case APP:
      return inferApp(e, inferOnly);
    case LAMBDA:
      return inferLambda(e, inferOnly);
    case PI:
      return term.sort(inferPi(e, inferOnly));
    case LET:
      return inferLet((Expr.Let) e, inferOnly);
    default:
      throw new AssertionError("unknown op " + e.op);
    }
  }

  private Expr inferConst(Expr.Const c) {
    final Declaration declaration = env.get(c.name);
    if (declaration.levelParams.size() != c.levels.size()) {
      throw new KernelException(ErrorKind.UNIVERSE_ARITY,
          "constant '" + c.name + "' expects "
              + declaration.levelParams.size() + " universe arguments, got "
              + c.levels.size());
    }
    return Exprs.instantiateLevelParams(declaration.type,
        declaration.levelParams, c.levels);
  }

  /** Infers the type of a chain of applications. Walks the spine once,
   * instantiating the function type's binders in batches. */
  private Expr inferApp(Expr e, boolean inferOnly) {
    final List<Expr> args = e.getAppArgs();
    Expr fnType = infer(e.getAppFn(), inferOnly);
    int j = 0;
    for (int i = 0; i < args.size(); i++) {
      if (fnType.op != Op.PI) {
        fnType = ensurePi(Exprs.instantiate(fnType, args.subList(j, i)));
        j = i;
      }
      final Expr.Binder pi = (Expr.Binder) fnType;
      if (!inferOnly) {
        final Expr domain = Exprs.instantiate(pi.type, args.subList(j, i));
        final Expr argType = infer(args.get(i), false);
        if (!isDefEq(argType, domain)) {
          throw new KernelException(ErrorKind.TYPE_MISMATCH,
              "argument " + args.get(i) + " has the wrong type", domain,
              argType);
        }
      }
      fnType = pi.body;
    }
    return Exprs.instantiate(fnType, args.subList(j, args.size()));
  }

  private Expr inferLambda(Expr e, boolean inferOnly) {
    final List<Expr.Local> locals = new ArrayList<>();
    Expr body = e;
    while (body.op == Op.LAMBDA) {
      final Expr.Binder lambda = (Expr.Binder) body;
      final Expr domain = Exprs.instantiate(lambda.type, locals);
      if (!inferOnly) {
        inferSortLevel(domain);
      }
      locals.add(
          localContext.fresh(lambda.name, domain, lambda.binderInfo));
      body = lambda.body;
    }
    final Expr bodyType =
        infer(Exprs.instantiate(body, locals), inferOnly);
    return term.pi(locals, bodyType);
  }

  /** Returns the level of the sort of a Pi type. */
  private Level inferPi(Expr e, boolean inferOnly) {
    final List<Expr.Local> locals = new ArrayList<>();
    final List<Level> levels = new ArrayList<>();
    Expr body = e;
    while (body.op == Op.PI) {
      final Expr.Binder pi = (Expr.Binder) body;
      final Expr domain = Exprs.instantiate(pi.type, locals);
      levels.add(inferSortLevel(domain, inferOnly));
      locals.add(localContext.fresh(pi.name, domain, pi.binderInfo));
      body = pi.body;
    }
    Level level =
        inferSortLevel(Exprs.instantiate(body, locals), inferOnly);
    for (int i = levels.size() - 1; i >= 0; i--) {
      level = Level.imax(levels.get(i), level);
    }
    return level;
  }

  private Expr inferLet(Expr.Let let, boolean inferOnly) {
    if (!inferOnly) {
      inferSortLevel(let.type);
      final Expr valueType = infer(let.value, false);
      if (!isDefEq(valueType, let.type)) {
        throw new KernelException(ErrorKind.TYPE_MISMATCH,
            "value of let '" + let.name + "' has the wrong type", let.type,
            valueType);
      }
    }
    return infer(Exprs.instantiate(let.body, let.value), inferOnly);
  }

  /** Infers the type of a type, checks that it is a sort, and returns its
   * level. */
  public Level inferSortLevel(Expr type) {
    return inferSortLevel(type, false);
  }

  private Level inferSortLevel(Expr type, boolean inferOnly) {
    return ensureSort(infer(type, inferOnly)).level;
  }

  /** Reduces an expression to a sort, or throws. */
  public Expr.Sort ensureSort(Expr e) {
    if (e.op == Op.SORT) {
      return (Expr.Sort) e;
    }
    final Expr e2 = whnf(e);
    if (e2.op == Op.SORT) {
      return (Expr.Sort) e2;
    }
    throw new KernelException(ErrorKind.NOT_A_SORT,
        "type expected", null, e);
  }

  /** Reduces an expression to a Pi, or throws. */
  public Expr.Binder ensurePi(Expr e) {
    if (e.op == Op.PI) {
      return (Expr.Binder) e;
    }
    final Expr e2 = whnf(e);
    if (e2.op == Op.PI) {
      return (Expr.Binder) e2;
    }
    throw new KernelException(ErrorKind.NOT_A_FUNCTION,
        "function expected", null, e);
  }

  /** Checks that an expression has a given type. */
  public void check(Expr e, Expr expectedType) {
    final Expr type = infer(e);
    if (!isDefEq(type, expectedType)) {
      throw new KernelException(ErrorKind.TYPE_MISMATCH,
          "type mismatch for " + e, expectedType, type);
    }
  }

  /** Returns whether a type is a proposition, that is, its type is
   * {@code Prop}. */
  public boolean isProp(Expr type) {
    return whnf(inferOnly(type)) == term.prop();
  }

  /** Returns whether an expression is a proof, that is, its type is a
   * proposition. */
  public boolean isProof(Expr e) {
    return isProp(inferOnly(e));
  }

  /** Reduces an expression to weak head normal form. */
  public Expr whnf(Expr e) {
    return reducer.whnf(e);
  }

  /** Returns whether two expressions are definitionally equal. */
  public boolean isDefEq(Expr a, Expr b) {
    return defEqChecker.isDefEq(a, b);
  }

  /** Returns the source of fresh locals. */
  public LocalContext localContext() {
    return localContext;
  }
}

// End TypeChecker.java
