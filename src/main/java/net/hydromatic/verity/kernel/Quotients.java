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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The quotient package: the type former {@code quot}, its constructor
 * {@code quot.mk}, its eliminator {@code quot.lift} and its induction
 * principle {@code quot.ind}.
 *
 * <p>The package requires the equality family {@code eq} to be declared
 * first. Reduction:
 *
 * <ul>
 *   <li>{@code quot.lift f h (quot.mk r a)} reduces to {@code f a};
 *   <li>{@code quot.ind h (quot.mk r a)} reduces to {@code h a}.
 * </ul>
 */
public abstract class Quotients {
  private Quotients() {}

  public static final Name QUOT = Name.of("quot");
  public static final Name MK = QUOT.str("mk");
  public static final Name LIFT = QUOT.str("lift");
  public static final Name IND = QUOT.str("ind");
  public static final Name EQ = Name.of("eq");

  static final Name U = Name.of("u");
  static final Name V = Name.of("v");

  /** Returns the type of {@code quot}:
   * {@code Pi {α : Sort u}, (α -> α -> Prop) -> Sort u}. */
  static Expr quotType() {
    final Builder b = new Builder();
    return term.pi(ImmutableList.of(b.alpha, b.relation(BinderInfo.DEFAULT)),
        b.sortU);
  }

  /** Returns the four constants of the package. */
  static List<Declaration.QuotConstant> constants() {
    final ImmutableList.Builder<Declaration.QuotConstant> list =
        ImmutableList.builder();
    final List<Name> u = ImmutableList.of(U);
    list.add(new Declaration.QuotConstant(QUOT, u, quotType(), Kind.TYPE));

    // quot.mk : Pi {α : Sort u} (r : α -> α -> Prop) (a : α), quot α r
    Builder b = new Builder();
    Expr.Local r = b.relation(BinderInfo.DEFAULT);
    Expr.Local a = b.local("a", b.alpha);
    list.add(
        new Declaration.QuotConstant(MK, u,
            term.pi(ImmutableList.of(b.alpha, r, a), b.quot(r)), Kind.MK));

    // quot.lift : Pi {α : Sort u} {r : α -> α -> Prop} {β : Sort v}
    //   (f : α -> β), (Pi (a b : α), r a b -> eq (f a) (f b))
    //   -> quot α r -> β
    b = new Builder();
    r = b.relation(BinderInfo.IMPLICIT);
    final Level v = Level.param(V);
    final Expr.Local beta =
        b.lc.fresh(Name.of("β"), term.sort(v), BinderInfo.IMPLICIT);
    final Expr.Local f = b.local("f", term.arrow(b.alpha, beta));
    a = b.local("a", b.alpha);
    final Expr.Local a2 = b.local("b", b.alpha);
    final Expr.Local rab = b.local("h", term.apps(r, a, a2));
    final Expr respects =
        term.pi(ImmutableList.of(a, a2, rab),
            term.apps(term.constant(EQ, ImmutableList.of(v)), beta,
                term.app(f, a), term.app(f, a2)));
    final Expr.Local h = b.local("h", respects);
    list.add(
        new Declaration.QuotConstant(LIFT, ImmutableList.of(U, V),
            term.pi(ImmutableList.of(b.alpha, r, beta, f, h),
                term.arrow(b.quot(r), beta)),
            Kind.LIFT));

    // quot.ind : Pi {α : Sort u} {r : α -> α -> Prop}
    //   {β : quot α r -> Prop}, (Pi (a : α), β (quot.mk α r a))
    //   -> Pi (q : quot α r), β q
    b = new Builder();
    r = b.relation(BinderInfo.IMPLICIT);
    final Expr.Local motive =
        b.lc.fresh(Name.of("β"), term.arrow(b.quot(r), term.prop()),
            BinderInfo.IMPLICIT);
    a = b.local("a", b.alpha);
    final Expr.Local hInd =
        b.local("h",
            term.pi(ImmutableList.of(a),
                term.app(motive,
                    term.apps(term.constant(MK, b.levels), b.alpha, r, a))));
    final Expr.Local q = b.local("q", b.quot(r));
    list.add(
        new Declaration.QuotConstant(IND, u,
            term.pi(ImmutableList.of(b.alpha, r, motive, hInd, q),
                term.app(motive, q)),
            Kind.IND));
    return list.build();
  }

  /** Checks that the environment has the equality family that the package
   * needs: {@code eq.{u} : Pi {α : Sort u}, α -> α -> Prop}. */
  static void checkEq(TypeChecker tc) {
    final Declaration eq = tc.env().get(EQ);
    if (!(eq instanceof Declaration.Inductive)
        || eq.levelParams.size() != 1) {
      throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
          "'" + EQ + "' must be an inductive family with one universe"
              + " parameter");
    }
    final Builder b = new Builder(eq.levelParams.get(0));
    final Expr.Local x = b.local("a", b.alpha);
    final Expr expected =
        term.pi(ImmutableList.of(b.alpha, x),
            term.arrow(b.alpha, term.prop()));
    if (!tc.isDefEq(eq.type, expected)) {
      throw new KernelException(ErrorKind.TYPE_MISMATCH,
          "'" + EQ + "' has unexpected type", expected, eq.type);
    }
  }

  /** Reduces an application of {@code quot.lift} or {@code quot.ind} whose
   * quotient argument reduces to {@code quot.mk}; returns null if it does
   * not apply. */
  static @Nullable Expr reduce(Kind kind, List<Expr> args,
      UnaryOperator<Expr> whnf) {
    final int mkPos;
    switch (kind) {
    case LIFT:
      mkPos = 5;
      break;
    case IND:
      mkPos = 4;
      break;
    default:
      return null;
    }
    final int fnPos = 3;
    if (args.size() <= mkPos) {
      return null;
    }
    final Expr mk = whnf.apply(args.get(mkPos));
    if (!mk.getAppFn().isConst(MK) || mk.getAppNumArgs() != 3) {
      return null;
    }
    final Expr r = term.app(args.get(fnPos), mk.getAppArgs().get(2));
    return term.apps(r, skip(args, mkPos + 1));
  }

  /** Role of a constant in the quotient package. */
  public enum Kind {
    TYPE, MK, LIFT, IND
  }

  /** Shared locals for building the types in the package. */
  private static class Builder {
    final LocalContext lc = new LocalContext();
    final List<Level> levels;
    final Expr sortU;
    final Expr.Local alpha;

    Builder() {
      this(U);
    }

    Builder(Name u) {
      levels = ImmutableList.of(Level.param(u));
      sortU = term.sort(levels.get(0));
      alpha = lc.fresh(Name.of("α"), sortU, BinderInfo.IMPLICIT);
    }

    Expr.Local local(String name, Expr type) {
      return lc.fresh(Name.of(name), type, BinderInfo.DEFAULT);
    }

    Expr.Local relation(BinderInfo binderInfo) {
      return lc.fresh(Name.of("r"),
          term.arrow(alpha, term.arrow(alpha, term.prop())), binderInfo);
    }

    Expr quot(Expr relation) {
      return term.apps(term.constant(QUOT, levels), alpha, relation);
    }
  }
}

// End Quotients.java
