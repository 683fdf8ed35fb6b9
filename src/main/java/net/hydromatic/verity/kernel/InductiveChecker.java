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
import static net.hydromatic.verity.util.Static.concat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Exprs;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import net.hydromatic.verity.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks an inductive family and derives its recursor.
 *
 * <p>Checks that each constructor's type consists of the family's
 * parameters, then fields, then a conclusion that is the family applied to
 * the parameters and some indices. Derives the recursor's type and one
 * computation rule per constructor, then validates each rule by reducing the
 * recursor applied to the constructor.
 *
 * <p>Strict positivity is not checked.
 */
public class InductiveChecker {
  private final Environment env;
  private final Declaration.Inductive ind;
  private final LocalContext lc = new LocalContext();

  /** Checker over an environment that includes the family itself. */
  private TypeChecker tc;
  private final List<Expr.Local> params = new ArrayList<>();
  private final List<Expr.Local> indices = new ArrayList<>();
  private Level sortLevel = Level.ZERO;
  private Expr indConst;

  public InductiveChecker(Environment env, Declaration.Inductive ind) {
    this.env = env;
    this.ind = ind;
    this.tc = new TypeChecker(env);
    this.indConst = term.constant(ind.name, ind.paramLevels());
  }

  /** Checks the family and returns the declarations to commit: the family,
   * its constructors and its recursor, in that order. */
  public List<Declaration> check() {
    checkFamilyType();
    tc = new TypeChecker(env.withPending(ImmutableList.of(ind)));
    final List<CtorInfo> ctors = new ArrayList<>();
    for (Declaration.Constructor ctor : ind.constructors) {
      ctors.add(checkConstructor(ctor));
    }
    final RecursorInfo recursor = deriveRecursor(ctors);

    final List<Declaration> declarations = new ArrayList<>();
    declarations.add(ind);
    ctors.forEach(c -> declarations.add(c.declaration));
    declarations.add(recursor.declaration);

    // Validate the recursor against an environment that contains it.
    tc = new TypeChecker(env.withPending(declarations));
    tc.inferSortLevel(recursor.declaration.type);
    for (int i = 0; i < ctors.size(); i++) {
      checkComputationRule(recursor, ctors.get(i), i);
    }
    return declarations;
  }

  /** Checks that the type of the family is a telescope of at least
   * {@code numParams} binders ending in a sort. */
  private void checkFamilyType() {
    tc.inferSortLevel(ind.type);
    Expr type = ind.type;
    int i = 0;
    for (;;) {
      type = tc.whnf(type);
      if (type.op != Op.PI) {
        break;
      }
      final Expr.Binder pi = (Expr.Binder) type;
      final Expr.Local local = lc.fresh(pi);
      (i++ < ind.numParams ? params : indices).add(local);
      type = Exprs.instantiateBody(pi, local);
    }
    if (i < ind.numParams) {
      throw new KernelException(ErrorKind.MALFORMED_CONSTRUCTOR,
          "family '" + ind.name + "' has " + i + " binders but "
              + ind.numParams + " parameters");
    }
    if (type.op != Op.SORT) {
      throw new KernelException(ErrorKind.NOT_A_SORT,
          "family '" + ind.name + "' does not end in a sort", null, type);
    }
    sortLevel = ((Expr.Sort) type).level;
  }

  private KernelException malformed(Declaration.Constructor ctor,
      String message, Expr expected, Expr actual) {
    return new KernelException(ErrorKind.MALFORMED_CONSTRUCTOR,
        "constructor '" + ctor.name + "': " + message, expected, actual);
  }

  private CtorInfo checkConstructor(Declaration.Constructor ctor) {
    if (!ctor.inductName.equals(ind.name)) {
      throw malformed(ctor, "belongs to another family", indConst,
          term.constant(ctor.inductName));
    }
    tc.inferSortLevel(ctor.type);

    // Parameters must match the family's, position by position.
    Expr type = ctor.type;
    for (Expr.Local param : params) {
      type = tc.whnf(type);
      if (type.op != Op.PI) {
        throw malformed(ctor, "too few parameters", param.type, type);
      }
      final Expr.Binder pi = (Expr.Binder) type;
      if (!tc.isDefEq(pi.type, param.type)) {
        throw malformed(ctor, "parameter '" + param.name
            + "' has the wrong type", param.type, pi.type);
      }
      type = Exprs.instantiateBody(pi, param);
    }

    // Fields.
    final List<Expr.Local> fields = new ArrayList<>();
    final List<RecursiveField> recursiveFields = new ArrayList<>();
    for (;;) {
      type = tc.whnf(type);
      if (type.op != Op.PI) {
        break;
      }
      final Expr.Binder pi = (Expr.Binder) type;
      final Expr.Local field = lc.fresh(pi);
      checkFieldUniverse(ctor, field);
      final RecursiveField recursiveField =
          recursiveField(ctor, field, fields.size());
      if (recursiveField != null) {
        recursiveFields.add(recursiveField);
      }
      fields.add(field);
      type = Exprs.instantiateBody(pi, field);
    }

    // Conclusion: the family applied to the parameters and indices.
    final Expr expected = term.apps(indConst, params);
    final Expr fn = type.getAppFn();
    final List<Expr> args = type.getAppArgs();
    if (fn != indConst
        || args.size() != params.size() + indices.size()) {
      throw malformed(ctor, "conclusion is not the family", expected, type);
    }
    for (int i = 0; i < params.size(); i++) {
      if (!tc.isDefEq(args.get(i), params.get(i))) {
        throw malformed(ctor, "conclusion has wrong parameter",
            params.get(i), args.get(i));
      }
    }
    final List<Expr> conclusionIndices =
        args.subList(params.size(), args.size());
    final Declaration.Constructor declaration =
        ctor.numFields == fields.size()
            ? ctor
            : new Declaration.Constructor(ctor.name, ctor.levelParams,
                ctor.type, ctor.inductName, ctor.ordinal, ctor.numParams,
                fields.size());
    return new CtorInfo(declaration, fields, recursiveFields,
        ImmutableList.copyOf(conclusionIndices));
  }

  /** Checks that a field's type is a type, and, unless the family is a
   * proposition, that it lives in a universe no bigger than the
   * family's. */
  private void checkFieldUniverse(Declaration.Constructor ctor,
      Expr.Local field) {
    final Level level = tc.inferSortLevel(field.type);
    if (sortLevel.maybeNonZero() && !level.leq(sortLevel)) {
      throw malformed(ctor, "field '" + field.name + "' is too big",
          term.sort(sortLevel), term.sort(level));
    }
  }

  /** If the type of a field, after its own telescope, is the family applied
   * to the parameters, returns a description of the recursive field;
   * otherwise null. */
  private @Nullable RecursiveField recursiveField(Declaration.Constructor ctor,
      Expr.Local field, int position) {
    final List<Expr.Local> telescope = new ArrayList<>();
    Expr type = field.type;
    for (;;) {
      type = tc.whnf(type);
      if (type.op != Op.PI) {
        break;
      }
      final Expr.Binder pi = (Expr.Binder) type;
      final Expr.Local local = lc.fresh(pi);
      telescope.add(local);
      type = Exprs.instantiateBody(pi, local);
    }
    if (type.getAppFn() != indConst) {
      return null;
    }
    final List<Expr> args = type.getAppArgs();
    if (args.size() != params.size() + indices.size()) {
      throw malformed(ctor, "recursive field '" + field.name
          + "' has the wrong number of arguments",
          term.apps(indConst, params), type);
    }
    for (int i = 0; i < params.size(); i++) {
      if (!tc.isDefEq(args.get(i), params.get(i))) {
        throw malformed(ctor, "recursive field '" + field.name
            + "' changes a parameter", params.get(i), args.get(i));
      }
    }
    return new RecursiveField(position, telescope,
        ImmutableList.copyOf(args.subList(params.size(), args.size())));
  }

  /** Returns whether the recursor may only eliminate into {@code Prop}.
   * That is the case if the family may be a proposition and either has
   * several constructors or has a constructor with a field that is not a
   * proof and does not occur among the conclusion's indices. */
  private boolean elimOnlyIntoProp(List<CtorInfo> ctors) {
    if (!sortLevel.maybeZero()) {
      return false;
    }
    if (ctors.size() > 1) {
      return true;
    }
    for (CtorInfo ctor : ctors) {
      for (Expr.Local field : ctor.fields) {
        if (!tc.isProof(field) && !ctor.indices.contains(field)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Applies the motive to indices and, for a dependent eliminator, to the
   * major premise. */
  private Expr motiveApp(Expr motive, List<? extends Expr> indices,
      Expr major) {
    final Expr e = term.apps(motive, indices);
    return useDependentElim() ? term.app(e, major) : e;
  }

  private boolean useDependentElim() {
    return sortLevel.maybeNonZero();
  }

  private RecursorInfo deriveRecursor(List<CtorInfo> ctors) {
    // Universe parameters, and the universe into which to eliminate.
    final Level elimLevel;
    final List<Name> recLevelParams;
    if (elimOnlyIntoProp(ctors)) {
      elimLevel = Level.ZERO;
      recLevelParams = ind.levelParams;
    } else {
      final Name l = Name.of("l").fresh(new HashSet<>(ind.levelParams));
      elimLevel = Level.param(l);
      recLevelParams =
          ImmutableList.<Name>builder().add(l).addAll(ind.levelParams)
              .build();
    }
    final Expr recConst =
        term.constant(ind.recursorName(), Level.params(recLevelParams));

    // Motive.
    final Expr familyApp = term.apps(indConst, concat(params, indices));
    final List<Expr.Local> motiveBinders = new ArrayList<>(indices);
    if (useDependentElim()) {
      motiveBinders.add(lc.fresh(Name.of("t"), familyApp, BinderInfo.DEFAULT));
    }
    final Expr.Local motive =
        lc.fresh(Name.of("C"),
            term.pi(motiveBinders, term.sort(elimLevel)),
            BinderInfo.IMPLICIT);

    // Minor premises.
    final List<Expr.Local> minors = new ArrayList<>();
    for (CtorInfo ctor : ctors) {
      final List<Expr.Local> hypotheses = new ArrayList<>();
      for (RecursiveField rf : ctor.recursiveFields) {
        final Expr.Local field = ctor.fields.get(rf.position);
        final Expr ihType =
            term.pi(rf.telescope,
                motiveApp(motive, rf.indices,
                    term.apps(field, rf.telescope)));
        hypotheses.add(
            lc.fresh(Name.of("ih_" + field.name.last()), ihType,
                BinderInfo.DEFAULT));
      }
      ctor.hypotheses = hypotheses;
      final Expr minorType =
          term.pi(concat(ctor.fields, hypotheses),
              motiveApp(motive, ctor.indices, ctorApp(ctor)));
      minors.add(
          lc.fresh(Name.of(ctor.declaration.name.last()), minorType,
              BinderInfo.DEFAULT));
    }

    // Major premise and the recursor's type.
    final Expr.Local major =
        lc.fresh(Name.of("x"), familyApp, BinderInfo.DEFAULT);
    final List<Expr.Local> binders =
        ImmutableList.<Expr.Local>builder()
            .addAll(params).add(motive).addAll(minors).addAll(indices)
            .add(major).build();
    final Expr recType = term.pi(binders, motiveApp(motive, indices, major));

    // Computation rules.
    final RecursorInfo recursor =
        new RecursorInfo(recConst, motive, ImmutableList.copyOf(minors));
    final List<Declaration.RecursorRule> rules = new ArrayList<>();
    for (int i = 0; i < ctors.size(); i++) {
      final CtorInfo ctor = ctors.get(i);
      final List<Expr.Local> ruleBinders =
          ImmutableList.<Expr.Local>builder()
              .addAll(params).add(motive).addAll(minors)
              .addAll(ctor.fields).build();
      rules.add(
          new Declaration.RecursorRule(ctor.declaration.name,
              ctor.fields.size(),
              term.lambda(ruleBinders, expectedReduct(recursor, ctor, i))));
    }
    final boolean k =
        sortLevel.isZero()
            && ctors.size() == 1
            && ctors.get(0).fields.isEmpty();
    recursor.declaration =
        new Declaration.Recursor(ind.recursorName(), recLevelParams, recType,
            ind.name, params.size(), indices.size(), minors.size(), k,
            rules);
    return recursor;
  }

  /** Returns the constructor applied to the parameters and its fields. */
  private Expr ctorApp(CtorInfo ctor) {
    return term.apps(term.constant(ctor.declaration.name, ind.paramLevels()),
        concat(params, ctor.fields));
  }

  /** Returns what the recursor, applied to a constructor, should reduce
   * to: the constructor's minor premise applied to the fields and to a
   * recursive call for each recursive field. */
  private Expr expectedReduct(RecursorInfo recursor, CtorInfo ctor, int i) {
    final List<Expr> args = new ArrayList<>(ctor.fields);
    for (RecursiveField rf : ctor.recursiveFields) {
      final Expr field = ctor.fields.get(rf.position);
      final Expr call =
          term.apps(recursor.recConst,
              ImmutableList.<Expr>builder()
                  .addAll(params).add(recursor.motive)
                  .addAll(recursor.minors).addAll(rf.indices)
                  .add(term.apps(field, rf.telescope)).build());
      args.add(term.lambda(rf.telescope, call));
    }
    return term.apps(recursor.minors.get(i), args);
  }

  /** Checks that the recursor applied to a constructor is well typed and
   * reduces to what the minor premise promises. */
  private void checkComputationRule(RecursorInfo recursor, CtorInfo ctor,
      int i) {
    final Expr lhs =
        term.apps(recursor.recConst,
            ImmutableList.<Expr>builder()
                .addAll(params).add(recursor.motive)
                .addAll(recursor.minors).addAll(ctor.indices)
                .add(ctorApp(ctor)).build());
    final Expr rhs = expectedReduct(recursor, ctor, i);
    final Expr lhsType;
    final Expr rhsType;
    try {
      lhsType = tc.infer(lhs);
      rhsType = tc.infer(rhs);
    } catch (KernelException e) {
      throw new KernelException(ErrorKind.BAD_COMPUTATION_RULE,
          "rule for '" + ctor.declaration.name + "' is ill typed: "
              + e.getMessage(), e.expected, e.actual);
    }
    if (!tc.isDefEq(lhsType, rhsType)) {
      throw new KernelException(ErrorKind.BAD_COMPUTATION_RULE,
          "rule for '" + ctor.declaration.name + "' changes the type",
          lhsType, rhsType);
    }
    final Expr reduced = tc.whnf(lhs);
    if (!tc.isDefEq(reduced, rhs)) {
      throw new KernelException(ErrorKind.BAD_COMPUTATION_RULE,
          "recursor does not reduce on '" + ctor.declaration.name + "'",
          rhs, reduced);
    }
  }

  /** What is known about a constructor after it has been checked. */
  private static class CtorInfo {
    final Declaration.Constructor declaration;
    final List<Expr.Local> fields;
    final List<RecursiveField> recursiveFields;
    /** Indices in the constructor's conclusion. */
    final List<Expr> indices;
    List<Expr.Local> hypotheses = ImmutableList.of();

    CtorInfo(Declaration.Constructor declaration, List<Expr.Local> fields,
        List<RecursiveField> recursiveFields, List<Expr> indices) {
      this.declaration = declaration;
      this.fields = ImmutableList.copyOf(fields);
      this.recursiveFields = ImmutableList.copyOf(recursiveFields);
      this.indices = indices;
    }
  }

  /** A field whose type is the family (possibly under a telescope). */
  private static class RecursiveField {
    final int position;
    final List<Expr.Local> telescope;
    final List<Expr> indices;

    RecursiveField(int position, List<Expr.Local> telescope,
        List<Expr> indices) {
      this.position = position;
      this.telescope = ImmutableList.copyOf(telescope);
      this.indices = indices;
    }
  }

  /** The recursor being derived. */
  private static class RecursorInfo {
    final Expr recConst;
    final Expr.Local motive;
    final List<Expr.Local> minors;
    Declaration.Recursor declaration;

    RecursorInfo(Expr recConst, Expr.Local motive, List<Expr.Local> minors) {
      this.recConst = recConst;
      this.motive = motive;
      this.minors = minors;
    }
  }
}

// End InductiveChecker.java
