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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import net.hydromatic.verity.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration: a named, universe-polymorphic constant with a type.
 *
 * <p>Axioms, definitions, inductive families and the quotient package
 * arrive from the input stream. Constructors, recursors and quotient
 * constants are derived by the kernel when it commits their family or
 * package.
 */
public abstract class Declaration {
  public final Name name;
  public final ImmutableList<Name> levelParams;
  public final Expr type;

  Declaration(Name name, List<Name> levelParams, Expr type) {
    this.name = requireNonNull(name);
    this.levelParams = ImmutableList.copyOf(levelParams);
    this.type = requireNonNull(type);
  }

  /** Returns the terms of this declaration other than its type that
   * must satisfy the environment's invariants. */
  public List<Expr> otherTerms() {
    return ImmutableList.of();
  }

  /** Returns the levels that refer to this declaration's parameters, for
   * use in a constant that refers to it from within. */
  public List<Level> paramLevels() {
    return Level.params(levelParams);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName().toLowerCase(Locale.ROOT)
        + " " + name;
  }

  /** Creates an axiom. */
  public static Axiom axiom(Name name, List<Name> levelParams, Expr type) {
    return new Axiom(name, levelParams, type);
  }

  /** Creates a definition whose reducibility hint will be computed from its
   * value when it is committed. */
  public static Definition definition(Name name, List<Name> levelParams,
      Expr type, Expr value) {
    return new Definition(name, levelParams, type, value, null);
  }

  /** Creates a definition with a given reducibility hint. */
  public static Definition definition(Name name, List<Name> levelParams,
      Expr type, Expr value, ReducibilityHint hint) {
    return new Definition(name, levelParams, type, value, hint);
  }

  /** Creates an inductive family.
   *
   * @param name Name of the family
   * @param levelParams Universe parameters, shared by the constructors
   * @param numParams Number of leading Pi binders of {@code type} that are
   *     parameters (the rest are indices)
   * @param type Type of the family
   * @param constructors Names and types of the constructors, in order
   */
  public static Inductive inductive(Name name, List<Name> levelParams,
      int numParams, Expr type, Map<Name, Expr> constructors) {
    final ImmutableList.Builder<Constructor> b = ImmutableList.builder();
    int i = 0;
    for (Map.Entry<Name, Expr> entry : constructors.entrySet()) {
      final int numFields = countPis(entry.getValue()) - numParams;
      b.add(
          new Constructor(entry.getKey(), levelParams, entry.getValue(), name,
              i++, numParams, Math.max(numFields, 0)));
    }
    return new Inductive(name, levelParams, numParams, type, b.build());
  }

  /** Creates a request to add the quotient package. */
  public static QuotPackage quotPackage() {
    return new QuotPackage(ImmutableList.of(Quotients.U), Quotients.quotType());
  }

  /** Counts the leading Pi binders of a type. */
  static int countPis(Expr type) {
    int n = 0;
    for (Expr e = type; e.op == Op.PI; e = ((Expr.Binder) e).body) {
      ++n;
    }
    return n;
  }

  /** Trusted constant; it has a type but no value. */
  public static class Axiom extends Declaration {
    Axiom(Name name, List<Name> levelParams, Expr type) {
      super(name, levelParams, type);
    }
  }

  /** Constant with a value that may be unfolded. */
  public static class Definition extends Declaration {
    public final Expr value;
    /** Reducibility hint; null until the definition has been committed,
     * if the input did not supply one. */
    public final @Nullable ReducibilityHint hint;

    Definition(Name name, List<Name> levelParams, Expr type, Expr value,
        @Nullable ReducibilityHint hint) {
      super(name, levelParams, type);
      this.value = requireNonNull(value);
      this.hint = hint;
    }

    /** Returns a copy of this definition with a given hint. */
    public Definition withHint(ReducibilityHint hint) {
      if (hint.equals(this.hint)) {
        return this;
      }
      return new Definition(name, levelParams, type, value, hint);
    }

    /** Returns the hint, treating a missing one as height zero. */
    public ReducibilityHint hint() {
      return hint != null ? hint : ReducibilityHint.regular(0);
    }

    @Override
    public List<Expr> otherTerms() {
      return ImmutableList.of(value);
    }
  }

  /** Inductive family. */
  public static class Inductive extends Declaration {
    public final int numParams;
    public final ImmutableList<Constructor> constructors;

    Inductive(Name name, List<Name> levelParams, int numParams, Expr type,
        List<Constructor> constructors) {
      super(name, levelParams, type);
      this.numParams = numParams;
      this.constructors = ImmutableList.copyOf(constructors);
    }

    /** Returns the name of the recursor of this family. */
    public Name recursorName() {
      return name.str("rec");
    }
  }

  /** Constructor of an inductive family. */
  public static class Constructor extends Declaration {
    public final Name inductName;
    /** Position of this constructor in its family, starting at 0. */
    public final int ordinal;
    public final int numParams;
    public final int numFields;

    Constructor(Name name, List<Name> levelParams, Expr type,
        Name inductName, int ordinal, int numParams, int numFields) {
      super(name, levelParams, type);
      this.inductName = requireNonNull(inductName);
      this.ordinal = ordinal;
      this.numParams = numParams;
      this.numFields = numFields;
    }
  }

  /** Recursor (eliminator) of an inductive family, derived by the kernel.
   *
   * <p>Its arguments are, in order: the family's parameters, the motive,
   * one minor premise per constructor, the family's indices, and the major
   * premise. */
  public static class Recursor extends Declaration {
    public final Name inductName;
    public final int numParams;
    public final int numIndices;
    public final int numMinors;
    /** Whether the recursor supports K-like reduction: the family is a
     * proposition with one constructor that has no fields. */
    public final boolean k;
    public final ImmutableList<RecursorRule> rules;

    Recursor(Name name, List<Name> levelParams, Expr type, Name inductName,
        int numParams, int numIndices, int numMinors, boolean k,
        List<RecursorRule> rules) {
      super(name, levelParams, type);
      this.inductName = requireNonNull(inductName);
      this.numParams = numParams;
      this.numIndices = numIndices;
      this.numMinors = numMinors;
      this.k = k;
      this.rules = ImmutableList.copyOf(rules);
    }

    /** Returns the position of the motive among the arguments. */
    public int motiveIndex() {
      return numParams;
    }

    /** Returns the position of the major premise among the arguments. */
    public int majorIndex() {
      return numParams + 1 + numMinors + numIndices;
    }

    /** Returns the rule for a given constructor, or null. */
    public @Nullable RecursorRule ruleFor(Name ctorName) {
      for (RecursorRule rule : rules) {
        if (rule.ctorName == ctorName) {
          return rule;
        }
      }
      return null;
    }

    @Override
    public List<Expr> otherTerms() {
      final ImmutableList.Builder<Expr> b = ImmutableList.builder();
      rules.forEach(rule -> b.add(rule.rhs));
      return b.build();
    }
  }

  /** Computation rule of a recursor.
   *
   * <p>The right-hand side is a closed term that takes the recursor's
   * parameters, motive and minor premises, then the constructor's fields,
   * and returns the result of the reduction. */
  public static class RecursorRule {
    public final Name ctorName;
    public final int numFields;
    public final Expr rhs;

    public RecursorRule(Name ctorName, int numFields, Expr rhs) {
      this.ctorName = requireNonNull(ctorName);
      this.numFields = numFields;
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public String toString() {
      return ctorName + " => " + rhs;
    }
  }

  /** Request to add the quotient package. Its name, universe parameters
   * and type are those of the {@code quot} type former; the package also
   * declares {@code quot.mk}, {@code quot.lift} and {@code quot.ind}. */
  public static class QuotPackage extends Declaration {
    QuotPackage(List<Name> levelParams, Expr type) {
      super(Quotients.QUOT, levelParams, type);
    }
  }

  /** One of the constants of the quotient package. */
  public static class QuotConstant extends Declaration {
    public final Quotients.Kind kind;

    QuotConstant(Name name, List<Name> levelParams, Expr type,
        Quotients.Kind kind) {
      super(name, levelParams, type);
      this.kind = requireNonNull(kind);
    }
  }
}

// End Declaration.java
