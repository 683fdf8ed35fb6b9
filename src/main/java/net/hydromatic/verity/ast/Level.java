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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Universe level.
 *
 * <p>Levels are hash-consed; structurally identical levels are the same
 * object. Equality in the sense of the type theory is not {@code ==}; use
 * {@link #isEquivalent(Level)}, which is based on {@link #leq(Level)}.
 */
public abstract class Level {
  private static final Interner<Level> INTERNER = Interners.newWeakInterner();

  /** The level of propositions. */
  public static final Level ZERO = INTERNER.intern(new Zero());

  /** The level one above {@link #ZERO}. */
  public static final Level ONE = succ(ZERO);

  public final Kind kind;
  private final int hash;
  private final boolean hasParam;

  Level(Kind kind, int hash, boolean hasParam) {
    this.kind = requireNonNull(kind);
    this.hash = hash;
    this.hasParam = hasParam;
  }

  /** Creates the successor of a level. */
  public static Level succ(Level level) {
    return INTERNER.intern(new Succ(level));
  }

  /** Creates the maximum of two levels. */
  public static Level max(Level left, Level right) {
    return INTERNER.intern(new Max(Kind.MAX, left, right));
  }

  /** Creates the impredicative maximum of two levels; zero if
   * {@code right} is zero, otherwise the maximum. */
  public static Level imax(Level left, Level right) {
    return INTERNER.intern(new Max(Kind.IMAX, left, right));
  }

  /** Creates a reference to a universe parameter. */
  public static Level param(Name name) {
    return INTERNER.intern(new Param(name));
  }

  /** Creates a reference to a universe parameter. */
  public static Level param(String name) {
    return param(Name.of(name));
  }

  /** Creates the level {@code n}, that is, {@code n} successors of zero. */
  public static Level of(int n) {
    Level level = ZERO;
    for (int i = 0; i < n; i++) {
      level = succ(level);
    }
    return level;
  }

  /** Converts a list of parameter names to a list of parameter levels. */
  public static List<Level> params(List<Name> names) {
    final ImmutableList.Builder<Level> b = ImmutableList.builder();
    names.forEach(name -> b.add(param(name)));
    return b.build();
  }

  /** Returns whether this level mentions a universe parameter. */
  public boolean hasParam() {
    return hasParam;
  }

  /** Adds the names of the parameters in this level to a set. */
  public abstract void collectParams(Set<Name> names);

  /** Returns the names of the parameters in this level. */
  public Set<Name> params() {
    final Set<Name> names = new LinkedHashSet<>();
    collectParams(names);
    return names;
  }

  /** Returns a copy of this level with each component replaced by a
   * function. The function is applied to each parameter. */
  abstract Level replace(UnaryOperator<Level> paramReplacer);

  /** Replaces parameters by levels.
   *
   * <p>The map is keyed by parameter name; parameters not in the map are
   * unchanged. */
  public Level instantiate(Map<Name, Level> map) {
    if (!hasParam || map.isEmpty()) {
      return this;
    }
    return replace(p -> {
      final Level level = map.get(((Param) p).name);
      return level != null ? level : p;
    });
  }

  /** Simplifies this level.
   *
   * <p>The main purpose is to remove {@code IMAX} nodes whose right operand
   * is zero (they become zero) or a successor (they become a maximum). */
  public Level simplify() {
    return this;
  }

  /** Combines two levels into a maximum, collapsing zeros and
   * common successors. */
  static Level combine(Level a, Level b) {
    if (a.kind == Kind.ZERO) {
      return b;
    }
    if (b.kind == Kind.ZERO) {
      return a;
    }
    if (a.kind == Kind.SUCC && b.kind == Kind.SUCC) {
      return succ(combine(((Succ) a).level, ((Succ) b).level));
    }
    return max(a, b);
  }

  /** Returns whether this level is less than or equal to another level for
   * every assignment of levels to parameters. */
  public boolean leq(Level other) {
    return leq(simplify(), other.simplify(), 0);
  }

  /** Returns whether this level is equal to another level for every
   * assignment of levels to parameters. */
  public boolean isEquivalent(Level other) {
    if (this == other) {
      return true;
    }
    final Level a = simplify();
    final Level b = other.simplify();
    return a == b || leq(a, b, 0) && leq(b, a, 0);
  }

  /** Returns whether this level is zero under every assignment. */
  public boolean isZero() {
    return leq(ZERO);
  }

  /** Returns whether this level is nonzero under every assignment. */
  public boolean isNonZero() {
    return ONE.leq(this);
  }

  /** Returns whether this level is zero under some assignment. */
  public boolean maybeZero() {
    return !isNonZero();
  }

  /** Returns whether this level is nonzero under some assignment. */
  public boolean maybeNonZero() {
    return !isZero();
  }

  /** Returns whether {@code a + diff <= b}, where {@code diff} counts
   * the successors peeled from {@code a} (negatively) and {@code b}
   * (positively). Both levels must be simplified. */
  private static boolean leq(Level a, Level b, int diff) {
    if (a.kind == Kind.ZERO && diff >= 0) {
      return true;
    }
    if (b.kind == Kind.ZERO && diff < 0) {
      return false;
    }
    switch (a.kind) {
    case PARAM:
      switch (b.kind) {
      case PARAM:
        return a == b && diff >= 0;
      case ZERO:
        return false;
      default:
        break;
      }
      break;
    case ZERO:
      if (b.kind == Kind.PARAM) {
        return diff >= 0;
      }
      break;
    default:
      break;
    }
    if (a.kind == Kind.SUCC) {
      return leq(((Succ) a).level, b, diff - 1);
    }
    if (b.kind == Kind.SUCC) {
      return leq(a, ((Succ) b).level, diff + 1);
    }
    if (a.kind == Kind.MAX) {
      final Max m = (Max) a;
      return leq(m.left, b, diff) && leq(m.right, b, diff);
    }
    if (b.kind == Kind.MAX
        && (a.kind == Kind.PARAM || a.kind == Kind.ZERO)) {
      final Max m = (Max) b;
      return leq(a, m.left, diff) || leq(a, m.right, diff);
    }
    if (a.kind == Kind.IMAX && a == b) {
      return true;
    }
    if (a.kind == Kind.IMAX && ((Max) a).right.kind == Kind.PARAM) {
      return leqByCases((Param) ((Max) a).right, a, b, diff);
    }
    if (b.kind == Kind.IMAX && ((Max) b).right.kind == Kind.PARAM) {
      return leqByCases((Param) ((Max) b).right, a, b, diff);
    }
    if (a.kind == Kind.IMAX && ((Max) a).right.isAnyMax()) {
      return leq(distribute((Max) a), b, diff);
    }
    if (b.kind == Kind.IMAX && ((Max) b).right.isAnyMax()) {
      return leq(a, distribute((Max) b), diff);
    }
    throw new AssertionError("cannot compare " + a + " and " + b);
  }

  /** Decides {@code a + diff <= b} where an {@code IMAX} has parameter
   * {@code p} on its right, by checking both the case that {@code p} is zero
   * and the case that it is a successor. */
  private static boolean leqByCases(Param p, Level a, Level b, int diff) {
    final Map<Name, Level> zeroMap = Map.of(p.name, ZERO);
    final Map<Name, Level> succMap = Map.of(p.name, succ(p));
    return leq(a.instantiate(zeroMap).simplify(),
            b.instantiate(zeroMap).simplify(), diff)
        && leq(a.instantiate(succMap).simplify(),
            b.instantiate(succMap).simplify(), diff);
  }

  /** Rewrites {@code imax a (max x y)} to {@code max (imax a x) (imax a y)}
   * and {@code imax a (imax x y)} to {@code max (imax a y) (imax x y)}. */
  private static Level distribute(Max imax) {
    final Max inner = (Max) imax.right;
    if (inner.kind == Kind.MAX) {
      return max(imax(imax.left, inner.left), imax(imax.left, inner.right))
          .simplify();
    }
    return max(imax(imax.left, inner.right), inner);
  }

  private boolean isAnyMax() {
    return kind == Kind.MAX || kind == Kind.IMAX;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder b);

  /** Kind of level. */
  public enum Kind {
    ZERO, SUCC, MAX, IMAX, PARAM
  }

  /** The zero level. */
  static final class Zero extends Level {
    Zero() {
      super(Kind.ZERO, 7, false);
    }

    @Override
    public void collectParams(Set<Name> names) {
    }

    @Override
    Level replace(UnaryOperator<Level> paramReplacer) {
      return this;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Zero;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append('0');
    }
  }

  /** Successor of a level. */
  public static final class Succ extends Level {
    public final Level level;

    Succ(Level level) {
      super(Kind.SUCC, level.hash * 31 + 1, level.hasParam);
      this.level = requireNonNull(level);
    }

    @Override
    public void collectParams(Set<Name> names) {
      level.collectParams(names);
    }

    @Override
    Level replace(UnaryOperator<Level> paramReplacer) {
      return succ(level.replace(paramReplacer));
    }

    @Override
    public Level simplify() {
      final Level level2 = level.simplify();
      return level2 == level ? this : succ(level2);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Succ
          && ((Succ) o).level == level;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      int n = 1;
      Level inner = level;
      while (inner instanceof Succ) {
        ++n;
        inner = ((Succ) inner).level;
      }
      if (inner.kind == Kind.ZERO) {
        return b.append(n);
      }
      inner.unparse(b);
      return b.append('+').append(n);
    }
  }

  /** Maximum or impredicative maximum of two levels. */
  public static final class Max extends Level {
    public final Level left;
    public final Level right;

    Max(Kind kind, Level left, Level right) {
      super(kind, (left.hash * 31 + right.hash) * 31 + kind.ordinal(),
          left.hasParam || right.hasParam);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public void collectParams(Set<Name> names) {
      left.collectParams(names);
      right.collectParams(names);
    }

    @Override
    Level replace(UnaryOperator<Level> paramReplacer) {
      final Level left2 = left.replace(paramReplacer);
      final Level right2 = right.replace(paramReplacer);
      if (left2 == left && right2 == right) {
        return this;
      }
      return kind == Kind.MAX ? max(left2, right2) : imax(left2, right2);
    }

    @Override
    public Level simplify() {
      if (kind == Kind.MAX) {
        return max(left.simplify(), right.simplify());
      }
      final Level right2 = right.simplify();
      switch (right2.kind) {
      case ZERO:
        return ZERO;
      case SUCC:
        return combine(left.simplify(), right2);
      default:
        return imax(left.simplify(), right2);
      }
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Max
          && ((Max) o).kind == kind
          && ((Max) o).left == left
          && ((Max) o).right == right;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(kind == Kind.MAX ? "max(" : "imax(");
      left.unparse(b).append(", ");
      return right.unparse(b).append(')');
    }
  }

  /** Reference to a universe parameter. */
  public static final class Param extends Level {
    public final Name name;

    Param(Name name) {
      super(Kind.PARAM, name.hashCode() * 31 + 5, true);
      this.name = requireNonNull(name);
    }

    @Override
    public void collectParams(Set<Name> names) {
      names.add(name);
    }

    @Override
    Level replace(UnaryOperator<Level> paramReplacer) {
      return paramReplacer.apply(this);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
          && ((Param) o).name == name;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(name);
    }
  }
}

// End Level.java
