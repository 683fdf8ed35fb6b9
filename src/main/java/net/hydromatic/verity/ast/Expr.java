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
import java.util.ArrayList;
import java.util.List;

/**
 * Expression of the type theory.
 *
 * <p>Expressions are immutable and hash-consed (see {@link ExprBuilder}), so
 * structurally identical expressions are the same object. Each node caches
 * properties that are expensive to compute by traversal: its hash code, one
 * more than its largest loose de Bruijn index, and whether it contains any
 * {@link Local} nodes or universe parameters.
 */
public abstract class Expr {
  public final Op op;
  private final int hash;
  private final int looseBound;
  private final boolean hasLocals;
  private final boolean hasLevelParams;

  Expr(Op op, int hash, int looseBound, boolean hasLocals,
      boolean hasLevelParams) {
    this.op = requireNonNull(op);
    this.hash = hash;
    this.looseBound = looseBound;
    this.hasLocals = hasLocals;
    this.hasLevelParams = hasLevelParams;
  }

  /** Returns one more than the largest de Bruijn index that is not bound
   * within this expression; zero if there is none. */
  public int looseBound() {
    return looseBound;
  }

  /** Returns whether this expression has a variable that is not bound
   * within it. */
  public boolean hasLooseVars() {
    return looseBound > 0;
  }

  /** Returns whether this expression contains a {@link Local}. */
  public boolean hasLocals() {
    return hasLocals;
  }

  /** Returns whether this expression mentions a universe parameter. */
  public boolean hasLevelParams() {
    return hasLevelParams;
  }

  /** Returns whether this expression is closed: no loose variables and no
   * locals. */
  public boolean isClosed() {
    return looseBound == 0 && !hasLocals;
  }

  /** Returns the function at the head of a chain of applications;
   * this expression if it is not an application. */
  public Expr getAppFn() {
    Expr e = this;
    while (e.op == Op.APP) {
      e = ((App) e).fn;
    }
    return e;
  }

  /** Returns the arguments of a chain of applications, outermost
   * function's first argument first. */
  public List<Expr> getAppArgs() {
    final List<Expr> args = new ArrayList<>();
    Expr e = this;
    while (e.op == Op.APP) {
      args.add(((App) e).arg);
      e = ((App) e).fn;
    }
    return ImmutableList.copyOf(reverse(args));
  }

  /** Returns the number of arguments in a chain of applications. */
  public int getAppNumArgs() {
    int n = 0;
    for (Expr e = this; e.op == Op.APP; e = ((App) e).fn) {
      ++n;
    }
    return n;
  }

  private static <E> List<E> reverse(List<E> list) {
    final List<E> reversed = new ArrayList<>(list.size());
    for (int i = list.size() - 1; i >= 0; i--) {
      reversed.add(list.get(i));
    }
    return reversed;
  }

  /** Returns whether this is a constant with a given name. */
  public boolean isConst(Name name) {
    return op == Op.CONST && ((Const) this).name == name;
  }

  /** Returns whether this is a {@link Sort}. */
  public boolean isSort() {
    return op == Op.SORT;
  }

  /** Returns whether this is a {@link Binder} of type {@link Op#PI}. */
  public boolean isPi() {
    return op == Op.PI;
  }

  /** Returns whether this is a {@link Binder} of type {@link Op#LAMBDA}. */
  public boolean isLambda() {
    return op == Op.LAMBDA;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /** Renders this expression for diagnostics. Deeply nested
   * sub-expressions are elided. */
  @Override
  public String toString() {
    return unparse(new StringBuilder(), 0).toString();
  }

  /** Maximum nesting depth rendered by {@link #toString()}. */
  static final int MAX_UNPARSE_DEPTH = 40;

  final StringBuilder unparse(StringBuilder b, int depth) {
    if (depth > MAX_UNPARSE_DEPTH) {
      return b.append("...");
    }
    return unparse0(b, depth + 1);
  }

  abstract StringBuilder unparse0(StringBuilder b, int depth);

  /** Bound variable. */
  public static final class Var extends Expr {
    public final int index;

    Var(int index) {
      super(Op.VAR, index * 31 + 1, index + 1, false, false);
      this.index = index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var && ((Var) o).index == index;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      return b.append('#').append(index);
    }
  }

  /** Universe. */
  public static final class Sort extends Expr {
    public final Level level;

    Sort(Level level) {
      super(Op.SORT, level.hashCode() * 31 + 2, 0, false, level.hasParam());
      this.level = requireNonNull(level);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Sort && ((Sort) o).level == level;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      if (level == Level.ZERO) {
        return b.append("Prop");
      }
      return b.append("Sort ").append(level);
    }
  }

  /** Reference to a declaration in the environment, instantiated with
   * universe levels. */
  public static final class Const extends Expr {
    public final Name name;
    public final ImmutableList<Level> levels;

    Const(Name name, ImmutableList<Level> levels) {
      super(Op.CONST, name.hashCode() * 31 + levels.hashCode(), 0, false,
          levels.stream().anyMatch(Level::hasParam));
      this.name = requireNonNull(name);
      this.levels = requireNonNull(levels);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Const
          && ((Const) o).name == name
          && ((Const) o).levels.equals(levels);
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      b.append(name);
      if (!levels.isEmpty()) {
        b.append(".{");
        for (int i = 0; i < levels.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          b.append(levels.get(i));
        }
        b.append('}');
      }
      return b;
    }
  }

  /** Application of a function to an argument. */
  public static final class App extends Expr {
    public final Expr fn;
    public final Expr arg;

    App(Expr fn, Expr arg) {
      super(Op.APP, (fn.hash * 31 + arg.hash) * 31 + 3,
          Math.max(fn.looseBound, arg.looseBound),
          fn.hasLocals || arg.hasLocals,
          fn.hasLevelParams || arg.hasLevelParams);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof App
          && ((App) o).fn == fn
          && ((App) o).arg == arg;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      b.append('(');
      fn.unparse(b, depth).append(' ');
      return arg.unparse(b, depth).append(')');
    }
  }

  /** Lambda abstraction or Pi type; see {@link #op}. */
  public static final class Binder extends Expr {
    public final BinderInfo binderInfo;
    public final Name name;
    public final Expr type;
    public final Expr body;

    Binder(Op op, BinderInfo binderInfo, Name name, Expr type, Expr body) {
      super(op,
          ((type.hash * 31 + body.hash) * 31 + name.hashCode()) * 31
              + op.ordinal(),
          Math.max(type.looseBound, Math.max(body.looseBound - 1, 0)),
          type.hasLocals || body.hasLocals,
          type.hasLevelParams || body.hasLevelParams);
      this.binderInfo = requireNonNull(binderInfo);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.body = requireNonNull(body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binder
          && ((Binder) o).op == op
          && ((Binder) o).binderInfo == binderInfo
          && ((Binder) o).name == name
          && ((Binder) o).type == type
          && ((Binder) o).body == body;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      b.append(op == Op.LAMBDA ? "(fun (" : "(Pi (")
          .append(name).append(" : ");
      type.unparse(b, depth).append("), ");
      return body.unparse(b, depth).append(')');
    }
  }

  /** Local definition, {@code let name : type := value in body}. */
  public static final class Let extends Expr {
    public final Name name;
    public final Expr type;
    public final Expr value;
    public final Expr body;

    Let(Name name, Expr type, Expr value, Expr body) {
      super(Op.LET,
          ((type.hash * 31 + value.hash) * 31 + body.hash) * 31 + 7,
          Math.max(Math.max(type.looseBound, value.looseBound),
              Math.max(body.looseBound - 1, 0)),
          type.hasLocals || value.hasLocals || body.hasLocals,
          type.hasLevelParams || value.hasLevelParams
              || body.hasLevelParams);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
          && ((Let) o).name == name
          && ((Let) o).type == type
          && ((Let) o).value == value
          && ((Let) o).body == body;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      b.append("(let ").append(name).append(" : ");
      type.unparse(b, depth).append(" := ");
      value.unparse(b, depth).append(" in ");
      return body.unparse(b, depth).append(')');
    }
  }

  /** Free variable that stands for the bound variable of a binder while the
   * binder's body is being checked. The serial number is unique within a
   * checking episode. */
  public static final class Local extends Expr {
    public final long serial;
    public final Name name;
    public final Expr type;
    public final BinderInfo binderInfo;

    Local(long serial, Name name, Expr type, BinderInfo binderInfo) {
      super(Op.LOCAL, Long.hashCode(serial) * 31 + 11, type.looseBound,
          true, type.hasLevelParams);
      this.serial = serial;
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.binderInfo = requireNonNull(binderInfo);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Local
          && ((Local) o).serial == serial
          && ((Local) o).name == name
          && ((Local) o).type == type
          && ((Local) o).binderInfo == binderInfo;
    }

    @Override
    StringBuilder unparse0(StringBuilder b, int depth) {
      return b.append(name).append('_').append(serial & 0xFFFFFFFFL);
    }
  }
}

// End Expr.java
