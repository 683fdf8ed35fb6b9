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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Exprs;
import net.hydromatic.verity.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Append-only map from names to declarations.
 *
 * <p>Lookups may happen concurrently with each other and with a commit.
 * Commits are serialized. A commit is a single step as far as readers are
 * concerned; declarations are immutable, so a reader never sees a partially
 * constructed one.
 *
 * <p>An environment may be a <em>view</em> that sees only the declarations
 * committed before a given point (see {@link #upTo(int)}), or that also sees
 * declarations that are being checked but are not yet committed (see
 * {@link #withPending(List)}). A view shares storage with the environment it
 * was created from and cannot commit.
 */
public class Environment {
  private final Store store;
  /** Number of declarations visible; {@link Integer#MAX_VALUE} for a
   * full environment. */
  private final int limit;
  private final ImmutableMap<Name, Declaration> pending;

  private Environment(Store store, int limit,
      ImmutableMap<Name, Declaration> pending) {
    this.store = requireNonNull(store);
    this.limit = limit;
    this.pending = requireNonNull(pending);
  }

  /** Creates an empty environment. */
  public static Environment empty() {
    return new Environment(new Store(), Integer.MAX_VALUE,
        ImmutableMap.of());
  }

  private boolean isView() {
    return limit != Integer.MAX_VALUE || !pending.isEmpty();
  }

  /** Returns the number of declarations visible in this environment. */
  public int size() {
    return Math.min(store.entries.size(), limit) + pending.size();
  }

  /** Returns a view that contains only the first {@code count}
   * declarations committed to this environment. */
  public Environment upTo(int count) {
    return new Environment(store, Math.min(count, limit), pending);
  }

  /** Returns a view that also contains some declarations that have not been
   * committed. */
  public Environment withPending(List<? extends Declaration> declarations) {
    final Map<Name, Declaration> map = new LinkedHashMap<>(pending);
    declarations.forEach(d -> map.put(d.name, d));
    return new Environment(store, limit, ImmutableMap.copyOf(map));
  }

  /** Looks up a declaration; returns null if not found. */
  public @Nullable Declaration lookup(Name name) {
    final Entry entry = store.entries.get(name);
    if (entry != null && entry.ordinal < limit) {
      return entry.declaration;
    }
    return pending.get(name);
  }

  /** Looks up a declaration; throws if not found. */
  public Declaration get(Name name) {
    final Declaration declaration = lookup(name);
    if (declaration == null) {
      throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
          "unknown constant '" + name + "'");
    }
    return declaration;
  }

  /** Returns the declarations in this environment in the order they were
   * committed. */
  public List<Declaration> declarations() {
    synchronized (store) {
      return ImmutableList.copyOf(
          store.order.subList(0, Math.min(store.order.size(), limit)));
    }
  }

  /** Adds a declaration.
   *
   * @throws KernelException of kind {@link ErrorKind#DUPLICATE_NAME} if the
   *     name is already present, or {@link ErrorKind#UNKNOWN_REFERENCE} if
   *     the declaration mentions a constant that is not present (or gives
   *     it the wrong number of universe arguments) or a universe parameter
   *     it does not declare; in either case the environment is unchanged
   */
  public void commit(Declaration declaration) {
    commitAll(ImmutableList.of(declaration));
  }

  /** Adds several declarations, each of which may refer to those before
   * it. If any declaration is invalid, none is added. */
  public void commitAll(List<? extends Declaration> declarations) {
    if (isView()) {
      throw new IllegalStateException("cannot commit to a view");
    }
    synchronized (store) {
      final List<Declaration> checked = new ArrayList<>();
      for (Declaration declaration : declarations) {
        final Environment env = withPending(checked);
        env.checkNewName(declaration.name);
        env.checkReferences(declaration);
        checked.add(declaration);
      }
      for (Declaration declaration : checked) {
        final Entry entry = new Entry(store.order.size(), declaration);
        store.order.add(declaration);
        store.entries.put(declaration.name, entry);
      }
    }
  }

  /** Checks that a declaration could be committed now: its name is new,
   * and every constant it mentions is present with the right number of
   * universe parameters. Does not commit it. */
  public void checkCommittable(Declaration declaration) {
    checkNewName(declaration.name);
    checkReferences(declaration);
  }

  /** Throws {@link ErrorKind#DUPLICATE_NAME} if a name is present. */
  public void checkNewName(Name name) {
    if (lookup(name) != null) {
      throw new KernelException(ErrorKind.DUPLICATE_NAME,
          "'" + name + "' is already declared");
    }
  }

  /** Checks that a declaration's universe parameters are distinct and
   * that its terms are closed and mention only its own universe
   * parameters. Does not look at constants. */
  public static void checkWellScoped(Declaration declaration) {
    final Set<Name> params = new HashSet<>();
    for (Name param : declaration.levelParams) {
      if (!params.add(param)) {
        throw new KernelException(ErrorKind.DUPLICATE_NAME,
            "duplicate universe parameter '" + param + "'");
      }
    }
    for (Expr e : terms(declaration)) {
      if (!e.isClosed()) {
        throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
            "term has free variables: " + e);
      }
      final Set<Name> used = new HashSet<>();
      Exprs.collectLevelParams(e, used);
      for (Name name : used) {
        if (!params.contains(name)) {
          throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
              "undeclared universe parameter '" + name + "'");
        }
      }
    }
  }

  /** Checks that every constant a declaration mentions is in this
   * environment with the right number of universe parameters. A recursor
   * may mention itself in its computation rules. */
  void checkReferences(Declaration declaration) {
    checkWellScoped(declaration);
    for (Expr e : terms(declaration)) {
      Exprs.forEachConst(e, c -> {
        final Declaration target =
            c.name == declaration.name
                && declaration instanceof Declaration.Recursor
                ? declaration
                : lookup(c.name);
        if (target == null) {
          throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
              "unknown constant '" + c.name + "'");
        }
        if (target.levelParams.size() != c.levels.size()) {
          throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
              "constant '" + c.name + "' has " + target.levelParams.size()
                  + " universe parameters but is given " + c.levels.size());
        }
      });
    }
  }

  private static List<Expr> terms(Declaration declaration) {
    return ImmutableList.<Expr>builder()
        .add(declaration.type)
        .addAll(declaration.otherTerms())
        .build();
  }

  /** Computes the height of a definition whose value is {@code value}: one
   * more than the greatest height of the definitions it mentions, or zero
   * if it mentions none. */
  public ReducibilityHint computeHint(Expr value) {
    final int[] height = {-1};
    Exprs.forEachConst(value, c -> {
      final Declaration d = lookup(c.name);
      if (d instanceof Declaration.Definition) {
        final ReducibilityHint hint = ((Declaration.Definition) d).hint();
        if (hint.kind == ReducibilityHint.Kind.REGULAR) {
          height[0] = Math.max(height[0], hint.height);
        }
      }
    });
    return ReducibilityHint.regular(height[0] + 1);
  }

  /** Storage shared by an environment and its views. */
  private static class Store {
    final Map<Name, Entry> entries = new ConcurrentHashMap<>();
    /** Declarations in commit order; guarded by {@code this}. */
    final List<Declaration> order = new ArrayList<>();
  }

  /** A declaration and the position at which it was committed. */
  private static class Entry {
    final int ordinal;
    final Declaration declaration;

    Entry(int ordinal, Declaration declaration) {
      this.ordinal = ordinal;
      this.declaration = requireNonNull(declaration);
    }
  }
}

// End Environment.java
