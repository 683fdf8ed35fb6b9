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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Name;

/**
 * Ordered sequence of locals, and the source of fresh locals, for one
 * checking episode.
 *
 * <p>Serial numbers are unique for the lifetime of the JVM: the high 24 bits
 * identify the episode and are allocated once, when the context is created;
 * the low 40 bits count within the episode. Allocating a local therefore
 * requires no synchronization.
 *
 * <p>Not thread-safe; each episode belongs to one thread at a time.
 */
public class LocalContext {
  private static final AtomicLong EPISODES = new AtomicLong();

  private final long episode;
  private long next;
  private final List<Expr.Local> locals = new ArrayList<>();

  public LocalContext() {
    this.episode = (EPISODES.incrementAndGet() & 0xFFFFFFL) << 40;
  }

  /** Creates a local with a fresh serial number, without adding it to this
   * context. */
  public Expr.Local fresh(Name name, Expr type, BinderInfo binderInfo) {
    return term.local(episode | next++, name, type, binderInfo);
  }

  /** Creates a fresh local for the bound variable of a binder. */
  public Expr.Local fresh(Expr.Binder binder) {
    return fresh(binder.name, binder.type, binder.binderInfo);
  }

  /** Creates a fresh local and appends it to this context. */
  public Expr.Local add(Name name, Expr type, BinderInfo binderInfo) {
    final Expr.Local local = fresh(name, type, binderInfo);
    locals.add(local);
    return local;
  }

  /** Returns the local that a loose variable with a given de Bruijn index
   * refers to: index 0 is the most recently added. */
  public Expr.Local fromEnd(int index) {
    if (index < 0 || index >= locals.size()) {
      throw new KernelException(ErrorKind.UNKNOWN_REFERENCE,
          "bound variable #" + index + " escapes its binder");
    }
    return locals.get(locals.size() - 1 - index);
  }

  /** Returns the locals in this context, oldest first. */
  public List<Expr.Local> locals() {
    return ImmutableList.copyOf(locals);
  }

  public int size() {
    return locals.size();
  }
}

// End LocalContext.java
