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

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each committed
   * declaration, then calls the underlying tracer. */
  public static Tracer withOnCommit(Tracer tracer,
      Consumer<Declaration> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCommit(Declaration declaration) {
        consumer.accept(declaration);
        super.onCommit(declaration);
      }
    };
  }

  /** Returns a tracer that performs the given action on each rejected
   * declaration, then calls the underlying tracer. */
  public static Tracer withOnReject(Tracer tracer,
      BiConsumer<Declaration, KernelException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReject(Declaration declaration, KernelException e) {
        consumer.accept(declaration, e);
        super.onReject(declaration, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on each state
   * transition, then calls the underlying tracer. */
  public static Tracer withOnTransition(Tracer tracer,
      BiConsumer<Declaration, Verdict.State> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTransition(Declaration declaration,
          Verdict.State state) {
        consumer.accept(declaration, state);
        super.onTransition(declaration, state);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTransition(Declaration declaration, Verdict.State state) {
    }

    @Override
    public void onCommit(Declaration declaration) {
    }

    @Override
    public void onReject(Declaration declaration, KernelException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onTransition(Declaration declaration, Verdict.State state) {
      tracer.onTransition(declaration, state);
    }

    @Override
    public void onCommit(Declaration declaration) {
      tracer.onCommit(declaration);
    }

    @Override
    public void onReject(Declaration declaration, KernelException e) {
      tracer.onReject(declaration, e);
    }
  }
}

// End Tracers.java
