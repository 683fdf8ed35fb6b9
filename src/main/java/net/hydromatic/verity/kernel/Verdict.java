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

import java.util.Objects;
import net.hydromatic.verity.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of certifying one declaration. */
public final class Verdict {
  public final Name name;
  public final State state;
  /** The error, if {@link #state} is {@link State#REJECTED}. */
  public final @Nullable KernelException error;

  private Verdict(Name name, State state, @Nullable KernelException error) {
    this.name = requireNonNull(name);
    this.state = requireNonNull(state);
    this.error = error;
  }

  public static Verdict committed(Name name) {
    return new Verdict(name, State.COMMITTED, null);
  }

  public static Verdict rejected(Name name, KernelException error) {
    return new Verdict(name, State.REJECTED, error.withDeclName(name));
  }

  public boolean isCommitted() {
    return state == State.COMMITTED;
  }

  /** Returns the kind of error, or null if committed. */
  public @Nullable ErrorKind errorKind() {
    return error == null ? null : error.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, state, errorKind());
  }

  /** Two verdicts are equal if they are for the same declaration and have
   * the same state and kind of error. */
  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Verdict
        && ((Verdict) o).name == name
        && ((Verdict) o).state == state
        && ((Verdict) o).errorKind() == errorKind();
  }

  @Override
  public String toString() {
    return name + ": " + state + (error == null ? "" : " " + error.kind);
  }

  /** State of a declaration as it passes through the certifier.
   * {@link #COMMITTED} and {@link #REJECTED} are terminal. */
  public enum State {
    RECEIVED,
    TYPE_CHECKING,
    COMMITTED,
    REJECTED
  }
}

// End Verdict.java
