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

import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error found while checking a declaration.
 *
 * <p>Carries the kind of error, the name of the declaration being checked
 * (once the exception has reached the {@link Certifier}), and, where
 * applicable, the expected and actual terms. The terms are left for a
 * reporting layer to render.
 */
public class KernelException extends RuntimeException {
  public final ErrorKind kind;
  public final @Nullable Name declName;
  public final @Nullable Expr expected;
  public final @Nullable Expr actual;

  public KernelException(ErrorKind kind, String message) {
    this(kind, message, null, null, null, null);
  }

  public KernelException(ErrorKind kind, String message,
      @Nullable Expr expected, @Nullable Expr actual) {
    this(kind, message, null, expected, actual, null);
  }

  private KernelException(ErrorKind kind, String message,
      @Nullable Name declName, @Nullable Expr expected,
      @Nullable Expr actual, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind);
    this.declName = declName;
    this.expected = expected;
    this.actual = actual;
  }

  /** Creates an exception of kind {@link ErrorKind#STACK_EXHAUSTED}. */
  public static KernelException stackExhausted(Throwable cause) {
    return new KernelException(ErrorKind.STACK_EXHAUSTED,
        String.valueOf(cause.getMessage()), null, null, null, cause);
  }

  /** Returns a copy of this exception that knows the declaration in which
   * the error occurred. */
  public KernelException withDeclName(Name declName) {
    if (this.declName == declName) {
      return this;
    }
    final KernelException e =
        new KernelException(kind, getMessage(), declName, expected, actual,
            getCause());
    e.setStackTrace(getStackTrace());
    return e;
  }

  @Override
  public String toString() {
    return super.toString() + " [" + kind
        + (declName == null ? "" : " in " + declName) + "]";
  }

  /** Appends a description of this error, including the terms, to a
   * buffer. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(declName == null ? "?" : declName.toString())
        .append(": ").append(kind).append(": ").append(getMessage());
    if (expected != null) {
      buf.append("\n  expected: ").append(expected);
    }
    if (actual != null) {
      buf.append("\n  actual:   ").append(actual);
    }
    return buf;
  }
}

// End KernelException.java
