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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.util.StackGuard;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Certifies declarations and commits them to an environment.
 *
 * <p>Each declaration from the input goes from
 * {@link Verdict.State#RECEIVED} through {@link Verdict.State#TYPE_CHECKING}
 * to {@link Verdict.State#COMMITTED} or {@link Verdict.State#REJECTED}:
 *
 * <ul>
 *   <li>an axiom's type must be a type;
 *   <li>a definition's type must be a type, and its value must have that
 *       type;
 *   <li>an inductive family is checked by {@link InductiveChecker}, and
 *       commits with its constructors and recursor;
 *   <li>the quotient package requires {@code eq}, and commits its four
 *       constants.
 * </ul>
 *
 * <p>The certifier never throws {@link KernelException}; it returns a
 * rejected verdict instead.
 */
public class Certifier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Certifier.class);

  private final Environment env;
  private final Tracer tracer;

  public Certifier(Environment env, Tracer tracer) {
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
  }

  public Environment env() {
    return env;
  }

  /** Certifies a declaration completely, and commits it if it is valid. */
  public Verdict certify(Declaration declaration) {
    tracer.onTransition(declaration, Verdict.State.RECEIVED);
    return requireNonNull(
        guarded(declaration, () -> {
          tracer.onTransition(declaration, Verdict.State.TYPE_CHECKING);
          final List<Declaration> declarations = check(declaration, true);
          env.commitAll(declarations);
          return committed(declaration, declarations);
        }));
  }

  /** Certifies the signature of a declaration and commits it, deferring
   * the check of a definition's value.
   *
   * <p>If the declaration is a definition, returns a task that checks its
   * value against the environment as it was before the definition was
   * committed. The task is thread-safe with respect to this certifier and
   * may run on any thread. The tracer hears of the definition's commit only
   * when the task succeeds. Otherwise, and if the signature is invalid, the
   * registration's task is null. */
  public Registration register(Declaration declaration) {
    tracer.onTransition(declaration, Verdict.State.RECEIVED);
    final Environment before = env.upTo(env.size());
    final List<Declaration> declarations = new ArrayList<>();
    final Verdict verdict = guarded(declaration, () -> {
      tracer.onTransition(declaration, Verdict.State.TYPE_CHECKING);
      declarations.addAll(check(declaration, false));
      env.commitAll(declarations);
      if (declaration instanceof Declaration.Definition) {
        // Still type-checking; the value check will decide.
        return null;
      }
      return committed(declaration, declarations);
    });
    if (verdict != null) {
      return new Registration(verdict, null);
    }
    final Declaration.Definition definition =
        (Declaration.Definition) declaration;
    return new Registration(null, () ->
        requireNonNull(
            guarded(declaration, () -> {
              checkValue(definition, before);
              return committed(declaration, declarations);
            })));
  }

  private Verdict committed(Declaration declaration,
      List<Declaration> declarations) {
    declarations.forEach(tracer::onCommit);
    tracer.onTransition(declaration, Verdict.State.COMMITTED);
    LOGGER.debug("committed {}", declaration.name);
    return Verdict.committed(declaration.name);
  }

  /** Runs a check, converting errors into a rejected verdict. Returns
   * what the check returns if it succeeds, possibly null. */
  private @Nullable Verdict guarded(Declaration declaration,
      Supplier<@Nullable Verdict> supplier) {
    KernelException error;
    try {
      return supplier.get();
    } catch (KernelException e) {
      error = e;
    } catch (StackGuard.StackExhaustedException | StackOverflowError e) {
      error = KernelException.stackExhausted(e);
    }
    final Verdict verdict = Verdict.rejected(declaration.name, error);
    final KernelException e = requireNonNull(verdict.error);
    LOGGER.warn("rejected {}: {}: {}", declaration.name, e.kind,
        e.getMessage());
    tracer.onTransition(declaration, Verdict.State.REJECTED);
    tracer.onReject(declaration, e);
    return verdict;
  }

  /** Checks a declaration, and returns the declarations to commit.
   *
   * @param declaration Declaration from the input
   * @param checkValue Whether to check the value of a definition
   */
  private List<Declaration> check(Declaration declaration,
      boolean checkValue) {
    Environment.checkWellScoped(declaration);
    if (declaration instanceof Declaration.Axiom
        || declaration instanceof Declaration.Definition) {
      env.checkCommittable(declaration);
    }
    final TypeChecker tc = new TypeChecker(env);
    if (declaration instanceof Declaration.Axiom) {
      tc.inferSortLevel(declaration.type);
      return ImmutableList.of(declaration);
    }
    if (declaration instanceof Declaration.Definition) {
      Declaration.Definition definition = (Declaration.Definition) declaration;
      tc.inferSortLevel(definition.type);
      if (checkValue) {
        checkValue(definition, env);
      }
      if (definition.hint == null) {
        definition = definition.withHint(env.computeHint(definition.value));
      }
      return ImmutableList.of(definition);
    }
    if (declaration instanceof Declaration.Inductive) {
      return new InductiveChecker(env, (Declaration.Inductive) declaration)
          .check();
    }
    if (declaration instanceof Declaration.QuotPackage) {
      Quotients.checkEq(tc);
      final List<Declaration.QuotConstant> constants = Quotients.constants();
      final TypeChecker quotTc = new TypeChecker(env.withPending(constants));
      constants.forEach(c -> quotTc.inferSortLevel(c.type));
      return ImmutableList.copyOf(constants);
    }
    throw new IllegalArgumentException("cannot certify " + declaration
        + "; it is derived from another declaration");
  }

  /** Checks that the value of a definition has the declared type. */
  private static void checkValue(Declaration.Definition definition,
      Environment env) {
    final TypeChecker tc = new TypeChecker(env);
    final Expr valueType = tc.infer(definition.value);
    if (!tc.isDefEq(valueType, definition.type)) {
      throw new KernelException(ErrorKind.TYPE_MISMATCH,
          "value of '" + definition.name + "' does not have its declared"
              + " type", definition.type, valueType);
    }
  }

  /** Result of {@link #register(Declaration)}: either a verdict, or a task
   * that computes one. */
  public static class Registration {
    public final @Nullable Verdict verdict;
    public final @Nullable Supplier<Verdict> valueCheck;

    Registration(@Nullable Verdict verdict,
        @Nullable Supplier<Verdict> valueCheck) {
      this.verdict = verdict;
      this.valueCheck = valueCheck;
    }
  }
}

// End Certifier.java
