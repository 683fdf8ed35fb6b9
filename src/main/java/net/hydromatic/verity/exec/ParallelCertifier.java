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
package net.hydromatic.verity.exec;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import net.hydromatic.verity.kernel.Certifier;
import net.hydromatic.verity.kernel.Declaration;
import net.hydromatic.verity.kernel.Environment;
import net.hydromatic.verity.kernel.Tracer;
import net.hydromatic.verity.kernel.Verdict;
import net.hydromatic.verity.util.Static;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Certifies a stream of declarations, optionally in parallel.
 *
 * <p>With one thread (the default; see {@link Prop#THREADS}), each
 * declaration is certified and committed before the next is read.
 *
 * <p>With more threads, the calling thread is the only writer. For each
 * declaration in turn it checks the signature, commits the declaration, and
 * hands the check of a definition's value to a worker. Axioms, inductive
 * families and the quotient package are checked completely by the writer.
 * At most {@link Prop#MAX_PENDING} value checks may be outstanding; beyond
 * that the writer waits for a worker to finish.
 *
 * <p>Once a check fails, the writer stops reading. When all outstanding
 * checks have finished, the result contains the verdicts up to the first
 * rejection in stream order, which is the same result as a serial run.
 */
public class ParallelCertifier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ParallelCertifier.class);

  private final Environment env;
  private final Tracer tracer;
  private final ImmutableMap<Prop, Object> props;

  public ParallelCertifier(Environment env, Tracer tracer,
      Map<Prop, Object> props) {
    this.env = requireNonNull(env);
    this.tracer = requireNonNull(tracer);
    this.props = ImmutableMap.copyOf(props);
  }

  /** Certifies declarations in order, stopping at the first that is
   * rejected. */
  public CertifyResult certify(Iterable<? extends Declaration> declarations) {
    final int threads = Prop.THREADS.intValue(props);
    final Stopwatch stopwatch = Stopwatch.createStarted();
    LOGGER.info("certifying with {} thread(s)", threads);
    final CertifyResult result =
        threads <= 1
            ? certifySerial(declarations)
            : certifyParallel(declarations, threads);
    LOGGER.info("{} in {}", result, stopwatch);
    return result;
  }

  private CertifyResult certifySerial(
      Iterable<? extends Declaration> declarations) {
    final Certifier certifier = new Certifier(env, tracer);
    final List<Verdict> verdicts = new ArrayList<>();
    for (Declaration declaration : declarations) {
      final Verdict verdict = certifier.certify(declaration);
      verdicts.add(verdict);
      if (!verdict.isCommitted()) {
        break;
      }
    }
    return new CertifyResult(verdicts);
  }

  private CertifyResult certifyParallel(
      Iterable<? extends Declaration> declarations, int threads) {
    final Certifier certifier = new Certifier(env, tracer);
    final Semaphore slots = new Semaphore(Prop.MAX_PENDING.intValue(props));
    final AtomicBoolean failed = new AtomicBoolean();
    final List<CompletableFuture<Verdict>> futures = new ArrayList<>();
    final ExecutorService pool =
        Executors.newFixedThreadPool(threads,
            new ThreadFactoryBuilder()
                .setNameFormat("verity-worker-%d")
                .setDaemon(true)
                .build());
    try {
      for (Declaration declaration : declarations) {
        if (failed.get()) {
          break;
        }
        final Certifier.Registration registration =
            certifier.register(declaration);
        if (registration.verdict != null) {
          futures.add(CompletableFuture.completedFuture(registration.verdict));
          if (!registration.verdict.isCommitted()) {
            failed.set(true);
          }
          continue;
        }
        final Supplier<Verdict> valueCheck =
            requireNonNull(registration.valueCheck);
        acquire(slots);
        futures.add(
            CompletableFuture.supplyAsync(() -> {
              try {
                final Verdict verdict = valueCheck.get();
                if (!verdict.isCommitted()) {
                  failed.set(true);
                }
                return verdict;
              } finally {
                slots.release();
              }
            }, pool));
      }

      // Wait for every check, then keep verdicts up to the first rejection.
      final List<Verdict> verdicts = new ArrayList<>();
      for (CompletableFuture<Verdict> future : futures) {
        verdicts.add(join(future));
      }
      final List<Verdict> result = new ArrayList<>();
      for (Verdict verdict : verdicts) {
        result.add(verdict);
        if (!verdict.isCommitted()) {
          break;
        }
      }
      return new CertifyResult(result);
    } finally {
      pool.shutdown();
    }
  }

  private static void acquire(Semaphore semaphore) {
    try {
      semaphore.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  private static Verdict join(CompletableFuture<Verdict> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw Static.rethrow(e.getCause() != null ? e.getCause() : e);
    }
  }
}

// End ParallelCertifier.java
