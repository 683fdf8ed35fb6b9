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
package net.hydromatic.verity.util;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards deeply recursive computations against stack exhaustion.
 *
 * <p>Each recursive routine wraps its recursive step in
 * {@link #guard(Supplier)}. The guard counts the nesting depth of guarded
 * calls on the current thread. When the depth reaches the budget of the
 * current stack segment, the rest of the computation continues on a new
 * thread with a large stack (a "segment"); the calling thread blocks until
 * the segment finishes, and receives its result or exception. The segment
 * thread terminates when the guarded call returns, releasing its stack.
 *
 * <p>Segments may chain. When the number of chained segments would exceed
 * {@link #maxSegments()}, the guard throws {@link StackExhaustedException}.
 *
 * <p>Depth counters are per thread; the guard is safe to use from many
 * threads at once.
 */
public final class StackGuard {
  private static final Logger LOGGER = LoggerFactory.getLogger(StackGuard.class);

  /** Number of guarded levels that fit in one megabyte of stack. */
  static final int LEVELS_PER_MB = 256;

  private static final AtomicReference<StackGuard> INSTANCE =
      new AtomicReference<>(new StackGuard(400, 256, 16));

  private static final AtomicInteger SEGMENT_COUNT = new AtomicInteger();

  private static final ThreadLocal<Segment> SEGMENT =
      ThreadLocal.withInitial(() -> new Segment(0, instance().guardDepth));

  private final int guardDepth;
  private final int segmentMb;
  private final int maxSegments;

  /** Creates a StackGuard.
   *
   * @param guardDepth Depth permitted on a thread that is not a segment
   * @param segmentMb Stack size of each segment, in megabytes
   * @param maxSegments Maximum number of chained segments
   */
  public StackGuard(int guardDepth, int segmentMb, int maxSegments) {
    checkArgument(guardDepth > 0, "guardDepth must be positive");
    checkArgument(segmentMb > 0, "segmentMb must be positive");
    checkArgument(maxSegments >= 0, "maxSegments must be non-negative");
    this.guardDepth = guardDepth;
    this.segmentMb = segmentMb;
    this.maxSegments = maxSegments;
  }

  /** Returns the guard currently in effect. */
  public static StackGuard instance() {
    return INSTANCE.get();
  }

  /** Installs a guard, returning the previous one. Threads that are already
   * inside a guarded computation keep their current budget. */
  public static StackGuard install(StackGuard guard) {
    return INSTANCE.getAndSet(guard);
  }

  public int guardDepth() {
    return guardDepth;
  }

  public int segmentMb() {
    return segmentMb;
  }

  public int maxSegments() {
    return maxSegments;
  }

  /** Returns the number of segment threads created since the JVM started.
   * For tests. */
  public static int segmentCount() {
    return SEGMENT_COUNT.get();
  }

  /** Runs a step of a recursive computation, continuing on a fresh stack
   * segment if the current one is nearly exhausted. */
  public static <T> T guard(Supplier<T> supplier) {
    final Segment segment = SEGMENT.get();
    if (segment.depth < segment.budget) {
      ++segment.depth;
      try {
        return supplier.get();
      } finally {
        --segment.depth;
      }
    }
    return instance().continueOnNewSegment(segment, supplier);
  }

  /** Runs a step of a recursive computation that returns no value. */
  public static void guardRun(Runnable runnable) {
    guard(() -> {
      runnable.run();
      return null;
    });
  }

  private <T> T continueOnNewSegment(Segment parent,
      Supplier<T> supplier) {
    final int index = parent.index + 1;
    if (index > maxSegments) {
      throw new StackExhaustedException(maxSegments, segmentMb);
    }
    final long stackBytes = (long) segmentMb << 20;
    final int budget = segmentMb * LEVELS_PER_MB;
    final Holder<T> holder = new Holder<>();
    final Thread thread =
        new Thread(null, () -> {
          SEGMENT.set(new Segment(index, budget));
          try {
            holder.value = supplier.get();
          } catch (Throwable e) {
            holder.throwable = e;
          } finally {
            SEGMENT.remove();
          }
        }, "stack-segment-" + SEGMENT_COUNT.incrementAndGet(), stackBytes);
    LOGGER.debug("continuing on segment {} ({} MB) from thread {}",
        index, segmentMb, Thread.currentThread().getName());
    thread.start();
    try {
      thread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
    if (holder.throwable != null) {
      throw Static.rethrow(holder.throwable);
    }
    return holder.value;
  }

  /** Depth counter of one thread. */
  private static class Segment {
    final int index;
    final int budget;
    int depth;

    Segment(int index, int budget) {
      this.index = index;
      this.budget = budget;
    }
  }

  /** Result of a computation on a segment thread. */
  private static class Holder<T> {
    @Nullable T value;
    @Nullable Throwable throwable;
  }

  /** Thrown when the stack cannot grow any further. */
  public static class StackExhaustedException extends RuntimeException {
    StackExhaustedException(int maxSegments, int segmentMb) {
      super("stack exhausted after " + maxSegments + " segments of "
          + segmentMb + " MB");
    }
  }
}

// End StackGuard.java
