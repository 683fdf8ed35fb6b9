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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.verity.kernel.Verdict;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of certifying a stream of declarations.
 *
 * <p>Contains a verdict for each declaration up to and including the first
 * rejected one; the run stops there. */
public class CertifyResult {
  public final ImmutableList<Verdict> verdicts;

  CertifyResult(List<Verdict> verdicts) {
    this.verdicts = ImmutableList.copyOf(verdicts);
  }

  /** Returns whether every declaration was committed. */
  public boolean isSuccess() {
    return rejection() == null;
  }

  /** Returns the verdict for the rejected declaration, or null. */
  public @Nullable Verdict rejection() {
    if (verdicts.isEmpty()) {
      return null;
    }
    final Verdict last = verdicts.get(verdicts.size() - 1);
    return last.isCommitted() ? null : last;
  }

  /** Returns the number of committed declarations. */
  public int committedCount() {
    return isSuccess() ? verdicts.size() : verdicts.size() - 1;
  }

  @Override
  public String toString() {
    final Verdict rejection = rejection();
    return rejection == null
        ? "ok: " + verdicts.size() + " declarations"
        : "rejected after " + committedCount() + " declarations: "
            + rejection;
  }
}

// End CertifyResult.java
