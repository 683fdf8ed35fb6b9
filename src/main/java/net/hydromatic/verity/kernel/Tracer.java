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

/**
 * Called by the {@link Certifier} as declarations pass through it.
 *
 * <p>In parallel mode, methods may be called from worker threads, so
 * implementations must be thread-safe.
 */
public interface Tracer {
  /** Called when a declaration from the input enters a new state. */
  void onTransition(Declaration declaration, Verdict.State state);

  /** Called when a declaration is added to the environment. This includes
   * declarations that the kernel derives, such as constructors and
   * recursors. */
  void onCommit(Declaration declaration);

  /** Called when a declaration from the input is rejected. */
  void onReject(Declaration declaration, KernelException e);
}

// End Tracer.java
