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
package net.hydromatic.verity.ast;

/** Kind of expression node. */
public enum Op {
  /** Bound variable, identified by de Bruijn index. */
  VAR,
  /** Sort (universe) at a given level. */
  SORT,
  /** Reference to a global declaration, with universe arguments. */
  CONST,
  /** Application of a function to one argument. */
  APP,
  /** Function abstraction. */
  LAMBDA,
  /** Dependent function type. */
  PI,
  /** Local definition. */
  LET,
  /** Free variable introduced while checking the body of a binder. */
  LOCAL;

  /** Returns whether this is a binder, {@link #LAMBDA} or {@link #PI}. */
  public boolean isBinder() {
    return this == LAMBDA || this == PI;
  }
}

// End Op.java
