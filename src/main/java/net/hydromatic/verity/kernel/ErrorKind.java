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

/** Kind of error that causes a declaration to be rejected. */
public enum ErrorKind {
  /** A name, or a universe parameter, cannot be resolved. */
  UNKNOWN_REFERENCE,
  /** A declaration's name is already in the environment, or a declaration
   * lists the same universe parameter twice. */
  DUPLICATE_NAME,
  /** A constant is given the wrong number of universe arguments. */
  UNIVERSE_ARITY,
  /** The head of an application does not reduce to a Pi. */
  NOT_A_FUNCTION,
  /** An expression in a type position does not reduce to a Sort. */
  NOT_A_SORT,
  /** An inferred type is not definitionally equal to the expected type. */
  TYPE_MISMATCH,
  /** A constructor does not have the shape its inductive family requires. */
  MALFORMED_CONSTRUCTOR,
  /** A derived recursor does not reduce as its computation rule says. */
  BAD_COMPUTATION_RULE,
  /** The stack could not grow any further. */
  STACK_EXHAUSTED
}

// End ErrorKind.java
