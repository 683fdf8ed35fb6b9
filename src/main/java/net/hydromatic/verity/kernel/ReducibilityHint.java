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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Locale;
import java.util.Objects;

/**
 * Tells the definitional-equality checker how eagerly to unfold a
 * definition.
 *
 * <p>When two different definitions are compared, the one with the greater
 * height is unfolded first. An abbreviation is taller than any regular
 * definition; an opaque definition is never unfolded.
 */
public final class ReducibilityHint {
  public static final ReducibilityHint OPAQUE =
      new ReducibilityHint(Kind.OPAQUE, 0);
  public static final ReducibilityHint ABBREV =
      new ReducibilityHint(Kind.ABBREV, 0);

  public final Kind kind;
  public final int height;

  private ReducibilityHint(Kind kind, int height) {
    this.kind = kind;
    this.height = height;
  }

  /** Creates a hint for a regular definition. */
  public static ReducibilityHint regular(int height) {
    checkArgument(height >= 0, "negative height");
    return new ReducibilityHint(Kind.REGULAR, height);
  }

  /** Returns whether a definition with this hint may be unfolded. */
  public boolean isUnfoldable() {
    return kind != Kind.OPAQUE;
  }

  /** Compares the heights of two hints: positive if this hint should be
   * unfolded before {@code other}, negative if after, zero if they should
   * be unfolded together. */
  public int compareHeight(ReducibilityHint other) {
    if (kind == other.kind) {
      return kind == Kind.REGULAR ? Integer.compare(height, other.height) : 0;
    }
    if (kind == Kind.OPAQUE) {
      return -1;
    }
    if (other.kind == Kind.OPAQUE) {
      return 1;
    }
    return kind == Kind.ABBREV ? 1 : -1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, height);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ReducibilityHint
        && ((ReducibilityHint) o).kind == kind
        && ((ReducibilityHint) o).height == height;
  }

  @Override
  public String toString() {
    return kind == Kind.REGULAR ? "regular(" + height + ")"
        : kind.name().toLowerCase(Locale.ROOT);
  }

  /** Kind of hint. */
  public enum Kind {
    OPAQUE, ABBREV, REGULAR
  }
}

// End ReducibilityHint.java
