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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Hierarchical identifier, such as {@code nat.rec} or {@code _private.3.foo}.
 *
 * <p>A name is either {@link #ANONYMOUS} or a prefix name extended with one
 * string or numeric component. Names are interned: two names with the same
 * components are the same object, so you may compare them using {@code ==}.
 */
public final class Name implements Comparable<Name> {
  private static final Interner<Name> INTERNER = Interners.newWeakInterner();

  /** The anonymous name; the root of every name. */
  public static final Name ANONYMOUS = INTERNER.intern(new Name());

  private final @Nullable Name prefix;
  private final @Nullable String string;
  private final long number;
  private final int hash;

  /** Creates the anonymous name. */
  private Name() {
    this.prefix = null;
    this.string = null;
    this.number = 0L;
    this.hash = 17;
  }

  private Name(Name prefix, @Nullable String string, long number) {
    this.prefix = requireNonNull(prefix);
    this.string = string;
    this.number = number;
    this.hash =
        prefix.hash * 31
            + (string != null ? string.hashCode() : Long.hashCode(number));
  }

  /** Creates a name from a dotted string, such as "nat.rec".
   * Components that consist only of digits become numeric components. */
  public static Name of(String dotted) {
    Name name = ANONYMOUS;
    if (dotted.isEmpty()) {
      return name;
    }
    for (String s : dotted.split("\\.", -1)) {
      name = isNumeric(s) ? name.num(Long.parseLong(s)) : name.str(s);
    }
    return name;
  }

  private static boolean isNumeric(String s) {
    if (s.isEmpty() || s.length() > 18) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns this name extended by a string component. */
  public Name str(String s) {
    return INTERNER.intern(new Name(this, requireNonNull(s), 0L));
  }

  /** Returns this name extended by a numeric component. */
  public Name num(long n) {
    return INTERNER.intern(new Name(this, null, n));
  }

  public boolean isAnonymous() {
    return prefix == null;
  }

  /** Returns the prefix; throws if this is the anonymous name. */
  public Name prefix() {
    return requireNonNull(prefix, "anonymous name has no prefix");
  }

  /** Returns the last component as a string; numeric components are
   * rendered in decimal. */
  public String last() {
    if (prefix == null) {
      return "";
    }
    return string != null ? string : Long.toString(number);
  }

  /** Returns the components of this name, outermost first. */
  public List<String> components() {
    final List<String> list = new ArrayList<>();
    for (Name n = this; n.prefix != null; n = n.prefix) {
      list.add(0, n.last());
    }
    return ImmutableList.copyOf(list);
  }

  /** Returns a name, based on this name, that is not in a given set. If this
   * name is not in the set, returns this name; otherwise appends "_1", "_2"
   * and so forth to the last component. */
  public Name fresh(Collection<Name> used) {
    if (!used.contains(this) || prefix == null) {
      return this;
    }
    for (int i = 1;; i++) {
      final Name name = prefix.str(last() + "_" + i);
      if (!used.contains(name)) {
        return name;
      }
    }
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Name)) {
      return false;
    }
    final Name that = (Name) o;
    // Prefixes are interned, so identity comparison suffices.
    return hash == that.hash
        && prefix == that.prefix
        && number == that.number
        && Objects.equals(string, that.string);
  }

  @Override
  public int compareTo(Name o) {
    return toString().compareTo(o.toString());
  }

  @Override
  public String toString() {
    if (prefix == null) {
      return "[anonymous]";
    }
    return String.join(".", components());
  }
}

// End Name.java
