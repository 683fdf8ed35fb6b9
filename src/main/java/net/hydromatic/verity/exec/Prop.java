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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.verity.util.StackGuard;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration property.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * Integer property "threads" is the number of worker threads that check
   * the values of definitions. If 1 (the default), declarations are
   * certified one at a time, in order, on the calling thread.
   */
  THREADS("threads", Integer.class, 1),

  /**
   * Integer property "maxPending" is the maximum number of value checks that
   * have been dispatched to workers but have not finished. When the limit is
   * reached, the thread that registers signatures waits. Default is 1024.
   */
  MAX_PENDING("maxPending", Integer.class, 1024),

  /**
   * Integer property "guardDepth" is the depth of guarded recursion allowed
   * on an ordinary thread before the computation moves to a dedicated stack
   * segment. Default is 400.
   */
  GUARD_DEPTH("guardDepth", Integer.class, 400),

  /**
   * Integer property "stackSegmentMb" is the stack size, in megabytes, of
   * each dedicated stack segment. Default is 256.
   */
  STACK_SEGMENT_MB("stackSegmentMb", Integer.class, 256),

  /**
   * Integer property "maxStackSegments" is the number of stack segments that
   * may be chained before the kernel gives up with a "stack exhausted"
   * error. Default is 16.
   */
  MAX_STACK_SEGMENTS("maxStackSegments", Integer.class, 16),

  /**
   * Boolean property "printVerdicts" controls whether the command line
   * prints a line for each committed declaration. Default is false.
   */
  PRINT_VERDICTS("printVerdicts", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(Arrays.asList(values()));

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must have type " + type.getSimpleName());
    }
    map.put(this, value);
  }

  /** Sets the value of a property from a string, converting it to the
   * property's type. */
  public void setLenient(Map<Prop, Object> map, String value) {
    if (type == Integer.class) {
      try {
        set(map, Integer.valueOf(value.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be an integer", e);
      }
    } else if (type == Boolean.class) {
      final String low = value.trim().toLowerCase(Locale.ROOT);
      if (!low.equals("true") && !low.equals("false")) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be true or false");
      }
      set(map, Boolean.valueOf(low));
    } else {
      set(map, value);
    }
  }

  /** Creates a stack guard from the properties
   * {@link #GUARD_DEPTH}, {@link #STACK_SEGMENT_MB} and
   * {@link #MAX_STACK_SEGMENTS}. */
  public static StackGuard stackGuard(Map<Prop, Object> map) {
    return new StackGuard(GUARD_DEPTH.intValue(map),
        STACK_SEGMENT_MB.intValue(map), MAX_STACK_SEGMENTS.intValue(map));
  }
}

// End Prop.java
