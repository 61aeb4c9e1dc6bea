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
package net.hydromatic.gentzen.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.collect.Range;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration property.
 *
 * <p>Values are held in a {@code Map<Prop, Object>} that is passed explicitly
 * to the components that need it; a property that is absent from the map has
 * its default value.
 */
public enum Prop {
  /**
   * Integer property "maxProofDepth" is the number of rounds of rule
   * application the proof search may perform for each target. Default is 5.
   */
  MAX_PROOF_DEPTH("maxProofDepth", Integer.class, 5, Range.closed(1, 20)),

  /**
   * Integer property "maxIterations" is the number of states the proof
   * search may take from its queue before giving up. Default is 1,000.
   */
  MAX_ITERATIONS(
      "maxIterations", Integer.class, 1000, Range.closed(10, 100_000)),

  /**
   * Integer property "maxQueueSize" is the number of states that may wait in
   * the proof search's queue before it gives up. Default is 1,000.
   */
  MAX_QUEUE_SIZE(
      "maxQueueSize", Integer.class, 1000, Range.closed(10, 100_000)),

  /**
   * Integer property "maxSteps" is the number of steps at which a state is
   * no longer expanded. Default is 100.
   */
  MAX_STEPS("maxSteps", Integer.class, 100, Range.closed(1, 10_000)),

  /**
   * Boolean property "selectiveResolution" controls whether only the fact
   * resolvers for atoms that a scenario references are run. Default is
   * false.
   */
  SELECTIVE_RESOLUTION("selectiveResolution", Boolean.class, false, null),

  /**
   * Boolean property "validate" controls whether a scenario is validated
   * before it is run. Default is false.
   */
  VALIDATE("validate", Boolean.class, false, null),

  /**
   * Boolean property "verbose" controls whether results include fact
   * resolutions and every proof step. Default is false.
   */
  VERBOSE("verbose", Boolean.class, false, null);

  /** Prefix of keys in a properties file, e.g. "gentzen.maxSteps". */
  public static final String KEY_PREFIX = "gentzen.";

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;
  private final @Nullable Range<Integer> range;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(
      String camelName,
      Class<?> type,
      Object defaultValue,
      @Nullable Range<Integer> range) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    this.range = range;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
    checkArgument(range == null || type == Integer.class);
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the default value of this property. */
  public Object defaultValue() {
    return defaultValue;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
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

  /** Sets the value of a property. Checks that its type and range are
   * valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must have type " + type);
    }
    if (range != null && !range.contains((Integer) value)) {
      throw new IllegalArgumentException(
          "value "
              + value
              + " for property "
              + camelName
              + " is out of range "
              + range);
    }
    map.put(this, value);
  }

  /** Sets the value of a property from a string, converting it to the
   * property's type. */
  public void setLenient(Map<Prop, Object> map, String value) {
    final String trimmed = value.trim();
    if (type == Boolean.class) {
      switch (trimmed.toLowerCase(Locale.ROOT)) {
        case "true":
        case "1":
          set(map, true);
          return;
        case "false":
        case "0":
          set(map, false);
          return;
        default:
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be true or false");
      }
    }
    final int i;
    try {
      i = Integer.parseInt(trimmed);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must be an integer", e);
    }
    set(map, i);
  }

  /**
   * Sets every property whose key, "gentzen." followed by its camel name,
   * occurs in a set of properties. Other keys are ignored.
   */
  public static void load(Properties properties, Map<Prop, Object> map) {
    for (Prop prop : BY_CAMEL_NAME) {
      final String value = properties.getProperty(KEY_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
  }
}

// End Prop.java
