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
package net.hydromatic.fixpoint.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see SolverConfig
 */
public enum Prop {
  /**
   * Boolean property "eagerIndexes" controls whether the index hints declared
   * on a symbol are built when a solve starts. If false, every index is built
   * the first time a query needs it. Default is true.
   */
  EAGER_INDEXES("eagerIndexes", Boolean.class, true),

  /**
   * Boolean property "impure" controls whether scalar functions with side
   * effects (printing, generating fresh identifiers) may be registered.
   * Default is false; registering an impure function then fails.
   */
  IMPURE("impure", Boolean.class, false),

  /**
   * Boolean property "minimizeMemo" controls whether the delta minimizer
   * remembers the outcome of fact sets it has already tried. Default is true.
   */
  MINIMIZE_MEMO("minimizeMemo", Boolean.class, true),

  /**
   * Enum property "minimizeStrictness" controls which failures the delta
   * minimizer accepts as a reproduction of the original failure. Default is
   * {@link Strictness#ANY}.
   */
  MINIMIZE_STRICTNESS("minimizeStrictness", Strictness.class, Strictness.ANY);

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

  /**
   * Looks up a property by name. Throws if not found; never returns null.
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
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

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /**
   * Converts a value to this property's type, allowing strings for boolean
   * and enum types. Throws if the value is not valid.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  Object convertLenient(@Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type == Boolean.class) {
        final String low = s.toLowerCase(Locale.ROOT);
        checkArgument(
            low.equals("true") || low.equals("false"),
            "value for property %s must be 'true' or 'false'",
            camelName);
        return Boolean.valueOf(low);
      }
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value must be one of: " + values);
        }
        return optional.get();
      }
    }
    return convert(value);
  }

  /** Checks that a value is valid for this property, and returns it. */
  Object convert(@Nullable Object value) {
    checkArgument(value != null, "property %s is required", camelName);
    checkArgument(
        type.isInstance(value),
        "value for property %s must have type %s",
        camelName,
        type);
    return value;
  }

  /** Allowed values for {@link #MINIMIZE_STRICTNESS} property. */
  public enum Strictness {
    /**
     * Any unsatisfiable constraint or scalar function failure reproduces the
     * original failure. The default.
     */
    ANY,
    /** The failure must be of the same class as the original failure. */
    SAME_KIND,
    /**
     * The failure must be of the same class and raised by the same constraint
     * as the original failure.
     */
    SAME_CONSTRAINT
  }
}

// End Prop.java
