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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable set of property values.
 *
 * <p>Built once, then passed to the {@link FunctionRegistry}, the solver and
 * the delta minimizer. Properties that have not been set take their default
 * value.
 */
public final class SolverConfig {
  /** Configuration in which every property has its default value. */
  public static final SolverConfig DEFAULT =
      new SolverConfig(ImmutableSortedMap.of());

  private final ImmutableSortedMap<Prop, Object> map;

  private SolverConfig(ImmutableSortedMap<Prop, Object> map) {
    this.map = map;
  }

  /**
   * Returns a configuration with a property set to a given value.
   *
   * @throws IllegalArgumentException if the value does not have the
   *     property's type
   */
  public SolverConfig with(Prop prop, Object value) {
    return with2(prop, prop.convert(value));
  }

  /**
   * Returns a configuration with a property, identified by name, set to a
   * value given as a string.
   *
   * @throws IllegalArgumentException if there is no such property, or the
   *     value is not valid
   */
  public SolverConfig withLenient(String propName, @Nullable Object value) {
    final Prop prop = Prop.lookup(propName);
    return with2(prop, prop.convertLenient(value));
  }

  private SolverConfig with2(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new TreeMap<>(map);
    map2.put(prop, value);
    return new SolverConfig(ImmutableSortedMap.copyOf(map2));
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(map);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Prop prop, Class<E> type) {
    return prop.enumValue(map, type);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SolverConfig && map.equals(((SolverConfig) o).map);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      if (buf.length() > 1) {
        buf.append(", ");
      }
      buf.append(prop.camelName).append('=').append(prop.get(map));
    }
    return buf.append('}').toString();
  }
}

// End SolverConfig.java
