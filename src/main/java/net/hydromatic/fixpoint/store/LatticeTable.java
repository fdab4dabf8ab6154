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
package net.hydromatic.fixpoint.store;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.ast.LatticeOps;
import net.hydromatic.fixpoint.ast.Symbol;

/**
 * Extent of a lattice: a map from key to lattice value.
 *
 * <p>A key that is absent has value bottom. A key's value only increases,
 * via {@link LatticeOps#lub}; each key keeps its row id for its whole life.
 */
class LatticeTable extends Table {
  private final LatticeOps ops;
  private final List<ImmutableList<Object>> keys = new ArrayList<>();
  private final List<Object> values = new ArrayList<>();
  private final Map<List<Object>, Integer> ids = new HashMap<>();

  LatticeTable(Symbol symbol) {
    super(symbol);
    this.ops = symbol.latticeOps();
  }

  @Override
  int size() {
    return keys.size();
  }

  @Override
  ImmutableList<Object> row(int id) {
    return ImmutableList.<Object>builder()
        .addAll(keys.get(id))
        .add(values.get(id))
        .build();
  }

  @Override
  boolean mutableRows() {
    return true;
  }

  /** Returns the id of the row with a given key, or -1. */
  int id(List<Object> key) {
    final Integer id = ids.get(key);
    return id == null ? -1 : id;
  }

  /** Returns the value of a key, or bottom if the key is absent. */
  Object value(List<Object> key) {
    final Integer id = ids.get(key);
    return id == null ? ops.bottom : values.get(id);
  }

  /**
   * Merges a value into a key's current value; returns whether the value
   * changed. The value is unchanged if the least upper bound is equivalent,
   * under {@code leq}, to the old value.
   */
  boolean merge(ImmutableList<Object> key, Object value) {
    final Integer id = ids.get(key);
    final Object old = id == null ? ops.bottom : values.get(id);
    final Object lub = ops.lub(old, value);
    if (ops.equivalent(lub, old)) {
      return false;
    }
    ++version;
    if (id == null) {
      keys.add(key);
      values.add(lub);
      ids.put(key, keys.size() - 1);
      onAppend(keys.size() - 1);
    } else {
      values.set(id, lub);
    }
    return true;
  }
}

// End LatticeTable.java
