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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import net.hydromatic.fixpoint.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Extent of one symbol.
 *
 * <p>Rows are stored in an append-only arena and identified by their position
 * in it. Each change increments {@link #version}. A lookup sees the rows that
 * existed when it was created.
 */
abstract class Table {
  final Symbol symbol;
  private final Map<Columns, Index> indexes = new LinkedHashMap<>();

  /** Number of changes made to this table. */
  int version;

  Table(Symbol symbol) {
    this.symbol = symbol;
  }

  /** Number of rows. */
  abstract int size();

  /** Returns the row with a given id. For a lattice, the last column holds
   * the current value. */
  abstract ImmutableList<Object> row(int id);

  /** Whether the rows returned by an iterator are affected by changes after
   * the iterator was created. */
  abstract boolean mutableRows();

  /** Called when a row is appended. */
  void onAppend(int id) {
    final ImmutableList<Object> row = row(id);
    for (Index index : indexes.values()) {
      index.add(id, row);
    }
  }

  /** Returns the index for a set of columns, building it if necessary. */
  Index index(Columns columns) {
    Index index = indexes.get(columns);
    if (index == null) {
      checkArgument(
          columns.max() < symbol.keyArity(),
          "cannot index %s on columns %s",
          symbol,
          columns);
      index = new Index(columns);
      for (int id = 0, n = size(); id < n; id++) {
        index.add(id, row(id));
      }
      indexes.put(columns, index);
    }
    return index;
  }

  /** Returns the number of indexes built so far. */
  int indexCount() {
    return indexes.size();
  }

  /**
   * Returns the rows whose bound columns have the given values.
   *
   * <p>The result is lazy, and may be iterated more than once. Each iteration
   * sees only rows that existed when this method was called.
   */
  Iterable<ImmutableList<Object>> lookup(Columns columns, List<Object> key) {
    checkArgument(
        key.size() == columns.size(),
        "expected %s key values, got %s",
        columns.size(),
        key.size());
    final int limit = size();
    if (columns.isEmpty()) {
      return () -> new RowIterator(null, limit);
    }
    final List<Integer> ids = index(columns).get(key);
    return () -> new RowIterator(ids, limit);
  }

  /** Iterates over rows, in ascending id order, whose ids are less than a
   * limit. */
  private class RowIterator implements Iterator<ImmutableList<Object>> {
    private final @Nullable List<Integer> ids;
    private final int limit;
    private final int expectedVersion = version;
    private int i = 0;

    /** Creates a RowIterator; if {@code ids} is null, iterates over all
     * rows. */
    RowIterator(@Nullable List<Integer> ids, int limit) {
      this.ids = ids;
      this.limit = limit;
    }

    private int id(int i) {
      return ids == null ? i : ids.get(i);
    }

    @Override
    public boolean hasNext() {
      final int n = ids == null ? limit : ids.size();
      return i < n && id(i) < limit;
    }

    @Override
    public ImmutableList<Object> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (mutableRows() && version != expectedVersion) {
        throw new ConcurrentModificationException(
            "table " + symbol + " changed during iteration");
      }
      return row(id(i++));
    }
  }
}

// End Table.java
