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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.solve.Model;
import net.hydromatic.fixpoint.solve.Statistics;

/**
 * Current extent of every symbol of a program.
 *
 * <p>Relations only grow (set union), and each lattice key's value only
 * increases (least upper bound). Every change increments {@link #version()}
 * and is recorded until the next call to {@link #takeDeltas()}.
 *
 * <p>Not thread-safe. A store is owned by one solve.
 */
public class TableStore {
  private final Map<Symbol, Table> tables = new LinkedHashMap<>();
  private final Map<Symbol, List<Integer>> changes = new LinkedHashMap<>();
  private int version;
  private boolean snapshotTaken;

  /**
   * Creates an empty store for the symbols of a program.
   *
   * @param program the program
   * @param eagerIndexes whether to build the indexes hinted by each symbol now,
   *     rather than on first use
   */
  public TableStore(Program program, boolean eagerIndexes) {
    for (Symbol symbol : program.symbols) {
      final Table table =
          symbol.isLattice() ? new LatticeTable(symbol) : new RelationTable(symbol);
      tables.put(symbol, table);
      if (eagerIndexes) {
        symbol.indexHints.forEach(columns -> table.index(Columns.of(columns)));
      }
    }
  }

  private Table table(Symbol symbol) {
    final Table table = tables.get(symbol);
    checkArgument(table != null, "unknown symbol %s", symbol);
    return table;
  }

  private RelationTable relation(Symbol symbol) {
    final Table table = table(symbol);
    checkArgument(
        table instanceof RelationTable, "%s is not a relation", symbol);
    return (RelationTable) table;
  }

  private LatticeTable lattice(Symbol symbol) {
    final Table table = table(symbol);
    checkArgument(table instanceof LatticeTable, "%s is not a lattice", symbol);
    return (LatticeTable) table;
  }

  /** Returns the number of changes made to this store. */
  public int version() {
    return version;
  }

  /**
   * Adds a fact to a relation.
   *
   * @return whether the fact was not already present
   */
  public boolean insert(Symbol symbol, List<Object> fact) {
    checkState(!snapshotTaken, "store is frozen");
    final RelationTable table = relation(symbol);
    checkArgument(
        fact.size() == symbol.arity,
        "fact for %s must have %s values",
        symbol,
        symbol.arity);
    if (!table.insert(ImmutableList.copyOf(fact))) {
      return false;
    }
    record(symbol, table.size() - 1);
    return true;
  }

  /**
   * Merges a value into a lattice key.
   *
   * <p>Stores {@code lub(old, value)}, where {@code old} is the key's current
   * value, or bottom if it has none.
   *
   * @return whether the stored value changed
   */
  public boolean merge(Symbol symbol, List<Object> key, Object value) {
    checkState(!snapshotTaken, "store is frozen");
    final LatticeTable table = lattice(symbol);
    checkArgument(
        key.size() == symbol.keyArity(),
        "key for %s must have %s values",
        symbol,
        symbol.keyArity());
    final ImmutableList<Object> key2 = ImmutableList.copyOf(key);
    if (!table.merge(key2, requireNonNull(value, "value"))) {
      return false;
    }
    record(symbol, table.id(key2));
    return true;
  }

  private void record(Symbol symbol, int id) {
    ++version;
    changes.computeIfAbsent(symbol, s -> new ArrayList<>()).add(id);
  }

  /**
   * Returns the changes since the previous call, per symbol, and starts
   * recording anew. Symbols without changes are absent.
   */
  public ImmutableMap<Symbol, Delta> takeDeltas() {
    final ImmutableMap.Builder<Symbol, Delta> b = ImmutableMap.builder();
    changes.forEach(
        (symbol, ids) ->
            b.put(symbol, Delta.of(ids.stream().mapToInt(i -> i).toArray())));
    changes.clear();
    return b.build();
  }

  /**
   * Returns the rows of a symbol whose bound columns have given values.
   *
   * <p>For a lattice, only key columns may be bound, and the last column of
   * each row is the key's current value. The result is lazy and restartable;
   * it does not see rows added after this call.
   *
   * @param symbol the symbol
   * @param columns the bound columns
   * @param key values of the bound columns, in column order
   */
  public Iterable<ImmutableList<Object>> lookup(
      Symbol symbol, Columns columns, List<Object> key) {
    return table(symbol).lookup(columns, key);
  }

  /**
   * Returns the rows in a delta whose bound columns have given values.
   *
   * <p>Rows are read when iterated, so a lattice row has the key's value at
   * that time.
   */
  public Iterable<ImmutableList<Object>> lookup(
      Symbol symbol, Delta delta, Columns columns, List<Object> key) {
    final Table table = table(symbol);
    checkArgument(
        columns.max() < symbol.keyArity(),
        "cannot look up %s on columns %s",
        symbol,
        columns);
    final List<Integer> positions = new ArrayList<>(delta.size());
    for (int i = 0; i < delta.size(); i++) {
      positions.add(i);
    }
    return FluentIterable.from(positions)
        .transform(i -> table.row(delta.id(i)))
        .filter(row -> columns.project(row).equals(key));
  }

  /** Returns the value of a lattice key, or bottom if the key is absent. */
  public Object latticeValue(Symbol symbol, List<Object> key) {
    return lattice(symbol).value(key);
  }

  /** Returns whether a relation contains a fact. */
  public boolean contains(Symbol symbol, List<Object> fact) {
    return relation(symbol).contains(fact);
  }

  /** Returns the number of rows of a symbol. */
  public int size(Symbol symbol) {
    return table(symbol).size();
  }

  /** Returns the number of indexes of a symbol that have been built. */
  public int indexCount(Symbol symbol) {
    return table(symbol).indexCount();
  }

  /** Returns a copy of the rows of a symbol, in id order. */
  public ImmutableList<ImmutableList<Object>> rows(Symbol symbol) {
    final Table table = table(symbol);
    final ImmutableList.Builder<ImmutableList<Object>> b =
        ImmutableList.builder();
    for (int id = 0, n = table.size(); id < n; id++) {
      b.add(table.row(id));
    }
    return b.build();
  }

  /**
   * Returns an immutable copy of the final contents of this store. Can be
   * called only once; afterwards, the store can no longer change.
   */
  public Model snapshot(Statistics statistics) {
    checkState(!snapshotTaken, "snapshot already taken");
    snapshotTaken = true;
    final ImmutableMap.Builder<Symbol, List<ImmutableList<Object>>> b =
        ImmutableMap.builder();
    tables.keySet().forEach(symbol -> b.put(symbol, rows(symbol)));
    return Model.of(b.build(), statistics);
  }
}

// End TableStore.java
