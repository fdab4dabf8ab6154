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
package net.hydromatic.fixpoint.solve;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.eval.Values;
import net.hydromatic.fixpoint.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The minimal model computed by a solve.
 *
 * <p>Immutable. Rows of each symbol are sorted by {@link Values#ORDERING}, so
 * two models with the same extents are equal, whatever order the facts were
 * derived in.
 */
public final class Model {
  private final ImmutableMap<String, Symbol> symbols;
  private final ImmutableMap<Symbol, ImmutableList<ImmutableList<Object>>>
      extents;
  private final Statistics statistics;

  private Model(
      ImmutableMap<String, Symbol> symbols,
      ImmutableMap<Symbol, ImmutableList<ImmutableList<Object>>> extents,
      Statistics statistics) {
    this.symbols = symbols;
    this.extents = extents;
    this.statistics = requireNonNull(statistics, "statistics");
  }

  /** Creates a model from the rows of each symbol. */
  public static Model of(
      Map<Symbol, ? extends List<ImmutableList<Object>>> rows,
      Statistics statistics) {
    final ImmutableMap.Builder<String, Symbol> symbols = ImmutableMap.builder();
    final ImmutableMap.Builder<Symbol, ImmutableList<ImmutableList<Object>>>
        extents = ImmutableMap.builder();
    rows.forEach(
        (symbol, list) -> {
          symbols.put(symbol.name, symbol);
          extents.put(
              symbol, ImmutableList.copyOf(Values.ORDERING.sortedCopy(list)));
        });
    return new Model(symbols.build(), extents.build(), statistics);
  }

  /** Returns the symbols, in declaration order. */
  public List<Symbol> symbols() {
    return extents.keySet().asList();
  }

  /**
   * Returns the symbol with a given name.
   *
   * @throws IllegalArgumentException if there is no such symbol
   */
  public Symbol symbol(String name) {
    final Symbol symbol = symbols.get(name);
    if (symbol == null) {
      throw new IllegalArgumentException("No such name: " + name);
    }
    return symbol;
  }

  /**
   * Returns the facts of a relation.
   *
   * @throws IllegalArgumentException if there is no relation with this name
   */
  public List<ImmutableList<Object>> getRelation(String name) {
    final List<ImmutableList<Object>> relation = getRelationOpt(name);
    if (relation == null) {
      throw new IllegalArgumentException("No such relation: " + name);
    }
    return relation;
  }

  /** Returns the facts of a relation, or null if there is no such relation. */
  public @Nullable List<ImmutableList<Object>> getRelationOpt(String name) {
    final Symbol symbol = symbols.get(name);
    if (symbol == null || symbol.isLattice()) {
      return null;
    }
    return extents.get(symbol);
  }

  /**
   * Returns the entries of a lattice; each is a key and a value.
   *
   * @throws IllegalArgumentException if there is no lattice with this name
   */
  public List<Map.Entry<List<Object>, Object>> getLattice(String name) {
    final List<Map.Entry<List<Object>, Object>> lattice = getLatticeOpt(name);
    if (lattice == null) {
      throw new IllegalArgumentException("No such lattice: " + name);
    }
    return lattice;
  }

  /** Returns the entries of a lattice, or null if there is no such lattice. */
  public @Nullable List<Map.Entry<List<Object>, Object>> getLatticeOpt(
      String name) {
    final Symbol symbol = symbols.get(name);
    if (symbol == null || !symbol.isLattice()) {
      return null;
    }
    final ImmutableList.Builder<Map.Entry<List<Object>, Object>> b =
        ImmutableList.builder();
    for (ImmutableList<Object> row : requireNonNull(extents.get(symbol))) {
      b.add(Maps.immutableEntry(Static.skipLast(row), Static.last(row)));
    }
    return b.build();
  }

  /** Returns the rows of a symbol; for a lattice, key and value together. */
  public List<ImmutableList<Object>> rows(Symbol symbol) {
    final ImmutableList<ImmutableList<Object>> rows = extents.get(symbol);
    if (rows == null) {
      throw new IllegalArgumentException("No such name: " + symbol);
    }
    return rows;
  }

  /**
   * Returns every fact in this model, ordered by symbol then value. A lattice
   * entry becomes a fact whose last value is the lattice value.
   *
   * <p>Solving the same program with these facts as input yields an equal
   * model.
   */
  public ImmutableList<Fact> facts() {
    final ImmutableList.Builder<Fact> b = ImmutableList.builder();
    extents.forEach(
        (symbol, rows) ->
            rows.forEach(row -> b.add(Fact.ofList(symbol, row))));
    return b.build();
  }

  public Statistics getStatistics() {
    return statistics;
  }

  @Override
  public int hashCode() {
    return extents.hashCode();
  }

  /** Two models are equal if they have the same extents. Statistics are
   * ignored. */
  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Model && extents.equals(((Model) o).extents);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (Fact fact : facts()) {
      buf.append(fact).append('\n');
    }
    return buf.toString();
  }
}

// End Model.java
