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
package net.hydromatic.fixpoint.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.ast.Ast.AtomHead;
import net.hydromatic.fixpoint.ast.Ast.BodyLiteral;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.compile.Stratifier;

/**
 * A compiled constraint program: symbols, constraints, and a stratification.
 *
 * <p>The program is assumed to be well-typed, range-restricted and correctly
 * stratified; the compiler that produced it is responsible for that.
 */
public final class Program {
  /** Symbols, in declaration order. */
  public final ImmutableList<Symbol> symbols;
  /** Constraints, in declaration order. */
  public final ImmutableList<Constraint> constraints;

  private final ImmutableMap<String, Symbol> symbolsByName;
  private final ImmutableMap<Symbol, Integer> strata;
  private final ImmutableListMultimap<Integer, Constraint> constraintsByStratum;
  private final int stratumCount;

  private Program(
      ImmutableList<Symbol> symbols,
      ImmutableList<Constraint> constraints,
      ImmutableMap<Symbol, Integer> strata) {
    this.symbols = symbols;
    this.constraints = constraints;
    this.strata = strata;

    final ImmutableMap.Builder<String, Symbol> byName = ImmutableMap.builder();
    symbols.forEach(symbol -> byName.put(symbol.name, symbol));
    this.symbolsByName = byName.build();

    final ImmutableListMultimap.Builder<Integer, Constraint> byStratum =
        ImmutableListMultimap.builder();
    int count = strata.values().stream().mapToInt(i -> i + 1).max().orElse(0);
    for (Constraint constraint : constraints) {
      final int stratum = Stratifier.constraintStratum(constraint, strata);
      byStratum.put(stratum, constraint);
      count = Math.max(count, stratum + 1);
    }
    this.constraintsByStratum = byStratum.build();
    this.stratumCount = count;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the symbol with a given name.
   *
   * @throws IllegalArgumentException if there is no such symbol
   */
  public Symbol symbol(String name) {
    final Symbol symbol = symbolsByName.get(name);
    checkArgument(symbol != null, "unknown symbol %s", name);
    return symbol;
  }

  /** Returns whether a symbol is declared in this program. */
  public boolean contains(Symbol symbol) {
    return symbol.equals(symbolsByName.get(symbol.name));
  }

  /** Returns the stratum of a symbol. */
  public int stratum(Symbol symbol) {
    final Integer stratum = strata.get(symbol);
    checkArgument(stratum != null, "unknown symbol %s", symbol);
    return stratum;
  }

  /** Returns the number of strata. */
  public int stratumCount() {
    return stratumCount;
  }

  /** Returns the symbols in a given stratum, in declaration order. */
  public List<Symbol> symbols(int stratum) {
    final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
    symbols.forEach(
        symbol -> {
          if (strata.get(symbol) == stratum) {
            b.add(symbol);
          }
        });
    return b.build();
  }

  /** Returns the constraints evaluated in a given stratum. */
  public List<Constraint> constraints(int stratum) {
    return constraintsByStratum.get(stratum);
  }

  /** Builder for {@link Program}. */
  public static class Builder {
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<String, Integer> strata = new LinkedHashMap<>();

    Builder() {}

    /** Declares a symbol. */
    public Symbol declare(Symbol symbol) {
      checkArgument(
          !symbols.containsKey(symbol.name), "duplicate symbol %s", symbol);
      symbols.put(symbol.name, symbol);
      return symbol;
    }

    /** Declares a relation. */
    public Symbol relation(String name, int arity) {
      return declare(Symbol.relation(name, arity));
    }

    /** Declares a lattice. */
    public Symbol lattice(String name, int arity, LatticeOps ops) {
      return declare(Symbol.lattice(name, arity, ops));
    }

    /** Adds an index hint to a declared symbol. */
    public Builder index(Symbol symbol, Integer... columns) {
      final Symbol declared = lookup(symbol);
      symbols.put(symbol.name, declared.withIndex(Arrays.asList(columns)));
      return this;
    }

    /**
     * Assigns a stratum to a symbol. If strata are assigned, they must be
     * assigned to every symbol; if none are, they are computed.
     */
    public Builder stratum(Symbol symbol, int stratum) {
      lookup(symbol);
      checkArgument(stratum >= 0, "negative stratum %s", stratum);
      strata.put(symbol.name, stratum);
      return this;
    }

    /** Adds constraints. */
    public Builder add(Constraint... constraints) {
      for (Constraint constraint : constraints) {
        if (constraint.head instanceof AtomHead) {
          lookup(((AtomHead) constraint.head).symbol);
        }
        for (BodyLiteral literal : constraint.body) {
          if (literal.op.isAtom()) {
            lookup(((Ast.Atom) literal).symbol);
          }
        }
        this.constraints.add(constraint);
      }
      return this;
    }

    private Symbol lookup(Symbol symbol) {
      final Symbol declared = symbols.get(symbol.name);
      checkArgument(
          symbol.equals(declared), "symbol %s is not declared", symbol);
      return declared;
    }

    /**
     * Builds the program.
     *
     * @throws net.hydromatic.fixpoint.compile.StratificationException if
     *     strata were not assigned and cannot be computed
     */
    public Program build() {
      final ImmutableList<Symbol> symbolList =
          ImmutableList.copyOf(symbols.values());
      final ImmutableList<Constraint> constraintList =
          ImmutableList.copyOf(constraints);
      final ImmutableMap<Symbol, Integer> strataMap;
      if (strata.isEmpty()) {
        strataMap = Stratifier.stratify(symbolList, constraintList);
      } else {
        final ImmutableMap.Builder<Symbol, Integer> b = ImmutableMap.builder();
        for (Symbol symbol : symbolList) {
          final Integer stratum = strata.get(symbol.name);
          checkArgument(stratum != null, "no stratum for symbol %s", symbol);
          b.put(symbol, stratum);
        }
        strataMap = b.build();
      }
      return new Program(symbolList, constraintList, strataMap);
    }
  }
}

// End Program.java
