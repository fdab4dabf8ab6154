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
package net.hydromatic.fixpoint.compile;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Ast.Atom;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes a stratification of a program.
 *
 * <p>Each symbol gets the lowest stratum such that a constraint's head is in
 * the same or a later stratum than every symbol its positive atoms read, and
 * in a strictly later stratum than every symbol its negative atoms read.
 */
public class Stratifier {
  private Stratifier() {
    // Utility class
  }

  /**
   * Assigns a stratum to each symbol.
   *
   * @param symbols the symbols, in declaration order
   * @param constraints the constraints
   * @return map from each symbol to its stratum, starting at 0
   * @throws StratificationException if a dependency cycle passes through a
   *     negative atom
   */
  public static ImmutableMap<Symbol, Integer> stratify(
      List<Symbol> symbols, List<Constraint> constraints) {
    final Map<Symbol, Set<Dependency>> graph = buildGraph(constraints);
    checkNegationCycles(graph);

    // Longest-path levels. Without a negative cycle, each pass raises at
    // least one level or stops, and no level exceeds the symbol count.
    final Map<Symbol, Integer> strata = new LinkedHashMap<>();
    symbols.forEach(symbol -> strata.put(symbol, 0));
    for (boolean changed = true; changed; ) {
      changed = false;
      for (Map.Entry<Symbol, Set<Dependency>> entry : graph.entrySet()) {
        final Symbol head = entry.getKey();
        int stratum = strata.getOrDefault(head, 0);
        for (Dependency dep : entry.getValue()) {
          final int bodyStratum = strata.getOrDefault(dep.target, 0);
          stratum = Math.max(stratum, bodyStratum + (dep.negated ? 1 : 0));
        }
        if (stratum > strata.getOrDefault(head, 0)) {
          if (stratum > symbols.size()) {
            throw new StratificationException(
                "Program is not stratified. Negation cycle detected involving"
                    + " symbol: " + head,
                head,
                null);
          }
          strata.put(head, stratum);
          changed = true;
        }
      }
    }
    return ImmutableMap.copyOf(strata);
  }

  /**
   * Returns the stratum in which a constraint is evaluated: that of its head
   * symbol, or, for a constraint whose head is true or false, the earliest
   * stratum in which every symbol it reads is available.
   */
  public static int constraintStratum(
      Constraint constraint, Map<Symbol, Integer> strata) {
    final @Nullable Symbol headSymbol = constraint.headSymbol();
    if (headSymbol != null) {
      return strata.getOrDefault(headSymbol, 0);
    }
    int stratum = 0;
    for (Atom atom : constraint.atoms()) {
      final int s = strata.getOrDefault(atom.symbol, 0);
      stratum = Math.max(stratum, s + (atom.negated() ? 1 : 0));
    }
    return stratum;
  }

  private static Map<Symbol, Set<Dependency>> buildGraph(
      List<Constraint> constraints) {
    final Map<Symbol, Set<Dependency>> graph = new LinkedHashMap<>();
    for (Constraint constraint : constraints) {
      final @Nullable Symbol head = constraint.headSymbol();
      if (head == null) {
        // A true or false head defines no symbol
        continue;
      }
      final Set<Dependency> dependencies =
          graph.computeIfAbsent(head, h -> new LinkedHashSet<>());
      for (Atom atom : constraint.atoms()) {
        dependencies.add(new Dependency(atom.symbol, atom.negated()));
      }
    }
    return graph;
  }

  /** Throws if a negative dependency connects two symbols in the same
   * strongly connected component of the dependency graph. Cycles of positive
   * dependencies are allowed. */
  private static void checkNegationCycles(Map<Symbol, Set<Dependency>> graph) {
    final Components components = new Components(graph);
    graph.keySet().forEach(components::visit);
    graph.forEach((head, dependencies) -> {
      for (Dependency dep : dependencies) {
        if (dep.negated && components.same(head, dep.target)) {
          throw new StratificationException(
              String.format(
                  "Program is not stratified. Negation cycle detected"
                      + " involving symbol: %s",
                  head),
              head,
              null);
        }
      }
    });
  }

  /** Strongly connected components of a dependency graph, computed by
   * Tarjan's algorithm. */
  private static class Components {
    private final Map<Symbol, Set<Dependency>> graph;
    private final Map<Symbol, Integer> index = new HashMap<>();
    private final Map<Symbol, Integer> lowLink = new HashMap<>();
    private final Deque<Symbol> stack = new ArrayDeque<>();
    private final Set<Symbol> onStack = new HashSet<>();
    private final Map<Symbol, Integer> component = new HashMap<>();

    Components(Map<Symbol, Set<Dependency>> graph) {
      this.graph = graph;
    }

    boolean same(Symbol symbol1, Symbol symbol2) {
      return component.get(symbol1).equals(component.get(symbol2));
    }

    void visit(Symbol symbol) {
      if (index.containsKey(symbol)) {
        return;
      }
      final int i = index.size();
      index.put(symbol, i);
      lowLink.put(symbol, i);
      stack.push(symbol);
      onStack.add(symbol);
      for (Dependency dep : graph.getOrDefault(symbol, ImmutableSet.of())) {
        if (!index.containsKey(dep.target)) {
          visit(dep.target);
          lowLink.put(symbol,
              Math.min(lowLink.get(symbol), lowLink.get(dep.target)));
        } else if (onStack.contains(dep.target)) {
          lowLink.put(symbol,
              Math.min(lowLink.get(symbol), index.get(dep.target)));
        }
      }
      if (lowLink.get(symbol) == i) {
        final int c = component.size();
        Symbol member;
        do {
          member = stack.pop();
          onStack.remove(member);
          component.put(member, c);
        } while (member != symbol);
      }
    }
  }

  /** A dependency between symbols in the dependency graph. */
  private static class Dependency {
    final Symbol target;
    final boolean negated;

    Dependency(Symbol target, boolean negated) {
      this.target = target;
      this.negated = negated;
    }

    @Override
    public int hashCode() {
      return Objects.hash(target, negated);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Dependency
              && target.equals(((Dependency) o).target)
              && negated == ((Dependency) o).negated;
    }
  }
}

// End Stratifier.java
