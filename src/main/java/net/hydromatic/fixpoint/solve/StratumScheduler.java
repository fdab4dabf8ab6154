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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.store.TableStore;
import net.hydromatic.fixpoint.util.Static;

/** Runs the strata of a program in order, each to completion. */
class StratumScheduler {
  private final Program program;
  private final TableStore store;
  private final Evaluator evaluator;

  StratumScheduler(Program program, TableStore store, Tracer tracer) {
    this.program = requireNonNull(program, "program");
    this.store = requireNonNull(store, "store");
    this.evaluator = new Evaluator(program, store, tracer);
  }

  /** Adds initial facts to the store. Each fact's symbol must be declared in
   * the program.
   *
   * @throws ScalarFunctionException if a lattice operator throws while a
   *     fact is merged */
  void load(Iterable<Fact> facts) {
    for (Fact fact : facts) {
      final Symbol symbol = fact.symbol;
      checkArgument(
          program.contains(symbol),
          "fact %s has symbol that is not in the program",
          fact);
      if (symbol.isLattice()) {
        try {
          store.merge(
              symbol, Static.skipLast(fact.values), Static.last(fact.values));
        } catch (RuntimeException e) {
          throw new ScalarFunctionException("lub of " + symbol, fact, e);
        }
      } else {
        store.insert(symbol, fact.values);
      }
    }
  }

  /** Evaluates every stratum; returns the number of rounds of each. */
  ImmutableList<Integer> run() {
    final List<Integer> rounds = new ArrayList<>();
    for (int stratum = 0; stratum < program.stratumCount(); stratum++) {
      rounds.add(evaluator.evaluate(stratum));
    }
    return ImmutableList.copyOf(rounds);
  }

  long derivations() {
    return evaluator.derivations;
  }
}

// End StratumScheduler.java
