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

import java.util.List;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.eval.Prop;
import net.hydromatic.fixpoint.eval.SolverConfig;
import net.hydromatic.fixpoint.store.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the minimal model of a program.
 *
 * <p>A solver is immutable, and may be used by several threads at once. Each
 * call to {@link #solve} works on a store of its own.
 */
public class Solver {
  private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

  public final SolverConfig config;
  public final Tracer tracer;

  private Solver(SolverConfig config, Tracer tracer) {
    this.config = requireNonNull(config, "config");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a solver. */
  public static Solver create(SolverConfig config) {
    return new Solver(config, Tracers.empty());
  }

  /** Returns a solver that is the same as this but with a given tracer. */
  public Solver withTracer(Tracer tracer) {
    return tracer == this.tracer ? this : new Solver(config, tracer);
  }

  /**
   * Solves a program, starting from a set of facts.
   *
   * @param program the program
   * @param facts initial facts; a lattice fact's last value is merged into
   *     the entry for its key
   * @return the model
   * @throws UnsatisfiableConstraintException if a constraint with a false
   *     head is satisfied
   * @throws ScalarFunctionException if a scalar function or lattice operator
   *     throws
   * @throws net.hydromatic.fixpoint.compile.StratificationException if a
   *     constraint reads a symbol its stratum may not read
   */
  public Model solve(Program program, Iterable<Fact> facts) {
    final long start = System.nanoTime();
    final TableStore store =
        new TableStore(program, config.booleanValue(Prop.EAGER_INDEXES));
    final StratumScheduler scheduler =
        new StratumScheduler(program, store, tracer);
    scheduler.load(facts);
    final List<Integer> rounds = scheduler.run();
    int factCount = 0;
    for (Symbol symbol : program.symbols) {
      factCount += store.size(symbol);
    }
    final Statistics statistics =
        new Statistics(
            rounds,
            scheduler.derivations(),
            factCount,
            System.nanoTime() - start);
    LOG.debug("Solved {} symbols: {}", program.symbols.size(), statistics);
    return store.snapshot(statistics);
  }
}

// End Solver.java
