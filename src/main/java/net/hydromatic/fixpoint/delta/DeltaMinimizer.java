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
package net.hydromatic.fixpoint.delta;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.eval.Prop;
import net.hydromatic.fixpoint.eval.Prop.Strictness;
import net.hydromatic.fixpoint.eval.SolverConfig;
import net.hydromatic.fixpoint.solve.EvaluationException;
import net.hydromatic.fixpoint.solve.Solver;
import net.hydromatic.fixpoint.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shrinks a set of facts whose solve fails to a 1-minimal subset that still
 * fails, using delta debugging (ddmin).
 *
 * <p>Each trial is a complete solve from scratch. Which failures count as
 * reproducing the original one depends on
 * {@link Prop#MINIMIZE_STRICTNESS}. A
 * {@link net.hydromatic.fixpoint.compile.StratificationException} is never a
 * reproduction; it propagates to the caller.
 */
public class DeltaMinimizer {
  private static final Logger LOG =
      LoggerFactory.getLogger(DeltaMinimizer.class);

  private final Solver solver;
  private final Strictness strictness;
  private final boolean memo;

  /** Creates a minimizer that runs trials with a given solver, and reads its
   * settings from the solver's configuration. */
  public DeltaMinimizer(Solver solver) {
    this.solver = requireNonNull(solver, "solver");
    final SolverConfig config = solver.config;
    this.strictness =
        config.enumValue(Prop.MINIMIZE_STRICTNESS, Strictness.class);
    this.memo = config.booleanValue(Prop.MINIMIZE_MEMO);
  }

  /**
   * Minimizes a list of facts, and writes the result to a sink.
   *
   * <p>If solving all of the facts does not fail, returns a result with
   * status {@link MinimizeResult.Status#NOT_REPRODUCIBLE} and writes
   * nothing. Otherwise writes the minimized facts to the sink exactly once.
   */
  public MinimizeResult minimize(Program program, List<Fact> facts,
      FactSink sink) throws IOException {
    final Run run = new Run(program, ImmutableList.copyOf(facts));
    final MinimizeResult result = run.minimize();
    if (result.status == MinimizeResult.Status.MINIMIZED) {
      sink.write(result.facts);
    }
    return result;
  }

  /**
   * Minimizes a list of facts, and writes the result to a file.
   *
   * @throws ReproductionException if solving the facts does not fail
   */
  public MinimizeResult minimizeTo(Path path, Program program,
      List<Fact> facts) throws IOException {
    final MinimizeResult result =
        minimize(program, facts, FactSinks.of(path));
    if (result.status == MinimizeResult.Status.NOT_REPRODUCIBLE) {
      throw new ReproductionException(facts.size());
    }
    return result;
  }

  /** State of one minimization. Candidates are lists of positions in the
   * input, in ascending order. */
  private class Run {
    final Program program;
    final ImmutableList<Fact> facts;
    final Map<List<Integer>, Outcome> outcomes = new HashMap<>();
    int trials;
    @Nullable EvaluationException original;

    Run(Program program, ImmutableList<Fact> facts) {
      this.program = program;
      this.facts = facts;
    }

    MinimizeResult minimize() {
      final List<Integer> all = new ArrayList<>();
      for (int i = 0; i < facts.size(); i++) {
        all.add(i);
      }
      original = test(all).failure;
      if (original == null) {
        LOG.info("Failure not reproducible with {} facts", facts.size());
        return MinimizeResult.notReproducible(trials);
      }
      LOG.debug("Minimizing {} facts; failure: {}", facts.size(), original);

      List<Integer> current = all;
      int n = Math.min(2, current.size());
      while (!current.isEmpty()) {
        @Nullable List<Integer> next = null;
        for (List<Integer> chunk : Static.split(current, n)) {
          final List<Integer> complement = new ArrayList<>(current);
          complement.removeAll(chunk);
          if (reproduces(complement)) {
            next = complement;
            break;
          }
          if (n > 1 && reproduces(chunk)) {
            next = ImmutableList.copyOf(chunk);
            break;
          }
        }
        if (next != null) {
          current = next;
          n = Math.min(2, current.size());
          LOG.debug("Reduced to {} facts", current.size());
        } else if (n >= current.size()) {
          break;
        } else {
          n = Math.min(2 * n, current.size());
        }
      }

      final List<Fact> minimized = new ArrayList<>();
      current.forEach(i -> minimized.add(facts.get(i)));
      LOG.info("Minimized {} facts to {} in {} trials",
          facts.size(), minimized.size(), trials);
      return MinimizeResult.minimized(original, minimized, trials);
    }

    /** Returns whether a candidate fails in the same way as the original
     * facts. */
    boolean reproduces(List<Integer> candidate) {
      final @Nullable EvaluationException failure = test(candidate).failure;
      if (failure == null) {
        return false;
      }
      final EvaluationException original = requireNonNull(this.original);
      switch (strictness) {
        case ANY:
          return true;
        case SAME_KIND:
          return failure.getClass() == original.getClass();
        case SAME_CONSTRAINT:
          return failure.getClass() == original.getClass()
              && failure.constraint == original.constraint;
        default:
          throw new AssertionError(strictness);
      }
    }

    /** Solves a candidate, or returns the outcome of the earlier solve of
     * the same candidate. */
    Outcome test(List<Integer> candidate) {
      if (memo) {
        final Outcome outcome = outcomes.get(candidate);
        if (outcome != null) {
          return outcome;
        }
      }
      final List<Fact> candidateFacts = new ArrayList<>();
      candidate.forEach(i -> candidateFacts.add(facts.get(i)));
      ++trials;
      @Nullable EvaluationException failure = null;
      try {
        solver.solve(program, candidateFacts);
      } catch (EvaluationException e) {
        failure = e;
      }
      solver.tracer.onTrial(candidateFacts, failure);
      final Outcome outcome = new Outcome(failure);
      if (memo) {
        outcomes.put(ImmutableList.copyOf(candidate), outcome);
      }
      return outcome;
    }
  }

  /** Result of solving a candidate. */
  private static class Outcome {
    final @Nullable EvaluationException failure;

    Outcome(@Nullable EvaluationException failure) {
      this.failure = failure;
    }
  }
}

// End DeltaMinimizer.java
