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

import static net.hydromatic.fixpoint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.ast.LatticeOps;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.compile.StratificationException;
import net.hydromatic.fixpoint.eval.FunctionRegistry;
import net.hydromatic.fixpoint.eval.Prop;
import net.hydromatic.fixpoint.eval.SolverConfig;
import net.hydromatic.fixpoint.solve.ScalarFunctionException;
import net.hydromatic.fixpoint.solve.Solver;
import net.hydromatic.fixpoint.solve.Tracers;
import net.hydromatic.fixpoint.solve.UnsatisfiableConstraintException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests {@link DeltaMinimizer}. */
public class DeltaMinimizerTest {
  /** Program whose only constraint fails if both "a" and "c" are present. */
  private static class Fixture {
    final Symbol p;
    final Symbol q;
    final Constraint aAndC;
    final Program.Builder builder = Program.builder();
    final Fact a;
    final Fact b;
    final Fact c;

    Fixture() {
      p = builder.relation("P", 1);
      q = builder.relation("Q", 1);
      aAndC =
          ast.constraint(ast.falseHead(), ast.atom(p, ast.literal("a")),
              ast.atom(p, ast.literal("c")));
      builder.add(aAndC);
      a = Fact.of(p, "a");
      b = Fact.of(p, "b");
      c = Fact.of(p, "c");
    }

    List<Fact> facts() {
      return ImmutableList.of(a, b, c);
    }
  }

  /** Sink that remembers what it was asked to write. */
  private static class RecordingSink implements FactSink {
    final List<List<Fact>> writes = new ArrayList<>();

    @Override
    public void write(List<Fact> facts) {
      writes.add(ImmutableList.copyOf(facts));
    }
  }

  private static DeltaMinimizer minimizer(SolverConfig config) {
    return new DeltaMinimizer(Solver.create(config));
  }

  @Test void testMinimize() throws IOException {
    final Fixture f = new Fixture();
    final RecordingSink sink = new RecordingSink();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(f.builder.build(), f.facts(), sink);
    assertThat(result.status, is(MinimizeResult.Status.MINIMIZED));
    assertThat(result.facts, hasToString("[P(\"a\"), P(\"c\")]"));
    assertThat(result.failure,
        instanceOf(UnsatisfiableConstraintException.class));
    assertThat(result.trials, is(6));
    assertThat(sink.writes, hasSize(1));
    assertThat(sink.writes.get(0), is(result.facts));
  }

  /** The result is 1-minimal: removing any one fact makes the failure go
   * away. */
  @Test void testOneMinimal() throws IOException {
    final Fixture f = new Fixture();
    final Program program = f.builder.build();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(program, f.facts(), new RecordingSink());
    final Solver solver = Solver.create(SolverConfig.DEFAULT);
    for (Fact fact : result.facts) {
      final List<Fact> fewer = new ArrayList<>(result.facts);
      fewer.remove(fact);
      assertThat(solver.solve(program, fewer).facts(), hasSize(1));
    }
  }

  /** Without the memo, candidates that were tried before are solved
   * again. */
  @Test void testNoMemo() throws IOException {
    final Fixture f = new Fixture();
    final List<List<Fact>> trials = new ArrayList<>();
    final Solver solver =
        Solver.create(SolverConfig.DEFAULT.with(Prop.MINIMIZE_MEMO, false))
            .withTracer(
                Tracers.withOnTrial(Tracers.empty(),
                    (facts, failure) -> trials.add(facts)));
    final MinimizeResult result =
        new DeltaMinimizer(solver)
            .minimize(f.builder.build(), f.facts(), new RecordingSink());
    assertThat(result.facts, hasToString("[P(\"a\"), P(\"c\")]"));
    assertThat(result.trials, is(12));
    assertThat(trials, hasSize(12));
    assertThat(trials.get(0), is(f.facts()));
  }

  /** Minimized facts are in the order they were given. */
  @Test void testOrderPreserved() throws IOException {
    final Fixture f = new Fixture();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(f.builder.build(), ImmutableList.of(f.c, f.b, f.a),
                new RecordingSink());
    assertThat(result.facts, hasToString("[P(\"c\"), P(\"a\")]"));
  }

  @Test void testNotReproducible() throws IOException {
    final Fixture f = new Fixture();
    final RecordingSink sink = new RecordingSink();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(f.builder.build(), ImmutableList.of(f.a, f.b), sink);
    assertThat(result.status, is(MinimizeResult.Status.NOT_REPRODUCIBLE));
    assertThat(result.failure, nullValue());
    assertThat(result.facts, hasSize(0));
    assertThat(result.trials, is(1));
    assertThat(sink.writes, hasSize(0));
  }

  /** A failure that needs no facts minimizes to the empty set. */
  @Test void testEmpty() throws IOException {
    final Program.Builder b = Program.builder();
    final Symbol p = b.relation("P", 1);
    final Symbol q = b.relation("Q", 1);
    b.add(ast.fact(q, 1),
        ast.constraint(ast.falseHead(), ast.atom(q, ast.var("x"))));
    final RecordingSink sink = new RecordingSink();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(b.build(), ImmutableList.of(Fact.of(p, 1)), sink);
    assertThat(result.status, is(MinimizeResult.Status.MINIMIZED));
    assertThat(result.facts, hasSize(0));
    assertThat(sink.writes, hasToString("[[]]"));
  }

  /** Program with two failing constraints: {@code aAndC}, which fails first,
   * and another that fails if "b" is present. */
  private static Program twoFailures(Fixture f, boolean scalar) {
    final FunctionRegistry functions =
        FunctionRegistry.builder(SolverConfig.DEFAULT)
            .pure2("div", (x, y) -> (Integer) x / (Integer) y)
            .build();
    final Constraint bFails =
        scalar
            ? ast.constraint(
                ast.head(f.q,
                    ast.apply(functions.lookup("div"), ast.literal(1),
                        ast.literal(0))),
                ast.atom(f.p, ast.literal("b")))
            : ast.constraint(ast.falseHead(), ast.atom(f.p, ast.literal("b")));
    return f.builder.add(bFails).build();
  }

  @Test void testStrictnessAny() throws IOException {
    final Fixture f = new Fixture();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT)
            .minimize(twoFailures(f, false), f.facts(), new RecordingSink());
    assertThat(result.failure.constraint, is(f.aAndC));
    assertThat(result.facts, hasToString("[P(\"b\")]"));
  }

  @Test void testStrictnessSameConstraint() throws IOException {
    final Fixture f = new Fixture();
    final SolverConfig config =
        SolverConfig.DEFAULT.withLenient("minimizeStrictness",
            "same_constraint");
    final MinimizeResult result =
        minimizer(config)
            .minimize(twoFailures(f, false), f.facts(), new RecordingSink());
    assertThat(result.facts, hasToString("[P(\"a\"), P(\"c\")]"));
  }

  @Test void testStrictnessSameKind() throws IOException {
    final Fixture f = new Fixture();
    final MinimizeResult any =
        minimizer(SolverConfig.DEFAULT)
            .minimize(twoFailures(f, true), f.facts(), new RecordingSink());
    assertThat(any.facts, hasToString("[P(\"b\")]"));

    final Fixture f2 = new Fixture();
    final SolverConfig config =
        SolverConfig.DEFAULT.with(Prop.MINIMIZE_STRICTNESS,
            Prop.Strictness.SAME_KIND);
    final MinimizeResult sameKind =
        minimizer(config)
            .minimize(twoFailures(f2, true), f2.facts(), new RecordingSink());
    assertThat(sameKind.facts, hasToString("[P(\"a\"), P(\"c\")]"));
    assertThat(sameKind.failure,
        instanceOf(UnsatisfiableConstraintException.class));

    // The scalar failure on its own minimizes to "b"
    final Fixture f3 = new Fixture();
    final MinimizeResult scalar =
        minimizer(config)
            .minimize(twoFailures(f3, true), ImmutableList.of(f3.b, f3.c),
                new RecordingSink());
    assertThat(scalar.failure, instanceOf(ScalarFunctionException.class));
    assertThat(scalar.facts, hasToString("[P(\"b\")]"));
  }

  /** Both failing constraints are unsatisfiable, so the same-kind policy
   * accepts the failure on "b", and the same-constraint policy does not. */
  @Test void testStrictnessTwoUnsatisfiable() throws IOException {
    final Fixture f = new Fixture();
    final SolverConfig sameKind =
        SolverConfig.DEFAULT.with(Prop.MINIMIZE_STRICTNESS,
            Prop.Strictness.SAME_KIND);
    final MinimizeResult kind =
        minimizer(sameKind)
            .minimize(twoFailures(f, false), f.facts(), new RecordingSink());
    assertThat(kind.facts, hasToString("[P(\"b\")]"));
    assertThat(kind.failure.constraint, is(f.aAndC));

    final Fixture f2 = new Fixture();
    final SolverConfig sameConstraint =
        SolverConfig.DEFAULT.with(Prop.MINIMIZE_STRICTNESS,
            Prop.Strictness.SAME_CONSTRAINT);
    final Program program = twoFailures(f2, false);
    final MinimizeResult constraint =
        minimizer(sameConstraint)
            .minimize(program, f2.facts(), new RecordingSink());
    assertThat(constraint.facts, hasToString("[P(\"a\"), P(\"c\")]"));
    assertThat(constraint.failure.constraint, is(f2.aAndC));

    // Solving the minimized facts fails on the original constraint
    final UnsatisfiableConstraintException e =
        assertThrows(UnsatisfiableConstraintException.class,
            () -> Solver.create(SolverConfig.DEFAULT)
                .solve(program, constraint.facts));
    assertThat(e.constraint, is(f2.aAndC));
  }

  /** A lattice operator that fails while initial facts are loaded is a
   * failure like any other, and can be minimized. */
  @Test void testMinimizeLatticeFailure() throws IOException {
    final LatticeOps overflow =
        LatticeOps.of(0, (Integer x, Integer y) -> x <= y,
            (Integer x, Integer y) -> {
              if (x + y > 10) {
                throw new IllegalStateException("overflow");
              }
              return Math.max(x, y);
            },
            Math::min);
    final Program.Builder b = Program.builder();
    final Symbol l = b.lattice("L", 2, overflow);
    final List<Fact> facts =
        ImmutableList.of(Fact.of(l, 1, 4), Fact.of(l, 2, 3), Fact.of(l, 1, 9));
    final RecordingSink sink = new RecordingSink();
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT).minimize(b.build(), facts, sink);
    assertThat(result.status, is(MinimizeResult.Status.MINIMIZED));
    assertThat(result.facts, hasToString("[L(1, 4), L(1, 9)]"));
    assertThat(result.failure, instanceOf(ScalarFunctionException.class));
    assertThat(result.failure.constraint, nullValue());
    assertThat(result.failure.fact, is(Fact.of(l, 1, 9)));
    assertThat(sink.writes, hasSize(1));
  }

  /** A stratification error is not a failure to be minimized. */
  @Test void testStratificationIsFatal() {
    final Program.Builder b = Program.builder();
    final Symbol p = b.relation("P", 1);
    final Symbol q = b.relation("Q", 1);
    b.add(ast.constraint(ast.head(q, ast.var("x")), ast.atom(p, ast.var("x")),
        ast.not(q, ast.literal(0))));
    final Program program = b.stratum(p, 0).stratum(q, 0).build();
    final RecordingSink sink = new RecordingSink();
    assertThrows(StratificationException.class,
        () -> minimizer(SolverConfig.DEFAULT)
            .minimize(program, ImmutableList.of(Fact.of(p, 1)), sink));
    assertThat(sink.writes, hasSize(0));
  }

  @Test void testWriterSink() throws IOException {
    final Program.Builder b = Program.builder();
    final Symbol e = b.relation("E", 3);
    final StringWriter w = new StringWriter();
    FactSinks.of(w)
        .write(
            ImmutableList.of(Fact.of(e, 1, "x\"y", 'c'),
                Fact.of(e, true, ImmutableList.of(1, 2), 2.5)));
    assertThat(w.toString(),
        is("E(1, \"x\\\"y\", 'c')\nE(true, [1, 2], 2.5)\n"));
  }

  @Test void testMinimizeTo(@TempDir Path dir) throws IOException {
    final Fixture f = new Fixture();
    final Program program = f.builder.build();
    final Path path = dir.resolve("facts.txt");
    final MinimizeResult result =
        minimizer(SolverConfig.DEFAULT).minimizeTo(path, program, f.facts());
    assertThat(result.facts, hasSize(2));
    assertThat(Files.readAllLines(path, StandardCharsets.UTF_8),
        hasToString("[P(\"a\"), P(\"c\")]"));

    final Path path2 = dir.resolve("none.txt");
    final ReproductionException e =
        assertThrows(ReproductionException.class,
            () -> minimizer(SolverConfig.DEFAULT)
                .minimizeTo(path2, program, ImmutableList.of(f.b)));
    assertThat(e.getMessage(), is("Failure not reproducible with 1 facts"));
    assertThat(Files.exists(path2), is(false));
  }
}

// End DeltaMinimizerTest.java
