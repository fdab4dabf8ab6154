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

import static net.hydromatic.fixpoint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Ast.Var;
import net.hydromatic.fixpoint.eval.FunctionRegistry;
import net.hydromatic.fixpoint.eval.ScalarFunction;
import net.hydromatic.fixpoint.eval.SolverConfig;
import org.junit.jupiter.api.Test;

/** Tests {@link Ast}, {@link AstBuilder}, {@link Symbol}, {@link Fact} and
 * {@link Program.Builder}. */
public class AstTest {
  private static final ScalarFunction PLUS =
      FunctionRegistry.builder(SolverConfig.DEFAULT)
          .pure2("plus", (a, b) -> (Integer) a + (Integer) b)
          .build()
          .lookup("plus");

  private final Var x = ast.var("x");
  private final Var y = ast.var("y");

  @Test void testUnparse() {
    final Symbol edge = Symbol.relation("Edge", 2);
    final Symbol cost = Symbol.relation("Cost", 2);
    final Symbol items = Symbol.relation("Items", 1);
    assertThat(
        ast.constraint(ast.head(cost, x, ast.apply(PLUS, x, ast.literal(1))),
            ast.atom(edge, x, ast.wildcard()), ast.not(edge, x, x),
            ast.notEqual(x, y), ast.atom(items, y), ast.loop(x, y),
            ast.filter(PLUS, x, y)),
        hasToString("Cost(x, plus(x, 1)) :- Edge(x, _), !Edge(x, x), "
            + "x != y, Items(y), x <- y, plus(x, y)."));
    assertThat(ast.constraint(ast.falseHead(), ast.atom(edge, x, y)),
        hasToString("false :- Edge(x, y)."));
    assertThat(ast.fact(edge, "a", 1), hasToString("Edge(\"a\", 1)."));
    assertThat(ast.constraint(ast.trueHead(), ImmutableList.of()),
        hasToString("true."));
  }

  @Test void testInvalid() {
    final Symbol edge = Symbol.relation("Edge", 2);
    assertThrows(IllegalArgumentException.class,
        () -> ast.atom(edge, x));
    assertThrows(IllegalArgumentException.class,
        () -> ast.head(edge, x, ast.wildcard()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.atom(edge, x, ast.apply(PLUS, x, y)));
    assertThrows(IllegalArgumentException.class,
        () -> Fact.of(edge, 1));
  }

  @Test void testSymbol() {
    final LatticeOps ops =
        LatticeOps.of(0, (Integer a, Integer b) -> a <= b, Math::max,
            Math::min);
    final Symbol dist = Symbol.lattice("Dist", 3, ops);
    assertThat(dist.isLattice(), is(true));
    assertThat(dist.keyArity(), is(2));
    assertThat(dist.latticeOps().isBottom(0), is(true));
    assertThat(dist.latticeOps().equivalent(3, 3), is(true));
    assertThat(Symbol.relation("Edge", 2).keyArity(), is(2));
    assertThrows(IllegalStateException.class,
        () -> Symbol.relation("Edge", 2).latticeOps());
    assertThat(dist.withIndex(ImmutableList.of(1)).indexHints,
        hasToString("[[1]]"));
    assertThat(dist.withIndex(ImmutableList.of(1)).equals(dist), is(true));
  }

  @Test void testProgramBuilder() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    assertThrows(IllegalArgumentException.class,
        () -> b.relation("Edge", 3));
    final Symbol other = Symbol.relation("Other", 2);
    assertThrows(IllegalArgumentException.class,
        () -> b.add(ast.constraint(ast.head(other, x, y),
            ast.atom(edge, x, y))));
    final Constraint c =
        ast.constraint(ast.head(edge, y, x), ast.atom(edge, x, y))
            .withName("symmetric");
    final Program program = b.add(c).build();
    assertThat(program.symbol("Edge"), is(edge));
    assertThat(program.contains(other), is(false));
    assertThat(program.constraints.get(0).name, is("symmetric"));
    assertThrows(IllegalArgumentException.class,
        () -> program.symbol("Other"));

    // If any stratum is given, every symbol needs one
    final Program.Builder b2 = Program.builder();
    final Symbol p = b2.relation("P", 1);
    b2.relation("Q", 1);
    b2.stratum(p, 0);
    assertThrows(IllegalArgumentException.class, b2::build);
  }
}

// End AstTest.java
