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

import static net.hydromatic.fixpoint.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Ast.Var;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import org.junit.jupiter.api.Test;

/** Tests {@link Stratifier}. */
public class StratifierTest {
  private final Var x = ast.var("x");
  private final Var y = ast.var("y");

  /** A chain of negations needs one stratum per link; positive recursion
   * stays within a stratum. */
  @Test void testStrata() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final Symbol path = b.relation("Path", 2);
    final Symbol node = b.relation("Node", 1);
    final Symbol isolated = b.relation("Isolated", 1);
    final Symbol connected = b.relation("Connected", 1);
    final Constraint noIsolated =
        ast.constraint(ast.falseHead(), ast.atom(isolated, x));
    b.add(ast.constraint(ast.head(path, x, y), ast.atom(edge, x, y)),
        ast.constraint(ast.head(path, x, y), ast.atom(path, y, x)),
        ast.constraint(ast.head(isolated, x), ast.atom(node, x),
            ast.not(path, x, ast.wildcard())),
        ast.constraint(ast.head(connected, x), ast.atom(node, x),
            ast.not(isolated, x)),
        noIsolated);
    final Program program = b.build();
    assertThat(program.stratum(edge), is(0));
    assertThat(program.stratum(path), is(0));
    assertThat(program.stratum(node), is(0));
    assertThat(program.stratum(isolated), is(1));
    assertThat(program.stratum(connected), is(2));
    assertThat(program.stratumCount(), is(3));
    assertThat(program.symbols(1), hasToString("[Isolated]"));
    assertThat(program.constraints(0), hasToString("[Path(x, y) :- Edge(x, y)."
        + ", Path(x, y) :- Path(y, x).]"));
    assertThat(program.constraints(1).contains(noIsolated), is(true));
  }

  /** A recursive symbol may be negated from a later stratum. The recursion
   * is a positive cycle and does not make the program unstratifiable. */
  @Test void testNegationOfRecursiveSymbol() {
    final Program.Builder b = Program.builder();
    final Symbol node = b.relation("Node", 1);
    final Symbol edge = b.relation("Edge", 2);
    final Symbol reach = b.relation("Reach", 1);
    final Symbol unreached = b.relation("Unreached", 1);
    b.add(
        ast.constraint(ast.head(unreached, x), ast.atom(node, x),
            ast.not(reach, x)),
        ast.constraint(ast.head(reach, y), ast.atom(reach, x),
            ast.atom(edge, x, y)));
    final Program program = b.build();
    assertThat(program.stratum(reach), is(0));
    assertThat(program.stratum(unreached), is(1));
    assertThat(program.stratumCount(), is(2));

    // Negation inside a longer cycle is still rejected
    final Symbol p = Symbol.relation("P", 1);
    final Symbol q = Symbol.relation("Q", 1);
    final Symbol r = Symbol.relation("R", 1);
    final StratificationException e =
        assertThrows(StratificationException.class,
            () -> Stratifier.stratify(ImmutableList.of(p, q, r),
                ImmutableList.of(
                    ast.constraint(ast.head(p, x), ast.atom(q, x)),
                    ast.constraint(ast.head(q, x), ast.atom(r, x)),
                    ast.constraint(ast.head(r, x), ast.atom(node, x),
                        ast.not(p, x)))));
    assertThat(e.symbol, is(r));
  }

  @Test void testConstraintStratum() {
    final Symbol p = Symbol.relation("P", 1);
    final Symbol q = Symbol.relation("Q", 1);
    final ImmutableMap<Symbol, Integer> strata = ImmutableMap.of(p, 0, q, 2);
    assertThat(Stratifier.constraintStratum(
        ast.constraint(ast.trueHead(), ast.atom(p, x), ast.not(q, x)),
        strata), is(3));
    assertThat(Stratifier.constraintStratum(
        ast.constraint(ast.falseHead(), ast.atom(q, x)), strata), is(2));
    assertThat(Stratifier.constraintStratum(
        ast.constraint(ast.head(p, x), ast.atom(q, x)), strata), is(0));
  }

  @Test void testNegationCycle() {
    final Program.Builder b = Program.builder();
    final Symbol node = b.relation("Node", 1);
    final Symbol win = b.relation("Win", 1);
    final Symbol lose = b.relation("Lose", 1);
    b.add(
        ast.constraint(ast.head(win, x), ast.atom(node, x), ast.not(lose, x)),
        ast.constraint(ast.head(lose, x), ast.atom(node, x), ast.not(win, x)));
    final StratificationException e =
        assertThrows(StratificationException.class, b::build);
    assertThat(e.getMessage(),
        is("Program is not stratified. Negation cycle detected involving "
            + "symbol: Win"));
    assertThat(e.symbol, is(win));
  }

  @Test void testNegatedSelf() {
    final Symbol p = Symbol.relation("P", 1);
    final Symbol q = Symbol.relation("Q", 1);
    assertThrows(StratificationException.class,
        () -> Stratifier.stratify(ImmutableList.of(p, q),
            ImmutableList.of(
                ast.constraint(ast.head(p, x), ast.atom(q, x),
                    ast.not(p, x)))));
  }
}

// End StratifierTest.java
