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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.fixpoint.ast.Ast.Apply;
import net.hydromatic.fixpoint.ast.Ast.Atom;
import net.hydromatic.fixpoint.ast.Ast.AtomHead;
import net.hydromatic.fixpoint.ast.Ast.BodyLiteral;
import net.hydromatic.fixpoint.ast.Ast.BoolHead;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Ast.Filter;
import net.hydromatic.fixpoint.ast.Ast.Head;
import net.hydromatic.fixpoint.ast.Ast.Literal;
import net.hydromatic.fixpoint.ast.Ast.Loop;
import net.hydromatic.fixpoint.ast.Ast.NotEqual;
import net.hydromatic.fixpoint.ast.Ast.Term;
import net.hydromatic.fixpoint.ast.Ast.Var;
import net.hydromatic.fixpoint.ast.Ast.Wildcard;
import net.hydromatic.fixpoint.eval.ScalarFunction;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a variable term. */
  public Var var(String name) {
    return new Var(name);
  }

  /** Returns the wildcard term. */
  public Term wildcard() {
    return Wildcard.INSTANCE;
  }

  /** Creates a literal term. */
  public Literal literal(Object value) {
    return new Literal(value);
  }

  /** Creates a term that applies a function. */
  public Apply apply(ScalarFunction function, Term... args) {
    return new Apply(function, ImmutableList.copyOf(args));
  }

  /** Creates a positive atom. */
  public Atom atom(Symbol symbol, Term... terms) {
    return new Atom(Op.ATOM, symbol, ImmutableList.copyOf(terms));
  }

  /** Creates a negative atom. */
  public Atom not(Symbol symbol, Term... terms) {
    return new Atom(Op.NOT_ATOM, symbol, ImmutableList.copyOf(terms));
  }

  /** Creates a filter literal. */
  public Filter filter(ScalarFunction function, Term... args) {
    return new Filter(function, ImmutableList.copyOf(args));
  }

  /** Creates an inequality guard. */
  public NotEqual notEqual(Var left, Var right) {
    return new NotEqual(left, right);
  }

  /** Creates a loop literal. */
  public Loop loop(Var var, Term collection) {
    return new Loop(var, collection);
  }

  /** Creates a head that derives a fact. */
  public AtomHead head(Symbol symbol, Term... terms) {
    return new AtomHead(symbol, ImmutableList.copyOf(terms));
  }

  /** Returns the head that is always true. */
  public Head trueHead() {
    return BoolHead.TRUE;
  }

  /** Returns the head that is always false. */
  public Head falseHead() {
    return BoolHead.FALSE;
  }

  /** Creates a constraint. */
  public Constraint constraint(Head head, BodyLiteral... body) {
    return new Constraint(head, ImmutableList.copyOf(body), null);
  }

  /** Creates a constraint. */
  public Constraint constraint(Head head, List<? extends BodyLiteral> body) {
    return new Constraint(head, ImmutableList.copyOf(body), null);
  }

  /** Creates a constraint with an empty body, equivalent to a fact. */
  public Constraint fact(Symbol symbol, Object... values) {
    final ImmutableList.Builder<Term> terms = ImmutableList.builder();
    for (Object value : values) {
      terms.add(literal(value));
    }
    return new Constraint(
        new AtomHead(symbol, terms.build()), ImmutableList.of(), null);
  }
}

// End AstBuilder.java
