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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.fixpoint.eval.ScalarFunction;
import net.hydromatic.fixpoint.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract syntax tree of a compiled constraint program.
 *
 * <p>A program is a list of {@link Constraint constraints}; each has a
 * {@link Head} and a body of {@link BodyLiteral literals}. Literals and heads
 * contain {@link Term terms}.
 *
 * <p>The hierarchy is closed: every node has an {@link Op}, and consumers
 * switch on it. Create nodes using {@link AstBuilder}.
 */
public class Ast {
  private Ast() {}

  /** Base class for all nodes. */
  public abstract static class Node {
    public final Op op;

    Node(Op op) {
      this.op = requireNonNull(op, "op");
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf);
  }

  /** Term: a variable, wildcard, literal or function application. */
  public abstract static class Term extends Node {
    Term(Op op) {
      super(op);
    }
  }

  /** Variable term. */
  public static final class Var extends Term {
    public final String name;

    Var(String name) {
      super(Op.VAR);
      this.name = requireNonNull(name, "name");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && name.equals(((Var) o).name);
    }
  }

  /** Wildcard term, "_"; matches any value. Allowed only in body atoms. */
  public static final class Wildcard extends Term {
    static final Wildcard INSTANCE = new Wildcard();

    private Wildcard() {
      super(Op.WILDCARD);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append('_');
    }
  }

  /** Literal term. */
  public static final class Literal extends Term {
    public final Object value;

    Literal(Object value) {
      super(Op.LITERAL);
      this.value = requireNonNull(value, "value");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return Values.appendLiteral(buf, value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && value.equals(((Literal) o).value);
    }
  }

  /** Term that applies a scalar function to arguments. */
  public static final class Apply extends Term {
    public final ScalarFunction function;
    public final ImmutableList<Term> args;

    Apply(ScalarFunction function, ImmutableList<Term> args) {
      super(Op.APPLY);
      this.function = requireNonNull(function, "function");
      this.args = requireNonNull(args, "args");
      checkArgument(
          args.stream().noneMatch(arg -> arg.op == Op.WILDCARD),
          "wildcard is not allowed in a function argument");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf.append(function.name), args);
    }
  }

  /** A literal in the body of a constraint. */
  public abstract static class BodyLiteral extends Node {
    BodyLiteral(Op op) {
      super(op);
    }
  }

  /**
   * Positive or negative atom, such as {@code Edge(x, y)} or {@code
   * !Edge(x, 1)}.
   *
   * <p>Terms are variables, wildcards and literals. In an atom over a lattice,
   * the last term matches the lattice value.
   */
  public static final class Atom extends BodyLiteral {
    public final Symbol symbol;
    public final ImmutableList<Term> terms;

    Atom(Op op, Symbol symbol, ImmutableList<Term> terms) {
      super(op);
      checkArgument(op == Op.ATOM || op == Op.NOT_ATOM);
      this.symbol = requireNonNull(symbol, "symbol");
      this.terms = requireNonNull(terms, "terms");
      checkArity(symbol, terms);
      checkArgument(
          terms.stream().noneMatch(term -> term.op == Op.APPLY),
          "function application is not allowed in a body atom: %s",
          this);
    }

    public boolean negated() {
      return op == Op.NOT_ATOM;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (op == Op.NOT_ATOM) {
        buf.append('!');
      }
      return unparseList(buf.append(symbol.name), terms);
    }
  }

  /** Filter literal; calls a boolean-valued scalar function. */
  public static final class Filter extends BodyLiteral {
    public final ScalarFunction function;
    public final ImmutableList<Term> args;

    Filter(ScalarFunction function, ImmutableList<Term> args) {
      super(Op.FILTER);
      this.function = requireNonNull(function, "function");
      this.args = requireNonNull(args, "args");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf.append(function.name), args);
    }
  }

  /** Inequality guard between two variables, {@code x != y}. */
  public static final class NotEqual extends BodyLiteral {
    public final Var left;
    public final Var right;

    NotEqual(Var left, Var right) {
      super(Op.NOT_EQUAL);
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return right.unparse(left.unparse(buf).append(" != "));
    }
  }

  /**
   * Loop literal, {@code x <- e}; binds a variable to each element of a
   * collection.
   */
  public static final class Loop extends BodyLiteral {
    public final Var var;
    public final Term collection;

    Loop(Var var, Term collection) {
      super(Op.LOOP);
      this.var = requireNonNull(var, "var");
      this.collection = requireNonNull(collection, "collection");
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return collection.unparse(var.unparse(buf).append(" <- "));
    }
  }

  /** Head of a constraint. */
  public abstract static class Head extends Node {
    Head(Op op) {
      super(op);
    }
  }

  /** Head that derives a fact, or merges a value into a lattice. */
  public static final class AtomHead extends Head {
    public final Symbol symbol;
    public final ImmutableList<Term> terms;

    AtomHead(Symbol symbol, ImmutableList<Term> terms) {
      super(Op.ATOM_HEAD);
      this.symbol = requireNonNull(symbol, "symbol");
      this.terms = requireNonNull(terms, "terms");
      checkArity(symbol, terms);
      checkArgument(
          terms.stream().noneMatch(term -> term.op == Op.WILDCARD),
          "wildcard is not allowed in a head: %s",
          this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf.append(symbol.name), terms);
    }
  }

  /**
   * Head that is always true or always false.
   *
   * <p>A constraint with a false head is an integrity assertion: if its body
   * is ever satisfied, the solve fails.
   */
  public static final class BoolHead extends Head {
    static final BoolHead TRUE = new BoolHead(Op.TRUE_HEAD);
    static final BoolHead FALSE = new BoolHead(Op.FALSE_HEAD);

    private BoolHead(Op op) {
      super(op);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(op == Op.TRUE_HEAD ? "true" : "false");
    }
  }

  /** Constraint, {@code head :- body}. */
  public static final class Constraint extends Node {
    public final Head head;
    public final ImmutableList<BodyLiteral> body;
    public final @Nullable String name;

    Constraint(
        Head head, ImmutableList<BodyLiteral> body, @Nullable String name) {
      super(Op.CONSTRAINT);
      this.head = requireNonNull(head, "head");
      this.body = requireNonNull(body, "body");
      this.name = name;
    }

    /** Returns the symbol of the head, or null if the head is true/false. */
    public @Nullable Symbol headSymbol() {
      return head instanceof AtomHead ? ((AtomHead) head).symbol : null;
    }

    /** Returns the atoms in the body. */
    public List<Atom> atoms() {
      final ImmutableList.Builder<Atom> atoms = ImmutableList.builder();
      for (BodyLiteral literal : body) {
        if (literal.op.isAtom()) {
          atoms.add((Atom) literal);
        }
      }
      return atoms.build();
    }

    /** Returns a copy of this constraint with the given name. */
    public Constraint withName(String name) {
      return new Constraint(head, body, requireNonNull(name));
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      head.unparse(buf);
      for (int i = 0; i < body.size(); i++) {
        body.get(i).unparse(buf.append(i == 0 ? " :- " : ", "));
      }
      return buf.append('.');
    }
  }

  private static void checkArity(Symbol symbol, List<Term> terms) {
    checkArgument(
        terms.size() == symbol.arity,
        "%s has arity %s but %s terms were given",
        symbol.name,
        symbol.arity,
        terms.size());
  }

  private static StringBuilder unparseList(
      StringBuilder buf, List<? extends Node> nodes) {
    buf.append('(');
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      nodes.get(i).unparse(buf);
    }
    return buf.append(')');
  }
}

// End Ast.java
