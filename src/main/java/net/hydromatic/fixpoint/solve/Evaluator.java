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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.fixpoint.ast.Ast.Apply;
import net.hydromatic.fixpoint.ast.Ast.Atom;
import net.hydromatic.fixpoint.ast.Ast.AtomHead;
import net.hydromatic.fixpoint.ast.Ast.BodyLiteral;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Ast.Filter;
import net.hydromatic.fixpoint.ast.Ast.Literal;
import net.hydromatic.fixpoint.ast.Ast.Loop;
import net.hydromatic.fixpoint.ast.Ast.NotEqual;
import net.hydromatic.fixpoint.ast.Ast.Term;
import net.hydromatic.fixpoint.ast.Ast.Var;
import net.hydromatic.fixpoint.ast.LatticeOps;
import net.hydromatic.fixpoint.ast.Op;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.compile.StratificationException;
import net.hydromatic.fixpoint.eval.ScalarFunction;
import net.hydromatic.fixpoint.eval.Tuple;
import net.hydromatic.fixpoint.store.Columns;
import net.hydromatic.fixpoint.store.Delta;
import net.hydromatic.fixpoint.store.TableStore;
import net.hydromatic.fixpoint.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Semi-naive fixpoint evaluation of one stratum at a time.
 *
 * <p>The first round of a stratum evaluates every constraint against the full
 * extents of the symbols it reads. Each later round evaluates, for each
 * constraint and each positive atom over a symbol of the stratum that changed
 * in the previous round, the variant of the constraint in which that atom
 * reads only the changed rows (the delta) and every other atom reads the full
 * extent. The stratum is complete when a round changes nothing.
 *
 * <p>Within a round, constraints only read the store; the facts and lattice
 * values they derive are buffered, and applied in order when the round ends.
 * Evaluation order is deterministic: constraints in program order, body
 * literals left to right, and rows in the order they were added.
 */
class Evaluator {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  private final Program program;
  private final TableStore store;
  private final Tracer tracer;

  /** Number of times a head has been instantiated. */
  long derivations;

  Evaluator(Program program, TableStore store, Tracer tracer) {
    this.program = requireNonNull(program, "program");
    this.store = requireNonNull(store, "store");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /**
   * Evaluates a stratum until no constraint derives anything new. Earlier
   * strata must already be complete.
   *
   * @return the number of rounds
   * @throws StratificationException if a constraint reads a symbol of a later
   *     stratum, or negates a symbol that is not in an earlier stratum
   * @throws UnsatisfiableConstraintException if the body of a constraint with
   *     a false head is satisfied
   * @throws ScalarFunctionException if a scalar function or lattice operator
   *     throws
   */
  int evaluate(int stratum) {
    final List<Constraint> constraints = program.constraints(stratum);
    constraints.forEach(constraint -> checkStrata(constraint, stratum));
    tracer.onStratum(stratum, constraints);

    // Facts added before this stratum started are seen by the first round,
    // which reads full extents.
    store.takeDeltas();

    final List<Derivation> derivationList = new ArrayList<>();
    for (Constraint constraint : constraints) {
      new Frame(constraint, null, -1).evalBody(0, derivationList);
    }
    Map<Symbol, Delta> deltas = apply(derivationList);
    int round = 1;
    endRound(stratum, round, deltas);

    while (!deltas.isEmpty()) {
      derivationList.clear();
      for (Constraint constraint : constraints) {
        final ImmutableList<BodyLiteral> body = constraint.body;
        for (int i = 0; i < body.size(); i++) {
          final BodyLiteral literal = body.get(i);
          if (literal.op == Op.ATOM) {
            final Delta delta = deltas.get(((Atom) literal).symbol);
            if (delta != null && !delta.isEmpty()) {
              new Frame(constraint, delta, i).evalBody(0, derivationList);
            }
          }
        }
      }
      deltas = apply(derivationList);
      ++round;
      endRound(stratum, round, deltas);
    }
    return round;
  }

  private void endRound(int stratum, int round, Map<Symbol, Delta> deltas) {
    if (LOG.isDebugEnabled()) {
      final Map<String, Integer> sizes = new LinkedHashMap<>();
      deltas.forEach((symbol, delta) -> sizes.put(symbol.name, delta.size()));
      LOG.debug("Stratum {} round {}: delta {}", stratum, round, sizes);
    }
    tracer.onRound(stratum, round, store);
  }

  /** Checks that a constraint reads only symbols that it may read. */
  private void checkStrata(Constraint constraint, int stratum) {
    for (Atom atom : constraint.atoms()) {
      final int atomStratum = program.stratum(atom.symbol);
      if (atom.negated() && atomStratum >= stratum) {
        throw new StratificationException(
            String.format(
                "Negated symbol %s is in stratum %d, not earlier than %d",
                atom.symbol, atomStratum, stratum),
            atom.symbol,
            constraint);
      }
      if (atomStratum > stratum) {
        throw new StratificationException(
            String.format(
                "Symbol %s is in stratum %d, later than %d",
                atom.symbol, atomStratum, stratum),
            atom.symbol,
            constraint);
      }
    }
  }

  /**
   * Applies derivations to the store, in order, and returns the rows that
   * changed.
   */
  private Map<Symbol, Delta> apply(List<Derivation> derivationList) {
    for (Derivation d : derivationList) {
      if (d.symbol.isLattice()) {
        try {
          store.merge(
              d.symbol, Static.skipLast(d.values), Static.last(d.values));
        } catch (RuntimeException e) {
          throw new ScalarFunctionException(
              "lub of " + d.symbol, d.constraint, requireNonNull(d.bindings), e);
        }
      } else {
        store.insert(d.symbol, d.values);
      }
    }
    return store.takeDeltas();
  }

  /** A fact or lattice value derived by a constraint, not yet applied. */
  private static class Derivation {
    final Constraint constraint;
    final Symbol symbol;
    final List<Object> values;
    /** Bindings, retained for lattices so that a failing merge can report
     * them. */
    final @Nullable ImmutableMap<String, Object> bindings;

    Derivation(
        Constraint constraint,
        Symbol symbol,
        List<Object> values,
        @Nullable ImmutableMap<String, Object> bindings) {
      this.constraint = constraint;
      this.symbol = symbol;
      this.values = values;
      this.bindings = bindings;
    }
  }

  /**
   * State of the evaluation of one variant of a constraint: the constraint,
   * which body literal (if any) reads a delta, and the current variable
   * bindings.
   */
  private class Frame {
    final Constraint constraint;
    final @Nullable Delta delta;
    final int deltaOrdinal;
    final Map<String, Object> env = new LinkedHashMap<>();

    Frame(Constraint constraint, @Nullable Delta delta, int deltaOrdinal) {
      this.constraint = constraint;
      this.delta = delta;
      this.deltaOrdinal = deltaOrdinal;
    }

    /** Evaluates body literals from {@code i} onwards, then the head. */
    void evalBody(int i, List<Derivation> out) {
      if (i == constraint.body.size()) {
        evalHead(out);
        return;
      }
      final BodyLiteral literal = constraint.body.get(i);
      switch (literal.op) {
        case ATOM:
          matchAtom((Atom) literal, i == deltaOrdinal ? delta : null, i, out);
          return;

        case NOT_ATOM:
          if (!exists((Atom) literal)) {
            evalBody(i + 1, out);
          }
          return;

        case FILTER:
          final Filter filter = (Filter) literal;
          if (test(filter)) {
            evalBody(i + 1, out);
          }
          return;

        case NOT_EQUAL:
          final NotEqual notEqual = (NotEqual) literal;
          if (!Objects.equals(eval(notEqual.left), eval(notEqual.right))) {
            evalBody(i + 1, out);
          }
          return;

        case LOOP:
          final Loop loop = (Loop) literal;
          for (Object element : elements(eval(loop.collection))) {
            bindAndContinue(loop.var, element, i, out);
          }
          return;

        default:
          throw new AssertionError("unknown op " + literal.op);
      }
    }

    /** Binds a variable to a value, evaluates the rest of the body, and
     * unbinds. If the variable is already bound, checks that the values are
     * equal instead. */
    private void bindAndContinue(
        Var var, Object value, int i, List<Derivation> out) {
      final @Nullable Object current = env.get(var.name);
      if (current != null) {
        if (current.equals(value)) {
          evalBody(i + 1, out);
        }
        return;
      }
      env.put(var.name, value);
      try {
        evalBody(i + 1, out);
      } finally {
        env.remove(var.name);
      }
    }

    /** Evaluates a positive atom; continues once per matching row. */
    private void matchAtom(
        Atom atom, @Nullable Delta delta, int i, List<Derivation> out) {
      final Symbol symbol = atom.symbol;
      final int keyArity = symbol.keyArity();
      Columns columns = Columns.EMPTY;
      final List<Object> key = new ArrayList<>();
      for (int j = 0; j < keyArity; j++) {
        final @Nullable Object value = boundValue(atom.terms.get(j));
        if (value != null) {
          columns = columns.with(j);
          key.add(value);
        }
      }
      final Iterable<ImmutableList<Object>> rows =
          delta == null
              ? store.lookup(symbol, columns, key)
              : store.lookup(symbol, delta, columns, key);
      final List<String> added = new ArrayList<>();
      for (ImmutableList<Object> row : rows) {
        if (bindKeys(atom, row, added)) {
          if (symbol.isLattice()) {
            matchLatticeValue(atom, Static.last(row), i, out);
          } else {
            evalBody(i + 1, out);
          }
        }
        added.forEach(env::remove);
        added.clear();
      }
    }

    /** Binds the unbound variables among an atom's key terms to the values
     * of a row. Returns false if a bound term does not match. */
    private boolean bindKeys(Atom atom, List<Object> row, List<String> added) {
      for (int j = 0; j < atom.symbol.keyArity(); j++) {
        final Term term = atom.terms.get(j);
        final Object value = row.get(j);
        switch (term.op) {
          case WILDCARD:
            break;
          case LITERAL:
            if (!((Literal) term).value.equals(value)) {
              return false;
            }
            break;
          case VAR:
            final String name = ((Var) term).name;
            final @Nullable Object current = env.get(name);
            if (current == null) {
              env.put(name, value);
              added.add(name);
            } else if (!current.equals(value)) {
              return false;
            }
            break;
          default:
            throw new AssertionError("unexpected term " + term);
        }
      }
      return true;
    }

    /**
     * Matches the value term of a lattice atom against a stored value.
     *
     * <p>An unbound variable binds to the stored value. A bound value matches
     * if its greatest lower bound with the stored value is not bottom; a
     * variable is then rebound to that greatest lower bound while the rest of
     * the body is evaluated.
     */
    private void matchLatticeValue(
        Atom atom, Object stored, int i, List<Derivation> out) {
      final Term term = Static.last(atom.terms);
      if (term.op == Op.WILDCARD) {
        evalBody(i + 1, out);
        return;
      }
      final @Nullable Object bound = boundValue(term);
      if (bound == null) {
        bindAndContinue((Var) term, stored, i, out);
        return;
      }
      final LatticeOps ops = atom.symbol.latticeOps();
      final Object glb;
      try {
        glb = ops.glb(bound, stored);
        if (ops.isBottom(glb)) {
          return;
        }
      } catch (RuntimeException e) {
        throw new ScalarFunctionException(
            "glb of " + atom.symbol, constraint, bindings(), e);
      }
      if (term.op != Op.VAR) {
        evalBody(i + 1, out);
        return;
      }
      final String name = ((Var) term).name;
      env.put(name, glb);
      try {
        evalBody(i + 1, out);
      } finally {
        env.put(name, bound);
      }
    }

    /**
     * Returns whether any row matches a negated atom. Negated atoms read only
     * complete strata.
     */
    private boolean exists(Atom atom) {
      final Symbol symbol = atom.symbol;
      Columns columns = Columns.EMPTY;
      final List<Object> key = new ArrayList<>();
      for (int j = 0; j < symbol.keyArity(); j++) {
        final @Nullable Object value = boundValue(atom.terms.get(j));
        if (value != null) {
          columns = columns.with(j);
          key.add(value);
        }
      }
      final @Nullable Object bound =
          symbol.isLattice() ? boundValue(Static.last(atom.terms)) : null;
      for (ImmutableList<Object> row : store.lookup(symbol, columns, key)) {
        if (bound == null) {
          return true;
        }
        try {
          if (symbol.latticeOps().leq(bound, Static.last(row))) {
            return true;
          }
        } catch (RuntimeException e) {
          throw new ScalarFunctionException(
              "leq of " + symbol, constraint, bindings(), e);
        }
      }
      return false;
    }

    /** Instantiates the head. */
    private void evalHead(List<Derivation> out) {
      ++derivations;
      switch (constraint.head.op) {
        case TRUE_HEAD:
          return;

        case FALSE_HEAD:
          throw new UnsatisfiableConstraintException(constraint, bindings());

        case ATOM_HEAD:
          final AtomHead head = (AtomHead) constraint.head;
          final List<Object> values = new ArrayList<>(head.terms.size());
          for (Term term : head.terms) {
            values.add(eval(term));
          }
          out.add(
              new Derivation(
                  constraint,
                  head.symbol,
                  values,
                  head.symbol.isLattice() ? bindings() : null));
          return;

        default:
          throw new AssertionError("unknown head " + constraint.head);
      }
    }

    /** Returns the value of a term if it is a literal or a bound variable,
     * otherwise null. */
    private @Nullable Object boundValue(Term term) {
      switch (term.op) {
        case LITERAL:
          return ((Literal) term).value;
        case VAR:
          return env.get(((Var) term).name);
        default:
          return null;
      }
    }

    /** Evaluates a term. All of its variables must be bound. */
    private Object eval(Term term) {
      switch (term.op) {
        case LITERAL:
          return ((Literal) term).value;

        case VAR:
          final @Nullable Object value = env.get(((Var) term).name);
          if (value == null) {
            throw new IllegalStateException(
                "variable " + term + " is not bound in " + constraint);
          }
          return value;

        case APPLY:
          final Apply apply = (Apply) term;
          return call(apply.function, apply.args);

        default:
          throw new AssertionError("cannot evaluate " + term);
      }
    }

    /** Calls a scalar function. */
    private Object call(ScalarFunction function, List<Term> args) {
      final List<Object> values = evalAll(args);
      try {
        return function.apply(values);
      } catch (RuntimeException e) {
        throw new ScalarFunctionException(
            function.name, constraint, bindings(), e);
      }
    }

    /** Calls the predicate of a filter. A result that is not a boolean
     * fails like an exception thrown by the predicate. */
    private boolean test(Filter filter) {
      final List<Object> values = evalAll(filter.args);
      try {
        return (Boolean) filter.function.apply(values);
      } catch (RuntimeException e) {
        throw new ScalarFunctionException(
            filter.function.name, constraint, bindings(), e);
      }
    }

    private List<Object> evalAll(List<Term> args) {
      final List<Object> values = new ArrayList<>(args.size());
      for (Term arg : args) {
        values.add(eval(arg));
      }
      return values;
    }

    private ImmutableMap<String, Object> bindings() {
      return ImmutableMap.copyOf(env);
    }

    /** Returns the elements of a collection value. A map yields its entries
     * as (key, value) tuples. */
    private Iterable<?> elements(Object collection) {
      if (collection instanceof Iterable) {
        return (Iterable<?>) collection;
      }
      if (collection instanceof Map) {
        final List<Object> entries = new ArrayList<>();
        ((Map<?, ?>) collection)
            .forEach((k, v) -> entries.add(Tuple.of(k, v)));
        return entries;
      }
      throw new IllegalStateException(
          "loop over value that is not a collection: " + collection
              + " in " + constraint);
    }
  }
}

// End Evaluator.java
