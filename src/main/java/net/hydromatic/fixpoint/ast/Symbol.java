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
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A relation or lattice table.
 *
 * <p>A lattice's last attribute holds the lattice value; the other attributes
 * are its key.
 */
public final class Symbol {
  public final String name;
  public final Kind kind;
  public final int arity;
  public final @Nullable LatticeOps ops;

  /**
   * Column sets to index. Each element is a sorted list of column ordinals.
   */
  public final ImmutableList<ImmutableList<Integer>> indexHints;

  private Symbol(
      String name,
      Kind kind,
      int arity,
      @Nullable LatticeOps ops,
      ImmutableList<ImmutableList<Integer>> indexHints) {
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
    this.arity = arity;
    this.ops = ops;
    this.indexHints = requireNonNull(indexHints, "indexHints");
    checkArgument(
        (kind == Kind.LATTICE) == (ops != null),
        "a lattice, and only a lattice, has operators");
    checkArgument(
        arity >= (kind == Kind.LATTICE ? 1 : 0),
        "invalid arity %s for %s",
        arity,
        name);
    checkArgument(arity <= 64, "too many attributes in %s", name);
  }

  /** Creates a relation symbol. */
  public static Symbol relation(String name, int arity) {
    return new Symbol(name, Kind.RELATION, arity, null, ImmutableList.of());
  }

  /**
   * Creates a lattice symbol. {@code arity} includes the value attribute.
   */
  public static Symbol lattice(String name, int arity, LatticeOps ops) {
    return new Symbol(
        name, Kind.LATTICE, arity, requireNonNull(ops), ImmutableList.of());
  }

  /**
   * Returns a copy of this symbol with an index hint on the given columns.
   */
  public Symbol withIndex(List<Integer> columns) {
    final ImmutableList<Integer> sorted =
        ImmutableList.sortedCopyOf(columns);
    for (int column : sorted) {
      checkArgument(
          column >= 0 && column < arity,
          "invalid column %s for %s",
          column,
          name);
    }
    return new Symbol(
        name,
        kind,
        arity,
        ops,
        ImmutableList.<ImmutableList<Integer>>builder()
            .addAll(indexHints)
            .add(sorted)
            .build());
  }

  public boolean isLattice() {
    return kind == Kind.LATTICE;
  }

  /** Returns the lattice operators; throws if this is not a lattice. */
  public LatticeOps latticeOps() {
    if (ops == null) {
      throw new IllegalStateException(name + " is not a lattice");
    }
    return ops;
  }

  /** Number of key attributes: all but the last of a lattice, all of a
   * relation. */
  public int keyArity() {
    return kind == Kind.LATTICE ? arity - 1 : arity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, arity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && name.equals(((Symbol) o).name)
            && kind == ((Symbol) o).kind
            && arity == ((Symbol) o).arity;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Kind of symbol. */
  public enum Kind {
    /** Set of facts. */
    RELATION,
    /** Map from key tuple to lattice value. */
    LATTICE
  }
}

// End Symbol.java
