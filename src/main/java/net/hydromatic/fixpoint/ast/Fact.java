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
import net.hydromatic.fixpoint.eval.Values;

/**
 * A fact: a symbol and a list of values, one per attribute.
 *
 * <p>For a lattice, the last value is the lattice value.
 */
public final class Fact {
  public final Symbol symbol;
  public final ImmutableList<Object> values;

  private Fact(Symbol symbol, ImmutableList<Object> values) {
    this.symbol = requireNonNull(symbol, "symbol");
    this.values = requireNonNull(values, "values");
    checkArgument(
        values.size() == symbol.arity,
        "fact %s has %s values but its symbol has arity %s",
        symbol.name,
        values.size(),
        symbol.arity);
  }

  public static Fact of(Symbol symbol, Object... values) {
    return new Fact(symbol, ImmutableList.copyOf(values));
  }

  /** Creates a fact from a list of values. Unlike {@link #of}, a list is
   * never mistaken for a single value. */
  public static Fact ofList(Symbol symbol, List<?> values) {
    return new Fact(symbol, ImmutableList.copyOf(values));
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, values);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Fact
            && symbol.equals(((Fact) o).symbol)
            && values.equals(((Fact) o).values);
  }

  /** Returns the fact in literal syntax, e.g. {@code Edge(1, "a")}. */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(symbol.name).append('(');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      Values.appendLiteral(buf, values.get(i));
    }
    return buf.append(')').toString();
  }
}

// End Fact.java
