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
package net.hydromatic.fixpoint.store;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.fixpoint.ast.LatticeOps;
import net.hydromatic.fixpoint.ast.Program;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.solve.Statistics;
import org.junit.jupiter.api.Test;

/** Tests {@link TableStore}, {@link Index} and {@link Columns}. */
public class TableStoreTest {
  /** Lattice whose values are integers, bottom is "infinity", and merging
   * takes the minimum. */
  static final LatticeOps DIST =
      LatticeOps.of(Integer.MAX_VALUE,
          (Integer a, Integer b) -> a <= b, Math::min, Math::max);

  private static List<Object> list(Object... values) {
    return ImmutableList.copyOf(values);
  }

  private static <E> List<E> toList(Iterable<E> iterable) {
    final List<E> list = new ArrayList<>();
    iterable.forEach(list::add);
    return list;
  }

  @Test void testInsertIsIdempotent() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final TableStore store = new TableStore(b.build(), false);
    assertThat(store.insert(edge, list(1, 2)), is(true));
    assertThat(store.insert(edge, list(1, 2)), is(false));
    assertThat(store.insert(edge, list(2, 3)), is(true));
    assertThat(store.size(edge), is(2));
    assertThat(store.version(), is(2));
    assertThat(store.contains(edge, list(1, 2)), is(true));
    assertThat(store.contains(edge, list(3, 1)), is(false));
  }

  /** Merging 5, then 3, then 10 into the same key leaves 3. */
  @Test void testLatticeMerge() {
    final Program.Builder b = Program.builder();
    final Symbol dist = b.lattice("Dist", 2, DIST);
    final TableStore store = new TableStore(b.build(), false);
    assertThat(store.latticeValue(dist, list(1)), is(Integer.MAX_VALUE));
    assertThat(store.merge(dist, list(1), 5), is(true));
    assertThat(store.latticeValue(dist, list(1)), is(5));
    assertThat(store.merge(dist, list(1), 3), is(true));
    assertThat(store.latticeValue(dist, list(1)), is(3));
    assertThat(store.merge(dist, list(1), 10), is(false));
    assertThat(store.latticeValue(dist, list(1)), is(3));
    assertThat(store.size(dist), is(1));
    assertThat(store.rows(dist), hasToString("[[1, 3]]"));
  }

  /** Merging bottom into an absent key stores nothing. */
  @Test void testMergeBottom() {
    final Program.Builder b = Program.builder();
    final Symbol dist = b.lattice("Dist", 2, DIST);
    final TableStore store = new TableStore(b.build(), false);
    assertThat(store.merge(dist, list(7), Integer.MAX_VALUE), is(false));
    assertThat(store.size(dist), is(0));
  }

  @Test void testWrongKind() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final Symbol dist = b.lattice("Dist", 2, DIST);
    final TableStore store = new TableStore(b.build(), false);
    assertThrows(IllegalArgumentException.class,
        () -> store.merge(edge, list(1), 2));
    assertThrows(IllegalArgumentException.class,
        () -> store.insert(dist, list(1, 2)));
    assertThrows(IllegalArgumentException.class,
        () -> store.insert(edge, list(1, 2, 3)));
    assertThrows(IllegalArgumentException.class,
        () -> store.insert(Symbol.relation("Other", 1), list(1)));
  }

  /** An index is built on the first lookup that needs it, and is extended,
   * not rebuilt, as rows are added. */
  @Test void testLazyIndex() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final TableStore store = new TableStore(b.build(), false);
    store.insert(edge, list(1, 2));
    store.insert(edge, list(1, 3));
    store.insert(edge, list(2, 3));
    assertThat(store.indexCount(edge), is(0));

    // Scans do not need an index
    assertThat(toList(store.lookup(edge, Columns.EMPTY, list())), hasSize(3));
    assertThat(store.indexCount(edge), is(0));

    final Columns c0 = Columns.of(0);
    assertThat(toList(store.lookup(edge, c0, list(1))),
        hasToString("[[1, 2], [1, 3]]"));
    assertThat(store.indexCount(edge), is(1));

    store.insert(edge, list(1, 4));
    assertThat(toList(store.lookup(edge, c0, list(1))),
        hasToString("[[1, 2], [1, 3], [1, 4]]"));
    assertThat(store.indexCount(edge), is(1));

    assertThat(toList(store.lookup(edge, Columns.of(0, 1), list(2, 3))),
        hasToString("[[2, 3]]"));
    assertThat(toList(store.lookup(edge, Columns.of(1), list(5))), hasSize(0));
    assertThat(store.indexCount(edge), is(3));
  }

  @Test void testEagerIndex() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    b.index(edge, 1);
    final Program program = b.build();
    assertThat(new TableStore(program, true).indexCount(edge), is(1));
    assertThat(new TableStore(program, false).indexCount(edge), is(0));
  }

  /** A lookup sees the rows that existed when it was made, however many
   * times it is iterated. */
  @Test void testStableLookup() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final TableStore store = new TableStore(b.build(), false);
    store.insert(edge, list(1, 2));
    final Iterable<ImmutableList<Object>> all =
        store.lookup(edge, Columns.EMPTY, list());
    final Iterable<ImmutableList<Object>> ones =
        store.lookup(edge, Columns.of(0), list(1));
    store.insert(edge, list(1, 3));
    assertThat(toList(all), hasToString("[[1, 2]]"));
    assertThat(toList(ones), hasToString("[[1, 2]]"));
    assertThat(toList(all), hasSize(1));

    // Iterating and inserting into a relation at the same time is fine
    final Iterator<ImmutableList<Object>> iterator =
        store.lookup(edge, Columns.EMPTY, list()).iterator();
    assertThat(iterator.next(), hasToString("[1, 2]"));
    store.insert(edge, list(5, 6));
    assertThat(iterator.next(), hasToString("[1, 3]"));
    assertThat(iterator.hasNext(), is(false));
  }

  /** Changing a lattice while iterating over it fails. */
  @Test void testLatticeIterationFailsFast() {
    final Program.Builder b = Program.builder();
    final Symbol dist = b.lattice("Dist", 2, DIST);
    final TableStore store = new TableStore(b.build(), false);
    store.merge(dist, list(1), 5);
    store.merge(dist, list(2), 5);
    final Iterator<ImmutableList<Object>> iterator =
        store.lookup(dist, Columns.EMPTY, list()).iterator();
    assertThat(iterator.next(), hasToString("[1, 5]"));
    store.merge(dist, list(2), 4);
    assertThrows(ConcurrentModificationException.class, iterator::next);
  }

  @Test void testDeltas() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final Symbol dist = b.lattice("Dist", 2, DIST);
    final TableStore store = new TableStore(b.build(), false);
    store.insert(edge, list(1, 2));
    store.merge(dist, list(1), 5);
    store.merge(dist, list(2), 8);
    ImmutableMap<Symbol, Delta> deltas = store.takeDeltas();
    assertThat(deltas.keySet(), hasToString("[Edge, Dist]"));
    assertThat(deltas.get(dist).size(), is(2));

    store.insert(edge, list(1, 2));
    store.merge(dist, list(2), 3);
    store.merge(dist, list(2), 2);
    deltas = store.takeDeltas();
    assertThat(deltas.keySet(), hasToString("[Dist]"));
    final Delta delta = deltas.get(dist);
    assertThat(delta.size(), is(1));
    assertThat(toList(store.lookup(dist, delta, Columns.EMPTY, list())),
        hasToString("[[2, 2]]"));
    assertThat(store.takeDeltas().isEmpty(), is(true));

    assertThat(toList(store.lookup(dist, Columns.of(0), list(1))),
        hasToString("[[1, 5]]"));
  }

  @Test void testSnapshot() {
    final Program.Builder b = Program.builder();
    final Symbol edge = b.relation("Edge", 2);
    final TableStore store = new TableStore(b.build(), false);
    store.insert(edge, list(2, 1));
    store.insert(edge, list(1, 2));
    final Statistics statistics = new Statistics(ImmutableList.of(), 0, 2, 0);
    assertThat(store.snapshot(statistics).getRelation("Edge"),
        hasToString("[[1, 2], [2, 1]]"));
    assertThrows(IllegalStateException.class,
        () -> store.insert(edge, list(3, 3)));
    assertThrows(IllegalStateException.class,
        () -> store.snapshot(statistics));
  }

  @Test void testColumns() {
    final Columns columns = Columns.of(2, 0);
    assertThat(columns, hasToString("[0, 2]"));
    assertThat(columns.size(), is(2));
    assertThat(columns.max(), is(2));
    assertThat(columns.contains(1), is(false));
    assertThat(columns.with(1), is(Columns.of(0, 1, 2)));
    assertThat(Columns.EMPTY.max(), is(-1));
    assertThat(columns.project(list("a", "b", "c")), hasToString("[a, c]"));
  }
}

// End TableStoreTest.java
