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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Set of column ordinals; the columns that are bound in a lookup.
 *
 * <p>An access pattern is identified by its bound columns, so each distinct
 * {@code Columns} value of a table has at most one index.
 */
public final class Columns {
  public static final Columns EMPTY = new Columns(0L);

  private final long mask;

  private Columns(long mask) {
    this.mask = mask;
  }

  /** Creates a set of columns. */
  public static Columns of(int... columns) {
    long mask = 0L;
    for (int column : columns) {
      checkArgument(column >= 0 && column < 64, "invalid column %s", column);
      mask |= 1L << column;
    }
    return new Columns(mask);
  }

  /** Creates a set of columns. */
  public static Columns of(List<Integer> columns) {
    return of(columns.stream().mapToInt(i -> i).toArray());
  }

  /** Returns a set of columns with one column added. */
  public Columns with(int column) {
    checkArgument(column >= 0 && column < 64, "invalid column %s", column);
    return new Columns(mask | (1L << column));
  }

  public boolean contains(int column) {
    return column >= 0 && column < 64 && (mask & (1L << column)) != 0;
  }

  public boolean isEmpty() {
    return mask == 0L;
  }

  public int size() {
    return Long.bitCount(mask);
  }

  /** Returns the highest column ordinal, or -1 if empty. */
  public int max() {
    return 63 - Long.numberOfLeadingZeros(mask);
  }

  /** Returns the column ordinals in ascending order. */
  public ImmutableList<Integer> toList() {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (long m = mask; m != 0L; m &= m - 1) {
      b.add(Long.numberOfTrailingZeros(m));
    }
    return b.build();
  }

  /** Projects the bound columns out of a row. */
  public ImmutableList<Object> project(List<Object> row) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (long m = mask; m != 0L; m &= m - 1) {
      b.add(row.get(Long.numberOfTrailingZeros(m)));
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Long.hashCode(mask);
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Columns && mask == ((Columns) o).mask;
  }

  @Override
  public String toString() {
    return toList().toString();
  }
}

// End Columns.java
