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
package net.hydromatic.fixpoint.util;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns the last element of a list.
   *
   * @throws java.lang.IndexOutOfBoundsException if the list is empty
   */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Returns every element of a list but its last element. */
  public static <E> List<E> skipLast(List<E> list) {
    return list.subList(0, list.size() - 1);
  }

  /**
   * Splits a list into {@code n} contiguous chunks whose sizes differ by at
   * most one. Earlier chunks are the larger ones.
   */
  public static <E> ImmutableList<List<E>> split(List<E> list, int n) {
    if (n < 1 || n > Math.max(list.size(), 1)) {
      throw new IllegalArgumentException(
          "cannot split " + list.size() + " elements into " + n + " chunks");
    }
    final ImmutableList.Builder<List<E>> b = ImmutableList.builder();
    final int size = list.size() / n;
    final int remainder = list.size() % n;
    int start = 0;
    for (int i = 0; i < n; i++) {
      final int end = start + size + (i < remainder ? 1 : 0);
      b.add(list.subList(start, end));
      start = end;
    }
    return b.build();
  }
}

// End Static.java
