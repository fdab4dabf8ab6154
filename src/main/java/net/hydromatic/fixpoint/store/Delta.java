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

import java.util.Arrays;

/**
 * Rows of one table that changed during one round of evaluation: facts that
 * were inserted into a relation, or keys of a lattice whose value increased.
 *
 * <p>Immutable; ids are in ascending order.
 */
public final class Delta {
  public static final Delta EMPTY = new Delta(new int[0]);

  private final int[] ids;

  private Delta(int[] ids) {
    this.ids = ids;
  }

  static Delta of(int[] ids) {
    final int[] sorted = Arrays.stream(ids).distinct().sorted().toArray();
    return sorted.length == 0 ? EMPTY : new Delta(sorted);
  }

  public int size() {
    return ids.length;
  }

  public boolean isEmpty() {
    return ids.length == 0;
  }

  int id(int i) {
    return ids[i];
  }

  @Override
  public String toString() {
    return Arrays.toString(ids);
  }
}

// End Delta.java
