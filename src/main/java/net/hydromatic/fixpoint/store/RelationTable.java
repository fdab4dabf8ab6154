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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.fixpoint.ast.Symbol;

/** Extent of a relation: a set of facts. Facts are never removed. */
class RelationTable extends Table {
  private final List<ImmutableList<Object>> rows = new ArrayList<>();
  private final Set<ImmutableList<Object>> members = new HashSet<>();

  RelationTable(Symbol symbol) {
    super(symbol);
  }

  @Override
  int size() {
    return rows.size();
  }

  @Override
  ImmutableList<Object> row(int id) {
    return rows.get(id);
  }

  @Override
  boolean mutableRows() {
    return false;
  }

  /** Adds a fact; returns whether it was not already present. */
  boolean insert(ImmutableList<Object> fact) {
    if (!members.add(fact)) {
      return false;
    }
    rows.add(fact);
    ++version;
    onAppend(rows.size() - 1);
    return true;
  }

  boolean contains(List<Object> fact) {
    return members.contains(fact);
  }
}

// End RelationTable.java
