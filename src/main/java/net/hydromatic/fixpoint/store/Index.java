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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.List;

/**
 * Index on one access pattern of a table.
 *
 * <p>Maps the values of the bound columns to the ids of the rows that have
 * those values, in ascending id order. An index is derived from its table: it
 * is built from the table's rows the first time the pattern is queried, and
 * then extended as rows are added. It is never rebuilt.
 */
class Index {
  final Columns columns;
  private final ListMultimap<List<Object>, Integer> postings =
      ArrayListMultimap.create();

  Index(Columns columns) {
    this.columns = columns;
  }

  /** Adds a row. Ids must be added in ascending order. */
  void add(int id, List<Object> row) {
    postings.put(columns.project(row), id);
  }

  /** Returns the ids of rows whose bound columns have the given values. */
  List<Integer> get(List<Object> key) {
    return postings.get(key);
  }
}

// End Index.java
