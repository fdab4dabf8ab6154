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
package net.hydromatic.fixpoint.eval;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Tuple value.
 *
 * <p>Not a {@link List}, so that a loop literal never mistakes a tuple for a
 * collection to iterate over.
 */
public final class Tuple {
  public final ImmutableList<Object> elements;

  private Tuple(ImmutableList<Object> elements) {
    this.elements = elements;
  }

  public static Tuple of(Object... elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static Tuple of(List<?> elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public int size() {
    return elements.size();
  }

  public Object get(int i) {
    return elements.get(i);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tuple && elements.equals(((Tuple) o).elements);
  }

  @Override
  public String toString() {
    return Values.toLiteral(this);
  }
}

// End Tuple.java
