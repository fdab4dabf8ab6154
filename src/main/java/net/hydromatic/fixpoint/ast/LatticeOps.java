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

import static java.util.Objects.requireNonNull;

import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;

/**
 * Operators of a bounded join-semilattice: bottom element, partial order,
 * least upper bound, greatest lower bound.
 *
 * <p>The operators are supplied by the host. The solver trusts, and does not
 * check, that {@code lub} is monotone, commutative, associative and
 * idempotent with respect to {@code leq}, and that the lattice has finite
 * height over the values that occur during a solve. If not, the fixpoint
 * computation may not terminate.
 */
public final class LatticeOps {
  public final Object bottom;
  private final BiPredicate<Object, Object> leq;
  private final BinaryOperator<Object> lub;
  private final BinaryOperator<Object> glb;

  private LatticeOps(
      Object bottom,
      BiPredicate<Object, Object> leq,
      BinaryOperator<Object> lub,
      BinaryOperator<Object> glb) {
    this.bottom = requireNonNull(bottom, "bottom");
    this.leq = requireNonNull(leq, "leq");
    this.lub = requireNonNull(lub, "lub");
    this.glb = requireNonNull(glb, "glb");
  }

  /** Creates a LatticeOps whose operators work on values of type {@code T}. */
  @SuppressWarnings("unchecked")
  public static <T> LatticeOps of(
      T bottom,
      BiPredicate<? super T, ? super T> leq,
      BinaryOperator<T> lub,
      BinaryOperator<T> glb) {
    return new LatticeOps(
        bottom,
        (BiPredicate<Object, Object>) leq,
        (BinaryOperator<Object>) lub,
        (BinaryOperator<Object>) glb);
  }

  public boolean leq(Object v1, Object v2) {
    return leq.test(v1, v2);
  }

  public Object lub(Object v1, Object v2) {
    return requireNonNull(lub.apply(v1, v2), "lub returned null");
  }

  public Object glb(Object v1, Object v2) {
    return requireNonNull(glb.apply(v1, v2), "glb returned null");
  }

  /** Returns whether two values are equal under the partial order. */
  public boolean equivalent(Object v1, Object v2) {
    return leq(v1, v2) && leq(v2, v1);
  }

  /** Returns whether a value is equivalent to bottom. */
  public boolean isBottom(Object v) {
    return equivalent(v, bottom);
  }
}

// End LatticeOps.java
