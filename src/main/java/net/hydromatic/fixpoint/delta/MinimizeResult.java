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
package net.hydromatic.fixpoint.delta;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.solve.EvaluationException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of {@link DeltaMinimizer#minimize}. */
public final class MinimizeResult {
  public final Status status;
  /** Failure raised by the original facts; null if not reproducible. */
  public final @Nullable EvaluationException failure;
  /** Minimized facts, in the order they occurred in the input; empty if not
   * reproducible. */
  public final ImmutableList<Fact> facts;
  /** Number of solves performed, including the first, on all facts. */
  public final int trials;

  private MinimizeResult(
      Status status,
      @Nullable EvaluationException failure,
      List<Fact> facts,
      int trials) {
    this.status = status;
    this.failure = failure;
    this.facts = ImmutableList.copyOf(facts);
    this.trials = trials;
  }

  static MinimizeResult minimized(
      EvaluationException failure, List<Fact> facts, int trials) {
    return new MinimizeResult(Status.MINIMIZED, failure, facts, trials);
  }

  static MinimizeResult notReproducible(int trials) {
    return new MinimizeResult(
        Status.NOT_REPRODUCIBLE, null, ImmutableList.of(), trials);
  }

  @Override
  public String toString() {
    return status + " " + facts + " after " + trials + " trials";
  }

  /** Status of a minimization. */
  public enum Status {
    /** The input failed, and was reduced to a 1-minimal failing subset. */
    MINIMIZED,
    /** The input did not fail; nothing was written. */
    NOT_REPRODUCIBLE
  }
}

// End MinimizeResult.java
