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
package net.hydromatic.fixpoint.solve;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Statistics about a solve. */
public final class Statistics {
  /** Number of rounds evaluated in each stratum, in stratum order. */
  public final ImmutableList<Integer> rounds;
  /** Number of times a constraint's head was instantiated. */
  public final long derivations;
  /** Number of facts and lattice entries in the model. */
  public final int factCount;
  /** Elapsed time of the solve, in nanoseconds. */
  public final long elapsedNanos;

  public Statistics(
      List<Integer> rounds, long derivations, int factCount, long elapsedNanos) {
    this.rounds = ImmutableList.copyOf(rounds);
    this.derivations = derivations;
    this.factCount = factCount;
    this.elapsedNanos = elapsedNanos;
  }

  /** Returns the number of strata evaluated. */
  public int strata() {
    return rounds.size();
  }

  /** Returns the total number of rounds over all strata. */
  public int totalRounds() {
    return rounds.stream().mapToInt(i -> i).sum();
  }

  @Override
  public String toString() {
    return "strata: " + strata()
        + ", rounds: " + rounds
        + ", derivations: " + derivations
        + ", facts: " + factCount
        + ", elapsed: " + elapsedNanos / 1_000_000 + " ms";
  }
}

// End Statistics.java
