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

import java.util.List;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.store.TableStore;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Called on various events during solving and minimization.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called when evaluation of a stratum starts. */
  void onStratum(int stratum, List<Constraint> constraints);

  /**
   * Called at the end of each round of a stratum, after the round's
   * derivations have been applied. The store must only be read.
   */
  void onRound(int stratum, int round, TableStore store);

  /**
   * Called after the delta minimizer has solved a candidate set of facts, with
   * the failure it raised, or null if the solve succeeded.
   */
  void onTrial(List<Fact> candidate, @Nullable EvaluationException failure);
}

// End Tracer.java
