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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.store.TableStore;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action when a stratum starts,
   * then calls the underlying tracer.
   */
  public static Tracer withOnStratum(Tracer tracer, IntConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStratum(int stratum, List<Constraint> constraints) {
        consumer.accept(stratum);
        super.onStratum(stratum, constraints);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action at the end of each round,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRound(Tracer tracer, Consumer<TableStore> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRound(int stratum, int round, TableStore store) {
        consumer.accept(store);
        super.onRound(stratum, round, store);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each trial of the delta
   * minimizer, then calls the underlying tracer.
   */
  public static Tracer withOnTrial(
      Tracer tracer, BiConsumer<List<Fact>, @Nullable EvaluationException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTrial(
          List<Fact> candidate, @Nullable EvaluationException failure) {
        consumer.accept(candidate, failure);
        super.onTrial(candidate, failure);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStratum(int stratum, List<Constraint> constraints) {}

    @Override
    public void onRound(int stratum, int round, TableStore store) {}

    @Override
    public void onTrial(
        List<Fact> candidate, @Nullable EvaluationException failure) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStratum(int stratum, List<Constraint> constraints) {
      tracer.onStratum(stratum, constraints);
    }

    @Override
    public void onRound(int stratum, int round, TableStore store) {
      tracer.onRound(stratum, round, store);
    }

    @Override
    public void onTrial(
        List<Fact> candidate, @Nullable EvaluationException failure) {
      tracer.onTrial(candidate, failure);
    }
  }
}

// End Tracers.java
