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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Fact;
import net.hydromatic.fixpoint.eval.Values;
import net.hydromatic.fixpoint.util.FixpointException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Failure while evaluating a constraint, or while loading an initial fact.
 *
 * <p>Carries the constraint and the variable bindings at the point of
 * failure; or, if the failure happened while loading the initial facts, the
 * fact being loaded. Evaluation is deterministic, so solving the same program with the
 * same facts raises the same failure.
 */
public abstract class EvaluationException extends RuntimeException
    implements FixpointException {
  /** The constraint being evaluated; null if the failure happened while
   * loading initial facts. */
  public final @Nullable Constraint constraint;
  /** Variable bindings, in the order the variables were bound. */
  public final ImmutableMap<String, Object> bindings;
  /** The initial fact being loaded, or null. */
  public final @Nullable Fact fact;

  protected EvaluationException(
      String message,
      Constraint constraint,
      ImmutableMap<String, Object> bindings,
      @Nullable Throwable cause) {
    super(message, cause);
    this.constraint = requireNonNull(constraint, "constraint");
    this.bindings = requireNonNull(bindings, "bindings");
    this.fact = null;
  }

  protected EvaluationException(String message, Fact fact, Throwable cause) {
    super(message, cause);
    this.constraint = null;
    this.bindings = ImmutableMap.of();
    this.fact = requireNonNull(fact, "fact");
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(getMessage());
    if (fact != null) {
      return buf.append(" while loading fact ").append(fact);
    }
    buf.append(" in constraint ").append(constraint);
    if (!bindings.isEmpty()) {
      buf.append(" with ");
      final int start = buf.length();
      bindings.forEach(
          (name, value) -> {
            if (buf.length() > start) {
              buf.append(", ");
            }
            Values.appendLiteral(buf.append(name).append(" = "), value);
          });
    }
    return buf;
  }
}

// End EvaluationException.java
