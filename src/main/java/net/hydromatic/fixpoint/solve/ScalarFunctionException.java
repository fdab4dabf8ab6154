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

/**
 * Thrown when a scalar function or a lattice operator throws while a
 * constraint is being evaluated, or when a lattice operator throws while an
 * initial fact is merged into the store.
 *
 * <p>The exception thrown by the function is the {@link #getCause() cause},
 * unchanged.
 */
public class ScalarFunctionException extends EvaluationException {
  /** Name of the function or lattice operator that failed. */
  public final String functionName;

  public ScalarFunctionException(
      String functionName,
      Constraint constraint,
      ImmutableMap<String, Object> bindings,
      Throwable cause) {
    super(
        "Function " + functionName + " failed: " + cause,
        constraint,
        bindings,
        requireNonNull(cause, "cause"));
    this.functionName = requireNonNull(functionName, "functionName");
  }

  public ScalarFunctionException(
      String functionName, Fact fact, Throwable cause) {
    super(
        "Function " + functionName + " failed: " + cause,
        fact,
        requireNonNull(cause, "cause"));
    this.functionName = requireNonNull(functionName, "functionName");
  }
}

// End ScalarFunctionException.java
