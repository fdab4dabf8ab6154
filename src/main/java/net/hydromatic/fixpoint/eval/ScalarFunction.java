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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Function;

/**
 * A function over runtime values, called by filter literals and by term
 * expressions.
 *
 * <p>The body is supplied by the host and is opaque to the solver. Instances
 * are obtained from a {@link FunctionRegistry}, which checks their purity.
 */
public final class ScalarFunction {
  public final String name;
  public final Purity purity;
  private final Function<List<Object>, Object> body;

  ScalarFunction(
      String name, Purity purity, Function<List<Object>, Object> body) {
    this.name = requireNonNull(name, "name");
    this.purity = requireNonNull(purity, "purity");
    this.body = requireNonNull(body, "body");
  }

  /**
   * Calls this function.
   *
   * <p>Any exception thrown by the body propagates unchanged.
   */
  public Object apply(List<Object> args) {
    return requireNonNull(body.apply(args), () -> name + " returned null");
  }

  @Override
  public String toString() {
    return name;
  }

  /** Whether a function has side effects. */
  public enum Purity {
    /** No side effects; the result depends only on the arguments. */
    PURE,
    /** Has side effects, or a result that is not a function of arguments. */
    IMPURE
  }
}

// End ScalarFunction.java
