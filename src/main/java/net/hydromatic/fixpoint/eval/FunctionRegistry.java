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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import net.hydromatic.fixpoint.eval.ScalarFunction.Purity;

/**
 * Immutable registry of the scalar functions a program may call.
 *
 * <p>Created once by a {@link Builder} bound to a {@link SolverConfig}. The
 * builder refuses to register an {@link Purity#IMPURE impure} function unless
 * the configuration enables {@link Prop#IMPURE}, so an impure call can never
 * happen silently.
 */
public final class FunctionRegistry {
  public final SolverConfig config;
  private final ImmutableMap<String, ScalarFunction> functions;

  private FunctionRegistry(
      SolverConfig config, ImmutableMap<String, ScalarFunction> functions) {
    this.config = config;
    this.functions = functions;
  }

  /** Creates a builder. */
  public static Builder builder(SolverConfig config) {
    return new Builder(config);
  }

  /**
   * Returns the function with a given name.
   *
   * @throws IllegalArgumentException if there is no such function
   */
  public ScalarFunction lookup(String name) {
    final ScalarFunction function = functions.get(name);
    if (function == null) {
      throw new IllegalArgumentException("unknown function " + name);
    }
    return function;
  }

  /** Returns the names of the registered functions, in registration order. */
  public Iterable<String> names() {
    return functions.keySet();
  }

  /** Builder for {@link FunctionRegistry}. */
  public static class Builder {
    private final SolverConfig config;
    private final Map<String, ScalarFunction> functions =
        new LinkedHashMap<>();

    Builder(SolverConfig config) {
      this.config = requireNonNull(config, "config");
    }

    /**
     * Registers a function.
     *
     * @throws IllegalStateException if the function is impure and impure
     *     functions are not enabled
     * @throws IllegalArgumentException if a function with the same name is
     *     already registered
     */
    public Builder register(
        String name, Purity purity, Function<List<Object>, Object> body) {
      if (purity == Purity.IMPURE && !config.booleanValue(Prop.IMPURE)) {
        throw new IllegalStateException(
            "Illegal registration of impure function " + name
                + "; requires property " + Prop.IMPURE.camelName);
      }
      checkArgument(
          !functions.containsKey(name), "duplicate function %s", name);
      functions.put(name, new ScalarFunction(name, purity, body));
      return this;
    }

    /** Registers a pure function of one argument. */
    public Builder pure1(String name, Function<Object, Object> body) {
      return register(name, Purity.PURE, args -> body.apply(args.get(0)));
    }

    /** Registers a pure function of two arguments. */
    public Builder pure2(String name, BiFunction<Object, Object, Object> body) {
      return register(
          name, Purity.PURE, args -> body.apply(args.get(0), args.get(1)));
    }

    public FunctionRegistry build() {
      return new FunctionRegistry(config, ImmutableMap.copyOf(functions));
    }
  }
}

// End FunctionRegistry.java
