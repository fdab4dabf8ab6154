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
package net.hydromatic.fixpoint.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.fixpoint.ast.Ast.Constraint;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.util.FixpointException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error that indicates that a program is not correctly stratified.
 *
 * <p>Either a dependency cycle passes through a negative literal, or a
 * negative literal reads a symbol that is not in a strictly earlier stratum
 * than the constraint containing it. Both are breaches of the contract with
 * the compiler that produced the program, and are not recoverable.
 */
public class StratificationException extends RuntimeException
    implements FixpointException {
  public final Symbol symbol;
  public final @Nullable Constraint constraint;

  public StratificationException(
      String message, Symbol symbol, @Nullable Constraint constraint) {
    super(message);
    this.symbol = requireNonNull(symbol, "symbol");
    this.constraint = constraint;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Stratification error: ").append(getMessage());
    if (constraint != null) {
      buf.append(" in constraint ").append(constraint);
    }
    return buf;
  }
}

// End StratificationException.java
