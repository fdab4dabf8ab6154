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

import net.hydromatic.fixpoint.util.FixpointException;

/**
 * Thrown by {@link DeltaMinimizer#minimizeTo} when solving the facts to be
 * minimized does not fail.
 */
public class ReproductionException extends RuntimeException
    implements FixpointException {
  /** Number of facts that were solved without failure. */
  public final int factCount;

  public ReproductionException(int factCount) {
    super("Failure not reproducible with " + factCount + " facts");
    this.factCount = factCount;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(getMessage());
  }
}

// End ReproductionException.java
