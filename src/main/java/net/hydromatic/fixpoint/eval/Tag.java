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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of a tagged union: a constructor name and an optional payload.
 *
 * <p>For example, {@code Red} has no payload, and {@code Some(3)} has payload
 * 3.
 */
public final class Tag {
  public final String name;
  public final @Nullable Object payload;

  private Tag(String name, @Nullable Object payload) {
    this.name = requireNonNull(name, "name");
    this.payload = payload;
  }

  /** Creates a tag without a payload. */
  public static Tag of(String name) {
    return new Tag(name, null);
  }

  /** Creates a tag with a payload. */
  public static Tag of(String name, Object payload) {
    return new Tag(name, requireNonNull(payload, "payload"));
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, payload);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tag
            && name.equals(((Tag) o).name)
            && Objects.equals(payload, ((Tag) o).payload);
  }

  @Override
  public String toString() {
    return Values.toLiteral(this);
  }
}

// End Tag.java
