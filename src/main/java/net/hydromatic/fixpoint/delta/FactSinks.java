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

import static java.util.Objects.requireNonNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.hydromatic.fixpoint.ast.Fact;

/** Utilities for {@link FactSink}. */
public abstract class FactSinks {
  private FactSinks() {}

  /**
   * Returns a sink that writes one fact per line, in the form
   * {@code Name(v1, v2)}, to a writer. The writer is flushed but not closed.
   */
  public static FactSink of(Writer writer) {
    requireNonNull(writer, "writer");
    return facts -> {
      write(writer, facts);
      writer.flush();
    };
  }

  /**
   * Returns a sink that writes one fact per line to a file, in UTF-8,
   * replacing any existing contents.
   */
  public static FactSink of(Path path) {
    requireNonNull(path, "path");
    return facts -> {
      try (BufferedWriter writer =
               Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
        write(writer, facts);
      }
    };
  }

  private static void write(Writer writer, List<Fact> facts)
      throws IOException {
    for (Fact fact : facts) {
      writer.write(fact.toString());
      writer.write('\n');
    }
  }
}

// End FactSinks.java
