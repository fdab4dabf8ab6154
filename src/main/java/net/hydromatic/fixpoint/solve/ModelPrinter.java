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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fixpoint.ast.Symbol;
import net.hydromatic.fixpoint.eval.Values;

/**
 * Renders the contents of a symbol in a {@link Model} as an ASCII table.
 *
 * <p>For example, relation {@code Edge} with facts {@code Edge(1, 2)} and
 * {@code Edge(2, 3)} prints as
 *
 * <pre>{@code
 * Edge
 * +----+----+
 * | c0 | c1 |
 * +----+----+
 * | 1  | 2  |
 * | 2  | 3  |
 * +----+----+
 * }</pre>
 *
 * <p>Columns of a relation are named {@code c0}, {@code c1}, etc.; the last
 * column of a lattice is named {@code value}. Rows are in
 * {@link Values#ORDERING} order.
 */
public class ModelPrinter {
  private ModelPrinter() {}

  /** Prints the symbol with a given name, or "No such name: ..." if the model
   * has no such symbol. */
  public static String print(Model model, String name) {
    return print(new StringBuilder(), model, name).toString();
  }

  /** Appends a symbol to a buffer. */
  public static StringBuilder print(StringBuilder buf, Model model, String name) {
    final Symbol symbol;
    try {
      symbol = model.symbol(name);
    } catch (IllegalArgumentException e) {
      return buf.append(e.getMessage()).append('\n');
    }
    final List<String> header = new ArrayList<>();
    for (int i = 0; i < symbol.arity; i++) {
      header.add(symbol.isLattice() && i == symbol.arity - 1
          ? "value" : "c" + i);
    }
    final List<List<String>> cells = new ArrayList<>();
    for (ImmutableList<Object> row : model.rows(symbol)) {
      final List<String> line = new ArrayList<>();
      row.forEach(value -> line.add(Values.toLiteral(value)));
      cells.add(line);
    }

    final int[] widths = new int[symbol.arity];
    for (int i = 0; i < symbol.arity; i++) {
      widths[i] = header.get(i).length();
      for (List<String> line : cells) {
        widths[i] = Math.max(widths[i], line.get(i).length());
      }
    }

    buf.append(symbol.name).append('\n');
    separator(buf, widths);
    row(buf, widths, header);
    separator(buf, widths);
    cells.forEach(line -> row(buf, widths, line));
    return separator(buf, widths);
  }

  private static StringBuilder separator(StringBuilder buf, int[] widths) {
    buf.append('+');
    for (int width : widths) {
      buf.append(Strings.repeat("-", width + 2)).append('+');
    }
    return buf.append('\n');
  }

  private static void row(StringBuilder buf, int[] widths, List<String> line) {
    buf.append('|');
    for (int i = 0; i < widths.length; i++) {
      buf.append(' ')
          .append(Strings.padEnd(line.get(i), widths[i], ' '))
          .append(" |");
    }
    buf.append('\n');
  }
}

// End ModelPrinter.java
