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

import com.google.common.collect.Ordering;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utilities for runtime values.
 *
 * <p>A value is one of {@link Boolean}, {@link Character}, {@link Integer},
 * {@link Long}, {@link BigInteger}, {@link Float}, {@link Double}, {@link
 * String}, {@link Unit}, {@link Tuple}, {@link Tag}, or an immutable {@link
 * List}, {@link Set} or {@link Map} of values.
 */
public class Values {
  private Values() {}

  /**
   * Total order over all values.
   *
   * <p>Values of different kinds are ordered by kind (unit, boolean, char,
   * number, string, tuple, tag, list, set, map). Numbers compare by numeric
   * value regardless of their Java class. Tuples, lists, sets and maps compare
   * element-wise; sets and maps by their sorted elements.
   */
  public static final Ordering<Object> ORDERING =
      Ordering.from(Values::compare);

  /** Returns the literal syntax of a value. */
  public static String toLiteral(Object value) {
    return appendLiteral(new StringBuilder(), value).toString();
  }

  /** Appends the literal syntax of a value to a buffer. */
  public static StringBuilder appendLiteral(StringBuilder buf, Object value) {
    if (value instanceof String) {
      return appendString(buf, (String) value);
    }
    if (value instanceof Character) {
      return appendChar(buf, (Character) value);
    }
    if (value instanceof Tuple) {
      return appendAll(buf, "(", ((Tuple) value).elements, ")");
    }
    if (value instanceof Tag) {
      final Tag tag = (Tag) value;
      buf.append(tag.name);
      if (tag.payload == null) {
        return buf;
      }
      if (tag.payload instanceof Tuple) {
        return appendLiteral(buf, tag.payload);
      }
      return appendLiteral(buf.append('('), tag.payload).append(')');
    }
    if (value instanceof List) {
      return appendAll(buf, "[", (List<?>) value, "]");
    }
    if (value instanceof Set) {
      return appendAll(buf, "#{", ORDERING.sortedCopy((Set<?>) value), "}");
    }
    if (value instanceof Map) {
      final Map<?, ?> map = (Map<?, ?>) value;
      buf.append("@{");
      int i = 0;
      for (Object key : ORDERING.sortedCopy(map.keySet())) {
        if (i++ > 0) {
          buf.append(", ");
        }
        appendLiteral(buf, key).append(" -> ");
        appendLiteral(buf, map.get(key));
      }
      return buf.append('}');
    }
    // Unit, Boolean, and numbers print as themselves
    return buf.append(value);
  }

  private static StringBuilder appendAll(
      StringBuilder buf, String open, Iterable<?> values, String close) {
    buf.append(open);
    final Iterator<?> iterator = values.iterator();
    while (iterator.hasNext()) {
      appendLiteral(buf, iterator.next());
      if (iterator.hasNext()) {
        buf.append(", ");
      }
    }
    return buf.append(close);
  }

  private static StringBuilder appendString(StringBuilder buf, String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      appendEscaped(buf, s.charAt(i), '"');
    }
    return buf.append('"');
  }

  private static StringBuilder appendChar(StringBuilder buf, char c) {
    buf.append('\'');
    appendEscaped(buf, c, '\'');
    return buf.append('\'');
  }

  private static void appendEscaped(StringBuilder buf, char c, char quote) {
    switch (c) {
      case '\\':
        buf.append("\\\\");
        break;
      case '\n':
        buf.append("\\n");
        break;
      case '\t':
        buf.append("\\t");
        break;
      case '\r':
        buf.append("\\r");
        break;
      default:
        if (c == quote) {
          buf.append('\\');
        }
        buf.append(c);
    }
  }

  /** Compares two values using {@link #ORDERING}. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  static int compare(Object o1, Object o2) {
    if (o1 == o2) {
      return 0;
    }
    final int rank1 = rank(o1);
    final int rank2 = rank(o2);
    if (rank1 != rank2) {
      return Integer.compare(rank1, rank2);
    }
    switch (rank1) {
      case 3:
        return compareNumbers((Number) o1, (Number) o2);
      case 5:
        return compareLists(((Tuple) o1).elements, ((Tuple) o2).elements);
      case 6:
        final Tag tag1 = (Tag) o1;
        final Tag tag2 = (Tag) o2;
        final int c = tag1.name.compareTo(tag2.name);
        if (c != 0) {
          return c;
        }
        if (tag1.payload == null || tag2.payload == null) {
          return Boolean.compare(tag1.payload != null, tag2.payload != null);
        }
        return compare(tag1.payload, tag2.payload);
      case 7:
        return compareLists((List<?>) o1, (List<?>) o2);
      case 8:
        return compareLists(
            ORDERING.sortedCopy((Set<?>) o1), ORDERING.sortedCopy((Set<?>) o2));
      case 9:
        return compareMaps((Map<?, ?>) o1, (Map<?, ?>) o2);
      case 10:
        final int c2 =
            o1.getClass().getName().compareTo(o2.getClass().getName());
        if (c2 != 0) {
          return c2;
        }
        if (o1 instanceof Comparable) {
          return ((Comparable) o1).compareTo(o2);
        }
        return o1.toString().compareTo(o2.toString());
      default:
        return ((Comparable) o1).compareTo(o2);
    }
  }

  private static int rank(Object o) {
    if (o instanceof Unit) {
      return 0;
    } else if (o instanceof Boolean) {
      return 1;
    } else if (o instanceof Character) {
      return 2;
    } else if (o instanceof Number) {
      return 3;
    } else if (o instanceof String) {
      return 4;
    } else if (o instanceof Tuple) {
      return 5;
    } else if (o instanceof Tag) {
      return 6;
    } else if (o instanceof List) {
      return 7;
    } else if (o instanceof Set) {
      return 8;
    } else if (o instanceof Map) {
      return 9;
    } else {
      return 10;
    }
  }

  private static int compareNumbers(Number n1, Number n2) {
    if (n1.getClass() == n2.getClass() && n1 instanceof Comparable) {
      @SuppressWarnings("unchecked")
      final Comparable<Number> c1 = (Comparable<Number>) n1;
      return c1.compareTo(n2);
    }
    if (isIntegral(n1) && isIntegral(n2)) {
      return toBigInteger(n1).compareTo(toBigInteger(n2));
    }
    return Double.compare(n1.doubleValue(), n2.doubleValue());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer
        || n instanceof Long
        || n instanceof Short
        || n instanceof Byte
        || n instanceof BigInteger;
  }

  private static BigInteger toBigInteger(Number n) {
    return n instanceof BigInteger
        ? (BigInteger) n
        : BigInteger.valueOf(n.longValue());
  }

  private static int compareLists(List<?> list1, List<?> list2) {
    final int n1 = list1.size();
    final int n2 = list2.size();
    final int n = Math.min(n1, n2);
    for (int i = 0; i < n; i++) {
      final int c = compare(list1.get(i), list2.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(n1, n2);
  }

  private static int compareMaps(Map<?, ?> map1, Map<?, ?> map2) {
    final List<?> keys1 = ORDERING.sortedCopy(map1.keySet());
    final List<?> keys2 = ORDERING.sortedCopy(map2.keySet());
    final int c = compareLists(keys1, keys2);
    if (c != 0) {
      return c;
    }
    for (Object key : keys1) {
      final int c2 = compare(map1.get(key), map2.get(key));
      if (c2 != 0) {
        return c2;
      }
    }
    return 0;
  }
}

// End Values.java
