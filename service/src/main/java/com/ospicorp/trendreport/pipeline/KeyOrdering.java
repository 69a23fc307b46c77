package com.ospicorp.trendreport.pipeline;

import java.time.LocalTime;
import java.time.chrono.ChronoLocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over group key values: nulls first, numbers by value whatever their boxed type,
 * strings, booleans, dates, times and constants of one enum naturally, anything else by string
 * form.
 */
public final class KeyOrdering {
  public static final Comparator<Object> VALUES = KeyOrdering::compareValues;
  public static final Comparator<List<Object>> TUPLES = KeyOrdering::compareTuples;

  private KeyOrdering() {
  }

  static int compareValues(Object left, Object right) {
    if (left == right) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    if (left instanceof Number a && right instanceof Number b) {
      return Double.compare(a.doubleValue(), b.doubleValue());
    }
    if (left instanceof String a && right instanceof String b) {
      return a.compareTo(b);
    }
    if (left instanceof Boolean a && right instanceof Boolean b) {
      return a.compareTo(b);
    }
    if (left instanceof ChronoLocalDate a && right instanceof ChronoLocalDate b) {
      return a.compareTo(b);
    }
    if (left instanceof LocalTime a && right instanceof LocalTime b) {
      return a.compareTo(b);
    }
    if (left instanceof Enum<?> a && right instanceof Enum<?> b
        && a.getDeclaringClass() == b.getDeclaringClass()) {
      return Integer.compare(a.ordinal(), b.ordinal());
    }
    return left.toString().compareTo(right.toString());
  }

  static int compareTuples(List<Object> left, List<Object> right) {
    int shared = Math.min(left.size(), right.size());
    for (int i = 0; i < shared; i++) {
      int cmp = compareValues(left.get(i), right.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(left.size(), right.size());
  }
}
