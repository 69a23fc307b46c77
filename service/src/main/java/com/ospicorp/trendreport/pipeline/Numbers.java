package com.ospicorp.trendreport.pipeline;

public final class Numbers {
  private Numbers() {
  }

  /**
   * Numeric view of a field value: numbers as-is, booleans as 1/0 and {@code null} as missing.
   * Anything else is a configuration mistake (a measure pointed at a text column).
   */
  public static Double toDouble(String field, Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean flag) {
      return flag ? 1d : 0d;
    }
    throw new IllegalArgumentException(
        "Field " + field + " is not numeric (found " + value.getClass().getSimpleName() + ")");
  }
}
