package com.ospicorp.trendreport.pipeline;

import java.util.Objects;

// field is ignored for COUNT, which counts every record in the group
public record MeasureSpec(String name, MeasureOp op, String field) {
  public MeasureSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(op, "op");
    if (op != MeasureOp.COUNT && (field == null || field.isBlank())) {
      throw new IllegalArgumentException("Measure " + name + " (" + op + ") needs a field");
    }
  }

  public static MeasureSpec count(String name) {
    return new MeasureSpec(name, MeasureOp.COUNT, null);
  }

  public static MeasureSpec sum(String name, String field) {
    return new MeasureSpec(name, MeasureOp.SUM, field);
  }
}
