package com.ospicorp.trendreport.pipeline.model;

import java.util.Objects;

public record ColumnSpec(String name, ColumnType type, boolean required) {
  public ColumnSpec {
    Objects.requireNonNull(name, "name");
    type = type == null ? ColumnType.TEXT : type;
  }

  public static ColumnSpec required(String name, ColumnType type) {
    return new ColumnSpec(name, type, true);
  }

  public static ColumnSpec optional(String name, ColumnType type) {
    return new ColumnSpec(name, type, false);
  }
}
