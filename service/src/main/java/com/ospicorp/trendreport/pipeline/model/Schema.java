package com.ospicorp.trendreport.pipeline.model;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared columns of an input table. Header columns that are not declared are read as optional
 * text.
 */
public record Schema(List<ColumnSpec> columns, DateTimeFormatter dateFormat,
    DateTimeFormatter timeFormat) {

  public Schema {
    columns = List.copyOf(columns);
    dateFormat = dateFormat == null ? DateTimeFormatter.ISO_LOCAL_DATE : dateFormat;
    timeFormat = timeFormat == null ? DateTimeFormatter.ISO_LOCAL_TIME : timeFormat;
    Map<String, ColumnSpec> seen = new LinkedHashMap<>();
    for (ColumnSpec column : columns) {
      if (seen.put(column.name(), column) != null) {
        throw new IllegalArgumentException("Column declared twice: " + column.name());
      }
    }
  }

  public Optional<ColumnSpec> column(String name) {
    return columns.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  public ColumnSpec columnOrText(String name) {
    return column(name).orElseGet(() -> ColumnSpec.optional(name, ColumnType.TEXT));
  }
}
