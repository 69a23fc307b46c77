package com.ospicorp.trendreport.pipeline.model;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Canonical fields plus the derived ones. Derived values are also present in {@link #fields()}
 * under their configured names so that aggregation and trend inputs can address them like any
 * input column; an undefined ratio is stored as {@code null} there.
 */
public record FeatureRecord(
    long rowNumber,
    Map<String, Object> fields,
    LocalDate date,
    Weekday dayOfWeek,
    long dayOffset,
    Set<String> undefinedRatios
) implements TabularRecord {

  public FeatureRecord {
    fields = TabularRecord.freeze(fields);
    undefinedRatios = Set.copyOf(undefinedRatios);
  }

  public OptionalDouble ratio(String name) {
    Object value = fields.get(name);
    if (value instanceof Double d && !undefinedRatios.contains(name)) {
      return OptionalDouble.of(d);
    }
    return OptionalDouble.empty();
  }
}
