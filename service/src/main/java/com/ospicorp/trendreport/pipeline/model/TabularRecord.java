package com.ospicorp.trendreport.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row flowing through the pipeline: its 1-based position in the input and an ordered,
 * read-only view of its field values.
 */
public interface TabularRecord {

  long rowNumber();

  Map<String, Object> fields();

  default Object get(String field) {
    return fields().get(field);
  }

  default boolean has(String field) {
    return fields().containsKey(field);
  }

  // Map.copyOf rejects null values, which optional cells need
  static Map<String, Object> freeze(Map<String, Object> fields) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
