package com.ospicorp.trendreport.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One group of an aggregation: the group key values in key order, how many records fell into
 * the group, and the measures by name. A measure is {@code null} when no record contributed.
 */
public record AggregatedBucket(Map<String, Object> key, long records, Map<String, Double> measures) {

  public AggregatedBucket {
    key = Collections.unmodifiableMap(new LinkedHashMap<>(key));
    measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
  }

  public List<Object> keyValues() {
    return Collections.unmodifiableList(new ArrayList<>(key.values()));
  }

  public Double measure(String name) {
    return measures.get(name);
  }

  public Object get(String field) {
    if (key.containsKey(field)) {
      return key.get(field);
    }
    return measures.get(field);
  }

  public boolean has(String field) {
    return key.containsKey(field) || measures.containsKey(field);
  }

  public AggregatedBucket withMeasure(String name, Double value) {
    Map<String, Double> extended = new LinkedHashMap<>(measures);
    extended.put(name, value);
    return new AggregatedBucket(key, records, extended);
  }

  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>(key);
    row.put("records", records);
    row.putAll(measures);
    return row;
  }
}
