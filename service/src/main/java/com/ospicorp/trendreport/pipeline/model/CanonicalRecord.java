package com.ospicorp.trendreport.pipeline.model;

import java.util.Map;

public record CanonicalRecord(long rowNumber, Map<String, Object> fields)
    implements TabularRecord {
  public CanonicalRecord {
    fields = TabularRecord.freeze(fields);
  }
}
