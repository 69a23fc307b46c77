package com.ospicorp.trendreport.pipeline.model;

import java.util.Map;

public record RawRecord(long rowNumber, Map<String, Object> fields) implements TabularRecord {
  public RawRecord {
    fields = TabularRecord.freeze(fields);
  }
}
