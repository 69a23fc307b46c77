package com.ospicorp.trendreport.report;

import java.util.Objects;

/**
 * Which table feeds the trend fit and which of its columns are x and y. With a holdout of k the
 * model is fitted on all but the last k points and evaluated on those k.
 */
public record TrendSpec(String source, String x, String y, int holdout) {
  public static final String RECORDS = "records";

  public TrendSpec {
    source = source == null || source.isBlank() ? RECORDS : source;
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (holdout < 0) {
      throw new IllegalArgumentException("holdout must not be negative");
    }
  }

  public boolean usesRecords() {
    return RECORDS.equals(source);
  }
}
