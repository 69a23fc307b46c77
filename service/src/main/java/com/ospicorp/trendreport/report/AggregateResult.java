package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.pipeline.AggregateSpec;
import com.ospicorp.trendreport.pipeline.model.AggregatedBucket;
import com.ospicorp.trendreport.pipeline.model.CumulativePoint;
import com.ospicorp.trendreport.pipeline.model.CumulativeSeries;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Buckets of one aggregate in output order. When the aggregate keeps a running total the buckets
 * are those of the cumulative series and each row carries a {@code running_total} column.
 */
public record AggregateResult(AggregateSpec spec, List<AggregatedBucket> buckets,
    CumulativeSeries cumulative) {

  public AggregateResult {
    buckets = List.copyOf(buckets);
  }

  public String name() {
    return spec.name();
  }

  public List<Map<String, Object>> rows() {
    List<Map<String, Object>> rows = new ArrayList<>(buckets.size());
    if (cumulative == null) {
      for (AggregatedBucket bucket : buckets) {
        rows.add(bucket.toRow());
      }
      return rows;
    }
    for (CumulativePoint point : cumulative.points()) {
      Map<String, Object> row = point.bucket().toRow();
      row.put(AggregateSpec.RUNNING_TOTAL_COLUMN, point.runningTotal());
      rows.add(row);
    }
    return rows;
  }
}
