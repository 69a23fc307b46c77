package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.pipeline.model.FeatureRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Everything one completed run produced. Immutable once built. */
public record ReportResult(
    String name,
    Instant startedAt,
    Instant finishedAt,
    List<FeatureRecord> records,
    Map<String, Long> undefinedRatios,
    Map<String, AggregateResult> aggregates,
    TrendOutcome trend
) {

  public ReportResult {
    records = List.copyOf(records);
    undefinedRatios = Collections.unmodifiableMap(new LinkedHashMap<>(undefinedRatios));
    aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
  }

  public Optional<AggregateResult> aggregate(String aggregateName) {
    return Optional.ofNullable(aggregates.get(aggregateName));
  }

  public Optional<TrendOutcome> trendOutcome() {
    return Optional.ofNullable(trend);
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }
}
