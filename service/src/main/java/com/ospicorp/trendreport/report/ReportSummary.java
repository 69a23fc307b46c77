package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportSummary(
    String name,
    String title,
    String source,
    ReportStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("duration_ms") Long durationMs,
    @JsonProperty("record_count") Integer recordCount,
    @JsonProperty("undefined_ratios") Map<String, Long> undefinedRatios,
    List<String> aggregates,
    @JsonProperty("trend_fitted") Boolean trendFitted,
    @JsonProperty("trend_failure") String trendFailure,
    @JsonProperty("last_failure") RunFailure lastFailure
) {}
