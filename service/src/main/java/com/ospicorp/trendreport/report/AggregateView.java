package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateView(
    String report,
    String aggregate,
    List<String> keys,
    @JsonProperty("order_by") String orderBy,
    @JsonProperty("running_total") String runningTotal,
    @JsonProperty("bucket_count") int bucketCount,
    List<Map<String, Object>> rows
) {}
