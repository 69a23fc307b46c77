package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record RecordsPage(
    String report,
    int page,
    @JsonProperty("page_size") int pageSize,
    @JsonProperty("total_records") int totalRecords,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("has_more") boolean hasMore,
    List<Map<String, Object>> records
) {}
