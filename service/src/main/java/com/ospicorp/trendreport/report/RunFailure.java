package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.trendreport.pipeline.RecordParseException;
import java.time.Instant;

/** Diagnostic of the latest aborted run of a report. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunFailure(
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    String error,
    String message,
    Long row,
    String column
) {

  public static RunFailure of(Exception ex, Instant startedAt, Instant finishedAt) {
    Long row = null;
    String column = null;
    if (ex instanceof RecordParseException parse) {
      row = parse.rowNumber();
      column = parse.column();
    }
    return new RunFailure(startedAt, finishedAt, ex.getClass().getSimpleName(), ex.getMessage(),
        row, column);
  }
}
