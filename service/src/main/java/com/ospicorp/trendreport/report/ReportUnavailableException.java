package com.ospicorp.trendreport.report;

/** The report exists but has no completed result to serve. */
public class ReportUnavailableException extends RuntimeException {
  public ReportUnavailableException(String message) {
    super(message);
  }
}
