package com.ospicorp.trendreport.report;

/** Predictions were requested for a report whose trend could not be fitted. */
public class TrendUnavailableException extends RuntimeException {
  public TrendUnavailableException(String message) {
    super(message);
  }
}
