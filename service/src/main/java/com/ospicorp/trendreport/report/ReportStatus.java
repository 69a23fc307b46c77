package com.ospicorp.trendreport.report;

public enum ReportStatus {
  PENDING,
  COMPLETED,
  FAILED
}
