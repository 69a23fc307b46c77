package com.ospicorp.trendreport.pipeline;

public enum MeasureOp {
  COUNT,
  SUM,
  MEAN,
  MIN,
  MAX
}
