package com.ospicorp.trendreport.pipeline;

public enum Transform {
  AS_IS,
  DIFF,
  PCT_CHANGE
}
