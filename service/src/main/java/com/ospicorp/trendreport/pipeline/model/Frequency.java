package com.ospicorp.trendreport.pipeline.model;

public enum Frequency {
  D,
  W,
  M,
  Q,
  A
}
