package com.ospicorp.trendreport.pipeline.model;

public enum ColumnType {
  TEXT,
  INTEGER,
  DECIMAL,
  DATE,
  TIME,
  BOOLEAN
}
