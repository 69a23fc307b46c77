package com.ospicorp.trendreport.pipeline.model;

public record CumulativePoint(AggregatedBucket bucket, double runningTotal) {}
