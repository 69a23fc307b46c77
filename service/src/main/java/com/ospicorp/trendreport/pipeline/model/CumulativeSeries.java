package com.ospicorp.trendreport.pipeline.model;

import java.util.List;

public record CumulativeSeries(String orderBy, String measure, List<CumulativePoint> points) {
  public CumulativeSeries {
    points = List.copyOf(points);
  }

  public double total() {
    return points.isEmpty() ? 0d : points.get(points.size() - 1).runningTotal();
  }
}
