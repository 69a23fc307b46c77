package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.pipeline.Numbers;
import com.ospicorp.trendreport.pipeline.model.XYPoint;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * (x, y) pairs read from table rows in row order. Dates are read as epoch days. A row with a
 * missing x or y is excluded and counted.
 */
record TrendInputs(List<XYPoint> points, int excluded) {

  TrendInputs {
    points = List.copyOf(points);
  }

  static TrendInputs from(List<Map<String, Object>> rows, String x, String y) {
    List<XYPoint> points = new ArrayList<>(rows.size());
    int excluded = 0;
    for (Map<String, Object> row : rows) {
      if (!row.containsKey(x) || !row.containsKey(y)) {
        throw new IllegalArgumentException("Trend field " + (row.containsKey(x) ? y : x)
            + " is not a column of the trend source");
      }
      Double xValue = numeric(x, row.get(x));
      Double yValue = numeric(y, row.get(y));
      if (xValue == null || yValue == null) {
        excluded++;
        continue;
      }
      points.add(new XYPoint(xValue, yValue));
    }
    return new TrendInputs(points, excluded);
  }

  private static Double numeric(String field, Object value) {
    if (value instanceof LocalDate date) {
      return (double) date.toEpochDay();
    }
    return Numbers.toDouble(field, value);
  }
}
