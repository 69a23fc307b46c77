package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.Evaluation;
import com.ospicorp.trendreport.pipeline.model.Prediction;
import com.ospicorp.trendreport.pipeline.model.TrendModel;
import com.ospicorp.trendreport.pipeline.model.XYPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class PredictionEvaluator {
  private PredictionEvaluator() {
  }

  /** Model values at each x, in input order. The returned list is unmodifiable. */
  public static List<Double> predict(TrendModel model, List<Double> xs) {
    Objects.requireNonNull(model, "a fitted model is required");
    List<Double> out = new ArrayList<>(xs.size());
    for (int i = 0; i < xs.size(); i++) {
      Double x = xs.get(i);
      if (x == null) {
        throw new IllegalArgumentException("Cannot predict at a missing x (index " + i + ")");
      }
      out.add(model.predict(x));
    }
    return List.copyOf(out);
  }

  /**
   * Pairs each actual point with the model's prediction at its x, in input order. The points may
   * be the fit input or a disjoint evaluation set.
   */
  public static Evaluation evaluate(TrendModel model, List<XYPoint> actual) {
    Objects.requireNonNull(model, "a fitted model is required");
    List<Prediction> predictions = new ArrayList<>(actual.size());
    double absolute = 0d;
    double squared = 0d;
    for (XYPoint point : actual) {
      double predicted = model.predict(point.x());
      double residual = point.y() - predicted;
      predictions.add(new Prediction(point.x(), point.y(), predicted, residual));
      absolute += Math.abs(residual);
      squared += residual * residual;
    }
    if (predictions.isEmpty()) {
      return new Evaluation(predictions, null, null);
    }
    int n = predictions.size();
    return new Evaluation(predictions, absolute / n, Math.sqrt(squared / n));
  }
}
