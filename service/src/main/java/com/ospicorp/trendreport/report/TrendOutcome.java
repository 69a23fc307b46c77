package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ospicorp.trendreport.pipeline.model.Evaluation;
import com.ospicorp.trendreport.pipeline.model.TrendModel;

/**
 * Result of the trend stage: either a fitted model with its evaluation or the reason the fit was
 * impossible. {@code excluded} counts source rows dropped for a missing x or y.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendOutcome(
    String source,
    String x,
    String y,
    int holdout,
    int excluded,
    TrendModel model,
    Evaluation evaluation,
    String failure
) {

  public static TrendOutcome fitted(TrendSpec spec, int excluded, TrendModel model,
      Evaluation evaluation) {
    return new TrendOutcome(spec.source(), spec.x(), spec.y(), spec.holdout(), excluded, model,
        evaluation, null);
  }

  public static TrendOutcome degenerate(TrendSpec spec, int excluded, String reason) {
    return new TrendOutcome(spec.source(), spec.x(), spec.y(), spec.holdout(), excluded, null,
        null, reason);
  }

  @JsonIgnore
  public boolean isFitted() {
    return model != null;
  }
}
