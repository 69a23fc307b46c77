package com.ospicorp.trendreport.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record Evaluation(
    List<Prediction> predictions,
    @JsonProperty("mean_absolute_error") Double meanAbsoluteError,
    @JsonProperty("root_mean_squared_error") Double rootMeanSquaredError
) {
  public Evaluation {
    predictions = List.copyOf(predictions);
  }
}
