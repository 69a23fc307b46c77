package com.ospicorp.trendreport.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fitted line {@code y = intercept + slope * x}. The inference statistics need at least one
 * residual degree of freedom and are {@code null} for a two-point fit.
 */
public record TrendModel(
    double intercept,
    double slope,
    int points,
    @JsonProperty("r_squared") double rSquared,
    @JsonProperty("residual_standard_error") Double residualStandardError,
    @JsonProperty("slope_standard_error") Double slopeStandardError,
    @JsonProperty("t_statistic") Double tStatistic,
    @JsonProperty("p_value") Double slopePValue
) {

  public double predict(double x) {
    return intercept + slope * x;
  }

  @JsonProperty("degrees_of_freedom")
  public int degreesOfFreedom() {
    return points - 2;
  }
}
