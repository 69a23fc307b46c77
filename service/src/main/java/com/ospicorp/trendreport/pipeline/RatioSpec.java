package com.ospicorp.trendreport.pipeline;

import java.util.Objects;

// value = numerator / denominator * scale, e.g. scale 1000 for "per thousand"
public record RatioSpec(String name, String numerator, String denominator, double scale) {
  public RatioSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
    if (!Double.isFinite(scale) || scale == 0d) {
      throw new IllegalArgumentException("Ratio " + name + " needs a finite, non-zero scale");
    }
  }

  public RatioSpec(String name, String numerator, String denominator) {
    this(name, numerator, denominator, 1d);
  }
}
