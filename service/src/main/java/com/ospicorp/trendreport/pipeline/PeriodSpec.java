package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.Frequency;
import java.util.Objects;

public record PeriodSpec(String name, Frequency frequency) {
  public PeriodSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(frequency, "frequency");
  }
}
