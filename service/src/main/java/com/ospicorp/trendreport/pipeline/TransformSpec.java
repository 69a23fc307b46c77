package com.ospicorp.trendreport.pipeline;

import java.util.Objects;

public record TransformSpec(String name, String measure, Transform type) {
  public TransformSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(measure, "measure");
    type = type == null ? Transform.AS_IS : type;
  }
}
