package com.ospicorp.trendreport.pipeline;

public class UndefinedRatioException extends RuntimeException {
  private final String ratio;

  public UndefinedRatioException(String ratio, String message) {
    super("Ratio " + ratio + " is undefined: " + message);
    this.ratio = ratio;
  }

  public String ratio() {
    return ratio;
  }
}
