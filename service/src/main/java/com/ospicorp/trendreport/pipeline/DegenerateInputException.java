package com.ospicorp.trendreport.pipeline;

public class DegenerateInputException extends RuntimeException {
  private final int points;

  public DegenerateInputException(String message, int points) {
    super(message);
    this.points = points;
  }

  public int points() {
    return points;
  }
}
