package com.ospicorp.trendreport.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.LocalDate;

// Declaration order is the reporting order: Sunday first
public enum Weekday {
  SUNDAY("Sunday"),
  MONDAY("Monday"),
  TUESDAY("Tuesday"),
  WEDNESDAY("Wednesday"),
  THURSDAY("Thursday"),
  FRIDAY("Friday"),
  SATURDAY("Saturday");

  private final String label;

  Weekday(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static Weekday of(LocalDate date) {
    // DayOfWeek runs MONDAY=1 .. SUNDAY=7
    return values()[date.getDayOfWeek().getValue() % 7];
  }

  @Override
  public String toString() {
    return label;
  }
}
