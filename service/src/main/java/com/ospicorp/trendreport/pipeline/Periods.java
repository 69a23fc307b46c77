package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.Frequency;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

public final class Periods {
  private Periods() {
  }

  public static LocalDate periodEnd(LocalDate date, Frequency frequency) {
    return switch (frequency) {
      case D -> date;
      case W -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
      case M -> date.with(TemporalAdjusters.lastDayOfMonth());
      case Q -> endOfQuarter(date);
      case A -> date.with(TemporalAdjusters.lastDayOfYear());
    };
  }

  private static LocalDate endOfQuarter(LocalDate date) {
    int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
    return LocalDate.of(date.getYear(), quarterEndMonth, 1)
        .with(TemporalAdjusters.lastDayOfMonth());
  }
}
