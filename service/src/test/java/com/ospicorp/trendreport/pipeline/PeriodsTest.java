package com.ospicorp.trendreport.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.trendreport.pipeline.model.Frequency;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PeriodsTest {

  @Test
  void dailyPeriodIsTheDateItself() {
    var date = LocalDate.of(2021, 5, 4);
    assertEquals(date, Periods.periodEnd(date, Frequency.D));
  }

  @Test
  void weeksEndOnSunday() {
    assertEquals(LocalDate.of(2024, 1, 7), Periods.periodEnd(LocalDate.of(2024, 1, 1), Frequency.W));
    assertEquals(LocalDate.of(2024, 1, 7), Periods.periodEnd(LocalDate.of(2024, 1, 7), Frequency.W));
  }

  @Test
  void monthQuarterAndYearEnds() {
    var date = LocalDate.of(2020, 2, 10);
    assertEquals(LocalDate.of(2020, 2, 29), Periods.periodEnd(date, Frequency.M));
    assertEquals(LocalDate.of(2020, 3, 31), Periods.periodEnd(date, Frequency.Q));
    assertEquals(LocalDate.of(2020, 12, 31), Periods.periodEnd(date, Frequency.A));
    assertEquals(LocalDate.of(2020, 12, 31), Periods.periodEnd(LocalDate.of(2020, 10, 1), Frequency.Q));
  }
}
