package com.ospicorp.trendreport.report;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportRegistryTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static ReportResult result(String name) {
    return new ReportResult(name, T0, T0.plusMillis(5), List.of(), Map.of(), Map.of(), null);
  }

  @Test
  void unknownReportIsPending() {
    ReportRegistry registry = new ReportRegistry();
    assertEquals(ReportStatus.PENDING, registry.status("x"));
    assertTrue(registry.result("x").isEmpty());
    var ex = assertThrows(ReportUnavailableException.class, () -> registry.require("x"));
    assertTrue(ex.getMessage().contains("has not completed"));
  }

  @Test
  void failureIsReportedUntilTheNextCompletedRun() {
    ReportRegistry registry = new ReportRegistry();
    ReportResult first = result("x");
    registry.completed(first);
    assertEquals(ReportStatus.COMPLETED, registry.status("x"));
    assertEquals(5, first.duration().toMillis());

    registry.failed("x", new RunFailure(T0, T0, "IOException", "boom", null, null));
    assertEquals(ReportStatus.FAILED, registry.status("x"));
    assertSame(first, registry.require("x"));

    ReportResult second = result("x");
    registry.completed(second);
    assertEquals(ReportStatus.COMPLETED, registry.status("x"));
    assertSame(second, registry.require("x"));
    assertTrue(registry.failure("x").isEmpty());
  }

  @Test
  void failureWithoutResultNamesTheCause() {
    ReportRegistry registry = new ReportRegistry();
    registry.failed("x", new RunFailure(T0, T0, "RecordParseException", "bad row", 3L, "date"));
    var ex = assertThrows(ReportUnavailableException.class, () -> registry.require("x"));
    assertTrue(ex.getMessage().contains("bad row"));
  }
}
