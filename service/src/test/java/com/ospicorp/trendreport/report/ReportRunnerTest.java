package com.ospicorp.trendreport.report;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.trendreport.config.PipelineProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

class ReportRunnerTest {
  private final ReportRegistry registry = new ReportRegistry();

  private ReportRunner runner(boolean runOnStartup, boolean failFast) {
    PipelineProperties properties = new PipelineProperties(runOnStartup, failFast, false, null,
        List.of(
            ReportFixtures.events("classpath:fixtures/malformed.csv", List.of(), null),
            renamed(ReportFixtures.events(null), "good")));
    ReportService service = new ReportService(new DefaultResourceLoader(), registry,
        new ReportExporter(new ObjectMapper().findAndRegisterModules()), properties);
    return new ReportRunner(new ReportCatalog(properties), service, properties);
  }

  private static PipelineProperties.Dataset renamed(PipelineProperties.Dataset d, String name) {
    return new PipelineProperties.Dataset(name, d.title(), d.source(), d.dateFormat(),
        d.timeFormat(), d.columns(), d.normalization(), d.features(), d.aggregates(), d.trend());
  }

  @Test
  void failedReportDoesNotStopTheOthers() {
    runner(true, false).run();

    assertEquals(ReportStatus.FAILED, registry.status("events"));
    assertEquals(ReportStatus.COMPLETED, registry.status("good"));
  }

  @Test
  void unexpectedExceptionIsRecordedAndTheNextReportStillRuns() {
    String brokenSource = "classpath:fixtures/unreachable.csv";
    DefaultResourceLoader loader = new DefaultResourceLoader() {
      @Override
      public Resource getResource(String location) {
        if (brokenSource.equals(location)) {
          throw new IllegalStateException("resource backend unavailable");
        }
        return super.getResource(location);
      }
    };
    PipelineProperties properties = new PipelineProperties(true, false, false, null,
        List.of(
            ReportFixtures.events(brokenSource, List.of(), null),
            renamed(ReportFixtures.events(null), "good")));
    ReportService service = new ReportService(loader, registry,
        new ReportExporter(new ObjectMapper().findAndRegisterModules()), properties);

    new ReportRunner(new ReportCatalog(properties), service, properties).run();

    assertEquals(ReportStatus.FAILED, registry.status("events"));
    RunFailure failure = registry.failure("events").orElseThrow();
    assertEquals("IllegalStateException", failure.error());
    assertEquals("resource backend unavailable", failure.message());
    assertEquals(ReportStatus.COMPLETED, registry.status("good"));
  }

  @Test
  void failFastAbortsOnTheFirstFailure() {
    assertThrows(IllegalStateException.class, () -> runner(true, true).run());
    assertEquals(ReportStatus.PENDING, registry.status("good"));
  }

  @Test
  void startupRunCanBeDisabled() {
    runner(false, false).run();
    assertEquals(ReportStatus.PENDING, registry.status("events"));
  }

  @Test
  void duplicateDatasetNamesAreRejected() {
    PipelineProperties properties = new PipelineProperties(true, false, false, null,
        List.of(ReportFixtures.events(null), ReportFixtures.events(null)));
    assertThrows(IllegalArgumentException.class, () -> new ReportCatalog(properties));
  }
}
