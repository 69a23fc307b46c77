package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/** Runs every configured report once at startup. */
@Component
public class ReportRunner implements CommandLineRunner {
  private static final Logger log = LoggerFactory.getLogger(ReportRunner.class);

  private final ReportCatalog catalog;
  private final ReportService reportService;
  private final PipelineProperties properties;

  public ReportRunner(ReportCatalog catalog, ReportService reportService,
      PipelineProperties properties) {
    this.catalog = catalog;
    this.reportService = reportService;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    if (!properties.runOnStartup()) {
      log.info("Startup report run disabled via property pipeline.run-on-startup=false");
      return;
    }
    int failed = 0;
    for (ReportDefinition definition : catalog.all()) {
      ReportStatus status = reportService.run(definition);
      if (status == ReportStatus.FAILED) {
        failed++;
        if (properties.failFast()) {
          throw new IllegalStateException("Report " + definition.name()
              + " failed and pipeline.fail-fast is set");
        }
      }
    }
    log.info("Startup run finished: {} reports, {} failed", catalog.all().size(), failed);
  }
}
