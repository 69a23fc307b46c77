package com.ospicorp.trendreport.report;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** DOWN while the latest run of any report has failed. */
@Component("reports")
public class ReportsHealthIndicator implements HealthIndicator {
  private final ReportCatalog catalog;
  private final ReportRegistry registry;

  public ReportsHealthIndicator(ReportCatalog catalog, ReportRegistry registry) {
    this.catalog = catalog;
    this.registry = registry;
  }

  @Override
  public Health health() {
    Map<String, ReportStatus> statuses = new LinkedHashMap<>();
    boolean anyFailed = false;
    for (ReportDefinition definition : catalog.all()) {
      ReportStatus status = registry.status(definition.name());
      statuses.put(definition.name(), status);
      anyFailed |= status == ReportStatus.FAILED;
    }
    Health.Builder builder = anyFailed ? Health.down() : Health.up();
    return builder.withDetails(statuses).build();
  }
}
