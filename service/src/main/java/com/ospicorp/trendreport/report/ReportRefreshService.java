package com.ospicorp.trendreport.report;

import java.util.concurrent.CompletableFuture;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
public class ReportRefreshService {
  private final ReportService reportService;

  public ReportRefreshService(ReportService reportService) {
    this.reportService = reportService;
  }

  @Async
  public CompletableFuture<ReportStatus> refresh(ReportDefinition definition) {
    return CompletableFuture.completedFuture(reportService.run(definition));
  }
}
