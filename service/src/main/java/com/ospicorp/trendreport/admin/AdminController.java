package com.ospicorp.trendreport.admin;

import com.ospicorp.trendreport.config.PipelineProperties;
import com.ospicorp.trendreport.report.ReportCatalog;
import com.ospicorp.trendreport.report.ReportDefinition;
import com.ospicorp.trendreport.report.ReportRefreshService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Validated
@Tag(name = "Admin")
public class AdminController {
  private final ReportCatalog catalog;
  private final ReportRefreshService refreshService;

  public AdminController(ReportCatalog catalog, ReportRefreshService refreshService) {
    this.catalog = catalog;
    this.refreshService = refreshService;
  }

  @PostMapping("/reports/{name}/refresh")
  @PreAuthorize("@adminAuthorization.permits(authentication)")
  @Operation(summary = "Refresh a report", description = "Re-run one report from its source in the background.")
  public ResponseEntity<Map<String, String>> refresh(
      @PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX) String name) {
    ReportDefinition definition = catalog.require(name);
    refreshService.refresh(definition);
    return ResponseEntity.accepted().body(Map.of("status", "refresh started", "report", name));
  }
}
