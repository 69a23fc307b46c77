package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.config.PipelineProperties;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Compiled report definitions in configuration order. */
@Component
public class ReportCatalog {
  private static final Logger log = LoggerFactory.getLogger(ReportCatalog.class);

  private final Map<String, ReportDefinition> definitions;

  public ReportCatalog(PipelineProperties properties) {
    Map<String, ReportDefinition> compiled = new LinkedHashMap<>();
    for (PipelineProperties.Dataset dataset : properties.datasets()) {
      ReportDefinition definition = ReportDefinition.compile(dataset);
      if (compiled.put(definition.name(), definition) != null) {
        throw new IllegalArgumentException("Dataset defined twice: " + definition.name());
      }
    }
    this.definitions = Collections.unmodifiableMap(compiled);
    log.info("Compiled {} report definitions: {}", definitions.size(), definitions.keySet());
  }

  public Collection<ReportDefinition> all() {
    return definitions.values();
  }

  public ReportDefinition require(String name) {
    ReportDefinition definition = definitions.get(name);
    if (definition == null) {
      throw new NoSuchElementException("Report not found: " + name);
    }
    return definition;
  }
}
