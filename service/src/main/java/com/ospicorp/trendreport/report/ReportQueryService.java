package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.pipeline.AggregateSpec;
import com.ospicorp.trendreport.pipeline.model.FeatureRecord;
import com.ospicorp.trendreport.pipeline.model.Prediction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.springframework.stereotype.Service;

/** Read side of the registry, shaped for the HTTP hand-off. */
@Service
public class ReportQueryService {
  private final ReportCatalog catalog;
  private final ReportRegistry registry;

  public ReportQueryService(ReportCatalog catalog, ReportRegistry registry) {
    this.catalog = catalog;
    this.registry = registry;
  }

  public List<ReportSummary> summaries() {
    return catalog.all().stream().map(this::summarize).toList();
  }

  public ReportSummary summary(String name) {
    return summarize(catalog.require(name));
  }

  public RecordsPage records(String name, int page, int pageSize) {
    ReportResult result = completedResult(name);
    List<FeatureRecord> all = result.records();
    int totalRecords = all.size();
    int totalPages = totalRecords == 0 ? 0 : (int) Math.ceil((double) totalRecords / pageSize);
    int fromIndex = (int) Math.min(Math.max(0L, (long) (page - 1) * pageSize), totalRecords);
    int toIndex = Math.min(fromIndex + pageSize, totalRecords);
    List<Map<String, Object>> rows = new ArrayList<>(toIndex - fromIndex);
    for (FeatureRecord record : all.subList(fromIndex, toIndex)) {
      rows.add(record.fields());
    }
    return new RecordsPage(name, page, pageSize, totalRecords, totalPages, page < totalPages,
        rows);
  }

  public AggregateView aggregate(String name, String aggregateName) {
    ReportResult result = completedResult(name);
    AggregateResult aggregate = result.aggregate(aggregateName)
        .orElseThrow(() -> new NoSuchElementException(
            "Aggregate " + aggregateName + " not found in report " + name));
    AggregateSpec spec = aggregate.spec();
    return new AggregateView(name, aggregate.name(), spec.keys(), spec.orderBy(),
        spec.runningTotal(), aggregate.buckets().size(), aggregate.rows());
  }

  public TrendOutcome trend(String name) {
    return completedResult(name).trendOutcome()
        .orElseThrow(() -> new NoSuchElementException("Report " + name + " has no trend"));
  }

  public List<Prediction> predictions(String name) {
    TrendOutcome trend = trend(name);
    if (!trend.isFitted()) {
      throw new TrendUnavailableException(
          "Trend of report " + name + " was not fitted: " + trend.failure());
    }
    return trend.evaluation().predictions();
  }

  private ReportResult completedResult(String name) {
    catalog.require(name);
    return registry.require(name);
  }

  private ReportSummary summarize(ReportDefinition definition) {
    String name = definition.name();
    ReportStatus status = registry.status(name);
    RunFailure failure = registry.failure(name).orElse(null);
    ReportResult result = registry.result(name).orElse(null);
    if (result == null) {
      return new ReportSummary(name, definition.title(), definition.source(), status, null, null,
          null, null, null, null, null, null, failure);
    }
    TrendOutcome trend = result.trend();
    return new ReportSummary(name, definition.title(), definition.source(), status,
        result.startedAt(), result.finishedAt(), result.duration().toMillis(),
        result.records().size(), result.undefinedRatios(),
        List.copyOf(result.aggregates().keySet()),
        trend == null ? null : trend.isFitted(),
        trend == null ? null : trend.failure(),
        failure);
  }
}
