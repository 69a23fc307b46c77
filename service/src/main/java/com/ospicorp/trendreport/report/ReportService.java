package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.config.PipelineProperties;
import com.ospicorp.trendreport.pipeline.Aggregator;
import com.ospicorp.trendreport.pipeline.AggregateSpec;
import com.ospicorp.trendreport.pipeline.DegenerateInputException;
import com.ospicorp.trendreport.pipeline.FeatureDeriver;
import com.ospicorp.trendreport.pipeline.Ingestor;
import com.ospicorp.trendreport.pipeline.Normalizer;
import com.ospicorp.trendreport.pipeline.PredictionEvaluator;
import com.ospicorp.trendreport.pipeline.RecordParseException;
import com.ospicorp.trendreport.pipeline.TrendFitter;
import com.ospicorp.trendreport.pipeline.model.AggregatedBucket;
import com.ospicorp.trendreport.pipeline.model.CanonicalRecord;
import com.ospicorp.trendreport.pipeline.model.CumulativeSeries;
import com.ospicorp.trendreport.pipeline.model.Evaluation;
import com.ospicorp.trendreport.pipeline.model.FeatureRecord;
import com.ospicorp.trendreport.pipeline.model.RawRecord;
import com.ospicorp.trendreport.pipeline.model.TrendModel;
import com.ospicorp.trendreport.pipeline.model.XYPoint;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs one report end to end: ingest, normalize, derive features, aggregate, fit and evaluate the
 * trend. A parse or configuration error aborts the run and is recorded in the registry; a
 * degenerate trend only marks the trend outcome.
 */
@Service
public class ReportService {
  private static final Logger log = LoggerFactory.getLogger(ReportService.class);

  private final ResourceLoader resourceLoader;
  private final ReportRegistry registry;
  private final ReportExporter exporter;
  private final PipelineProperties properties;
  private final Clock clock;

  @Autowired
  public ReportService(ResourceLoader resourceLoader, ReportRegistry registry,
      ReportExporter exporter, PipelineProperties properties) {
    this(resourceLoader, registry, exporter, properties, Clock.systemUTC());
  }

  ReportService(ResourceLoader resourceLoader, ReportRegistry registry, ReportExporter exporter,
      PipelineProperties properties, Clock clock) {
    this.resourceLoader = resourceLoader;
    this.registry = registry;
    this.exporter = exporter;
    this.properties = properties;
    this.clock = clock;
  }

  /** Runs the report from its configured source and records the outcome in the registry. */
  public ReportStatus run(ReportDefinition definition) {
    Instant started = clock.instant();
    ReportResult result;
    try {
      Resource resource = resourceLoader.getResource(definition.source());
      log.info("Running report {} from {}", definition.name(), definition.source());
      try (Reader reader = new InputStreamReader(resource.getInputStream(),
          StandardCharsets.UTF_8)) {
        result = execute(definition, reader);
      }
    } catch (RecordParseException ex) {
      log.error("Report {} failed at row {} column {}: {}", definition.name(), ex.rowNumber(),
          ex.column(), ex.getMessage());
      registry.failed(definition.name(), RunFailure.of(ex, started, clock.instant()));
      return ReportStatus.FAILED;
    } catch (IOException | UncheckedIOException | IllegalArgumentException ex) {
      log.error("Report {} failed: {}", definition.name(), ex.getMessage(), ex);
      registry.failed(definition.name(), RunFailure.of(ex, started, clock.instant()));
      return ReportStatus.FAILED;
    } catch (RuntimeException ex) {
      log.error("Report {} failed unexpectedly", definition.name(), ex);
      registry.failed(definition.name(), RunFailure.of(ex, started, clock.instant()));
      return ReportStatus.FAILED;
    }
    registry.completed(result);
    export(result);
    return ReportStatus.COMPLETED;
  }

  /**
   * Runs every stage over {@code input}.
   *
   * @throws RecordParseException when the input does not match the schema
   * @throws IllegalArgumentException when the definition does not fit the data
   */
  public ReportResult execute(ReportDefinition definition, Reader input) throws IOException {
    Instant started = clock.instant();
    boolean parallel = properties.parallel();
    String name = definition.name();

    List<RawRecord> raw = new Ingestor(definition.schema()).read(input);
    log.info("[{}] ingested {} records", name, raw.size());

    List<CanonicalRecord> canonical =
        new Normalizer(definition.normalization()).normalizeAll(raw, parallel);
    log.info("[{}] normalized {} fields across {} records", name,
        definition.normalization().designatedFields().size(), canonical.size());

    List<FeatureRecord> records = new FeatureDeriver(definition.features())
        .deriveAll(canonical, parallel);
    Map<String, Long> undefined = countUndefinedRatios(records);
    log.info("[{}] derived {} on {} records", name, definition.features().derivedFieldNames(),
        records.size());
    if (!undefined.isEmpty()) {
      log.warn("[{}] undefined ratios: {}", name, undefined);
    }

    Map<String, AggregateResult> aggregates = new LinkedHashMap<>();
    for (AggregateSpec spec : definition.aggregates()) {
      List<AggregatedBucket> buckets = Aggregator.aggregate(records, spec, parallel);
      CumulativeSeries cumulative = spec.isCumulative()
          ? Aggregator.cumulative(buckets, spec)
          : null;
      aggregates.put(spec.name(), new AggregateResult(spec, buckets, cumulative));
      log.info("[{}] aggregate {} has {} buckets", name, spec.name(), buckets.size());
    }

    TrendOutcome trend = definition.trend() == null
        ? null
        : fitTrend(name, definition.trend(), records, aggregates);

    Instant finished = clock.instant();
    log.info("[{}] completed in {} ms", name, finished.toEpochMilli() - started.toEpochMilli());
    return new ReportResult(name, started, finished, records, undefined, aggregates, trend);
  }

  private void export(ReportResult result) {
    if (!StringUtils.hasText(properties.outputDirectory())) {
      return;
    }
    try {
      exporter.export(result, Path.of(properties.outputDirectory()));
    } catch (IOException ex) {
      log.error("Failed to export report {}: {}", result.name(), ex.getMessage(), ex);
    }
  }

  static TrendOutcome fitTrend(String report, TrendSpec spec, List<FeatureRecord> records,
      Map<String, AggregateResult> aggregates) {
    List<Map<String, Object>> rows;
    if (spec.usesRecords()) {
      rows = new ArrayList<>(records.size());
      for (FeatureRecord record : records) {
        rows.add(record.fields());
      }
    } else {
      AggregateResult source = aggregates.get(spec.source());
      if (source == null) {
        throw new IllegalArgumentException("Trend reads unknown aggregate " + spec.source());
      }
      rows = source.rows();
    }

    TrendInputs inputs = TrendInputs.from(rows, spec.x(), spec.y());
    if (inputs.excluded() > 0) {
      log.info("[{}] trend excluded {} rows with a missing {} or {}", report, inputs.excluded(),
          spec.x(), spec.y());
    }
    List<XYPoint> points = inputs.points();
    int fitSize = points.size() - spec.holdout();
    try {
      if (spec.holdout() > 0 && fitSize < 1) {
        throw new DegenerateInputException("Holdout of " + spec.holdout()
            + " leaves no points to fit out of " + points.size(), Math.max(fitSize, 0));
      }
      List<XYPoint> fitPoints = points.subList(0, fitSize);
      TrendModel model = TrendFitter.fit(fitPoints);
      List<XYPoint> evaluationPoints = spec.holdout() > 0
          ? points.subList(fitSize, points.size())
          : fitPoints;
      Evaluation evaluation = PredictionEvaluator.evaluate(model, evaluationPoints);
      log.info("[{}] trend {} ~ {}: slope={} intercept={} r2={} p={}", report, spec.y(),
          spec.x(), model.slope(), model.intercept(), model.rSquared(), model.slopePValue());
      return TrendOutcome.fitted(spec, inputs.excluded(), model, evaluation);
    } catch (DegenerateInputException ex) {
      log.warn("[{}] trend not fitted: {}", report, ex.getMessage());
      return TrendOutcome.degenerate(spec, inputs.excluded(), ex.getMessage());
    }
  }

  private static Map<String, Long> countUndefinedRatios(List<FeatureRecord> records) {
    Map<String, Long> counts = new TreeMap<>();
    for (FeatureRecord record : records) {
      for (String ratio : record.undefinedRatios()) {
        counts.merge(ratio, 1L, Long::sum);
      }
    }
    return counts;
  }
}
