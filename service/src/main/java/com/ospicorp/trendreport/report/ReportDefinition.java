package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.config.PipelineProperties;
import com.ospicorp.trendreport.pipeline.AggregateSpec;
import com.ospicorp.trendreport.pipeline.DatePatterns;
import com.ospicorp.trendreport.pipeline.FeatureSpec;
import com.ospicorp.trendreport.pipeline.MeasureSpec;
import com.ospicorp.trendreport.pipeline.NormalizationRules;
import com.ospicorp.trendreport.pipeline.PeriodSpec;
import com.ospicorp.trendreport.pipeline.RatioSpec;
import com.ospicorp.trendreport.pipeline.TransformSpec;
import com.ospicorp.trendreport.pipeline.model.ColumnSpec;
import com.ospicorp.trendreport.pipeline.model.Schema;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A dataset's configuration compiled into the specs each pipeline stage takes. Compilation checks
 * what the stages cannot check on their own: derived fields must not shadow declared columns and
 * the trend must name an existing aggregate and columns it produces.
 */
public record ReportDefinition(
    String name,
    String title,
    String source,
    Schema schema,
    NormalizationRules normalization,
    FeatureSpec features,
    List<AggregateSpec> aggregates,
    TrendSpec trend
) {

  public ReportDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(source, "source");
    title = title == null ? name : title;
    aggregates = List.copyOf(aggregates);
    validate(name, schema, features, aggregates, trend);
  }

  public static ReportDefinition compile(PipelineProperties.Dataset dataset) {
    try {
      return doCompile(dataset);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid configuration for dataset " + dataset.name() + ": " + ex.getMessage(), ex);
    }
  }

  public Optional<AggregateSpec> aggregate(String aggregateName) {
    return aggregates.stream().filter(a -> a.name().equals(aggregateName)).findFirst();
  }

  private static ReportDefinition doCompile(PipelineProperties.Dataset dataset) {
    DateTimeFormatter dateFormat = hasText(dataset.dateFormat())
        ? DatePatterns.date(dataset.dateFormat())
        : null;
    DateTimeFormatter timeFormat = hasText(dataset.timeFormat())
        ? DatePatterns.time(dataset.timeFormat())
        : null;

    List<ColumnSpec> columns = new ArrayList<>();
    for (PipelineProperties.Column column : dataset.columns()) {
      columns.add(new ColumnSpec(column.name(), column.type(), column.required()));
    }
    Schema schema = new Schema(columns, dateFormat, timeFormat);

    NormalizationRules.Builder rules = NormalizationRules.builder();
    PipelineProperties.Normalization normalization = dataset.normalization();
    if (normalization != null) {
      rules.sentinel(normalization.sentinel());
      for (PipelineProperties.Rule rule : normalization.rules()) {
        rules.rule(rule.fields(), rule.values());
      }
    }

    PipelineProperties.Features features = dataset.features();
    List<PeriodSpec> periods = features.periods().stream()
        .map(p -> new PeriodSpec(p.name(), p.frequency()))
        .toList();
    List<RatioSpec> ratios = features.ratios().stream()
        .map(r -> new RatioSpec(r.name(), r.numerator(), r.denominator(), r.scale()))
        .toList();
    FeatureSpec featureSpec = new FeatureSpec(features.dateField(), dateFormat,
        features.dayOfWeekField(), features.dayOffsetField(), periods, ratios);

    List<AggregateSpec> aggregates = new ArrayList<>();
    for (PipelineProperties.Aggregate aggregate : dataset.aggregates()) {
      List<MeasureSpec> measures = aggregate.measures().stream()
          .map(m -> new MeasureSpec(m.name(), m.op(), m.field()))
          .toList();
      List<TransformSpec> transforms = aggregate.transforms().stream()
          .map(t -> new TransformSpec(t.name(), t.measure(), t.type()))
          .toList();
      aggregates.add(new AggregateSpec(aggregate.name(), aggregate.keys(), measures,
          aggregate.orderBy(), aggregate.runningTotal(), transforms));
    }

    PipelineProperties.Trend trend = dataset.trend();
    TrendSpec trendSpec = trend == null ? null
        : new TrendSpec(trend.source(), trend.x(), trend.y(), trend.holdout());

    return new ReportDefinition(dataset.name(), dataset.title(), dataset.source(), schema,
        rules.build(), featureSpec, aggregates, trendSpec);
  }

  private static boolean hasText(String pattern) {
    return pattern != null && !pattern.isBlank();
  }

  private static void validate(String name, Schema schema, FeatureSpec features,
      List<AggregateSpec> aggregates, TrendSpec trend) {
    for (String derived : features.derivedFieldNames()) {
      if (schema.column(derived).isPresent()) {
        throw new IllegalArgumentException(
            "Derived field " + derived + " collides with a declared column");
      }
    }
    Set<String> names = new LinkedHashSet<>();
    for (AggregateSpec aggregate : aggregates) {
      if (!names.add(aggregate.name())) {
        throw new IllegalArgumentException("Aggregate defined twice: " + aggregate.name());
      }
      if (TrendSpec.RECORDS.equals(aggregate.name())) {
        throw new IllegalArgumentException("Aggregate name " + TrendSpec.RECORDS + " is reserved");
      }
    }
    if (trend == null || trend.usesRecords()) {
      return;
    }
    AggregateSpec source = aggregates.stream()
        .filter(a -> a.name().equals(trend.source()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "Trend of report " + name + " reads unknown aggregate " + trend.source()));
    Set<String> columns = outputColumns(source);
    for (String field : List.of(trend.x(), trend.y())) {
      if (!columns.contains(field)) {
        throw new IllegalArgumentException("Trend field " + field
            + " is not produced by aggregate " + source.name());
      }
    }
  }

  private static Set<String> outputColumns(AggregateSpec aggregate) {
    Set<String> columns = new LinkedHashSet<>(aggregate.keys());
    columns.add(AggregateSpec.RECORDS_COLUMN);
    aggregate.measures().forEach(m -> columns.add(m.name()));
    aggregate.transforms().forEach(t -> columns.add(t.name()));
    if (aggregate.isCumulative()) {
      columns.add(AggregateSpec.RUNNING_TOTAL_COLUMN);
    }
    return columns;
  }
}
