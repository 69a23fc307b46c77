package com.ospicorp.trendreport.config;

import com.ospicorp.trendreport.pipeline.MeasureOp;
import com.ospicorp.trendreport.pipeline.NormalizationRules;
import com.ospicorp.trendreport.pipeline.Transform;
import com.ospicorp.trendreport.pipeline.model.ColumnType;
import com.ospicorp.trendreport.pipeline.model.Frequency;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Datasets the pipeline runs and how. Bound from {@code pipeline.*}; cross-field consistency is
 * checked later, when each dataset is compiled into a report definition.
 */
@ConfigurationProperties("pipeline")
@Validated
public record PipelineProperties(
    @DefaultValue("true") boolean runOnStartup,
    @DefaultValue("false") boolean failFast,
    @DefaultValue("false") boolean parallel,
    String outputDirectory,
    @Valid @DefaultValue List<Dataset> datasets
) {
  public static final String NAME_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  public record Dataset(
      @NotBlank @Pattern(regexp = NAME_REGEX) String name,
      String title,
      @NotBlank String source,
      String dateFormat,
      String timeFormat,
      @Valid @DefaultValue List<Column> columns,
      @Valid Normalization normalization,
      @Valid @NotNull Features features,
      @Valid @DefaultValue List<Aggregate> aggregates,
      @Valid Trend trend
  ) {}

  public record Column(@NotBlank String name, @DefaultValue("TEXT") ColumnType type,
      @DefaultValue("false") boolean required) {}

  public record Normalization(
      @DefaultValue(NormalizationRules.UNKNOWN) String sentinel,
      @Valid @DefaultValue List<Rule> rules) {}

  public record Rule(@NotEmpty List<String> fields, @NotEmpty List<String> values) {}

  public record Features(
      @NotBlank String dateField,
      String dayOfWeekField,
      String dayOffsetField,
      @Valid @DefaultValue List<Period> periods,
      @Valid @DefaultValue List<Ratio> ratios) {}

  public record Period(@NotBlank String name, @NotNull Frequency frequency) {}

  public record Ratio(@NotBlank String name, @NotBlank String numerator,
      @NotBlank String denominator, @DefaultValue("1") double scale) {}

  public record Aggregate(
      @NotBlank @Pattern(regexp = NAME_REGEX) String name,
      @DefaultValue List<String> keys,
      @Valid @NotEmpty List<Measure> measures,
      String orderBy,
      String runningTotal,
      @Valid @DefaultValue List<SeriesTransform> transforms) {}

  public record Measure(@NotBlank String name, @NotNull MeasureOp op, String field) {}

  public record SeriesTransform(@NotBlank String name, @NotBlank String measure,
      @DefaultValue("AS_IS") Transform type) {}

  public record Trend(String source, @NotBlank String x, @NotBlank String y,
      @DefaultValue("0") @Min(0) int holdout) {}
}
