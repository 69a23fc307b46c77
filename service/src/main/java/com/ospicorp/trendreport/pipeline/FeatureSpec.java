package com.ospicorp.trendreport.pipeline;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record FeatureSpec(
    String dateField,
    DateTimeFormatter dateFormat,
    String dayOfWeekField,
    String dayOffsetField,
    List<PeriodSpec> periods,
    List<RatioSpec> ratios
) {
  public static final String DEFAULT_DAY_OF_WEEK_FIELD = "day_of_week";
  public static final String DEFAULT_DAY_OFFSET_FIELD = "day_offset";

  public FeatureSpec {
    Objects.requireNonNull(dateField, "dateField");
    dateFormat = dateFormat == null ? DateTimeFormatter.ISO_LOCAL_DATE : dateFormat;
    dayOfWeekField = dayOfWeekField == null ? DEFAULT_DAY_OF_WEEK_FIELD : dayOfWeekField;
    dayOffsetField = dayOffsetField == null ? DEFAULT_DAY_OFFSET_FIELD : dayOffsetField;
    periods = periods == null ? List.of() : List.copyOf(periods);
    ratios = ratios == null ? List.of() : List.copyOf(ratios);
    Set<String> names = new HashSet<>();
    for (String name : derivedFieldNames(dayOfWeekField, dayOffsetField, periods, ratios)) {
      if (!names.add(name)) {
        throw new IllegalArgumentException("Derived field defined twice: " + name);
      }
    }
  }

  public static FeatureSpec forDate(String dateField) {
    return new FeatureSpec(dateField, null, null, null, List.of(), List.of());
  }

  public FeatureSpec withDateFormat(DateTimeFormatter format) {
    return new FeatureSpec(dateField, format, dayOfWeekField, dayOffsetField, periods, ratios);
  }

  public FeatureSpec withPeriods(List<PeriodSpec> extra) {
    return new FeatureSpec(dateField, dateFormat, dayOfWeekField, dayOffsetField, extra, ratios);
  }

  public FeatureSpec withRatios(List<RatioSpec> extra) {
    return new FeatureSpec(dateField, dateFormat, dayOfWeekField, dayOffsetField, periods, extra);
  }

  public List<String> derivedFieldNames() {
    return derivedFieldNames(dayOfWeekField, dayOffsetField, periods, ratios);
  }

  private static List<String> derivedFieldNames(String dayOfWeekField, String dayOffsetField,
      List<PeriodSpec> periods, List<RatioSpec> ratios) {
    List<String> names = new ArrayList<>();
    names.add(dayOfWeekField);
    names.add(dayOffsetField);
    periods.forEach(p -> names.add(p.name()));
    ratios.forEach(r -> names.add(r.name()));
    return names;
  }
}
