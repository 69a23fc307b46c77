package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.CanonicalRecord;
import com.ospicorp.trendreport.pipeline.model.FeatureRecord;
import com.ospicorp.trendreport.pipeline.model.TabularRecord;
import com.ospicorp.trendreport.pipeline.model.Weekday;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds temporal and ratio fields to canonical records.
 *
 * <p>Day offsets are computed in two phases: {@link #minimumDate} reduces the whole dataset to
 * its earliest date, then {@link #derive} maps each record given that date. {@link #deriveAll}
 * finishes the reduction before any record is mapped.
 */
public final class FeatureDeriver {
  private static final Logger log = LoggerFactory.getLogger(FeatureDeriver.class);

  private final FeatureSpec spec;

  public FeatureDeriver(FeatureSpec spec) {
    this.spec = Objects.requireNonNull(spec, "spec");
  }

  public List<FeatureRecord> deriveAll(List<CanonicalRecord> records, boolean parallel) {
    Optional<LocalDate> minimum = minimumDate(records);
    if (minimum.isEmpty()) {
      return List.of();
    }
    LocalDate start = minimum.get();
    Stream<CanonicalRecord> stream = parallel ? records.parallelStream() : records.stream();
    return stream.map(record -> derive(record, start)).toList();
  }

  public Optional<LocalDate> minimumDate(List<? extends TabularRecord> records) {
    return records.stream().map(this::dateOf).min(Comparator.naturalOrder());
  }

  public FeatureRecord derive(TabularRecord record, LocalDate minimumDate) {
    LocalDate date = dateOf(record);
    if (date.isBefore(minimumDate)) {
      throw new IllegalArgumentException("Row " + record.rowNumber() + " is dated " + date
          + ", before the dataset minimum " + minimumDate);
    }
    Weekday dayOfWeek = Weekday.of(date);
    long dayOffset = ChronoUnit.DAYS.between(minimumDate, date);

    Map<String, Object> fields = new LinkedHashMap<>(record.fields());
    putDerived(fields, spec.dayOfWeekField(), dayOfWeek);
    putDerived(fields, spec.dayOffsetField(), dayOffset);
    for (PeriodSpec period : spec.periods()) {
      putDerived(fields, period.name(), Periods.periodEnd(date, period.frequency()));
    }

    Set<String> undefined = new HashSet<>();
    for (RatioSpec ratio : spec.ratios()) {
      Double value;
      try {
        value = ratio(ratio, record);
      } catch (UndefinedRatioException ex) {
        log.debug("Row {}: {}", record.rowNumber(), ex.getMessage());
        undefined.add(ratio.name());
        value = null;
      }
      putDerived(fields, ratio.name(), value);
    }
    return new FeatureRecord(record.rowNumber(), fields, date, dayOfWeek, dayOffset, undefined);
  }

  public static double ratio(RatioSpec ratio, TabularRecord record) {
    Double numerator = Numbers.toDouble(ratio.numerator(), record.get(ratio.numerator()));
    Double denominator = Numbers.toDouble(ratio.denominator(), record.get(ratio.denominator()));
    if (numerator == null || denominator == null) {
      throw new UndefinedRatioException(ratio.name(), "missing operand");
    }
    if (denominator == 0d) {
      throw new UndefinedRatioException(ratio.name(), "denominator is zero");
    }
    double value = numerator / denominator * ratio.scale();
    if (!Double.isFinite(value)) {
      throw new UndefinedRatioException(ratio.name(), "result is not finite");
    }
    return value;
  }

  LocalDate dateOf(TabularRecord record) {
    String field = spec.dateField();
    Object value = record.get(field);
    if (value instanceof LocalDate date) {
      return date;
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return LocalDate.parse(text.trim(), spec.dateFormat());
      } catch (DateTimeParseException ex) {
        throw new RecordParseException("Cannot parse date '" + text + "'", record.rowNumber(),
            field, ex);
      }
    }
    if (value == null || value instanceof String) {
      throw new RecordParseException("Date is missing", record.rowNumber(), field);
    }
    throw new RecordParseException("Unsupported date value of type "
        + value.getClass().getSimpleName(), record.rowNumber(), field);
  }

  private static void putDerived(Map<String, Object> fields, String name, Object value) {
    if (fields.containsKey(name)) {
      throw new IllegalArgumentException("Derived field " + name + " collides with an input column");
    }
    fields.put(name, value);
  }
}
