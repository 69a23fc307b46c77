package com.ospicorp.trendreport.pipeline;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Strict formatters for dataset date and time patterns. Impossible values such as 02/31 are
 * rejected instead of being moved to the end of the month. Date patterns may use {@code uuuu} or
 * {@code yyyy}; the latter is read as a year of the current era.
 */
public final class DatePatterns {
  private DatePatterns() {
  }

  public static DateTimeFormatter date(String pattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.ERA, 1)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  public static DateTimeFormatter time(String pattern) {
    return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
  }
}
