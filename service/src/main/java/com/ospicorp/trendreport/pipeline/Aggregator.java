package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.AggregatedBucket;
import com.ospicorp.trendreport.pipeline.model.CumulativePoint;
import com.ospicorp.trendreport.pipeline.model.CumulativeSeries;
import com.ospicorp.trendreport.pipeline.model.TabularRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grouped reduction of records into buckets, and running totals over the ordered buckets.
 *
 * <p>The per-group accumulator is commutative and associative, so a parallel stream or any
 * input order yields the same buckets. A {@code null} measure value (an undefined ratio, an empty
 * optional cell) is left out of that measure only; the group's record count still includes it.
 */
public final class Aggregator {
  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private Aggregator() {
  }

  public static List<AggregatedBucket> aggregate(List<? extends TabularRecord> records,
      AggregateSpec spec) {
    return aggregate(records, spec, false);
  }

  public static List<AggregatedBucket> aggregate(List<? extends TabularRecord> records,
      AggregateSpec spec, boolean parallel) {
    if (records.isEmpty()) {
      return List.of();
    }
    List<TabularRecord> rows = List.copyOf(records);
    Stream<TabularRecord> stream = parallel ? rows.parallelStream() : rows.stream();
    Map<List<Object>, GroupAccumulator> groups = stream.collect(Collectors.groupingBy(
        record -> keyOf(record, spec.keys()),
        HashMap::new,
        Collector.of(
            () -> new GroupAccumulator(spec.measures()),
            GroupAccumulator::add,
            GroupAccumulator::merge)));

    List<AggregatedBucket> buckets = new ArrayList<>(groups.size());
    groups.forEach((key, group) -> buckets.add(group.toBucket(spec.keys(), key)));
    buckets.sort(spec.bucketOrder());

    List<AggregatedBucket> result = buckets;
    for (TransformSpec transform : spec.transforms()) {
      result = SeriesTransformer.apply(result, spec, transform);
    }
    return List.copyOf(result);
  }

  public static CumulativeSeries cumulative(List<AggregatedBucket> buckets, AggregateSpec spec) {
    if (!spec.isCumulative()) {
      throw new IllegalArgumentException(
          "Aggregate " + spec.name() + " does not define a running total");
    }
    String measure = spec.runningTotal();
    List<AggregatedBucket> ordered = new ArrayList<>(buckets);
    ordered.sort(spec.bucketOrder());

    List<CumulativePoint> points = new ArrayList<>(ordered.size());
    double total = 0d;
    int negatives = 0;
    for (AggregatedBucket bucket : ordered) {
      Double value = bucket.measure(measure);
      if (value != null) {
        if (value < 0d) {
          negatives++;
        }
        total += value;
      }
      points.add(new CumulativePoint(bucket, total));
    }
    if (negatives > 0) {
      log.warn("Running total of {} in aggregate {} includes {} negative values and is not "
          + "monotonic", measure, spec.name(), negatives);
    }
    return new CumulativeSeries(spec.orderBy(), measure, points);
  }

  private static List<Object> keyOf(TabularRecord record, List<String> keys) {
    Object[] values = new Object[keys.size()];
    for (int i = 0; i < values.length; i++) {
      String field = keys.get(i);
      if (!record.has(field)) {
        throw new IllegalArgumentException("Unknown group field " + field);
      }
      values[i] = record.get(field);
    }
    // Arrays.asList tolerates null key values, List.of does not
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  static final class GroupAccumulator {
    private final List<MeasureSpec> measures;
    private final long[] contributions;
    private final double[] sums;
    private final double[] minimums;
    private final double[] maximums;
    private long records;

    GroupAccumulator(List<MeasureSpec> measures) {
      this.measures = measures;
      this.contributions = new long[measures.size()];
      this.sums = new double[measures.size()];
      this.minimums = new double[measures.size()];
      this.maximums = new double[measures.size()];
      Arrays.fill(minimums, Double.POSITIVE_INFINITY);
      Arrays.fill(maximums, Double.NEGATIVE_INFINITY);
    }

    void add(TabularRecord record) {
      records++;
      for (int i = 0; i < measures.size(); i++) {
        MeasureSpec measure = measures.get(i);
        if (measure.op() == MeasureOp.COUNT) {
          continue;
        }
        if (!record.has(measure.field())) {
          throw new IllegalArgumentException(
              "Unknown field " + measure.field() + " for measure " + measure.name());
        }
        Double value = Numbers.toDouble(measure.field(), record.get(measure.field()));
        if (value == null) {
          continue;
        }
        contributions[i]++;
        sums[i] += value;
        minimums[i] = Math.min(minimums[i], value);
        maximums[i] = Math.max(maximums[i], value);
      }
    }

    GroupAccumulator merge(GroupAccumulator other) {
      records += other.records;
      for (int i = 0; i < measures.size(); i++) {
        contributions[i] += other.contributions[i];
        sums[i] += other.sums[i];
        minimums[i] = Math.min(minimums[i], other.minimums[i]);
        maximums[i] = Math.max(maximums[i], other.maximums[i]);
      }
      return this;
    }

    AggregatedBucket toBucket(List<String> keys, List<Object> keyValues) {
      Map<String, Object> key = new LinkedHashMap<>();
      for (int i = 0; i < keys.size(); i++) {
        key.put(keys.get(i), keyValues.get(i));
      }
      Map<String, Double> values = new LinkedHashMap<>();
      for (int i = 0; i < measures.size(); i++) {
        values.put(measures.get(i).name(), value(i));
      }
      return new AggregatedBucket(key, records, values);
    }

    private Double value(int i) {
      if (measures.get(i).op() == MeasureOp.COUNT) {
        return (double) records;
      }
      if (contributions[i] == 0) {
        return null;
      }
      return switch (measures.get(i).op()) {
        case SUM -> sums[i];
        case MEAN -> sums[i] / contributions[i];
        case MIN -> minimums[i];
        case MAX -> maximums[i];
        case COUNT -> (double) records;
      };
    }
  }
}
