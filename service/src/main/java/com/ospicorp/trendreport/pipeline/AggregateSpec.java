package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.AggregatedBucket;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What to group by and what to measure. With an ordering key, buckets come out sorted by it
 * (ties broken by the full key tuple), transforms run along that order and a running total may be
 * requested over one COUNT or SUM measure or one transform output.
 */
public record AggregateSpec(
    String name,
    List<String> keys,
    List<MeasureSpec> measures,
    String orderBy,
    String runningTotal,
    List<TransformSpec> transforms
) {
  public static final String RECORDS_COLUMN = "records";
  public static final String RUNNING_TOTAL_COLUMN = "running_total";

  public AggregateSpec {
    Objects.requireNonNull(name, "name");
    keys = keys == null ? List.of() : List.copyOf(keys);
    measures = measures == null ? List.of() : List.copyOf(measures);
    transforms = transforms == null ? List.of() : List.copyOf(transforms);
    validate(name, keys, measures, orderBy, runningTotal, transforms);
  }

  public static AggregateSpec of(String name, List<String> keys, MeasureSpec... measures) {
    return new AggregateSpec(name, keys, List.of(measures), null, null, List.of());
  }

  public AggregateSpec orderedBy(String field) {
    return new AggregateSpec(name, keys, measures, field, runningTotal, transforms);
  }

  public AggregateSpec withRunningTotal(String measure) {
    return new AggregateSpec(name, keys, measures, orderBy, measure, transforms);
  }

  public AggregateSpec withTransforms(List<TransformSpec> extra) {
    return new AggregateSpec(name, keys, measures, orderBy, runningTotal, extra);
  }

  public boolean isCumulative() {
    return runningTotal != null;
  }

  public Comparator<AggregatedBucket> bucketOrder() {
    Comparator<AggregatedBucket> byTuple =
        Comparator.comparing(AggregatedBucket::keyValues, KeyOrdering.TUPLES);
    if (orderBy == null) {
      return byTuple;
    }
    return Comparator.<AggregatedBucket, Object>comparing(b -> b.key().get(orderBy),
        KeyOrdering.VALUES).thenComparing(byTuple);
  }

  private static void validate(String name, List<String> keys, List<MeasureSpec> measures,
      String orderBy, String runningTotal, List<TransformSpec> transforms) {
    if (measures.isEmpty()) {
      throw new IllegalArgumentException("Aggregate " + name + " defines no measures");
    }
    Set<String> columns = new HashSet<>(keys);
    if (columns.size() != keys.size()) {
      throw new IllegalArgumentException("Aggregate " + name + " repeats a group key");
    }
    columns.add(RECORDS_COLUMN);
    columns.add(RUNNING_TOTAL_COLUMN);
    Set<String> summable = new HashSet<>();
    for (MeasureSpec measure : measures) {
      if (!columns.add(measure.name())) {
        throw new IllegalArgumentException(
            "Aggregate " + name + " reuses the column name " + measure.name());
      }
      if (measure.op() == MeasureOp.COUNT || measure.op() == MeasureOp.SUM) {
        summable.add(measure.name());
      }
    }
    if (orderBy != null && !keys.contains(orderBy)) {
      throw new IllegalArgumentException(
          "Aggregate " + name + " orders by " + orderBy + ", which is not a group key");
    }
    for (TransformSpec transform : transforms) {
      if (orderBy == null) {
        throw new IllegalArgumentException(
            "Aggregate " + name + " needs an ordering key for transform " + transform.name());
      }
      if (!columns.contains(transform.measure()) || keys.contains(transform.measure())) {
        throw new IllegalArgumentException("Transform " + transform.name()
            + " refers to unknown measure " + transform.measure());
      }
      if (!columns.add(transform.name())) {
        throw new IllegalArgumentException(
            "Aggregate " + name + " reuses the column name " + transform.name());
      }
      summable.add(transform.name());
    }
    if (runningTotal != null) {
      if (orderBy == null) {
        throw new IllegalArgumentException(
            "Aggregate " + name + " needs an ordering key for its running total");
      }
      if (!summable.contains(runningTotal)) {
        throw new IllegalArgumentException("Aggregate " + name + " cannot keep a running total of "
            + runningTotal + "; use a COUNT or SUM measure or a transform");
      }
    }
  }
}
