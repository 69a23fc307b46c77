package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.AggregatedBucket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Period-over-period transforms of an ordered aggregate measure. Buckets are split into
 * partitions by every group key except the ordering key, and each partition is transformed on
 * its own: daily new cases per state out of cumulative cases per state and date.
 */
public final class SeriesTransformer {
  private SeriesTransformer() {
  }

  public static List<AggregatedBucket> apply(List<AggregatedBucket> ordered, AggregateSpec spec,
      TransformSpec transform) {
    Map<List<Object>, List<Integer>> partitions = new LinkedHashMap<>();
    for (int i = 0; i < ordered.size(); i++) {
      partitions.computeIfAbsent(partitionKey(ordered.get(i), spec), k -> new ArrayList<>())
          .add(i);
    }
    Double[] derived = new Double[ordered.size()];
    for (List<Integer> indexes : partitions.values()) {
      List<Double> in = new ArrayList<>(indexes.size());
      for (int index : indexes) {
        in.add(ordered.get(index).measure(transform.measure()));
      }
      List<Double> out = apply(in, transform.type());
      for (int i = 0; i < indexes.size(); i++) {
        derived[indexes.get(i)] = out.get(i);
      }
    }
    List<AggregatedBucket> result = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      result.add(ordered.get(i).withMeasure(transform.name(), derived[i]));
    }
    return result;
  }

  /** Transforms one partition's values into a new list; the input is never returned or modified. */
  public static List<Double> apply(List<Double> in, Transform t) {
    List<Double> out = new ArrayList<>(in.size());
    switch (t) {
      case AS_IS -> out.addAll(in);
      case DIFF -> {
        Double prev = null;
        for (Double value : in) {
          Double v = (prev == null || value == null) ? null : value - prev;
          out.add(normalize(v));
          prev = value;
        }
      }
      case PCT_CHANGE -> {
        Double prev = null;
        for (Double value : in) {
          Double v = (prev == null || value == null || prev == 0d)
              ? null
              : ((value / prev) - 1d) * 100d;
          out.add(normalize(v));
          prev = value;
        }
      }
    }
    return out;
  }

  private static List<Object> partitionKey(AggregatedBucket bucket, AggregateSpec spec) {
    List<Object> key = new ArrayList<>(spec.keys().size());
    for (String field : spec.keys()) {
      if (!field.equals(spec.orderBy())) {
        key.add(bucket.key().get(field));
      }
    }
    return Collections.unmodifiableList(key);
  }

  private static Double normalize(Double value) {
    if (value == null) {
      return null;
    }
    double scaled = Math.round(value * 1_000_000d);
    return scaled / 1_000_000d;
  }
}
