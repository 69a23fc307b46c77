package com.ospicorp.trendreport.pipeline;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-field sets of values that mean "missing". Several rules may name the same field; their
 * value sets are merged.
 */
public final class NormalizationRules {
  public static final String UNKNOWN = "UNKNOWN";

  private final String sentinel;
  private final Map<String, Set<String>> badValuesByField;

  private NormalizationRules(String sentinel, Map<String, Set<String>> badValuesByField) {
    this.sentinel = sentinel;
    this.badValuesByField = badValuesByField;
  }

  public static NormalizationRules none() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String sentinel() {
    return sentinel;
  }

  public Set<String> designatedFields() {
    return badValuesByField.keySet();
  }

  public Set<String> badValues(String field) {
    return badValuesByField.getOrDefault(field, Set.of());
  }

  public boolean isDesignated(String field) {
    return badValuesByField.containsKey(field);
  }

  public static final class Builder {
    private String sentinel = UNKNOWN;
    private final Map<String, Set<String>> badValues = new HashMap<>();

    private Builder() {
    }

    public Builder sentinel(String sentinel) {
      this.sentinel = Objects.requireNonNull(sentinel, "sentinel");
      return this;
    }

    public Builder rule(Collection<String> fields, Collection<String> values) {
      for (String field : fields) {
        badValues.computeIfAbsent(field, f -> new HashSet<>()).addAll(values);
      }
      return this;
    }

    public NormalizationRules build() {
      Map<String, Set<String>> frozen = new HashMap<>();
      badValues.forEach((field, values) -> frozen.put(field, Set.copyOf(values)));
      return new NormalizationRules(sentinel, Map.copyOf(frozen));
    }
  }
}
