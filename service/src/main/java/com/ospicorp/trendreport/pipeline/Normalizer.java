package com.ospicorp.trendreport.pipeline;

import com.ospicorp.trendreport.pipeline.model.CanonicalRecord;
import com.ospicorp.trendreport.pipeline.model.RawRecord;
import com.ospicorp.trendreport.pipeline.model.TabularRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Rewrites designated categorical fields to the sentinel when their value is one of the field's
 * bad values. Matching is exact and case-sensitive on the value's string form, fields are
 * handled independently, and fields without a rule are never touched. Rewriting an already
 * canonical record changes nothing.
 */
public final class Normalizer {
  private final NormalizationRules rules;

  public Normalizer(NormalizationRules rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  public CanonicalRecord normalize(TabularRecord record) {
    Map<String, Object> fields = new LinkedHashMap<>(record.fields());
    for (String field : rules.designatedFields()) {
      if (fields.containsKey(field) && isBad(field, fields.get(field))) {
        fields.put(field, rules.sentinel());
      }
    }
    return new CanonicalRecord(record.rowNumber(), fields);
  }

  public List<CanonicalRecord> normalizeAll(List<RawRecord> records, boolean parallel) {
    Stream<RawRecord> stream = parallel ? records.parallelStream() : records.stream();
    return stream.map(this::normalize).toList();
  }

  private boolean isBad(String field, Object value) {
    if (value == null) {
      return true;
    }
    return rules.badValues(field).contains(value.toString());
  }
}
