package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Writes rows as a header-bearing CSV table. Rows may be maps, whose keys become the columns in
 * first-seen order, or beans, whose properties do.
 */
public final class CsvTables {
  private CsvTables() {
  }

  public static CsvMapper newMapper() {
    CsvMapper mapper = new CsvMapper();
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  public static void write(CsvMapper mapper, Iterable<?> rows, OutputStream out)
      throws IOException {
    CsvSchema schema = schemaFor(mapper, rows);
    SequenceWriter writer = mapper.writer(schema).writeValues(out);
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  public static CsvSchema schemaFor(CsvMapper mapper, Iterable<?> rows) {
    Object sample = null;
    for (Object row : rows) {
      if (row != null) {
        sample = row;
        break;
      }
    }
    if (sample instanceof Map<?, ?>) {
      CsvSchema schema = schemaFromMaps(rows);
      if (schema != null) {
        return schema;
      }
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return mapper.schemaFor(Object.class).withHeader();
  }

  private static CsvSchema schemaFromMaps(Iterable<?> rows) {
    Set<String> columns = new LinkedHashSet<>();
    for (Object row : rows) {
      if (row instanceof Map<?, ?> map) {
        for (Object key : map.keySet()) {
          if (key != null) {
            columns.add(key.toString());
          }
        }
      }
    }
    if (columns.isEmpty()) {
      return null;
    }
    CsvSchema.Builder builder = CsvSchema.builder();
    columns.forEach(builder::addColumn);
    return builder.setUseHeader(true).build();
  }
}
