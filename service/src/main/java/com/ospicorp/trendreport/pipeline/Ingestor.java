package com.ospicorp.trendreport.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.trendreport.pipeline.model.ColumnSpec;
import com.ospicorp.trendreport.pipeline.model.ColumnType;
import com.ospicorp.trendreport.pipeline.model.RawRecord;
import com.ospicorp.trendreport.pipeline.model.Schema;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a header-bearing CSV table into typed {@link RawRecord}s. The schema is checked once
 * here: every declared column must appear in the header, every row must have the header's width
 * and every typed cell must parse. Any violation aborts the read with a
 * {@link RecordParseException} naming the row and column.
 */
public final class Ingestor {
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final Schema schema;
  private final CsvMapper mapper = new CsvMapper();

  public Ingestor(Schema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  public List<RawRecord> read(Reader input) throws IOException {
    List<RawRecord> records = new ArrayList<>();
    long rowNumber = 0;
    try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(input)) {
      if (!rows.hasNextValue()) {
        throw new RecordParseException("Input has no header row", 0, null);
      }
      List<ColumnSpec> header = resolveHeader(rows.nextValue());
      while (rows.hasNextValue()) {
        String[] cells = rows.nextValue();
        rowNumber++;
        records.add(parseRow(rowNumber, cells, header));
      }
    } catch (JsonProcessingException ex) {
      throw new RecordParseException("Malformed CSV: " + ex.getOriginalMessage(), rowNumber + 1,
          null, ex);
    }
    return records;
  }

  private List<ColumnSpec> resolveHeader(String[] names) {
    List<ColumnSpec> header = new ArrayList<>(names.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < names.length; i++) {
      String name = names[i].trim();
      if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
        name = name.substring(1);
      }
      if (name.isEmpty()) {
        throw new RecordParseException("Blank header column at position " + (i + 1), 0, null);
      }
      if (!seen.add(name)) {
        throw new RecordParseException("Duplicate header column", 0, name);
      }
      header.add(schema.columnOrText(name));
    }
    for (ColumnSpec declared : schema.columns()) {
      if (!seen.contains(declared.name())) {
        throw new RecordParseException("Declared column missing from header", 0, declared.name());
      }
    }
    return header;
  }

  private RawRecord parseRow(long rowNumber, String[] cells, List<ColumnSpec> header) {
    if (cells.length != header.size()) {
      throw new RecordParseException(
          "Expected " + header.size() + " fields but found " + cells.length, rowNumber, null);
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < cells.length; i++) {
      ColumnSpec column = header.get(i);
      fields.put(column.name(), parseValue(cells[i], column, rowNumber));
    }
    return new RawRecord(rowNumber, fields);
  }

  private Object parseValue(String raw, ColumnSpec column, long rowNumber) {
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      if (column.required()) {
        throw new RecordParseException("Required value is empty", rowNumber, column.name());
      }
      // empty text stays "" so that normalization can see it
      return column.type() == ColumnType.TEXT ? raw : null;
    }
    try {
      return switch (column.type()) {
        case TEXT -> raw;
        case INTEGER -> Long.valueOf(trimmed);
        case DECIMAL -> parseDecimal(trimmed);
        case DATE -> LocalDate.parse(trimmed, schema.dateFormat());
        case TIME -> LocalTime.parse(trimmed, schema.timeFormat());
        case BOOLEAN -> parseBoolean(trimmed);
      };
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new RecordParseException("Cannot parse '" + raw + "' as " + column.type(), rowNumber,
          column.name(), ex);
    }
  }

  private static Double parseDecimal(String value) {
    double parsed = Double.parseDouble(value);
    if (!Double.isFinite(parsed)) {
      throw new NumberFormatException("Not a finite number: " + value);
    }
    return parsed;
  }

  private static Boolean parseBoolean(String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "t", "y", "yes", "1" -> Boolean.TRUE;
      case "false", "f", "n", "no", "0" -> Boolean.FALSE;
      default -> throw new NumberFormatException("Not a boolean: " + value);
    };
  }
}
