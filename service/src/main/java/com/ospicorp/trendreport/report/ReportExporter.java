package com.ospicorp.trendreport.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.ospicorp.trendreport.pipeline.model.FeatureRecord;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a completed report under {@code <directory>/<report>/}: the feature records, one CSV per
 * aggregate, the trend outcome as JSON and, when the fit succeeded, the predictions.
 */
@Component
public class ReportExporter {
  private static final Logger log = LoggerFactory.getLogger(ReportExporter.class);

  private final ObjectMapper objectMapper;
  private final CsvMapper csvMapper = CsvTables.newMapper();

  public ReportExporter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<Path> export(ReportResult result, Path directory) throws IOException {
    Path target = directory.resolve(result.name());
    Files.createDirectories(target);
    List<Path> written = new ArrayList<>();

    List<Map<String, Object>> records = new ArrayList<>(result.records().size());
    for (FeatureRecord record : result.records()) {
      records.add(record.fields());
    }
    written.add(writeCsv(target.resolve("records.csv"), records));

    for (AggregateResult aggregate : result.aggregates().values()) {
      written.add(writeCsv(target.resolve("aggregate-" + aggregate.name() + ".csv"),
          aggregate.rows()));
    }

    TrendOutcome trend = result.trend();
    if (trend != null) {
      Path trendFile = target.resolve("trend.json");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(trendFile.toFile(), trend);
      written.add(trendFile);
      if (trend.isFitted()) {
        written.add(writeCsv(target.resolve("predictions.csv"),
            trend.evaluation().predictions()));
      }
    }
    log.info("Exported report {} to {} ({} files)", result.name(), target, written.size());
    return written;
  }

  private Path writeCsv(Path file, List<?> rows) throws IOException {
    try (OutputStream out = Files.newOutputStream(file)) {
      CsvTables.write(csvMapper, rows, out);
    }
    return file;
  }
}
