package com.ospicorp.trendreport.report;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.trendreport.config.PipelineProperties;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class ReportExporterTest {
  private static final String EVENTS_CSV = "id,date,borough,fatal,perp_sex,amount,base\n"
      + "1,2024-01-01,BRONX,true,M,10,2\n"
      + "2,2024-01-02,QUEENS,false,F,20,4\n"
      + "3,2024-01-03,BRONX,false,,40,0\n";

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final ReportExporter exporter = new ReportExporter(objectMapper);

  @TempDir
  Path dir;

  private ReportResult events(PipelineProperties.Trend trend) throws Exception {
    ReportService service = new ReportService(new DefaultResourceLoader(), new ReportRegistry(),
        exporter, new PipelineProperties(true, false, false, null, List.of()));
    return service.execute(ReportDefinition.compile(ReportFixtures.events(trend)),
        new StringReader(EVENTS_CSV));
  }

  @Test
  void writesRecordsAggregatesAndTrend() throws Exception {
    List<Path> written = exporter.export(events(ReportFixtures.recordsTrend(0)), dir);

    Path target = dir.resolve("events");
    assertEquals(List.of(
        target.resolve("records.csv"),
        target.resolve("aggregate-by_borough.csv"),
        target.resolve("aggregate-daily.csv"),
        target.resolve("trend.json"),
        target.resolve("predictions.csv")), written);

    List<String> records = Files.readAllLines(target.resolve("records.csv"),
        StandardCharsets.UTF_8);
    assertEquals(4, records.size());
    assertEquals("id,date,borough,fatal,perp_sex,amount,base,day_of_week,day_offset,week,per_base",
        records.get(0));
    assertTrue(records.get(1).startsWith("1,2024-01-01,BRONX,true,M,10.0,2.0,Monday,0,2024-01-07"));
    assertTrue(records.get(3).endsWith(","));

    List<String> daily = Files.readAllLines(target.resolve("aggregate-daily.csv"));
    assertEquals("date,records,events,amount,amount_change,running_total", daily.get(0));
    assertEquals("2024-01-01,1,1.0,10.0,,1.0", daily.get(1));

    JsonNode trend = objectMapper.readTree(target.resolve("trend.json").toFile());
    assertEquals("records", trend.get("source").asText());
    assertEquals(15d, trend.get("model").get("slope").asDouble(), 1e-9);
    assertTrue(trend.get("model").has("r_squared"));
    assertFalse(trend.has("failure"));

    List<String> predictions = Files.readAllLines(target.resolve("predictions.csv"));
    assertEquals(4, predictions.size());
    assertTrue(predictions.get(0).contains("predicted"));
  }

  @Test
  void degenerateTrendHasNoPredictionsFile() throws Exception {
    List<Path> written = exporter.export(events(ReportFixtures.recordsTrend(3)), dir);

    Path target = dir.resolve("events");
    assertTrue(written.contains(target.resolve("trend.json")));
    assertFalse(Files.exists(target.resolve("predictions.csv")));
    JsonNode trend = objectMapper.readTree(target.resolve("trend.json").toFile());
    assertTrue(trend.get("failure").asText().contains("Holdout"));
    assertFalse(trend.has("model"));
  }

  @Test
  void reportWithoutTrendWritesTablesOnly() throws Exception {
    List<Path> written = exporter.export(events(null), dir);
    assertEquals(3, written.size());
    assertFalse(Files.exists(dir.resolve("events").resolve("trend.json")));
  }
}
