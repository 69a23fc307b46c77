package com.ospicorp.trendreport.report;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ReportControllerTest {

  @Autowired
  private TestRestTemplate restTemplate;

  private ResponseEntity<Map<String, Object>> getMap(String path) {
    return restTemplate.exchange(path, HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});
  }

  @Test
  void listsEveryConfiguredReport() {
    ResponseEntity<List<Map<String, Object>>> response = restTemplate.exchange(
        "/v1/reports", HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> body = requireNonNull(response.getBody());
    assertThat(body).extracting(entry -> entry.get("name"))
        .containsExactly("events", "flat", "broken");
    assertThat(body).extracting(entry -> entry.get("status"))
        .containsExactly("COMPLETED", "COMPLETED", "FAILED");
  }

  @Test
  void summaryCarriesCountsAndTrendOutcome() {
    Map<String, Object> body = requireNonNull(getMap("/v1/reports/events").getBody());

    assertThat(body).containsEntry("title", "Fixture events");
    assertThat(body).containsEntry("record_count", 5);
    assertThat(body).containsEntry("undefined_ratios", Map.of("per_base", 1));
    assertThat(body).containsEntry("aggregates", List.of("by_borough", "daily"));
    assertThat(body).containsEntry("trend_fitted", true);
    assertThat(body).doesNotContainKey("last_failure");
  }

  @Test
  void failedReportSummaryNamesTheRow() {
    Map<String, Object> body = requireNonNull(getMap("/v1/reports/broken").getBody());

    assertThat(body).containsEntry("status", "FAILED");
    @SuppressWarnings("unchecked")
    Map<String, Object> failure = (Map<String, Object>) body.get("last_failure");
    assertThat(failure).containsEntry("error", "RecordParseException");
    assertThat(failure).containsEntry("row", 2);
  }

  @Test
  void recordsArePaged() {
    ResponseEntity<Map<String, Object>> response =
        getMap("/v1/reports/events/records?page=2&page_size=2");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = requireNonNull(response.getBody());
    assertThat(body).containsEntry("total_records", 5);
    assertThat(body).containsEntry("total_pages", 3);
    assertThat(body).containsEntry("has_more", true);
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> records = (List<Map<String, Object>>) body.get("records");
    assertThat(records).hasSize(2);
    assertThat(records.get(0)).containsEntry("id", 3);
    assertThat(records.get(0)).containsEntry("date", "2024-01-02");
    assertThat(records.get(0)).containsEntry("day_of_week", "Tuesday");
    assertThat(records.get(0)).containsEntry("perp_sex", "UNKNOWN");
  }

  @Test
  void recordsAsCsv() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/v1/reports/events/records?format=csv", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    String[] lines = requireNonNull(response.getBody()).split("\\R");
    assertThat(lines).hasSize(6);
    assertThat(lines[0]).isEqualTo(
        "id,date,borough,fatal,perp_sex,amount,base,day_of_week,day_offset,week,per_base");
  }

  @Test
  void acceptHeaderSelectsCsv() {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT, "text/csv");
    ResponseEntity<String> response = restTemplate.exchange(
        "/v1/reports/events/aggregates/by_borough", HttpMethod.GET, new HttpEntity<>(headers),
        String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    String[] lines = requireNonNull(response.getBody()).split("\\R");
    assertThat(lines[0]).isEqualTo("borough,records,events,fatal,per_base");
    assertThat(lines[1]).isEqualTo("BRONX,3,3.0,1.0,25.0");
    assertThat(lines[2]).isEqualTo("QUEENS,2,2.0,1.0,10.0");
  }

  @Test
  void aggregateAsJsonIncludesRunningTotal() {
    Map<String, Object> body = requireNonNull(
        getMap("/v1/reports/events/aggregates/daily").getBody());

    assertThat(body).containsEntry("order_by", "date");
    assertThat(body).containsEntry("running_total", "events");
    assertThat(body).containsEntry("bucket_count", 4);
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> rows = (List<Map<String, Object>>) body.get("rows");
    assertThat(rows).extracting(row -> row.get("running_total"))
        .containsExactly(2.0, 3.0, 4.0, 5.0);
  }

  @Test
  void trendAndPredictions() {
    Map<String, Object> trend = requireNonNull(getMap("/v1/reports/events/trend").getBody());
    @SuppressWarnings("unchecked")
    Map<String, Object> model = (Map<String, Object>) trend.get("model");
    assertThat((Double) model.get("slope")).isCloseTo(80d / 6.8d, offset(1e-9));
    assertThat(model).containsKeys("r_squared", "p_value", "degrees_of_freedom");

    ResponseEntity<List<Map<String, Object>>> predictions = restTemplate.exchange(
        "/v1/reports/events/predictions", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});
    assertThat(predictions.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(predictions.getBody()).hasSize(5);
    assertThat(predictions.getBody().get(0)).containsKeys("x", "actual", "predicted", "residual");
  }

  @Test
  void degenerateTrendHasNoPredictions() {
    Map<String, Object> trend = requireNonNull(getMap("/v1/reports/flat/trend").getBody());
    assertThat(trend).doesNotContainKey("model");
    assertThat((String) trend.get("failure")).contains("zero variance");

    ResponseEntity<Map<String, Object>> response = getMap("/v1/reports/flat/predictions");
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
  }

  @Test
  void failedReportHasNoData() {
    ResponseEntity<Map<String, Object>> response = getMap("/v1/reports/broken/records");
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
  }

  @Test
  void unknownAggregateAndMissingTrendAreNotFound() {
    assertThat(getMap("/v1/reports/events/aggregates/weekly").getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(getMap("/v1/reports/nope/records").getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void invalidPagingAndFormatCarryErrorCodes() {
    ResponseEntity<Map<String, Object>> page = getMap("/v1/reports/events/records?page=0");
    assertThat(page.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(page.getBody()).containsEntry("errorCode", 1005);

    ResponseEntity<Map<String, Object>> size =
        getMap("/v1/reports/events/records?page_size=1001");
    assertThat(size.getBody()).containsEntry("errorCode", 1006);

    ResponseEntity<Map<String, Object>> format =
        getMap("/v1/reports/events/predictions?format=xml");
    assertThat(format.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(format.getBody()).containsEntry("errorCode", 1007);
    assertThat(format.getBody()).containsEntry("moreInfo",
        "https://docs.trend-report.dev/errors/1007");
  }

  @Test
  void healthIsDownWhileAReportHasFailed() {
    ResponseEntity<Map<String, Object>> response = getMap("/actuator/health");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    @SuppressWarnings("unchecked")
    Map<String, Object> components = (Map<String, Object>) response.getBody().get("components");
    @SuppressWarnings("unchecked")
    Map<String, Object> reports = (Map<String, Object>) components.get("reports");
    assertThat(reports).containsEntry("status", "DOWN");
    assertThat(reports.get("details")).isEqualTo(
        Map.of("events", "COMPLETED", "flat", "COMPLETED", "broken", "FAILED"));
  }
}
