package com.ospicorp.trendreport.report;

import com.ospicorp.trendreport.config.PipelineProperties;
import com.ospicorp.trendreport.pipeline.model.Prediction;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reports")
@Validated
@Tag(name = "Reports")
public class ReportController {
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final String ERROR_DOCS_BASE = "https://docs.trend-report.dev/errors/";
  private static final int MAX_PAGE_SIZE = 1000;

  private final ReportQueryService queries;

  public ReportController(ReportQueryService queries) {
    this.queries = queries;
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List reports", description = "Status and outline of every configured report.")
  @ApiResponse(responseCode = "200", description = "Report summaries",
      content = @Content(mediaType = "application/json",
          array = @ArraySchema(schema = @Schema(implementation = ReportSummary.class))))
  public List<ReportSummary> list() {
    return queries.summaries();
  }

  @GetMapping("/{name}")
  @Operation(summary = "Get report summary",
      description = "Status, timings, record count, aggregates and trend outcome of one report.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Report summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ReportSummary.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ReportSummary get(@PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Report name", example = "incidents") String name) {
    return queries.summary(name);
  }

  @GetMapping("/{name}/records")
  @Tag(name = "Data")
  @Operation(summary = "Get feature records",
      description = "Normalized records with their derived fields, paged, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Records",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = RecordsPage.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Report has no completed run",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> records(@PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Report name", example = "incidents") String name,
      @RequestParam(defaultValue = "1") @Parameter(description = "Page number") int page,
      @RequestParam(name = "page_size", defaultValue = "500")
          @Parameter(description = "Page size") int pageSize,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    validatePage(page);
    validatePageSize(pageSize);
    MediaType contentType = selectMediaType(format, accept);
    RecordsPage result = queries.records(name, page, pageSize);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? result.records() : result;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/{name}/aggregates/{aggregate}")
  @Tag(name = "Data")
  @Operation(summary = "Get aggregate rows",
      description = "Group keys, record count, measures and running total per bucket.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Aggregate rows",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = AggregateView.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Report has no completed run",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> aggregate(
      @PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Report name", example = "incidents") String name,
      @PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Aggregate name", example = "by_boro") String aggregate,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    AggregateView view = queries.aggregate(name, aggregate);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? view.rows() : view;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/{name}/trend")
  @Tag(name = "Trend")
  @Operation(summary = "Get trend outcome",
      description = "Fitted linear trend with its evaluation, or the reason it could not be fitted.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Trend outcome",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TrendOutcome.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Report has no completed run",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public TrendOutcome trend(@PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Report name", example = "cases") String name) {
    return queries.trend(name);
  }

  @GetMapping("/{name}/predictions")
  @Tag(name = "Trend")
  @Operation(summary = "Get predictions",
      description = "Predicted against actual values with residuals, as JSON or CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Predictions",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = Prediction.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Report has no completed run",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Trend could not be fitted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<Prediction>> predictions(
      @PathVariable @Pattern(regexp = PipelineProperties.NAME_REGEX)
      @Parameter(description = "Report name", example = "cases") String name,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok().contentType(contentType).body(queries.predictions(name));
  }

  private static void validatePage(int page) {
    if (page < 1) {
      throw invalidParameter("Invalid page parameter. Must be greater than or equal to 1.", 1005);
    }
  }

  private static void validatePageSize(int pageSize) {
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw invalidParameter(
          "Invalid page_size parameter. Supported range: 1-" + MAX_PAGE_SIZE + ".", 1006);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 1007);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
