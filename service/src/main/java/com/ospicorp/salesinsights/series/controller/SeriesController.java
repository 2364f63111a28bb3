package com.ospicorp.salesinsights.series.controller;

import com.ospicorp.salesinsights.schema.Concept;
import com.ospicorp.salesinsights.series.model.BreakdownRow;
import com.ospicorp.salesinsights.series.model.Forecast;
import com.ospicorp.salesinsights.series.model.ForecastResponse;
import com.ospicorp.salesinsights.series.model.MonthlySeriesResponse;
import com.ospicorp.salesinsights.series.model.TimeSeriesPoint;
import com.ospicorp.salesinsights.series.service.SeriesService;
import com.ospicorp.salesinsights.web.InvalidParameterException;
import com.ospicorp.salesinsights.web.ResponseFormats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.format.annotation.DateTimeFormat.ISO;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@Tag(name = "Series")
public class SeriesController {
  private static final String DIMENSION_REGEX = "(?i)^(category|region)$";

  private final SeriesService svc;
  private final int defaultHorizon;
  private final int maxHorizon;

  public SeriesController(SeriesService svc,
      @Value("${insights.forecast.default-horizon:3}") int defaultHorizon,
      @Value("${insights.forecast.max-horizon:12}") int maxHorizon) {
    this.svc = svc;
    this.defaultHorizon = defaultHorizon;
    this.maxHorizon = maxHorizon;
  }

  @GetMapping("/v1/series/monthly")
  @Operation(summary = "Monthly actuals",
      description = "Monthly sales from the precomputed aggregate, or derived from raw orders.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Monthly series",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = MonthlySeriesResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "204", description = "No monthly data available")
  })
  public ResponseEntity<?> monthly(
      @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE)
      @Parameter(description = "First period (inclusive)") LocalDate start,
      @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE)
      @Parameter(description = "Last period (inclusive)") LocalDate end,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new InvalidParameterException("Invalid date range. start must not be after end.", 1001);
    }
    MediaType contentType = ResponseFormats.select(format, accept);
    Optional<List<TimeSeriesPoint>> series = svc.monthlyActuals(start, end);
    if (series.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    Object body = ResponseFormats.isCsv(contentType)
        ? series.get()
        : MonthlySeriesResponse.of(series.get());
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @GetMapping("/v1/series/forecast")
  @Operation(summary = "Forecast",
      description = "External forecast when valid, otherwise a flat rolling-mean fallback.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast points",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = ForecastResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "204", description = "Neither a forecast nor actuals available"),
      @ApiResponse(responseCode = "422", description = "Actuals hold no numeric values",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> forecast(
      @RequestParam(required = false) @Parameter(description = "Months to forecast (fallback only)", example = "3") Integer horizon,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    int months = horizon != null ? horizon : defaultHorizon;
    if (months < 1 || months > maxHorizon) {
      throw new InvalidParameterException(
          "Invalid horizon parameter. Supported range: 1-" + maxHorizon + ".", 1002);
    }
    MediaType contentType = ResponseFormats.select(format, accept);
    Optional<Forecast> forecast = svc.forecast(months);
    if (forecast.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    Object body = ResponseFormats.isCsv(contentType)
        ? forecast.get().points()
        : ForecastResponse.of(forecast.get());
    return ResponseEntity.ok()
        .header("X-Forecast-Source", forecast.get().source().name())
        .contentType(contentType)
        .body(body);
  }

  @GetMapping("/v1/breakdowns/{dimension}")
  @Operation(summary = "Sales breakdown", description = "Total sales by category or region.")
  public ResponseEntity<?> breakdown(
      @PathVariable @Pattern(regexp = DIMENSION_REGEX)
      @Parameter(description = "category or region", example = "category") String dimension,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    Concept concept = parseDimension(dimension);
    MediaType contentType = ResponseFormats.select(format, accept);
    Optional<List<BreakdownRow>> rows = svc.breakdown(concept);
    if (rows.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.ok().contentType(contentType).body(rows.get());
  }

  private static Concept parseDimension(String value) {
    return "region".equals(value.toLowerCase(Locale.ROOT)) ? Concept.REGION : Concept.CATEGORY;
  }
}
