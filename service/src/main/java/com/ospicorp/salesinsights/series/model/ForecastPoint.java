package com.ospicorp.salesinsights.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;
import java.util.Objects;

@JsonPropertyOrder({"period", "point_estimate", "lower_bound", "upper_bound"})
public record ForecastPoint(
    LocalDate period,
    @JsonProperty("point_estimate") double pointEstimate,
    @JsonProperty("lower_bound") double lowerBound,
    @JsonProperty("upper_bound") double upperBound
) {

  public ForecastPoint {
    Objects.requireNonNull(period, "period");
    if (!(lowerBound <= pointEstimate && pointEstimate <= upperBound)) {
      throw new IllegalArgumentException("Forecast band must satisfy lower <= point <= upper, got "
          + lowerBound + " / " + pointEstimate + " / " + upperBound);
    }
  }
}
