package com.ospicorp.salesinsights.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ForecastResponse(
    ForecastSource source,
    @JsonProperty("point_count") int pointCount,
    List<ForecastPoint> points
) {

  public static ForecastResponse of(Forecast forecast) {
    return new ForecastResponse(forecast.source(), forecast.points().size(), forecast.points());
  }
}
