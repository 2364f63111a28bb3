package com.ospicorp.salesinsights.series.model;

import java.util.List;

public record Forecast(ForecastSource source, List<ForecastPoint> points) {

  public Forecast {
    points = List.copyOf(points);
  }
}
