package com.ospicorp.salesinsights.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonthlySeriesResponse(
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("point_count") int pointCount,
    List<List<Object>> points
) {

  /** Points as [period, value] tuples. */
  public static MonthlySeriesResponse of(List<TimeSeriesPoint> series) {
    List<List<Object>> tuples = new ArrayList<>(series.size());
    for (TimeSeriesPoint point : series) {
      List<Object> tuple = new ArrayList<>(2);
      tuple.add(point.period().toString());
      tuple.add(point.value());
      tuples.add(tuple);
    }
    LocalDate first = series.isEmpty() ? null : series.get(0).period();
    LocalDate last = series.isEmpty() ? null : series.get(series.size() - 1).period();
    return new MonthlySeriesResponse(first, last, series.size(), tuples);
  }
}
