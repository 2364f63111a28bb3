package com.ospicorp.salesinsights.series.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

// value may be null when a month had no numeric observations
@JsonPropertyOrder({"period", "value"})
public record TimeSeriesPoint(LocalDate period, Double value) {}
