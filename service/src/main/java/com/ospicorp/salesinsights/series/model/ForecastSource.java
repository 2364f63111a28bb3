package com.ospicorp.salesinsights.series.model;

public enum ForecastSource {
  EXTERNAL,
  FALLBACK
}
