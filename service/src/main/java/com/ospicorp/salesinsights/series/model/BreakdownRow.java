package com.ospicorp.salesinsights.series.model;

public record BreakdownRow(String key, Double total) {}
