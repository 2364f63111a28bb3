package com.ospicorp.salesinsights.customers.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Headline metrics; a metric is null when its input column or dataset is unavailable. */
public record CustomerOverview(
    Integer customers,
    @JsonProperty("total_sales") Double totalSales,
    @JsonProperty("total_orders") Long totalOrders,
    @JsonProperty("segment_share") List<SegmentCount> segmentShare
) {

  public record SegmentCount(String segment, int customers) {}
}
