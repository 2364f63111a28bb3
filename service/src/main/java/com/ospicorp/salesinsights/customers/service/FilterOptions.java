package com.ospicorp.salesinsights.customers.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterOptions(
    List<String> segments,
    @JsonProperty("recency_min") Integer recencyMin,
    @JsonProperty("recency_max") Integer recencyMax,
    @JsonProperty("sales_min") Double salesMin,
    @JsonProperty("sales_max") Double salesMax
) {}
