package com.ospicorp.salesinsights.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import java.util.List;

public record DatasetResponse(
    List<String> columns,
    @JsonProperty("row_count") int rowCount,
    List<List<String>> rows
) {

  public static DatasetResponse of(TabularDataset dataset) {
    return new DatasetResponse(dataset.columns(), dataset.rowCount(), dataset.rows());
  }
}
