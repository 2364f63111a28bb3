package com.ospicorp.salesinsights.customers.controller;

import com.ospicorp.salesinsights.artifact.TabularDataset;
import com.ospicorp.salesinsights.customers.service.CustomerOverview;
import com.ospicorp.salesinsights.customers.service.CustomerQuery;
import com.ospicorp.salesinsights.customers.service.CustomerService;
import com.ospicorp.salesinsights.customers.service.FilterOptions;
import com.ospicorp.salesinsights.web.DatasetResponse;
import com.ospicorp.salesinsights.web.InvalidParameterException;
import com.ospicorp.salesinsights.web.ResponseFormats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Customers")
public class CustomerController {
  private final CustomerService customers;

  public CustomerController(CustomerService customers) {
    this.customers = customers;
  }

  @GetMapping("/v1/customers")
  @Operation(summary = "Explore customers",
      description = "Customer segment records narrowed by segment, recency, sales and id search.")
  public ResponseEntity<?> explore(
      @RequestParam(required = false) @Parameter(description = "Segment, or All", example = "Champions") String segment,
      @RequestParam(name = "recency_min", required = false) Double recencyMin,
      @RequestParam(name = "recency_max", required = false) Double recencyMax,
      @RequestParam(name = "sales_min", required = false) Double salesMin,
      @RequestParam(name = "sales_max", required = false) Double salesMax,
      @RequestParam(name = "q", required = false) @Parameter(description = "Customer id substring") String search,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    checkRange(recencyMin, recencyMax, "recency", 1101);
    checkRange(salesMin, salesMax, "sales", 1102);
    MediaType contentType = ResponseFormats.select(format, accept);
    Optional<TabularDataset> result = customers.explore(
        new CustomerQuery(segment, recencyMin, recencyMax, salesMin, salesMax, search));
    return datasetResponse(result, contentType);
  }

  @GetMapping("/v1/customers/filters")
  @Operation(summary = "Customer filter options",
      description = "Segment values and numeric bounds for building filter controls.")
  public ResponseEntity<FilterOptions> filters() {
    return customers.filterOptions()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/v1/customers/overview")
  @Operation(summary = "Customer overview", description = "Customer count, sales, orders and segment share.")
  public CustomerOverview overview() {
    return customers.overview();
  }

  @GetMapping("/v1/profiles")
  @Tag(name = "Profiles")
  @Operation(summary = "Segment profiles", description = "Segment profile table, unmodified.")
  public ResponseEntity<?> profiles(
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    return datasetResponse(customers.profiles(), ResponseFormats.select(format, accept));
  }

  private static ResponseEntity<?> datasetResponse(Optional<TabularDataset> dataset,
      MediaType contentType) {
    if (dataset.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    Object body = ResponseFormats.isCsv(contentType)
        ? dataset.get()
        : DatasetResponse.of(dataset.get());
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  private static void checkRange(Double min, Double max, String name, int errorCode) {
    if (min != null && max != null && min > max) {
      throw new InvalidParameterException(
          "Invalid " + name + " range. " + name + "_min must not exceed " + name + "_max.",
          errorCode);
    }
  }
}
