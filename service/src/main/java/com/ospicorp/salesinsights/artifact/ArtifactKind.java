package com.ospicorp.salesinsights.artifact;

/** The optional inputs the service knows about, with their default file names. */
public enum ArtifactKind {
  CUSTOMER_SEGMENTS("Customer segments", Location.OUTPUTS, "customer_segments.csv"),
  SEGMENT_PROFILE("Segment profiles", Location.OUTPUTS, "segment_profile.csv"),
  RAW_TRANSACTIONS("Raw orders", Location.DATA, "train.csv"),
  CATEGORY_AGGREGATE("Sales by category", Location.OUTPUTS, "sales_by_category.csv"),
  REGION_AGGREGATE("Sales by region", Location.OUTPUTS, "sales_by_region.csv"),
  MONTHLY_AGGREGATE("Sales by month", Location.OUTPUTS, "sales_by_month.csv"),
  EXTERNAL_FORECAST("Forecast", Location.OUTPUTS, "forecast_prophet.csv");

  public enum Location {
    OUTPUTS,
    DATA
  }

  private final String label;
  private final Location location;
  private final String fileName;

  ArtifactKind(String label, Location location, String fileName) {
    this.label = label;
    this.location = location;
    this.fileName = fileName;
  }

  public String label() {
    return label;
  }

  public Location location() {
    return location;
  }

  public String fileName() {
    return fileName;
  }
}
