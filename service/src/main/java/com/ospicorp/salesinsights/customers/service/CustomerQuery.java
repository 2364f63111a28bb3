package com.ospicorp.salesinsights.customers.service;

/** Interactive customer filters; null or blank fields are not applied. */
public record CustomerQuery(
    String segment,
    Double recencyMin,
    Double recencyMax,
    Double salesMin,
    Double salesMax,
    String search
) {
  public static final String ALL_SEGMENTS = "All";

  public static CustomerQuery none() {
    return new CustomerQuery(null, null, null, null, null, null);
  }
}
