package com.ospicorp.salesinsights.series.service;

/** No usable numeric history exists, so no baseline forecast can be computed. */
public class InsufficientDataException extends RuntimeException {
  private final int observations;

  public InsufficientDataException(String message, int observations) {
    super(message);
    this.observations = observations;
  }

  public int observations() {
    return observations;
  }
}
