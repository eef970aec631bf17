package com.swapengine.domain.orders;

public enum OrderStatus {
  QUEUED("queued"),
  PENDING("pending"),
  ROUTING("routing"),
  BUILDING("building"),
  SUBMITTED("submitted"),
  CONFIRMED("confirmed"),
  FAILED("failed");

  private final String wireValue;

  OrderStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this == CONFIRMED || this == FAILED;
  }
}
