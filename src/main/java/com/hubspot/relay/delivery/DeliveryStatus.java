package com.hubspot.relay.delivery;

public enum DeliveryStatus {
  SENT("sent"),
  FAILED("failed");

  private final String label;

  DeliveryStatus(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
