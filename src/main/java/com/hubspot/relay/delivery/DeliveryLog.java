package com.hubspot.relay.delivery;

/**
 * Receives a record of every delivery request. Implementations typically persist it for
 * dashboards and audits.
 */
public interface DeliveryLog {
  /**
   * Records {@code entry}. Exceptions thrown here are logged by the caller and never change
   * the outcome of the delivery.
   */
  void record(DeliveryLogEntry entry);
}
