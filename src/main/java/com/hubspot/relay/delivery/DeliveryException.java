package com.hubspot.relay.delivery;

import java.util.Optional;

import com.hubspot.relay.errors.ErrorClassification;

/**
 * Unchecked exception used to fail a delivery once no further attempt will be made. It carries
 * the classification of the final failure, including a remediation suggestion for operators.
 *
 */
public class DeliveryException extends RuntimeException {
  private final ErrorClassification classification;
  private final int attempts;
  private final long elapsedMs;
  private final Optional<Integer> lastReplyCode;

  public DeliveryException(ErrorClassification classification, int attempts, long elapsedMs, Optional<Integer> lastReplyCode, String message, Throwable cause) {
    super(message, cause);
    this.classification = classification;
    this.attempts = attempts;
    this.elapsedMs = elapsedMs;
    this.lastReplyCode = lastReplyCode;
  }

  public ErrorClassification getClassification() {
    return classification;
  }

  public int getAttempts() {
    return attempts;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public Optional<Integer> getLastReplyCode() {
    return lastReplyCode;
  }

  public String getSuggestion() {
    return classification.getSuggestion();
  }
}
