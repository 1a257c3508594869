package com.hubspot.relay.retry;

import com.hubspot.relay.errors.ErrorClassification;

/**
 * Unchecked exception used to fail a retried operation once no further attempt will be made,
 * either because the last failure was not transient or because every attempt has been used.
 * The cause is the failure of the final attempt.
 *
 */
public class RetryException extends RuntimeException {
  private final int attempts;
  private final ErrorClassification classification;

  public RetryException(String operationName, int attempts, ErrorClassification classification, Throwable cause) {
    super(String.format("%s failed after %d attempt(s) [%s]: %s", operationName, attempts, classification.getCategory().getLabel(), cause.getMessage()), cause);
    this.attempts = attempts;
    this.classification = classification;
  }

  public int getAttempts() {
    return attempts;
  }

  public ErrorClassification getClassification() {
    return classification;
  }
}
