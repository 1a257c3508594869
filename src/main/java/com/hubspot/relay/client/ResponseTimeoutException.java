package com.hubspot.relay.client;

import java.time.Duration;

/**
 * Unchecked exception used to fail a pending command when the server does not answer in time.
 * The channel is closed when this is raised, so the session cannot be used afterwards.
 *
 */
public class ResponseTimeoutException extends SmtpException {
  private final Duration timeout;

  public ResponseTimeoutException(String connectionId, Duration timeout, String debugString) {
    super(connectionId, String.format("Timed out after %dms waiting for a response to [%s]", timeout.toMillis(), debugString));
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
