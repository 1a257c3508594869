package com.hubspot.relay.errors;

/**
 * The broad kind of a delivery failure, used to decide whether to retry and what to tell the operator.
 */
public enum ErrorCategory {
  TIMEOUT("timeout", true, "Check network connectivity and increase timeout values"),
  AUTH("auth", false, "Verify SMTP username and password credentials. Providers that require two-factor authentication (such as Gmail) need an App Password instead of the account password"),
  NETWORK("network", true, "Check network connectivity and SMTP server availability"),
  TLS("tls", false, "Try alternative port (465 for implicit TLS, 587 for STARTTLS)"),
  UNKNOWN("unknown", false, "Check SMTP server configuration and logs for details");

  private final String label;
  private final boolean isTransient;
  private final String suggestion;

  ErrorCategory(String label, boolean isTransient, String suggestion) {
    this.label = label;
    this.isTransient = isTransient;
    this.suggestion = suggestion;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Whether a failure of this kind may succeed if attempted again.
   */
  public boolean isTransient() {
    return isTransient;
  }

  public String getSuggestion() {
    return suggestion;
  }
}
