package com.hubspot.relay.client;

import com.google.common.base.Strings;

/**
 * A base exception that incorporates a connection ID into the exception message.
 *
 */
public abstract class SmtpException extends RuntimeException {
  private final String connectionId;

  public SmtpException(String connectionId, String message) {
    this(connectionId, message, null);
  }

  public SmtpException(String connectionId, String message, Throwable cause) {
    super(constructErrorMessage(connectionId, message), cause);
    this.connectionId = connectionId;
  }

  public String getConnectionId() {
    return connectionId;
  }

  private static String constructErrorMessage(String connectionId, String message) {
    if (Strings.isNullOrEmpty(connectionId)) {
      return message;
    } else {
      return String.format("[%s] %s", connectionId, message);
    }
  }
}
