package com.hubspot.relay.client;

/**
 * Unchecked exception thrown when a connection could not be upgraded to TLS, either because
 * the server does not offer STARTTLS or because the command or the handshake failed.
 *
 */
public class StartTlsException extends SmtpException {
  public StartTlsException(String connectionId, String message) {
    super(connectionId, message);
  }

  public StartTlsException(String connectionId, String message, Throwable cause) {
    super(connectionId, message, cause);
  }
}
