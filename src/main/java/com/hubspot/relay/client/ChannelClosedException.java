package com.hubspot.relay.client;

/**
 * Unchecked exception used to fail a pending command when the server drops the connection.
 *
 */
public class ChannelClosedException extends SmtpException {
  public ChannelClosedException(String connectionId, String message) {
    super(connectionId, message);
  }
}
