package com.hubspot.relay.client;

import com.hubspot.relay.utils.SmtpResponses;

import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Unchecked exception thrown when an error was received in response to a command.
 *
 */
public class ErrorResponseException extends SmtpException {
  private final SmtpResponse response;

  public ErrorResponseException(String connectionId, SmtpResponse response, String message) {
    super(connectionId, String.format("%s (%s)", message, SmtpResponses.toString(response)));
    this.response = response;
  }

  public SmtpResponse getResponse() {
    return response;
  }

  public int getCode() {
    return response.code();
  }

  public boolean isTransient() {
    return SmtpResponses.isTransientError(response);
  }
}
