package com.hubspot.relay.client;

import java.util.Optional;

import com.hubspot.relay.utils.SmtpResponses;

import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Unchecked exception thrown when the server refuses the supplied credentials.
 *
 */
public class AuthenticationException extends SmtpException {
  private final Optional<SmtpResponse> response;

  public AuthenticationException(String connectionId, SmtpResponse response, String message) {
    super(connectionId, String.format("%s (%s)", message, SmtpResponses.toString(response)));
    this.response = Optional.of(response);
  }

  protected AuthenticationException(String connectionId, String message) {
    super(connectionId, message);
    this.response = Optional.empty();
  }

  public Optional<SmtpResponse> getResponse() {
    return response;
  }

  public Optional<Integer> getCode() {
    return response.map(SmtpResponse::code);
  }
}
