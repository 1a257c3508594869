package com.hubspot.relay.client;

import com.hubspot.relay.utils.SmtpResponses;

import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Wraps the session and the response to an SMTP command.
 *
 * <p>This class is thread-safe.
 */
public class SmtpClientResponse {
  private final SmtpSession session;
  private final SmtpResponse response;

  public SmtpClientResponse(SmtpSession session, SmtpResponse response) {
    this.session = session;
    this.response = response;
  }

  /**
   * Gets the {@link SmtpSession} that received this response.
   */
  public SmtpSession getSession() {
    return session;
  }

  public SmtpResponse getResponse() {
    return response;
  }

  public int code() {
    return response.code();
  }

  /**
   * Gets whether the response has a {@code code >= 400}.
   */
  public boolean containsError() {
    return SmtpResponses.isError(response);
  }

  @Override
  public String toString() {
    return SmtpResponses.toString(response);
  }
}
