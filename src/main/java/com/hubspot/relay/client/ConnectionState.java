package com.hubspot.relay.client;

/**
 * The lifecycle of an {@link SmtpSession}. A session only moves forward through these states,
 * except that {@code SENDING} returns to {@code AUTHENTICATED} once a message has been accepted.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTED,
  CAPABILITIES_KNOWN,
  TLS_UPGRADED,
  AUTHENTICATED,
  SENDING,
  CLOSED
}
