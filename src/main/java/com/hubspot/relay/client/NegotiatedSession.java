package com.hubspot.relay.client;

/**
 * A connected session whose TLS mode is settled and whose capabilities are known, ready to
 * authenticate.
 *
 */
public final class NegotiatedSession {
  private final SmtpSession session;
  private final TlsMode tlsMode;
  private final EhloResponse capabilities;

  NegotiatedSession(SmtpSession session, TlsMode tlsMode, EhloResponse capabilities) {
    this.session = session;
    this.tlsMode = tlsMode;
    this.capabilities = capabilities;
  }

  public SmtpSession getSession() {
    return session;
  }

  public TlsMode getTlsMode() {
    return tlsMode;
  }

  public EhloResponse getCapabilities() {
    return capabilities;
  }
}
