package com.hubspot.relay.client;

/**
 * How a connection is protected with TLS.
 *
 */
public enum TlsMode {
  /**
   * Connect in plain text and upgrade the connection with the STARTTLS command.
   */
  STARTTLS("starttls"),

  /**
   * Start the TLS handshake as soon as the TCP connection is open, before the greeting.
   */
  IMPLICIT("implicit"),

  /**
   * Never encrypt the connection.
   */
  NONE("none");

  public static final int SUBMISSION_PORT = 587;
  public static final int SUBMISSIONS_PORT = 465;

  private final String label;

  TlsMode(String label) {
    this.label = label;
  }

  /**
   * Gets the mode conventionally used on {@code port}: STARTTLS on 587, implicit TLS on 465
   * and no TLS on any other port.
   */
  public static TlsMode forPort(int port) {
    switch (port) {
      case SUBMISSION_PORT:
        return STARTTLS;
      case SUBMISSIONS_PORT:
        return IMPLICIT;
      default:
        return NONE;
    }
  }

  public String getLabel() {
    return label;
  }
}
