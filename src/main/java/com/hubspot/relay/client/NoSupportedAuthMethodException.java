package com.hubspot.relay.client;

import java.util.List;

/**
 * Unchecked exception thrown when the server only advertises mechanisms this client cannot use.
 *
 */
public class NoSupportedAuthMethodException extends AuthenticationException {
  private final List<String> advertisedMechanisms;

  public NoSupportedAuthMethodException(String connectionId, List<String> advertisedMechanisms) {
    super(connectionId, "No supported authentication method, the server advertised " + advertisedMechanisms);
    this.advertisedMechanisms = advertisedMechanisms;
  }

  public List<String> getAdvertisedMechanisms() {
    return advertisedMechanisms;
  }
}
