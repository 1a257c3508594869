package com.hubspot.relay.client;

import java.util.Optional;

/**
 * The SASL mechanisms this client can authenticate with.
 *
 */
public enum AuthMechanism {
  PLAIN,
  LOGIN;

  public static Optional<AuthMechanism> find(String name) {
    for (AuthMechanism mechanism : values()) {
      if (mechanism.name().equalsIgnoreCase(name)) {
        return Optional.of(mechanism);
      }
    }
    return Optional.empty();
  }
}
