package com.hubspot.relay.config;

import java.util.Optional;

/**
 * Supplies relay settings, for example from a secret store or a settings table.
 */
public interface ConnectionConfigSource {
  /**
   * Loads the current settings, or empty if this source has none.
   */
  Optional<SmtpSettings> load();
}
