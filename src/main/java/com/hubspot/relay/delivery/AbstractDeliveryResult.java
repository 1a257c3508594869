package com.hubspot.relay.delivery;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.TlsMode;

/**
 * Describes a message the relay accepted.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractDeliveryResult {
  public abstract TlsMode getTlsMode();

  public abstract AuthMechanism getAuthMethod();

  /**
   * The number of attempts made, including the successful one.
   */
  public abstract int getAttempts();

  public abstract long getElapsedMs();

  public abstract Optional<Integer> getLastReplyCode();

  public abstract List<String> getCapabilities();

  public abstract String getMessageId();
}
