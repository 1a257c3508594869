package com.hubspot.relay.delivery;

import java.util.List;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.TlsMode;

/**
 * The outcome of a health check: the relay could be reached, encrypted and logged in to.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractVerificationResult {
  public abstract TlsMode getTlsMode();

  public abstract AuthMechanism getAuthMethod();

  public abstract List<String> getCapabilities();

  public abstract long getElapsedMs();
}
