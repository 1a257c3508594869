package com.hubspot.relay.retry;

import java.time.Instant;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Parameter;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

/**
 * Identifies one attempt of a retried operation.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractDeliveryAttempt {
  /**
   * The attempt number, starting at 1.
   */
  @Parameter
  public abstract int getAttemptNumber();

  @Parameter
  public abstract int getMaxAttempts();

  @Parameter
  public abstract Instant getStartedAt();

  public boolean isLastAttempt() {
    return getAttemptNumber() >= getMaxAttempts();
  }
}
