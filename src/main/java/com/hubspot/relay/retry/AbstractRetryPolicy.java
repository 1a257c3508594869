package com.hubspot.relay.retry;

import java.time.Duration;

import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.Preconditions;

/**
 * Bounds how often and how quickly a failed delivery is attempted again.
 *
 * <p>The delay before attempt {@code n + 1} is {@code baseDelay * multiplier^(n - 1)}, capped
 * at {@code maxDelay}, then scaled by a random factor in {@code [1 - jitter, 1 + jitter]}.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractRetryPolicy {

  /**
   * The total number of attempts, including the first.
   */
  @Default
  public int getMaxAttempts() {
    return 3;
  }

  @Default
  public Duration getBaseDelay() {
    return Duration.ofMillis(1000);
  }

  @Default
  public double getMultiplier() {
    return 2.0;
  }

  @Default
  public Duration getMaxDelay() {
    return Duration.ofMillis(5000);
  }

  /**
   * The largest fraction by which a delay is randomly lengthened or shortened.
   */
  @Default
  public double getJitter() {
    return 0.1;
  }

  /**
   * Computes the delay to wait after attempt {@code attemptNumber} failed.
   *
   * @param attemptNumber the attempt that just failed, starting at 1
   * @param random a uniformly distributed value in {@code [0, 1)}
   */
  public long computeDelayMillis(int attemptNumber, double random) {
    Preconditions.checkArgument(attemptNumber >= 1, "attemptNumber must be at least 1");

    double exponential = getBaseDelay().toMillis() * Math.pow(getMultiplier(), attemptNumber - 1);
    double capped = Math.min(exponential, getMaxDelay().toMillis());
    double jittered = capped + (random * 2 - 1) * capped * getJitter();

    return Math.max(0, Math.round(jittered));
  }

  @Check
  protected void check() {
    Preconditions.checkState(getMaxAttempts() >= 1, "maxAttempts must be at least 1");
    Preconditions.checkState(!getBaseDelay().isNegative(), "baseDelay must not be negative");
    Preconditions.checkState(getMultiplier() >= 1.0, "multiplier must be at least 1");
    Preconditions.checkState(!getMaxDelay().isNegative(), "maxDelay must not be negative");
    Preconditions.checkState(getJitter() >= 0 && getJitter() < 1, "jitter must be in [0, 1)");
  }
}
