package com.hubspot.relay.delivery;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.hubspot.relay.errors.ErrorClassification;

/**
 * Stops deliveries to a relay that keeps failing with transient errors.
 *
 * <p>After {@code failureThreshold} consecutive transient failures the breaker opens and
 * every delivery fails fast for {@code openDuration}. Then a single trial delivery is let
 * through: success closes the breaker, another transient failure opens it again. Permanent
 * failures such as bad credentials mean the relay answered, so they are not counted.
 *
 * <p>One instance is shared by all deliveries to the same relay. This class is thread-safe.
 */
public class CircuitBreaker {
  private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final Duration DEFAULT_OPEN_DURATION = Duration.ofSeconds(60);

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  private static final Status CLOSED_STATUS = new Status(State.CLOSED, 0);
  private static final Status HALF_OPEN_STATUS = new Status(State.HALF_OPEN, 0);

  private final int failureThreshold;
  private final long openDurationNanos;
  private final Ticker ticker;

  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private final AtomicReference<Status> status = new AtomicReference<>(CLOSED_STATUS);

  public CircuitBreaker() {
    this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_OPEN_DURATION, Ticker.systemTicker());
  }

  @VisibleForTesting
  CircuitBreaker(int failureThreshold, Duration openDuration, Ticker ticker) {
    Preconditions.checkArgument(failureThreshold > 0, "failureThreshold must be positive");
    this.failureThreshold = failureThreshold;
    this.openDurationNanos = openDuration.toNanos();
    this.ticker = ticker;
  }

  /**
   * Gets whether a delivery may start now. When the open period has elapsed this returns true
   * for exactly one caller, whose outcome decides the next state.
   */
  public boolean allowRequest() {
    Status current = status.get();

    switch (current.state) {
      case CLOSED:
        return true;
      case HALF_OPEN:
        return false;
      default:
        if (!hasOpenPeriodElapsed(current)) {
          return false;
        }
        return status.compareAndSet(current, HALF_OPEN_STATUS);
    }
  }

  public void recordSuccess() {
    consecutiveFailures.set(0);
    if (status.getAndSet(CLOSED_STATUS).state != State.CLOSED) {
      LOG.info("Circuit closed after a successful delivery");
    }
  }

  public void recordFailure(ErrorClassification classification) {
    if (!classification.isTransient()) {
      // the relay answered, so a trial that failed this way still proves it is reachable
      if (status.compareAndSet(HALF_OPEN_STATUS, CLOSED_STATUS)) {
        consecutiveFailures.set(0);
      }
      return;
    }

    int failures = consecutiveFailures.incrementAndGet();
    Status current = status.get();

    boolean shouldOpen = current.state == State.HALF_OPEN || (current.state == State.CLOSED && failures >= failureThreshold);
    if (shouldOpen && status.compareAndSet(current, new Status(State.OPEN, ticker.read()))) {
      LOG.warn("Circuit opened after {} consecutive transient failures, failing fast for {}ms",
          failures, Duration.ofNanos(openDurationNanos).toMillis());
    }
  }

  public State getState() {
    Status current = status.get();
    if (current.state == State.OPEN && hasOpenPeriodElapsed(current)) {
      return State.HALF_OPEN;
    }
    return current.state;
  }

  public int getConsecutiveFailures() {
    return consecutiveFailures.get();
  }

  private boolean hasOpenPeriodElapsed(Status current) {
    return ticker.read() - current.openedAtNanos >= openDurationNanos;
  }

  private static final class Status {
    private final State state;
    private final long openedAtNanos;

    private Status(State state, long openedAtNanos) {
      this.state = state;
      this.openedAtNanos = openedAtNanos;
    }
  }
}
