package com.hubspot.relay.retry;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hubspot.relay.errors.ErrorClassification;
import com.hubspot.relay.errors.ErrorClassifier;
import com.hubspot.relay.utils.CompletableFutures;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;

/**
 * Runs an asynchronous operation until it succeeds, fails with a non-transient error or has
 * used every attempt its {@link RetryPolicy} allows.
 *
 * <p>Delays between attempts are scheduled on a timer, so no thread blocks while waiting.
 * Each attempt must build its own connection; nothing is carried over from a failed attempt.
 *
 * <p>This class is thread-safe.
 */
public class RetryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);
  private static final HashedWheelTimer TIMER = new HashedWheelTimer(new ThreadFactoryBuilder().setDaemon(true).setNameFormat("retry-timer-%d").build());

  private final RetryPolicy policy;
  private final ErrorClassifier classifier;
  private final Timer timer;
  private final DoubleSupplier random;
  private final Clock clock;

  public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier) {
    this(policy, classifier, TIMER, () -> ThreadLocalRandom.current().nextDouble(), Clock.systemUTC());
  }

  @VisibleForTesting
  RetryExecutor(RetryPolicy policy, ErrorClassifier classifier, Timer timer, DoubleSupplier random, Clock clock) {
    this.policy = policy;
    this.classifier = classifier;
    this.timer = timer;
    this.random = random;
    this.clock = clock;
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  /**
   * Runs {@code operation}, retrying transient failures.
   *
   * @param operationName a description used in log messages and exception messages
   * @param operation starts one attempt; it receives the attempt's number
   * @return a future for the first successful result, or failed with a {@link RetryException}
   *         whose cause is the last failure
   */
  public <T> CompletableFuture<T> run(String operationName, Function<DeliveryAttempt, CompletableFuture<T>> operation) {
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(operationName, operation, 1, result);
    return result;
  }

  private <T> void attempt(String operationName, Function<DeliveryAttempt, CompletableFuture<T>> operation, int attemptNumber, CompletableFuture<T> result) {
    DeliveryAttempt attempt = DeliveryAttempt.of(attemptNumber, policy.getMaxAttempts(), clock.instant());

    CompletableFuture<T> attemptFuture;
    try {
      attemptFuture = operation.apply(attempt);
    } catch (RuntimeException e) {
      attemptFuture = CompletableFutures.failedFuture(e);
    }

    attemptFuture.whenComplete((value, e) -> {
      if (e == null) {
        result.complete(value);
        return;
      }

      Throwable cause = CompletableFutures.unwrap(e);
      ErrorClassification classification = classifier.classify(cause);

      if (!classification.isTransient() || attempt.isLastAttempt()) {
        result.completeExceptionally(new RetryException(operationName, attemptNumber, classification, cause));
        return;
      }

      long delayMillis = policy.computeDelayMillis(attemptNumber, random.getAsDouble());
      LOG.warn("{} attempt {}/{} failed with a {} error, retrying in {}ms: {}",
          operationName, attemptNumber, policy.getMaxAttempts(), classification.getCategory().getLabel(), delayMillis, cause.getMessage());

      timer.newTimeout(ignored -> attempt(operationName, operation, attemptNumber + 1, result), delayMillis, TimeUnit.MILLISECONDS);
    });
  }
}
