package com.hubspot.relay.delivery;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.AuthenticationException;
import com.hubspot.relay.client.Authenticator;
import com.hubspot.relay.client.CompositeSendInterceptor;
import com.hubspot.relay.client.ConnectionNegotiator;
import com.hubspot.relay.client.DebugLoggingInterceptor;
import com.hubspot.relay.client.ErrorResponseException;
import com.hubspot.relay.client.NegotiatedSession;
import com.hubspot.relay.client.SendInterceptor;
import com.hubspot.relay.client.SmtpSession;
import com.hubspot.relay.client.SmtpSessionConfig;
import com.hubspot.relay.client.SmtpSessionFactory;
import com.hubspot.relay.errors.ErrorCategory;
import com.hubspot.relay.errors.ErrorClassification;
import com.hubspot.relay.errors.ErrorClassifier;
import com.hubspot.relay.messages.ComposedMessage;
import com.hubspot.relay.messages.EmailMessage;
import com.hubspot.relay.messages.MessageComposer;
import com.hubspot.relay.retry.DeliveryAttempt;
import com.hubspot.relay.retry.RetryException;
import com.hubspot.relay.retry.RetryExecutor;
import com.hubspot.relay.retry.RetryPolicy;
import com.hubspot.relay.utils.CompletableFutures;
import com.hubspot.relay.utils.CredentialMasking;

/**
 * Delivers a message through a relay: negotiate, authenticate, send, with transient failures
 * retried on a fresh connection.
 *
 * <p>Every attempt opens its own {@link SmtpSession} and closes it, with a best-effort QUIT,
 * whatever the outcome. The message is composed once, so every attempt sends the same
 * Message-ID. A shared {@link CircuitBreaker} fails deliveries fast while the relay keeps
 * failing with transient errors.
 *
 * <p>This class is thread-safe.
 */
public class DeliveryOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(DeliveryOrchestrator.class);

  private final ConnectionNegotiator negotiator;
  private final Authenticator authenticator;
  private final MessageComposer composer;
  private final RetryExecutor retryExecutor;
  private final ErrorClassifier classifier;
  private final CircuitBreaker circuitBreaker;
  private final Ticker ticker;

  /**
   * Creates an orchestrator with the default retry policy and circuit breaker.
   */
  public DeliveryOrchestrator(SmtpSessionFactory sessionFactory) {
    this(sessionFactory, RetryPolicy.builder().build(), new CircuitBreaker());
  }

  public DeliveryOrchestrator(SmtpSessionFactory sessionFactory, RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
    this(
        new ConnectionNegotiator(sessionFactory),
        new Authenticator(),
        new MessageComposer(),
        new RetryExecutor(retryPolicy, new ErrorClassifier()),
        new ErrorClassifier(),
        circuitBreaker,
        Ticker.systemTicker());
  }

  @VisibleForTesting
  DeliveryOrchestrator(ConnectionNegotiator negotiator,
                       Authenticator authenticator,
                       MessageComposer composer,
                       RetryExecutor retryExecutor,
                       ErrorClassifier classifier,
                       CircuitBreaker circuitBreaker,
                       Ticker ticker) {
    this.negotiator = negotiator;
    this.authenticator = authenticator;
    this.composer = composer;
    this.retryExecutor = retryExecutor;
    this.classifier = classifier;
    this.circuitBreaker = circuitBreaker;
    this.ticker = ticker;
  }

  /**
   * Delivers {@code message}.
   *
   * @return a future for the delivery's outcome, failing with {@link DeliveryException} once
   *         no further attempt will be made
   */
  public CompletableFuture<DeliveryResult> send(ConnectionConfig config, EmailMessage message) {
    Preconditions.checkNotNull(config);
    Preconditions.checkNotNull(message);

    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    String recipient = CredentialMasking.maskEmail(message.getToAddress());

    if (!circuitBreaker.allowRequest()) {
      LOG.warn("[{}] Not delivering to {}, the circuit for {} is open", config.getConnectionId(), recipient, describe(config));
      return CompletableFutures.failedFuture(new DeliveryException(
          ErrorClassification.forCategory(ErrorCategory.NETWORK),
          0,
          stopwatch.elapsed(TimeUnit.MILLISECONDS),
          Optional.empty(),
          String.format("[%s] Circuit breaker is open for %s after repeated failures", config.getConnectionId(), describe(config)),
          null));
    }

    ReplyCodeRecorder replyCodes = new ReplyCodeRecorder();

    // composition failures fail the returned future like any other delivery failure
    CompletableFuture<DeliveryResult> delivered = CompletableFuture.completedFuture(message)
        .thenApply(m -> composer.compose(m, config.getEhloDomain()))
        .thenCompose(composed -> deliver(config, message, composed, replyCodes));

    BiFunction<DeliveryResult, Throwable, CompletableFuture<DeliveryResult>> complete = (result, e) -> {
      long elapsedMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

      if (e == null) {
        circuitBreaker.recordSuccess();
        LOG.info("[{}] Delivered {} to {} ({}, AUTH {}) after {} attempt(s) in {}ms",
            config.getConnectionId(), result.getMessageId(), recipient, result.getTlsMode().getLabel(), result.getAuthMethod(), result.getAttempts(), elapsedMs);
        return CompletableFuture.completedFuture(result.withElapsedMs(elapsedMs));
      }

      DeliveryException failure = toDeliveryException(config, "Delivery to " + recipient, CompletableFutures.unwrap(e), elapsedMs, replyCodes);
      circuitBreaker.recordFailure(failure.getClassification());

      LOG.warn("[{}] {} (suggestion: {})", config.getConnectionId(), failure.getMessage(), failure.getSuggestion());
      return CompletableFutures.failedFuture(failure);
    };

    return delivered.handle(complete).thenCompose(Function.identity());
  }

  private CompletableFuture<DeliveryResult> deliver(ConnectionConfig config, EmailMessage message, ComposedMessage composed, ReplyCodeRecorder replyCodes) {
    return retryExecutor.run("Delivery to " + describe(config), attempt -> {
      replyCodes.reset();

      return negotiator.negotiate(createSessionConfig(config, attempt, replyCodes)).thenCompose(negotiated ->
          closeAfter(negotiated.getSession(), () -> authenticate(config, negotiated)
              .thenCompose(authMethod -> negotiated.getSession()
                  .send(message.getFromAddress(), message.getToAddress(), composed.getContent())
                  .thenApply(response -> DeliveryResult.builder()
                      .tlsMode(negotiated.getTlsMode())
                      .authMethod(authMethod)
                      .attempts(attempt.getAttemptNumber())
                      .elapsedMs(0)
                      .lastReplyCode(response.code())
                      .capabilities(ImmutableList.copyOf(negotiated.getCapabilities().getCapabilities()))
                      .messageId(composed.getMessageId())
                      .build()))));
    });
  }

  /**
   * Checks that the relay can be reached and logged in to, without sending anything. This
   * makes a single attempt and ignores the circuit breaker.
   */
  public CompletableFuture<VerificationResult> verify(ConnectionConfig config) {
    Preconditions.checkNotNull(config);

    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    ReplyCodeRecorder replyCodes = new ReplyCodeRecorder();
    DeliveryAttempt attempt = DeliveryAttempt.of(1, 1, Instant.now());

    CompletableFuture<VerificationResult> verified;
    try {
      verified = negotiator.negotiate(createSessionConfig(config, attempt, replyCodes)).thenCompose(negotiated ->
          closeAfter(negotiated.getSession(), () -> authenticate(config, negotiated)
              .thenApply(authMethod -> VerificationResult.builder()
                  .tlsMode(negotiated.getTlsMode())
                  .authMethod(authMethod)
                  .capabilities(ImmutableList.copyOf(negotiated.getCapabilities().getCapabilities()))
                  .elapsedMs(0)
                  .build())));
    } catch (RuntimeException e) {
      verified = CompletableFutures.failedFuture(e);
    }

    BiFunction<VerificationResult, Throwable, CompletableFuture<VerificationResult>> complete = (result, e) -> {
      long elapsedMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

      if (e == null) {
        LOG.info("[{}] Verified {} ({}, AUTH {}) in {}ms", config.getConnectionId(), describe(config), result.getTlsMode().getLabel(), result.getAuthMethod(), elapsedMs);
        return CompletableFuture.completedFuture(result.withElapsedMs(elapsedMs));
      }

      DeliveryException failure = toDeliveryException(config, "Verification of " + describe(config), CompletableFutures.unwrap(e), elapsedMs, replyCodes);
      LOG.warn("[{}] {} (suggestion: {})", config.getConnectionId(), failure.getMessage(), failure.getSuggestion());
      return CompletableFutures.failedFuture(failure);
    };

    return verified.handle(complete).thenCompose(Function.identity());
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  private CompletableFuture<AuthMechanism> authenticate(ConnectionConfig config, NegotiatedSession negotiated) {
    return authenticator.authenticate(negotiated.getSession(), config.getUsername(), config.getPassword());
  }

  @VisibleForTesting
  static SmtpSessionConfig createSessionConfig(ConnectionConfig config, DeliveryAttempt attempt, ReplyCodeRecorder replyCodes) {
    String connectionId = config.getConnectionId() + "-" + attempt.getAttemptNumber();

    SendInterceptor interceptor = replyCodes;
    if (config.isDebugLogging()) {
      interceptor = CompositeSendInterceptor.of(new DebugLoggingInterceptor(connectionId, config.getUsername(), config.getPassword()), replyCodes);
    }

    return SmtpSessionConfig.builder()
        .remoteAddress(config.getRemoteAddress())
        .tlsMode(config.getTlsMode())
        .ehloDomain(config.getEhloDomain())
        .connectTimeout(config.getConnectTimeout())
        .commandTimeout(config.getCommandTimeout())
        .dataTimeout(config.getDataTimeout())
        .connectionId(connectionId)
        .sendInterceptor(interceptor)
        .build();
  }

  private DeliveryException toDeliveryException(ConnectionConfig config, String operation, Throwable error, long elapsedMs, ReplyCodeRecorder replyCodes) {
    ErrorClassification classification;
    int attempts;
    Throwable cause;

    if (error instanceof RetryException) {
      RetryException retryException = (RetryException) error;
      classification = retryException.getClassification();
      attempts = retryException.getAttempts();
      cause = retryException.getCause();
    } else {
      classification = classifier.classify(error);
      attempts = 1;
      cause = error;
    }

    Optional<Integer> lastReplyCode = findReplyCode(cause);
    if (!lastReplyCode.isPresent()) {
      lastReplyCode = replyCodes.getLastReplyCode();
    }

    String message = String.format("%s failed after %d attempt(s) [%s]: %s",
        operation, attempts, classification.getCategory().getLabel(), CredentialMasking.mask(String.valueOf(cause.getMessage()), config.getUsername(), config.getPassword()));

    return new DeliveryException(classification, attempts, elapsedMs, lastReplyCode, message, cause);
  }

  // a refused greeting never passes through the interceptors, so prefer the code the failure carries
  private static Optional<Integer> findReplyCode(Throwable error) {
    for (Throwable t : Throwables.getCausalChain(error)) {
      if (t instanceof ErrorResponseException) {
        return Optional.of(((ErrorResponseException) t).getCode());
      }
      if (t instanceof AuthenticationException && ((AuthenticationException) t).getCode().isPresent()) {
        return ((AuthenticationException) t).getCode();
      }
    }
    return Optional.empty();
  }

  private static <T> CompletableFuture<T> closeAfter(SmtpSession session, Supplier<CompletableFuture<T>> work) {
    CompletableFuture<T> future;
    try {
      future = work.get();
    } catch (RuntimeException e) {
      future = CompletableFutures.failedFuture(e);
    }

    BiFunction<T, Throwable, CompletableFuture<T>> close = (value, e) -> session.quitAndClose().thenCompose(ignored -> {
      if (e != null) {
        return CompletableFutures.<T>failedFuture(CompletableFutures.unwrap(e));
      }
      return CompletableFuture.completedFuture(value);
    });

    return future.handle(close).thenCompose(Function.identity());
  }

  private static String describe(ConnectionConfig config) {
    return config.getHostname() + ":" + config.getPort();
  }
}
