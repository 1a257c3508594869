package com.hubspot.relay.client;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hubspot.relay.utils.CompletableFutures;

/**
 * Opens a session and brings it to the point where it can authenticate: greeting checked,
 * capabilities known and, for STARTTLS, the connection upgraded and EHLO repeated.
 *
 * <p>If anything fails after the channel opened, the session is closed before the returned
 * future fails.
 *
 * <p>This class is thread-safe.
 */
public class ConnectionNegotiator {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionNegotiator.class);
  private static final int SERVICE_READY = 220;

  private final SmtpSessionFactory sessionFactory;

  public ConnectionNegotiator(SmtpSessionFactory sessionFactory) {
    this.sessionFactory = sessionFactory;
  }

  public CompletableFuture<NegotiatedSession> negotiate(SmtpSessionConfig config) {
    return sessionFactory.connect(config).thenCompose(greeting -> {
      SmtpSession session = greeting.getSession();

      if (greeting.code() != SERVICE_READY) {
        return ConnectionNegotiator.<NegotiatedSession>closeAndFail(session, new ErrorResponseException(config.getConnectionId(), greeting.getResponse(), "Server rejected connection"));
      }

      CompletableFuture<NegotiatedSession> negotiated = session.ehlo()
          .thenCompose(ehlo -> upgrade(session, config.getTlsMode()))
          .thenApply(ehlo -> {
            LOG.debug("[{}] Negotiated {} with capabilities {}", config.getConnectionId(), config.getTlsMode().getLabel(), ehlo.getCapabilities());
            return new NegotiatedSession(session, config.getTlsMode(), ehlo);
          });

      return closeOnFailure(session, negotiated);
    });
  }

  private CompletableFuture<EhloResponse> upgrade(SmtpSession session, TlsMode tlsMode) {
    if (tlsMode == TlsMode.STARTTLS) {
      return session.startTls();
    }
    return CompletableFuture.completedFuture(session.getEhloResponse());
  }

  private static <T> CompletableFuture<T> closeOnFailure(SmtpSession session, CompletableFuture<T> future) {
    BiFunction<T, Throwable, CompletableFuture<T>> recover = (result, e) -> {
      if (e == null) {
        return CompletableFuture.completedFuture(result);
      }
      return closeAndFail(session, CompletableFutures.unwrap(e));
    };

    return future.handle(recover).thenCompose(Function.identity());
  }

  private static <T> CompletableFuture<T> closeAndFail(SmtpSession session, Throwable cause) {
    return session.quitAndClose().thenCompose(ignored -> CompletableFutures.<T>failedFuture(cause));
  }
}
