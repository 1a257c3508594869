package com.hubspot.relay.client;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.hubspot.relay.utils.CompletableFutures;

/**
 * Authenticates a session with the best mechanism the server advertised.
 *
 * <p>PLAIN is preferred. Some providers advertise PLAIN but only accept LOGIN, so a 535 reply
 * to PLAIN is followed by exactly one LOGIN attempt on the same connection when LOGIN is also
 * advertised. A server that advertises no mechanisms at all is tried with LOGIN.
 *
 * <p>This class is thread-safe.
 */
public class Authenticator {
  private static final Logger LOG = LoggerFactory.getLogger(Authenticator.class);

  static final int AUTH_SUCCEEDED = 235;
  static final int AUTH_CREDENTIALS_INVALID = 535;

  /**
   * Authenticates {@code session}, which must already know the server's capabilities.
   *
   * @return a future for the mechanism that succeeded, failing with {@link AuthenticationException}
   *         if the credentials are refused or {@link NoSupportedAuthMethodException} if no usable
   *         mechanism is advertised
   */
  public CompletableFuture<AuthMechanism> authenticate(SmtpSession session, String username, String password) {
    Preconditions.checkNotNull(session);
    Preconditions.checkNotNull(username);
    Preconditions.checkNotNull(password);

    EhloResponse ehloResponse = session.getEhloResponse();

    if (ehloResponse.isAuthSupported(AuthMechanism.PLAIN)) {
      return session.authPlain(username, password).thenCompose(response -> {
        if (response.code() == AUTH_SUCCEEDED) {
          return CompletableFuture.completedFuture(AuthMechanism.PLAIN);
        }

        if (response.code() == AUTH_CREDENTIALS_INVALID && ehloResponse.isAuthSupported(AuthMechanism.LOGIN)) {
          LOG.info("[{}] AUTH PLAIN was refused with {}, falling back to AUTH LOGIN", session.getConnectionId(), response.code());
          return authenticateWithLogin(session, username, password);
        }

        throw new AuthenticationException(session.getConnectionId(), response.getResponse(), "Authentication failed using PLAIN");
      });
    }

    if (ehloResponse.isAuthSupported(AuthMechanism.LOGIN) || ehloResponse.getAuthMechanisms().isEmpty()) {
      return authenticateWithLogin(session, username, password);
    }

    return CompletableFutures.failedFuture(new NoSupportedAuthMethodException(session.getConnectionId(), ehloResponse.getAuthMechanisms()));
  }

  private CompletableFuture<AuthMechanism> authenticateWithLogin(SmtpSession session, String username, String password) {
    return session.authLogin(username, password).thenApply(response -> {
      if (response.code() != AUTH_SUCCEEDED) {
        throw new AuthenticationException(session.getConnectionId(), response.getResponse(), "Authentication failed using LOGIN");
      }
      return AuthMechanism.LOGIN;
    });
  }
}
