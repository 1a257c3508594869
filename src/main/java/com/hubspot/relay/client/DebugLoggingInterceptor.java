package com.hubspot.relay.client;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hubspot.relay.utils.CompletableFutures;
import com.hubspot.relay.utils.CredentialMasking;
import com.hubspot.relay.utils.SmtpResponses;

import io.netty.handler.codec.smtp.SmtpRequest;
import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Logs every line sent to and received from the server, with credentials masked. Commands are
 * prefixed with {@code >>} and replies with {@code <<}.
 *
 * <p>The AUTH PLAIN payload and the AUTH LOGIN password never appear in the log. The username
 * is shown with most of its local part replaced by asterisks.
 */
public class DebugLoggingInterceptor implements SendInterceptor {
  private static final Logger LOG = LoggerFactory.getLogger(DebugLoggingInterceptor.class);
  private static final String AUTH = "AUTH";

  private final String connectionId;
  private final String username;
  private final String password;

  public DebugLoggingInterceptor(String connectionId, String username, String password) {
    this.connectionId = connectionId;
    this.username = username;
    this.password = password;
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next) {
    LOG.info("[{}] >> {}", connectionId, describe(request));
    return logResponse(next.get());
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next) {
    String shown = step == LoginStep.USERNAME ? CredentialMasking.maskEmail(value) : CredentialMasking.MASK;
    LOG.info("[{}] >> {}", connectionId, shown);
    return logResponse(next.get());
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next) {
    LOG.info("[{}] >> <message content>", connectionId);
    return logResponse(next.get());
  }

  String describe(SmtpRequest request) {
    String command = request.command().name().toString();

    if (AUTH.equalsIgnoreCase(command)) {
      // keep the mechanism, never the initial response
      String mechanism = request.parameters().isEmpty() ? "" : " " + request.parameters().get(0);
      return command + mechanism + (request.parameters().size() > 1 ? " " + CredentialMasking.MASK : "");
    }

    return CredentialMasking.mask(SmtpSession.createDebugString(request), username, password);
  }

  private CompletableFuture<SmtpResponse> logResponse(CompletableFuture<SmtpResponse> responseFuture) {
    return responseFuture.whenComplete((response, e) -> {
      if (e != null) {
        LOG.info("[{}] << failed: {}", connectionId, CompletableFutures.unwrap(e).getMessage());
        return;
      }

      for (String line : SmtpResponses.getLines(response)) {
        LOG.info("[{}] << {}", connectionId, CredentialMasking.mask(line, username, password));
      }
    });
  }
}
