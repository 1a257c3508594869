package com.hubspot.relay.delivery;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.hubspot.relay.client.LoginStep;
import com.hubspot.relay.client.SendInterceptor;

import io.netty.handler.codec.smtp.SmtpCommand;
import io.netty.handler.codec.smtp.SmtpRequest;
import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Remembers the code of the last reply received during an attempt. The reply to QUIT is
 * ignored, so after cleanup this still holds the reply that decided the outcome.
 */
class ReplyCodeRecorder implements SendInterceptor {
  private static final int NONE = -1;

  private final AtomicInteger lastReplyCode = new AtomicInteger(NONE);

  void reset() {
    lastReplyCode.set(NONE);
  }

  Optional<Integer> getLastReplyCode() {
    int code = lastReplyCode.get();
    return code == NONE ? Optional.empty() : Optional.of(code);
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next) {
    if (request.command().equals(SmtpCommand.QUIT)) {
      return next.get();
    }
    return record(next.get());
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next) {
    return record(next.get());
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next) {
    return record(next.get());
  }

  private CompletableFuture<SmtpResponse> record(CompletableFuture<SmtpResponse> responseFuture) {
    return responseFuture.whenComplete((response, e) -> {
      if (response != null) {
        lastReplyCode.set(response.code());
      }
    });
  }
}
