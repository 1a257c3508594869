package com.hubspot.relay.client;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Wraps the future for the single response a command is waiting for, together with a
 * description of that command for error messages.
 *
 */
class ResponseCollector {
  private final CompletableFuture<SmtpResponse> future;
  private final Supplier<String> debugString;

  ResponseCollector(Supplier<String> debugString) {
    this.debugString = debugString;
    this.future = new CompletableFuture<>();
  }

  CompletableFuture<SmtpResponse> getFuture() {
    return future;
  }

  String getDebugString() {
    return debugString.get();
  }

  void complete(SmtpResponse response) {
    future.complete(response);
  }

  void completeExceptionally(Throwable cause) {
    future.completeExceptionally(cause);
  }
}
