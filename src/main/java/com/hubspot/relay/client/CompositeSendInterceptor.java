package com.hubspot.relay.client;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import io.netty.handler.codec.smtp.SmtpRequest;
import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * A chain of {@link SendInterceptor} instances that will call each other in turn.
 *
 * <p>With {@code CompositeSendInterceptor.of(a, b, c)}, {@code a} is called first and the
 * {@code next} parameter of each of its {@code around} methods refers to the future
 * returned by {@code b}.
 *
 * <p>This class is thread-safe.
 */
public class CompositeSendInterceptor implements SendInterceptor {
  private final SendInterceptor rootInterceptor;
  private final List<SendInterceptor> sendInterceptors;

  public static CompositeSendInterceptor of(SendInterceptor... sendInterceptors) {
    return of(ImmutableList.copyOf(sendInterceptors));
  }

  public static CompositeSendInterceptor of(List<SendInterceptor> interceptors) {
    return new CompositeSendInterceptor(interceptors);
  }

  private CompositeSendInterceptor(List<SendInterceptor> sendInterceptors) {
    Preconditions.checkNotNull(sendInterceptors);
    Preconditions.checkArgument(!sendInterceptors.isEmpty(), "sendInterceptors must not be empty");

    // wrap from the innermost interceptor outwards
    SendInterceptor chain = sendInterceptors.get(sendInterceptors.size() - 1);
    for (int i = sendInterceptors.size() - 2; i >= 0; i--) {
      chain = new Link(sendInterceptors.get(i), chain);
    }

    this.rootInterceptor = chain;
    this.sendInterceptors = ImmutableList.copyOf(sendInterceptors);
  }

  @VisibleForTesting
  List<SendInterceptor> getSendInterceptors() {
    return sendInterceptors;
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next) {
    return rootInterceptor.aroundRequest(request, next);
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next) {
    return rootInterceptor.aroundLoginStep(step, value, next);
  }

  @Override
  public CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next) {
    return rootInterceptor.aroundData(next);
  }

  private static class Link implements SendInterceptor {
    private final SendInterceptor outer;
    private final SendInterceptor inner;

    Link(SendInterceptor outer, SendInterceptor inner) {
      this.outer = outer;
      this.inner = inner;
    }

    @Override
    public CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next) {
      return outer.aroundRequest(request, () -> inner.aroundRequest(request, next));
    }

    @Override
    public CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next) {
      return outer.aroundLoginStep(step, value, () -> inner.aroundLoginStep(step, value, next));
    }

    @Override
    public CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next) {
      return outer.aroundData(() -> inner.aroundData(next));
    }
  }
}
