package com.hubspot.relay.client;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import io.netty.handler.codec.smtp.SmtpRequest;
import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * An extension point that supports intercepting commands and data before they are sent.
 *
 * <p>Each method executes "around" the sending of a command, an {@code AUTH LOGIN}
 * continuation line or the message body. All methods receive a
 * {@code Supplier<CompletableFuture<SmtpResponse>>} called {@code next} that returns a
 * future that will complete when the server has answered.
 *
 * <p>As an example, consider an interceptor used for timing commands. It can record the time
 * before the command is sent, then log the difference when the {@code next} future completes.
 *
 * <pre>{@code
 *  class TimingInterceptor implements SendInterceptor {
 *    private static final Logger LOG = LoggerFactory.getLogger(TimingInterceptor.class);
 *
 *    public CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next) {
 *      long startedAt = System.currentTimeMillis();
 *      return next.get().whenComplete((response, throwable) -> LOG.debug("{}: {}ms", request.command(), System.currentTimeMillis() - startedAt));
 *    }
 *
 *    public CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next) {
 *      return next.get();
 *    }
 *
 *    public CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next) {
 *      long startedAt = System.currentTimeMillis();
 *      return next.get().whenComplete((response, throwable) -> LOG.debug("data: {}ms", System.currentTimeMillis() - startedAt));
 *    }
 *  }}</pre>
 *
 *  @see CompositeSendInterceptor
 */
public interface SendInterceptor {
  /**
   * Called before a command is sent.
   *
   * @param  request the request that will be sent
   * @param  next supplies a future that will complete when the request has been sent and a response received
   * @return {@code next.get()}, a {@code CompletableFuture} derived from it, or an exceptional future if the send should
   *         be aborted
   */
  CompletableFuture<SmtpResponse> aroundRequest(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> next);

  /**
   * Called before an {@code AUTH LOGIN} continuation line is sent.
   *
   * @param  step whether the line carries the username or the password
   * @param  value the credential in clear text, before it is base64 encoded
   * @param  next supplies a future that will complete when the line has been sent and a response received
   */
  CompletableFuture<SmtpResponse> aroundLoginStep(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> next);

  /**
   * Called before the message body is sent.
   *
   * @param  next supplies a future that will complete when the data has been sent and a response received
   */
  CompletableFuture<SmtpResponse> aroundData(Supplier<CompletableFuture<SmtpResponse>> next);
}
