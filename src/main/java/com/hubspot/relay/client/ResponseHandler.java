package com.hubspot.relay.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.smtp.SmtpResponse;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

/**
 * A Netty handler that hands each SMTP response to the command waiting for it.
 *
 * <p>Only one command may wait at a time. If no response arrives within the command's
 * timeout, the pending future fails with a {@link ResponseTimeoutException} and the channel
 * is closed, so a late reply can never be matched to a later command.
 */
class ResponseHandler extends SimpleChannelInboundHandler<SmtpResponse> {
  private static final Logger LOG = LoggerFactory.getLogger(ResponseHandler.class);
  private static final HashedWheelTimer TIMER = new HashedWheelTimer(new ThreadFactoryBuilder().setDaemon(true).setNameFormat("response-timer-%d").build());

  private final AtomicReference<ResponseCollector> responseCollector = new AtomicReference<>();
  private final String connectionId;
  private final Optional<Consumer<Throwable>> exceptionHandler;
  private final Timer timer;

  private volatile ChannelHandlerContext context;

  ResponseHandler(String connectionId, Optional<Consumer<Throwable>> exceptionHandler) {
    this(connectionId, exceptionHandler, TIMER);
  }

  @VisibleForTesting
  ResponseHandler(String connectionId, Optional<Consumer<Throwable>> exceptionHandler, Timer timer) {
    this.connectionId = connectionId;
    this.exceptionHandler = exceptionHandler;
    this.timer = timer;
  }

  CompletableFuture<SmtpResponse> createResponseFuture(Duration responseTimeout, Supplier<String> debugStringSupplier) {
    ResponseCollector collector = new ResponseCollector(debugStringSupplier);

    boolean success = responseCollector.compareAndSet(null, collector);
    if (!success) {
      ResponseCollector previousCollector = this.responseCollector.get();
      if (previousCollector == null) {
        return createResponseFuture(responseTimeout, debugStringSupplier);
      }

      throw new IllegalStateException(String.format("[%s] Cannot wait for a response to [%s] because we're still waiting for a response to [%s]",
          connectionId, collector.getDebugString(), previousCollector.getDebugString()));
    }

    CompletableFuture<SmtpResponse> responseFuture = collector.getFuture();

    Timeout timeout = timer.newTimeout(ignored -> expire(collector, responseTimeout), responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
    responseFuture.whenComplete((ignored1, ignored2) -> timeout.cancel());

    return responseFuture;
  }

  private void expire(ResponseCollector collector, Duration responseTimeout) {
    if (!responseCollector.compareAndSet(collector, null)) {
      return;
    }

    LOG.warn("[{}] No response to [{}] within {}ms, closing the connection", connectionId, collector.getDebugString(), responseTimeout.toMillis());
    collector.completeExceptionally(new ResponseTimeoutException(connectionId, responseTimeout, collector.getDebugString()));

    ChannelHandlerContext ctx = context;
    if (ctx != null) {
      ctx.channel().close();
    }
  }

  boolean isResponsePending() {
    return responseCollector.get() != null;
  }

  @VisibleForTesting
  Optional<String> getPendingResponseDebugString() {
    return Optional.ofNullable(responseCollector.get()).map(ResponseCollector::getDebugString);
  }

  @Override
  public void handlerAdded(ChannelHandlerContext ctx) throws Exception {
    this.context = ctx;
    super.handlerAdded(ctx);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, SmtpResponse msg) throws Exception {
    ResponseCollector collector = responseCollector.getAndSet(null);

    if (collector == null) {
      LOG.warn("[{}] Unexpected response received: {}", connectionId, msg);
    } else {
      collector.complete(msg);
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
    ResponseCollector collector = responseCollector.getAndSet(null);
    if (collector != null) {
      collector.completeExceptionally(cause);
    } else {
      // this exception can't get back to the client via a future,
      // use the connection exception handler if possible
      if (exceptionHandler.isPresent()) {
        exceptionHandler.get().accept(cause);
      } else {
        super.exceptionCaught(ctx, cause);
      }
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    ResponseCollector collector = responseCollector.getAndSet(null);

    if (collector != null) {
      collector.completeExceptionally(new ChannelClosedException(connectionId, "Handled channelInactive while waiting for a response to [" + collector.getDebugString() + "]"));
    }

    super.channelInactive(ctx);
  }
}
