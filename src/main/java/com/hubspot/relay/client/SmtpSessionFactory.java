package com.hubspot.relay.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.handler.codec.smtp.SmtpResponse;
import io.netty.util.concurrent.GlobalEventExecutor;

/**
 * Creates {@link SmtpSession} instances by connecting to remote servers.
 *
 * <p>This class is thread-safe.
 */
public class SmtpSessionFactory implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(SmtpSessionFactory.class);

  private final ChannelGroup allChannels;
  private final SmtpSessionFactoryConfig factoryConfig;

  /**
   * Creates a new factory with the provided configuration.
   */
  public SmtpSessionFactory(SmtpSessionFactoryConfig factoryConfig) {
    this.factoryConfig = factoryConfig;

    allChannels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
  }

  /**
   * Connects to a remote server. With {@link TlsMode#IMPLICIT} the TLS handshake completes
   * before the greeting is read.
   *
   * @param  config the configuration to use for the connection
   * @return a future representing the initial response from the server
   */
  public CompletableFuture<SmtpClientResponse> connect(SmtpSessionConfig config) {
    ResponseHandler responseHandler = new ResponseHandler(config.getConnectionId(), config.getExceptionHandler());
    CompletableFuture<SmtpResponse> initialResponseFuture = responseHandler.createResponseFuture(config.getInitialResponseTimeout(), () -> "initial response");
    Supplier<SSLEngine> sslEngineSupplier = () -> createSslEngine(config.getRemoteAddress());

    Bootstrap bootstrap = new Bootstrap()
        .group(factoryConfig.getEventLoopGroup())
        .channel(factoryConfig.getChannelClass())
        .option(ChannelOption.ALLOCATOR, factoryConfig.getAllocator())
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
        .remoteAddress(config.getRemoteAddress())
        .handler(new Initializer(responseHandler, config, sslEngineSupplier));

    CompletableFuture<SmtpClientResponse> connectFuture = new CompletableFuture<>();

    LOG.debug("[{}] Connecting to {} (tls: {})", config.getConnectionId(), config.getRemoteAddress(), config.getTlsMode().getLabel());

    bootstrap.connect().addListener(f -> {
      if (f.isSuccess()) {
        Channel channel = ((ChannelFuture) f).channel();
        allChannels.add(channel);

        SmtpSession session = new SmtpSession(channel, responseHandler, config, factoryConfig.getExecutor(), sslEngineSupplier);

        initialResponseFuture.handleAsync((response, e) -> {
          if (e != null) {
            session.close();
            connectFuture.completeExceptionally(e);
          } else {
            connectFuture.complete(new SmtpClientResponse(session, response));
          }

          return null;
        }, factoryConfig.getExecutor());
      } else {
        // nothing will ever answer the greeting future, fail it so its timer is cancelled
        initialResponseFuture.completeExceptionally(f.cause());
        factoryConfig.getExecutor().execute(() -> connectFuture.completeExceptionally(f.cause()));
      }
    });

    return connectFuture;
  }

  private SSLEngine createSslEngine(InetSocketAddress remoteAddress) {
    SSLEngine engine = factoryConfig.getSslContext().newEngine(factoryConfig.getAllocator(), remoteAddress.getHostString(), remoteAddress.getPort());

    if (factoryConfig.isHostnameVerificationEnabled()) {
      SSLParameters parameters = engine.getSSLParameters();
      parameters.setEndpointIdentificationAlgorithm("HTTPS");
      engine.setSSLParameters(parameters);
    }

    return engine;
  }

  @Override
  public void close() throws IOException {
    try {
      allChannels.close().await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Closes all sessions created by this factory.
   *
   * @return a future that will be completed when all sessions have been closed
   */
  public CompletableFuture<Void> closeAsync() {
    CompletableFuture<Void> returnedFuture = new CompletableFuture<>();

    allChannels.close().addListener(f -> {
      if (f.isSuccess()) {
        returnedFuture.complete(null);
      } else {
        returnedFuture.completeExceptionally(f.cause());
      }
    });

    return returnedFuture;
  }
}
