package com.hubspot.relay.client;

import java.util.function.Supplier;

import javax.net.ssl.SSLEngine;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.ssl.SslHandler;

class Initializer extends ChannelInitializer<SocketChannel> {

  static final int MAX_LINE_LENGTH = 1000;

  private final ResponseHandler responseHandler;
  private final SmtpSessionConfig config;
  private final Supplier<SSLEngine> sslEngineSupplier;

  Initializer(ResponseHandler responseHandler, SmtpSessionConfig config, Supplier<SSLEngine> sslEngineSupplier) {
    this.responseHandler = responseHandler;
    this.config = config;
    this.sslEngineSupplier = sslEngineSupplier;
  }

  @Override
  protected void initChannel(SocketChannel socketChannel) throws Exception {
    if (config.getTlsMode() == TlsMode.IMPLICIT) {
      // the handshake starts as soon as the channel becomes active, before the greeting
      socketChannel.pipeline().addLast(createSslHandler(sslEngineSupplier, config));
    }

    socketChannel.pipeline().addLast(
        new Utf8SmtpRequestEncoder(),
        new Utf8SmtpResponseDecoder(MAX_LINE_LENGTH),
        responseHandler);
  }

  static SslHandler createSslHandler(Supplier<SSLEngine> sslEngineSupplier, SmtpSessionConfig config) {
    SslHandler sslHandler = new SslHandler(sslEngineSupplier.get());
    sslHandler.setHandshakeTimeoutMillis(config.getConnectTimeout().toMillis());
    return sslHandler;
  }
}
