package com.hubspot.relay.client;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.function.Supplier;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import com.hubspot.relay.messages.MessageContent;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.smtp.DefaultSmtpRequest;
import io.netty.handler.codec.smtp.SmtpCommand;
import io.netty.handler.codec.smtp.SmtpRequest;
import io.netty.handler.codec.smtp.SmtpRequests;
import io.netty.handler.codec.smtp.SmtpResponse;
import io.netty.handler.ssl.SslHandler;

/**
 * A single conversation with an SMTP server.
 *
 * <p>Commands are sent one at a time: each {@code send} waits for the server's reply before
 * another command may be written. A session is created for one delivery attempt and is never
 * reused afterwards.
 *
 * <p>The session tracks its {@link ConnectionState}. The mail transaction commands
 * (MAIL, RCPT and DATA) are refused until authentication has succeeded.
 */
public class SmtpSession {
  private static final Logger LOG = LoggerFactory.getLogger(SmtpSession.class);

  private static final Joiner SPACE_JOINER = Joiner.on(" ");
  private static final SmtpCommand STARTTLS_COMMAND = SmtpCommand.valueOf("STARTTLS");
  private static final SmtpCommand AUTH_COMMAND = SmtpCommand.valueOf("AUTH");
  private static final Set<SmtpCommand> TRANSACTION_COMMANDS = ImmutableSet.of(SmtpCommand.MAIL, SmtpCommand.RCPT, SmtpCommand.DATA);
  private static final Set<ConnectionState> TRANSACTION_STATES = EnumSet.of(ConnectionState.AUTHENTICATED, ConnectionState.SENDING);
  private static final byte[] DOT_CRLF = {'.', '\r', '\n'};
  private static final byte[] CRLF = {'\r', '\n'};

  private static final int READY = 220;
  private static final int OK = 250;
  private static final int USER_NOT_LOCAL = 251;
  private static final int CLOSING = 221;
  private static final int AUTH_SUCCEEDED = 235;
  private static final int AUTH_CONTINUE = 334;
  private static final int START_MAIL_INPUT = 354;

  private final Channel channel;
  private final ResponseHandler responseHandler;
  private final SmtpSessionConfig config;
  private final Executor executor;
  private final Supplier<SSLEngine> sslEngineSupplier;
  private final CompletableFuture<Void> closeFuture;
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTED);

  private volatile EhloResponse ehloResponse = EhloResponse.EMPTY;

  SmtpSession(Channel channel, ResponseHandler responseHandler, SmtpSessionConfig config, Executor executor, Supplier<SSLEngine> sslEngineSupplier) {
    this.channel = channel;
    this.responseHandler = responseHandler;
    this.config = config;
    this.executor = executor;
    this.sslEngineSupplier = sslEngineSupplier;
    this.closeFuture = new CompletableFuture<>();

    this.channel.pipeline().addLast(new ErrorHandler());
  }

  public String getConnectionId() {
    return config.getConnectionId();
  }

  public CompletableFuture<Void> getCloseFuture() {
    return closeFuture;
  }

  public EhloResponse getEhloResponse() {
    return ehloResponse;
  }

  public ConnectionState getState() {
    return state.get();
  }

  public TlsMode getTlsMode() {
    return config.getTlsMode();
  }

  public CompletableFuture<Void> close() {
    state.set(ConnectionState.CLOSED);
    this.channel.close();
    return closeFuture;
  }

  /**
   * Sends QUIT, then closes the channel whatever the outcome. Failures of either step are
   * logged, and the returned future always completes normally.
   */
  public CompletableFuture<Void> quitAndClose() {
    CompletableFuture<Void> quitFuture;

    if (channel.isActive() && !responseHandler.isResponsePending()) {
      quitFuture = send(SmtpRequests.quit()).handle((response, e) -> {
        if (e != null) {
          LOG.debug("[{}] QUIT failed: {}", getConnectionId(), Throwables.getRootCause(e).toString());
        } else if (response.code() != CLOSING) {
          LOG.debug("[{}] Unexpected response to QUIT: {}", getConnectionId(), response);
        }
        return null;
      });
    } else {
      quitFuture = CompletableFuture.completedFuture(null);
    }

    return quitFuture.thenCompose(ignored -> close().handle((v, e) -> {
      if (e != null) {
        LOG.debug("[{}] The connection closed with an error: {}", getConnectionId(), e.toString());
      }
      return null;
    }));
  }

  /**
   * Sends EHLO with the configured domain and records the advertised capabilities.
   *
   * @return a future that fails with {@link ErrorResponseException} unless the server replies 250
   */
  public CompletableFuture<EhloResponse> ehlo() {
    return send(SmtpRequests.ehlo(config.getEhloDomain())).thenApply(r -> {
      if (r.code() != OK) {
        throw new ErrorResponseException(getConnectionId(), r.getResponse(), "EHLO was rejected");
      }

      state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.CAPABILITIES_KNOWN);
      return ehloResponse;
    });
  }

  /**
   * Upgrades the connection to TLS with STARTTLS and then repeats EHLO, since the capabilities
   * advertised before the upgrade must be discarded.
   *
   * @return a future for the capabilities advertised over the encrypted connection
   * @throws IllegalStateException if the connection is already encrypted
   */
  public CompletableFuture<EhloResponse> startTls() {
    Preconditions.checkState(!isEncrypted(), "This connection is already using TLS");

    if (!ehloResponse.isStartTlsSupported()) {
      CompletableFuture<EhloResponse> failed = new CompletableFuture<>();
      failed.completeExceptionally(new StartTlsException(getConnectionId(), "The server does not support STARTTLS"));
      return failed;
    }

    return send(new DefaultSmtpRequest(STARTTLS_COMMAND))
        .thenCompose(r -> {
          if (r.code() != READY) {
            throw new StartTlsException(getConnectionId(), "STARTTLS was rejected (" + r + ")");
          }

          return performTlsHandshake();
        })
        .thenCompose(ignored -> {
          ehloResponse = EhloResponse.EMPTY;
          return ehlo();
        })
        .thenApply(ehlo -> {
          state.set(ConnectionState.TLS_UPGRADED);
          return ehlo;
        });
  }

  private CompletionStage<Void> performTlsHandshake() {
    CompletableFuture<Void> ourFuture = new CompletableFuture<>();

    SslHandler sslHandler = Initializer.createSslHandler(sslEngineSupplier, config);
    channel.pipeline().addFirst(sslHandler);

    sslHandler.handshakeFuture().addListener(nettyFuture -> {
      if (nettyFuture.isSuccess()) {
        executor.execute(() -> ourFuture.complete(null));
      } else {
        close();
        executor.execute(() -> ourFuture.completeExceptionally(nettyFuture.cause()));
      }
    });

    return ourFuture;
  }

  public boolean isEncrypted() {
    return channel.pipeline().get(SslHandler.class) != null;
  }

  public Optional<SSLSession> getSSLSession() {
    return Optional.ofNullable(channel.pipeline().get(SslHandler.class)).map(handler -> handler.engine().getSession());
  }

  /**
   * Authenticates with {@code AUTH PLAIN} and an empty authorization identity.
   *
   * @return a future for the server's reply; the session is authenticated if its code is 235
   */
  public CompletableFuture<SmtpClientResponse> authPlain(String username, String password) {
    String credentials = String.format("\0%s\0%s", username, password);

    return send(new DefaultSmtpRequest(AUTH_COMMAND, AuthMechanism.PLAIN.name(), encodeBase64(credentials)))
        .thenApply(this::recordAuthenticationResult);
  }

  /**
   * Authenticates with {@code AUTH LOGIN}, answering the username and password challenges in turn.
   *
   * @return a future for the last reply received; the session is authenticated if its code is 235
   */
  public CompletableFuture<SmtpClientResponse> authLogin(String username, String password) {
    return send(new DefaultSmtpRequest(AUTH_COMMAND, AuthMechanism.LOGIN.name()))
        .thenCompose(r -> continueLoginIf(r, LoginStep.USERNAME, username))
        .thenCompose(r -> continueLoginIf(r, LoginStep.PASSWORD, password))
        .thenApply(this::recordAuthenticationResult);
  }

  private CompletionStage<SmtpClientResponse> continueLoginIf(SmtpClientResponse previous, LoginStep step, String value) {
    if (previous.code() != AUTH_CONTINUE) {
      return CompletableFuture.completedFuture(previous);
    }

    return applyOnExecutor(executeLoginStepInterceptor(step, value, () -> {
      CompletableFuture<SmtpResponse> responseFuture = responseHandler.createResponseFuture(config.getCommandTimeout(), () -> "<redacted-auth-" + step.name().toLowerCase() + ">");

      ByteBuf line = channel.alloc().buffer();
      line.writeBytes(encodeBase64(value).getBytes(StandardCharsets.US_ASCII)).writeBytes(CRLF);
      writeAndFlush(line);

      return responseFuture;
    }), this::wrapResponse);
  }

  private SmtpClientResponse recordAuthenticationResult(SmtpClientResponse response) {
    if (response.code() == AUTH_SUCCEEDED) {
      state.set(ConnectionState.AUTHENTICATED);
    }
    return response;
  }

  /**
   * Sends a message to a single recipient: MAIL, RCPT, DATA and then the dot-stuffed content.
   *
   * @return a future for the server's final 250 reply, failing with {@link ErrorResponseException}
   *         if any step is refused
   * @throws IllegalStateException if the session has not authenticated
   * @throws MessageTooLargeException if the content exceeds the server's advertised SIZE limit
   */
  public CompletableFuture<SmtpClientResponse> send(String from, String to, MessageContent content) {
    Preconditions.checkNotNull(from);
    Preconditions.checkNotNull(to);
    Preconditions.checkNotNull(content);
    checkTransactionAllowed(SmtpCommand.MAIL);
    checkMessageSize(content.size());

    state.set(ConnectionState.SENDING);

    return sendExpecting(SmtpRequests.mail(from), code -> code == OK, "MAIL FROM was rejected")
        .thenCompose(r -> sendExpecting(SmtpRequests.rcpt(to), code -> code == OK || code == USER_NOT_LOCAL, "RCPT TO was rejected"))
        .thenCompose(r -> sendExpecting(SmtpRequests.data(), code -> code == START_MAIL_INPUT, "DATA was rejected"))
        .thenCompose(r -> send(content))
        .thenApply(r -> {
          if (r.code() != OK) {
            throw new ErrorResponseException(getConnectionId(), r.getResponse(), "The message was rejected");
          }

          state.compareAndSet(ConnectionState.SENDING, ConnectionState.AUTHENTICATED);
          return r;
        });
  }

  private CompletableFuture<SmtpClientResponse> sendExpecting(SmtpRequest request, IntPredicate accepted, String errorMessage) {
    return send(request).thenApply(r -> {
      if (!accepted.test(r.code())) {
        throw new ErrorResponseException(getConnectionId(), r.getResponse(), errorMessage);
      }
      return r;
    });
  }

  /**
   * Sends a single command and waits for its reply, which may be an error reply.
   *
   * @throws IllegalStateException if the command is MAIL, RCPT or DATA and the session has not authenticated
   */
  public CompletableFuture<SmtpClientResponse> send(SmtpRequest request) {
    Preconditions.checkNotNull(request);
    if (TRANSACTION_COMMANDS.contains(request.command())) {
      checkTransactionAllowed(request.command());
    }

    return applyOnExecutor(executeRequestInterceptor(request, () -> {
      CompletableFuture<SmtpResponse> responseFuture = responseHandler.createResponseFuture(config.getCommandTimeout(), () -> createDebugString(request));
      writeAndFlush(request);

      if (request.command().equals(SmtpCommand.EHLO)) {
        responseFuture = responseFuture.whenComplete((response, ignored) -> {
          if (response != null && response.code() == OK) {
            String ehloDomain = request.parameters().isEmpty() ? "" : request.parameters().get(0).toString();
            parseEhloResponse(ehloDomain, response.details());
          }
        });
      }

      return responseFuture;
    }), this::wrapResponse);
  }

  /**
   * Sends the message body after a 354 reply to DATA. The content is dot-stuffed and followed
   * by the terminating {@code .} line.
   */
  public CompletableFuture<SmtpClientResponse> send(MessageContent content) {
    Preconditions.checkNotNull(content);
    Preconditions.checkState(state.get() == ConnectionState.SENDING, "Message content can only be sent after DATA (state: %s)", state.get());

    return applyOnExecutor(executeDataInterceptor(() -> {
      CompletableFuture<SmtpResponse> responseFuture = responseHandler.createResponseFuture(config.getDataTimeout(), () -> "message contents");

      write(content.getDotStuffedContent());
      writeAndFlush(Unpooled.wrappedBuffer(DOT_CRLF));

      return responseFuture;
    }), this::wrapResponse);
  }

  private SmtpClientResponse wrapResponse(SmtpResponse response) {
    return new SmtpClientResponse(this, response);
  }

  private void checkTransactionAllowed(SmtpCommand command) {
    ConnectionState current = state.get();
    Preconditions.checkState(TRANSACTION_STATES.contains(current),
        "[%s] %s requires an authenticated session (state: %s)", getConnectionId(), command.name(), current);
  }

  private void checkMessageSize(int size) {
    if (!ehloResponse.getMaxMessageSize().isPresent()) {
      return;
    }

    long maxMessageSize = ehloResponse.getMaxMessageSize().get();
    if (maxMessageSize < size) {
      throw new MessageTooLargeException(getConnectionId(), size, maxMessageSize);
    }
  }

  private static String encodeBase64(String s) {
    return Base64.getEncoder().encodeToString(s.getBytes(StandardCharsets.UTF_8));
  }

  private void write(Object obj) {
    // adding ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE ensures we'll find out
    // about errors that occur when writing
    channel.write(obj).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
  }

  private void writeAndFlush(Object obj) {
    channel.writeAndFlush(obj).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
  }

  @VisibleForTesting
  void parseEhloResponse(String ehloDomain, List<CharSequence> details) {
    // the first line is the server's greeting, the rest are capabilities
    List<CharSequence> capabilities = details.isEmpty() ? details : details.subList(1, details.size());
    ehloResponse = EhloResponse.parse(ehloDomain, capabilities);
  }

  @VisibleForTesting
  static String createDebugString(SmtpRequest request) {
    if (request.command().equals(AUTH_COMMAND)) {
      return "<redacted-auth-command>";
    } else if (request.parameters().isEmpty()) {
      return request.command().name().toString();
    } else {
      return request.command().name() + " " + SPACE_JOINER.join(request.parameters());
    }
  }

  private <R, T> CompletableFuture<R> applyOnExecutor(CompletableFuture<T> eventLoopFuture, Function<T, R> mapper) {
    if (executor == SmtpSessionFactoryConfig.DIRECT_EXECUTOR) {
      return eventLoopFuture.thenApply(mapper);
    }

    // use handleAsync to ensure exceptions and other callbacks are completed on the ExecutorService thread
    return eventLoopFuture.handleAsync((rs, e) -> {
      if (e != null) {
        Throwables.throwIfUnchecked(e);
        throw new IllegalStateException(e);
      }

      return mapper.apply(rs);
    }, executor);
  }

  private CompletableFuture<SmtpResponse> executeRequestInterceptor(SmtpRequest request, Supplier<CompletableFuture<SmtpResponse>> supplier) {
    return config.getSendInterceptor().map(h -> h.aroundRequest(request, supplier)).orElseGet(supplier);
  }

  private CompletableFuture<SmtpResponse> executeLoginStepInterceptor(LoginStep step, String value, Supplier<CompletableFuture<SmtpResponse>> supplier) {
    return config.getSendInterceptor().map(h -> h.aroundLoginStep(step, value, supplier)).orElseGet(supplier);
  }

  private CompletableFuture<SmtpResponse> executeDataInterceptor(Supplier<CompletableFuture<SmtpResponse>> supplier) {
    return config.getSendInterceptor().map(h -> h.aroundData(supplier)).orElseGet(supplier);
  }

  private class ErrorHandler extends ChannelInboundHandlerAdapter {
    private Throwable cause;

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
      this.cause = cause;
      ctx.close();
    }

    @Override
    @SuppressFBWarnings("NP_NONNULL_PARAM_VIOLATION") // https://github.com/findbugsproject/findbugs/issues/79
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
      state.set(ConnectionState.CLOSED);

      if (cause != null) {
        closeFuture.completeExceptionally(cause);
      } else {
        closeFuture.complete(null);
      }

      super.channelInactive(ctx);
    }
  }
}
