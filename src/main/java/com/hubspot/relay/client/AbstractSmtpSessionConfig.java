package com.hubspot.relay.client;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.Preconditions;

/**
 * Configures a connection to a remote SMTP server.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractSmtpSessionConfig {
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(8);
  public static final Duration DEFAULT_DATA_TIMEOUT = Duration.ofSeconds(20);

  /**
   * The host and port of the remote server.
   */
  public abstract InetSocketAddress getRemoteAddress();

  /**
   * How the connection is encrypted. Defaults to the conventional mode for the remote port.
   */
  @Default
  public TlsMode getTlsMode() {
    return TlsMode.forPort(getRemoteAddress().getPort());
  }

  /**
   * The domain sent with EHLO. Defaults to the remote host name.
   */
  @Default
  public String getEhloDomain() {
    return getRemoteAddress().getHostString();
  }

  /**
   * The time allowed to open the TCP connection, and separately to complete a TLS handshake.
   */
  @Default
  public Duration getConnectTimeout() {
    return DEFAULT_CONNECT_TIMEOUT;
  }

  /**
   * The time to wait for the response to any single command.
   */
  @Default
  public Duration getCommandTimeout() {
    return DEFAULT_COMMAND_TIMEOUT;
  }

  /**
   * The time to wait for the response to the message body.
   */
  @Default
  public Duration getDataTimeout() {
    return DEFAULT_DATA_TIMEOUT;
  }

  /**
   * The time to wait for the server greeting, which includes the connect time.
   */
  public Duration getInitialResponseTimeout() {
    return getConnectTimeout().plus(getCommandTimeout());
  }

  /**
   * A {@link SendInterceptor} that can intercept commands and data before
   * they are sent to the server.
   */
  public abstract Optional<SendInterceptor> getSendInterceptor();

  /**
   * A handler for exceptions that happen outside sending individual commands.
   */
  public abstract Optional<Consumer<Throwable>> getExceptionHandler();

  /**
   * An opaque string that will be logged with any errors on this connection.
   */
  @Default
  public String getConnectionId() {
    return "unidentified-connection";
  }

  @Check
  protected void check() {
    Preconditions.checkState(!getConnectTimeout().isNegative() && !getConnectTimeout().isZero(), "connectTimeout must be positive");
    Preconditions.checkState(!getCommandTimeout().isNegative() && !getCommandTimeout().isZero(), "commandTimeout must be positive");
    Preconditions.checkState(!getDataTimeout().isNegative() && !getDataTimeout().isZero(), "dataTimeout must be positive");
  }

  /**
   * Creates a configuration for a connection to a server on the specified host and port.
   */
  public static SmtpSessionConfig forRemoteAddress(String host, int port) {
    return forRemoteAddress(InetSocketAddress.createUnresolved(host, port));
  }

  /**
   * Creates a configuration for a connection to a server on the specified host and port.
   */
  public static SmtpSessionConfig forRemoteAddress(InetSocketAddress remoteAddress) {
    return SmtpSessionConfig.builder().remoteAddress(remoteAddress).build();
  }
}
