package com.hubspot.relay.delivery;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.UUID;

import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Redacted;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.hubspot.relay.client.SmtpSessionConfig;
import com.hubspot.relay.client.TlsMode;

/**
 * Everything needed to deliver through one relay: where it is, how to log in and how long to
 * wait. The username and password are redacted from {@code toString()}.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractConnectionConfig {

  public abstract String getHostname();

  public abstract int getPort();

  @Redacted
  public abstract String getUsername();

  @Redacted
  public abstract String getPassword();

  /**
   * Logs the whole SMTP conversation, with credentials masked.
   */
  @Default
  public boolean isDebugLogging() {
    return false;
  }

  /**
   * How to protect the connection. Defaults to STARTTLS on 587, implicit TLS on 465 and
   * plain text elsewhere.
   */
  @Default
  public TlsMode getTlsMode() {
    return TlsMode.forPort(getPort());
  }

  /**
   * The domain sent with EHLO and used in generated Message-IDs. Defaults to the relay host name.
   */
  @Default
  public String getEhloDomain() {
    return getHostname();
  }

  @Default
  public Duration getConnectTimeout() {
    return SmtpSessionConfig.DEFAULT_CONNECT_TIMEOUT;
  }

  @Default
  public Duration getCommandTimeout() {
    return SmtpSessionConfig.DEFAULT_COMMAND_TIMEOUT;
  }

  @Default
  public Duration getDataTimeout() {
    return SmtpSessionConfig.DEFAULT_DATA_TIMEOUT;
  }

  /**
   * Identifies this delivery in log messages. Each attempt appends its number.
   */
  @Default
  public String getConnectionId() {
    return UUID.randomUUID().toString().substring(0, 6);
  }

  public InetSocketAddress getRemoteAddress() {
    return InetSocketAddress.createUnresolved(getHostname(), getPort());
  }

  @Check
  protected void check() {
    Preconditions.checkState(!Strings.isNullOrEmpty(getHostname()), "hostname must not be empty");
    Preconditions.checkState(getPort() > 0 && getPort() <= 65535, "port must be between 1 and 65535, got %s", getPort());
  }
}
