package com.hubspot.relay.config;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Redacted;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.hubspot.relay.client.TlsMode;
import com.hubspot.relay.delivery.ConnectionConfig;

/**
 * Relay settings as an operator enters them. Unlike {@link ConnectionConfig}, any field may be
 * missing; {@link #toConnectionConfig()} reports what is.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractSmtpSettings {

  @Default
  public boolean isEnabled() {
    return true;
  }

  public abstract Optional<String> getHost();

  @Default
  public int getPort() {
    return TlsMode.SUBMISSION_PORT;
  }

  public abstract Optional<String> getUsername();

  @Redacted
  public abstract Optional<String> getPassword();

  /**
   * The address messages are sent from. Defaults to the username.
   */
  public abstract Optional<String> getSenderEmail();

  public abstract Optional<String> getSenderName();

  @Default
  public boolean isDebugLogging() {
    return false;
  }

  /**
   * Names the required fields that are absent or blank, in a fixed order.
   */
  public List<String> getMissingFields() {
    ImmutableList.Builder<String> missing = ImmutableList.builder();
    if (isBlank(getHost())) {
      missing.add("SMTP host");
    }
    if (isBlank(getUsername())) {
      missing.add("SMTP username");
    }
    if (isBlank(getPassword())) {
      missing.add("SMTP password");
    }
    return missing.build();
  }

  /**
   * Builds the connection settings, with surrounding whitespace trimmed.
   *
   * @throws ConfigurationException if SMTP is disabled or a required field is missing
   */
  public ConnectionConfig toConnectionConfig() {
    if (!isEnabled()) {
      throw ConfigurationException.disabled();
    }

    List<String> missing = getMissingFields();
    if (!missing.isEmpty()) {
      throw ConfigurationException.incomplete(missing);
    }

    return ConnectionConfig.builder()
        .hostname(getHost().get().trim())
        .port(getPort())
        .username(getUsername().get().trim())
        .password(getPassword().get().trim())
        .debugLogging(isDebugLogging())
        .build();
  }

  /**
   * Gets the sender address, falling back to the username.
   */
  public Optional<String> getEffectiveSenderEmail() {
    return firstNonBlank(getSenderEmail(), getUsername());
  }

  /**
   * Gets the sender display name, falling back to {@code defaultName}.
   */
  public String getEffectiveSenderName(String defaultName) {
    return firstNonBlank(getSenderName(), Optional.of(defaultName)).orElse(defaultName);
  }

  private static Optional<String> firstNonBlank(Optional<String> first, Optional<String> second) {
    if (!isBlank(first)) {
      return first.map(String::trim);
    }
    if (!isBlank(second)) {
      return second.map(String::trim);
    }
    return Optional.empty();
  }

  private static boolean isBlank(Optional<String> value) {
    return !value.isPresent() || Strings.isNullOrEmpty(value.get().trim());
  }
}
