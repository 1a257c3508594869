package com.hubspot.relay.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * Factories for common {@link ConnectionConfigSource} arrangements.
 */
public final class ConnectionConfigSources {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionConfigSources.class);

  public static final String HOST_KEY = "SMTP_HOST";
  public static final String PORT_KEY = "SMTP_PORT";
  public static final String USER_KEY = "SMTP_USER";
  public static final String PASSWORD_KEY = "SMTP_PASS";
  public static final String SENDER_EMAIL_KEY = "SENDER_EMAIL";
  public static final String SENDER_NAME_KEY = "SENDER_NAME";

  private ConnectionConfigSources() {
    throw new AssertionError("Cannot create static utility class");
  }

  /**
   * Returns a source that asks each of {@code sources} in turn and uses the first that has
   * settings.
   */
  public static ConnectionConfigSource firstAvailable(ConnectionConfigSource... sources) {
    List<ConnectionConfigSource> ordered = ImmutableList.copyOf(sources);
    Preconditions.checkArgument(!ordered.isEmpty(), "sources must not be empty");

    return () -> {
      for (ConnectionConfigSource source : ordered) {
        Optional<SmtpSettings> settings = source.load();
        if (settings.isPresent()) {
          return settings;
        }
      }
      return Optional.empty();
    };
  }

  /**
   * Returns a source that always supplies {@code settings}.
   */
  public static ConnectionConfigSource of(SmtpSettings settings) {
    Preconditions.checkNotNull(settings);
    Optional<SmtpSettings> loaded = Optional.of(settings);
    return () -> loaded;
  }

  /**
   * Returns a source backed by secrets stored under the {@code SMTP_*} keys, such as the
   * process environment. It has settings only when the host is present.
   */
  public static ConnectionConfigSource fromProperties(Map<String, String> properties) {
    Preconditions.checkNotNull(properties);

    return () -> {
      String host = properties.get(HOST_KEY);
      if (Strings.isNullOrEmpty(host)) {
        return Optional.empty();
      }

      SmtpSettings.Builder builder = SmtpSettings.builder()
          .host(host)
          .username(Optional.ofNullable(properties.get(USER_KEY)))
          .password(Optional.ofNullable(properties.get(PASSWORD_KEY)))
          .senderEmail(Optional.ofNullable(properties.get(SENDER_EMAIL_KEY)))
          .senderName(Optional.ofNullable(properties.get(SENDER_NAME_KEY)));

      String port = properties.get(PORT_KEY);
      if (!Strings.isNullOrEmpty(port)) {
        Integer parsed = Ints.tryParse(port.trim());
        if (parsed == null) {
          LOG.warn("Ignoring {}={}, it is not a port number", PORT_KEY, port);
        } else {
          builder.port(parsed);
        }
      }

      return Optional.of(builder.build());
    };
  }
}
