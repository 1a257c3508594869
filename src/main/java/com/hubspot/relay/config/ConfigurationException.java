package com.hubspot.relay.config;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Unchecked exception thrown when no delivery can be attempted because the relay settings are
 * disabled or incomplete.
 *
 */
public class ConfigurationException extends RuntimeException {
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  public enum Reason {
    SMTP_DISABLED("smtp_disabled", "Enable SMTP in communication settings"),
    INCOMPLETE_CONFIG("incomplete_config", "Complete SMTP configuration in admin settings"),
    NOT_CONFIGURED("not_configured", "Provide SMTP settings through a secret store or the settings record");

    private final String label;
    private final String suggestion;

    Reason(String label, String suggestion) {
      this.label = label;
      this.suggestion = suggestion;
    }

    public String getLabel() {
      return label;
    }

    public String getSuggestion() {
      return suggestion;
    }
  }

  private final Reason reason;
  private final List<String> missingFields;

  private ConfigurationException(Reason reason, List<String> missingFields, String message) {
    super(message);
    this.reason = reason;
    this.missingFields = ImmutableList.copyOf(missingFields);
  }

  public static ConfigurationException disabled() {
    return new ConfigurationException(Reason.SMTP_DISABLED, ImmutableList.of(), "SMTP not configured or disabled");
  }

  public static ConfigurationException incomplete(List<String> missingFields) {
    return new ConfigurationException(Reason.INCOMPLETE_CONFIG, missingFields, "Incomplete SMTP configuration: missing " + COMMA_JOINER.join(missingFields));
  }

  public static ConfigurationException notConfigured() {
    return new ConfigurationException(Reason.NOT_CONFIGURED, ImmutableList.of(), "No SMTP settings are available");
  }

  public Reason getReason() {
    return reason;
  }

  public List<String> getMissingFields() {
    return missingFields;
  }

  public String getSuggestion() {
    return reason.getSuggestion();
  }
}
