package com.hubspot.relay.utils;

import com.google.common.base.Strings;

/**
 * Hides credentials in text that is about to be logged.
 *
 */
public final class CredentialMasking {
  public static final String MASK = "***MASKED***";

  private CredentialMasking() {
    throw new AssertionError("Cannot create static utility class");
  }

  /**
   * Keeps the first and last character of the local part and the whole domain, e.g.
   * {@code jane.doe@example.com} becomes {@code j******e@example.com}. Local parts of two
   * characters or fewer are left alone, and a value without a domain is masked completely.
   */
  public static String maskEmail(String email) {
    if (Strings.isNullOrEmpty(email)) {
      return MASK;
    }

    int at = email.lastIndexOf('@');
    if (at < 0 || at == email.length() - 1) {
      return MASK;
    }

    String local = email.substring(0, at);
    String domain = email.substring(at + 1);

    if (local.length() <= 2) {
      return local + "@" + domain;
    }

    return local.charAt(0) + Strings.repeat("*", local.length() - 2) + local.charAt(local.length() - 1) + "@" + domain;
  }

  /**
   * Replaces every occurrence of {@code username} with its masked form and every occurrence of
   * {@code password} with {@link #MASK}.
   */
  public static String mask(String text, String username, String password) {
    String masked = text;

    if (!Strings.isNullOrEmpty(password)) {
      masked = masked.replace(password, MASK);
    }
    if (!Strings.isNullOrEmpty(username)) {
      masked = masked.replace(username, maskEmail(username));
    }

    return masked;
  }
}
