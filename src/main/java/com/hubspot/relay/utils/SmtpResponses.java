package com.hubspot.relay.utils;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import io.netty.handler.codec.smtp.SmtpResponse;

/**
 * Helps identify and print {@link SmtpResponse} instances.
 *
 */
public final class SmtpResponses {
  private static final Joiner SPACE_JOINER = Joiner.on(" ").skipNulls();

  private SmtpResponses() {
    throw new AssertionError("Cannot create static utility class");
  }

  public static String toString(SmtpResponse response) {
    if (response.details().isEmpty()) {
      return Integer.toString(response.code());
    } else {
      return response.code() + " " + getMessage(response);
    }
  }

  /**
   * Gets the text of every line of the response, without the reply code, joined with spaces.
   */
  public static String getMessage(SmtpResponse response) {
    return SPACE_JOINER.join(response.details());
  }

  /**
   * Gets the response as it appeared on the wire, e.g. {@code ["250-FIRST", "250 LAST"]}.
   */
  public static List<String> getLines(SmtpResponse response) {
    if (response.details().isEmpty()) {
      return ImmutableList.of(Integer.toString(response.code()));
    }

    ImmutableList.Builder<String> lines = ImmutableList.builder();
    int last = response.details().size() - 1;

    for (int i = 0; i <= last; i++) {
      lines.add(response.code() + (i == last ? " " : "-") + response.details().get(i));
    }

    return lines.build();
  }

  public static boolean isTransientError(SmtpResponse response) {
    return response.code() >= 400 && response.code() < 500;
  }

  public static boolean isPermanentError(SmtpResponse response) {
    return response.code() >= 500;
  }

  public static boolean isError(SmtpResponse response) {
    return isTransientError(response) || isPermanentError(response);
  }
}
