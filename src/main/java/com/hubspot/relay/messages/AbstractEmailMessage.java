package com.hubspot.relay.messages;

import java.util.Optional;

import org.immutables.value.Value.Check;
import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * A message to deliver: a sender, a single recipient, a subject and a plain text body with an
 * optional HTML alternative.
 *
 * <p>{@code from} and {@code to} may be bare addresses or use the {@code Name <address>} form.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractEmailMessage {
  private static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\r\n");

  public abstract String getFrom();

  public abstract String getTo();

  public abstract String getSubject();

  public abstract String getText();

  public abstract Optional<String> getHtml();

  /**
   * Gets the address used with {@code MAIL FROM}.
   */
  public String getFromAddress() {
    return extractAddress(getFrom());
  }

  /**
   * Gets the address used with {@code RCPT TO}.
   */
  public String getToAddress() {
    return extractAddress(getTo());
  }

  @Check
  protected void check() {
    Preconditions.checkState(!extractAddress(getFrom()).isEmpty(), "from must contain an address");
    Preconditions.checkState(!extractAddress(getTo()).isEmpty(), "to must contain an address");
    Preconditions.checkState(LINE_BREAKS.matchesNoneOf(getFrom()), "from must be a single line");
    Preconditions.checkState(LINE_BREAKS.matchesNoneOf(getTo()), "to must be a single line");
  }

  /**
   * Gets the address part of {@code Name <address>}, or the trimmed input if it has no angle brackets.
   */
  public static String extractAddress(String mailbox) {
    int open = mailbox.lastIndexOf('<');
    int close = mailbox.lastIndexOf('>');

    if (open >= 0 && close > open) {
      return mailbox.substring(open + 1, close).trim();
    }
    return mailbox.trim();
  }
}
