package com.hubspot.relay.delivery;

import java.util.List;
import java.util.Optional;

import org.immutables.value.Value.Immutable;
import org.immutables.value.Value.Style;
import org.immutables.value.Value.Style.ImplementationVisibility;

import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.TlsMode;
import com.hubspot.relay.errors.ErrorCategory;

/**
 * One record per delivery request, written whether or not the relay accepted the message.
 */
@Immutable
@Style(typeImmutable = "*", get = {"get*", "is*"}, visibility = ImplementationVisibility.PUBLIC)
abstract class AbstractDeliveryLogEntry {
  public abstract String getRecipient();

  public abstract String getSubject();

  public abstract DeliveryStatus getStatus();

  /**
   * A human readable diagnostic: a fixed text for successes, the failure message otherwise.
   */
  public abstract String getSmtpResponse();

  public abstract Optional<String> getSenderEmail();

  public abstract Optional<String> getTemplateKey();

  public abstract Optional<String> getMessageId();

  public abstract Optional<TlsMode> getTlsMode();

  public abstract Optional<AuthMechanism> getAuthMethod();

  public abstract int getAttemptCount();

  public abstract long getElapsedMs();

  public abstract Optional<Integer> getLastReplyCode();

  public abstract List<String> getCapabilities();

  public abstract Optional<ErrorCategory> getErrorCategory();

  public abstract Optional<String> getSuggestion();

  public abstract boolean isTemplateFound();

  public abstract boolean isExplicitSubjectUsed();
}
