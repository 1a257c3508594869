package com.hubspot.relay.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hubspot.relay.utils.CredentialMasking;

/**
 * Writes delivery records to the {@code com.hubspot.relay.delivery.Slf4jDeliveryLog} logger,
 * successes at INFO and failures at WARN. Recipients are masked.
 */
public class Slf4jDeliveryLog implements DeliveryLog {
  private static final Logger LOG = LoggerFactory.getLogger(Slf4jDeliveryLog.class);

  @Override
  public void record(DeliveryLogEntry entry) {
    String recipient = CredentialMasking.maskEmail(entry.getRecipient());

    if (entry.getStatus() == DeliveryStatus.SENT) {
      LOG.info("{} to={} messageId={} tls={} auth={} attempts={} elapsedMs={} lastReplyCode={} templateFound={}",
          entry.getStatus().getLabel(),
          recipient,
          entry.getMessageId().orElse("-"),
          entry.getTlsMode().map(mode -> mode.getLabel()).orElse("-"),
          entry.getAuthMethod().map(Enum::name).orElse("-"),
          entry.getAttemptCount(),
          entry.getElapsedMs(),
          entry.getLastReplyCode().map(String::valueOf).orElse("-"),
          entry.isTemplateFound());
    } else {
      LOG.warn("{} to={} category={} attempts={} elapsedMs={} lastReplyCode={} response='{}' suggestion='{}'",
          entry.getStatus().getLabel(),
          recipient,
          entry.getErrorCategory().map(category -> category.getLabel()).orElse("-"),
          entry.getAttemptCount(),
          entry.getElapsedMs(),
          entry.getLastReplyCode().map(String::valueOf).orElse("-"),
          entry.getSmtpResponse(),
          entry.getSuggestion().orElse("-"));
    }
  }
}
