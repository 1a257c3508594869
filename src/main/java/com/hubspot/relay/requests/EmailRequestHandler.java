package com.hubspot.relay.requests;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.hubspot.relay.config.ConfigurationException;
import com.hubspot.relay.config.ConnectionConfigSource;
import com.hubspot.relay.config.SmtpSettings;
import com.hubspot.relay.delivery.ConnectionConfig;
import com.hubspot.relay.delivery.DeliveryException;
import com.hubspot.relay.delivery.DeliveryLog;
import com.hubspot.relay.delivery.DeliveryLogEntry;
import com.hubspot.relay.delivery.DeliveryOrchestrator;
import com.hubspot.relay.delivery.DeliveryResult;
import com.hubspot.relay.delivery.DeliveryStatus;
import com.hubspot.relay.delivery.VerificationResult;
import com.hubspot.relay.errors.ErrorClassification;
import com.hubspot.relay.errors.ErrorClassifier;
import com.hubspot.relay.messages.EmailMessage;
import com.hubspot.relay.utils.CompletableFutures;
import com.hubspot.relay.utils.CredentialMasking;

/**
 * Turns an {@link EmailRequest} into a delivery: loads the relay settings, renders the
 * template, picks the subject and sender, delivers and records the outcome in the
 * {@link DeliveryLog}.
 *
 * <p>When the requested template does not exist the branded fallback is sent with a
 * warning, unless {@code strictTemplateMode} is set, in which case the request fails with
 * {@link TemplateNotFoundException} and nothing is sent.
 *
 * <p>This class is thread-safe.
 */
public class EmailRequestHandler {
  private static final Logger LOG = LoggerFactory.getLogger(EmailRequestHandler.class);
  private static final String SENT_RESPONSE = "Email sent successfully";

  private final DeliveryOrchestrator orchestrator;
  private final ConnectionConfigSource configSource;
  private final TemplateResolver templateResolver;
  private final DeliveryLog deliveryLog;
  private final String businessName;
  private final boolean strictTemplateMode;
  private final ErrorClassifier classifier = new ErrorClassifier();

  public EmailRequestHandler(DeliveryOrchestrator orchestrator,
                             ConnectionConfigSource configSource,
                             TemplateResolver templateResolver,
                             DeliveryLog deliveryLog,
                             String businessName,
                             boolean strictTemplateMode) {
    this.orchestrator = Preconditions.checkNotNull(orchestrator);
    this.configSource = Preconditions.checkNotNull(configSource);
    this.templateResolver = Preconditions.checkNotNull(templateResolver);
    this.deliveryLog = Preconditions.checkNotNull(deliveryLog);
    this.businessName = Preconditions.checkNotNull(businessName);
    this.strictTemplateMode = strictTemplateMode;
  }

  /**
   * Handles {@code request}.
   *
   * @return a future for the outcome, failing with {@link ConfigurationException} if the relay
   *         settings are unusable, {@link TemplateNotFoundException} in strict mode, or
   *         {@link DeliveryException} if the relay did not accept the message
   */
  public CompletableFuture<EmailRequestOutcome> handle(EmailRequest request) {
    Preconditions.checkNotNull(request);

    SmtpSettings settings;
    ConnectionConfig config;
    try {
      settings = configSource.load().orElseThrow(ConfigurationException::notConfigured);
      config = settings.toConnectionConfig();
    } catch (ConfigurationException e) {
      LOG.warn("Not sending to {}: {}", CredentialMasking.maskEmail(request.getTo()), e.getMessage());
      return CompletableFutures.failedFuture(e);
    }

    ImmutableList.Builder<String> warnings = ImmutableList.builder();

    String senderEmail = settings.getEffectiveSenderEmail().orElse(config.getUsername());
    checkSenderDomain(senderEmail, config.getUsername()).ifPresent(warning -> {
      LOG.warn("[{}] {}", config.getConnectionId(), warning);
      warnings.add(warning);
    });

    Optional<RenderedTemplate> template = request.getTemplateKey().flatMap(key -> resolveTemplate(key, request));
    boolean templateFound = template.isPresent();

    if (!templateFound && request.getTemplateKey().isPresent()) {
      String templateKey = request.getTemplateKey().get();
      if (strictTemplateMode) {
        LOG.warn("[{}] Template {} not found, not sending", config.getConnectionId(), templateKey);
        return CompletableFutures.failedFuture(new TemplateNotFoundException(templateKey));
      }

      String warning = "Template " + templateKey + " not found - using branded fallback";
      LOG.warn("[{}] {}", config.getConnectionId(), warning);
      warnings.add(warning);
    }

    RenderedTemplate rendered = template.orElseGet(() -> BrandedFallbackTemplate.render(businessName));
    boolean explicitSubjectUsed = request.getExplicitSubject().isPresent();
    String subject = request.getExplicitSubject().orElse(rendered.getSubject());

    EmailMessage message = EmailMessage.builder()
        .from(settings.getEffectiveSenderName(businessName) + " <" + senderEmail + ">")
        .to(request.getTo().trim())
        .subject(subject)
        .text(rendered.getText())
        .html(rendered.getHtml())
        .build();

    DeliveryLogEntry.Builder entry = DeliveryLogEntry.builder()
        .recipient(message.getToAddress())
        .subject(subject)
        .senderEmail(senderEmail)
        .templateKey(request.getTemplateKey())
        .templateFound(templateFound)
        .explicitSubjectUsed(explicitSubjectUsed);

    BiFunction<DeliveryResult, Throwable, CompletableFuture<EmailRequestOutcome>> complete = (result, e) -> {
      if (e == null) {
        record(entry.status(DeliveryStatus.SENT)
            .smtpResponse(SENT_RESPONSE)
            .messageId(result.getMessageId())
            .tlsMode(result.getTlsMode())
            .authMethod(result.getAuthMethod())
            .attemptCount(result.getAttempts())
            .elapsedMs(result.getElapsedMs())
            .lastReplyCode(result.getLastReplyCode())
            .capabilities(result.getCapabilities())
            .build());

        return CompletableFuture.completedFuture(EmailRequestOutcome.builder()
            .deliveryResult(result)
            .subject(subject)
            .templateFound(templateFound)
            .explicitSubjectUsed(explicitSubjectUsed)
            .warnings(warnings.build())
            .build());
      }

      Throwable cause = CompletableFutures.unwrap(e);
      DeliveryException failure = cause instanceof DeliveryException ? (DeliveryException) cause : null;
      ErrorClassification classification = failure != null ? failure.getClassification() : classifier.classify(cause);

      record(entry.status(DeliveryStatus.FAILED)
          .smtpResponse(String.valueOf(cause.getMessage()))
          .attemptCount(failure != null ? failure.getAttempts() : 0)
          .elapsedMs(failure != null ? failure.getElapsedMs() : 0)
          .lastReplyCode(failure != null ? failure.getLastReplyCode() : Optional.empty())
          .errorCategory(classification.getCategory())
          .suggestion(classification.getSuggestion())
          .build());

      return CompletableFutures.failedFuture(cause);
    };

    return orchestrator.send(config, message).handle(complete).thenCompose(Function.identity());
  }

  /**
   * Checks that the configured relay can be reached and logged in to.
   */
  public CompletableFuture<VerificationResult> checkHealth() {
    ConnectionConfig config;
    try {
      config = configSource.load().orElseThrow(ConfigurationException::notConfigured).toConnectionConfig();
    } catch (ConfigurationException e) {
      return CompletableFutures.failedFuture(e);
    }

    return orchestrator.verify(config);
  }

  private Optional<RenderedTemplate> resolveTemplate(String templateKey, EmailRequest request) {
    try {
      return templateResolver.resolve(templateKey, request.getVariables());
    } catch (RuntimeException e) {
      LOG.warn("Template lookup failed for {}", templateKey, e);
      return Optional.empty();
    }
  }

  private void record(DeliveryLogEntry entry) {
    try {
      deliveryLog.record(entry);
    } catch (RuntimeException e) {
      LOG.error("Failed to record delivery to {}", CredentialMasking.maskEmail(entry.getRecipient()), e);
    }
  }

  @VisibleForTesting
  static Optional<String> checkSenderDomain(String senderEmail, String username) {
    Optional<String> senderDomain = domainOf(senderEmail);
    Optional<String> userDomain = domainOf(username);

    if (senderDomain.isPresent() && userDomain.isPresent() && !senderDomain.get().equalsIgnoreCase(userDomain.get())) {
      return Optional.of(String.format("Sender domain (%s) differs from auth domain (%s)", senderDomain.get(), userDomain.get()));
    }
    return Optional.empty();
  }

  private static Optional<String> domainOf(String address) {
    int at = address.lastIndexOf('@');
    if (at < 0 || at == address.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(address.substring(at + 1));
  }
}
