package com.hubspot.relay.requests;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.TlsMode;
import com.hubspot.relay.config.ConfigurationException;
import com.hubspot.relay.config.ConnectionConfigSource;
import com.hubspot.relay.config.ConnectionConfigSources;
import com.hubspot.relay.config.SmtpSettings;
import com.hubspot.relay.delivery.ConnectionConfig;
import com.hubspot.relay.delivery.DeliveryException;
import com.hubspot.relay.delivery.DeliveryLog;
import com.hubspot.relay.delivery.DeliveryLogEntry;
import com.hubspot.relay.delivery.DeliveryOrchestrator;
import com.hubspot.relay.delivery.DeliveryResult;
import com.hubspot.relay.delivery.DeliveryStatus;
import com.hubspot.relay.delivery.VerificationResult;
import com.hubspot.relay.errors.ErrorCategory;
import com.hubspot.relay.errors.ErrorClassification;
import com.hubspot.relay.messages.EmailMessage;
import com.hubspot.relay.utils.CompletableFutures;

public class EmailRequestHandlerTest {
  private static final String BUSINESS_NAME = "Example Shop";
  private static final String RECIPIENT = "customer@example.org";

  private static final SmtpSettings SETTINGS = SmtpSettings.builder()
      .host("smtp.example.com")
      .username("relay@example.com")
      .password("secret")
      .build();

  private static final RenderedTemplate WELCOME = RenderedTemplate.builder()
      .subject("Welcome aboard")
      .text("Hi there")
      .html("<p>Hi there</p>")
      .build();

  private static final DeliveryResult RESULT = DeliveryResult.builder()
      .tlsMode(TlsMode.STARTTLS)
      .authMethod(AuthMechanism.PLAIN)
      .attempts(1)
      .elapsedMs(42)
      .lastReplyCode(250)
      .capabilities(ImmutableList.of("AUTH", "SIZE"))
      .messageId("<1.abc@smtp.example.com>")
      .build();

  private DeliveryOrchestrator orchestrator;
  private TemplateResolver templateResolver;
  private List<DeliveryLogEntry> logEntries;
  private DeliveryLog deliveryLog;

  @Before
  public void setup() {
    orchestrator = mock(DeliveryOrchestrator.class);
    templateResolver = mock(TemplateResolver.class);
    logEntries = Lists.newArrayList();
    deliveryLog = logEntries::add;

    when(orchestrator.send(any(ConnectionConfig.class), any(EmailMessage.class))).thenReturn(CompletableFuture.completedFuture(RESULT));
    when(templateResolver.resolve(eq("welcome"), anyMap())).thenReturn(Optional.of(WELCOME));
    when(templateResolver.resolve(eq("missing"), anyMap())).thenReturn(Optional.empty());
  }

  @Test
  public void itSendsTheResolvedTemplate() {
    EmailRequestOutcome outcome = handler(SETTINGS, false).handle(request("welcome")).join();

    assertThat(outcome.getDeliveryResult()).isEqualTo(RESULT);
    assertThat(outcome.getSubject()).isEqualTo("Welcome aboard");
    assertThat(outcome.isTemplateFound()).isTrue();
    assertThat(outcome.isExplicitSubjectUsed()).isFalse();
    assertThat(outcome.getWarnings()).isEmpty();

    EmailMessage message = sentMessage();
    assertThat(message.getFrom()).isEqualTo("Example Shop <relay@example.com>");
    assertThat(message.getTo()).isEqualTo(RECIPIENT);
    assertThat(message.getSubject()).isEqualTo("Welcome aboard");
    assertThat(message.getText()).isEqualTo("Hi there");
    assertThat(message.getHtml()).contains("<p>Hi there</p>");
  }

  @Test
  public void itPassesTheVariablesToTheResolver() {
    EmailRequest request = request("welcome").withVariables(ImmutableMap.of("name", "Jo"));

    handler(SETTINGS, false).handle(request).join();

    verify(templateResolver).resolve("welcome", ImmutableMap.of("name", "Jo"));
  }

  @Test
  public void itRecordsSuccessfulDeliveries() {
    handler(SETTINGS, false).handle(request("welcome")).join();

    assertThat(logEntries).hasSize(1);
    DeliveryLogEntry entry = logEntries.get(0);
    assertThat(entry.getStatus()).isEqualTo(DeliveryStatus.SENT);
    assertThat(entry.getSmtpResponse()).isEqualTo("Email sent successfully");
    assertThat(entry.getRecipient()).isEqualTo(RECIPIENT);
    assertThat(entry.getSenderEmail()).contains("relay@example.com");
    assertThat(entry.getTemplateKey()).contains("welcome");
    assertThat(entry.getMessageId()).contains("<1.abc@smtp.example.com>");
    assertThat(entry.getTlsMode()).contains(TlsMode.STARTTLS);
    assertThat(entry.getAuthMethod()).contains(AuthMechanism.PLAIN);
    assertThat(entry.getAttemptCount()).isEqualTo(1);
    assertThat(entry.getElapsedMs()).isEqualTo(42);
    assertThat(entry.getLastReplyCode()).contains(250);
    assertThat(entry.getCapabilities()).containsExactly("AUTH", "SIZE");
    assertThat(entry.getErrorCategory()).isEmpty();
  }

  @Test
  public void itPrefersAnExplicitSubject() {
    EmailRequestOutcome outcome = handler(SETTINGS, false).handle(request("welcome").withSubject("  Your invoice  ")).join();

    assertThat(outcome.getSubject()).isEqualTo("Your invoice");
    assertThat(outcome.isExplicitSubjectUsed()).isTrue();
    assertThat(sentMessage().getSubject()).isEqualTo("Your invoice");
    assertThat(sentMessage().getText()).isEqualTo("Hi there");
  }

  @Test
  public void itIgnoresABlankSubject() {
    EmailRequestOutcome outcome = handler(SETTINGS, false).handle(request("welcome").withSubject("   ")).join();

    assertThat(outcome.getSubject()).isEqualTo("Welcome aboard");
    assertThat(outcome.isExplicitSubjectUsed()).isFalse();
  }

  @Test
  public void itSendsTheBrandedFallbackWhenTheTemplateIsMissing() {
    EmailRequestOutcome outcome = handler(SETTINGS, false).handle(request("missing")).join();

    assertThat(outcome.isTemplateFound()).isFalse();
    assertThat(outcome.getSubject()).isEqualTo("Example Shop - Important Notification");
    assertThat(outcome.getWarnings()).containsExactly("Template missing not found - using branded fallback");

    EmailMessage message = sentMessage();
    assertThat(message.getText()).startsWith("Example Shop\n\nThank you for your business with us.");
    assertThat(message.getHtml().get()).contains("<h2 style=\"color: #f59e0b; margin-bottom: 20px;\">Example Shop</h2>");
    assertThat(logEntries.get(0).isTemplateFound()).isFalse();
  }

  @Test
  public void itSendsTheBrandedFallbackWithoutATemplateKey() {
    EmailRequestOutcome outcome = handler(SETTINGS, true).handle(EmailRequest.builder().to(RECIPIENT).build()).join();

    assertThat(outcome.getSubject()).isEqualTo("Example Shop - Important Notification");
    assertThat(outcome.getWarnings()).isEmpty();
    verify(templateResolver, never()).resolve(any(), anyMap());
  }

  @Test
  public void itRefusesMissingTemplatesInStrictMode() {
    Throwable thrown = catchThrowable(() -> handler(SETTINGS, true).handle(request("missing")).join());

    assertThat(thrown.getCause()).isInstanceOf(TemplateNotFoundException.class).hasMessage("Template missing not found");
    assertThat(((TemplateNotFoundException) thrown.getCause()).getTemplateKey()).isEqualTo("missing");
    verify(orchestrator, never()).send(any(), any());
    assertThat(logEntries).isEmpty();
  }

  @Test
  public void itTreatsTemplateLookupErrorsAsMissing() {
    when(templateResolver.resolve(eq("broken"), anyMap())).thenThrow(new IllegalStateException("template store unavailable"));

    EmailRequestOutcome outcome = handler(SETTINGS, false).handle(request("broken")).join();

    assertThat(outcome.isTemplateFound()).isFalse();
    assertThat(outcome.getWarnings()).containsExactly("Template broken not found - using branded fallback");
  }

  @Test
  public void itUsesTheConfiguredSender() {
    SmtpSettings settings = SETTINGS.withSenderEmail("news@example.com").withSenderName("Example News");

    EmailRequestOutcome outcome = handler(settings, false).handle(request("welcome")).join();

    assertThat(sentMessage().getFrom()).isEqualTo("Example News <news@example.com>");
    assertThat(outcome.getWarnings()).isEmpty();
  }

  @Test
  public void itWarnsWhenTheSenderDomainDiffers() {
    SmtpSettings settings = SETTINGS.withSenderEmail("news@other.example");

    EmailRequestOutcome outcome = handler(settings, false).handle(request("welcome")).join();

    assertThat(outcome.getWarnings()).containsExactly("Sender domain (other.example) differs from auth domain (example.com)");
  }

  @Test
  public void itComparesSenderDomainsIgnoringCase() {
    assertThat(EmailRequestHandler.checkSenderDomain("a@Example.COM", "b@example.com")).isEmpty();
    assertThat(EmailRequestHandler.checkSenderDomain("a@example.com", "not-an-address")).isEmpty();
    assertThat(EmailRequestHandler.checkSenderDomain("a@one.example", "b@two.example")).isPresent();
  }

  @Test
  public void itFailsWithoutSettings() {
    Throwable thrown = catchThrowable(() -> handler(Optional::empty, false).handle(request("welcome")).join());

    assertThat(thrown.getCause()).isInstanceOf(ConfigurationException.class);
    assertThat(((ConfigurationException) thrown.getCause()).getReason()).isEqualTo(ConfigurationException.Reason.NOT_CONFIGURED);
    verify(orchestrator, never()).send(any(), any());
    assertThat(logEntries).isEmpty();
  }

  @Test
  public void itFailsWithIncompleteSettings() {
    SmtpSettings settings = SmtpSettings.builder().host("smtp.example.com").build();

    Throwable thrown = catchThrowable(() -> handler(settings, false).handle(request("welcome")).join());

    ConfigurationException e = (ConfigurationException) thrown.getCause();
    assertThat(e.getReason()).isEqualTo(ConfigurationException.Reason.INCOMPLETE_CONFIG);
    assertThat(e.getMissingFields()).containsExactly("SMTP username", "SMTP password");
    verify(orchestrator, never()).send(any(), any());
  }

  @Test
  public void itFailsWhenSmtpIsDisabled() {
    Throwable thrown = catchThrowable(() -> handler(SETTINGS.withEnabled(false), false).handle(request("welcome")).join());

    assertThat(((ConfigurationException) thrown.getCause()).getReason()).isEqualTo(ConfigurationException.Reason.SMTP_DISABLED);
  }

  @Test
  public void itRecordsFailedDeliveries() {
    DeliveryException failure = new DeliveryException(
        ErrorClassification.forCategory(ErrorCategory.AUTH), 1, 120, Optional.of(535), "Delivery to c******r@example.org failed after 1 attempt(s) [auth]: bad credentials", null);
    when(orchestrator.send(any(ConnectionConfig.class), any(EmailMessage.class))).thenReturn(CompletableFutures.failedFuture(failure));

    Throwable thrown = catchThrowable(() -> handler(SETTINGS, false).handle(request("welcome")).join());

    assertThat(thrown.getCause()).isSameAs(failure);
    assertThat(logEntries).hasSize(1);
    DeliveryLogEntry entry = logEntries.get(0);
    assertThat(entry.getStatus()).isEqualTo(DeliveryStatus.FAILED);
    assertThat(entry.getSmtpResponse()).isEqualTo(failure.getMessage());
    assertThat(entry.getErrorCategory()).contains(ErrorCategory.AUTH);
    assertThat(entry.getSuggestion()).contains(ErrorCategory.AUTH.getSuggestion());
    assertThat(entry.getAttemptCount()).isEqualTo(1);
    assertThat(entry.getElapsedMs()).isEqualTo(120);
    assertThat(entry.getLastReplyCode()).contains(535);
    assertThat(entry.getMessageId()).isEmpty();
  }

  @Test
  public void itReturnsTheOutcomeWhenTheDeliveryLogFails() {
    DeliveryLog failingLog = entry -> {
      throw new IllegalStateException("log store unavailable");
    };
    EmailRequestHandler handler = new EmailRequestHandler(orchestrator, ConnectionConfigSources.of(SETTINGS), templateResolver, failingLog, BUSINESS_NAME, false);

    assertThat(handler.handle(request("welcome")).join().getDeliveryResult()).isEqualTo(RESULT);
  }

  @Test
  public void itChecksHealthWithTheConfiguredRelay() {
    VerificationResult verification = VerificationResult.builder()
        .tlsMode(TlsMode.STARTTLS)
        .authMethod(AuthMechanism.LOGIN)
        .elapsedMs(10)
        .build();
    ArgumentCaptor<ConnectionConfig> config = ArgumentCaptor.forClass(ConnectionConfig.class);
    when(orchestrator.verify(config.capture())).thenReturn(CompletableFuture.completedFuture(verification));

    assertThat(handler(SETTINGS, false).checkHealth().join()).isEqualTo(verification);
    assertThat(config.getValue().getHostname()).isEqualTo("smtp.example.com");
  }

  @Test
  public void itFailsTheHealthCheckWithoutSettings() {
    Throwable thrown = catchThrowable(() -> handler(SETTINGS.withEnabled(false), false).checkHealth().join());

    assertThat(thrown.getCause()).isInstanceOf(ConfigurationException.class);
    verify(orchestrator, never()).verify(any());
  }

  private EmailRequestHandler handler(SmtpSettings settings, boolean strictTemplateMode) {
    return handler(ConnectionConfigSources.of(settings), strictTemplateMode);
  }

  private EmailRequestHandler handler(ConnectionConfigSource source, boolean strictTemplateMode) {
    return new EmailRequestHandler(orchestrator, source, templateResolver, deliveryLog, BUSINESS_NAME, strictTemplateMode);
  }

  private static EmailRequest request(String templateKey) {
    return EmailRequest.builder().to(RECIPIENT).templateKey(templateKey).build();
  }

  private EmailMessage sentMessage() {
    ArgumentCaptor<EmailMessage> message = ArgumentCaptor.forClass(EmailMessage.class);
    verify(orchestrator).send(any(ConnectionConfig.class), message.capture());
    return message.getValue();
  }
}
