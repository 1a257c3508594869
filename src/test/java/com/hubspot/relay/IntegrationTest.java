package com.hubspot.relay;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.hubspot.relay.client.AuthMechanism;
import com.hubspot.relay.client.SmtpSessionFactory;
import com.hubspot.relay.client.SmtpSessionFactoryConfig;
import com.hubspot.relay.client.TlsMode;
import com.hubspot.relay.config.ConnectionConfigSources;
import com.hubspot.relay.config.SmtpSettings;
import com.hubspot.relay.delivery.CircuitBreaker;
import com.hubspot.relay.delivery.ConnectionConfig;
import com.hubspot.relay.delivery.DeliveryLog;
import com.hubspot.relay.delivery.DeliveryLogEntry;
import com.hubspot.relay.delivery.DeliveryOrchestrator;
import com.hubspot.relay.delivery.DeliveryResult;
import com.hubspot.relay.delivery.DeliveryStatus;
import com.hubspot.relay.delivery.Slf4jDeliveryLog;
import com.hubspot.relay.messages.EmailMessage;
import com.hubspot.relay.requests.EmailRequest;
import com.hubspot.relay.requests.EmailRequestHandler;
import com.hubspot.relay.requests.EmailRequestOutcome;
import com.hubspot.relay.requests.RenderedTemplate;
import com.hubspot.relay.requests.TemplateResolver;
import com.hubspot.relay.retry.RetryPolicy;

import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;

public class IntegrationTest {
  private static final String USERNAME = "orders@example.com";
  private static final String PASSWORD = "s3cret";
  private static final RetryPolicy FAST_RETRIES = RetryPolicy.builder()
      .baseDelay(Duration.ofMillis(10))
      .maxDelay(Duration.ofMillis(20))
      .build();

  private FakeSmtpServer server;
  private SmtpSessionFactory sessionFactory;
  private DeliveryOrchestrator orchestrator;

  @Before
  public void setup() throws Exception {
    server = new FakeSmtpServer(USERNAME, PASSWORD);

    SmtpSessionFactoryConfig factoryConfig = SmtpSessionFactoryConfig.nonProductionConfig()
        .withSslContext(SslContextBuilder.forClient().trustManager(InsecureTrustManagerFactory.INSTANCE).build())
        .withHostnameVerificationEnabled(false);

    sessionFactory = new SmtpSessionFactory(factoryConfig);
    orchestrator = new DeliveryOrchestrator(sessionFactory, FAST_RETRIES, new CircuitBreaker());
  }

  @After
  public void teardown() throws Exception {
    sessionFactory.close();
    server.stop();
  }

  @Test
  public void itDeliversOverImplicitTls() throws Exception {
    server.implicitTls().start();

    ConnectionConfig config = ConnectionConfig.builder()
        .hostname("127.0.0.1")
        .port(server.getPort())
        .username(USERNAME)
        .password(PASSWORD)
        .tlsMode(TlsMode.IMPLICIT)
        .build();

    EmailMessage message = EmailMessage.builder()
        .from("Orders <" + USERNAME + ">")
        .to("customer@example.org")
        .subject("Your receipt")
        .text("Total: 12,00 €")
        .html("<p>Total: 12,00 &euro;</p>")
        .build();

    DeliveryResult result = orchestrator.send(config, message).join();

    assertThat(result.getTlsMode()).isEqualTo(TlsMode.IMPLICIT);
    assertThat(result.getAuthMethod()).isEqualTo(AuthMechanism.PLAIN);
    assertThat(server.getCommands()).containsExactly("EHLO", "AUTH PLAIN", "MAIL", "RCPT", "DATA", "QUIT");
    assertThat(server.isLastMessageEncrypted()).isTrue();
    assertThat(server.getMessages().get(0))
        .contains("Content-Type: multipart/alternative; boundary=")
        .contains("Total: 12,00 =E2=82=AC");
  }

  @Test
  public void itHandlesARequestFromSettingsToRelay() throws Exception {
    server.start();

    SmtpSettings settings = SmtpSettings.builder()
        .host(" 127.0.0.1 ")
        .port(server.getPort())
        .username(USERNAME)
        .password(PASSWORD)
        .senderName("Example Shop Orders")
        .build();

    TemplateResolver templates = (templateKey, variables) -> {
      if (!templateKey.equals("order-shipped")) {
        return Optional.empty();
      }
      return Optional.of(RenderedTemplate.builder()
          .subject("Order " + variables.get("order") + " has shipped")
          .text("Hi " + variables.get("name") + ",\n.\nYour order is on its way.")
          .build());
    };

    List<DeliveryLogEntry> entries = Lists.newArrayList();
    DeliveryLog slf4jLog = new Slf4jDeliveryLog();
    DeliveryLog deliveryLog = entry -> {
      entries.add(entry);
      slf4jLog.record(entry);
    };
    EmailRequestHandler handler = new EmailRequestHandler(orchestrator, ConnectionConfigSources.of(settings), templates, deliveryLog, "Example Shop", false);

    Map<String, String> variables = ImmutableMap.of("order", "1042", "name", "Sam");
    EmailRequestOutcome outcome = handler.handle(EmailRequest.builder()
        .to("sam@example.org")
        .templateKey("order-shipped")
        .variables(variables)
        .build()).join();

    assertThat(outcome.getSubject()).isEqualTo("Order 1042 has shipped");
    assertThat(outcome.isTemplateFound()).isTrue();
    assertThat(outcome.getWarnings()).isEmpty();

    // ports other than 587 and 465 are used without TLS, even when STARTTLS is offered
    assertThat(outcome.getDeliveryResult().getTlsMode()).isEqualTo(TlsMode.NONE);
    assertThat(server.getCommands()).doesNotContain("STARTTLS");
    assertThat(server.isLastMessageEncrypted()).isFalse();

    assertThat(server.getMessages()).hasSize(1);
    assertThat(server.getMessages().get(0))
        .contains("From: Example Shop Orders <orders@example.com>\r\n")
        .contains("To: sam@example.org\r\n")
        .contains("Subject: Order 1042 has shipped\r\n")
        .contains("Hi Sam,\r\n..\r\nYour order is on its way.");

    assertThat(entries).hasSize(1);
    assertThat(entries.get(0).getStatus()).isEqualTo(DeliveryStatus.SENT);
    assertThat(entries.get(0).getLastReplyCode()).contains(250);
    assertThat(entries.get(0).getTlsMode()).contains(TlsMode.NONE);
  }
}
