package com.hubspot.relay.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.CompletableFuture;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import io.netty.handler.codec.smtp.DefaultSmtpResponse;

public class AuthenticatorTest {
  private static final String USERNAME = "user@example.com";
  private static final String PASSWORD = "hunter2";

  private final Authenticator authenticator = new Authenticator();
  private SmtpSession session;

  @Before
  public void setup() {
    session = mock(SmtpSession.class);
    when(session.getConnectionId()).thenReturn("conn-1");
  }

  @Test
  public void itPrefersPlain() {
    advertise("AUTH LOGIN PLAIN");
    when(session.authPlain(USERNAME, PASSWORD)).thenReturn(reply(235));

    assertThat(authenticator.authenticate(session, USERNAME, PASSWORD).join()).isEqualTo(AuthMechanism.PLAIN);
    verify(session, never()).authLogin(anyString(), anyString());
  }

  @Test
  public void itFallsBackToLoginOnceWhenPlainIsRefused() {
    advertise("AUTH PLAIN LOGIN");
    when(session.authPlain(USERNAME, PASSWORD)).thenReturn(reply(535));
    when(session.authLogin(USERNAME, PASSWORD)).thenReturn(reply(235));

    assertThat(authenticator.authenticate(session, USERNAME, PASSWORD).join()).isEqualTo(AuthMechanism.LOGIN);
    verify(session, times(1)).authLogin(USERNAME, PASSWORD);
  }

  @Test
  public void itFailsWhenTheFallbackIsAlsoRefused() {
    advertise("AUTH PLAIN LOGIN");
    when(session.authPlain(USERNAME, PASSWORD)).thenReturn(reply(535));
    when(session.authLogin(USERNAME, PASSWORD)).thenReturn(reply(535));

    Throwable cause = catchThrowable(() -> authenticator.authenticate(session, USERNAME, PASSWORD).join()).getCause();

    assertThat(cause).isInstanceOf(AuthenticationException.class).hasMessageContaining("Authentication failed using LOGIN");
    assertThat(((AuthenticationException) cause).getCode()).contains(535);
    verify(session, times(1)).authLogin(USERNAME, PASSWORD);
  }

  @Test
  public void itDoesNotFallBackWhenLoginIsNotAdvertised() {
    advertise("AUTH PLAIN");
    when(session.authPlain(USERNAME, PASSWORD)).thenReturn(reply(535));

    Throwable cause = catchThrowable(() -> authenticator.authenticate(session, USERNAME, PASSWORD).join()).getCause();

    assertThat(cause).isInstanceOf(AuthenticationException.class)
        .hasMessage("[conn-1] Authentication failed using PLAIN (535 5.7.8 Rejected)");
    verify(session, never()).authLogin(anyString(), anyString());
  }

  @Test
  public void itDoesNotFallBackForOtherPlainFailures() {
    advertise("AUTH PLAIN LOGIN");
    when(session.authPlain(USERNAME, PASSWORD)).thenReturn(reply(454));

    Throwable cause = catchThrowable(() -> authenticator.authenticate(session, USERNAME, PASSWORD).join()).getCause();

    assertThat(((AuthenticationException) cause).getCode()).contains(454);
    verify(session, never()).authLogin(anyString(), anyString());
  }

  @Test
  public void itUsesLoginWhenOnlyLoginIsAdvertised() {
    advertise("AUTH LOGIN");
    when(session.authLogin(USERNAME, PASSWORD)).thenReturn(reply(235));

    assertThat(authenticator.authenticate(session, USERNAME, PASSWORD).join()).isEqualTo(AuthMechanism.LOGIN);
    verify(session, never()).authPlain(anyString(), anyString());
  }

  @Test
  public void itTriesLoginWhenNoMechanismsAreAdvertised() {
    advertise("SIZE 1000");
    when(session.authLogin(USERNAME, PASSWORD)).thenReturn(reply(235));

    assertThat(authenticator.authenticate(session, USERNAME, PASSWORD).join()).isEqualTo(AuthMechanism.LOGIN);
  }

  @Test
  public void itFailsWhenOnlyUnsupportedMechanismsAreAdvertised() {
    advertise("AUTH XOAUTH2 CRAM-MD5");

    Throwable cause = catchThrowable(() -> authenticator.authenticate(session, USERNAME, PASSWORD).join()).getCause();

    assertThat(cause).isInstanceOf(NoSupportedAuthMethodException.class);
    assertThat(((NoSupportedAuthMethodException) cause).getAdvertisedMechanisms()).containsExactly("XOAUTH2", "CRAM-MD5");
    assertThat(((NoSupportedAuthMethodException) cause).getCode()).isEmpty();
    verify(session, never()).authPlain(anyString(), anyString());
    verify(session, never()).authLogin(anyString(), anyString());
  }

  private void advertise(String... lines) {
    when(session.getEhloResponse()).thenReturn(EhloResponse.parse("example.com", ImmutableList.copyOf(lines)));
  }

  private CompletableFuture<SmtpClientResponse> reply(int code) {
    String text = code == 235 ? "2.7.0 Accepted" : code == 535 ? "5.7.8 Rejected" : "4.7.0 Try later";
    return CompletableFuture.completedFuture(new SmtpClientResponse(session, new DefaultSmtpResponse(code, text)));
  }
}
