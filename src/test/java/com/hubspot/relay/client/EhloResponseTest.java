package com.hubspot.relay.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import com.google.common.collect.Lists;

public class EhloResponseTest {
  @Test
  public void itHasAnEmptyResponseThatSupportsNothing() {
    assertThat(EhloResponse.EMPTY.isStartTlsSupported()).isFalse();
    assertThat(EhloResponse.EMPTY.isAuthSupported(AuthMechanism.PLAIN)).isFalse();
    assertThat(EhloResponse.EMPTY.isAuthSupported(AuthMechanism.LOGIN)).isFalse();
    assertThat(EhloResponse.EMPTY.getCapabilities()).isEmpty();
  }

  @Test
  public void itParsesATypicalResponse() {
    EhloResponse response = parse("AUTH PLAIN LOGIN", "8BITMIME", "STARTTLS", "SIZE");

    assertThat(response.isStartTlsSupported()).isTrue();
    assertThat(response.isSupported("8bitmime")).isTrue();
    assertThat(response.isSupported("SIZE")).isTrue();
    assertThat(response.isSupported("PIPELINING")).isFalse();

    assertThat(response.isAuthSupported(AuthMechanism.PLAIN)).isTrue();
    assertThat(response.isAuthSupported(AuthMechanism.LOGIN)).isTrue();
  }

  @Test
  public void itUpperCasesCapabilityNames() {
    EhloResponse response = parse("starttls", "auth login plain");

    assertThat(response.getCapabilities()).containsExactlyInAnyOrder("STARTTLS", "AUTH");
    assertThat(response.getAuthMechanisms()).containsExactly("LOGIN", "PLAIN");
  }

  @Test
  public void itKeepsTheServerOrderOfMechanisms() {
    EhloResponse response = parse("AUTH XOAUTH2 LOGIN PLAIN", "AUTH CRAM-MD5 LOGIN");

    assertThat(response.getAuthMechanisms()).containsExactly("XOAUTH2", "LOGIN", "PLAIN", "CRAM-MD5");
  }

  @Test
  public void itParsesTheLegacyAuthForm() {
    EhloResponse response = parse("AUTH=LOGIN PLAIN");

    assertThat(response.isSupported("AUTH")).isTrue();
    assertThat(response.getAuthMechanisms()).containsExactly("LOGIN", "PLAIN");
  }

  @Test
  public void itExposesTheRawLines() {
    EhloResponse response = parse("AUTH PLAIN LOGIN", "STARTTLS");

    assertThat(response.getLines()).containsExactly("AUTH PLAIN LOGIN", "STARTTLS");
  }

  @Test
  public void itParsesSizeWithASpecifiedSize() {
    EhloResponse response = parse("SIZE 1234000");
    assertThat(response.isSupported("SIZE")).isTrue();
    assertThat(response.getMaxMessageSize()).contains(1234000L);
  }

  @Test
  public void itIgnoresInvalidSizes() {
    EhloResponse response = parse("SIZE abc");
    assertThat(response.isSupported("SIZE")).isTrue();
    assertThat(response.getMaxMessageSize()).isEmpty();
  }

  @Test
  public void itIgnoresASizeOfZero() {
    EhloResponse response = parse("SIZE 0");
    assertThat(response.getMaxMessageSize()).isEmpty();
  }

  @Test
  public void itIgnoresBlankLines() {
    EhloResponse response = parse("", "  ", "STARTTLS");
    assertThat(response.getCapabilities()).containsExactly("STARTTLS");
  }

  private EhloResponse parse(CharSequence... lines) {
    return EhloResponse.parse("", Lists.newArrayList(lines));
  }
}
