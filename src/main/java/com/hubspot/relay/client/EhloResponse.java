package com.hubspot.relay.client;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Longs;

/**
 * The parsed response to the EHLO command: the capabilities the server advertised.
 *
 * <p>Capability names are the first token of each line, upper-cased. The AUTH line (or the
 * legacy {@code AUTH=} form) supplies the advertised mechanisms, in the order the server
 * listed them.
 *
 * <p>This class is thread-safe.
 */
public class EhloResponse {
  static final EhloResponse EMPTY = EhloResponse.parse("", Collections.emptyList());

  public static final String STARTTLS = "STARTTLS";
  public static final String AUTH = "AUTH";
  public static final String SIZE = "SIZE";

  private static final Splitter WHITESPACE_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final String LEGACY_AUTH_PREFIX = "AUTH=";

  private final String ehloDomain;
  private final ImmutableSet<String> capabilities;
  private final ImmutableList<String> authMechanisms;
  private final ImmutableList<String> lines;
  private final Optional<Long> maxMessageSize;

  /**
   * Parses an EHLO response.
   *
   * @param  ehloDomain the domain provided with the EHLO command (e.g. "example.com" if "EHLO example.com"
   *                    was sent to the remote server)
   * @param  lines the capability lines returned by the server, without the leading greeting line
   * @return an {@link EhloResponse} object representing the response
   */
  public static EhloResponse parse(String ehloDomain, Iterable<? extends CharSequence> lines) {
    return new EhloResponse(ehloDomain, lines);
  }

  private EhloResponse(String ehloDomain, Iterable<? extends CharSequence> lines) {
    this.ehloDomain = ehloDomain;

    ImmutableSet.Builder<String> capabilities = ImmutableSet.builder();
    Set<String> mechanisms = new LinkedHashSet<>();
    ImmutableList.Builder<String> rawLines = ImmutableList.builder();
    Optional<Long> size = Optional.empty();

    for (CharSequence line : lines) {
      rawLines.add(line.toString());

      List<String> parts = WHITESPACE_SPLITTER.splitToList(line);
      if (parts.isEmpty()) {
        continue;
      }

      String keyword = parts.get(0).toUpperCase(Locale.ROOT);

      if (keyword.startsWith(LEGACY_AUTH_PREFIX)) {
        capabilities.add(AUTH);
        addMechanisms(mechanisms, keyword.substring(LEGACY_AUTH_PREFIX.length()), parts);
        continue;
      }

      capabilities.add(keyword);

      if (keyword.equals(AUTH)) {
        addMechanisms(mechanisms, null, parts);
      } else if (keyword.equals(SIZE) && parts.size() > 1) {
        Long parsed = Longs.tryParse(parts.get(1));
        if (parsed != null && parsed > 0) {
          size = Optional.of(parsed);
        }
      }
    }

    this.capabilities = capabilities.build();
    this.authMechanisms = ImmutableList.copyOf(mechanisms);
    this.lines = rawLines.build();
    this.maxMessageSize = size;
  }

  private static void addMechanisms(Set<String> mechanisms, String inlineMechanism, List<String> parts) {
    if (inlineMechanism != null && !inlineMechanism.isEmpty()) {
      mechanisms.add(inlineMechanism);
    }
    for (int i = 1; i < parts.size(); i++) {
      mechanisms.add(parts.get(i).toUpperCase(Locale.ROOT));
    }
  }

  /**
   * Gets the domain provided with the EHLO command (e.g. "example.com" if "EHLO example.com"
   * was sent to the remote server).
   */
  public String getEhloDomain() {
    return ehloDomain;
  }

  /**
   * Gets whether the server advertised {@code capability}, ignoring case.
   */
  public boolean isSupported(String capability) {
    return capabilities.contains(capability.toUpperCase(Locale.ROOT));
  }

  public boolean isStartTlsSupported() {
    return isSupported(STARTTLS);
  }

  public boolean isAuthSupported(AuthMechanism mechanism) {
    return authMechanisms.contains(mechanism.name());
  }

  /**
   * Gets the upper-cased capability names.
   */
  public Set<String> getCapabilities() {
    return capabilities;
  }

  /**
   * Gets the advertised AUTH mechanisms, upper-cased and in server order.
   */
  public List<String> getAuthMechanisms() {
    return authMechanisms;
  }

  /**
   * Gets the maximum message size if specified by the server.
   */
  public Optional<Long> getMaxMessageSize() {
    return maxMessageSize;
  }

  /**
   * Gets the capability lines exactly as the server sent them.
   */
  public List<String> getLines() {
    return lines;
  }

  @Override
  public String toString() {
    return "EhloResponse{capabilities=" + capabilities + ", authMechanisms=" + authMechanisms + "}";
  }
}
