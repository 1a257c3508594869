package com.hubspot.relay.messages;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Random;

import org.apache.commons.codec.net.QuotedPrintableCodec;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

/**
 * Builds the MIME form of an {@link EmailMessage}.
 *
 * <p>A message with an HTML body becomes {@code multipart/alternative} with the plain text
 * part first; otherwise it is a single {@code text/plain} part. Both kinds of part are
 * quoted-printable encoded in UTF-8. The subject is RFC 2047 encoded when it contains
 * non-ASCII characters.
 *
 * <p>This class is thread-safe.
 */
public class MessageComposer {
  private static final String CRLF = "\r\n";
  private static final Splitter LINE_SPLITTER = Splitter.on(CRLF);
  private static final Joiner LINE_JOINER = Joiner.on(CRLF);
  private static final CharMatcher HEADER_LINE_BREAKS = CharMatcher.anyOf("\r\n");

  private final Clock clock;
  private final Random random;
  private final QuotedPrintableCodec quotedPrintable = new QuotedPrintableCodec(StandardCharsets.UTF_8, true);
  // the strict codec needs at least three bytes of input
  private final QuotedPrintableCodec shortLineQuotedPrintable = new QuotedPrintableCodec(StandardCharsets.UTF_8, false);

  public MessageComposer() {
    this(Clock.systemUTC(), new SecureRandom());
  }

  @VisibleForTesting
  MessageComposer(Clock clock, Random random) {
    this.clock = clock;
    this.random = random;
  }

  /**
   * Composes {@code message}.
   *
   * @param message the message to compose
   * @param hostname the domain used on the right-hand side of the generated Message-ID
   */
  public ComposedMessage compose(EmailMessage message, String hostname) {
    Preconditions.checkNotNull(message);
    Preconditions.checkArgument(hostname != null && !hostname.isEmpty(), "hostname must not be empty");

    long now = clock.millis();
    String messageId = String.format("<%d.%s@%s>", now, randomToken(), hostname);

    StringBuilder sb = new StringBuilder(256 + message.getText().length() * 2);
    header(sb, "From", message.getFrom());
    header(sb, "To", message.getTo());
    header(sb, "Subject", encodeSubject(message.getSubject()));
    header(sb, "Date", DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC)));
    header(sb, "Message-ID", messageId);
    header(sb, "MIME-Version", "1.0");

    if (message.getHtml().isPresent()) {
      String boundary = String.format("boundary_%d_%s", now, randomToken());

      header(sb, "Content-Type", "multipart/alternative; boundary=\"" + boundary + "\"");
      sb.append(CRLF);

      sb.append("--").append(boundary).append(CRLF);
      part(sb, "text/plain", message.getText());
      sb.append(CRLF);

      sb.append("--").append(boundary).append(CRLF);
      part(sb, "text/html", message.getHtml().get());
      sb.append(CRLF);

      sb.append("--").append(boundary).append("--").append(CRLF);
    } else {
      part(sb, "text/plain", message.getText());
    }

    return ComposedMessage.builder()
        .messageId(messageId)
        .content(MessageContent.of(sb.toString()))
        .build();
  }

  private void part(StringBuilder sb, String mimeType, String body) {
    header(sb, "Content-Type", mimeType + "; charset=UTF-8");
    header(sb, "Content-Transfer-Encoding", "quoted-printable");
    sb.append(CRLF);
    sb.append(encodeBody(body)).append(CRLF);
  }

  // each line is encoded separately so the hard line breaks survive as CRLF
  @VisibleForTesting
  String encodeBody(String body) {
    List<String> lines = LINE_SPLITTER.splitToList(MessageContent.normalizeLineEndings(body));
    return LINE_JOINER.join(Lists.transform(lines, this::encodeLine));
  }

  private String encodeLine(String line) {
    if (line.getBytes(StandardCharsets.UTF_8).length >= 3) {
      return quotedPrintable.encode(line, StandardCharsets.UTF_8);
    }

    String encoded = shortLineQuotedPrintable.encode(line, StandardCharsets.UTF_8);
    if (encoded.isEmpty()) {
      return encoded;
    }

    // trailing whitespace would be stripped in transit
    char last = encoded.charAt(encoded.length() - 1);
    if (last == ' ') {
      return encoded.substring(0, encoded.length() - 1) + "=20";
    }
    if (last == '\t') {
      return encoded.substring(0, encoded.length() - 1) + "=09";
    }
    return encoded;
  }

  @VisibleForTesting
  static String encodeSubject(String subject) {
    String singleLine = HEADER_LINE_BREAKS.replaceFrom(subject, ' ');

    if (CharMatcher.ascii().matchesAllOf(singleLine)) {
      return singleLine;
    }

    return "=?UTF-8?B?" + Base64.getEncoder().encodeToString(singleLine.getBytes(StandardCharsets.UTF_8)) + "?=";
  }

  private static void header(StringBuilder sb, String name, String value) {
    sb.append(name).append(": ").append(HEADER_LINE_BREAKS.replaceFrom(value, ' ')).append(CRLF);
  }

  private String randomToken() {
    return Long.toString(random.nextLong() & Long.MAX_VALUE, 36);
  }
}
