package com.hubspot.relay.messages;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * The contents of a message, including its headers, with every line ending normalised to CRLF.
 *
 * <p>Instances are immutable and can be sent any number of times, so a retried delivery
 * reuses the content composed for the first attempt.
 */
public final class MessageContent {
  private static final Pattern LINE_ENDING = Pattern.compile("\r?\n");

  private final byte[] bytes;

  private MessageContent(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Creates a {@link MessageContent} from text, converting bare LF line endings to CRLF and
   * encoding the result as UTF-8.
   */
  public static MessageContent of(String content) {
    Preconditions.checkNotNull(content, "content");
    return new MessageContent(normalizeLineEndings(content).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Converts every {@code \n} and {@code \r\n} in {@code text} to {@code \r\n}.
   */
  public static String normalizeLineEndings(String text) {
    return LINE_ENDING.matcher(text).replaceAll("\r\n");
  }

  /**
   * The size of the content in bytes, before dot-stuffing. This is what gets compared with the
   * server's SIZE limit.
   */
  public int size() {
    return bytes.length;
  }

  /**
   * Gets a new buffer holding the content with dot-stuffing applied and a trailing CRLF,
   * ready to be followed by the {@code .} terminator line. The caller owns the buffer.
   */
  public ByteBuf getDotStuffedContent() {
    return Unpooled.wrappedBuffer(DotStuffing.dotStuff(bytes));
  }

  /**
   * Gets the content interpreted as a UTF-8 string.
   */
  public String getContentAsString() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "MessageContent{size=" + bytes.length + "}";
  }
}
