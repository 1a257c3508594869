package com.hubspot.relay.client;

import java.util.ArrayList;
import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.smtp.DefaultSmtpResponse;
import io.netty.handler.codec.smtp.SmtpResponse;
import io.netty.util.CharsetUtil;

/**
 * Assembles SMTP reply lines into {@link SmtpResponse} objects, decoding the text as UTF-8.
 *
 * <p>Lines of the form {@code nnn-text} are buffered until the terminal {@code nnn text}
 * (or bare {@code nnn}) line arrives, so a multi-line EHLO or error reply is emitted as a
 * single response whose code is taken from its first line. Blank lines are skipped
 * wherever they appear. Anything else that does not look like a reply line fails with a
 * {@link DecoderException}.
 */
public final class Utf8SmtpResponseDecoder extends LineBasedFrameDecoder {
  private static final int CODE_LENGTH = 3;

  private List<CharSequence> details;
  private int pendingCode = -1;

  public Utf8SmtpResponseDecoder(int maxLineLength) {
    super(maxLineLength);
  }

  @Override
  protected SmtpResponse decode(ChannelHandlerContext ctx, ByteBuf buffer) throws Exception {
    // a single read may carry several lines, keep going until a whole reply is assembled
    while (true) {
      ByteBuf frame = (ByteBuf) super.decode(ctx, buffer);
      if (frame == null) {
        return null;
      }

      try {
        SmtpResponse response = decodeLine(frame);
        if (response != null) {
          return response;
        }
      } finally {
        frame.release();
      }
    }
  }

  private SmtpResponse decodeLine(ByteBuf frame) {
    int readable = frame.readableBytes();
    if (readable == 0 || isBlank(frame)) {
      return null;
    }

    String line = frame.toString(CharsetUtil.UTF_8);
    if (readable < CODE_LENGTH) {
      throw invalidLine(line);
    }

    int code = parseCode(frame, line);
    if (readable == CODE_LENGTH) {
      return complete(code, null);
    }

    char separator = (char) frame.getByte(frame.readerIndex() + CODE_LENGTH);
    String detail = readable > CODE_LENGTH + 1 ? line.substring(CODE_LENGTH + 1) : null;

    switch (separator) {
      case ' ':
        return complete(code, detail);
      case '-':
        if (details == null) {
          details = new ArrayList<>(4);
          pendingCode = code;
        }
        if (detail != null) {
          details.add(detail);
        }
        return null;
      default:
        throw invalidLine(line);
    }
  }

  private SmtpResponse complete(int code, String detail) {
    List<CharSequence> lines = details == null ? new ArrayList<>(1) : details;
    if (detail != null) {
      lines.add(detail);
    }

    // the first line of a multi-line reply decides its code
    int replyCode = details == null ? code : pendingCode;

    reset();
    return new DefaultSmtpResponse(replyCode, lines.toArray(new CharSequence[0]));
  }

  private void reset() {
    details = null;
    pendingCode = -1;
  }

  private static boolean isBlank(ByteBuf frame) {
    for (int i = frame.readerIndex(); i < frame.writerIndex(); i++) {
      byte b = frame.getByte(i);
      if (b != ' ' && b != '\t' && b != '\r') {
        return false;
      }
    }
    return true;
  }

  private static int parseCode(ByteBuf frame, String line) {
    int code = 0;
    for (int i = 0; i < CODE_LENGTH; i++) {
      int digit = Character.digit((char) frame.getByte(frame.readerIndex() + i), 10);
      if (digit < 0) {
        throw invalidLine(line);
      }
      code = code * 10 + digit;
    }

    if (code < 100 || code > 599) {
      throw invalidLine(line);
    }
    return code;
  }

  private static DecoderException invalidLine(String line) {
    return new DecoderException("Received invalid line: '" + line + '\'');
  }
}
