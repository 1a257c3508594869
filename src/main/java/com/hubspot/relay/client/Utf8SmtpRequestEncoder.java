package com.hubspot.relay.client;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.MessageToMessageEncoder;
import io.netty.handler.codec.smtp.SmtpRequest;

/**
 * Writes an {@link SmtpRequest} as a single CRLF-terminated command line, encoding its
 * parameters as UTF-8. Message content is written as plain {@code ByteBuf}s and passes
 * through untouched.
 */
public final class Utf8SmtpRequestEncoder extends MessageToMessageEncoder<SmtpRequest> {
  private static final byte[] CRLF = {'\r', '\n'};
  private static final byte SP = ' ';

  @Override
  protected void encode(ChannelHandlerContext ctx, SmtpRequest request, List<Object> out) throws Exception {
    ByteBuf buffer = ctx.alloc().buffer();

    try {
      ByteBufUtil.writeAscii(buffer, request.command().name());

      for (CharSequence parameter : request.parameters()) {
        checkSingleLine(parameter);
        buffer.writeByte(SP);
        ByteBufUtil.writeUtf8(buffer, parameter);
      }

      buffer.writeBytes(CRLF);
    } catch (RuntimeException e) {
      buffer.release();
      throw e;
    }

    out.add(buffer);
  }

  // a parameter containing a line break would smuggle a second command onto the wire
  private static void checkSingleLine(CharSequence parameter) {
    for (int i = 0; i < parameter.length(); i++) {
      char c = parameter.charAt(i);
      if (c == '\r' || c == '\n') {
        throw new EncoderException("SMTP command parameters must not contain line breaks");
      }
    }
  }
}
