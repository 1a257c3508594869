package com.hubspot.relay.messages;

import java.io.ByteArrayOutputStream;

final class DotStuffing {
  private static final byte CR = '\r';
  private static final byte LF = '\n';
  private static final byte DOT = '.';

  private DotStuffing() {
    throw new AssertionError("Cannot create static utility class");
  }

  /**
   * Returns a copy of {@code content} in which every line that begins with a dot starts with
   * an extra dot, and which always ends with CRLF.
   *
   * <p>A line begins at the start of the content and after every CRLF. The receiving server
   * strips the extra dot, so the message arrives unchanged.
   */
  static byte[] dotStuff(byte[] content) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 16);

    boolean atLineStart = true;
    for (int i = 0; i < content.length; i++) {
      byte b = content[i];

      if (atLineStart && b == DOT) {
        out.write(DOT);
      }

      out.write(b);
      atLineStart = b == LF && i > 0 && content[i - 1] == CR;
    }

    if (!endsWithCrlf(content)) {
      out.write(CR);
      out.write(LF);
    }

    return out.toByteArray();
  }

  private static boolean endsWithCrlf(byte[] content) {
    int length = content.length;
    return length >= 2 && content[length - 2] == CR && content[length - 1] == LF;
  }
}
