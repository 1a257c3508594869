package com.hubspot.relay.client;

/**
 * Unchecked exception thrown when the composed message is larger than the maximum size the
 * server advertised in its EHLO response.
 *
 */
public class MessageTooLargeException extends SmtpException {
  private final long messageSize;
  private final long maxMessageSize;

  public MessageTooLargeException(String connectionId, long messageSize, long maxMessageSize) {
    super(connectionId, String.format("The message is %d bytes but the server accepts at most %d", messageSize, maxMessageSize));
    this.messageSize = messageSize;
    this.maxMessageSize = maxMessageSize;
  }

  public long getMessageSize() {
    return messageSize;
  }

  public long getMaxMessageSize() {
    return maxMessageSize;
  }
}
