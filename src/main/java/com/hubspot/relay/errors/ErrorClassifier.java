package com.hubspot.relay.errors;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import javax.net.ssl.SSLException;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.hubspot.relay.client.AuthenticationException;
import com.hubspot.relay.client.ChannelClosedException;
import com.hubspot.relay.client.ErrorResponseException;
import com.hubspot.relay.client.ResponseTimeoutException;
import com.hubspot.relay.client.SmtpException;
import com.hubspot.relay.client.StartTlsException;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.ssl.NotSslRecordException;
import io.netty.handler.ssl.SslHandshakeTimeoutException;

/**
 * Maps a delivery failure to an {@link ErrorClassification}.
 *
 * <p>The causal chain is searched outermost first, so wrappers such as
 * {@code CompletionException} do not hide the failure underneath. Known exception types
 * decide the category. Failures without a recognised type fall back to keywords in their
 * messages, and anything still unmatched is {@link ErrorCategory#UNKNOWN}.
 *
 * <p>This class is thread-safe.
 */
public class ErrorClassifier {
  private static final int AUTH_CREDENTIALS_INVALID = 535;
  private static final Pattern AUTH_CODE_PATTERN = Pattern.compile("\\b" + AUTH_CREDENTIALS_INVALID + "\\b");

  public ErrorClassification classify(Throwable error) {
    List<Throwable> chain = Throwables.getCausalChain(error);

    for (Throwable throwable : chain) {
      Optional<ErrorCategory> category = classifyByType(throwable);
      if (category.isPresent()) {
        return ErrorClassification.forCategory(category.get());
      }
    }

    for (Throwable throwable : chain) {
      Optional<ErrorCategory> category = classifyByMessage(throwable.getMessage());
      if (category.isPresent()) {
        return ErrorClassification.forCategory(category.get());
      }
    }

    return ErrorClassification.forCategory(ErrorCategory.UNKNOWN);
  }

  private static Optional<ErrorCategory> classifyByType(Throwable t) {
    // the timeout types come first because several of them extend the network and TLS types below
    if (t instanceof ResponseTimeoutException
        || t instanceof TimeoutException
        || t instanceof ConnectTimeoutException
        || t instanceof SocketTimeoutException
        || t instanceof SslHandshakeTimeoutException
        || t instanceof io.netty.handler.timeout.TimeoutException) {
      return Optional.of(ErrorCategory.TIMEOUT);
    }

    if (t instanceof AuthenticationException) {
      return Optional.of(ErrorCategory.AUTH);
    }

    // a refused command is never retried, 535 means the credentials were wrong
    if (t instanceof ErrorResponseException) {
      return Optional.of(((ErrorResponseException) t).getCode() == AUTH_CREDENTIALS_INVALID ? ErrorCategory.AUTH : ErrorCategory.UNKNOWN);
    }

    if (t instanceof StartTlsException || t instanceof SSLException || t instanceof NotSslRecordException) {
      return Optional.of(ErrorCategory.TLS);
    }

    // a malformed reply; its message quotes the server's line, so keywords in it mean nothing
    if (t instanceof DecoderException && !hasSslCause(t)) {
      return Optional.of(ErrorCategory.UNKNOWN);
    }

    if (t instanceof ChannelClosedException || t instanceof ConnectException || t instanceof IOException) {
      return Optional.of(ErrorCategory.NETWORK);
    }

    // any other client failure, e.g. a message over the SIZE limit; its message carries the connection id
    if (t instanceof SmtpException) {
      return Optional.of(ErrorCategory.UNKNOWN);
    }

    return Optional.empty();
  }

  private static boolean hasSslCause(Throwable t) {
    return Throwables.getCausalChain(t).stream().anyMatch(cause -> cause instanceof SSLException || cause instanceof NotSslRecordException);
  }

  private static Optional<ErrorCategory> classifyByMessage(String message) {
    if (Strings.isNullOrEmpty(message)) {
      return Optional.empty();
    }

    String lower = message.toLowerCase(Locale.ROOT);

    if (lower.contains("timeout") || lower.contains("timed out")) {
      return Optional.of(ErrorCategory.TIMEOUT);
    }
    if (lower.contains("authentication failed") || AUTH_CODE_PATTERN.matcher(lower).find()) {
      return Optional.of(ErrorCategory.AUTH);
    }
    if (lower.contains("connection") || lower.contains("network") || lower.contains("econnreset")) {
      return Optional.of(ErrorCategory.NETWORK);
    }
    if (lower.contains("starttls") || lower.contains("tls") || lower.contains("badresource")) {
      return Optional.of(ErrorCategory.TLS);
    }

    return Optional.empty();
  }
}
