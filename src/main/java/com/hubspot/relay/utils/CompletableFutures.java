package com.hubspot.relay.utils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Small helpers for composing {@link CompletableFuture}s.
 *
 */
public final class CompletableFutures {
  private CompletableFutures() {
    throw new AssertionError("Cannot create static utility class");
  }

  public static <T> CompletableFuture<T> failedFuture(Throwable cause) {
    CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(cause);
    return future;
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
   * dependent stages add around the exception that actually failed the chain.
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
