package io.github.panghy.valkeyvector.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Helpers for working with {@link java.util.concurrent.CompletableFuture} failures. */
public final class Futures {
  private Futures() {}

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers and returns the
   * underlying failure.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }
}
