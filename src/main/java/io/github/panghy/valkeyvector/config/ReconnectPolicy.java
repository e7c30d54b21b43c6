package io.github.panghy.valkeyvector.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff applied while opening a connection.
 *
 * <p>Attempt {@code n} (zero-based) waits {@code baseDelay * exponentBase^n} before the next try.
 * With the defaults (3 retries, 1000 ms, base 2) the waits are 1 s, 2 s and 4 s.</p>
 *
 * @param retries      number of retries after the first failed attempt
 * @param baseDelay    delay before the first retry
 * @param exponentBase growth factor between consecutive delays
 */
public record ReconnectPolicy(int retries, Duration baseDelay, int exponentBase) {

  // keeps exponentBase^attempt well inside a long
  private static final int MAX_EXPONENT = 16;

  public ReconnectPolicy {
    if (retries < 0) throw new IllegalArgumentException("retries must be >= 0");
    Objects.requireNonNull(baseDelay, "baseDelay must not be null");
    if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must not be negative");
    if (exponentBase < 1) throw new IllegalArgumentException("exponentBase must be >= 1");
  }

  public static ReconnectPolicy defaults() {
    return new ReconnectPolicy(3, Duration.ofMillis(1000), 2);
  }

  /** Disables retries; the first failure is propagated. */
  public static ReconnectPolicy none() {
    return new ReconnectPolicy(0, Duration.ZERO, 1);
  }

  /**
   * Returns the wait before retry number {@code attempt} (zero-based).
   *
   * @param attempt zero-based retry index; negative values are treated as 0
   */
  public Duration delayForAttempt(int attempt) {
    int capped = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
    long factor = 1;
    for (int i = 0; i < capped; i++) factor = Math.multiplyExact(factor, exponentBase);
    return baseDelay.multipliedBy(factor);
  }
}
