package io.intellixity.vellum.persistence.spi.resilience;

import java.time.Duration;
import java.util.Objects;

/** Stateless backoff arithmetic derived from a {@link RetryConfiguration}. */
public final class RetryPolicy {
  private final RetryConfiguration config;

  public RetryPolicy(RetryConfiguration config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public RetryConfiguration configuration() { return config; }

  /** Attempts one call may make; 1 when retrying is disabled. */
  public int totalAttempts() {
    if (!config.enabled() || config.maxAttempts() <= 1) return 1;
    return config.maxAttempts();
  }

  public boolean retries() { return totalAttempts() > 1; }

  /**
   * Wait before retry {@code k}, where {@code k = 1} precedes the second attempt:
   * {@code min(maxDelay, initialDelay * multiplier^(k-1))}.
   */
  public Duration delayBeforeRetry(int k) {
    if (k < 1) throw new IllegalArgumentException("retry index starts at 1: " + k);
    double ms = config.initialDelayMs() * Math.pow(config.backoffMultiplier(), k - 1);
    long capped = ms >= config.maxDelayMs() ? config.maxDelayMs() : (long) ms;
    return Duration.ofMillis(capped);
  }

  @Override
  public String toString() { return "RetryPolicy" + config; }
}
