package io.intellixity.vellum.persistence.spi.resilience;

import java.time.Duration;

/**
 * Retry settings, validated on construction.
 *
 * @param maxAttempts total attempts including the first; 0 and 1 both mean a single attempt
 * @param backoffMultiplier growth factor between consecutive delays, at least 1.0
 */
public record RetryConfiguration(
    boolean enabled,
    int maxAttempts,
    long initialDelayMs,
    long maxDelayMs,
    double backoffMultiplier
) {
  public RetryConfiguration {
    if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
    if (initialDelayMs < 0) throw new IllegalArgumentException("initialDelayMs must be >= 0: " + initialDelayMs);
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs (" + maxDelayMs + ") must be >= initialDelayMs (" + initialDelayMs + ")");
    }
    if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0: " + backoffMultiplier);
    }
  }

  public static RetryConfiguration defaults() { return new RetryConfiguration(true, 3, 100, 5_000, 2.0); }

  public static RetryConfiguration noRetry() { return new RetryConfiguration(false, 0, 0, 0, 1.0); }

  /** Slower, longer backoff for databases on network shares. */
  public static RetryConfiguration forNetworkStorage() { return new RetryConfiguration(true, 5, 500, 10_000, 2.0); }

  /** Many short retries for write-heavy workloads that hit lock contention. */
  public static RetryConfiguration forHighContention() { return new RetryConfiguration(true, 10, 50, 2_000, 1.5); }

  public RetryPolicy toPolicy() { return new RetryPolicy(this); }

  public Duration initialDelay() { return Duration.ofMillis(initialDelayMs); }

  public Duration maxDelay() { return Duration.ofMillis(maxDelayMs); }
}
