package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.spi.resilience.RetryConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-store execution settings.
 *
 * @param commandTimeout per-attempt statement timeout; zero leaves the driver default
 * @param batchSize default chunk size for batch operations
 */
public record StoreSettings(Duration commandTimeout, int batchSize, RetryConfiguration retry) {
  public StoreSettings {
    Objects.requireNonNull(commandTimeout, "commandTimeout");
    Objects.requireNonNull(retry, "retry");
    if (commandTimeout.isNegative()) throw new IllegalArgumentException("commandTimeout must be >= 0: " + commandTimeout);
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
  }

  public static StoreSettings defaults() {
    return new StoreSettings(Duration.ofSeconds(30), 100, RetryConfiguration.defaults());
  }

  public StoreSettings withRetry(RetryConfiguration retry) {
    return new StoreSettings(commandTimeout, batchSize, retry);
  }

  public StoreSettings withBatchSize(int batchSize) {
    return new StoreSettings(commandTimeout, batchSize, retry);
  }

  public StoreSettings withCommandTimeout(Duration commandTimeout) {
    return new StoreSettings(commandTimeout, batchSize, retry);
  }
}
