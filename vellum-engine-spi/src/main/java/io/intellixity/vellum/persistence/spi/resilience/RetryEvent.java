package io.intellixity.vellum.persistence.spi.resilience;

import java.time.Duration;

/**
 * Snapshot passed to {@link RetryListener}s.
 *
 * @param attempt the attempt that just finished, starting at 1
 * @param delay wait before the next attempt; zero for exhausted and recovered events
 * @param error the failure of this attempt; null for recovered events
 * @param description classifier verdict; null for recovered events
 */
public record RetryEvent(
    String operation,
    int attempt,
    int maxAttempts,
    Duration delay,
    Duration elapsed,
    Throwable error,
    String description
) {
}
