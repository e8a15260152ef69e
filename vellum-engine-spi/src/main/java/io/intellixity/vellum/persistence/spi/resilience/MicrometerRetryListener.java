package io.intellixity.vellum.persistence.spi.resilience;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Counts retry activity per operation.
 *
 * <pre>
 * vellum.retry.attempts     tags: operation
 * vellum.retry.exhausted    tags: operation
 * vellum.retry.recovered    tags: operation
 * </pre>
 */
public final class MicrometerRetryListener implements RetryListener {
  public static final String RETRIES = "vellum.retry.attempts";
  public static final String EXHAUSTED = "vellum.retry.exhausted";
  public static final String RECOVERED = "vellum.retry.recovered";

  private final MeterRegistry registry;

  public MicrometerRetryListener(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public void onRetry(RetryEvent e) { counter(RETRIES, "Retries scheduled after a transient failure", e).increment(); }

  @Override
  public void onExhausted(RetryEvent e) { counter(EXHAUSTED, "Operations that ran out of attempts", e).increment(); }

  @Override
  public void onRecovered(RetryEvent e) { counter(RECOVERED, "Operations that succeeded after retrying", e).increment(); }

  private Counter counter(String name, String description, RetryEvent e) {
    return Counter.builder(name)
        .description(description)
        .tag("operation", e.operation() == null ? "unknown" : e.operation())
        .register(registry);
  }
}
