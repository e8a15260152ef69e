package io.intellixity.vellum.persistence.spi.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes retry activity to SLF4J. */
public final class LoggingRetryListener implements RetryListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

  @Override
  public void onRetry(RetryEvent e) {
    log.warn("vellum.retry op={} attempt={}/{} delayMs={} error={}",
        e.operation(), e.attempt(), e.maxAttempts(), e.delay().toMillis(), e.description());
  }

  @Override
  public void onExhausted(RetryEvent e) {
    log.warn("vellum.retry_exhausted op={} attempts={} elapsedMs={} error={}",
        e.operation(), e.attempt(), e.elapsed().toMillis(), e.description());
  }

  @Override
  public void onRecovered(RetryEvent e) {
    log.info("vellum.retry_recovered op={} attempts={} elapsedMs={}",
        e.operation(), e.attempt(), e.elapsed().toMillis());
  }
}
