package io.intellixity.vellum.persistence.spi.resilience;

/** Observer of retry activity. Called asynchronously; exceptions are logged and dropped. */
public interface RetryListener {
  /** A transient failure occurred and another attempt is scheduled. */
  default void onRetry(RetryEvent event) {}

  /** The last allowed attempt failed with a transient error. */
  default void onExhausted(RetryEvent event) {}

  /** An attempt after at least one retry succeeded. */
  default void onRecovered(RetryEvent event) {}
}
