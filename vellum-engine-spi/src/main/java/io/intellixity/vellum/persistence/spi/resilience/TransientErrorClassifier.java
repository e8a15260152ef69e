package io.intellixity.vellum.persistence.spi.resilience;

/** Decides whether a storage error is worth retrying. */
@FunctionalInterface
public interface TransientErrorClassifier {
  Classification classify(Throwable error);

  default boolean isTransient(Throwable error) { return classify(error).transientError(); }
}
