package io.intellixity.vellum.persistence.spi.resilience;

import java.util.Objects;

/** Verdict of a {@link TransientErrorClassifier}, with a human-readable reason. */
public record Classification(boolean transientError, String description) {
  public Classification {
    Objects.requireNonNull(description, "description");
  }

  public static Classification transientError(String description) { return new Classification(true, description); }

  public static Classification permanent(String description) { return new Classification(false, description); }
}
