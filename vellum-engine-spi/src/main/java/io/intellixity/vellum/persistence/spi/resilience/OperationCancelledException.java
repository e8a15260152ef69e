package io.intellixity.vellum.persistence.spi.resilience;

import java.util.concurrent.CancellationException;

/** The caller cancelled the operation or interrupted its thread; never retried. */
public final class OperationCancelledException extends CancellationException {
  public OperationCancelledException(String message) {
    super(message);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }
}
