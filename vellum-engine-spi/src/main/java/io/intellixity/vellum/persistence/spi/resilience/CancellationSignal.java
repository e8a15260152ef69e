package io.intellixity.vellum.persistence.spi.resilience;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Cooperative cancellation for one or more storage operations. Once cancelled, stays cancelled. */
public final class CancellationSignal {
  private static final CancellationSignal NONE = new CancellationSignal(false);

  private final CountDownLatch latch = new CountDownLatch(1);
  private final boolean cancellable;

  private CancellationSignal(boolean cancellable) {
    this.cancellable = cancellable;
  }

  public static CancellationSignal create() { return new CancellationSignal(true); }

  /** A signal that can never be cancelled. */
  public static CancellationSignal none() { return NONE; }

  public void cancel() {
    if (!cancellable) throw new IllegalStateException("CancellationSignal.none() cannot be cancelled");
    latch.countDown();
  }

  public boolean isCancelled() { return latch.getCount() == 0; }

  public void throwIfCancelled() {
    if (isCancelled()) throw new OperationCancelledException("Operation cancelled");
    if (Thread.currentThread().isInterrupted()) throw new OperationCancelledException("Thread interrupted");
  }

  /**
   * Waits up to {@code timeout}, returning early on cancellation.
   *
   * @return true if cancelled before or during the wait
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) return isCancelled();
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
