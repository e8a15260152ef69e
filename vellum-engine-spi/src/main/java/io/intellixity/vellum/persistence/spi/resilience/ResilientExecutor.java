package io.intellixity.vellum.persistence.spi.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;

/**
 * Runs a {@link StorageCall} and retries transient failures with exponential backoff.
 *
 * <p>Each {@code execute} keeps its own attempt counter, so one instance is safe to share. Waits block
 * the calling thread only and end early on cancellation. The final failure is rethrown unchanged.</p>
 */
public final class ResilientExecutor {
  private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

  private final RetryPolicy policy;
  private final TransientErrorClassifier classifier;
  private final List<RetryListener> listeners;
  private final Executor listenerExecutor;

  public ResilientExecutor(RetryConfiguration config, TransientErrorClassifier classifier) {
    this(config, classifier, List.of(new LoggingRetryListener()), ForkJoinPool.commonPool());
  }

  public ResilientExecutor(RetryConfiguration config,
                           TransientErrorClassifier classifier,
                           List<RetryListener> listeners,
                           Executor listenerExecutor) {
    this.policy = new RetryPolicy(Objects.requireNonNull(config, "config"));
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.listeners = List.copyOf(listeners);
    this.listenerExecutor = Objects.requireNonNull(listenerExecutor, "listenerExecutor");
  }

  public RetryPolicy policy() { return policy; }

  public TransientErrorClassifier classifier() { return classifier; }

  public <T> T execute(StorageCall<T> call) throws SQLException {
    return execute("storage", call, CancellationSignal.none());
  }

  public <T> T execute(StorageCall<T> call, CancellationSignal signal) throws SQLException {
    return execute("storage", call, signal);
  }

  /**
   * @param operation short label used in logs and metrics
   * @throws OperationCancelledException if cancelled or interrupted before or between attempts
   */
  public <T> T execute(String operation, StorageCall<T> call, CancellationSignal signal) throws SQLException {
    Objects.requireNonNull(call, "call");
    Objects.requireNonNull(signal, "signal");
    int max = policy.totalAttempts();
    long start = System.nanoTime();

    for (int attempt = 1; ; attempt++) {
      signal.throwIfCancelled();
      try {
        T result = call.call();
        if (attempt > 1) {
          notify(RetryListener::onRecovered,
              new RetryEvent(operation, attempt, max, Duration.ZERO, elapsed(start), null, null));
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        if (e instanceof CancellationException) throw e;

        Classification c = classifier.classify(e);
        if (!c.transientError()) {
          if (log.isDebugEnabled()) {
            log.debug("vellum.retry_skip op={} attempt={} maxAttempts={} error={}",
                operation, attempt, max, c.description());
          }
          throw e;
        }
        if (attempt >= max) {
          notify(RetryListener::onExhausted,
              new RetryEvent(operation, attempt, max, Duration.ZERO, elapsed(start), e, c.description()));
          throw e;
        }

        Duration delay = policy.delayBeforeRetry(attempt);
        notify(RetryListener::onRetry,
            new RetryEvent(operation, attempt, max, delay, elapsed(start), e, c.description()));
        waitBeforeRetry(operation, delay, signal, e);
      }
    }
  }

  private static void waitBeforeRetry(String operation, Duration delay, CancellationSignal signal, Exception last) {
    try {
      if (signal.await(delay)) {
        OperationCancelledException ex = new OperationCancelledException(operation + " cancelled while waiting to retry");
        ex.addSuppressed(last);
        throw ex;
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      OperationCancelledException ex = new OperationCancelledException(operation + " interrupted while waiting to retry", ie);
      ex.addSuppressed(last);
      throw ex;
    }
  }

  private void notify(BiConsumer<RetryListener, RetryEvent> callback, RetryEvent event) {
    for (RetryListener l : listeners) {
      try {
        listenerExecutor.execute(() -> {
          try {
            callback.accept(l, event);
          } catch (RuntimeException ex) {
            log.warn("vellum.retry_listener_failed listener={} op={}", l.getClass().getName(), event.operation(), ex);
          }
        });
      } catch (RejectedExecutionException ex) {
        log.warn("vellum.retry_listener_rejected listener={} op={}", l.getClass().getName(), event.operation(), ex);
      }
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
