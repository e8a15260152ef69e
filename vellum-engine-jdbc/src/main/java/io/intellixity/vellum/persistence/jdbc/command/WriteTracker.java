package io.intellixity.vellum.persistence.jdbc.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Tracks one write through its {@link WriteState}s; terminal states are final. Not thread-safe. */
public final class WriteTracker {
  private static final Logger log = LoggerFactory.getLogger(WriteTracker.class);

  private final String table;
  private final Object key;
  private WriteState state = WriteState.BUILDING;
  private final long startNanos = System.nanoTime();

  public WriteTracker(String table, Object key) {
    this.table = Objects.requireNonNull(table, "table");
    this.key = key;
  }

  public WriteState state() { return state; }

  public void executing() { moveTo(WriteState.EXECUTING); }
  public void committed() { moveTo(WriteState.COMMITTED); }
  public void conflict() { moveTo(WriteState.CONFLICT_DETECTED); }
  public void notFound() { moveTo(WriteState.NOT_FOUND); }
  public void faulted() { moveTo(WriteState.FAULTED); }

  /** Moves to FAULTED unless a terminal state was already reached. */
  public void faultIfOpen() {
    if (!state.isTerminal()) moveTo(WriteState.FAULTED);
  }

  private void moveTo(WriteState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal write transition " + state + " -> " + next + " for " + table + "[" + key + "]");
    }
    state = next;
    if (log.isDebugEnabled()) {
      log.debug("vellum.write table={} key={} state={} elapsedMs={}",
          table, key, next, (System.nanoTime() - startNanos) / 1_000_000.0);
    }
  }
}
