package io.intellixity.vellum.persistence.jdbc.postgres;

import io.intellixity.vellum.persistence.spi.resilience.Classification;
import io.intellixity.vellum.persistence.spi.resilience.DefaultTransientErrorClassifier;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;

import java.util.Set;

/** Adds PostgreSQL SQLStates to the generic rules. */
public final class PostgresTransientErrorClassifier extends DefaultTransientErrorClassifier {
  /** lock_not_available, raised by NOWAIT and lock_timeout. */
  static final String LOCK_NOT_AVAILABLE = "55P03";

  private static final Set<String> TRANSIENT_STATES = Set.of(
      PSQLState.CONNECTION_UNABLE_TO_CONNECT.getState(),
      PSQLState.CONNECTION_DOES_NOT_EXIST.getState(),
      PSQLState.CONNECTION_FAILURE.getState(),
      PSQLState.CONNECTION_FAILURE_DURING_TRANSACTION.getState(),
      PSQLState.SERIALIZATION_FAILURE.getState(),
      PSQLState.DEADLOCK_DETECTED.getState(),
      PSQLState.QUERY_CANCELED.getState(),
      LOCK_NOT_AVAILABLE,
      "57P01", // admin_shutdown
      "57P02", // crash_shutdown
      "57P03", // cannot_connect_now
      "53300"  // too_many_connections
  );

  @Override
  protected Classification classifyEngineSpecific(Throwable t) {
    if (!(t instanceof PSQLException e)) return null;
    String state = e.getSQLState();
    if (state == null) return null;
    if (TRANSIENT_STATES.contains(state)) return Classification.transientError("PostgreSQL SQLState " + state);
    // Integrity (23), syntax/access (42) and data (22) classes never succeed on retry
    if (state.startsWith("23") || state.startsWith("42") || state.startsWith("22")) {
      return Classification.permanent("PostgreSQL SQLState " + state);
    }
    return null;
  }
}
