package io.intellixity.vellum.persistence.spi.resilience;

import io.intellixity.vellum.persistence.exec.PersistenceException;
import io.intellixity.vellum.persistence.exec.StorageException;

import java.io.IOException;
import java.sql.*;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Engine-neutral classification of JDBC and I/O failures.
 *
 * <p>Walks the cause chain and {@link SQLException#getNextException()}; the error is transient if any
 * link is. Engine dialects extend {@link #classifyEngineSpecific(Throwable)} with vendor codes.</p>
 */
public class DefaultTransientErrorClassifier implements TransientErrorClassifier {
  private static final int MAX_DEPTH = 16;

  private static final Set<String> TRANSIENT_SQL_STATES = Set.of("40001", "40P01", "HYT00", "HYT01");

  private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
      "database is locked",
      "database table is locked",
      "database is temporarily locked",
      "unable to open database",
      "cannot open database file",
      "disk i/o error",
      "unable to acquire",
      "deadlock",
      "busy",
      "connection was closed",
      "connection was lost",
      "connection broken",
      "connection reset",
      "network error",
      "network path",
      "network name",
      "network unreachable",
      "no more connections",
      "timeout expired",
      "timed out",
      "semaphore timeout",
      "being used by another process",
      "sharing violation",
      "lock violation",
      "temporarily unavailable",
      "insufficient system resources",
      "broken pipe",
      "bad file descriptor",
      "interrupted system call");

  @Override
  public final Classification classify(Throwable error) {
    if (error == null) return Classification.permanent("no error");
    Verdicts v = new Verdicts();
    walk(error, v, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    // A message match never overrides a typed or coded permanent verdict elsewhere in the chain
    boolean transientError = v.typedTransient || (v.messageTransient && !v.typedPermanent);
    return new Classification(transientError, describe(error, v.details, transientError));
  }

  private static final class Verdicts {
    final List<String> details = new ArrayList<>();
    boolean typedTransient;
    boolean typedPermanent;
    boolean messageTransient;
  }

  private void walk(Throwable t, Verdicts v, Set<Throwable> seen, int depth) {
    if (t == null || depth > MAX_DEPTH || !seen.add(t)) return;
    if (t instanceof CancellationException) {
      v.details.add("cancelled by caller");
      v.typedPermanent = true;
      return;
    }
    // Conflicts, missing rows and mapping errors are outcomes, not faults
    if (t instanceof PersistenceException && !(t instanceof StorageException)) {
      v.details.add(t.getClass().getSimpleName() + " is not retryable");
      v.typedPermanent = true;
      return;
    }

    Classification own = classifyTyped(t);
    if (own != null) {
      v.details.add(own.description());
      if (own.transientError()) {
        v.typedTransient = true;
        return;
      }
      v.typedPermanent = true;
    } else {
      String pattern = matchMessage(t.getMessage());
      if (pattern != null) {
        v.details.add("transient message pattern '" + pattern + "'");
        v.messageTransient = true;
      }
    }

    if (t instanceof SQLException sql) walk(sql.getNextException(), v, seen, depth + 1);
    if (!v.typedTransient) walk(t.getCause(), v, seen, depth + 1);
  }

  /** Classifies one link by type, vendor code or SQLState; null means no opinion. */
  private Classification classifyTyped(Throwable t) {
    Classification engine = classifyEngineSpecific(t);
    if (engine != null) return engine;

    if (t instanceof SQLTransientException) {
      return Classification.transientError(t.getClass().getSimpleName() + " is transient by JDBC contract");
    }
    if (t instanceof SQLRecoverableException) {
      return Classification.transientError("recoverable JDBC error; retry on a fresh connection");
    }
    if (t instanceof SQLException sql) {
      String state = sql.getSQLState();
      if (state != null) {
        if (state.startsWith("08")) return Classification.transientError("connection failure, SQLState " + state);
        if (TRANSIENT_SQL_STATES.contains(state)) return Classification.transientError("SQLState " + state);
      }
      if (sql instanceof SQLIntegrityConstraintViolationException
          || sql instanceof SQLSyntaxErrorException
          || sql instanceof SQLDataException) {
        return Classification.permanent(sql.getClass().getSimpleName() + " is not retryable");
      }
    }
    if (t instanceof TimeoutException) return Classification.transientError("operation timed out");
    if (t instanceof IOException) return Classification.transientError("I/O error: " + t.getClass().getSimpleName());
    return null;
  }

  /** Hook for vendor codes; return null to fall through to the generic rules. */
  protected Classification classifyEngineSpecific(Throwable t) {
    return null;
  }

  protected static String matchMessage(String message) {
    if (message == null || message.isEmpty()) return null;
    String m = message.toLowerCase(Locale.ROOT);
    for (String p : TRANSIENT_MESSAGE_PATTERNS) if (m.contains(p)) return p;
    return null;
  }

  private static String describe(Throwable error, List<String> details, boolean transientError) {
    StringBuilder sb = new StringBuilder();
    sb.append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
    sb.append(transientError ? " [transient]" : " [non-transient]");
    for (String d : details) sb.append("; ").append(d);
    return sb.toString();
  }
}
