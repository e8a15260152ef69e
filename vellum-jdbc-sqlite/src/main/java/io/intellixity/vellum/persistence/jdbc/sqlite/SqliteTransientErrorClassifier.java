package io.intellixity.vellum.persistence.jdbc.sqlite;

import io.intellixity.vellum.persistence.spi.resilience.Classification;
import io.intellixity.vellum.persistence.spi.resilience.DefaultTransientErrorClassifier;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.util.Locale;
import java.util.Map;

/** Adds SQLite result codes to the generic rules. Primary codes are the low byte of extended codes. */
public final class SqliteTransientErrorClassifier extends DefaultTransientErrorClassifier {
  static final int SQLITE_BUSY = 5;
  static final int SQLITE_LOCKED = 6;
  static final int SQLITE_IOERR = 10;
  static final int SQLITE_CORRUPT = 11;
  static final int SQLITE_CANTOPEN = 14;
  static final int SQLITE_PROTOCOL = 17;

  private static final Map<Integer, String> PERMANENT_PRIMARY = Map.of(
      1, "SQLITE_ERROR",
      8, "SQLITE_READONLY",
      18, "SQLITE_TOOBIG",
      19, "SQLITE_CONSTRAINT",
      20, "SQLITE_MISMATCH",
      25, "SQLITE_RANGE");

  private static final Map<Integer, String> TRANSIENT_EXTENDED = Map.of(
      261, "SQLITE_BUSY_RECOVERY",
      517, "SQLITE_BUSY_SNAPSHOT",
      773, "SQLITE_BUSY_TIMEOUT",
      518, "SQLITE_LOCKED_SHAREDCACHE");

  @Override
  protected Classification classifyEngineSpecific(Throwable t) {
    if (!(t instanceof SQLiteException e)) return null;
    SQLiteErrorCode rc = e.getResultCode();
    int code = (rc == null || rc == SQLiteErrorCode.UNKNOWN_ERROR) ? e.getErrorCode() : rc.code;
    return classifyCode(code, e.getMessage());
  }

  /**
   * Classification for a primary or extended SQLite result code; null when the code says nothing.
   * Constraint, type and misuse codes are permanent regardless of what the message text contains.
   */
  static Classification classifyCode(int code, String message) {
    String ext = TRANSIENT_EXTENDED.get(code);
    if (ext != null) return Classification.transientError("SQLite " + ext + " (" + code + ")");

    String permanent = PERMANENT_PRIMARY.get(code & 0xFF);
    if (permanent != null) return Classification.permanent("SQLite " + permanent + " (" + code + ")");

    switch (code & 0xFF) {
      case SQLITE_BUSY: return Classification.transientError("SQLite SQLITE_BUSY (" + code + "): database file is locked");
      case SQLITE_LOCKED: return Classification.transientError("SQLite SQLITE_LOCKED (" + code + "): table is locked");
      case SQLITE_IOERR: return Classification.transientError("SQLite SQLITE_IOERR (" + code + "): disk I/O error");
      case SQLITE_CANTOPEN: return Classification.transientError("SQLite SQLITE_CANTOPEN (" + code + "): unable to open database file");
      case SQLITE_PROTOCOL: return Classification.transientError("SQLite SQLITE_PROTOCOL (" + code + "): locking protocol error");
      case SQLITE_CORRUPT: {
        // Corruption reported over a network share is often a torn read
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("malformed") || m.contains("network")) {
          return Classification.transientError("SQLite SQLITE_CORRUPT (" + code + ") with transient symptom");
        }
        return Classification.permanent("SQLite SQLITE_CORRUPT (" + code + ")");
      }
      default: return null;
    }
  }
}
