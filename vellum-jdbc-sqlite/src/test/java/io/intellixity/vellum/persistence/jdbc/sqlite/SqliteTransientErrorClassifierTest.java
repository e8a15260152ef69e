package io.intellixity.vellum.persistence.jdbc.sqlite;

import io.intellixity.vellum.persistence.exec.StorageException;
import io.intellixity.vellum.persistence.spi.resilience.Classification;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteTransientErrorClassifierTest {
  private final SqliteTransientErrorClassifier classifier = new SqliteTransientErrorClassifier();

  @Test
  void lockAndIoCodesAreTransient() {
    for (int code : new int[] {5, 6, 10, 14, 17}) {
      Classification c = SqliteTransientErrorClassifier.classifyCode(code, null);
      assertNotNull(c, "code " + code);
      assertTrue(c.transientError(), c.description());
    }
  }

  @Test
  void extendedCodesAreNamed() {
    Classification c = SqliteTransientErrorClassifier.classifyCode(517, "snapshot");
    assertTrue(c.transientError());
    assertEquals("SQLite SQLITE_BUSY_SNAPSHOT (517)", c.description());

    // IOERR_SHORT_READ falls back to its primary code
    assertTrue(SqliteTransientErrorClassifier.classifyCode(522, null).transientError());
  }

  @Test
  void corruptionIsTransientOnlyWithNetworkSymptoms() {
    assertTrue(SqliteTransientErrorClassifier.classifyCode(11, "database disk image is malformed").transientError());
    assertTrue(SqliteTransientErrorClassifier.classifyCode(11, "Network share went away").transientError());
    assertFalse(SqliteTransientErrorClassifier.classifyCode(11, "file is not a database").transientError());
    assertFalse(SqliteTransientErrorClassifier.classifyCode(11, null).transientError());
  }

  @Test
  void constraintTypeAndMisuseCodesArePermanent() {
    for (int code : new int[] {19, 2067, 1555, 1299, 787, 1, 8, 18, 20, 25}) {
      Classification c = SqliteTransientErrorClassifier.classifyCode(code, "busy");
      assertNotNull(c, "code " + code);
      assertFalse(c.transientError(), c.description());
    }
    assertEquals("SQLite SQLITE_CONSTRAINT (2067)", SqliteTransientErrorClassifier.classifyCode(2067, null).description());
  }

  @Test
  void otherCodesHaveNoOpinion() {
    assertNull(SqliteTransientErrorClassifier.classifyCode(0, null));
    assertNull(SqliteTransientErrorClassifier.classifyCode(21, "library routine called out of sequence"));
  }

  @Test
  void constraintFailureNamingABusyColumnIsNotRetried() {
    SQLiteException unique = new SQLiteException(
        "[SQLITE_CONSTRAINT_UNIQUE] A UNIQUE constraint failed (UNIQUE constraint failed: Jobs.BusyUntil)",
        SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE);
    Classification c = classifier.classify(unique);
    assertFalse(c.transientError(), c.description());

    // The wrapper repeats the driver text; the coded verdict underneath still wins
    Classification wrapped = classifier.classify(new StorageException("create failed for Job: " + unique.getMessage(), unique));
    assertFalse(wrapped.transientError(), wrapped.description());
  }

  @Test
  void classifiesDriverExceptions() {
    SQLiteException busy = new SQLiteException("[SQLITE_BUSY] The database file is locked", SQLiteErrorCode.SQLITE_BUSY);
    assertTrue(classifier.classify(busy).transientError());

    SQLiteException pk = new SQLiteException("[SQLITE_CONSTRAINT_PRIMARYKEY] A PRIMARY KEY constraint failed",
        SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY);
    assertFalse(classifier.classify(pk).transientError());
  }

  @Test
  void looksThroughWrappers() {
    SQLiteException locked = new SQLiteException("[SQLITE_LOCKED] A table in the database is locked",
        SQLiteErrorCode.SQLITE_LOCKED);
    Classification c = classifier.classify(new StorageException("update failed", locked));
    assertTrue(c.transientError(), c.description());
    assertTrue(c.description().contains("SQLITE_LOCKED"), c.description());
  }

  @Test
  void nonSqliteErrorsUseTheGenericRules() {
    assertTrue(classifier.classify(new java.sql.SQLTransientConnectionException("pool empty")).transientError());
    assertFalse(classifier.classify(new IllegalStateException("bug")).transientError());
  }
}
