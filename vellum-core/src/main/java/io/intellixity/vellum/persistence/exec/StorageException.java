package io.intellixity.vellum.persistence.exec;

import java.sql.SQLException;

/**
 * A storage error that was not transient or outlived the retry budget.
 * The driver's exception is kept unchanged as the cause.
 */
public final class StorageException extends PersistenceException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }

  /** SQLState of the underlying driver error, or null when the cause is not an {@link SQLException}. */
  public String sqlState() {
    return getCause() instanceof SQLException e ? e.getSQLState() : null;
  }

  public int errorCode() {
    return getCause() instanceof SQLException e ? e.getErrorCode() : 0;
  }
}
