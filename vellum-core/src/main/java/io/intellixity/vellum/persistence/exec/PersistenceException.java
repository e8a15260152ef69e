package io.intellixity.vellum.persistence.exec;

/** Base of all errors raised by the persistence layer. */
public class PersistenceException extends RuntimeException {
  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
