package io.intellixity.vellum.persistence.mapping;

import io.intellixity.vellum.persistence.exec.PersistenceException;

/** Bad or contradictory mapping metadata. Fatal; never retried. */
public final class MappingException extends PersistenceException {
  public MappingException(String message) {
    super(message);
  }

  public MappingException(String message, Throwable cause) {
    super(message, cause);
  }
}
