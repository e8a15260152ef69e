package io.intellixity.vellum.persistence.jdbc.command;

import io.intellixity.vellum.persistence.exec.ConcurrencyConflictException;
import io.intellixity.vellum.persistence.exec.EntityNotFoundException;
import io.intellixity.vellum.persistence.exec.PersistenceException;
import io.intellixity.vellum.persistence.mapping.EntityKey;

import java.util.Optional;

/**
 * Explains a version-guarded write that affected no rows.
 *
 * <p>A missing row or a tombstone means not found. A different stored version is a conflict carrying
 * that version. A matching stored version means the row changed and changed back between the write
 * and the probe; that is reported as a conflict with an unknown current version.</p>
 */
public final class ConcurrencyGuard {
  private ConcurrencyGuard() {}

  public static PersistenceException explainZeroRows(String entityType, EntityKey key, long expectedVersion,
                                                     Optional<RowVersion> current) {
    if (current.isEmpty() || current.get().deleted()) return new EntityNotFoundException(entityType, key);
    long v = current.get().version();
    return new ConcurrencyConflictException(entityType, key, v == expectedVersion ? null : v, expectedVersion);
  }
}
