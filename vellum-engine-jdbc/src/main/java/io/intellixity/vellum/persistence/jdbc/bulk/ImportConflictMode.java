package io.intellixity.vellum.persistence.jdbc.bulk;

/** What a bulk import does with an entity whose key already has a live row. */
public enum ImportConflictMode {
  /** Abort and roll back the whole import with {@code EntityAlreadyExistsException}. */
  FAIL,
  /** Keep the stored row and count the entity as skipped. */
  SKIP,
  /** Overwrite the stored row at its current version. */
  OVERWRITE
}
