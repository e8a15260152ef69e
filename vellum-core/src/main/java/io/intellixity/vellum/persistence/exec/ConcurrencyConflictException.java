package io.intellixity.vellum.persistence.exec;

import io.intellixity.vellum.persistence.mapping.EntityKey;

import java.util.Objects;

/**
 * A write was rejected because the stored version no longer matches the caller's expected version.
 * {@link #currentVersion()} is null when the row changed again before it could be re-read.
 */
public final class ConcurrencyConflictException extends PersistenceException {
  private final String entityType;
  private final EntityKey entityKey;
  private final Long currentVersion;
  private final long expectedVersion;

  public ConcurrencyConflictException(String entityType, EntityKey entityKey, Long currentVersion, long expectedVersion) {
    super("Version conflict on " + entityType + "[" + entityKey + "]: expected " + expectedVersion
        + ", current " + (currentVersion == null ? "unknown" : currentVersion));
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.entityKey = Objects.requireNonNull(entityKey, "entityKey");
    this.currentVersion = currentVersion;
    this.expectedVersion = expectedVersion;
  }

  public String entityType() { return entityType; }
  public EntityKey entityKey() { return entityKey; }
  public Long currentVersion() { return currentVersion; }
  public long expectedVersion() { return expectedVersion; }
}
