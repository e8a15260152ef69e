package io.intellixity.vellum.persistence.exec;

import io.intellixity.vellum.persistence.mapping.EntityKey;

/** No live row exists for the key; soft-deleted rows count as missing. */
public final class EntityNotFoundException extends PersistenceException {
  private final String entityType;
  private final EntityKey entityKey;

  public EntityNotFoundException(String entityType, EntityKey entityKey) {
    super(entityType + "[" + entityKey + "] not found");
    this.entityType = entityType;
    this.entityKey = entityKey;
  }

  public String entityType() { return entityType; }
  public EntityKey entityKey() { return entityKey; }
}
