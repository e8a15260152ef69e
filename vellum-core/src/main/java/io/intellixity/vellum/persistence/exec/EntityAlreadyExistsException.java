package io.intellixity.vellum.persistence.exec;

import io.intellixity.vellum.persistence.mapping.EntityKey;

public final class EntityAlreadyExistsException extends PersistenceException {
  private final String entityType;
  private final EntityKey entityKey;

  public EntityAlreadyExistsException(String entityType, EntityKey entityKey) {
    super(entityType + "[" + entityKey + "] already exists");
    this.entityType = entityType;
    this.entityKey = entityKey;
  }

  public String entityType() { return entityType; }
  public EntityKey entityKey() { return entityKey; }
}
