package io.intellixity.vellum.persistence.mapping;

/** What a column is used for. Everything except {@link #DATA} is maintained by the store. */
public enum ColumnRole {
  DATA,
  VERSION,
  CREATED_TIME,
  LAST_WRITE_TIME,
  SOFT_DELETE_FLAG,
  EXPIRATION;

  public boolean isSystem() { return this != DATA; }
}
