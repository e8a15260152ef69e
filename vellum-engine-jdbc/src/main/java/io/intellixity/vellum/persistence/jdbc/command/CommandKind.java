package io.intellixity.vellum.persistence.jdbc.command;

public enum CommandKind {
  INSERT,
  BATCH_INSERT,
  UPDATE,
  DELETE,
  RESTORE,
  PURGE,
  SELECT,
  QUERY,
  COUNT,
  VERSION_PROBE;

  public boolean isWrite() {
    return this == INSERT || this == BATCH_INSERT || this == UPDATE || this == DELETE || this == RESTORE
        || this == PURGE;
  }
}
