package io.intellixity.vellum.persistence.mapping;

/** Logical column types; dialects map them to physical SQL types. */
public enum ColumnType {
  TEXT,
  INTEGER,
  BIGINT,
  BOOLEAN,
  DOUBLE,
  DECIMAL,
  TIMESTAMP,
  DATE,
  UUID,
  BLOB;

  public boolean isText() { return this == TEXT; }

  public boolean isIntegral() { return this == INTEGER || this == BIGINT; }
}
