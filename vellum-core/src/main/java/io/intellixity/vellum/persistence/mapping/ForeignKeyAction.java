package io.intellixity.vellum.persistence.mapping;

public enum ForeignKeyAction {
  NO_ACTION("NO ACTION"),
  CASCADE("CASCADE"),
  SET_NULL("SET NULL"),
  SET_DEFAULT("SET DEFAULT"),
  RESTRICT("RESTRICT");

  private final String sql;

  ForeignKeyAction(String sql) { this.sql = sql; }

  public String sql() { return sql; }
}
