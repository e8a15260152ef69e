package io.intellixity.vellum.persistence.query;

public enum Operator {
  EQ("="),
  NE("<>"),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String sql;

  Operator(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }

  /** Ordering comparisons; these have no meaning against NULL. */
  public boolean isRelational() { return this != EQ && this != NE; }
}
