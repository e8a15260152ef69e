package io.intellixity.vellum.persistence.jdbc;

/** Lifecycle of a {@link TransactionScope}. A scope that rolls back ends in {@code FAILED}. */
public enum TransactionState {
  ACTIVE,
  COMMITTING,
  COMMITTED,
  ROLLING_BACK,
  FAILED;

  public boolean isTerminal() { return this == COMMITTED || this == FAILED; }
}
