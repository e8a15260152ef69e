package io.intellixity.vellum.persistence.jdbc;

import java.sql.SQLException;

/** Caller code run inside a {@link TransactionScope}. */
@FunctionalInterface
public interface TransactionWork<T, R> {
  R run(TransactionScope<T> scope) throws SQLException;
}
