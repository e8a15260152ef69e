package io.intellixity.vellum.persistence.spi.resilience;

import java.sql.SQLException;

/** One attempt of a unit of storage work. */
@FunctionalInterface
public interface StorageCall<T> {
  T call() throws SQLException;
}
