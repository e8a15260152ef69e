package io.intellixity.vellum.persistence.mapping;

/** Materializes one entity from the current row. */
@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);
}
