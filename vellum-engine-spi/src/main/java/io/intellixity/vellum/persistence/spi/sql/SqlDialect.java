package io.intellixity.vellum.persistence.spi.sql;

import io.intellixity.vellum.persistence.mapping.ColumnDef;
import io.intellixity.vellum.persistence.spi.resilience.TransientErrorClassifier;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Engine-specific SQL rendering, parameter encoding and error classification. */
public interface SqlDialect {
  String id();

  /** Escapes an identifier as the engine requires; may return it unchanged. */
  String quoteIdent(String identifier);

  default String qualifiedTable(String schema, String table) {
    if (schema == null || schema.isBlank()) return quoteIdent(table);
    return quoteIdent(schema) + "." + quoteIdent(table);
  }

  /** Storage type for a column, e.g. {@code TEXT} or {@code VARCHAR(100)}. */
  String columnType(ColumnDef column);

  /** Definition of a single auto-increment key column, from the type onward. */
  String autoIncrementKeyDefinition(ColumnDef column);

  /** True when {@link #autoIncrementKeyDefinition} already declares the primary key inline. */
  default boolean inlinesAutoIncrementKey() { return false; }

  String booleanLiteral(boolean value);

  /** SQL literal for a column default, or null when the column has none. */
  String defaultLiteral(ColumnDef column);

  /** Paging suffix with a leading space, or an empty string. */
  String limitOffset(Integer limit, Integer offset);

  boolean supportsParameter(Object value);

  /** Converts a bound value to what the driver accepts for this engine. */
  Object toParameter(Object value);

  PreparedStatement prepareInsertReturningKey(Connection c, String sql, ColumnDef key) throws SQLException;

  TransientErrorClassifier errorClassifier();
}
