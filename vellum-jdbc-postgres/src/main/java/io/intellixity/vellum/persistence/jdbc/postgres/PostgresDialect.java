package io.intellixity.vellum.persistence.jdbc.postgres;

import io.intellixity.vellum.persistence.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.vellum.persistence.mapping.ColumnDef;
import io.intellixity.vellum.persistence.mapping.ColumnType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public PostgresDialect() {
    super(new PostgresTransientErrorClassifier());
  }

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String typeName(ColumnType type, ColumnDef column) {
    switch (type) {
      case TEXT:
        return column.size() == null ? "TEXT" : "VARCHAR(" + column.size() + ")";
      case INTEGER:
        return "INTEGER";
      case BIGINT:
        return "BIGINT";
      case BOOLEAN:
        return "BOOLEAN";
      case DOUBLE:
        return "DOUBLE PRECISION";
      case DECIMAL:
        if (column.precision() == null) return "NUMERIC";
        return "NUMERIC(" + column.precision() + ", " + (column.scale() == null ? 0 : column.scale()) + ")";
      case TIMESTAMP:
        return "TIMESTAMP WITH TIME ZONE";
      case DATE:
        return "DATE";
      case UUID:
        return "UUID";
      case BLOB:
        return "BYTEA";
      default:
        throw new IllegalArgumentException("Unsupported column type: " + type);
    }
  }

  @Override
  public String autoIncrementKeyDefinition(ColumnDef column) {
    return (column.type() == ColumnType.INTEGER ? "INTEGER" : "BIGINT") + " GENERATED BY DEFAULT AS IDENTITY";
  }

  @Override
  public String booleanLiteral(boolean value) { return value ? "TRUE" : "FALSE"; }

  /** pgjdbc binds {@code OffsetDateTime} natively to {@code timestamptz}. */
  @Override
  protected Object encodeInstant(Instant v) { return v.atOffset(ZoneOffset.UTC); }

  /** Returns only the key column; the default would return every column of the row. */
  @Override
  public PreparedStatement prepareInsertReturningKey(Connection c, String sql, ColumnDef key) throws SQLException {
    return c.prepareStatement(sql, new String[] {key.column()});
  }
}
