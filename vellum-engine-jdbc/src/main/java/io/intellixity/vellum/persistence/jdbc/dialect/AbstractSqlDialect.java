package io.intellixity.vellum.persistence.jdbc.dialect;

import io.intellixity.vellum.persistence.mapping.ColumnDef;
import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.spi.resilience.DefaultTransientErrorClassifier;
import io.intellixity.vellum.persistence.spi.resilience.TransientErrorClassifier;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for column defaults, paging and parameter encoding.
 * Engine dialects override hooks for quoting, type names and value encodings.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private final TransientErrorClassifier classifier;

  protected AbstractSqlDialect() {
    this(new DefaultTransientErrorClassifier());
  }

  protected AbstractSqlDialect(TransientErrorClassifier classifier) {
    this.classifier = classifier;
  }

  @Override
  public TransientErrorClassifier errorClassifier() { return classifier; }

  @Override
  public String columnType(ColumnDef column) {
    return typeName(column.type(), column);
  }

  /** Storage type name for a logical type; size, precision and scale come from the column. */
  protected abstract String typeName(ColumnType type, ColumnDef column);

  @Override
  public String defaultLiteral(ColumnDef column) {
    if (column.defaultExpression() != null) return column.defaultExpression();
    if (column.defaultValue() == null) return null;
    return literal(column.defaultValue());
  }

  /** Inline SQL literal; only used for DDL defaults, never for values supplied at run time. */
  protected String literal(Object value) {
    if (value instanceof Boolean b) return booleanLiteral(b);
    if (value instanceof Number) return value.toString();
    Object encoded = toParameter(value);
    if (encoded instanceof Number) return encoded.toString();
    return "'" + String.valueOf(encoded).replace("'", "''") + "'";
  }

  @Override
  public String limitOffset(Integer limit, Integer offset) {
    StringBuilder sb = new StringBuilder();
    if (limit != null) {
      sb.append(" LIMIT ").append(limit);
    } else if (offset != null && unboundedLimit() != null) {
      sb.append(" LIMIT ").append(unboundedLimit());
    }
    if (offset != null) sb.append(" OFFSET ").append(offset);
    return sb.toString();
  }

  /** LIMIT value meaning "all rows", for engines that require LIMIT before OFFSET; null when not needed. */
  protected String unboundedLimit() {
    return null;
  }

  @Override
  public boolean supportsParameter(Object value) {
    return value == null
        || value instanceof String
        || value instanceof Character
        || value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof Double
        || value instanceof Float
        || value instanceof BigDecimal
        || value instanceof BigInteger
        || value instanceof Boolean
        || value instanceof Instant
        || value instanceof LocalDate
        || value instanceof UUID
        || value instanceof Enum<?>
        || value instanceof byte[];
  }

  @Override
  public Object toParameter(Object value) {
    if (value == null) return null;
    if (!supportsParameter(value)) {
      throw new IllegalArgumentException("Unsupported parameter type for " + id() + ": " + value.getClass().getName());
    }
    if (value instanceof Boolean b) return encodeBoolean(b);
    if (value instanceof Instant i) return encodeInstant(i);
    if (value instanceof LocalDate d) return encodeDate(d);
    if (value instanceof UUID u) return encodeUuid(u);
    if (value instanceof BigDecimal bd) return encodeDecimal(bd);
    if (value instanceof BigInteger bi) return encodeDecimal(new BigDecimal(bi));
    if (value instanceof Enum<?> e) return e.name();
    if (value instanceof Character c) return c.toString();
    return value;
  }

  protected Object encodeBoolean(boolean v) { return v; }
  protected Object encodeInstant(Instant v) { return v; }
  protected Object encodeDate(LocalDate v) { return v; }
  protected Object encodeUuid(UUID v) { return v; }
  protected Object encodeDecimal(BigDecimal v) { return v; }

  @Override
  public PreparedStatement prepareInsertReturningKey(Connection c, String sql, ColumnDef key) throws SQLException {
    return c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
  }

  @Override
  public String toString() { return getClass().getSimpleName() + "[" + id() + "]"; }
}
