package io.intellixity.vellum.persistence.jdbc.sqlite;

import io.intellixity.vellum.persistence.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.vellum.persistence.mapping.ColumnDef;
import io.intellixity.vellum.persistence.mapping.ColumnType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * SQLite dialect.
 *
 * Keeps only SQLite-specific overrides; generic rendering lives in {@link AbstractSqlDialect}.
 * Timestamps are stored as fixed-width UTC text so that text comparison orders them correctly.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
      .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'", Locale.ROOT)
      .withZone(ZoneOffset.UTC);

  private static final Set<String> KEYWORDS = Set.of(
      "ABORT", "ACTION", "ADD", "AFTER", "ALL", "ALTER", "ALWAYS", "ANALYZE", "AND", "AS", "ASC", "ATTACH",
      "AUTOINCREMENT", "BEFORE", "BEGIN", "BETWEEN", "BY", "CASCADE", "CASE", "CAST", "CHECK", "COLLATE",
      "COLUMN", "COMMIT", "CONFLICT", "CONSTRAINT", "CREATE", "CROSS", "CURRENT", "CURRENT_DATE",
      "CURRENT_TIME", "CURRENT_TIMESTAMP", "DATABASE", "DEFAULT", "DEFERRABLE", "DEFERRED", "DELETE", "DESC",
      "DETACH", "DISTINCT", "DO", "DROP", "EACH", "ELSE", "END", "ESCAPE", "EXCEPT", "EXCLUDE", "EXCLUSIVE",
      "EXISTS", "EXPLAIN", "FAIL", "FILTER", "FIRST", "FOLLOWING", "FOR", "FOREIGN", "FROM", "FULL",
      "GENERATED", "GLOB", "GROUP", "GROUPS", "HAVING", "IF", "IGNORE", "IMMEDIATE", "IN", "INDEX", "INDEXED",
      "INITIALLY", "INNER", "INSERT", "INSTEAD", "INTERSECT", "INTO", "IS", "ISNULL", "JOIN", "KEY", "LAST",
      "LEFT", "LIKE", "LIMIT", "MATCH", "MATERIALIZED", "NATURAL", "NO", "NOT", "NOTHING", "NOTNULL", "NULL",
      "NULLS", "OF", "OFFSET", "ON", "OR", "ORDER", "OTHERS", "OUTER", "OVER", "PARTITION", "PLAN", "PRAGMA",
      "PRECEDING", "PRIMARY", "QUERY", "RAISE", "RANGE", "RECURSIVE", "REFERENCES", "REGEXP", "REINDEX",
      "RELEASE", "RENAME", "REPLACE", "RESTRICT", "RETURNING", "RIGHT", "ROLLBACK", "ROW", "ROWS", "SAVEPOINT",
      "SELECT", "SET", "TABLE", "TEMP", "TEMPORARY", "THEN", "TIES", "TO", "TRANSACTION", "TRIGGER",
      "UNBOUNDED", "UNION", "UNIQUE", "UPDATE", "USING", "VACUUM", "VALUES", "VIEW", "VIRTUAL", "WHEN",
      "WHERE", "WINDOW", "WITH", "WITHOUT");

  public SqliteDialect() {
    super(new SqliteTransientErrorClassifier());
  }

  @Override public String id() { return "sqlite"; }

  /** Wraps reserved words and identifiers that are not plain words in {@code [...]}; others stay bare. */
  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    if (KEYWORDS.contains(ident.toUpperCase(Locale.ROOT)) || !isPlain(ident)) {
      return "[" + ident.replace("]", "]]") + "]";
    }
    return ident;
  }

  @Override
  protected String typeName(ColumnType type, ColumnDef column) {
    switch (type) {
      case INTEGER:
      case BIGINT:
      case BOOLEAN:
        return "INTEGER";
      case DOUBLE:
        return "REAL";
      case DECIMAL:
        return "NUMERIC";
      case BLOB:
        return "BLOB";
      default:
        return "TEXT";
    }
  }

  @Override
  public String autoIncrementKeyDefinition(ColumnDef column) {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  public boolean inlinesAutoIncrementKey() { return true; }

  @Override
  public String booleanLiteral(boolean value) { return value ? "1" : "0"; }

  @Override
  protected String unboundedLimit() { return "-1"; }

  @Override protected Object encodeBoolean(boolean v) { return v ? 1 : 0; }
  @Override protected Object encodeInstant(Instant v) { return TIMESTAMP.format(v); }
  @Override protected Object encodeDate(LocalDate v) { return v.toString(); }
  @Override protected Object encodeUuid(UUID v) { return v.toString(); }
  @Override protected Object encodeDecimal(BigDecimal v) { return v.toPlainString(); }

  private static boolean isPlain(String ident) {
    if (ident.isEmpty() || Character.isDigit(ident.charAt(0))) return false;
    for (int i = 0; i < ident.length(); i++) {
      char c = ident.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) return false;
    }
    return true;
  }
}
