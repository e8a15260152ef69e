package io.intellixity.vellum.persistence.jdbc.ddl;

import io.intellixity.vellum.persistence.mapping.*;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** CREATE TABLE / CREATE INDEX statements for a mapping. Output is byte-stable for equal inputs. */
public final class SchemaGenerator {
  private static final String INDENT = "    ";

  private final SqlDialect dialect;

  public SchemaGenerator(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public String generateCreateTableSql(EntityMapping<?> mapping) {
    List<String> parts = new ArrayList<>();
    boolean inlineKey = false;
    for (ColumnDef c : mapping.columns()) {
      boolean generated = mapping.generatedKey().filter(k -> k == c).isPresent();
      if (generated && dialect.inlinesAutoIncrementKey()) inlineKey = true;
      parts.add(columnDefinition(c, generated));
    }

    if (!inlineKey) {
      List<String> keyCols = new ArrayList<>();
      for (ColumnDef k : mapping.keyColumns()) keyCols.add(dialect.quoteIdent(k.column()));
      parts.add("PRIMARY KEY (" + String.join(", ", keyCols) + ")");
    }

    for (ColumnDef c : mapping.columns()) {
      if (c.check() == null) continue;
      parts.add("CONSTRAINT " + dialect.quoteIdent(c.checkName()) + " CHECK (" + c.check() + ")");
    }

    for (ForeignKeyDef fk : mapping.foreignKeys()) parts.add(foreignKey(fk));

    StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(dialect.qualifiedTable(mapping.schema(), mapping.table()))
        .append(" (\n");
    for (int i = 0; i < parts.size(); i++) {
      sb.append(INDENT).append(parts.get(i));
      if (i < parts.size() - 1) sb.append(',');
      sb.append('\n');
    }
    return sb.append(");").toString();
  }

  public List<String> generateCreateIndexSql(EntityMapping<?> mapping) {
    List<String> out = new ArrayList<>();
    for (IndexDef idx : mapping.indexes()) {
      List<String> cols = new ArrayList<>();
      for (IndexDef.Column c : idx.columns()) {
        cols.add(dialect.quoteIdent(c.column()) + (c.descending() ? " DESC" : ""));
      }
      StringBuilder sb = new StringBuilder("CREATE ")
          .append(idx.unique() ? "UNIQUE " : "")
          .append("INDEX IF NOT EXISTS ")
          .append(dialect.quoteIdent(idx.name()))
          .append(" ON ")
          .append(dialect.qualifiedTable(mapping.schema(), mapping.table()))
          .append(" (").append(String.join(", ", cols)).append(')');
      if (idx.filter() != null && !idx.filter().isBlank()) sb.append(" WHERE ").append(idx.filter());
      out.add(sb.append(';').toString());
    }
    return out;
  }

  private String columnDefinition(ColumnDef c, boolean generatedKey) {
    StringBuilder sb = new StringBuilder(dialect.quoteIdent(c.column())).append(' ');
    if (generatedKey) {
      sb.append(dialect.autoIncrementKeyDefinition(c));
      if (!dialect.inlinesAutoIncrementKey()) sb.append(" NOT NULL");
      return sb.toString();
    }
    sb.append(dialect.columnType(c));
    if (c.notNull() || c.primaryKey()) sb.append(" NOT NULL");
    if (c.unique()) sb.append(" UNIQUE");
    String def = dialect.defaultLiteral(c);
    if (def != null) sb.append(" DEFAULT ").append(def);
    return sb.toString();
  }

  private String foreignKey(ForeignKeyDef fk) {
    List<String> cols = new ArrayList<>();
    for (String c : fk.columns()) cols.add(dialect.quoteIdent(c));
    List<String> refs = new ArrayList<>();
    for (String c : fk.referencedColumns()) refs.add(dialect.quoteIdent(c));
    return "CONSTRAINT " + dialect.quoteIdent(fk.name())
        + " FOREIGN KEY (" + String.join(", ", cols) + ")"
        + " REFERENCES " + dialect.qualifiedTable(fk.referencedSchema(), fk.referencedTable()) + " (" + String.join(", ", refs) + ")"
        + " ON DELETE " + fk.onDelete().sql()
        + " ON UPDATE " + fk.onUpdate().sql();
  }
}
