package io.intellixity.vellum.persistence.jdbc.ddl;

import io.intellixity.vellum.persistence.mapping.ColumnDef;
import io.intellixity.vellum.persistence.mapping.ColumnRole;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.mapping.SystemColumns;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parameterized statements for one mapping, with {@code @Column} placeholders.
 *
 * <p>Update and delete filter by key first, then {@code Version = @expectedVersion}, then the
 * soft-delete flag when the mapping has one. {@code restore} is null for mappings without soft delete.
 * {@code purge} removes the physical row by key alone, whatever its version or flags.</p>
 */
public record DmlTemplates(
    String insert,
    String update,
    String delete,
    String select,
    String selectVersion,
    String restore,
    String purge
) {
  public static DmlTemplates generate(EntityMapping<?> mapping, SqlDialect dialect) {
    String table = dialect.qualifiedTable(mapping.schema(), mapping.table());
    String version = dialect.quoteIdent(mapping.versionColumn().column());
    String lastWrite = dialect.quoteIdent(SystemColumns.LAST_WRITE_TIME);
    Optional<ColumnDef> deleted = mapping.role(ColumnRole.SOFT_DELETE_FLAG);
    Optional<ColumnDef> expiration = mapping.role(ColumnRole.EXPIRATION);
    String bumpVersion = version + " = " + SystemColumns.EXPECTED_VERSION_PARAM + " + 1";
    String versionMatches = " AND " + version + " = " + SystemColumns.EXPECTED_VERSION_PARAM;

    String keyWhere = keyWhere(mapping, dialect);
    String isLive = deleted.map(d -> " AND " + dialect.quoteIdent(d.column()) + " = " + dialect.booleanLiteral(false)).orElse("");

    List<String> insertCols = new ArrayList<>();
    List<String> insertParams = new ArrayList<>();
    for (ColumnDef c : insertColumns(mapping)) {
      insertCols.add(dialect.quoteIdent(c.column()));
      insertParams.add(c.parameter());
    }
    String insert = "INSERT INTO " + table + " (" + String.join(", ", insertCols) + ") VALUES ("
        + String.join(", ", insertParams) + ")";

    List<String> sets = new ArrayList<>();
    for (ColumnDef c : mapping.dataColumns()) {
      if (!c.primaryKey()) sets.add(dialect.quoteIdent(c.column()) + " = " + c.parameter());
    }
    sets.add(bumpVersion);
    sets.add(lastWrite + " = @" + SystemColumns.LAST_WRITE_TIME);
    expiration.ifPresent(e -> sets.add(dialect.quoteIdent(e.column()) + " = " + e.parameter()));
    String update = "UPDATE " + table + " SET " + String.join(", ", sets)
        + " WHERE " + keyWhere + versionMatches + isLive;

    String delete;
    if (deleted.isPresent()) {
      delete = "UPDATE " + table + " SET " + dialect.quoteIdent(deleted.get().column()) + " = " + dialect.booleanLiteral(true)
          + ", " + bumpVersion + ", " + lastWrite + " = @" + SystemColumns.LAST_WRITE_TIME
          + " WHERE " + keyWhere + versionMatches + isLive;
    } else {
      delete = "DELETE FROM " + table + " WHERE " + keyWhere + versionMatches;
    }

    List<String> all = new ArrayList<>();
    for (ColumnDef c : mapping.columns()) all.add(dialect.quoteIdent(c.column()));
    String select = "SELECT " + String.join(", ", all) + " FROM " + table + " WHERE " + keyWhere;

    String probeCols = version + deleted.map(d -> ", " + dialect.quoteIdent(d.column())).orElse("");
    String selectVersion = "SELECT " + probeCols + " FROM " + table + " WHERE " + keyWhere;

    String restore = null;
    if (deleted.isPresent()) {
      List<String> rs = new ArrayList<>();
      for (ColumnDef c : mapping.columns()) {
        if (c.primaryKey() || c.role() == ColumnRole.SOFT_DELETE_FLAG) continue;
        rs.add(dialect.quoteIdent(c.column()) + " = " + c.parameter());
      }
      rs.add(dialect.quoteIdent(deleted.get().column()) + " = " + dialect.booleanLiteral(false));
      restore = "UPDATE " + table + " SET " + String.join(", ", rs)
          + " WHERE " + keyWhere + versionMatches
          + " AND " + dialect.quoteIdent(deleted.get().column()) + " = " + dialect.booleanLiteral(true);
    }

    String purge = "DELETE FROM " + table + " WHERE " + keyWhere;

    return new DmlTemplates(insert, update, delete, select, selectVersion, restore, purge);
  }

  /** Columns written by an insert: everything except a store-generated key. */
  public static List<ColumnDef> insertColumns(EntityMapping<?> mapping) {
    Optional<ColumnDef> generated = mapping.generatedKey();
    List<ColumnDef> out = new ArrayList<>();
    for (ColumnDef c : mapping.columns()) {
      if (generated.isPresent() && generated.get() == c) continue;
      out.add(c);
    }
    return out;
  }

  static String keyWhere(EntityMapping<?> mapping, SqlDialect dialect) {
    List<String> parts = new ArrayList<>();
    for (ColumnDef k : mapping.keyColumns()) parts.add(dialect.quoteIdent(k.column()) + " = " + k.parameter());
    return String.join(" AND ", parts);
  }
}
