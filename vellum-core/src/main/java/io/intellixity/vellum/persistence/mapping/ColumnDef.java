package io.intellixity.vellum.persistence.mapping;

import java.util.Objects;

/**
 * One mapped column.
 *
 * @param field source field name on the entity (system columns use the column name)
 * @param keyOrder position in the primary key, or -1 when not part of it
 * @param defaultValue literal default, formatted by the dialect
 * @param defaultExpression raw SQL default, emitted verbatim; wins over {@code defaultValue}
 */
public record ColumnDef(
    String field,
    String column,
    ColumnType type,
    ColumnRole role,
    boolean notNull,
    int keyOrder,
    boolean autoIncrement,
    boolean unique,
    Integer size,
    Integer precision,
    Integer scale,
    Object defaultValue,
    String defaultExpression,
    String check,
    String checkName
) {
  public ColumnDef {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(type, "type");
    role = role == null ? ColumnRole.DATA : role;
    if (column.isBlank()) throw new MappingException("Blank column name for field '" + field + "'");
  }

  public boolean primaryKey() { return keyOrder >= 0; }

  public boolean hasDefault() { return defaultExpression != null || defaultValue != null; }

  /** Named placeholder used by generated DML, e.g. {@code @Name}. */
  public String parameter() { return "@" + column; }

  static ColumnDef system(String column, ColumnType type, ColumnRole role, boolean notNull, Object defaultValue) {
    return new ColumnDef(column, column, type, role, notNull, -1, false, false,
        null, null, null, defaultValue, null, null, null);
  }
}
