package io.intellixity.vellum.persistence.mapping;

import java.util.List;
import java.util.Objects;

/**
 * A resolved foreign key; referenced schema, table and columns come from the target's own mapping.
 * {@code referencedSchema} is null when the target lives in the default schema.
 */
public record ForeignKeyDef(
    String name,
    List<String> columns,
    String referencedSchema,
    String referencedTable,
    List<String> referencedColumns,
    ForeignKeyAction onDelete,
    ForeignKeyAction onUpdate
) {
  public ForeignKeyDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(referencedTable, "referencedTable");
    columns = List.copyOf(columns);
    referencedColumns = List.copyOf(referencedColumns);
    if (columns.isEmpty() || columns.size() != referencedColumns.size()) {
      throw new MappingException("Foreign key '" + name + "' must pair each column with one referenced column");
    }
    onDelete = onDelete == null ? ForeignKeyAction.NO_ACTION : onDelete;
    onUpdate = onUpdate == null ? ForeignKeyAction.NO_ACTION : onUpdate;
  }

  public boolean isComposite() { return columns.size() > 1; }
}
