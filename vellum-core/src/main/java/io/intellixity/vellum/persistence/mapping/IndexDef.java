package io.intellixity.vellum.persistence.mapping;

import java.util.List;
import java.util.Objects;

/** A declared index. {@code filter} is a partial-index predicate passed through verbatim. */
public record IndexDef(String name, List<Column> columns, boolean unique, String filter) {
  public IndexDef {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    if (columns.isEmpty()) throw new MappingException("Index '" + name + "' has no columns");
  }

  public record Column(String column, boolean descending) {
    public Column {
      Objects.requireNonNull(column, "column");
    }
  }
}
