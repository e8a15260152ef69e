package io.intellixity.vellum.persistence.query;

import java.util.Objects;

/** Reference to a mapped field, by source field name or column name. */
public record FieldRef(String name) implements Operand {
  public FieldRef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Blank field reference");
  }
}
