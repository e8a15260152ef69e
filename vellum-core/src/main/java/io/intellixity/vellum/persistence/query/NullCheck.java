package io.intellixity.vellum.persistence.query;

import java.util.Objects;

public record NullCheck(FieldRef field, boolean isNull) implements Predicate {
  public NullCheck {
    Objects.requireNonNull(field, "field");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
