package io.intellixity.vellum.persistence.query;

import java.util.List;
import java.util.Objects;

/** Membership test; an empty list matches nothing. */
public record InList(FieldRef field, List<Literal> values) implements Predicate {
  public InList {
    Objects.requireNonNull(field, "field");
    values = List.copyOf(values);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
