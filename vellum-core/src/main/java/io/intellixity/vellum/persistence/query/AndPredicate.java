package io.intellixity.vellum.persistence.query;

import java.util.Objects;

public record AndPredicate(Predicate left, Predicate right) implements Predicate {
  public AndPredicate {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
