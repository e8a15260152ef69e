package io.intellixity.vellum.persistence.query;

import java.util.Objects;

/** Unary NOT over any subtree. */
public record NotPredicate(Predicate operand) implements Predicate {
  public NotPredicate {
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
