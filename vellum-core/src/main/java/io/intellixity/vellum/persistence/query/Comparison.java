package io.intellixity.vellum.persistence.query;

import java.util.Objects;

public record Comparison(Operand left, Operator operator, Operand right) implements Predicate {
  public Comparison {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
