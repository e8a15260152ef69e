package io.intellixity.vellum.persistence.query;

/** Constant value; null is allowed and renders as a null check where the operator permits. */
public record Literal(Object value) implements Operand {
  public static final Literal NULL = new Literal(null);

  public boolean isNull() { return value == null; }
}
