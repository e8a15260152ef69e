package io.intellixity.vellum.persistence.query;

/**
 * Node of a filter tree over mapped entity fields.
 *
 * <p>The set of node kinds is closed; translators walk it with a {@link PredicateVisitor}.
 * Build trees through {@link Predicates}.</p>
 */
public interface Predicate {
  <R> R accept(PredicateVisitor<R> visitor);

  /** Short node name used in error messages, e.g. {@code Comparison}. */
  default String nodeKind() { return getClass().getSimpleName(); }

  default Predicate and(Predicate other) { return new AndPredicate(this, other); }

  default Predicate or(Predicate other) { return new OrPredicate(this, other); }

  default Predicate negate() { return new NotPredicate(this); }
}
