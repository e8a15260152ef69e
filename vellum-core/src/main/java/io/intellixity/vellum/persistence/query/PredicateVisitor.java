package io.intellixity.vellum.persistence.query;

public interface PredicateVisitor<R> {
  R visit(Comparison comparison);
  R visit(AndPredicate and);
  R visit(OrPredicate or);
  R visit(NotPredicate not);
  R visit(StringMatch match);
  R visit(NullCheck check);
  R visit(InList in);
}
