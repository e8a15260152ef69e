package io.intellixity.vellum.persistence.query;

import java.util.*;

/** Static factory for predicate trees. */
public final class Predicates {
  private Predicates() {}

  public static FieldRef field(String name) { return new FieldRef(name); }

  public static Literal value(Object v) { return v == null ? Literal.NULL : new Literal(v); }

  public static Predicate eq(String field, Object value) { return compare(field, Operator.EQ, value); }
  public static Predicate ne(String field, Object value) { return compare(field, Operator.NE, value); }
  public static Predicate lt(String field, Object value) { return compare(field, Operator.LT, value); }
  public static Predicate le(String field, Object value) { return compare(field, Operator.LE, value); }
  public static Predicate gt(String field, Object value) { return compare(field, Operator.GT, value); }
  public static Predicate ge(String field, Object value) { return compare(field, Operator.GE, value); }

  public static Predicate compare(String field, Operator op, Object value) {
    return new Comparison(field(field), op, value(value));
  }

  /** Field-to-field comparison, e.g. {@code CreatedTime < LastWriteTime}. */
  public static Predicate compareFields(String left, Operator op, String right) {
    return new Comparison(field(left), op, field(right));
  }

  public static Predicate contains(String field, String value) {
    return new StringMatch(field(field), StringMatch.Kind.CONTAINS, value(value));
  }

  public static Predicate startsWith(String field, String value) {
    return new StringMatch(field(field), StringMatch.Kind.STARTS_WITH, value(value));
  }

  public static Predicate endsWith(String field, String value) {
    return new StringMatch(field(field), StringMatch.Kind.ENDS_WITH, value(value));
  }

  public static Predicate isNull(String field) { return new NullCheck(field(field), true); }

  public static Predicate isNotNull(String field) { return new NullCheck(field(field), false); }

  public static Predicate in(String field, Collection<?> values) {
    List<Literal> lits = new ArrayList<>(values.size());
    for (Object v : values) lits.add(value(v));
    return new InList(field(field), lits);
  }

  public static Predicate in(String field, Object... values) {
    return in(field, Arrays.asList(values));
  }

  /** Left-folds into nested binary ANDs: {@code ((a AND b) AND c)}. */
  public static Predicate and(Predicate first, Predicate... rest) {
    Predicate p = Objects.requireNonNull(first, "first");
    for (Predicate r : rest) p = new AndPredicate(p, r);
    return p;
  }

  public static Predicate or(Predicate first, Predicate... rest) {
    Predicate p = Objects.requireNonNull(first, "first");
    for (Predicate r : rest) p = new OrPredicate(p, r);
    return p;
  }

  public static Predicate not(Predicate p) { return new NotPredicate(p); }
}
