package io.intellixity.vellum.persistence.query;

import java.util.Objects;

/** Substring match on a text field. The pattern is used as-is; {@code %} and {@code _} are not escaped. */
public record StringMatch(FieldRef field, Kind kind, Literal pattern) implements Predicate {
  public StringMatch {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(pattern, "pattern");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }

  public enum Kind {
    CONTAINS, STARTS_WITH, ENDS_WITH;

    public String likePattern(String value) {
      switch (this) {
        case STARTS_WITH: return value + "%";
        case ENDS_WITH: return "%" + value;
        default: return "%" + value + "%";
      }
    }
  }
}
