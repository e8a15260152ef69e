package io.intellixity.vellum.persistence.query;

/** Either side of a {@link Comparison}: a {@link FieldRef} or a {@link Literal}. */
public interface Operand {
}
