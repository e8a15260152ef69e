package io.intellixity.vellum.persistence.jdbc.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SQL fragment plus its named parameters, in the order they were generated.
 *
 * @param parameters placeholder (with its {@code @} prefix) to raw value; values may be null
 */
public record TranslatedPredicate(String sql, Map<String, Object> parameters) {
  private static final TranslatedPredicate EMPTY = new TranslatedPredicate("", Map.of());

  public TranslatedPredicate {
    Objects.requireNonNull(sql, "sql");
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public static TranslatedPredicate empty() { return EMPTY; }

  public boolean isEmpty() { return sql.isEmpty(); }
}
