package io.intellixity.vellum.persistence.jdbc.command;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rendered statement ready for execution.
 *
 * @param parameters {@code @name} placeholders to raw values; the dialect encodes them at bind time
 * @param timeout per-attempt statement timeout, or null for the driver default
 */
public record SqlCommand(CommandKind kind, String sql, Map<String, Object> parameters, ExecKind execKind, Duration timeout) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (used for SELECT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (no generated keys). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys(). */
    UPDATE_GENERATED_KEYS,
    /** Execute via PreparedStatement.executeQuery() and read the first column of the first row (COUNT). */
    QUERY_ONE_VALUE
  }

  public SqlCommand {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(sql, "sql");
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters == null ? Map.of() : parameters));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }
}
