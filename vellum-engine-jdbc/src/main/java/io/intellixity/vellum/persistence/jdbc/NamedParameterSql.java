package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQL with named parameters (e.g. {@code @Name}) compiled into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as '@' followed by [A-Za-z_][A-Za-z0-9_]*
 * - Text inside '...', "..." and [...] is copied verbatim; '' and "" escapes are honoured.
 * - A name used twice binds twice, in order of appearance.
 */
public record NamedParameterSql(String jdbcSql, List<String> names) {
  public NamedParameterSql {
    names = List.copyOf(names);
  }

  public static NamedParameterSql compile(String sql) {
    if (sql == null) return new NamedParameterSql("", List.of());
    StringBuilder out = new StringBuilder(sql.length());
    List<String> names = new ArrayList<>();

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"' || ch == '[') {
        char close = ch == '[' ? ']' : ch;
        int end = i + 1;
        while (end < sql.length()) {
          if (sql.charAt(end) == close) {
            // Doubled quote is an escape, not a terminator
            if (close != ']' && end + 1 < sql.length() && sql.charAt(end + 1) == close) {
              end += 2;
              continue;
            }
            break;
          }
          end++;
        }
        int stop = Math.min(end + 1, sql.length());
        out.append(sql, i, stop);
        i = stop - 1;
        continue;
      }

      if (ch == '@' && i + 1 < sql.length() && isIdentStart(sql.charAt(i + 1))) {
        int end = i + 2;
        while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
        names.add(sql.substring(i, end));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }
    return new NamedParameterSql(out.toString(), names);
  }

  /** Binds every placeholder from {@code params}; keys carry the '@' prefix. */
  public void bind(PreparedStatement ps, Map<String, Object> params, SqlDialect dialect) throws SQLException {
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
      Object v = dialect.toParameter(params.get(name));
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
