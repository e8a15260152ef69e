package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.jdbc.command.RowVersion;
import io.intellixity.vellum.persistence.jdbc.command.SqlCommand;
import io.intellixity.vellum.persistence.mapping.RowReader;
import io.intellixity.vellum.persistence.mapping.SystemColumns;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;
import io.intellixity.vellum.persistence.mapping.ColumnDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.util.*;

/**
 * Executes {@link SqlCommand}s on a caller-owned connection.
 *
 * <p>Never opens, commits or closes the connection; the store owns the unit of work.</p>
 */
public final class JdbcCommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcCommandExecutor.class);
  static final long SLOW_QUERY_MILLIS = 1_000;

  private final SqlDialect dialect;

  public JdbcCommandExecutor(SqlDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public <T> List<T> query(Connection c, SqlCommand cmd, RowReader<T> reader) throws SQLException {
    NamedParameterSql np = NamedParameterSql.compile(cmd.sql());
    long start = System.nanoTime();
    debugSql(cmd, np);
    try (PreparedStatement ps = c.prepareStatement(np.jdbcSql())) {
      prepare(ps, np, cmd);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        JdbcRowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(reader.read(row));
        done(cmd, out.size(), System.nanoTime() - start);
        return out;
      }
    }
  }

  /** First column of the first row, or null for an empty result. */
  public Object queryOneValue(Connection c, SqlCommand cmd) throws SQLException {
    NamedParameterSql np = NamedParameterSql.compile(cmd.sql());
    long start = System.nanoTime();
    debugSql(cmd, np);
    try (PreparedStatement ps = c.prepareStatement(np.jdbcSql())) {
      prepare(ps, np, cmd);
      try (ResultSet rs = ps.executeQuery()) {
        Object v = rs.next() ? rs.getObject(1) : null;
        done(cmd, v, System.nanoTime() - start);
        return v;
      }
    }
  }

  public int update(Connection c, SqlCommand cmd) throws SQLException {
    NamedParameterSql np = NamedParameterSql.compile(cmd.sql());
    long start = System.nanoTime();
    debugSql(cmd, np);
    try (PreparedStatement ps = c.prepareStatement(np.jdbcSql())) {
      prepare(ps, np, cmd);
      int n = ps.executeUpdate();
      done(cmd, n, System.nanoTime() - start);
      return n;
    }
  }

  /** Runs an insert and returns the generated key, or null when the driver returned none. */
  public Object insertReturningKey(Connection c, SqlCommand cmd, ColumnDef key) throws SQLException {
    if (cmd.execKind() != SqlCommand.ExecKind.UPDATE_GENERATED_KEYS) {
      throw new IllegalArgumentException("Invalid execKind=" + cmd.execKind() + " for insertReturningKey; use UPDATE_GENERATED_KEYS");
    }
    NamedParameterSql np = NamedParameterSql.compile(cmd.sql());
    long start = System.nanoTime();
    debugSql(cmd, np);
    try (PreparedStatement ps = dialect.prepareInsertReturningKey(c, np.jdbcSql(), key)) {
      prepare(ps, np, cmd);
      int n = ps.executeUpdate();
      try (ResultSet rs = ps.getGeneratedKeys()) {
        Object v = (rs == null || !rs.next()) ? null : rs.getObject(1);
        done(cmd, n, System.nanoTime() - start);
        return v;
      }
    }
  }

  /** Reads {@code Version} (and the tombstone flag, when mapped) for a key; empty when no row exists. */
  public Optional<RowVersion> probeVersion(Connection c, SqlCommand cmd, String versionColumn) throws SQLException {
    List<RowVersion> rows = query(c, cmd, row -> new RowVersion(
        row.getLong(versionColumn),
        row.has(SystemColumns.IS_DELETED) && row.flag(SystemColumns.IS_DELETED)));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Executes a statement without parameters, such as DDL. */
  public void execute(Connection c, String sql) throws SQLException {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) log.debug("vellum.jdbc op=DDL sql={}", sql);
    try (Statement st = c.createStatement()) {
      st.execute(sql);
    }
    if (log.isDebugEnabled()) {
      log.debug("vellum.jdbc_done op=DDL durationMs={}", (System.nanoTime() - start) / 1_000_000.0);
    }
  }

  private void prepare(PreparedStatement ps, NamedParameterSql np, SqlCommand cmd) throws SQLException {
    Duration t = cmd.timeout();
    if (t != null && !t.isZero()) {
      // JDBC timeouts are whole seconds; round sub-second timeouts up
      long seconds = Math.max(1, (t.toMillis() + 999) / 1000);
      ps.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
    }
    np.bind(ps, cmd.parameters(), dialect);
  }

  private void debugSql(SqlCommand cmd, NamedParameterSql np) {
    if (!log.isDebugEnabled()) return;
    log.debug("vellum.jdbc op={} execKind={} dialect={} paramCount={} sql={}",
        cmd.kind(), cmd.execKind(), dialect.id(), np.names().size(), np.jdbcSql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (String name : np.names()) {
        Object v = cmd.parameters().get(name);
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("vellum.jdbc bind index={} name={} valueType={} valueLen={}", idx++, name, vType, vLen);
      }
    }
  }

  private void done(SqlCommand cmd, Object result, long durationNanos) {
    long millis = durationNanos / 1_000_000;
    if (millis > SLOW_QUERY_MILLIS) {
      log.warn("vellum.slow_query op={} dialect={} durationMs={}", cmd.kind(), dialect.id(), millis);
    }
    if (!log.isDebugEnabled()) return;
    log.debug("vellum.jdbc_done op={} execKind={} durationMs={} result={}",
        cmd.kind(), cmd.execKind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
