package io.intellixity.vellum.persistence.jdbc.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.vellum.persistence.audit.AuditOperation;
import io.intellixity.vellum.persistence.audit.AuditRecord;
import io.intellixity.vellum.persistence.audit.CallerInfo;
import io.intellixity.vellum.persistence.jdbc.EntityMapper;
import io.intellixity.vellum.persistence.jdbc.JdbcCommandExecutor;
import io.intellixity.vellum.persistence.jdbc.command.CommandContext;
import io.intellixity.vellum.persistence.jdbc.command.SqlCommand;
import io.intellixity.vellum.persistence.mapping.EntityKey;
import io.intellixity.vellum.persistence.query.OrderBy;
import io.intellixity.vellum.persistence.query.Predicates;
import io.intellixity.vellum.persistence.query.SelectOptions;
import io.intellixity.vellum.persistence.spi.resilience.CancellationSignal;
import io.intellixity.vellum.persistence.spi.resilience.ResilientExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@link AuditRecord}s for entity operations.
 *
 * <p>Runs after the business transaction has committed, on its own connection. A failed audit write
 * is logged and never fails the operation that triggered it.</p>
 */
public final class AuditTrailWriter {
  private static final Logger log = LoggerFactory.getLogger(AuditTrailWriter.class);

  private final DataSource ds;
  private final EntityMapper<AuditRecord> mapper;
  private final JdbcCommandExecutor executor;
  private final ResilientExecutor resilient;
  private final ObjectMapper json;

  public AuditTrailWriter(DataSource ds, EntityMapper<AuditRecord> mapper, ResilientExecutor resilient) {
    this(ds, mapper, resilient, defaultJson());
  }

  public AuditTrailWriter(DataSource ds, EntityMapper<AuditRecord> mapper, ResilientExecutor resilient, ObjectMapper json) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.resilient = Objects.requireNonNull(resilient, "resilient");
    this.json = Objects.requireNonNull(json, "json");
    this.executor = new JdbcCommandExecutor(mapper.dialect());
  }

  public static ObjectMapper defaultJson() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();
  }

  public EntityMapper<AuditRecord> mapper() { return mapper; }

  /** Creates the {@code Audit} table and its indexes on the given connection. */
  public void createSchema(Connection c) throws SQLException {
    executor.execute(c, mapper.generateCreateTableSql());
    for (String idx : mapper.generateCreateIndexSql()) executor.execute(c, idx);
  }

  /**
   * Persists one audit entry. Never throws for storage or serialization failures.
   *
   * @param oldValue entity before the operation, or null
   * @param newValue entity after the operation, or null
   */
  public void write(String entityType, EntityKey key, AuditOperation operation, Long entityVersion, Long oldVersion,
                    Object oldValue, Object newValue, CallerInfo caller) {
    try {
      CallerInfo c = CallerInfo.orUnknown(caller);
      String oldJson = toJson(oldValue);
      String newJson = toJson(newValue);
      Integer size = newJson == null ? null : newJson.getBytes(StandardCharsets.UTF_8).length;
      AuditRecord rec = new AuditRecord(null, entityType, String.valueOf(key), operation, entityVersion, oldVersion,
          c.className(), c.methodName(), c.line() < 0 ? null : c.line(), c.userId(), size, oldJson, newJson, null);
      insert(rec);
    } catch (SQLException | RuntimeException e) {
      log.warn("vellum.audit_failed entityType={} key={} op={}", entityType, key, operation, e);
    }
  }

  /** Audit entries for one entity, oldest first. */
  public List<AuditRecord> recordsFor(String entityType, EntityKey key) throws SQLException {
    CommandContext<AuditRecord> ctx = CommandContext.forQuery(
        Predicates.and(Predicates.eq("entityType", entityType), Predicates.eq("entityId", String.valueOf(key))),
        SelectOptions.defaults().withOrderBy(OrderBy.by("id")));
    SqlCommand cmd = mapper.commandBuilder().build(ctx);
    return resilient.execute("audit.read", () -> {
      try (Connection c = ds.getConnection()) {
        return executor.query(c, cmd, mapper.mapping().reader());
      }
    }, CancellationSignal.none());
  }

  private void insert(AuditRecord rec) throws SQLException {
    SqlCommand cmd = mapper.commandBuilder().build(CommandContext.forInsert(rec));
    resilient.execute("audit.write", () -> {
      try (Connection c = ds.getConnection()) {
        c.setAutoCommit(true);
        if (cmd.execKind() == SqlCommand.ExecKind.UPDATE_GENERATED_KEYS) {
          executor.insertReturningKey(c, cmd, mapper.mapping().generatedKey().orElseThrow());
        } else {
          executor.update(c, cmd);
        }
        return null;
      }
    }, CancellationSignal.none());
  }

  private String toJson(Object value) {
    if (value == null) return null;
    try {
      return json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize " + value.getClass().getName() + " for audit", e);
    }
  }
}
