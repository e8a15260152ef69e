package io.intellixity.vellum.persistence.jdbc.command;

import io.intellixity.vellum.persistence.jdbc.ddl.DmlTemplates;
import io.intellixity.vellum.persistence.jdbc.translate.ExpressionTranslator;
import io.intellixity.vellum.persistence.jdbc.translate.TranslatedPredicate;
import io.intellixity.vellum.persistence.mapping.*;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Turns a {@link CommandContext} into a {@link SqlCommand}.
 *
 * <p>Writes are version-guarded: inserts start at version 1, updates and deletes bump
 * {@code @expectedVersion} by one and match on it, so a stale writer affects zero rows.</p>
 */
public final class CommandBuilder<T> {
  private final EntityMapping<T> mapping;
  private final SqlDialect dialect;
  private final DmlTemplates templates;
  private final ExpressionTranslator translator;
  private final Clock clock;

  public CommandBuilder(EntityMapping<T> mapping, SqlDialect dialect, DmlTemplates templates,
                        ExpressionTranslator translator, Clock clock) {
    this.mapping = Objects.requireNonNull(mapping, "mapping");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.templates = Objects.requireNonNull(templates, "templates");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public SqlCommand build(CommandContext<T> ctx) {
    Objects.requireNonNull(ctx, "ctx");
    ctx.consume();
    switch (ctx.kind()) {
      case INSERT: return insert(ctx);
      case BATCH_INSERT: return batchInsert(ctx);
      case UPDATE: return update(ctx);
      case DELETE: return delete(ctx);
      case RESTORE: return restore(ctx);
      case PURGE: return purge(ctx);
      case SELECT: return select(ctx);
      case QUERY: return query(ctx);
      case COUNT: return count(ctx);
      case VERSION_PROBE: return versionProbe(ctx);
      default: throw new IllegalArgumentException("Unknown command kind: " + ctx.kind());
    }
  }

  private SqlCommand insert(CommandContext<T> ctx) {
    Instant now = clock.instant();
    Map<String, Object> p = new LinkedHashMap<>();
    for (ColumnDef c : DmlTemplates.insertColumns(mapping)) {
      p.put(c.parameter(), insertValue(ctx.entity(), c, now, 1L));
    }
    SqlCommand.ExecKind exec = mapping.generatedKey().isPresent()
        ? SqlCommand.ExecKind.UPDATE_GENERATED_KEYS
        : SqlCommand.ExecKind.UPDATE;
    return new SqlCommand(CommandKind.INSERT, templates.insert(), p, exec, ctx.timeout());
  }

  /** One multi-row VALUES clause; placeholders are {@code @<Column>_<row>}, rows counted from 0. */
  private SqlCommand batchInsert(CommandContext<T> ctx) {
    Instant now = clock.instant();
    List<ColumnDef> cols = DmlTemplates.insertColumns(mapping);
    List<String> names = new ArrayList<>();
    for (ColumnDef c : cols) names.add(dialect.quoteIdent(c.column()));

    Map<String, Object> p = new LinkedHashMap<>();
    List<String> rows = new ArrayList<>();
    List<T> entities = ctx.entities();
    for (int i = 0; i < entities.size(); i++) {
      List<String> placeholders = new ArrayList<>(cols.size());
      for (ColumnDef c : cols) {
        String name = c.parameter() + "_" + i;
        placeholders.add(name);
        p.put(name, insertValue(entities.get(i), c, now, 1L));
      }
      rows.add("(" + String.join(", ", placeholders) + ")");
    }
    String sql = "INSERT INTO " + dialect.qualifiedTable(mapping.schema(), mapping.table())
        + " (" + String.join(", ", names) + ") VALUES " + String.join(", ", rows);
    return new SqlCommand(CommandKind.BATCH_INSERT, sql, p, SqlCommand.ExecKind.UPDATE, ctx.timeout());
  }

  private SqlCommand update(CommandContext<T> ctx) {
    Instant now = clock.instant();
    T e = ctx.entity();
    Map<String, Object> p = new LinkedHashMap<>();
    for (ColumnDef c : mapping.dataColumns()) {
      if (!c.primaryKey()) p.put(c.parameter(), mapping.valueOf(e, c));
    }
    p.put("@" + SystemColumns.LAST_WRITE_TIME, now);
    mapping.role(ColumnRole.EXPIRATION).ifPresent(x -> p.put(x.parameter(), expiration(e, now)));
    p.putAll(translator.keyParameters(mapping.keyOf(e)));
    p.put(SystemColumns.EXPECTED_VERSION_PARAM, ctx.expectedVersion());
    return new SqlCommand(CommandKind.UPDATE, templates.update(), p, SqlCommand.ExecKind.UPDATE, ctx.timeout());
  }

  private SqlCommand delete(CommandContext<T> ctx) {
    Map<String, Object> p = new LinkedHashMap<>();
    if (mapping.softDelete()) p.put("@" + SystemColumns.LAST_WRITE_TIME, clock.instant());
    p.putAll(translator.keyParameters(ctx.key()));
    p.put(SystemColumns.EXPECTED_VERSION_PARAM, ctx.expectedVersion());
    return new SqlCommand(CommandKind.DELETE, templates.delete(), p, SqlCommand.ExecKind.UPDATE, ctx.timeout());
  }

  private SqlCommand restore(CommandContext<T> ctx) {
    if (templates.restore() == null) {
      throw new IllegalStateException(mapping.type().getSimpleName() + " has no soft delete; nothing to restore");
    }
    Instant now = clock.instant();
    T e = ctx.entity();
    long tombstone = ctx.expectedVersion();
    Map<String, Object> p = new LinkedHashMap<>();
    for (ColumnDef c : mapping.columns()) {
      if (c.primaryKey() || c.role() == ColumnRole.SOFT_DELETE_FLAG) continue;
      p.put(c.parameter(), insertValue(e, c, now, tombstone + 1));
    }
    p.putAll(translator.keyParameters(mapping.keyOf(e)));
    p.put(SystemColumns.EXPECTED_VERSION_PARAM, tombstone);
    return new SqlCommand(CommandKind.RESTORE, templates.restore(), p, SqlCommand.ExecKind.UPDATE, ctx.timeout());
  }

  private SqlCommand purge(CommandContext<T> ctx) {
    return new SqlCommand(CommandKind.PURGE, templates.purge(), translator.keyParameters(ctx.key()),
        SqlCommand.ExecKind.UPDATE, ctx.timeout());
  }

  private SqlCommand select(CommandContext<T> ctx) {
    TranslatedPredicate tp = translator.translateSelect(ctx.key(), null, ctx.options());
    return new SqlCommand(CommandKind.SELECT, tp.sql(), tp.parameters(), SqlCommand.ExecKind.QUERY, ctx.timeout());
  }

  private SqlCommand query(CommandContext<T> ctx) {
    TranslatedPredicate tp = translator.translateSelect(null, ctx.predicate(), ctx.options());
    return new SqlCommand(CommandKind.QUERY, tp.sql(), tp.parameters(), SqlCommand.ExecKind.QUERY, ctx.timeout());
  }

  private SqlCommand count(CommandContext<T> ctx) {
    TranslatedPredicate tp = translator.translateCount(ctx.predicate(), ctx.options());
    return new SqlCommand(CommandKind.COUNT, tp.sql(), tp.parameters(), SqlCommand.ExecKind.QUERY_ONE_VALUE, ctx.timeout());
  }

  private SqlCommand versionProbe(CommandContext<T> ctx) {
    return new SqlCommand(CommandKind.VERSION_PROBE, templates.selectVersion(),
        translator.keyParameters(ctx.key()), SqlCommand.ExecKind.QUERY, ctx.timeout());
  }

  private Object insertValue(T entity, ColumnDef c, Instant now, long version) {
    switch (c.role()) {
      case VERSION: return version;
      case CREATED_TIME:
      case LAST_WRITE_TIME: return now;
      case SOFT_DELETE_FLAG: return Boolean.FALSE;
      case EXPIRATION: return expiration(entity, now);
      default: return mapping.valueOf(entity, c);
    }
  }

  private Instant expiration(T entity, Instant now) {
    Instant own = mapping.expirationOf(entity);
    if (own != null) return own;
    return mapping.expirySpan().map(now::plus).orElse(null);
  }
}
