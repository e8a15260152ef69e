package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.audit.AuditOperation;
import io.intellixity.vellum.persistence.audit.AuditRecord;
import io.intellixity.vellum.persistence.audit.CallerInfo;
import io.intellixity.vellum.persistence.exec.ConcurrencyConflictException;
import io.intellixity.vellum.persistence.exec.EntityAlreadyExistsException;
import io.intellixity.vellum.persistence.exec.EntityNotFoundException;
import io.intellixity.vellum.persistence.exec.PersistenceException;
import io.intellixity.vellum.persistence.exec.StorageException;
import io.intellixity.vellum.persistence.jdbc.audit.AuditTrailWriter;
import io.intellixity.vellum.persistence.jdbc.bulk.*;
import io.intellixity.vellum.persistence.jdbc.command.*;
import io.intellixity.vellum.persistence.mapping.*;
import io.intellixity.vellum.persistence.query.OrderBy;
import io.intellixity.vellum.persistence.query.Predicate;
import io.intellixity.vellum.persistence.query.Predicates;
import io.intellixity.vellum.persistence.query.SelectOptions;
import io.intellixity.vellum.persistence.spi.resilience.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.UnaryOperator;

/**
 * Typed CRUD, query and batch operations for one mapped type.
 *
 * <p>Every call is one unit of work: a fresh connection from the {@link DataSource}, one transaction,
 * rolled back on failure. The whole unit is retried by the {@link ResilientExecutor} when the failure
 * is transient. Storage errors that are not retried, or outlive the retry budget, surface as
 * {@link StorageException} with the driver exception as cause.</p>
 *
 * <p>Audit entries are written after commit and never fail the operation.</p>
 *
 * <p>{@link #inTransaction(TransactionWork)} groups several operations into one transaction; the bulk
 * operations import, export and purge many rows with the same version and audit rules.</p>
 */
public final class JdbcEntityStore<T> {
  private static final Logger log = LoggerFactory.getLogger(JdbcEntityStore.class);

  private final DataSource ds;
  private final EntityMapper<T> mapper;
  private final EntityMapping<T> mapping;
  private final StoreSettings settings;
  private final ResilientExecutor resilient;
  private final JdbcCommandExecutor executor;
  private final AuditTrailWriter audit;
  private final String entityType;

  private JdbcEntityStore(Builder<T> b) {
    this.ds = b.ds;
    this.mapper = b.mapper;
    this.mapping = b.mapper.mapping();
    this.settings = b.settings;
    this.resilient = new ResilientExecutor(settings.retry(), mapper.dialect().errorClassifier(),
        b.retryListeners, b.listenerExecutor);
    this.executor = new JdbcCommandExecutor(mapper.dialect());
    this.entityType = mapping.type().getSimpleName();
    if (!mapping.auditTrail()) {
      this.audit = null;
    } else if (b.auditWriter != null) {
      this.audit = b.auditWriter;
    } else {
      EntityMapping<AuditRecord> auditMapping = b.registry.build(AuditRecord.class);
      this.audit = new AuditTrailWriter(ds, EntityMapper.of(auditMapping, mapper.dialect(), mapper.clock()), resilient);
    }
  }

  public static <T> Builder<T> builder(DataSource ds, EntityMapper<T> mapper) {
    return new Builder<>(ds, mapper);
  }

  public EntityMapper<T> mapper() { return mapper; }
  public StoreSettings settings() { return settings; }
  public ResilientExecutor resilience() { return resilient; }

  /** The audit writer, or null when the mapping has no audit trail. */
  public AuditTrailWriter auditWriter() { return audit; }

  /** Key from positional values in key-column order, for composite keys. */
  public EntityKey key(Object... values) { return mapping.keyOf(values); }

  // ---- schema ----

  /** Creates the table, its indexes and, for audited types, the audit table. Idempotent. */
  public void createSchema() { createSchema(CancellationSignal.none()); }

  public void createSchema(CancellationSignal signal) {
    unitOfWork("createSchema", null, signal, c -> {
      executor.execute(c, mapper.generateCreateTableSql());
      for (String idx : mapper.generateCreateIndexSql()) executor.execute(c, idx);
      if (audit != null) audit.createSchema(c);
      return null;
    });
  }

  // ---- create ----

  /**
   * Inserts at version 1, or revives a tombstone with the same key at its version + 1.
   *
   * @return the entity as stored, including store-managed columns
   * @throws EntityAlreadyExistsException when a live row with the same key exists
   */
  public T create(T entity, CallerInfo caller) { return create(entity, caller, CancellationSignal.none()); }

  public T create(T entity, CallerInfo caller, CancellationSignal signal) {
    Objects.requireNonNull(entity, "entity");
    Object trackKey = mapping.generatedKey().isPresent() ? "new" : mapping.keyOf(entity);
    Written<T> w = unitOfWork("create", trackKey, signal, c -> createIn(c, entity));
    auditWrite(AuditOperation.CREATE, w, caller);
    return w.entity();
  }

  public List<T> createAll(List<T> entities, CallerInfo caller) {
    return createAll(entities, caller, settings.batchSize(), CancellationSignal.none());
  }

  public List<T> createAll(List<T> entities, CallerInfo caller, int batchSize) {
    return createAll(entities, caller, batchSize, CancellationSignal.none());
  }

  /** Creates all entities in one transaction; keys without a row are inserted {@code batchSize} rows per statement. */
  public List<T> createAll(List<T> entities, CallerInfo caller, int batchSize, CancellationSignal signal) {
    Objects.requireNonNull(entities, "entities");
    checkBatchSize(batchSize);
    if (entities.isEmpty()) return List.of();
    List<Imported<T>> imported = unitOfWork("createAll", "batch[" + entities.size() + "]", signal, c -> {
      List<Imported<T>> out = new ArrayList<>(entities.size());
      for (List<T> chunk : chunks(entities, batchSize)) out.addAll(importChunk(c, chunk, ImportConflictMode.FAIL, "createAll"));
      return out;
    });
    List<T> result = new ArrayList<>(imported.size());
    for (Imported<T> i : imported) {
      auditWrite(i.operation(), i.written(), caller);
      result.add(i.written().entity());
    }
    return result;
  }

  // ---- read ----

  /** Live, unexpired entity by key. Audited as READ when the mapping has an audit trail. */
  public Optional<T> get(Object key, CallerInfo caller) { return get(key, caller, CancellationSignal.none()); }

  public Optional<T> get(Object key, CallerInfo caller, CancellationSignal signal) {
    EntityKey k = mapping.keyOf(key);
    Optional<T> found = unitOfWork("get", null, signal, c -> selectOne(c, k, SelectOptions.defaults()));
    found.ifPresent(e -> auditRead(k, e, caller));
    return found;
  }

  /** Rows for a key, optionally including the tombstone and expired rows; empty or one element. */
  public List<T> getByKey(Object key, CallerInfo caller, boolean includeDeleted, boolean includeExpired) {
    return getByKey(key, caller, includeDeleted, includeExpired, CancellationSignal.none());
  }

  public List<T> getByKey(Object key, CallerInfo caller, boolean includeDeleted, boolean includeExpired,
                          CancellationSignal signal) {
    EntityKey k = mapping.keyOf(key);
    SelectOptions o = SelectOptions.defaults().withIncludeDeleted(includeDeleted).withIncludeExpired(includeExpired);
    List<T> rows = unitOfWork("getByKey", null, signal,
        c -> executor.query(c, build(CommandContext.forSelect(k, o)), mapping.reader()));
    if (!rows.isEmpty()) auditRead(k, rows.get(0), caller);
    return rows;
  }

  public List<T> getAll(SelectOptions options) { return getAll(options, CancellationSignal.none()); }

  public List<T> getAll(SelectOptions options, CancellationSignal signal) {
    return query(null, options, signal);
  }

  public List<T> query(Predicate predicate) { return query(predicate, SelectOptions.defaults(), CancellationSignal.none()); }

  public List<T> query(Predicate predicate, OrderBy orderBy, Integer offset, Integer limit) {
    return query(predicate, orderBy, offset, limit, CancellationSignal.none());
  }

  public List<T> query(Predicate predicate, OrderBy orderBy, Integer offset, Integer limit, CancellationSignal signal) {
    SelectOptions o = SelectOptions.defaults().withOrderBy(orderBy).withOffset(offset).withLimit(limit);
    return query(predicate, o, signal);
  }

  public List<T> query(Predicate predicate, SelectOptions options, CancellationSignal signal) {
    SqlCommand cmd = build(CommandContext.forQuery(predicate, options));
    return unitOfWork("query", null, signal, c -> executor.query(c, cmd, mapping.reader()));
  }

  public PagedResult<T> queryPaged(Predicate predicate, int pageSize, int pageNumber, OrderBy orderBy) {
    return queryPaged(predicate, pageSize, pageNumber, orderBy, CancellationSignal.none());
  }

  /**
   * One page of matches plus the total count, read in the same transaction.
   *
   * @param pageNumber 1-based
   */
  public PagedResult<T> queryPaged(Predicate predicate, int pageSize, int pageNumber, OrderBy orderBy,
                                   CancellationSignal signal) {
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be > 0: " + pageSize);
    if (pageNumber < 1) throw new IllegalArgumentException("pageNumber must be > 0: " + pageNumber);
    long offset = (long) (pageNumber - 1) * pageSize;
    if (offset > Integer.MAX_VALUE) throw new IllegalArgumentException("page " + pageNumber + " is out of range");
    SelectOptions o = SelectOptions.defaults().withOrderBy(orderBy).withPage((int) offset, pageSize);
    SqlCommand countCmd = build(CommandContext.forCount(predicate, o));
    SqlCommand pageCmd = build(CommandContext.forQuery(predicate, o));
    return unitOfWork("queryPaged", null, signal, c -> {
      long total = toCount(executor.queryOneValue(c, countCmd));
      List<T> items = executor.query(c, pageCmd, mapping.reader());
      return new PagedResult<>(items, total, pageNumber, pageSize);
    });
  }

  public long count(Predicate predicate) { return count(predicate, CancellationSignal.none()); }

  public long count(Predicate predicate, CancellationSignal signal) {
    SqlCommand cmd = build(CommandContext.forCount(predicate, SelectOptions.defaults()));
    return unitOfWork("count", null, signal, c -> toCount(executor.queryOneValue(c, cmd)));
  }

  public boolean exists(Predicate predicate) { return exists(predicate, CancellationSignal.none()); }

  public boolean exists(Predicate predicate, CancellationSignal signal) {
    return !query(predicate, SelectOptions.defaults().withLimit(1), signal).isEmpty();
  }

  // ---- update ----

  /** Updates at the version the entity was read with; requires a version getter on the mapping. */
  public T update(T entity, CallerInfo caller) { return update(entity, caller, CancellationSignal.none()); }

  public T update(T entity, CallerInfo caller, CancellationSignal signal) {
    return update(entity, requireVersion(entity), caller, signal);
  }

  public T update(T entity, long expectedVersion, CallerInfo caller) {
    return update(entity, expectedVersion, caller, CancellationSignal.none());
  }

  /**
   * @throws ConcurrencyConflictException when the stored version differs from {@code expectedVersion}
   * @throws EntityNotFoundException when no live row exists
   */
  public T update(T entity, long expectedVersion, CallerInfo caller, CancellationSignal signal) {
    Objects.requireNonNull(entity, "entity");
    EntityKey key = mapping.keyOf(entity);
    Written<T> w = unitOfWork("update", key, signal, c -> updateIn(c, entity, key, expectedVersion));
    auditWrite(AuditOperation.UPDATE, w, caller);
    return w.entity();
  }

  public List<T> updateAll(List<T> entities, UnaryOperator<T> updateFn, CallerInfo caller) {
    return updateAll(entities, updateFn, caller, settings.batchSize(), CancellationSignal.none());
  }

  public List<T> updateAll(List<T> entities, UnaryOperator<T> updateFn, CallerInfo caller, int batchSize) {
    return updateAll(entities, updateFn, caller, batchSize, CancellationSignal.none());
  }

  /**
   * Applies {@code updateFn} to each entity and writes the results in one transaction, each at the
   * version of the entity it was derived from. Any conflict rolls back the whole batch.
   */
  public List<T> updateAll(List<T> entities, UnaryOperator<T> updateFn, CallerInfo caller, int batchSize,
                           CancellationSignal signal) {
    Objects.requireNonNull(entities, "entities");
    Objects.requireNonNull(updateFn, "updateFn");
    checkBatchSize(batchSize);
    if (entities.isEmpty()) return List.of();
    List<T> updated = new ArrayList<>(entities.size());
    List<Long> versions = new ArrayList<>(entities.size());
    for (T e : entities) {
      versions.add(requireVersion(e));
      updated.add(Objects.requireNonNull(updateFn.apply(e), "updateFn returned null"));
    }
    List<Written<T>> written = unitOfWork("updateAll", "batch[" + entities.size() + "]", signal, c -> {
      List<Written<T>> out = new ArrayList<>(updated.size());
      int i = 0;
      for (List<T> chunk : chunks(updated, batchSize)) {
        for (T e : chunk) {
          out.add(updateIn(c, e, mapping.keyOf(e), versions.get(i++)));
        }
        if (log.isDebugEnabled()) log.debug("vellum.batch op=updateAll type={} updated={}", entityType, chunk.size());
      }
      return out;
    });
    List<T> result = new ArrayList<>(written.size());
    for (Written<T> w : written) {
      auditWrite(AuditOperation.UPDATE, w, caller);
      result.add(w.entity());
    }
    return result;
  }

  // ---- delete ----

  /**
   * Deletes at the current version. Idempotent.
   *
   * @return false when no live row existed
   */
  public boolean delete(Object key, CallerInfo caller) { return delete(key, caller, CancellationSignal.none()); }

  public boolean delete(Object key, CallerInfo caller, CancellationSignal signal) {
    EntityKey k = mapping.keyOf(key);
    Written<T> w = unitOfWork("delete", k, signal, c -> deleteIn(c, k, null));
    if (w == null) return false;
    auditWrite(AuditOperation.DELETE, w, caller);
    return true;
  }

  public void delete(Object key, long expectedVersion, CallerInfo caller) {
    delete(key, expectedVersion, caller, CancellationSignal.none());
  }

  /**
   * @throws ConcurrencyConflictException when the stored version differs from {@code expectedVersion}
   * @throws EntityNotFoundException when no live row exists
   */
  public void delete(Object key, long expectedVersion, CallerInfo caller, CancellationSignal signal) {
    EntityKey k = mapping.keyOf(key);
    Written<T> w = unitOfWork("delete", k, signal, c -> deleteIn(c, k, expectedVersion));
    auditWrite(AuditOperation.DELETE, w, caller);
  }

  public int deleteAll(List<?> keys, CallerInfo caller) {
    return deleteAll(keys, caller, settings.batchSize(), CancellationSignal.none());
  }

  public int deleteAll(List<?> keys, CallerInfo caller, int batchSize) {
    return deleteAll(keys, caller, batchSize, CancellationSignal.none());
  }

  /** Deletes every live row among {@code keys} in one transaction; missing keys are skipped. */
  public int deleteAll(List<?> keys, CallerInfo caller, int batchSize, CancellationSignal signal) {
    Objects.requireNonNull(keys, "keys");
    checkBatchSize(batchSize);
    if (keys.isEmpty()) return 0;
    List<EntityKey> entityKeys = new ArrayList<>(keys.size());
    for (Object k : keys) entityKeys.add(mapping.keyOf(k));
    List<Written<T>> written = unitOfWork("deleteAll", "batch[" + keys.size() + "]", signal, c -> {
      List<Written<T>> out = new ArrayList<>();
      for (List<EntityKey> chunk : chunks(entityKeys, batchSize)) {
        int before = out.size();
        for (EntityKey k : chunk) {
          Written<T> w = deleteIn(c, k, null);
          if (w != null) out.add(w);
        }
        if (log.isDebugEnabled()) {
          log.debug("vellum.batch op=deleteAll type={} deleted={} skipped={}",
              entityType, out.size() - before, chunk.size() - (out.size() - before));
        }
      }
      return out;
    });
    for (Written<T> w : written) auditWrite(AuditOperation.DELETE, w, caller);
    return written.size();
  }

  // ---- transaction scope ----

  public <R> R inTransaction(TransactionWork<T, R> work) {
    return inTransaction(work, CancellationSignal.none());
  }

  /**
   * Runs {@code work} with a {@link TransactionScope} on one connection and one transaction.
   *
   * <p>Returning normally commits, unless the scope was marked rollback-only; throwing rolls back and
   * rethrows. A transient failure reruns the whole callback on a fresh connection and scope, so the
   * callback should not have effects outside the scope. Queued audit entries are written after commit.</p>
   */
  public <R> R inTransaction(TransactionWork<T, R> work, CancellationSignal signal) {
    Objects.requireNonNull(work, "work");
    ScopedUnit<R> unit = new ScopedUnit<>(work);
    R result;
    try {
      result = unitOfWork("transaction", "transaction", signal, unit);
    } catch (RuntimeException e) {
      unit.finish(TransactionState.FAILED);
      throw e;
    }
    TransactionScope<T> scope = unit.scope;
    if (scope.isRollbackOnly()) {
      scope.moveTo(TransactionState.FAILED);
      log.debug("vellum.transaction_rolled_back type={} tx={}", entityType, scope.transactionId());
      return result;
    }
    scope.moveTo(TransactionState.COMMITTED);
    scope.flushAudit();
    return result;
  }

  /** One attempt of a scoped transaction; a retry replaces the scope. */
  private final class ScopedUnit<R> implements UnitOfWork<R> {
    private final TransactionWork<T, R> work;
    private TransactionScope<T> scope;

    ScopedUnit(TransactionWork<T, R> work) { this.work = work; }

    @Override
    public R run(Connection c) throws SQLException {
      if (scope != null && !scope.state().isTerminal()) scope.moveTo(TransactionState.FAILED);
      scope = new TransactionScope<>(JdbcEntityStore.this, c, mapper.clock().instant());
      R result;
      try {
        result = work.run(scope);
      } catch (SQLException | RuntimeException e) {
        scope.moveTo(TransactionState.ROLLING_BACK);
        throw e;
      }
      scope.moveTo(scope.isRollbackOnly() ? TransactionState.ROLLING_BACK : TransactionState.COMMITTING);
      return result;
    }

    @Override
    public boolean commitAfter() { return !scope.isRollbackOnly(); }

    void finish(TransactionState state) {
      if (scope != null && !scope.state().isTerminal()) scope.moveTo(state);
    }
  }

  // ---- bulk ----

  public BulkImportResult bulkImport(List<T> entities, BulkImportOptions options, CallerInfo caller) {
    return bulkImport(entities, options, caller, CancellationSignal.none());
  }

  /**
   * Writes all entities in one transaction, {@code batchSize} rows per chunk. New keys are inserted,
   * tombstones revived, and live rows handled per {@link ImportConflictMode}. Store-generated keys
   * always insert new rows.
   */
  public BulkImportResult bulkImport(List<T> entities, BulkImportOptions options, CallerInfo caller,
                                     CancellationSignal signal) {
    Objects.requireNonNull(entities, "entities");
    Objects.requireNonNull(options, "options");
    long start = System.nanoTime();
    if (entities.isEmpty()) return new BulkImportResult(0, 0, 0, Duration.ZERO);
    List<Imported<T>> imported = unitOfWork("bulkImport", "bulk[" + entities.size() + "]", signal, c -> {
      List<Imported<T>> out = new ArrayList<>(entities.size());
      for (List<T> chunk : chunks(entities, options.batchSize())) {
        out.addAll(importChunk(c, chunk, options.onConflict(), "bulkImport"));
      }
      return out;
    });
    long inserted = 0;
    long overwritten = 0;
    for (Imported<T> i : imported) {
      if (i.written() == null) continue;
      if (i.operation() == AuditOperation.UPDATE) overwritten++;
      else inserted++;
      auditWrite(i.operation(), i.written(), caller);
    }
    BulkImportResult result = new BulkImportResult(inserted, overwritten, entities.size() - inserted - overwritten, elapsed(start));
    log.info("vellum.bulk_import type={} inserted={} overwritten={} skipped={} elapsedMs={}",
        entityType, result.inserted(), result.overwritten(), result.skipped(), result.duration().toMillis());
    return result;
  }

  public BulkExportResult<T> bulkExport(Predicate predicate, BulkExportOptions options) {
    return bulkExport(predicate, options, CancellationSignal.none());
  }

  /** Reads every match in key order, one page of {@code batchSize} rows at a time, inside one transaction. */
  public BulkExportResult<T> bulkExport(Predicate predicate, BulkExportOptions options, CancellationSignal signal) {
    Objects.requireNonNull(options, "options");
    long start = System.nanoTime();
    SelectOptions base = SelectOptions.defaults()
        .withIncludeDeleted(options.includeDeleted())
        .withIncludeExpired(options.includeExpired())
        .withOrderBy(keyOrder());
    BulkExportResult<T> result = unitOfWork("bulkExport", null, signal, c -> {
      List<T> out = new ArrayList<>();
      int pages = 0;
      for (int offset = 0; ; offset += options.batchSize()) {
        signal.throwIfCancelled();
        List<T> page = queryIn(c, predicate, base.withPage(offset, options.batchSize()));
        pages++;
        out.addAll(page);
        if (page.size() < options.batchSize()) break;
      }
      return new BulkExportResult<>(out, pages, elapsed(start));
    });
    log.info("vellum.bulk_export type={} exported={} pages={} elapsedMs={}",
        entityType, result.count(), result.pages(), result.duration().toMillis());
    return result;
  }

  public PurgeResult purge(PurgeOptions options, CallerInfo caller) {
    return purge(options, caller, CancellationSignal.none());
  }

  /**
   * Physically removes tombstones and/or expired rows. Each batch commits on its own, so an interrupted
   * purge keeps what it removed and can simply be run again. Each removed row is audited as DELETE
   * with the row as old value.
   *
   * @throws IllegalArgumentException when the strategy needs soft delete or expiry the mapping lacks
   */
  public PurgeResult purge(PurgeOptions options, CallerInfo caller, CancellationSignal signal) {
    Objects.requireNonNull(options, "options");
    long start = System.nanoTime();
    Predicate candidates = purgeCandidates(options, mapper.clock().instant());
    SelectOptions all = everything();

    if (options.preview()) {
      SqlCommand cmd = build(CommandContext.forCount(candidates, all));
      long n = unitOfWork("purgePreview", null, signal, c -> toCount(executor.queryOneValue(c, cmd)));
      return new PurgeResult(n, 0, true, elapsed(start));
    }

    long purged = 0;
    int batches = 0;
    while (true) {
      List<Written<T>> batch = unitOfWork("purge", "purge", signal, c -> {
        List<T> rows = queryIn(c, candidates, all.withLimit(options.batchSize()));
        List<Written<T>> out = new ArrayList<>(rows.size());
        for (T row : rows) {
          EntityKey key = mapping.keyOf(row);
          executor.update(c, build(CommandContext.forPurge(key)));
          out.add(new Written<>(key, null, null, mapping.versionOf(row), row));
        }
        return out;
      });
      if (batch.isEmpty()) break;
      batches++;
      purged += batch.size();
      for (Written<T> w : batch) auditWrite(AuditOperation.DELETE, w, caller);
      if (log.isDebugEnabled()) log.debug("vellum.batch op=purge type={} purged={}", entityType, batch.size());
      if (batch.size() < options.batchSize()) break;
    }
    PurgeResult result = new PurgeResult(purged, batches, false, elapsed(start));
    log.info("vellum.purge type={} strategy={} purged={} batches={} elapsedMs={}",
        entityType, options.strategy(), purged, batches, result.duration().toMillis());
    return result;
  }

  private Predicate purgeCandidates(PurgeOptions options, Instant now) {
    Predicate deleted = mapping.softDelete() ? Predicates.eq(SystemColumns.IS_DELETED, true) : null;
    Predicate expired = mapping.expires()
        ? Predicates.and(Predicates.isNotNull(SystemColumns.ABSOLUTE_EXPIRATION),
            Predicates.le(SystemColumns.ABSOLUTE_EXPIRATION, now))
        : null;
    Predicate p;
    switch (options.strategy()) {
      case DELETED_ONLY:
        if (deleted == null) throw new IllegalArgumentException(entityType + " has no soft delete; nothing to purge");
        p = deleted;
        break;
      case EXPIRED:
        if (expired == null) throw new IllegalArgumentException(entityType + " does not expire; nothing to purge");
        p = expired;
        break;
      default:
        if (deleted == null && expired == null) {
          throw new IllegalArgumentException(entityType + " has neither soft delete nor expiry; nothing to purge");
        }
        p = deleted == null ? expired : expired == null ? deleted : Predicates.or(deleted, expired);
    }
    Instant cutoff = options.effectiveCutoff(now);
    if (cutoff != null) p = Predicates.and(p, Predicates.lt(SystemColumns.LAST_WRITE_TIME, cutoff));
    if (options.filter() != null) p = Predicates.and(p, options.filter());
    return p;
  }

  /**
   * Writes one chunk; results keep input order. A slot's {@code written} is null when the entity was
   * skipped under {@link ImportConflictMode#SKIP}.
   */
  private List<Imported<T>> importChunk(Connection c, List<T> chunk, ImportConflictMode mode, String op)
      throws SQLException {
    List<Imported<T>> slots = new ArrayList<>(Collections.nCopies(chunk.size(), null));
    if (mapping.generatedKey().isPresent()) {
      for (int i = 0; i < chunk.size(); i++) slots.set(i, new Imported<>(AuditOperation.CREATE, createIn(c, chunk.get(i))));
      return slots;
    }
    List<T> fresh = new ArrayList<>();
    int overwritten = 0;
    int skipped = 0;
    for (int i = 0; i < chunk.size(); i++) {
      T e = chunk.get(i);
      EntityKey key = mapping.keyOf(e);
      Optional<RowVersion> cur = probe(c, key);
      if (cur.isEmpty()) {
        fresh.add(e);
      } else if (cur.get().deleted()) {
        slots.set(i, new Imported<>(AuditOperation.CREATE, restoreIn(c, e, key, cur.get().version())));
      } else if (mode == ImportConflictMode.OVERWRITE) {
        slots.set(i, new Imported<>(AuditOperation.UPDATE, updateIn(c, e, key, cur.get().version())));
        overwritten++;
      } else if (mode == ImportConflictMode.SKIP) {
        slots.set(i, new Imported<>(AuditOperation.CREATE, null));
        skipped++;
      } else {
        throw new EntityAlreadyExistsException(entityType, key);
      }
    }
    // Fresh rows go in as one multi-row insert, then fill their slots
    if (!fresh.isEmpty()) executor.update(c, build(CommandContext.forBatchInsert(fresh)));
    for (int i = 0; i < chunk.size(); i++) {
      if (slots.get(i) == null) {
        EntityKey key = mapping.keyOf(chunk.get(i));
        slots.set(i, new Imported<>(AuditOperation.CREATE, new Written<>(key, reread(c, key), 1L, null, null)));
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("vellum.batch op={} type={} inserted={} overwritten={} skipped={}",
          op, entityType, fresh.size(), overwritten, skipped);
    }
    return slots;
  }

  private OrderBy keyOrder() {
    List<ColumnDef> keys = mapping.keyColumns();
    OrderBy o = OrderBy.by(keys.get(0).field());
    for (int i = 1; i < keys.size(); i++) o = o.thenBy(keys.get(i).field());
    return o;
  }

  // ---- units of work ----

  Written<T> createIn(Connection c, T entity) throws SQLException {
    Optional<ColumnDef> generated = mapping.generatedKey();
    if (generated.isPresent()) {
      SqlCommand cmd = build(CommandContext.forInsert(entity));
      Object id = executor.insertReturningKey(c, cmd, generated.get());
      if (id == null) throw new PersistenceException("No generated key returned for " + entityType);
      EntityKey key = EntityKey.of(generated.get().column(), generatedKeyValue(id, generated.get()));
      return new Written<>(key, reread(c, key), 1L, null, null);
    }

    EntityKey key = mapping.keyOf(entity);
    Optional<RowVersion> cur = probe(c, key);
    if (cur.isPresent()) {
      if (!cur.get().deleted()) throw new EntityAlreadyExistsException(entityType, key);
      return restoreIn(c, entity, key, cur.get().version());
    }
    try {
      executor.update(c, build(CommandContext.forInsert(entity)));
    } catch (SQLException e) {
      // Lost a race with a concurrent create of the same key
      if (isPrimaryKeyViolation(e)) {
        EntityAlreadyExistsException ex = new EntityAlreadyExistsException(entityType, key);
        ex.initCause(e);
        throw ex;
      }
      throw e;
    }
    return new Written<>(key, reread(c, key), 1L, null, null);
  }

  private Written<T> restoreIn(Connection c, T entity, EntityKey key, long tombstoneVersion) throws SQLException {
    T old = audit == null ? null : selectOne(c, key, everything()).orElse(null);
    int n = executor.update(c, build(CommandContext.forRestore(entity, tombstoneVersion)));
    if (n == 0) throw ConcurrencyGuard.explainZeroRows(entityType, key, tombstoneVersion, probe(c, key));
    return new Written<>(key, reread(c, key), tombstoneVersion + 1, tombstoneVersion, old);
  }

  Written<T> updateIn(Connection c, T entity, EntityKey key, long expectedVersion) throws SQLException {
    T old = audit == null ? null : selectOne(c, key, everything()).orElse(null);
    int n = executor.update(c, build(CommandContext.forUpdate(entity, expectedVersion)));
    if (n == 0) throw ConcurrencyGuard.explainZeroRows(entityType, key, expectedVersion, probe(c, key));
    return new Written<>(key, reread(c, key), expectedVersion + 1, expectedVersion, old);
  }

  /** Null when {@code expectedVersion} is null and there is no live row to delete. */
  Written<T> deleteIn(Connection c, EntityKey key, Long expectedVersion) throws SQLException {
    long expected;
    if (expectedVersion == null) {
      Optional<RowVersion> cur = probe(c, key);
      if (cur.isEmpty() || cur.get().deleted()) return null;
      expected = cur.get().version();
    } else {
      expected = expectedVersion;
    }
    T old = audit == null ? null : selectOne(c, key, everything()).orElse(null);
    int n = executor.update(c, build(CommandContext.forDelete(key, expected)));
    if (n == 0) throw ConcurrencyGuard.explainZeroRows(entityType, key, expected, probe(c, key));
    Long newVersion = mapping.softDelete() ? expected + 1 : null;
    return new Written<>(key, null, newVersion, expected, old);
  }

  Optional<T> selectOne(Connection c, EntityKey key, SelectOptions options) throws SQLException {
    List<T> rows = executor.query(c, build(CommandContext.forSelect(key, options)), mapping.reader());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Row just written in this transaction; expiry is ignored so a past expiration still reads back. */
  private T reread(Connection c, EntityKey key) throws SQLException {
    return selectOne(c, key, SelectOptions.defaults().withIncludeExpired(true))
        .orElseThrow(() -> new EntityNotFoundException(entityType, key));
  }

  List<T> queryIn(Connection c, Predicate predicate, SelectOptions options) throws SQLException {
    return executor.query(c, build(CommandContext.forQuery(predicate, options)), mapping.reader());
  }

  long countIn(Connection c, Predicate predicate) throws SQLException {
    return toCount(executor.queryOneValue(c, build(CommandContext.forCount(predicate, SelectOptions.defaults()))));
  }

  private Optional<RowVersion> probe(Connection c, EntityKey key) throws SQLException {
    return executor.probeVersion(c, build(CommandContext.forVersionProbe(key)), mapping.versionColumn().column());
  }

  private SqlCommand build(CommandContext<T> ctx) {
    return mapper.commandBuilder().build(ctx.withTimeout(settings.commandTimeout()));
  }

  @FunctionalInterface
  private interface UnitOfWork<R> {
    R run(Connection c) throws SQLException;

    /** False rolls back a unit that completed normally. */
    default boolean commitAfter() { return true; }
  }

  /**
   * Runs {@code work} in its own connection and transaction under the retry policy.
   *
   * @param trackKey key reported by the {@link WriteTracker}; null for reads, which are not tracked
   */
  private <R> R unitOfWork(String op, Object trackKey, CancellationSignal signal, UnitOfWork<R> work) {
    try {
      return resilient.execute(op, () -> {
        WriteTracker tracker = trackKey == null ? null : new WriteTracker(mapping.table(), trackKey);
        try (Connection c = ds.getConnection()) {
          c.setAutoCommit(false);
          if (tracker != null) tracker.executing();
          R result;
          boolean commit;
          try {
            result = work.run(c);
            commit = work.commitAfter();
            if (commit) c.commit();
            else c.rollback();
          } catch (SQLException | RuntimeException e) {
            rollback(c, e);
            throw e;
          }
          // A deliberate rollback leaves the tracker open; nothing was written
          if (tracker != null && commit) tracker.committed();
          return result;
        } catch (SQLException | RuntimeException e) {
          if (tracker != null) settle(tracker, e);
          throw e;
        }
      }, signal);
    } catch (SQLException e) {
      throw new StorageException(op + " failed for " + entityType + ": " + e.getMessage(), e);
    }
  }

  private static void settle(WriteTracker tracker, Exception e) {
    if (tracker.state() == WriteState.EXECUTING) {
      if (e instanceof ConcurrencyConflictException) {
        tracker.conflict();
        return;
      }
      if (e instanceof EntityNotFoundException) {
        tracker.notFound();
        return;
      }
    }
    tracker.faultIfOpen();
  }

  private static void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException re) {
      cause.addSuppressed(re);
    }
  }

  // ---- audit ----

  void auditWrite(AuditOperation op, Written<T> w, CallerInfo caller) {
    if (audit == null) return;
    audit.write(entityType, w.key(), op, w.version(), w.oldVersion(), w.old(), w.entity(), caller);
  }

  void auditRead(EntityKey key, T entity, CallerInfo caller) {
    if (audit == null) return;
    audit.write(entityType, key, AuditOperation.READ, mapping.versionOf(entity), null, null, entity, caller);
  }

  // ---- helpers ----

  /** Outcome of one write; {@code entity} is the row as stored, null after a delete. */
  record Written<T>(EntityKey key, T entity, Long version, Long oldVersion, T old) {}

  /** A write with the audit operation it is recorded under; {@code written} is null for a skipped entity. */
  private record Imported<T>(AuditOperation operation, Written<T> written) {}

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  Long requireVersion(T entity) {
    Long v = mapping.versionOf(entity);
    if (v == null) {
      throw new IllegalArgumentException(entityType + " mapping has no version getter or the entity version is null; "
          + "pass the expected version explicitly");
    }
    return v;
  }

  private static SelectOptions everything() {
    return SelectOptions.defaults().withIncludeDeleted(true).withIncludeExpired(true);
  }

  private static Object generatedKeyValue(Object raw, ColumnDef key) {
    return key.type() == ColumnType.INTEGER ? Coercions.toInteger(raw) : Coercions.toLong(raw);
  }

  private static long toCount(Object v) {
    Long n = Coercions.toLong(v);
    return n == null ? 0 : n;
  }

  /** Primary-key violation: PostgreSQL {@code 23505} on a {@code _pkey} constraint, or SQLite's extended code. */
  private static boolean isPrimaryKeyViolation(SQLException e) {
    String m = e.getMessage();
    if (m == null) return false;
    if ("23505".equals(e.getSQLState())) return m.contains("_pkey");
    return m.contains("SQLITE_CONSTRAINT_PRIMARYKEY");
  }

  private static void checkBatchSize(int batchSize) {
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
  }

  private static <E> List<List<E>> chunks(List<E> items, int size) {
    List<List<E>> out = new ArrayList<>();
    for (int i = 0; i < items.size(); i += size) out.add(items.subList(i, Math.min(items.size(), i + size)));
    return out;
  }

  public static final class Builder<T> {
    private final DataSource ds;
    private final EntityMapper<T> mapper;
    private StoreSettings settings = StoreSettings.defaults();
    private List<RetryListener> retryListeners = List.of(new LoggingRetryListener());
    private Executor listenerExecutor = ForkJoinPool.commonPool();
    private AuditTrailWriter auditWriter;
    private MappingRegistry registry = MappingRegistry.global();

    private Builder(DataSource ds, EntityMapper<T> mapper) {
      this.ds = Objects.requireNonNull(ds, "ds");
      this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Builder<T> settings(StoreSettings settings) {
      this.settings = Objects.requireNonNull(settings, "settings");
      return this;
    }

    public Builder<T> retryListeners(List<RetryListener> listeners) {
      this.retryListeners = List.copyOf(listeners);
      return this;
    }

    public Builder<T> listenerExecutor(Executor executor) {
      this.listenerExecutor = Objects.requireNonNull(executor, "executor");
      return this;
    }

    /** Writer for audited types; defaults to one on the store's data source. */
    public Builder<T> auditWriter(AuditTrailWriter writer) {
      this.auditWriter = writer;
      return this;
    }

    /** Registry that resolves the {@link AuditRecord} mapping; defaults to {@link MappingRegistry#global()}. */
    public Builder<T> registry(MappingRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
      return this;
    }

    public JdbcEntityStore<T> build() {
      return new JdbcEntityStore<>(this);
    }
  }
}
