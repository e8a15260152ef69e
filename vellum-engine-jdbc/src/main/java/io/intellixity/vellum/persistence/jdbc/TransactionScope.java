package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.audit.AuditOperation;
import io.intellixity.vellum.persistence.audit.CallerInfo;
import io.intellixity.vellum.persistence.exec.ConcurrencyConflictException;
import io.intellixity.vellum.persistence.exec.EntityAlreadyExistsException;
import io.intellixity.vellum.persistence.exec.EntityNotFoundException;
import io.intellixity.vellum.persistence.mapping.EntityKey;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.query.Predicate;
import io.intellixity.vellum.persistence.query.SelectOptions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes of one store sharing a connection and a transaction.
 *
 * <p>Handed to the callback of {@link JdbcEntityStore#inTransaction(TransactionWork)} and usable only
 * while it runs. Writes follow the same version rules as the store's own methods. Audit entries are
 * queued and written once the transaction commits; a rolled-back scope leaves no audit trail.</p>
 *
 * <p>Driver errors propagate as {@link SQLException} so the store can classify and retry the whole
 * callback; {@link JdbcEntityStore#inTransaction} wraps whatever is left in a {@code StorageException}.</p>
 */
public final class TransactionScope<T> {
  private final JdbcEntityStore<T> store;
  private final EntityMapping<T> mapping;
  private final Connection connection;
  private final String transactionId = UUID.randomUUID().toString();
  private final Instant startTime;
  private final List<Runnable> pendingAudit = new ArrayList<>();
  private TransactionState state = TransactionState.ACTIVE;
  private boolean rollbackOnly;

  TransactionScope(JdbcEntityStore<T> store, Connection connection, Instant startTime) {
    this.store = store;
    this.mapping = store.mapper().mapping();
    this.connection = connection;
    this.startTime = startTime;
  }

  public String transactionId() { return transactionId; }
  public Instant startTime() { return startTime; }
  public TransactionState state() { return state; }

  /** Rolls the transaction back when the callback returns, instead of committing it. */
  public void setRollbackOnly() {
    checkActive();
    rollbackOnly = true;
  }

  public boolean isRollbackOnly() { return rollbackOnly; }

  /** @throws EntityAlreadyExistsException when a live row with the same key exists */
  public T create(T entity, CallerInfo caller) throws SQLException {
    checkActive();
    JdbcEntityStore.Written<T> w = store.createIn(connection, Objects.requireNonNull(entity, "entity"));
    pendingAudit.add(() -> store.auditWrite(AuditOperation.CREATE, w, caller));
    return w.entity();
  }

  public Optional<T> get(Object key, CallerInfo caller) throws SQLException {
    checkActive();
    EntityKey k = mapping.keyOf(key);
    Optional<T> found = store.selectOne(connection, k, SelectOptions.defaults());
    found.ifPresent(e -> pendingAudit.add(() -> store.auditRead(k, e, caller)));
    return found;
  }

  /** Updates at the version the entity carries. */
  public T update(T entity, CallerInfo caller) throws SQLException {
    return update(entity, store.requireVersion(entity), caller);
  }

  /**
   * @throws ConcurrencyConflictException when the stored version differs from {@code expectedVersion}
   * @throws EntityNotFoundException when no live row exists
   */
  public T update(T entity, long expectedVersion, CallerInfo caller) throws SQLException {
    checkActive();
    Objects.requireNonNull(entity, "entity");
    JdbcEntityStore.Written<T> w = store.updateIn(connection, entity, mapping.keyOf(entity), expectedVersion);
    pendingAudit.add(() -> store.auditWrite(AuditOperation.UPDATE, w, caller));
    return w.entity();
  }

  /** @return false when no live row existed */
  public boolean delete(Object key, CallerInfo caller) throws SQLException {
    checkActive();
    JdbcEntityStore.Written<T> w = store.deleteIn(connection, mapping.keyOf(key), null);
    if (w == null) return false;
    pendingAudit.add(() -> store.auditWrite(AuditOperation.DELETE, w, caller));
    return true;
  }

  public void delete(Object key, long expectedVersion, CallerInfo caller) throws SQLException {
    checkActive();
    JdbcEntityStore.Written<T> w = store.deleteIn(connection, mapping.keyOf(key), expectedVersion);
    pendingAudit.add(() -> store.auditWrite(AuditOperation.DELETE, w, caller));
  }

  /** Sees this transaction's own uncommitted writes. */
  public List<T> query(Predicate predicate, SelectOptions options) throws SQLException {
    checkActive();
    return store.queryIn(connection, predicate, options);
  }

  public long count(Predicate predicate) throws SQLException {
    checkActive();
    return store.countIn(connection, predicate);
  }

  void moveTo(TransactionState next) {
    if (state.isTerminal()) {
      throw new IllegalStateException("Transaction " + transactionId + " is already " + state);
    }
    state = next;
  }

  /** Writes the queued audit entries; called once, after commit. */
  void flushAudit() {
    for (Runnable r : pendingAudit) r.run();
    pendingAudit.clear();
  }

  private void checkActive() {
    if (state != TransactionState.ACTIVE) {
      throw new IllegalStateException("Transaction " + transactionId + " is " + state + ", not ACTIVE");
    }
  }
}
