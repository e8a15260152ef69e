package io.intellixity.vellum.persistence.jdbc.command;

import io.intellixity.vellum.persistence.mapping.EntityKey;
import io.intellixity.vellum.persistence.query.Predicate;
import io.intellixity.vellum.persistence.query.SelectOptions;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Inputs of one command. Built per call and consumed by exactly one {@link CommandBuilder#build}.
 */
public final class CommandContext<T> {
  private final CommandKind kind;
  private final T entity;
  private final List<T> entities;
  private final EntityKey key;
  private final Predicate predicate;
  private final SelectOptions options;
  private final Long expectedVersion;
  private final Duration timeout;
  private final AtomicBoolean consumed = new AtomicBoolean();

  private CommandContext(CommandKind kind, T entity, List<T> entities, EntityKey key, Predicate predicate,
                         SelectOptions options, Long expectedVersion, Duration timeout) {
    this.kind = kind;
    this.entity = entity;
    this.entities = entities;
    this.key = key;
    this.predicate = predicate;
    this.options = options;
    this.expectedVersion = expectedVersion;
    this.timeout = timeout;
  }

  public static <T> CommandContext<T> forInsert(T entity) {
    return new CommandContext<>(CommandKind.INSERT, Objects.requireNonNull(entity, "entity"),
        null, null, null, null, null, null);
  }

  public static <T> CommandContext<T> forBatchInsert(List<T> entities) {
    Objects.requireNonNull(entities, "entities");
    if (entities.isEmpty()) throw new IllegalArgumentException("Batch insert needs at least one entity");
    return new CommandContext<>(CommandKind.BATCH_INSERT, null, List.copyOf(entities), null, null, null, null, null);
  }

  public static <T> CommandContext<T> forUpdate(T entity, long expectedVersion) {
    return new CommandContext<>(CommandKind.UPDATE, Objects.requireNonNull(entity, "entity"),
        null, null, null, null, checkVersion(expectedVersion), null);
  }

  public static <T> CommandContext<T> forDelete(EntityKey key, long expectedVersion) {
    return new CommandContext<>(CommandKind.DELETE, null, null, Objects.requireNonNull(key, "key"),
        null, null, checkVersion(expectedVersion), null);
  }

  /** Revives a tombstone in place; the new version is {@code tombstoneVersion + 1}. */
  public static <T> CommandContext<T> forRestore(T entity, long tombstoneVersion) {
    return new CommandContext<>(CommandKind.RESTORE, Objects.requireNonNull(entity, "entity"),
        null, null, null, null, checkVersion(tombstoneVersion), null);
  }

  /** Physical delete by key with no version guard; used to purge tombstones and expired rows. */
  public static <T> CommandContext<T> forPurge(EntityKey key) {
    return new CommandContext<>(CommandKind.PURGE, null, null, Objects.requireNonNull(key, "key"),
        null, null, null, null);
  }

  public static <T> CommandContext<T> forSelect(EntityKey key, SelectOptions options) {
    return new CommandContext<>(CommandKind.SELECT, null, null, Objects.requireNonNull(key, "key"),
        null, orDefaults(options), null, null);
  }

  public static <T> CommandContext<T> forQuery(Predicate predicate, SelectOptions options) {
    return new CommandContext<>(CommandKind.QUERY, null, null, null, predicate, orDefaults(options), null, null);
  }

  public static <T> CommandContext<T> forCount(Predicate predicate, SelectOptions options) {
    return new CommandContext<>(CommandKind.COUNT, null, null, null, predicate, orDefaults(options), null, null);
  }

  public static <T> CommandContext<T> forVersionProbe(EntityKey key) {
    return new CommandContext<>(CommandKind.VERSION_PROBE, null, null, Objects.requireNonNull(key, "key"),
        null, null, null, null);
  }

  /** Copy with a per-attempt statement timeout. */
  public CommandContext<T> withTimeout(Duration timeout) {
    if (timeout != null && timeout.isNegative()) throw new IllegalArgumentException("timeout must be >= 0: " + timeout);
    return new CommandContext<>(kind, entity, entities, key, predicate, options, expectedVersion, timeout);
  }

  public CommandKind kind() { return kind; }
  public T entity() { return entity; }
  public List<T> entities() { return entities; }
  public EntityKey key() { return key; }
  public Predicate predicate() { return predicate; }
  public SelectOptions options() { return options; }
  public Long expectedVersion() { return expectedVersion; }
  public Duration timeout() { return timeout; }

  void consume() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException(kind + " command context was already used to build a command");
    }
  }

  private static long checkVersion(long v) {
    if (v < 1) throw new IllegalArgumentException("versions start at 1: " + v);
    return v;
  }

  private static SelectOptions orDefaults(SelectOptions o) {
    return o == null ? SelectOptions.defaults() : o;
  }
}
