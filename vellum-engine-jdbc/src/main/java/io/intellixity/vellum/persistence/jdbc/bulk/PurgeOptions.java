package io.intellixity.vellum.persistence.jdbc.bulk;

import io.intellixity.vellum.persistence.query.Predicate;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Options of {@code JdbcEntityStore.purge}.
 *
 * @param olderThan only rows last written more than this long ago; null for no age limit
 * @param cutoff only rows last written before this instant; exclusive with {@code olderThan}
 * @param filter extra predicate over the candidates; null for none
 * @param preview count the candidates without deleting anything
 * @param batchSize rows deleted per transaction
 */
public record PurgeOptions(
    PurgeStrategy strategy,
    Duration olderThan,
    Instant cutoff,
    Predicate filter,
    boolean preview,
    int batchSize
) {
  public static final int DEFAULT_BATCH_SIZE = 1000;

  public PurgeOptions {
    Objects.requireNonNull(strategy, "strategy");
    if (olderThan != null && (olderThan.isNegative() || olderThan.isZero())) {
      throw new IllegalArgumentException("olderThan must be positive: " + olderThan);
    }
    if (olderThan != null && cutoff != null) {
      throw new IllegalArgumentException("olderThan and cutoff are mutually exclusive");
    }
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
  }

  public static PurgeOptions of(PurgeStrategy strategy) {
    return new PurgeOptions(strategy, null, null, null, false, DEFAULT_BATCH_SIZE);
  }

  public PurgeOptions withOlderThan(Duration v) { return new PurgeOptions(strategy, v, cutoff, filter, preview, batchSize); }
  public PurgeOptions withCutoff(Instant v) { return new PurgeOptions(strategy, olderThan, v, filter, preview, batchSize); }
  public PurgeOptions withFilter(Predicate v) { return new PurgeOptions(strategy, olderThan, cutoff, v, preview, batchSize); }
  public PurgeOptions withPreview(boolean v) { return new PurgeOptions(strategy, olderThan, cutoff, filter, v, batchSize); }
  public PurgeOptions withBatchSize(int v) { return new PurgeOptions(strategy, olderThan, cutoff, filter, preview, v); }

  /** Upper bound on {@code LastWriteTime} at {@code now}, or null when age does not matter. */
  public Instant effectiveCutoff(Instant now) {
    if (cutoff != null) return cutoff;
    return olderThan == null ? null : now.minus(olderThan);
  }
}
