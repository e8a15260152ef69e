package io.intellixity.vellum.persistence.jdbc.sqlite;

import io.intellixity.vellum.persistence.jdbc.StoreSettings;
import io.intellixity.vellum.persistence.spi.config.JsonConfigLoader;
import io.intellixity.vellum.persistence.spi.resilience.RetryConfiguration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * SQLite connection, pragma and store settings.
 *
 * @param cacheSize {@code PRAGMA cache_size}; negative values are KiB, positive values are pages
 * @param commandTimeoutSeconds per-attempt statement timeout; 0 disables it
 */
public record SqliteConfiguration(
    String dbFile,
    int cacheSize,
    int pageSize,
    String journalMode,
    String synchronous,
    int busyTimeoutMs,
    boolean foreignKeys,
    int commandTimeoutSeconds,
    int batchSize,
    int maximumPoolSize,
    RetryConfiguration retry
) {
  public static final String FILE_NAME = "vellum-sqlite.json";
  public static final String SECTION = "sqlite";

  private static final Set<String> JOURNAL_MODES = Set.of("DELETE", "TRUNCATE", "PERSIST", "MEMORY", "WAL", "OFF");
  private static final Set<String> SYNC_MODES = Set.of("OFF", "NORMAL", "FULL");

  public SqliteConfiguration {
    if (dbFile == null || dbFile.isBlank()) throw new IllegalArgumentException("dbFile is required");
    if (pageSize < 512 || pageSize > 65536 || Integer.bitCount(pageSize) != 1) {
      throw new IllegalArgumentException("pageSize must be a power of two between 512 and 65536: " + pageSize);
    }
    journalMode = Objects.requireNonNull(journalMode, "journalMode").toUpperCase(Locale.ROOT);
    if (!JOURNAL_MODES.contains(journalMode)) throw new IllegalArgumentException("Unknown journalMode: " + journalMode);
    synchronous = Objects.requireNonNull(synchronous, "synchronous").toUpperCase(Locale.ROOT);
    if (!SYNC_MODES.contains(synchronous)) throw new IllegalArgumentException("Unknown synchronous mode: " + synchronous);
    if (busyTimeoutMs < 0) throw new IllegalArgumentException("busyTimeoutMs must be >= 0: " + busyTimeoutMs);
    if (commandTimeoutSeconds < 0) throw new IllegalArgumentException("commandTimeoutSeconds must be >= 0: " + commandTimeoutSeconds);
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
    if (maximumPoolSize < 1) throw new IllegalArgumentException("maximumPoolSize must be >= 1: " + maximumPoolSize);
    retry = retry == null ? RetryConfiguration.defaults() : retry;
  }

  public static SqliteConfiguration defaults(String dbFile) {
    return new SqliteConfiguration(dbFile, -2000, 4096, "WAL", "NORMAL", 5000, true, 30, 100, 4,
        RetryConfiguration.defaults());
  }

  public static SqliteConfiguration defaults() { return defaults("vellum.db"); }

  /** Reads {@code {"sqlite": {...}}} or a root-level object over the defaults; a missing file yields the defaults. */
  public static SqliteConfiguration fromJsonFile(Path file) {
    return JsonConfigLoader.defaults().load(file, defaults(), SqliteConfiguration.class, SECTION);
  }

  public static SqliteConfiguration fromJsonFileRequired(Path file) {
    return JsonConfigLoader.defaults().loadRequired(file, defaults(), SqliteConfiguration.class, SECTION);
  }

  public static SqliteConfiguration fromJson(String json) {
    return JsonConfigLoader.defaults().load(json, defaults(), SqliteConfiguration.class, SECTION);
  }

  public SqliteConfiguration withDbFile(String dbFile) {
    return new SqliteConfiguration(dbFile, cacheSize, pageSize, journalMode, synchronous, busyTimeoutMs,
        foreignKeys, commandTimeoutSeconds, batchSize, maximumPoolSize, retry);
  }

  public SqliteConfiguration withRetry(RetryConfiguration retry) {
    return new SqliteConfiguration(dbFile, cacheSize, pageSize, journalMode, synchronous, busyTimeoutMs,
        foreignKeys, commandTimeoutSeconds, batchSize, maximumPoolSize, retry);
  }

  public String jdbcUrl() { return "jdbc:sqlite:" + dbFile; }

  public StoreSettings storeSettings() {
    return new StoreSettings(Duration.ofSeconds(commandTimeoutSeconds), batchSize, retry);
  }
}
