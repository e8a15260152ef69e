package io.intellixity.vellum.persistence.jdbc.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.util.Objects;

/** Pooled SQLite data sources; every pooled connection carries the configured pragmas. */
public final class SqliteDataSources {
  private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

  private SqliteDataSources() {}

  public static HikariDataSource create(SqliteConfiguration config) {
    Objects.requireNonNull(config, "config");
    SQLiteDataSource sqlite = new SQLiteDataSource(pragmas(config));
    sqlite.setUrl(config.jdbcUrl());

    HikariConfig hc = new HikariConfig();
    hc.setDataSource(sqlite);
    hc.setPoolName("vellum-sqlite");
    hc.setMaximumPoolSize(config.maximumPoolSize());
    hc.setMinimumIdle(1);
    if (log.isDebugEnabled()) {
      log.debug("vellum.sqlite_pool url={} maxPoolSize={} journalMode={} synchronous={} busyTimeoutMs={}",
          config.jdbcUrl(), config.maximumPoolSize(), config.journalMode(), config.synchronous(), config.busyTimeoutMs());
    }
    return new HikariDataSource(hc);
  }

  static SQLiteConfig pragmas(SqliteConfiguration config) {
    SQLiteConfig sc = new SQLiteConfig();
    sc.setCacheSize(config.cacheSize());
    sc.setPageSize(config.pageSize());
    sc.setJournalMode(SQLiteConfig.JournalMode.valueOf(config.journalMode()));
    sc.setSynchronous(SQLiteConfig.SynchronousMode.valueOf(config.synchronous()));
    sc.setBusyTimeout(config.busyTimeoutMs());
    sc.enforceForeignKeys(config.foreignKeys());
    return sc;
  }
}
