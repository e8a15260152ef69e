package io.intellixity.vellum.persistence.jdbc.sqlite;

import io.intellixity.vellum.persistence.jdbc.ddl.SchemaGenerator;
import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private final SqliteDialect dialect = new SqliteDialect();

  enum Mode { WAL }

  record Event(Long id, String kind, Boolean active, Double score, BigDecimal price, Instant at, UUID ref, byte[] body) {}

  @Test
  void quotesOnlyReservedOrIrregularIdentifiers() {
    assertEquals("Name", dialect.quoteIdent("Name"));
    assertEquals("[Order]", dialect.quoteIdent("Order"));
    assertEquals("[group]", dialect.quoteIdent("group"));
    assertEquals("[Line Item]", dialect.quoteIdent("Line Item"));
    assertEquals("[2fa]", dialect.quoteIdent("2fa"));
    assertEquals("[a]]b]", dialect.quoteIdent("a]b"));
    assertEquals("main.[Table]", dialect.qualifiedTable("main", "Table"));
  }

  @Test
  void encodesParametersAsSqliteStorageClasses() {
    assertEquals(1, dialect.toParameter(true));
    assertEquals(0, dialect.toParameter(false));
    assertEquals("2024-05-01T12:00:00.000000000Z", dialect.toParameter(Instant.parse("2024-05-01T12:00:00Z")));
    assertEquals("2024-05-01T12:00:00.123456789Z", dialect.toParameter(Instant.parse("2024-05-01T12:00:00.123456789Z")));
    assertEquals("2024-02-29", dialect.toParameter(LocalDate.of(2024, 2, 29)));
    assertEquals("0.00010", dialect.toParameter(new BigDecimal("1.0E-4").setScale(5)));
    UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    assertEquals(id.toString(), dialect.toParameter(id));
    assertEquals("WAL", dialect.toParameter(Mode.WAL));
    assertNull(dialect.toParameter(null));
    assertThrows(IllegalArgumentException.class, () -> dialect.toParameter(List.of(1)));
  }

  @Test
  void timestampTextSortsChronologically() {
    String earlier = (String) dialect.toParameter(Instant.parse("2024-05-01T09:59:59.999Z"));
    String later = (String) dialect.toParameter(Instant.parse("2024-05-01T10:00:00Z"));
    assertTrue(earlier.compareTo(later) < 0);
  }

  @Test
  void pagingAlwaysHasALimitBeforeOffset() {
    assertEquals(" LIMIT 10 OFFSET 20", dialect.limitOffset(10, 20));
    assertEquals(" LIMIT -1 OFFSET 20", dialect.limitOffset(null, 20));
    assertEquals(" LIMIT 5", dialect.limitOffset(5, null));
    assertEquals("", dialect.limitOffset(null, null));
  }

  @Test
  void createTableUsesSqliteAffinities() {
    EntityMapping<Event> m = EntityMapping.builder(Event.class, "Events")
        .key("id", ColumnType.BIGINT, Event::id, c -> c.autoIncrement())
        .column("kind", ColumnType.TEXT, Event::kind, c -> c.size(20).notNull())
        .column("active", ColumnType.BOOLEAN, Event::active, c -> c.defaultValue(true))
        .column("score", ColumnType.DOUBLE, Event::score)
        .column("price", ColumnType.DECIMAL, Event::price, c -> c.precision(10, 2))
        .column("at", ColumnType.TIMESTAMP, Event::at)
        .column("ref", ColumnType.UUID, Event::ref)
        .column("body", ColumnType.BLOB, Event::body)
        .softDelete()
        .index("IX_Events_Kind", i -> i.on("kind").onDescending("at"))
        .reader(row -> null)
        .build();
    SchemaGenerator generator = new SchemaGenerator(dialect);

    assertEquals(String.join("\n",
        "CREATE TABLE IF NOT EXISTS Events (",
        "    Id INTEGER PRIMARY KEY AUTOINCREMENT,",
        "    Kind TEXT NOT NULL,",
        "    Active INTEGER DEFAULT 1,",
        "    Score REAL,",
        "    Price NUMERIC,",
        "    At TEXT,",
        "    Ref TEXT,",
        "    Body BLOB,",
        "    Version INTEGER NOT NULL,",
        "    CreatedTime TEXT NOT NULL,",
        "    LastWriteTime TEXT NOT NULL,",
        "    IsDeleted INTEGER NOT NULL DEFAULT 0",
        ");"), generator.generateCreateTableSql(m));
    assertEquals(List.of("CREATE INDEX IF NOT EXISTS IX_Events_Kind ON Events (Kind, At DESC);"),
        generator.generateCreateIndexSql(m));
  }
}
