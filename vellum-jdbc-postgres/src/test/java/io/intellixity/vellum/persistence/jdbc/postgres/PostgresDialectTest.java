package io.intellixity.vellum.persistence.jdbc.postgres;

import io.intellixity.vellum.persistence.jdbc.EntityMapper;
import io.intellixity.vellum.persistence.jdbc.ddl.SchemaGenerator;
import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.query.Predicates;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect dialect = new PostgresDialect();

  record Invoice(Long id, UUID customer, String note, BigDecimal total, Double rate, Boolean paid, Instant due, byte[] pdf) {}

  @Test
  void quotesEveryIdentifier() {
    assertEquals("\"Name\"", dialect.quoteIdent("Name"));
    assertEquals("\"odd\"\"name\"", dialect.quoteIdent("odd\"name"));
    assertEquals("\"billing\".\"Invoices\"", dialect.qualifiedTable("billing", "Invoices"));
    assertEquals("\"Invoices\"", dialect.qualifiedTable(null, "Invoices"));
  }

  @Test
  void bindsInstantsAsUtcOffsetDateTimes() {
    Instant at = Instant.parse("2024-05-01T12:00:00.123456Z");
    assertEquals(OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 123_456_000, ZoneOffset.UTC), dialect.toParameter(at));
    assertEquals(Boolean.TRUE, dialect.toParameter(true));
    UUID id = UUID.randomUUID();
    assertSame(id, dialect.toParameter(id));
  }

  @Test
  void createTableUsesPostgresTypes() {
    EntityMapping<Invoice> m = EntityMapping.builder(Invoice.class, "Invoices")
        .schema("billing")
        .key("id", ColumnType.BIGINT, Invoice::id, c -> c.autoIncrement())
        .column("customer", ColumnType.UUID, Invoice::customer, c -> c.notNull())
        .column("note", ColumnType.TEXT, Invoice::note)
        .column("total", ColumnType.DECIMAL, Invoice::total, c -> c.precision(12, 2).defaultValue(BigDecimal.ZERO))
        .column("rate", ColumnType.DOUBLE, Invoice::rate)
        .column("paid", ColumnType.BOOLEAN, Invoice::paid, c -> c.defaultValue(false))
        .column("due", ColumnType.TIMESTAMP, Invoice::due, c -> c.defaultExpression("now()"))
        .column("pdf", ColumnType.BLOB, Invoice::pdf)
        .softDelete()
        .reader(row -> null)
        .build();

    assertEquals(String.join("\n",
        "CREATE TABLE IF NOT EXISTS \"billing\".\"Invoices\" (",
        "    \"Id\" BIGINT GENERATED BY DEFAULT AS IDENTITY NOT NULL,",
        "    \"Customer\" UUID NOT NULL,",
        "    \"Note\" TEXT,",
        "    \"Total\" NUMERIC(12, 2) DEFAULT 0,",
        "    \"Rate\" DOUBLE PRECISION,",
        "    \"Paid\" BOOLEAN DEFAULT FALSE,",
        "    \"Due\" TIMESTAMP WITH TIME ZONE DEFAULT now(),",
        "    \"Pdf\" BYTEA,",
        "    \"Version\" BIGINT NOT NULL,",
        "    \"CreatedTime\" TIMESTAMP WITH TIME ZONE NOT NULL,",
        "    \"LastWriteTime\" TIMESTAMP WITH TIME ZONE NOT NULL,",
        "    \"IsDeleted\" BOOLEAN NOT NULL DEFAULT FALSE,",
        "    PRIMARY KEY (\"Id\")",
        ");"), new SchemaGenerator(dialect).generateCreateTableSql(m));
  }

  @Test
  void sizedTextAndIntegerIdentity() {
    record Tag(Integer id, String label) {}
    EntityMapping<Tag> m = EntityMapping.builder(Tag.class, "Tags")
        .key("id", ColumnType.INTEGER, Tag::id, c -> c.autoIncrement())
        .column("label", ColumnType.TEXT, Tag::label, c -> c.size(40).unique())
        .reader(row -> null)
        .build();

    String sql = new SchemaGenerator(dialect).generateCreateTableSql(m);
    assertTrue(sql.contains("    \"Id\" INTEGER GENERATED BY DEFAULT AS IDENTITY NOT NULL,\n"), sql);
    assertTrue(sql.contains("    \"Label\" VARCHAR(40) UNIQUE,\n"), sql);
  }

  @Test
  void translatedFiltersUseQuotedColumns() {
    record Tag(Integer id, String label) {}
    EntityMapping<Tag> m = EntityMapping.builder(Tag.class, "Tags")
        .key("id", ColumnType.INTEGER, Tag::id)
        .column("label", ColumnType.TEXT, Tag::label)
        .reader(row -> null)
        .build();
    EntityMapper<Tag> mapper = EntityMapper.of(m, dialect, Clock.systemUTC());

    assertEquals("(\"Label\" = @p0)", mapper.translator().translatePredicate(Predicates.eq("label", "x")).sql());
    assertEquals(" LIMIT 10 OFFSET 20", dialect.limitOffset(10, 20));
    assertEquals(" OFFSET 20", dialect.limitOffset(null, 20));
  }

  @Test
  void foreignKeysReferenceTheTargetsSchema() {
    record Payment(Long id, Long invoiceId) {}
    EntityMapping<Invoice> invoices = EntityMapping.builder(Invoice.class, "Invoices")
        .schema("billing")
        .key("id", ColumnType.BIGINT, Invoice::id)
        .reader(row -> null)
        .build();
    EntityMapping<Payment> payments = EntityMapping.builder(Payment.class, "Payments")
        .schema("ledger")
        .key("id", ColumnType.BIGINT, Payment::id)
        .column("invoiceId", ColumnType.BIGINT, Payment::invoiceId, c -> c.notNull())
        .foreignKey("FK_Payments_Invoices", fk -> fk.references(Invoice.class).column("invoiceId", "id"))
        .reader(row -> null)
        .build(type -> invoices);

    String sql = new SchemaGenerator(dialect).generateCreateTableSql(payments);
    assertTrue(sql.contains("    CONSTRAINT \"FK_Payments_Invoices\" FOREIGN KEY (\"InvoiceId\")"
        + " REFERENCES \"billing\".\"Invoices\" (\"Id\") ON DELETE NO ACTION ON UPDATE NO ACTION\n"), sql);
  }
}
