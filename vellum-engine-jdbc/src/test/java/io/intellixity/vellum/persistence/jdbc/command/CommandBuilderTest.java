package io.intellixity.vellum.persistence.jdbc.command;

import io.intellixity.vellum.persistence.jdbc.Customers;
import io.intellixity.vellum.persistence.jdbc.Customers.Customer;
import io.intellixity.vellum.persistence.jdbc.EntityMapper;
import io.intellixity.vellum.persistence.jdbc.PlainSqlDialect;
import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.mapping.EntityKey;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.query.Predicates;
import io.intellixity.vellum.persistence.query.SelectOptions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CommandBuilderTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  record Session(String id, Instant expiresAt) {}

  private static <T> CommandBuilder<T> builder(EntityMapping<T> mapping) {
    return EntityMapper.of(mapping, new PlainSqlDialect(), CLOCK).commandBuilder();
  }

  private final CommandBuilder<Customer> plain = builder(Customers.plain());

  @Test
  void insertStartsAtVersionOne() {
    SqlCommand cmd = plain.build(CommandContext.forInsert(new Customer(1L, "Ann", 5, null)));

    assertEquals(CommandKind.INSERT, cmd.kind());
    assertEquals(SqlCommand.ExecKind.UPDATE, cmd.execKind());
    assertEquals(Map.of("@Id", 1L, "@Name", "Ann", "@Value", 5, "@Version", 1L,
        "@CreatedTime", NOW, "@LastWriteTime", NOW), cmd.parameters());
    assertTrue(cmd.sql().startsWith("INSERT INTO Customers"));
  }

  @Test
  void insertWithNullDataValueKeepsTheParameter() {
    SqlCommand cmd = plain.build(CommandContext.forInsert(new Customer(1L, "Ann", null, null)));
    assertTrue(cmd.parameters().containsKey("@Value"));
    assertNull(cmd.parameters().get("@Value"));
  }

  @Test
  void generatedKeyInsertAsksForKeys() {
    CommandBuilder<Customer> b = builder(EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id, c -> c.autoIncrement())
        .column("name", ColumnType.TEXT, Customer::name)
        .reader(row -> null)
        .build());

    SqlCommand cmd = b.build(CommandContext.forInsert(new Customer(null, "Ann", null, null)));
    assertEquals(SqlCommand.ExecKind.UPDATE_GENERATED_KEYS, cmd.execKind());
    assertFalse(cmd.parameters().containsKey("@Id"));
  }

  @Test
  void batchInsertUsesRowSuffixedPlaceholders() {
    SqlCommand cmd = plain.build(CommandContext.forBatchInsert(List.of(
        new Customer(1L, "Ann", 5, null), new Customer(2L, "Bob", 6, null))));

    assertEquals("INSERT INTO Customers (Id, Name, Value, Version, CreatedTime, LastWriteTime) VALUES"
        + " (@Id_0, @Name_0, @Value_0, @Version_0, @CreatedTime_0, @LastWriteTime_0),"
        + " (@Id_1, @Name_1, @Value_1, @Version_1, @CreatedTime_1, @LastWriteTime_1)", cmd.sql());
    assertEquals(12, cmd.parameters().size());
    assertEquals("Bob", cmd.parameters().get("@Name_1"));
    assertEquals(1L, cmd.parameters().get("@Version_1"));
    assertThrows(IllegalArgumentException.class, () -> CommandContext.forBatchInsert(List.of()));
  }

  @Test
  void updateCarriesExpectedVersionAndFreshWriteTime() {
    SqlCommand cmd = plain.build(CommandContext.forUpdate(new Customer(1L, "Ann", 7, 2L), 2L));

    assertEquals(CommandKind.UPDATE, cmd.kind());
    assertEquals(Map.of("@Name", "Ann", "@Value", 7, "@LastWriteTime", NOW, "@Id", 1L, "@expectedVersion", 2L),
        cmd.parameters());
    assertThrows(IllegalArgumentException.class, () -> CommandContext.forUpdate(new Customer(1L, "a", 1, 0L), 0));
  }

  @Test
  void hardDeleteBindsKeyAndVersionOnly() {
    SqlCommand cmd = plain.build(CommandContext.forDelete(EntityKey.of("Id", 3L), 4L));
    assertEquals(Map.of("@Id", 3L, "@expectedVersion", 4L), cmd.parameters());
  }

  @Test
  void softDeleteAlsoStampsWriteTime() {
    CommandBuilder<Customer> b = builder(Customers.softDeleting());
    SqlCommand cmd = b.build(CommandContext.forDelete(EntityKey.of("Id", 3L), 4L));
    assertEquals(NOW, cmd.parameters().get("@LastWriteTime"));
    assertTrue(cmd.sql().startsWith("UPDATE Customers SET IsDeleted = TRUE"), cmd.sql());
  }

  @Test
  void restoreMovesPastTheTombstone() {
    CommandBuilder<Customer> b = builder(Customers.softDeleting());
    SqlCommand cmd = b.build(CommandContext.forRestore(new Customer(3L, "Back", 1, null), 5L));

    assertEquals(CommandKind.RESTORE, cmd.kind());
    assertEquals(6L, cmd.parameters().get("@Version"));
    assertEquals(5L, cmd.parameters().get("@expectedVersion"));
    assertEquals(NOW, cmd.parameters().get("@CreatedTime"));
    assertFalse(cmd.parameters().containsKey("@IsDeleted"));

    assertThrows(IllegalStateException.class,
        () -> plain.build(CommandContext.forRestore(new Customer(3L, "Back", 1, null), 5L)));
  }

  @Test
  void expirationComesFromTheEntityOrTheSpan() {
    CommandBuilder<Customer> spanned = builder(Customers.expiring(Duration.ofMinutes(10)));
    SqlCommand a = spanned.build(CommandContext.forInsert(new Customer(1L, "Ann", 1, null)));
    assertEquals(NOW.plus(Duration.ofMinutes(10)), a.parameters().get("@AbsoluteExpiration"));

    Instant own = NOW.plusSeconds(30);
    CommandBuilder<Session> sessions = builder(EntityMapping.builder(Session.class, "Sessions")
        .key("id", ColumnType.TEXT, Session::id)
        .expiration(Session::expiresAt)
        .reader(row -> null)
        .build());
    assertEquals(own, sessions.build(CommandContext.forInsert(new Session("s1", own))).parameters().get("@AbsoluteExpiration"));
    assertNull(sessions.build(CommandContext.forInsert(new Session("s2", null))).parameters().get("@AbsoluteExpiration"));

    SqlCommand upd = spanned.build(CommandContext.forUpdate(new Customer(1L, "Ann", 1, 1L), 1L));
    assertEquals(NOW.plus(Duration.ofMinutes(10)), upd.parameters().get("@AbsoluteExpiration"));
  }

  @Test
  void readsAndProbes() {
    SqlCommand select = plain.build(CommandContext.forSelect(EntityKey.of("Id", 9L), null));
    assertEquals(SqlCommand.ExecKind.QUERY, select.execKind());
    assertEquals(Map.of("@Id", 9L), select.parameters());

    SqlCommand count = plain.build(CommandContext.forCount(Predicates.gt("value", 3), SelectOptions.defaults()));
    assertEquals(SqlCommand.ExecKind.QUERY_ONE_VALUE, count.execKind());
    assertEquals("SELECT COUNT(1) FROM Customers WHERE (Value > @p0)", count.sql());

    SqlCommand version = plain.build(CommandContext.forVersionProbe(EntityKey.of("Id", 9L)));
    assertEquals("SELECT Version FROM Customers WHERE Id = @Id", version.sql());
    assertFalse(CommandKind.VERSION_PROBE.isWrite());
    assertTrue(CommandKind.RESTORE.isWrite());
  }

  @Test
  void purgeDeletesByKeyWithoutVersionGuard() {
    CommandBuilder<Customer> b = builder(Customers.softDeleting());
    SqlCommand cmd = b.build(CommandContext.forPurge(EntityKey.of("Id", 4L)));

    assertEquals(CommandKind.PURGE, cmd.kind());
    assertTrue(cmd.kind().isWrite());
    assertEquals("DELETE FROM Customers WHERE Id = @Id", cmd.sql());
    assertEquals(Map.of("@Id", 4L), cmd.parameters());
  }

  @Test
  void contextIsSingleUse() {
    CommandContext<Customer> ctx = CommandContext.forQuery(null, null);
    plain.build(ctx);
    assertThrows(IllegalStateException.class, () -> plain.build(ctx));
  }

  @Test
  void timeoutTravelsWithTheCommand() {
    CommandContext<Customer> ctx = CommandContext.forQuery(null, null);
    SqlCommand cmd = plain.build(ctx.withTimeout(Duration.ofSeconds(3)));
    assertEquals(Duration.ofSeconds(3), cmd.timeout());
    assertNotNull(plain.build(ctx));
    assertThrows(IllegalArgumentException.class, () -> ctx.withTimeout(Duration.ofSeconds(-1)));
  }
}
