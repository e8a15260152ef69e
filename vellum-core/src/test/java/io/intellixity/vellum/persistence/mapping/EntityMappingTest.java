package io.intellixity.vellum.persistence.mapping;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class EntityMappingTest {

  record Customer(Long id, String name, Integer value, Long version) {}

  record Line(String tenantId, Long orderId, String sku) {}

  static EntityMapping.Builder<Customer> customer() {
    return EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id)
        .column("name", ColumnType.TEXT, Customer::name, c -> c.size(100).notNull())
        .column("value", ColumnType.INTEGER, Customer::value)
        .version(Customer::version)
        .reader(row -> new Customer(row.getLong("Id"), row.getString("Name"), row.getInt("Value"),
            row.getLong(SystemColumns.VERSION)));
  }

  private static List<String> columnNames(EntityMapping<?> m) {
    return m.columns().stream().map(ColumnDef::column).collect(Collectors.toList());
  }

  @Test
  void dataColumnsComeFirstThenSystemColumns() {
    EntityMapping<Customer> m = customer().build();

    assertEquals(List.of("Id", "Name", "Value", "Version", "CreatedTime", "LastWriteTime"), columnNames(m));
    assertEquals(3, m.dataColumns().size());
    assertEquals("Version", m.versionColumn().column());
    assertEquals(ColumnRole.VERSION, m.versionColumn().role());
    assertFalse(m.softDelete());
    assertFalse(m.expires());
    assertTrue(m.role(ColumnRole.SOFT_DELETE_FLAG).isEmpty());
  }

  @Test
  void keyColumnIsImplicitlyNotNull() {
    ColumnDef id = customer().build().keyColumns().get(0);
    assertTrue(id.primaryKey());
    assertTrue(id.notNull());
    assertEquals(0, id.keyOrder());
    assertEquals("@Id", id.parameter());
  }

  @Test
  void softDeleteAndExpiryAddTheirColumns() {
    EntityMapping<Customer> m = customer().softDelete().expiresAfter(Duration.ofHours(1)).build();

    assertEquals(List.of("Id", "Name", "Value", "Version", "CreatedTime", "LastWriteTime", "IsDeleted",
        "AbsoluteExpiration"), columnNames(m));
    ColumnDef flag = m.role(ColumnRole.SOFT_DELETE_FLAG).orElseThrow();
    assertEquals(Boolean.FALSE, flag.defaultValue());
    assertTrue(flag.notNull());
    assertFalse(m.role(ColumnRole.EXPIRATION).orElseThrow().notNull());
    assertEquals(Duration.ofHours(1), m.expirySpan().orElseThrow());
  }

  @Test
  void customVersionColumnName() {
    EntityMapping<Customer> m = customer().versionColumn("RowVersion").build();
    assertEquals("RowVersion", m.versionColumn().column());
    assertTrue(m.findColumn("Version").isEmpty());
  }

  @Test
  void findColumnResolvesFieldThenColumnIgnoringCase() {
    EntityMapping<Customer> m = EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id)
        .column("name", ColumnType.TEXT, Customer::name, c -> c.column("full_name"))
        .reader(row -> null)
        .build();

    assertEquals("full_name", m.findColumn("name").orElseThrow().column());
    assertEquals("name", m.findColumn("FULL_NAME").orElseThrow().field());
    assertTrue(m.findColumn("missing").isEmpty());
    assertTrue(m.findColumn(null).isEmpty());
  }

  @Test
  void compositeKeyFollowsDeclarationOrder() {
    EntityMapping<Line> m = EntityMapping.builder(Line.class, "Lines")
        .key("tenantId", ColumnType.TEXT, Line::tenantId)
        .key("orderId", ColumnType.BIGINT, Line::orderId)
        .column("sku", ColumnType.TEXT, Line::sku)
        .reader(row -> null)
        .build();

    EntityKey k = m.keyOf(new Line("t1", 42L, "A-1"));
    assertTrue(k.isComposite());
    assertEquals(Map.of("TenantId", "t1", "OrderId", 42L), k.values());
    assertEquals("TenantId=t1,OrderId=42", k.toString());
    assertEquals(k, m.keyOf("t1", 42L));
    assertSame(k, m.keyOf(k));
    assertThrows(IllegalArgumentException.class, () -> m.keyOf("t1"));
  }

  @Test
  void nullKeyValueIsRejected() {
    EntityMapping<Customer> m = customer().build();
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> m.keyOf(new Customer(null, "n", 1, null)));
    assertTrue(e.getMessage().contains("id"));
  }

  @Test
  void valueOfReadsDataColumnsOnly() {
    EntityMapping<Customer> m = customer().build();
    Customer c = new Customer(7L, "Ann", 3, 2L);

    assertEquals("Ann", m.valueOf(c, m.findColumn("name").orElseThrow()));
    assertNull(m.valueOf(c, m.versionColumn()));
    assertEquals(2L, m.versionOf(c));
  }

  @Test
  void expirationGetterEnablesExpiry() {
    Instant at = Instant.parse("2030-01-01T00:00:00Z");
    EntityMapping<Customer> m = customer().expiration(c -> at).build();
    assertTrue(m.expires());
    assertTrue(m.expirySpan().isEmpty());
    assertEquals(at, m.expirationOf(new Customer(1L, "a", 1, 1L)));
  }

  @Test
  void extendInheritsAndOverrides() {
    EntityMapping.Builder<Customer> base = customer().softDelete().auditTrail();
    EntityMapping<Customer> m = EntityMapping.builder(Customer.class, "VipCustomers")
        .extend(base)
        .column("name", ColumnType.TEXT, Customer::name, c -> c.size(10))
        .notMapped("value")
        .reader(row -> null)
        .build();

    assertEquals("VipCustomers", m.table());
    assertTrue(m.softDelete());
    assertTrue(m.auditTrail());
    assertEquals(10, m.findColumn("name").orElseThrow().size());
    assertFalse(m.findColumn("name").orElseThrow().notNull());
    assertTrue(m.findColumn("value").isEmpty());
    assertEquals(2, m.dataColumns().size());
  }

  @Test
  void missingKeyIsRejected() {
    MappingException e = assertThrows(MappingException.class, () -> EntityMapping.builder(Customer.class, "Customers")
        .column("name", ColumnType.TEXT, Customer::name)
        .reader(row -> null)
        .build());
    assertTrue(e.getMessage().contains("no primary key"));
  }

  @Test
  void missingReaderIsRejected() {
    assertThrows(MappingException.class, () -> EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id)
        .build());
  }

  @Test
  void duplicateColumnIsRejected() {
    MappingException e = assertThrows(MappingException.class, () -> customer()
        .column("alias", ColumnType.TEXT, Customer::name, c -> c.column("NAME"))
        .build());
    assertTrue(e.getMessage().contains("two fields"));
  }

  @Test
  void systemColumnCollisionIsRejected() {
    MappingException e = assertThrows(MappingException.class, () -> customer()
        .column("createdTime", ColumnType.TIMESTAMP, c -> null)
        .build());
    assertTrue(e.getMessage().contains("system column"));
  }

  @Test
  void generatedParameterNamesAreReserved() {
    assertThrows(MappingException.class, () -> customer().column("p0", ColumnType.TEXT, c -> null).build());
    assertThrows(MappingException.class, () -> customer().column("now", ColumnType.TEXT, c -> null).build());
    assertThrows(MappingException.class,
        () -> customer().column("expectedVersion", ColumnType.BIGINT, c -> null).build());
  }

  @Test
  void columnNamesMustBeUsableAsParameterNames() {
    MappingException e = assertThrows(MappingException.class,
        () -> customer().column("nick", ColumnType.TEXT, c -> null, c -> c.column("Nick Name")).build());
    assertTrue(e.getMessage().contains("Nick Name"), e.getMessage());
    assertThrows(MappingException.class,
        () -> customer().column("zip", ColumnType.TEXT, c -> null, c -> c.column("zip-code")).build());
    assertThrows(MappingException.class,
        () -> customer().column("rank", ColumnType.INTEGER, c -> null, c -> c.column("1st")).build());
    assertThrows(MappingException.class, () -> customer().versionColumn("Row Version"));

    EntityMapping<Customer> m = customer().column("zip", ColumnType.TEXT, c -> null, c -> c.column("_zip_2")).build();
    assertEquals("_zip_2", m.findColumn("zip").orElseThrow().column());
  }

  @Test
  void autoIncrementNeedsSingleIntegralKey() {
    assertThrows(MappingException.class, () -> EntityMapping.builder(Line.class, "Lines")
        .key("tenantId", ColumnType.TEXT, Line::tenantId)
        .key("orderId", ColumnType.BIGINT, Line::orderId, c -> c.autoIncrement())
        .reader(row -> null)
        .build());
    assertThrows(MappingException.class, () -> EntityMapping.builder(Line.class, "Lines")
        .key("sku", ColumnType.TEXT, Line::sku, c -> c.autoIncrement())
        .reader(row -> null)
        .build());

    EntityMapping<Customer> m = EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id, c -> c.autoIncrement())
        .reader(row -> null)
        .build();
    assertEquals("Id", m.generatedKey().orElseThrow().column());
  }

  @Test
  void indexColumnsResolveToColumnNames() {
    EntityMapping<Customer> m = customer()
        .index("IX_Customers_Name", i -> i.on("name").onDescending("value").unique())
        .build();

    IndexDef ix = m.indexes().get(0);
    assertTrue(ix.unique());
    assertEquals("Name", ix.columns().get(0).column());
    assertTrue(ix.columns().get(1).descending());

    assertThrows(MappingException.class, () -> customer().index("IX_Bad", i -> i.on("nope")).build());
    assertThrows(MappingException.class, () -> customer()
        .index("IX_A", i -> i.on("name"))
        .index("ix_a", i -> i.on("value"))
        .build());

    MappingException empty = assertThrows(MappingException.class,
        () -> customer().index("IX_Empty", i -> i.unique()).build());
    assertTrue(empty.getMessage().contains("no columns"), empty.getMessage());
  }

  @Test
  void selfReferencingForeignKeyResolvesWithoutRegistry() {
    record Node(Long id, Long parentId) {}
    EntityMapping<Node> m = EntityMapping.builder(Node.class, "Nodes")
        .key("id", ColumnType.BIGINT, Node::id)
        .column("parentId", ColumnType.BIGINT, Node::parentId)
        .foreignKey("FK_Nodes_Parent", fk -> fk.references(Node.class).column("parentId", "id")
            .onDelete(ForeignKeyAction.CASCADE))
        .reader(row -> null)
        .build();

    ForeignKeyDef fk = m.foreignKeys().get(0);
    assertEquals("Nodes", fk.referencedTable());
    assertEquals(List.of("ParentId"), fk.columns());
    assertEquals(List.of("Id"), fk.referencedColumns());
    assertEquals(ForeignKeyAction.CASCADE, fk.onDelete());
  }

  @Test
  void foreignKeyColumnsWithConflictingRulesAreRejected() {
    assertThrows(MappingException.class, () -> EntityMapping.builder(Line.class, "Lines")
        .key("tenantId", ColumnType.TEXT, Line::tenantId)
        .key("orderId", ColumnType.BIGINT, Line::orderId)
        .foreignKey("FK_Lines_Self", fk -> fk.references(Line.class).column("orderId", "orderId"))
        .foreignKey("FK_Lines_Self", fk -> fk.references(Line.class).column("tenantId", "tenantId")
            .onDelete(ForeignKeyAction.CASCADE))
        .reader(row -> null)
        .build());
  }

  @Test
  void invalidColumnOptionsAreRejected() {
    assertThrows(MappingException.class, () -> customer().column("x", ColumnType.TEXT, c -> null, c -> c.size(0)));
    assertThrows(MappingException.class,
        () -> customer().column("x", ColumnType.DECIMAL, c -> null, c -> c.precision(4, 6)));
    assertThrows(MappingException.class, () -> customer().expiresAfter(Duration.ZERO));
    assertThrows(MappingException.class, () -> EntityMapping.builder(Customer.class, " "));
  }
}
