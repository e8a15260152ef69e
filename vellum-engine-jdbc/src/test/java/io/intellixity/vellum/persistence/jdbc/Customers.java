package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.mapping.SystemColumns;

import java.time.Duration;

/** Shared test entity and its mapping variants. */
public final class Customers {
  private Customers() {}

  public record Customer(Long id, String name, Integer value, Long version) {
    public Customer withName(String name) { return new Customer(id, name, value, version); }
  }

  public static EntityMapping.Builder<Customer> builder() {
    return EntityMapping.builder(Customer.class, "Customers")
        .key("id", ColumnType.BIGINT, Customer::id)
        .column("name", ColumnType.TEXT, Customer::name, c -> c.size(100).notNull())
        .column("value", ColumnType.INTEGER, Customer::value)
        .version(Customer::version)
        .reader(row -> new Customer(row.getLong("Id"), row.getString("Name"), row.getInt("Value"),
            row.getLong(SystemColumns.VERSION)));
  }

  public static EntityMapping<Customer> plain() { return builder().build(); }

  public static EntityMapping<Customer> softDeleting() { return builder().softDelete().build(); }

  public static EntityMapping<Customer> expiring(Duration span) { return builder().expiresAfter(span).build(); }
}
