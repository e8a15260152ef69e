package io.intellixity.vellum.persistence.mapping;

import java.util.*;

/** Primary-key values of one row, ordered as the key columns are declared. */
public final class EntityKey {
  private final Map<String, Object> values;

  public EntityKey(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) throw new IllegalArgumentException("EntityKey needs at least one column");
    Map<String, Object> copy = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      if (e.getValue() == null) throw new IllegalArgumentException("Key column '" + e.getKey() + "' is null");
      copy.put(e.getKey(), e.getValue());
    }
    this.values = Collections.unmodifiableMap(copy);
  }

  public static EntityKey of(String column, Object value) {
    return new EntityKey(Map.of(column, value));
  }

  /** Column name to value, in key order. */
  public Map<String, Object> values() { return values; }

  public Object get(String column) { return values.get(column); }

  public boolean isComposite() { return values.size() > 1; }

  @Override
  public boolean equals(Object o) {
    return o instanceof EntityKey k && values.equals(k.values);
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  /** {@code 42} for single keys, {@code TenantId=t1,Id=42} for composite ones. */
  @Override
  public String toString() {
    if (!isComposite()) return String.valueOf(values.values().iterator().next());
    StringJoiner j = new StringJoiner(",");
    values.forEach((k, v) -> j.add(k + "=" + v));
    return j.toString();
  }
}
