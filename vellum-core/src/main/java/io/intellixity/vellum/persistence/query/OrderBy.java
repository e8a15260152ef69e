package io.intellixity.vellum.persistence.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Ordering keys, applied in declaration order. */
public final class OrderBy {
  private final List<Key> keys;

  private OrderBy(List<Key> keys) {
    this.keys = List.copyOf(keys);
  }

  public static OrderBy by(String field) { return new OrderBy(List.of(new Key(field, Direction.ASC))); }

  public static OrderBy byDescending(String field) { return new OrderBy(List.of(new Key(field, Direction.DESC))); }

  public OrderBy thenBy(String field) { return append(new Key(field, Direction.ASC)); }

  public OrderBy thenByDescending(String field) { return append(new Key(field, Direction.DESC)); }

  public List<Key> keys() { return keys; }

  private OrderBy append(Key k) {
    List<Key> next = new ArrayList<>(keys);
    next.add(k);
    return new OrderBy(next);
  }

  @Override
  public boolean equals(Object o) { return o instanceof OrderBy ob && keys.equals(ob.keys); }

  @Override
  public int hashCode() { return keys.hashCode(); }

  @Override
  public String toString() { return "OrderBy" + keys; }

  public record Key(String field, Direction direction) {
    public Key {
      Objects.requireNonNull(field, "field");
      direction = (direction == null) ? Direction.ASC : direction;
    }
  }

  public enum Direction { ASC, DESC }
}
