package io.intellixity.vellum.persistence.mapping;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Column-addressed view of the current row. Typed getters return null for SQL NULL. */
public interface RowAdapter {
  boolean has(String column);
  Object raw(String column);

  default boolean isNull(String column) { return raw(column) == null; }

  default String getString(String column) { return Coercions.toStringValue(raw(column)); }
  default Long getLong(String column) { return Coercions.toLong(raw(column)); }
  default Integer getInt(String column) { return Coercions.toInteger(raw(column)); }
  default Double getDouble(String column) { return Coercions.toDouble(raw(column)); }
  default BigDecimal getBigDecimal(String column) { return Coercions.toBigDecimal(raw(column)); }
  default Boolean getBoolean(String column) { return Coercions.toBoolean(raw(column)); }
  default Instant getInstant(String column) { return Coercions.toInstant(raw(column)); }
  default LocalDate getLocalDate(String column) { return Coercions.toLocalDate(raw(column)); }
  default UUID getUuid(String column) { return Coercions.toUuid(raw(column)); }
  default byte[] getBytes(String column) { return Coercions.toBytes(raw(column)); }

  default <E extends Enum<E>> E getEnum(String column, Class<E> enumType) {
    return Coercions.toEnum(raw(column), enumType);
  }

  /** Reads a boolean column, treating NULL as false. */
  default boolean flag(String column) {
    Boolean b = getBoolean(column);
    return b != null && b;
  }
}
