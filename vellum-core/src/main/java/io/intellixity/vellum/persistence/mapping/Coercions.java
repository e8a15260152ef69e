package io.intellixity.vellum.persistence.mapping;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.UUID;

/** Lenient conversions from raw driver values; SQLite in particular hands back strings and integers. */
public final class Coercions {
  private Coercions() {}

  public static String toStringValue(Object raw) {
    if (raw == null) return null;
    if (raw instanceof byte[] b) return new String(b, StandardCharsets.UTF_8);
    return raw.toString();
  }

  public static Long toLong(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.longValue();
    if (raw instanceof Boolean b) return b ? 1L : 0L;
    return Long.parseLong(raw.toString().trim());
  }

  public static Integer toInteger(Object raw) {
    Long l = toLong(raw);
    return l == null ? null : Math.toIntExact(l);
  }

  public static Double toDouble(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Number n) return n.doubleValue();
    return Double.parseDouble(raw.toString().trim());
  }

  public static BigDecimal toBigDecimal(Object raw) {
    if (raw == null) return null;
    if (raw instanceof BigDecimal bd) return bd;
    if (raw instanceof Long || raw instanceof Integer) return BigDecimal.valueOf(((Number) raw).longValue());
    if (raw instanceof Number n) return new BigDecimal(n.toString());
    return new BigDecimal(raw.toString().trim());
  }

  public static Boolean toBoolean(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.longValue() != 0;
    String s = raw.toString().trim();
    if ("1".equals(s)) return true;
    if ("0".equals(s)) return false;
    return Boolean.parseBoolean(s);
  }

  public static Instant toInstant(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Instant i) return i;
    if (raw instanceof java.sql.Timestamp ts) return ts.toInstant();
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (raw instanceof java.util.Date d) return d.toInstant();
    if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
    String s = raw.toString().trim();
    try {
      return Instant.parse(s);
    } catch (DateTimeException e) {
      return OffsetDateTime.parse(s).toInstant();
    }
  }

  public static LocalDate toLocalDate(Object raw) {
    if (raw == null) return null;
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    return LocalDate.parse(raw.toString().trim());
  }

  public static UUID toUuid(Object raw) {
    if (raw == null) return null;
    if (raw instanceof UUID u) return u;
    return UUID.fromString(raw.toString().trim());
  }

  public static byte[] toBytes(Object raw) {
    if (raw == null) return null;
    if (raw instanceof byte[] b) return b;
    return raw.toString().getBytes(StandardCharsets.UTF_8);
  }

  public static <E extends Enum<E>> E toEnum(Object raw, Class<E> enumType) {
    if (raw == null) return null;
    if (enumType.isInstance(raw)) return enumType.cast(raw);
    if (raw instanceof Number n) return enumType.getEnumConstants()[n.intValue()];
    return Enum.valueOf(enumType, raw.toString().trim());
  }
}
