package io.intellixity.vellum.persistence.mapping;

import java.util.Locale;
import java.util.regex.Pattern;

/** Column and parameter names the store manages on behalf of every entity. */
public final class SystemColumns {
  private SystemColumns() {}

  public static final String VERSION = "Version";
  public static final String CREATED_TIME = "CreatedTime";
  public static final String LAST_WRITE_TIME = "LastWriteTime";
  public static final String IS_DELETED = "IsDeleted";
  public static final String ABSOLUTE_EXPIRATION = "AbsoluteExpiration";

  public static final String EXPECTED_VERSION_PARAM = "@expectedVersion";
  public static final String NOW_PARAM = "@now";

  private static final Pattern GENERATED_PARAM = Pattern.compile("p\\d+");

  /** Column names that would clash with placeholders generated by the translator or command builder. */
  static boolean isReservedParameterName(String column) {
    String c = column.toLowerCase(Locale.ROOT);
    return GENERATED_PARAM.matcher(c).matches()
        || "now".equals(c)
        || "expectedversion".equals(c);
  }
}
