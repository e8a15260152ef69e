package io.intellixity.vellum.persistence.query;

/**
 * Read options. By default deleted and expired rows are hidden and no paging applies.
 *
 * @param limit max rows, or null for no limit
 * @param offset rows to skip, or null for none
 */
public record SelectOptions(boolean includeDeleted, boolean includeExpired, OrderBy orderBy, Integer limit, Integer offset) {
  private static final SelectOptions DEFAULTS = new SelectOptions(false, false, null, null, null);

  public SelectOptions {
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0: " + limit);
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
  }

  public static SelectOptions defaults() { return DEFAULTS; }

  public SelectOptions withIncludeDeleted(boolean v) { return new SelectOptions(v, includeExpired, orderBy, limit, offset); }
  public SelectOptions withIncludeExpired(boolean v) { return new SelectOptions(includeDeleted, v, orderBy, limit, offset); }
  public SelectOptions withOrderBy(OrderBy v) { return new SelectOptions(includeDeleted, includeExpired, v, limit, offset); }
  public SelectOptions withLimit(Integer v) { return new SelectOptions(includeDeleted, includeExpired, orderBy, v, offset); }
  public SelectOptions withOffset(Integer v) { return new SelectOptions(includeDeleted, includeExpired, orderBy, limit, v); }

  public SelectOptions withPage(int offset, int limit) {
    return new SelectOptions(includeDeleted, includeExpired, orderBy, limit, offset);
  }
}
