package io.intellixity.vellum.persistence.jdbc;

import java.util.List;

/**
 * One page of a query.
 *
 * @param pageNumber 1-based
 * @param totalCount rows matching the predicate across all pages
 */
public record PagedResult<T>(List<T> items, long totalCount, int pageNumber, int pageSize) {
  public PagedResult {
    items = List.copyOf(items);
    if (pageNumber < 1) throw new IllegalArgumentException("pageNumber must be >= 1: " + pageNumber);
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
  }

  public int totalPages() { return (int) ((totalCount + pageSize - 1) / pageSize); }
  public boolean hasNext() { return pageNumber < totalPages(); }
  public boolean hasPrevious() { return pageNumber > 1; }
}
