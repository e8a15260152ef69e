package io.intellixity.vellum.persistence.jdbc.bulk;

import java.time.Duration;
import java.util.List;

/** Entities in key order, read page by page from one transaction. */
public record BulkExportResult<T>(List<T> entities, int pages, Duration duration) {
  public BulkExportResult {
    entities = List.copyOf(entities);
  }

  public int count() { return entities.size(); }
}
