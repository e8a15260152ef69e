package io.intellixity.vellum.persistence.jdbc.bulk;

/** @param batchSize rows read per page */
public record BulkExportOptions(boolean includeDeleted, boolean includeExpired, int batchSize) {
  public static final int DEFAULT_BATCH_SIZE = 1000;

  public BulkExportOptions {
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
  }

  public static BulkExportOptions defaults() { return new BulkExportOptions(false, false, DEFAULT_BATCH_SIZE); }

  public BulkExportOptions withIncludeDeleted(boolean v) { return new BulkExportOptions(v, includeExpired, batchSize); }
  public BulkExportOptions withIncludeExpired(boolean v) { return new BulkExportOptions(includeDeleted, v, batchSize); }
  public BulkExportOptions withBatchSize(int v) { return new BulkExportOptions(includeDeleted, includeExpired, v); }
}
