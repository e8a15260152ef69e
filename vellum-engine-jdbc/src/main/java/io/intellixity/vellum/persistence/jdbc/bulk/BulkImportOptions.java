package io.intellixity.vellum.persistence.jdbc.bulk;

import java.util.Objects;

public record BulkImportOptions(ImportConflictMode onConflict, int batchSize) {
  public static final int DEFAULT_BATCH_SIZE = 1000;

  public BulkImportOptions {
    Objects.requireNonNull(onConflict, "onConflict");
    if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
  }

  public static BulkImportOptions defaults() { return new BulkImportOptions(ImportConflictMode.FAIL, DEFAULT_BATCH_SIZE); }

  public BulkImportOptions withOnConflict(ImportConflictMode v) { return new BulkImportOptions(v, batchSize); }
  public BulkImportOptions withBatchSize(int v) { return new BulkImportOptions(onConflict, v); }
}
