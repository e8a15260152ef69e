package io.intellixity.vellum.persistence.jdbc.bulk;

import java.time.Duration;

/**
 * Counts of one committed import.
 *
 * @param inserted new rows, including revived tombstones
 * @param overwritten live rows replaced under {@link ImportConflictMode#OVERWRITE}
 * @param skipped live rows left alone under {@link ImportConflictMode#SKIP}
 */
public record BulkImportResult(long inserted, long overwritten, long skipped, Duration duration) {
  public long total() { return inserted + overwritten + skipped; }
}
