package io.intellixity.vellum.persistence.jdbc.bulk;

import java.time.Duration;

/**
 * @param purged rows removed, or rows that would be removed for a preview
 * @param batches transactions committed; zero for a preview
 */
public record PurgeResult(long purged, int batches, boolean preview, Duration duration) {}
