package io.intellixity.vellum.persistence.jdbc.command;

/** Result of a version probe: the stored version and whether the row is a tombstone. */
public record RowVersion(long version, boolean deleted) {
}
