package io.intellixity.vellum.persistence.jdbc.bulk;

/** Which rows a purge removes physically. */
public enum PurgeStrategy {
  /** Soft-deleted tombstones; needs a soft-delete mapping. */
  DELETED_ONLY,
  /** Rows whose {@code AbsoluteExpiration} has passed; needs an expiring mapping. */
  EXPIRED,
  /** Both of the above, for whichever the mapping supports. */
  DELETED_OR_EXPIRED
}
