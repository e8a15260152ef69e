package io.intellixity.vellum.persistence.audit;

import java.time.Instant;

/**
 * One row of the {@code Audit} table.
 *
 * @param id store-generated; null until persisted
 * @param entityVersion version of the entity after the operation
 * @param oldVersion version before the operation, null for creates
 * @param size UTF-8 byte length of {@code newValue}
 * @param createdTime set by the store on insert; null on records not yet persisted
 */
public record AuditRecord(
    Long id,
    String entityType,
    String entityId,
    AuditOperation operation,
    Long entityVersion,
    Long oldVersion,
    String callerClass,
    String callerMethod,
    Integer callerLine,
    String userId,
    Integer size,
    String oldValue,
    String newValue,
    Instant createdTime
) {
}
