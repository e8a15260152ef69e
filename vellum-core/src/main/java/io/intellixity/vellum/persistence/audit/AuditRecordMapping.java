package io.intellixity.vellum.persistence.audit;

import io.intellixity.vellum.persistence.mapping.ColumnType;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.mapping.MappingProvider;
import io.intellixity.vellum.persistence.mapping.SystemColumns;

/** Mapping of {@link AuditRecord} onto the {@code Audit} table; listed in {@code META-INF/vellum.factories}. */
public final class AuditRecordMapping implements MappingProvider<AuditRecord> {
  public static final String TABLE = "Audit";

  @Override
  public Class<AuditRecord> type() { return AuditRecord.class; }

  @Override
  public EntityMapping.Builder<AuditRecord> describe() {
    return EntityMapping.builder(AuditRecord.class, TABLE)
        .key("id", ColumnType.BIGINT, AuditRecord::id, c -> c.autoIncrement())
        .column("entityType", ColumnType.TEXT, AuditRecord::entityType, c -> c.size(256).notNull())
        .column("entityId", ColumnType.TEXT, AuditRecord::entityId, c -> c.size(512).notNull())
        .column("operation", ColumnType.TEXT, AuditRecord::operation, c -> c.size(16).notNull())
        .column("entityVersion", ColumnType.BIGINT, AuditRecord::entityVersion)
        .column("oldVersion", ColumnType.BIGINT, AuditRecord::oldVersion)
        .column("callerClass", ColumnType.TEXT, AuditRecord::callerClass, c -> c.size(512))
        .column("callerMethod", ColumnType.TEXT, AuditRecord::callerMethod, c -> c.size(256))
        .column("callerLine", ColumnType.INTEGER, AuditRecord::callerLine)
        .column("userId", ColumnType.TEXT, AuditRecord::userId, c -> c.size(256))
        .column("size", ColumnType.INTEGER, AuditRecord::size)
        .column("oldValue", ColumnType.TEXT, AuditRecord::oldValue)
        .column("newValue", ColumnType.TEXT, AuditRecord::newValue)
        .index("IX_Audit_EntityType_EntityId", i -> i.on("entityType", "entityId"))
        .index("IX_Audit_Operation", i -> i.on("operation"))
        .reader(row -> new AuditRecord(
            row.getLong("Id"),
            row.getString("EntityType"),
            row.getString("EntityId"),
            row.getEnum("Operation", AuditOperation.class),
            row.getLong("EntityVersion"),
            row.getLong("OldVersion"),
            row.getString("CallerClass"),
            row.getString("CallerMethod"),
            row.getInt("CallerLine"),
            row.getString("UserId"),
            row.getInt("Size"),
            row.getString("OldValue"),
            row.getString("NewValue"),
            row.getInstant(SystemColumns.CREATED_TIME)));
  }
}
