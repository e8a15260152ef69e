package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.jdbc.command.CommandBuilder;
import io.intellixity.vellum.persistence.jdbc.ddl.DmlTemplates;
import io.intellixity.vellum.persistence.jdbc.ddl.SchemaGenerator;
import io.intellixity.vellum.persistence.jdbc.translate.ExpressionTranslator;
import io.intellixity.vellum.persistence.mapping.EntityMapping;
import io.intellixity.vellum.persistence.mapping.MappingRegistry;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * A built mapping bound to one dialect: DDL, DML templates, translator and command builder.
 *
 * <p>The mapping itself comes from the registry cache; the statements derived from it are rendered
 * once here and reused for every command.</p>
 */
public final class EntityMapper<T> {
  private final EntityMapping<T> mapping;
  private final SqlDialect dialect;
  private final Clock clock;
  private final String createTableSql;
  private final List<String> createIndexSql;
  private final DmlTemplates templates;
  private final ExpressionTranslator translator;
  private final CommandBuilder<T> commandBuilder;

  private EntityMapper(EntityMapping<T> mapping, SqlDialect dialect, Clock clock) {
    this.mapping = Objects.requireNonNull(mapping, "mapping");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clock = Objects.requireNonNull(clock, "clock");
    SchemaGenerator schema = new SchemaGenerator(dialect);
    this.createTableSql = schema.generateCreateTableSql(mapping);
    this.createIndexSql = List.copyOf(schema.generateCreateIndexSql(mapping));
    this.templates = DmlTemplates.generate(mapping, dialect);
    this.translator = new ExpressionTranslator(mapping, dialect, clock);
    this.commandBuilder = new CommandBuilder<>(mapping, dialect, templates, translator, clock);
  }

  public static <T> EntityMapper<T> build(Class<T> type, SqlDialect dialect) {
    return build(type, dialect, MappingRegistry.global(), Clock.systemUTC());
  }

  public static <T> EntityMapper<T> build(Class<T> type, SqlDialect dialect, MappingRegistry registry) {
    return build(type, dialect, registry, Clock.systemUTC());
  }

  public static <T> EntityMapper<T> build(Class<T> type, SqlDialect dialect, MappingRegistry registry, Clock clock) {
    Objects.requireNonNull(registry, "registry");
    return new EntityMapper<>(registry.build(type), dialect, clock);
  }

  public static <T> EntityMapper<T> of(EntityMapping<T> mapping, SqlDialect dialect, Clock clock) {
    return new EntityMapper<>(mapping, dialect, clock);
  }

  public EntityMapping<T> mapping() { return mapping; }
  public SqlDialect dialect() { return dialect; }
  public Clock clock() { return clock; }

  public String generateCreateTableSql() { return createTableSql; }
  public List<String> generateCreateIndexSql() { return createIndexSql; }
  public DmlTemplates generateDmlTemplates() { return templates; }

  public ExpressionTranslator translator() { return translator; }
  public CommandBuilder<T> commandBuilder() { return commandBuilder; }
}
