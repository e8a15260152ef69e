package io.intellixity.vellum.persistence.mapping;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Immutable mapping of one entity type onto a table.
 *
 * <p>Columns are ordered as declared, followed by the system columns
 * ({@code Version}, {@code CreatedTime}, {@code LastWriteTime}, then {@code IsDeleted} and
 * {@code AbsoluteExpiration} when enabled). Instances are built once per type and shared;
 * see {@link MappingRegistry}.</p>
 */
public final class EntityMapping<T> {
  private final Class<T> type;
  private final String table;
  private final String schema;
  private final List<ColumnDef> columns;
  private final List<ColumnDef> keyColumns;
  private final Map<String, ColumnDef> byField;
  private final Map<String, ColumnDef> byColumn;
  private final boolean softDelete;
  private final boolean expires;
  private final Duration expirySpan;
  private final boolean auditTrail;
  private final List<IndexDef> indexes;
  private final List<ForeignKeyDef> foreignKeys;
  private final PojoAccessor<T> accessor;
  private final RowReader<T> reader;
  private final Function<Object, Long> versionGetter;
  private final Function<Object, Instant> expirationGetter;

  private EntityMapping(Class<T> type, String table, String schema, List<ColumnDef> columns,
                        boolean softDelete, boolean expires, Duration expirySpan, boolean auditTrail,
                        List<IndexDef> indexes, List<ForeignKeyDef> foreignKeys,
                        Map<String, Function<Object, ?>> getters, RowReader<T> reader,
                        Function<Object, Long> versionGetter, Function<Object, Instant> expirationGetter) {
    this.type = type;
    this.table = table;
    this.schema = schema;
    this.columns = List.copyOf(columns);
    List<ColumnDef> keys = new ArrayList<>();
    for (ColumnDef c : columns) if (c.primaryKey()) keys.add(c);
    keys.sort(Comparator.comparingInt(ColumnDef::keyOrder));
    this.keyColumns = List.copyOf(keys);
    Map<String, ColumnDef> f = new LinkedHashMap<>();
    Map<String, ColumnDef> c = new LinkedHashMap<>();
    for (ColumnDef col : columns) {
      f.put(col.field(), col);
      c.put(col.column().toLowerCase(Locale.ROOT), col);
    }
    this.byField = Collections.unmodifiableMap(f);
    this.byColumn = Collections.unmodifiableMap(c);
    this.softDelete = softDelete;
    this.expires = expires;
    this.expirySpan = expirySpan;
    this.auditTrail = auditTrail;
    this.indexes = List.copyOf(indexes);
    this.foreignKeys = List.copyOf(foreignKeys);
    this.accessor = new GetterAccessor<>(type, Map.copyOf(getters));
    this.reader = reader;
    this.versionGetter = versionGetter;
    this.expirationGetter = expirationGetter;
  }

  public static <T> Builder<T> builder(Class<T> type, String table) {
    return new Builder<>(type, table);
  }

  public Class<T> type() { return type; }
  public String table() { return table; }
  /** Optional schema qualifier; null when the default schema is used. */
  public String schema() { return schema; }
  public List<ColumnDef> columns() { return columns; }
  public List<ColumnDef> keyColumns() { return keyColumns; }
  public boolean softDelete() { return softDelete; }
  public boolean expires() { return expires; }
  public Optional<Duration> expirySpan() { return Optional.ofNullable(expirySpan); }
  public boolean auditTrail() { return auditTrail; }
  public List<IndexDef> indexes() { return indexes; }
  public List<ForeignKeyDef> foreignKeys() { return foreignKeys; }
  public PojoAccessor<T> accessor() { return accessor; }
  public RowReader<T> reader() { return reader; }

  public List<ColumnDef> dataColumns() {
    List<ColumnDef> out = new ArrayList<>();
    for (ColumnDef c : columns) if (!c.role().isSystem()) out.add(c);
    return out;
  }

  public ColumnDef versionColumn() { return role(ColumnRole.VERSION).orElseThrow(); }

  public Optional<ColumnDef> role(ColumnRole role) {
    for (ColumnDef c : columns) if (c.role() == role) return Optional.of(c);
    return Optional.empty();
  }

  /** Resolves by source field name first, then by column name ignoring case. */
  public Optional<ColumnDef> findColumn(String fieldOrColumn) {
    if (fieldOrColumn == null) return Optional.empty();
    ColumnDef c = byField.get(fieldOrColumn);
    if (c == null) c = byColumn.get(fieldOrColumn.toLowerCase(Locale.ROOT));
    return Optional.ofNullable(c);
  }

  /** The single auto-increment key column, if the key is generated by the store. */
  public Optional<ColumnDef> generatedKey() {
    if (keyColumns.size() == 1 && keyColumns.get(0).autoIncrement()) return Optional.of(keyColumns.get(0));
    return Optional.empty();
  }

  public EntityKey keyOf(T entity) {
    Objects.requireNonNull(entity, "entity");
    Map<String, Object> values = new LinkedHashMap<>();
    for (ColumnDef k : keyColumns) {
      Object v = accessor.get(entity, k.field());
      if (v == null) throw new IllegalArgumentException("Key field '" + k.field() + "' of " + type.getSimpleName() + " is null");
      values.put(k.column(), v);
    }
    return new EntityKey(values);
  }

  /** Builds a key from positional values in key-column order; an {@link EntityKey} passes through. */
  public EntityKey keyOf(Object... values) {
    if (values != null && values.length == 1 && values[0] instanceof EntityKey k) return k;
    if (values == null || values.length != keyColumns.size()) {
      throw new IllegalArgumentException(type.getSimpleName() + " key has " + keyColumns.size()
          + " column(s), got " + (values == null ? 0 : values.length) + " value(s)");
    }
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++) m.put(keyColumns.get(i).column(), values[i]);
    return new EntityKey(m);
  }

  /** Value of a data column on the entity; system columns are owned by the store and read as null. */
  public Object valueOf(T entity, ColumnDef column) {
    if (column.role().isSystem()) return null;
    return accessor.get(entity, column.field());
  }

  /** The version the entity was read at, or null when the mapping declares no version getter. */
  public Long versionOf(T entity) {
    return versionGetter == null ? null : versionGetter.apply(entity);
  }

  public boolean hasVersionGetter() { return versionGetter != null; }

  /** Entity-supplied absolute expiration, or null to fall back to the expiry span. */
  public Instant expirationOf(T entity) {
    return expirationGetter == null ? null : expirationGetter.apply(entity);
  }

  public T read(RowAdapter row) { return reader.read(row); }

  @Override
  public String toString() {
    return "EntityMapping{" + type.getSimpleName() + " -> " + table + "}";
  }

  private static final class GetterAccessor<T> implements PojoAccessor<T> {
    private final Class<T> type;
    private final Map<String, Function<Object, ?>> getters;

    GetterAccessor(Class<T> type, Map<String, Function<Object, ?>> getters) {
      this.type = type;
      this.getters = getters;
    }

    @Override
    public Object get(T entity, String field) {
      Function<Object, ?> g = getters.get(field);
      if (g == null) throw new MappingException("Field '" + field + "' is not mapped on " + type.getName());
      return g.apply(entity);
    }

    @Override
    public boolean has(String field) { return getters.containsKey(field); }
  }

  // ---------- builder ----------

  public static final class Builder<T> {
    // Column names double as @Column parameter names in generated DML
    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Class<T> type;
    private final String table;
    private String schema;
    private final List<ColumnSpec> columns = new ArrayList<>();
    private final Set<String> notMapped = new LinkedHashSet<>();
    private final List<IndexSpec> indexes = new ArrayList<>();
    private final Map<String, ForeignKeySpec> foreignKeys = new LinkedHashMap<>();
    private String versionColumn = SystemColumns.VERSION;
    private boolean softDelete;
    private boolean expires;
    private Duration expirySpan;
    private boolean auditTrail;
    private RowReader<T> reader;
    private Function<Object, Long> versionGetter;
    private Function<Object, Instant> expirationGetter;

    private Builder(Class<T> type, String table) {
      this.type = Objects.requireNonNull(type, "type");
      this.table = Objects.requireNonNull(table, "table");
      if (table.isBlank()) throw new MappingException("Blank table name for " + type.getName());
    }

    public Class<T> type() { return type; }

    public Builder<T> schema(String schema) {
      this.schema = schema;
      return this;
    }

    public Builder<T> key(String field, ColumnType type, Function<? super T, ?> getter) {
      return key(field, type, getter, c -> {});
    }

    public Builder<T> key(String field, ColumnType type, Function<? super T, ?> getter, Consumer<ColumnSpec> options) {
      ColumnSpec spec = new ColumnSpec(field, type, erase(getter));
      spec.key = true;
      options.accept(spec);
      return put(spec);
    }

    public Builder<T> column(String field, ColumnType type, Function<? super T, ?> getter) {
      return column(field, type, getter, c -> {});
    }

    public Builder<T> column(String field, ColumnType type, Function<? super T, ?> getter, Consumer<ColumnSpec> options) {
      ColumnSpec spec = new ColumnSpec(field, type, erase(getter));
      options.accept(spec);
      return put(spec);
    }

    /**
     * Inherits columns, keys, indexes, foreign keys and capability flags from a base type's builder.
     * Later declarations of the same field override the inherited one in place.
     */
    public Builder<T> extend(Builder<? super T> base) {
      Objects.requireNonNull(base, "base");
      for (ColumnSpec c : base.columns) put(c.copy());
      notMapped.addAll(base.notMapped);
      for (IndexSpec i : base.indexes) indexes.add(i.copy());
      for (ForeignKeySpec fk : base.foreignKeys.values()) mergeForeignKey(fk.copy());
      if (!SystemColumns.VERSION.equals(base.versionColumn)) versionColumn = base.versionColumn;
      softDelete |= base.softDelete;
      expires |= base.expires;
      if (expirySpan == null) expirySpan = base.expirySpan;
      auditTrail |= base.auditTrail;
      if (schema == null) schema = base.schema;
      if (versionGetter == null) versionGetter = base.versionGetter;
      if (expirationGetter == null) expirationGetter = base.expirationGetter;
      return this;
    }

    /** Excludes a field, including one inherited through {@link #extend(Builder)}. */
    public Builder<T> notMapped(String field) {
      notMapped.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder<T> version(Function<? super T, Long> getter) {
      Objects.requireNonNull(getter, "getter");
      @SuppressWarnings("unchecked")
      Function<Object, Long> g = (Function<Object, Long>) getter;
      this.versionGetter = g;
      return this;
    }

    public Builder<T> versionColumn(String column) {
      Objects.requireNonNull(column, "column");
      if (!COLUMN_NAME.matcher(column).matches()) {
        throw new MappingException("Invalid version column '" + column + "' for " + type.getName());
      }
      this.versionColumn = column;
      return this;
    }

    public Builder<T> softDelete() {
      this.softDelete = true;
      return this;
    }

    public Builder<T> expiresAfter(Duration span) {
      Objects.requireNonNull(span, "span");
      if (span.isNegative() || span.isZero()) throw new MappingException("Expiry span must be positive: " + span);
      this.expires = true;
      this.expirySpan = span;
      return this;
    }

    /** Takes the absolute expiration from the entity; a null value falls back to the expiry span. */
    public Builder<T> expiration(Function<? super T, Instant> getter) {
      Objects.requireNonNull(getter, "getter");
      @SuppressWarnings("unchecked")
      Function<Object, Instant> g = (Function<Object, Instant>) getter;
      this.expirationGetter = g;
      this.expires = true;
      return this;
    }

    public Builder<T> auditTrail() {
      this.auditTrail = true;
      return this;
    }

    public Builder<T> index(String name, Consumer<IndexSpec> definition) {
      IndexSpec spec = new IndexSpec(name);
      definition.accept(spec);
      indexes.add(spec);
      return this;
    }

    public Builder<T> foreignKey(String name, Consumer<ForeignKeySpec> definition) {
      ForeignKeySpec spec = new ForeignKeySpec(name);
      definition.accept(spec);
      mergeForeignKey(spec);
      return this;
    }

    public Builder<T> reader(RowReader<T> reader) {
      this.reader = Objects.requireNonNull(reader, "reader");
      return this;
    }

    public EntityMapping<T> build() {
      return build(MappingResolver.none());
    }

    public EntityMapping<T> build(MappingResolver resolver) {
      Objects.requireNonNull(resolver, "resolver");
      if (reader == null) throw new MappingException(type.getName() + " declares no row reader");

      List<ColumnDef> out = new ArrayList<>();
      Map<String, Function<Object, ?>> getters = new LinkedHashMap<>();
      Set<String> seen = new HashSet<>();
      int keyOrder = 0;
      for (ColumnSpec spec : columns) {
        if (notMapped.contains(spec.field)) continue;
        String column = spec.columnName();
        if (!seen.add(column.toLowerCase(Locale.ROOT))) {
          throw new MappingException(type.getName() + " maps two fields to column '" + column + "'");
        }
        if (!COLUMN_NAME.matcher(column).matches()) {
          throw new MappingException(type.getName() + "." + spec.field + ": column name '" + column
              + "' must be letters, digits and underscores, not starting with a digit");
        }
        if (SystemColumns.isReservedParameterName(column)) {
          throw new MappingException(type.getName() + "." + spec.field + " uses reserved column name '" + column + "'");
        }
        ColumnDef def = spec.toDef(spec.key ? keyOrder++ : -1);
        out.add(def);
        getters.put(spec.field, spec.getter);
      }

      List<ColumnDef> keys = new ArrayList<>();
      for (ColumnDef c : out) if (c.primaryKey()) keys.add(c);
      if (keys.isEmpty()) throw new MappingException(type.getName() + " declares no primary key");
      for (ColumnDef k : keys) {
        if (k.autoIncrement() && (keys.size() > 1 || !k.type().isIntegral())) {
          throw new MappingException(type.getName() + "." + k.field() + ": auto-increment needs a single integral key");
        }
      }
      for (ColumnDef c : out) {
        if (c.autoIncrement() && !c.primaryKey()) {
          throw new MappingException(type.getName() + "." + c.field() + ": auto-increment is only supported on the key");
        }
      }

      for (ColumnDef sys : systemColumns()) {
        if (!seen.add(sys.column().toLowerCase(Locale.ROOT))) {
          throw new MappingException(type.getName() + " column '" + sys.column() + "' collides with a system column");
        }
        out.add(sys);
      }

      List<IndexDef> indexDefs = new ArrayList<>();
      Set<String> indexNames = new HashSet<>();
      for (IndexSpec i : indexes) {
        if (!indexNames.add(i.name.toLowerCase(Locale.ROOT))) {
          throw new MappingException(type.getName() + " declares index '" + i.name + "' twice");
        }
        if (i.columns.isEmpty()) throw new MappingException("Index '" + i.name + "' on " + type.getName() + " has no columns");
        List<IndexDef.Column> cols = new ArrayList<>();
        for (IndexDef.Column c : i.columns) {
          cols.add(new IndexDef.Column(resolve(out, c.column(), "index '" + i.name + "'").column(), c.descending()));
        }
        indexDefs.add(new IndexDef(i.name, cols, i.unique, i.filter));
      }

      List<ForeignKeyDef> fkDefs = new ArrayList<>();
      for (ForeignKeySpec fk : foreignKeys.values()) fkDefs.add(resolveForeignKey(fk, out, resolver));

      return new EntityMapping<>(type, table, schema, out, softDelete, expires, expirySpan, auditTrail,
          indexDefs, fkDefs, getters, reader, versionGetter, expirationGetter);
    }

    private List<ColumnDef> systemColumns() {
      List<ColumnDef> sys = new ArrayList<>();
      sys.add(ColumnDef.system(versionColumn, ColumnType.BIGINT, ColumnRole.VERSION, true, null));
      sys.add(ColumnDef.system(SystemColumns.CREATED_TIME, ColumnType.TIMESTAMP, ColumnRole.CREATED_TIME, true, null));
      sys.add(ColumnDef.system(SystemColumns.LAST_WRITE_TIME, ColumnType.TIMESTAMP, ColumnRole.LAST_WRITE_TIME, true, null));
      if (softDelete) {
        sys.add(ColumnDef.system(SystemColumns.IS_DELETED, ColumnType.BOOLEAN, ColumnRole.SOFT_DELETE_FLAG, true, Boolean.FALSE));
      }
      if (expires) {
        sys.add(ColumnDef.system(SystemColumns.ABSOLUTE_EXPIRATION, ColumnType.TIMESTAMP, ColumnRole.EXPIRATION, false, null));
      }
      return sys;
    }

    private ForeignKeyDef resolveForeignKey(ForeignKeySpec fk, List<ColumnDef> own, MappingResolver resolver) {
      if (fk.target == null) throw new MappingException("Foreign key '" + fk.name + "' on " + type.getName() + " has no target type");
      if (fk.localFields.isEmpty()) throw new MappingException("Foreign key '" + fk.name + "' on " + type.getName() + " has no columns");

      String refSchema;
      String refTable;
      List<String> refColumns = new ArrayList<>();
      if (fk.target == type) {
        refSchema = schema;
        refTable = table;
        for (String f : fk.targetFields) refColumns.add(resolve(own, f, "foreign key '" + fk.name + "'").column());
      } else {
        EntityMapping<?> target = resolver.resolve(fk.target);
        refSchema = target.schema();
        refTable = target.table();
        for (String f : fk.targetFields) {
          ColumnDef c = target.findColumn(f).orElseThrow(() -> new MappingException(
              "Foreign key '" + fk.name + "' references unknown field '" + f + "' on " + fk.target.getName()));
          refColumns.add(c.column());
        }
      }
      List<String> cols = new ArrayList<>();
      for (String f : fk.localFields) cols.add(resolve(own, f, "foreign key '" + fk.name + "'").column());
      return new ForeignKeyDef(fk.name, cols, refSchema, refTable, refColumns, fk.onDelete, fk.onUpdate);
    }

    private ColumnDef resolve(List<ColumnDef> cols, String fieldOrColumn, String owner) {
      for (ColumnDef c : cols) if (c.field().equals(fieldOrColumn)) return c;
      for (ColumnDef c : cols) if (c.column().equalsIgnoreCase(fieldOrColumn)) return c;
      throw new MappingException(owner + " on " + type.getName() + " references unknown field '" + fieldOrColumn + "'");
    }

    private Builder<T> put(ColumnSpec spec) {
      for (int i = 0; i < columns.size(); i++) {
        if (columns.get(i).field.equals(spec.field)) {
          columns.set(i, spec);
          return this;
        }
      }
      columns.add(spec);
      return this;
    }

    private void mergeForeignKey(ForeignKeySpec spec) {
      ForeignKeySpec existing = foreignKeys.get(spec.name);
      if (existing == null) {
        foreignKeys.put(spec.name, spec);
        return;
      }
      if (existing.target != spec.target || existing.onDelete != spec.onDelete || existing.onUpdate != spec.onUpdate) {
        throw new MappingException("Foreign key '" + spec.name + "' on " + type.getName()
            + " has inconsistent target or cascade rules across its columns");
      }
      for (int i = 0; i < spec.localFields.size(); i++) {
        if (!existing.localFields.contains(spec.localFields.get(i))) {
          existing.localFields.add(spec.localFields.get(i));
          existing.targetFields.add(spec.targetFields.get(i));
        }
      }
    }

    @SuppressWarnings("unchecked")
    private static Function<Object, ?> erase(Function<?, ?> getter) {
      return (Function<Object, ?>) Objects.requireNonNull(getter, "getter");
    }
  }

  /** Column options; defaults to a nullable column named after the field. */
  public static final class ColumnSpec {
    private final String field;
    private final ColumnType type;
    private final Function<Object, ?> getter;
    private String column;
    private boolean key;
    private boolean notNull;
    private boolean autoIncrement;
    private boolean unique;
    private Integer size;
    private Integer precision;
    private Integer scale;
    private Object defaultValue;
    private String defaultExpression;
    private String check;
    private String checkName;

    private ColumnSpec(String field, ColumnType type, Function<Object, ?> getter) {
      this.field = Objects.requireNonNull(field, "field");
      this.type = Objects.requireNonNull(type, "type");
      this.getter = getter;
      if (field.isBlank()) throw new MappingException("Blank field name");
    }

    /** Column name when it differs from the capitalized field name. */
    public ColumnSpec column(String name) {
      this.column = Objects.requireNonNull(name, "name");
      return this;
    }

    public ColumnSpec notNull() {
      this.notNull = true;
      return this;
    }

    public ColumnSpec size(int size) {
      if (size <= 0) throw new MappingException("Column size must be positive: " + field);
      this.size = size;
      return this;
    }

    public ColumnSpec precision(int precision, int scale) {
      if (precision <= 0 || scale < 0 || scale > precision) {
        throw new MappingException("Invalid precision/scale " + precision + "/" + scale + " on " + field);
      }
      this.precision = precision;
      this.scale = scale;
      return this;
    }

    public ColumnSpec defaultValue(Object value) {
      this.defaultValue = value;
      return this;
    }

    public ColumnSpec defaultExpression(String sql) {
      this.defaultExpression = sql;
      return this;
    }

    public ColumnSpec autoIncrement() {
      this.autoIncrement = true;
      return this;
    }

    public ColumnSpec unique() {
      this.unique = true;
      return this;
    }

    public ColumnSpec check(String name, String sql) {
      this.checkName = Objects.requireNonNull(name, "name");
      this.check = Objects.requireNonNull(sql, "sql");
      return this;
    }

    String columnName() {
      if (column != null) return column;
      return Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }

    ColumnDef toDef(int keyOrder) {
      return new ColumnDef(field, columnName(), type, ColumnRole.DATA, notNull || key, keyOrder,
          autoIncrement, unique, size, precision, scale, defaultValue, defaultExpression, check, checkName);
    }

    ColumnSpec copy() {
      ColumnSpec c = new ColumnSpec(field, type, getter);
      c.column = column;
      c.key = key;
      c.notNull = notNull;
      c.autoIncrement = autoIncrement;
      c.unique = unique;
      c.size = size;
      c.precision = precision;
      c.scale = scale;
      c.defaultValue = defaultValue;
      c.defaultExpression = defaultExpression;
      c.check = check;
      c.checkName = checkName;
      return c;
    }
  }

  public static final class IndexSpec {
    private final String name;
    private final List<IndexDef.Column> columns = new ArrayList<>();
    private boolean unique;
    private String filter;

    private IndexSpec(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public IndexSpec on(String... fields) {
      for (String f : fields) columns.add(new IndexDef.Column(f, false));
      return this;
    }

    public IndexSpec onDescending(String field) {
      columns.add(new IndexDef.Column(field, true));
      return this;
    }

    public IndexSpec unique() {
      this.unique = true;
      return this;
    }

    /** Partial-index predicate, emitted verbatim. */
    public IndexSpec where(String predicate) {
      this.filter = predicate;
      return this;
    }

    IndexSpec copy() {
      IndexSpec i = new IndexSpec(name);
      i.columns.addAll(columns);
      i.unique = unique;
      i.filter = filter;
      return i;
    }
  }

  public static final class ForeignKeySpec {
    private final String name;
    private final List<String> localFields = new ArrayList<>();
    private final List<String> targetFields = new ArrayList<>();
    private Class<?> target;
    private ForeignKeyAction onDelete = ForeignKeyAction.NO_ACTION;
    private ForeignKeyAction onUpdate = ForeignKeyAction.NO_ACTION;

    private ForeignKeySpec(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    /** Pairs a local field with a field of the referenced type. */
    public ForeignKeySpec column(String localField, String targetField) {
      localFields.add(Objects.requireNonNull(localField, "localField"));
      targetFields.add(Objects.requireNonNull(targetField, "targetField"));
      return this;
    }

    public ForeignKeySpec references(Class<?> target) {
      this.target = Objects.requireNonNull(target, "target");
      return this;
    }

    public ForeignKeySpec onDelete(ForeignKeyAction action) {
      this.onDelete = Objects.requireNonNull(action, "action");
      return this;
    }

    public ForeignKeySpec onUpdate(ForeignKeyAction action) {
      this.onUpdate = Objects.requireNonNull(action, "action");
      return this;
    }

    ForeignKeySpec copy() {
      ForeignKeySpec f = new ForeignKeySpec(name);
      f.localFields.addAll(localFields);
      f.targetFields.addAll(targetFields);
      f.target = target;
      f.onDelete = onDelete;
      f.onUpdate = onUpdate;
      return f;
    }
  }
}
