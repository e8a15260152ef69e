package io.intellixity.vellum.persistence.jdbc.translate;

import io.intellixity.vellum.persistence.mapping.*;
import io.intellixity.vellum.persistence.query.*;
import io.intellixity.vellum.persistence.spi.sql.SqlDialect;

import java.time.Clock;
import java.util.*;

/**
 * Renders predicate trees, ordering and paging for one mapping.
 *
 * <p>Every binary node is fully parenthesized, so source precedence survives. Each non-null literal
 * becomes one {@code @pN} parameter, numbered in left-to-right walk order; nulls compared with
 * {@code =} or {@code <>} become {@code IS [NOT] NULL} and use no parameter.</p>
 */
public final class ExpressionTranslator {
  private final EntityMapping<?> mapping;
  private final SqlDialect dialect;
  private final Clock clock;

  public ExpressionTranslator(EntityMapping<?> mapping, SqlDialect dialect, Clock clock) {
    this.mapping = Objects.requireNonNull(mapping, "mapping");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TranslatedPredicate translatePredicate(Predicate predicate) {
    if (predicate == null) return TranslatedPredicate.empty();
    Renderer r = new Renderer();
    String sql = predicate.accept(r);
    return new TranslatedPredicate(sql, r.params);
  }

  public String translateOrderBy(OrderBy orderBy) {
    if (orderBy == null || orderBy.keys().isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (OrderBy.Key k : orderBy.keys()) {
      ColumnDef c = column(k.field(), "OrderBy");
      parts.add(dialect.quoteIdent(c.column()) + (k.direction() == OrderBy.Direction.DESC ? " DESC" : " ASC"));
    }
    return "ORDER BY " + String.join(", ", parts);
  }

  public TranslatedPredicate translateSelect(Predicate predicate, SelectOptions options) {
    return translateSelect(null, predicate, options);
  }

  /**
   * {@code SELECT <cols> FROM <table> [WHERE ...] [ORDER BY ...] [LIMIT/OFFSET]}.
   * Conjuncts: key, predicate, soft-delete filter, expiry filter.
   */
  public TranslatedPredicate translateSelect(EntityKey key, Predicate predicate, SelectOptions options) {
    SelectOptions o = options == null ? SelectOptions.defaults() : options;
    List<String> cols = new ArrayList<>();
    for (ColumnDef c : mapping.columns()) cols.add(dialect.quoteIdent(c.column()));

    Map<String, Object> params = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", cols))
        .append(" FROM ").append(table());
    appendWhere(sql, params, key, predicate, o);

    String order = translateOrderBy(o.orderBy());
    if (!order.isEmpty()) sql.append(' ').append(order);
    sql.append(dialect.limitOffset(o.limit(), o.offset()));
    return new TranslatedPredicate(sql.toString(), params);
  }

  /** {@code SELECT COUNT(1) FROM <table> [WHERE ...]}; ordering and paging are ignored. */
  public TranslatedPredicate translateCount(Predicate predicate, SelectOptions options) {
    SelectOptions o = options == null ? SelectOptions.defaults() : options;
    Map<String, Object> params = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder("SELECT COUNT(1) FROM ").append(table());
    appendWhere(sql, params, null, predicate, o);
    return new TranslatedPredicate(sql.toString(), params);
  }

  /** {@code col1 = @col1 AND ...} over the key columns. */
  public String keyCondition() {
    List<String> parts = new ArrayList<>();
    for (ColumnDef k : mapping.keyColumns()) parts.add(dialect.quoteIdent(k.column()) + " = " + k.parameter());
    return String.join(" AND ", parts);
  }

  public Map<String, Object> keyParameters(EntityKey key) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ColumnDef k : mapping.keyColumns()) {
      Object v = key.get(k.column());
      if (v == null) throw new IllegalArgumentException("Key " + key + " has no value for " + k.column());
      out.put(k.parameter(), v);
    }
    return out;
  }

  public String notDeletedCondition() {
    return mapping.role(ColumnRole.SOFT_DELETE_FLAG)
        .map(c -> dialect.quoteIdent(c.column()) + " = " + dialect.booleanLiteral(false))
        .orElse("");
  }

  public String notExpiredCondition() {
    return mapping.role(ColumnRole.EXPIRATION)
        .map(c -> {
          String col = dialect.quoteIdent(c.column());
          return "(" + col + " IS NULL OR " + col + " > " + SystemColumns.NOW_PARAM + ")";
        })
        .orElse("");
  }

  private void appendWhere(StringBuilder sql, Map<String, Object> params, EntityKey key, Predicate predicate, SelectOptions o) {
    List<String> conjuncts = new ArrayList<>();
    if (key != null) {
      conjuncts.add(keyCondition());
      params.putAll(keyParameters(key));
    }
    if (predicate != null) {
      TranslatedPredicate tp = translatePredicate(predicate);
      conjuncts.add(tp.sql());
      params.putAll(tp.parameters());
    }
    if (!o.includeDeleted() && mapping.softDelete()) conjuncts.add(notDeletedCondition());
    if (!o.includeExpired() && mapping.expires()) {
      conjuncts.add(notExpiredCondition());
      params.put(SystemColumns.NOW_PARAM, clock.instant());
    }
    if (!conjuncts.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", conjuncts));
  }

  private String table() { return dialect.qualifiedTable(mapping.schema(), mapping.table()); }

  private ColumnDef column(String name, String nodeKind) {
    Optional<ColumnDef> c = mapping.findColumn(name);
    if (c.isPresent()) return c.get();
    if (("Id".equalsIgnoreCase(name) || "Key".equalsIgnoreCase(name)) && mapping.keyColumns().size() == 1) {
      return mapping.keyColumns().get(0);
    }
    throw new UnsupportedExpressionException(nodeKind,
        "unknown field '" + name + "' on " + mapping.type().getSimpleName());
  }

  private final class Renderer implements PredicateVisitor<String> {
    private final Map<String, Object> params = new LinkedHashMap<>();
    private int next;

    private String bind(Object value, String nodeKind) {
      if (!dialect.supportsParameter(value)) {
        throw new UnsupportedExpressionException(nodeKind,
            "literal of type " + value.getClass().getName() + " is not supported");
      }
      String name = "@p" + (next++);
      params.put(name, value);
      return name;
    }

    private String operand(Operand o, String nodeKind) {
      if (o instanceof FieldRef f) return dialect.quoteIdent(column(f.name(), nodeKind).column());
      return bind(((Literal) o).value(), nodeKind);
    }

    @Override
    public String visit(Comparison c) {
      Operand l = c.left();
      Operand r = c.right();
      boolean lNull = l instanceof Literal ll && ll.isNull();
      boolean rNull = r instanceof Literal rl && rl.isNull();
      if (lNull || rNull) {
        if (c.operator().isRelational()) {
          throw new UnsupportedExpressionException("Comparison",
              "operator " + c.operator().sql() + " cannot be applied to NULL");
        }
        if (lNull && rNull) {
          throw new UnsupportedExpressionException("Comparison", "both operands are NULL");
        }
        Operand other = lNull ? r : l;
        if (!(other instanceof FieldRef)) {
          throw new UnsupportedExpressionException("Comparison", "NULL can only be compared with a field");
        }
        String col = operand(other, "Comparison");
        return "(" + col + (c.operator() == Operator.EQ ? " IS NULL)" : " IS NOT NULL)");
      }
      String left = operand(l, "Comparison");
      String right = operand(r, "Comparison");
      return "(" + left + " " + c.operator().sql() + " " + right + ")";
    }

    @Override
    public String visit(AndPredicate and) {
      String left = and.left().accept(this);
      String right = and.right().accept(this);
      return "(" + left + " AND " + right + ")";
    }

    @Override
    public String visit(OrPredicate or) {
      String left = or.left().accept(this);
      String right = or.right().accept(this);
      return "(" + left + " OR " + right + ")";
    }

    @Override
    public String visit(NotPredicate not) {
      return "(NOT " + not.operand().accept(this) + ")";
    }

    @Override
    public String visit(StringMatch m) {
      ColumnDef c = column(m.field().name(), "StringMatch");
      if (!c.type().isText()) {
        throw new UnsupportedExpressionException("StringMatch",
            "column " + c.column() + " is " + c.type() + ", not text");
      }
      if (!(m.pattern().value() instanceof String s)) {
        throw new UnsupportedExpressionException("StringMatch", "pattern must be a non-null string");
      }
      return "(" + dialect.quoteIdent(c.column()) + " LIKE " + bind(m.kind().likePattern(s), "StringMatch") + ")";
    }

    @Override
    public String visit(NullCheck n) {
      String col = dialect.quoteIdent(column(n.field().name(), "NullCheck").column());
      return "(" + col + (n.isNull() ? " IS NULL)" : " IS NOT NULL)");
    }

    @Override
    public String visit(InList in) {
      String col = dialect.quoteIdent(column(in.field().name(), "InList").column());
      if (in.values().isEmpty()) return "(1 = 0)";
      List<String> names = new ArrayList<>(in.values().size());
      for (Literal v : in.values()) {
        if (v.isNull()) throw new UnsupportedExpressionException("InList", "NULL is not allowed in an IN list");
        names.add(bind(v.value(), "InList"));
      }
      return "(" + col + " IN (" + String.join(", ", names) + "))";
    }
  }
}
