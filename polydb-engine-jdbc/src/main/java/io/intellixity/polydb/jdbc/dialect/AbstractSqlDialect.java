package io.intellixity.polydb.jdbc.dialect;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.SqlStatement;
import io.intellixity.polydb.jdbc.SqlStatement.ExecKind;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.query.AtomicCondition;
import io.intellixity.polydb.query.Clause;
import io.intellixity.polydb.query.LogicalGroup;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.query.WhereConditionVisitor;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import io.intellixity.polydb.spi.coerce.ValueCoercion;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - select: unit + WhereCondition filter + primary-key order + offset paging
 * - DML: insert/update/delete from string-valued row maps, coerced per declared column type
 * - DDL: create table from field records
 *
 * Every value is bound as a parameter. DB-specific dialects override hooks for quoting, paging,
 * LIKE on non-text columns, DDL suffixes and value binding.
 */
public abstract class AbstractSqlDialect implements JdbcDialect {
  private static final Pattern TYPE_NAME = Pattern.compile(
      "[A-Za-z][A-Za-z0-9_]*( [A-Za-z][A-Za-z0-9_]*)*(\\(\\s*\\d+(\\s*,\\s*\\d+)?\\s*\\))?( ?\\[\\])?");

  protected static final class RenderCtx {
    private int n = 1;
    private final List<SqlBind> binds = new ArrayList<>();

    public String add(SqlBind b) {
      binds.add(b);
      return ":b" + (n++);
    }

    public List<SqlBind> binds() { return binds; }
  }

  protected record RenderedPredicate(String sql, List<SqlBind> binds) {}

  @Override
  public String qualify(String schema, String table) {
    if (schema == null || schema.isBlank()) return quoteIdent(table);
    return quoteIdent(schema) + "." + quoteIdent(table);
  }

  @Override
  public ColumnKind kindOf(String declaredType) {
    return ColumnKind.classify(declaredType);
  }

  @Override
  public SqlStatement renderSelect(String schema, String table, Map<String, String> columnTypes,
                                   WhereCondition where, List<String> orderBy, OffsetPage page) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT ");
    List<String> cols = new ArrayList<>();
    for (String c : columnTypes.keySet()) cols.add(quoteIdent(c));
    sql.append(cols.isEmpty() ? "*" : String.join(", ", cols));
    sql.append(" FROM ").append(qualify(schema, table));

    if (where != null) {
      String predicate = renderPredicateSql(where, columnTypes, ctx);
      if (!predicate.isBlank()) sql.append(" WHERE ").append(stripParensIfAny(predicate));
    }
    if (orderBy != null && !orderBy.isEmpty()) {
      sql.append(" ORDER BY ").append(String.join(", ", orderBy.stream().map(this::quoteIdent).toList()));
    }
    String out = page == null ? sql.toString() : applyOffsetPage(sql.toString(), page, ctx);
    return new SqlStatement(out, ctx.binds(), ExecKind.QUERY);
  }

  /** Default {@code LIMIT ? OFFSET ?}; both bound. */
  protected String applyOffsetPage(String sql, OffsetPage page, RenderCtx ctx) {
    String limit = ctx.add(SqlBind.of((long) page.limit(), ColumnKind.INTEGER));
    String offset = ctx.add(SqlBind.of((long) page.offset(), ColumnKind.INTEGER));
    return sql + " LIMIT " + limit + " OFFSET " + offset;
  }

  protected RenderedPredicate renderPredicate(WhereCondition where, Map<String, String> columnTypes) {
    if (where == null) return new RenderedPredicate("", List.of());
    RenderCtx ctx = new RenderCtx();
    String sql = renderPredicateSql(where, columnTypes, ctx);
    return new RenderedPredicate(sql, ctx.binds());
  }

  private String renderPredicateSql(WhereCondition where, Map<String, String> columnTypes, RenderCtx ctx) {
    return where.accept(new WhereConditionVisitor<String>() {
      @Override
      public String visit(AtomicCondition c) {
        return renderAtomic(c, columnTypes, ctx);
      }

      @Override
      public String visit(LogicalGroup g) {
        List<String> childSql = new ArrayList<>();
        for (WhereCondition child : g.children()) {
          String s = child.accept(this);
          if (s == null || s.isBlank()) continue;
          childSql.add(s);
        }
        if (childSql.isEmpty()) return "";
        if (childSql.size() == 1) return childSql.get(0);
        String sep = (g.clause() == Clause.OR) ? " OR " : " AND ";
        return "(" + String.join(sep, childSql) + ")";
      }
    });
  }

  private String renderAtomic(AtomicCondition c, Map<String, String> columnTypes, RenderCtx ctx) {
    if (!columnTypes.containsKey(c.key())) {
      throw EngineException.malformedFilter(c.key(), "unknown column");
    }
    String declared = columnTypes.get(c.key());
    if (declared == null || declared.isBlank()) declared = c.columnType();
    ColumnKind kind = kindOf(declared);
    String expr = quoteIdent(c.key());

    return switch (c.operator()) {
      case IS_NULL -> expr + " IS NULL";
      case IS_NOT_NULL -> expr + " IS NOT NULL";
      case LIKE -> likeExpr(expr, kind) + " LIKE " + ctx.add(SqlBind.of(c.value(), ColumnKind.TEXT));
      case NOT_LIKE -> likeExpr(expr, kind) + " NOT LIKE " + ctx.add(SqlBind.of(c.value(), ColumnKind.TEXT));
      case IN -> listSql(expr, "IN", c, kind, ctx);
      case NOT_IN -> listSql(expr, "NOT IN", c, kind, ctx);
      case NE -> expr + " <> " + filterBind(c.key(), c.value(), kind, ctx);
      default -> expr + " " + c.operator().symbol() + " " + filterBind(c.key(), c.value(), kind, ctx);
    };
  }

  private String listSql(String expr, String op, AtomicCondition c, ColumnKind kind, RenderCtx ctx) {
    List<String> values = c.values();
    if (values.isEmpty()) return "NOT IN".equals(op) ? "1 = 1" : "1 = 0";
    List<String> ph = new ArrayList<>();
    for (String v : values) ph.add(filterBind(c.key(), v, kind, ctx));
    return expr + " " + op + " (" + String.join(", ", ph) + ")";
  }

  private String filterBind(String column, String raw, ColumnKind kind, RenderCtx ctx) {
    Object v = ValueCoercion.coerce(kind, raw, column, ValueCoercion.Mode.FILTER);
    return ctx.add(SqlBind.of(v, kind));
  }

  /** Expression a LIKE pattern is matched against; dialects cast non-text columns where needed. */
  protected String likeExpr(String expr, ColumnKind kind) {
    return expr;
  }

  @Override
  public SqlStatement renderInsert(String schema, String table, Map<String, String> columnTypes, List<Record> values) {
    if (values == null || values.isEmpty()) throw EngineException.malformedInput(table, "row has no values");
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    for (Record r : values) {
      cols.add(quoteIdent(requireColumn(columnTypes, table, r.key())));
      ph.add(writeBind(r.key(), r.value(), columnTypes.get(r.key()), ctx));
    }
    String sql = "INSERT INTO " + qualify(schema, table) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderUpdate(String schema, String table, Map<String, String> columnTypes,
                                   Map<String, String> sets, Map<String, String> where) {
    if (sets == null || sets.isEmpty()) throw EngineException.malformedInput(table, "update has no columns to set");
    RenderCtx ctx = new RenderCtx();
    List<String> parts = new ArrayList<>();
    for (var e : sets.entrySet()) {
      parts.add(quoteIdent(requireColumn(columnTypes, table, e.getKey())) + " = " +
          writeBind(e.getKey(), e.getValue(), columnTypes.get(e.getKey()), ctx));
    }
    String predicate = rowPredicate(table, columnTypes, where, ctx);
    String sql = updatePrefix(schema, table) + String.join(", ", parts) + " WHERE " + predicate;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(String schema, String table, Map<String, String> columnTypes, Map<String, String> where) {
    RenderCtx ctx = new RenderCtx();
    String predicate = rowPredicate(table, columnTypes, where, ctx);
    return new SqlStatement(deletePrefix(schema, table) + predicate, ctx.binds(), ExecKind.UPDATE);
  }

  protected String updatePrefix(String schema, String table) {
    return "UPDATE " + qualify(schema, table) + " SET ";
  }

  protected String deletePrefix(String schema, String table) {
    return "DELETE FROM " + qualify(schema, table) + " WHERE ";
  }

  private String rowPredicate(String table, Map<String, String> columnTypes, Map<String, String> where, RenderCtx ctx) {
    if (where == null || where.isEmpty()) {
      throw EngineException.malformedInput(table, "refusing to modify rows without a row predicate");
    }
    List<String> terms = new ArrayList<>();
    for (var e : where.entrySet()) {
      String col = quoteIdent(requireColumn(columnTypes, table, e.getKey()));
      if (e.getValue() == null) {
        terms.add(col + " IS NULL");
      } else {
        ColumnKind kind = kindOf(columnTypes.get(e.getKey()));
        Object v = ValueCoercion.coerce(kind, e.getValue(), e.getKey(), ValueCoercion.Mode.WRITE);
        terms.add(v == null ? col + " IS NULL" : col + " = " + ctx.add(SqlBind.of(v, kind)));
      }
    }
    return String.join(" AND ", terms);
  }

  private String writeBind(String column, String raw, String declaredType, RenderCtx ctx) {
    ColumnKind kind = kindOf(declaredType);
    Object v = ValueCoercion.coerce(kind, raw, column, ValueCoercion.Mode.WRITE);
    return ctx.add(SqlBind.of(v, kind));
  }

  private static String requireColumn(Map<String, String> columnTypes, String table, String column) {
    if (!columnTypes.containsKey(column)) {
      throw EngineException.malformedInput(column, "unknown column of '" + table + "'");
    }
    return column;
  }

  @Override
  public SqlStatement renderCreateTable(String schema, String table, List<Record> fields) {
    if (table == null || table.isBlank()) throw EngineException.malformedInput("storageUnit", "storage unit name is required");
    if (fields == null || fields.isEmpty()) throw EngineException.malformedInput(table, "storage unit needs at least one field");
    Map<String, Record> byName = new LinkedHashMap<>();
    List<String> primary = new ArrayList<>();
    for (Record f : fields) {
      if (f.key().isBlank()) throw EngineException.malformedInput(table, "field name is required");
      if (byName.put(f.key(), f) != null) throw EngineException.malformedInput(f.key(), "duplicate field");
      if (f.value() == null || !TYPE_NAME.matcher(f.value().trim()).matches()) {
        throw EngineException.malformedInput(f.key(), "invalid column type '" + f.value() + "'");
      }
      if (f.flag(Record.PRIMARY)) primary.add(f.key());
    }
    List<String> defs = new ArrayList<>();
    for (Record f : byName.values()) defs.add(columnDefinition(f));
    if (!primary.isEmpty()) {
      defs.add("PRIMARY KEY (" + String.join(", ", primary.stream().map(this::quoteIdent).toList()) + ")");
    }
    String sql = "CREATE TABLE " + qualify(schema, table) + " (" + String.join(", ", defs) + ")" + createTableSuffix(primary);
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }

  protected String columnDefinition(Record field) {
    String def = quoteIdent(field.key()) + " " + field.value().trim();
    return field.nullable() && !field.flag(Record.PRIMARY) ? def : def + " NOT NULL";
  }

  protected String createTableSuffix(List<String> primaryKey) {
    return "";
  }

  @Override
  public void bind(PreparedStatement ps, int position, SqlBind bind) throws SQLException {
    Object v = bind.value();
    if (v == null) {
      ps.setNull(position, sqlType(bind.kind()));
      return;
    }
    if (v instanceof byte[] bytes) {
      ps.setBytes(position, bytes);
      return;
    }
    ps.setObject(position, v);
  }

  protected int sqlType(ColumnKind kind) {
    return switch (kind) {
      case INTEGER -> Types.BIGINT;
      case DECIMAL -> Types.DECIMAL;
      case FLOAT -> Types.DOUBLE;
      case BOOLEAN -> Types.BOOLEAN;
      case DATE -> Types.DATE;
      case TIME -> Types.TIME;
      case TIMESTAMP -> Types.TIMESTAMP;
      case BINARY -> Types.BINARY;
      case UUID, JSON -> Types.OTHER;
      case TEXT -> Types.VARCHAR;
    };
  }

  protected String stripParensIfAny(String s) {
    if (s == null) return null;
    String t = s.trim();
    if (!t.startsWith("(") || !t.endsWith(")")) return t;
    // Only strip when the outer pair encloses the whole expression.
    int depth = 0;
    for (int i = 0; i < t.length(); i++) {
      char ch = t.charAt(i);
      if (ch == '(') depth++;
      else if (ch == ')') depth--;
      if (depth == 0 && i < t.length() - 1) return t;
    }
    return t.substring(1, t.length() - 1);
  }
}
