package io.intellixity.polydb.jdbc.clickhouse;

import io.intellixity.polydb.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.spi.coerce.ColumnKind;

import java.util.List;

/**
 * ClickHouse dialect.
 *
 * Row edits are asynchronous mutations ({@code ALTER TABLE ... UPDATE/DELETE}); created tables use the
 * MergeTree engine ordered by their primary key.
 */
public final class ClickHouseDialect extends AbstractSqlDialect {
  @Override public String id() { return "clickhouse"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("\\", "\\\\").replace("`", "``") + "`";
  }

  /** Classifies the wrapped type of {@code Nullable(T)} and {@code LowCardinality(T)}. */
  @Override
  public ColumnKind kindOf(String declaredType) {
    return super.kindOf(unwrap(declaredType));
  }

  static String unwrap(String type) {
    if (type == null) return null;
    String t = type.trim();
    while (true) {
      String inner = unwrapOne(t, "Nullable(");
      if (inner == null) inner = unwrapOne(t, "LowCardinality(");
      if (inner == null) return t;
      t = inner;
    }
  }

  private static String unwrapOne(String t, String prefix) {
    if (t.startsWith(prefix) && t.endsWith(")")) return t.substring(prefix.length(), t.length() - 1).trim();
    return null;
  }

  @Override
  protected String likeExpr(String expr, ColumnKind kind) {
    return kind == ColumnKind.TEXT ? expr : "toString(" + expr + ")";
  }

  @Override
  protected String updatePrefix(String schema, String table) {
    return "ALTER TABLE " + qualify(schema, table) + " UPDATE ";
  }

  @Override
  protected String deletePrefix(String schema, String table) {
    return "ALTER TABLE " + qualify(schema, table) + " DELETE WHERE ";
  }

  @Override
  protected String columnDefinition(Record field) {
    String type = field.value().trim();
    boolean nullable = field.nullable() && !field.flag(Record.PRIMARY);
    return quoteIdent(field.key()) + " " + (nullable ? "Nullable(" + type + ")" : type);
  }

  @Override
  protected String createTableSuffix(List<String> primaryKey) {
    String order = primaryKey.isEmpty()
        ? "tuple()"
        : "(" + String.join(", ", primaryKey.stream().map(this::quoteIdent).toList()) + ")";
    return " ENGINE = MergeTree() ORDER BY " + order;
  }
}
