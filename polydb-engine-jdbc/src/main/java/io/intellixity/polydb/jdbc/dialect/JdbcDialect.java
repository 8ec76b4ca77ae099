package io.intellixity.polydb.jdbc.dialect;

import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.SqlStatement;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.spi.coerce.ColumnKind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** Statement rendering and parameter binding for one SQL engine. */
public interface JdbcDialect {
  String id();

  String quoteIdent(String ident);

  /** {@code schema.table} with both parts quoted; schema omitted when blank. */
  String qualify(String schema, String table);

  ColumnKind kindOf(String declaredType);

  /**
   * @param columnTypes declared column types of the unit; filter keys outside it are rejected
   */
  SqlStatement renderSelect(String schema, String table, Map<String, String> columnTypes,
                            WhereCondition where, List<String> orderBy, OffsetPage page);

  SqlStatement renderInsert(String schema, String table, Map<String, String> columnTypes, List<Record> values);

  /** {@code null} values in {@code where} render as {@code IS NULL}. */
  SqlStatement renderUpdate(String schema, String table, Map<String, String> columnTypes,
                            Map<String, String> sets, Map<String, String> where);

  SqlStatement renderDelete(String schema, String table, Map<String, String> columnTypes, Map<String, String> where);

  SqlStatement renderCreateTable(String schema, String table, List<Record> fields);

  void bind(PreparedStatement ps, int position, SqlBind bind) throws SQLException;
}
