package io.intellixity.polydb.jdbc;

import io.intellixity.polydb.jdbc.dialect.JdbcDialect;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.spi.coerce.ColumnKind;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/** Maps a JDBC result set onto the string-valued {@link RowsResult} shape. */
public final class JdbcRows {
  private JdbcRows() {}

  /**
   * @param declared column metadata from catalog introspection, in select order; {@code null} to use the
   *                 driver's result set metadata
   */
  public static RowsResult read(ResultSet rs, List<Column> declared, boolean disableUpdate, JdbcDialect dialect)
      throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<Column> columns = new ArrayList<>(n);
    if (declared != null && declared.size() == n) {
      columns.addAll(declared);
    } else {
      for (int i = 1; i <= n; i++) {
        String label = md.getColumnLabel(i);
        columns.add(new Column(label == null || label.isBlank() ? md.getColumnName(i) : label, md.getColumnTypeName(i)));
      }
    }

    ColumnKind[] kinds = new ColumnKind[n];
    for (int i = 0; i < n; i++) kinds[i] = dialect.kindOf(columns.get(i).type());

    List<List<String>> rows = new ArrayList<>();
    while (rs.next()) {
      List<String> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) row.add(cell(rs, i, kinds[i - 1]));
      rows.add(row);
    }
    return new RowsResult(columns, rows, disableUpdate);
  }

  static String cell(ResultSet rs, int i, ColumnKind kind) throws SQLException {
    switch (kind) {
      case BINARY: {
        byte[] bytes = rs.getBytes(i);
        return bytes == null ? null : "0x" + HexFormat.of().formatHex(bytes);
      }
      case BOOLEAN: {
        Object v = rs.getObject(i);
        if (v == null) return null;
        if (v instanceof Boolean b) return b.toString();
        if (v instanceof Number num) return String.valueOf(num.intValue() != 0);
        return v.toString();
      }
      default:
        return rs.getString(i);
    }
  }
}
