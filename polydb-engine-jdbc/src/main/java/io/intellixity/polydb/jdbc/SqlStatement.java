package io.intellixity.polydb.jdbc;

import java.util.List;

/** Rendered SQL with {@code :bN} placeholders and its ordered binds. */
public record SqlStatement(String sql, List<SqlBind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<SqlBind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
