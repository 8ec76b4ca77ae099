package io.intellixity.polydb.jdbc.mysql;

import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.polydb.spi.coerce.ColumnKind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Locale;
import java.util.UUID;

/**
 * MySQL / MariaDB dialect.
 *
 * Backtick identifiers. {@code tinyint(1)} and {@code bit(1)} are treated as booleans, matching
 * Connector/J's default mapping.
 */
public final class MySqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public ColumnKind kindOf(String declaredType) {
    if (declaredType != null) {
      String t = declaredType.trim().toLowerCase(Locale.ROOT).replace(" ", "");
      if (t.equals("tinyint(1)") || t.equals("bit(1)")) return ColumnKind.BOOLEAN;
      if (t.startsWith("enum(") || t.startsWith("set(")) return ColumnKind.TEXT;
    }
    return super.kindOf(declaredType);
  }

  @Override
  public void bind(PreparedStatement ps, int position, SqlBind bind) throws SQLException {
    Object v = bind.value();
    // No native uuid/json parameter types: both travel as strings.
    if (v instanceof UUID || (bind.kind() == ColumnKind.JSON && v != null)) {
      ps.setString(position, v.toString());
      return;
    }
    super.bind(ps, position, bind);
  }

  @Override
  protected int sqlType(ColumnKind kind) {
    return switch (kind) {
      case UUID, JSON -> Types.VARCHAR;
      default -> super.sqlType(kind);
    };
  }
}
