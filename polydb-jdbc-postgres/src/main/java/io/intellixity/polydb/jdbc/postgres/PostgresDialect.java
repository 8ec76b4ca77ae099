package io.intellixity.polydb.jdbc.postgres;

import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides and bind behavior.
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String likeExpr(String expr, ColumnKind kind) {
    return kind == ColumnKind.TEXT ? expr : "CAST(" + expr + " AS TEXT)";
  }

  @Override
  public void bind(PreparedStatement ps, int position, SqlBind bind) throws SQLException {
    Object v = bind.value();
    switch (bind.kind()) {
      case JSON -> {
        if (v == null) {
          ps.setNull(position, Types.OTHER);
          return;
        }
        PGobject obj = new PGobject();
        obj.setType("jsonb");
        obj.setValue(String.valueOf(v));
        ps.setObject(position, obj);
      }
      // Untyped text lets the server infer enum, citext and domain targets.
      case TEXT -> {
        if (v == null) ps.setNull(position, Types.VARCHAR);
        else ps.setObject(position, v, Types.OTHER);
      }
      default -> super.bind(ps, position, bind);
    }
  }
}
