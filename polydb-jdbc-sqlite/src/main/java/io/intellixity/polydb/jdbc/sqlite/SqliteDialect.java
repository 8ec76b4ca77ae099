package io.intellixity.polydb.jdbc.sqlite;

import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.dialect.AbstractSqlDialect;

import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.UUID;

/**
 * SQLite dialect.
 *
 * SQLite stores temporals as text: they are bound in the {@code yyyy-MM-dd HH:mm:ss} form its date
 * functions produce. Booleans are bound as 1/0.
 */
public final class SqliteDialect extends AbstractSqlDialect {
  private static final DateTimeFormatter SQL_TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .toFormatter();

  @Override public String id() { return "sqlite"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public void bind(PreparedStatement ps, int position, SqlBind bind) throws SQLException {
    Object v = bind.value();
    if (v instanceof Boolean b) {
      ps.setInt(position, b ? 1 : 0);
    } else if (v instanceof LocalDateTime t) {
      ps.setString(position, SQL_TIMESTAMP.format(t));
    } else if (v instanceof OffsetDateTime t) {
      ps.setString(position, SQL_TIMESTAMP.format(t.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime()));
    } else if (v instanceof LocalDate t) {
      ps.setString(position, t.toString());
    } else if (v instanceof LocalTime t) {
      ps.setString(position, DateTimeFormatter.ISO_LOCAL_TIME.format(t));
    } else if (v instanceof UUID || v instanceof BigInteger) {
      ps.setString(position, v.toString());
    } else {
      super.bind(ps, position, bind);
    }
  }
}
