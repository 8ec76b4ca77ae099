package io.intellixity.polydb.jdbc.sqlite;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.jdbc.AbstractJdbcPlugin;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.jdbc.connect.JdbcTarget;
import io.intellixity.polydb.jdbc.connect.JdbcUrls;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.spi.chat.ChatModel;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite adapter over a database file.
 *
 * <p>{@code Credentials.database} is the file path. The file is the only database and {@code main} its
 * only schema; a blank schema means {@code main}. The catalog is read through the PRAGMA table-valued
 * functions.</p>
 */
public final class SqlitePlugin extends AbstractJdbcPlugin {
  static final String MAIN = "main";

  private static final String USER_TABLE = "m.type = 'table' AND m.name NOT LIKE 'sqlite!_%' ESCAPE '!'";

  public SqlitePlugin(JdbcConnector connector, ChatModel chatModel) {
    super(DatabaseType.SQLITE, new SqliteDialect(), connector, chatModel);
  }

  public SqlitePlugin() {
    this(null, null);
  }

  @Override
  protected JdbcTarget target(PluginConfig config) {
    Credentials c = config.credentials();
    if (c.database() == null || c.database().isBlank()) {
      throw EngineException.malformedInput("database", "sqlite needs the database file path");
    }
    Map<String, String> props = new LinkedHashMap<>(c.advanced());
    props.putIfAbsent("foreign_keys", "true");
    config.timeoutOpt().ifPresent(t -> props.putIfAbsent("busy_timeout", String.valueOf(t.toMillis())));
    return new JdbcTarget("jdbc:sqlite:" + JdbcUrls.filePath(c.database()), null, null, props);
  }

  @Override
  protected String resolveSchema(String schema) {
    if (schema == null || schema.isBlank() || MAIN.equalsIgnoreCase(schema)) return MAIN;
    throw EngineException.malformedInput(schema, "sqlite exposes only the 'main' schema");
  }

  @Override
  protected List<String> primaryKey(Connection c, String schema, String table) throws SQLException {
    List<String> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement("SELECT name FROM pragma_table_info(?, ?) WHERE pk > 0 ORDER BY pk")) {
      ps.setString(1, table);
      ps.setString(2, schema);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) out.add(rs.getString(1));
      }
    }
    return out;
  }

  @Override
  protected String databasesQuery() {
    return "SELECT file FROM pragma_database_list WHERE name = 'main'";
  }

  @Override
  protected String schemasQuery() {
    return "SELECT name FROM pragma_database_list WHERE name = 'main'";
  }

  @Override
  protected String columnsQuery() {
    return "WITH x AS (SELECT ? AS s) SELECT m.name, p.name, p.type " +
        "FROM x, sqlite_master m, pragma_table_info(m.name, x.s) p WHERE " + USER_TABLE + " ORDER BY m.name, p.cid";
  }

  @Override
  protected String tableColumnsQuery() {
    return "WITH x AS (SELECT ? AS s, ? AS t) SELECT p.name, p.type FROM x, pragma_table_info(x.t, x.s) p ORDER BY p.cid";
  }

  @Override
  protected String foreignKeysQuery() {
    return "WITH x AS (SELECT ? AS s) " +
        "SELECT 'fk_' || m.name || '_' || f.id, m.name, f.\"from\", f.\"table\", " +
        "COALESCE(f.\"to\", (SELECT r.name FROM pragma_table_info(f.\"table\", x.s) r WHERE r.pk = 1)) " +
        "FROM x, sqlite_master m, pragma_foreign_key_list(m.name, x.s) f WHERE " + USER_TABLE + " " +
        "ORDER BY m.name, f.id, f.seq";
  }

  @Override
  protected String uniqueKeysQuery() {
    return "WITH x AS (SELECT ? AS s) " +
        "SELECT 'pk_' || m.name, m.name, p.name FROM x, sqlite_master m, pragma_table_info(m.name, x.s) p " +
        "WHERE " + USER_TABLE + " AND p.pk > 0 " +
        "UNION ALL " +
        "SELECT il.name, m.name, ii.name FROM x, sqlite_master m, pragma_index_list(m.name, x.s) il, " +
        "pragma_index_info(il.name, x.s) ii WHERE " + USER_TABLE + " AND il.\"unique\" = 1 AND il.origin <> 'pk'";
  }
}
