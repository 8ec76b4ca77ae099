package io.intellixity.polydb.jdbc.mysql;

import io.intellixity.polydb.jdbc.AbstractJdbcPlugin;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.jdbc.connect.JdbcTarget;
import io.intellixity.polydb.jdbc.connect.JdbcUrls;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.spi.chat.ChatModel;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * MySQL adapter, also registered for MariaDB.
 *
 * <p>Schemas and databases are the same thing here; the catalog comes from information_schema, with
 * foreign keys read from the {@code REFERENCED_*} columns of {@code KEY_COLUMN_USAGE}.</p>
 */
public final class MySqlPlugin extends AbstractJdbcPlugin {
  static final int DEFAULT_PORT = 3306;

  private static final String SYSTEM_SCHEMAS = "('information_schema', 'mysql', 'performance_schema', 'sys')";

  public MySqlPlugin(DatabaseType type, JdbcConnector connector, ChatModel chatModel) {
    super(requireMySqlFamily(type), new MySqlDialect(), connector, chatModel);
  }

  public MySqlPlugin(DatabaseType type) {
    this(type, null, null);
  }

  public MySqlPlugin() {
    this(DatabaseType.MYSQL);
  }

  private static DatabaseType requireMySqlFamily(DatabaseType type) {
    if (type != DatabaseType.MYSQL && type != DatabaseType.MARIADB) {
      throw new IllegalArgumentException("MySqlPlugin serves mysql or mariadb, not " + type);
    }
    return type;
  }

  @Override
  protected JdbcTarget target(PluginConfig config) {
    Credentials c = config.credentials();
    String db = JdbcUrls.database(c.database());
    String url = "jdbc:mysql://" + JdbcUrls.host(c.hostOr("localhost")) + ":" + c.portOr(DEFAULT_PORT) + "/" + db;
    Map<String, String> props = new LinkedHashMap<>(c.advanced());
    config.timeoutOpt().ifPresent(t -> props.putIfAbsent("connectTimeout", String.valueOf(Math.max(1, t.toMillis()))));
    props.putIfAbsent("connectionAttributes", "program_name:polydb");
    return new JdbcTarget(url, c.username(), c.password(), props);
  }

  @Override
  protected List<String> primaryKey(Connection c, String schema, String table) throws SQLException {
    // Connector/J reports databases as catalogs.
    Map<Integer, String> bySeq = new TreeMap<>();
    try (ResultSet rs = c.getMetaData().getPrimaryKeys(blankToNull(schema), null, table)) {
      while (rs.next()) bySeq.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
    }
    return new ArrayList<>(bySeq.values());
  }

  @Override
  protected String databasesQuery() {
    return "SELECT schema_name FROM information_schema.schemata ORDER BY schema_name";
  }

  @Override
  protected String schemasQuery() {
    return "SELECT schema_name FROM information_schema.schemata WHERE schema_name NOT IN " + SYSTEM_SCHEMAS +
        " ORDER BY schema_name";
  }

  @Override
  protected String columnsQuery() {
    return "SELECT c.table_name, c.column_name, c.column_type FROM information_schema.columns c " +
        "JOIN information_schema.tables t ON t.table_schema = c.table_schema AND t.table_name = c.table_name " +
        "WHERE c.table_schema = ? AND t.table_type = 'BASE TABLE' ORDER BY c.table_name, c.ordinal_position";
  }

  @Override
  protected String tableColumnsQuery() {
    return "SELECT column_name, column_type FROM information_schema.columns " +
        "WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";
  }

  @Override
  protected String foreignKeysQuery() {
    return "SELECT constraint_name, table_name, column_name, referenced_table_name, referenced_column_name " +
        "FROM information_schema.key_column_usage " +
        "WHERE table_schema = ? AND referenced_table_name IS NOT NULL AND referenced_table_schema = table_schema " +
        "ORDER BY table_name, constraint_name, ordinal_position";
  }

  @Override
  protected String uniqueKeysQuery() {
    return "SELECT tc.constraint_name, k.table_name, k.column_name FROM information_schema.table_constraints tc " +
        "JOIN information_schema.key_column_usage k ON k.constraint_schema = tc.constraint_schema " +
        "AND k.constraint_name = tc.constraint_name AND k.table_name = tc.table_name " +
        "WHERE tc.table_schema = ? AND tc.constraint_type IN ('PRIMARY KEY', 'UNIQUE')";
  }
}
