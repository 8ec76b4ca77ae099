package io.intellixity.polydb.jdbc.postgres;

import io.intellixity.polydb.jdbc.AbstractJdbcPlugin;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.jdbc.connect.JdbcTarget;
import io.intellixity.polydb.jdbc.connect.JdbcUrls;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.spi.chat.ChatModel;

import java.util.LinkedHashMap;
import java.util.Map;

/** Postgres adapter: information_schema for tables and keys, pg_database for databases. */
public final class PostgresPlugin extends AbstractJdbcPlugin {
  static final int DEFAULT_PORT = 5432;

  public PostgresPlugin(JdbcConnector connector, ChatModel chatModel) {
    super(DatabaseType.POSTGRES, new PostgresDialect(), connector, chatModel);
  }

  public PostgresPlugin() {
    this(null, null);
  }

  @Override
  protected JdbcTarget target(PluginConfig config) {
    Credentials c = config.credentials();
    String db = c.database() == null || c.database().isBlank() ? "postgres" : JdbcUrls.database(c.database());
    String url = "jdbc:postgresql://" + JdbcUrls.host(c.hostOr("localhost")) + ":" + c.portOr(DEFAULT_PORT) + "/" + db;
    Map<String, String> props = new LinkedHashMap<>(c.advanced());
    config.timeoutOpt().ifPresent(t -> props.putIfAbsent("connectTimeout", String.valueOf(Math.max(1, t.toSeconds()))));
    props.putIfAbsent("ApplicationName", "polydb");
    return new JdbcTarget(url, c.username(), c.password(), props);
  }

  @Override
  protected String databasesQuery() {
    return "SELECT datname FROM pg_database WHERE NOT datistemplate AND datallowconn ORDER BY datname";
  }

  @Override
  protected String schemasQuery() {
    return "SELECT schema_name FROM information_schema.schemata " +
        "WHERE schema_name NOT LIKE 'pg\\_%' AND schema_name <> 'information_schema' ORDER BY schema_name";
  }

  @Override
  protected String columnsQuery() {
    return "SELECT c.table_name, c.column_name, " + typeExpr("c") + " FROM information_schema.columns c " +
        "JOIN information_schema.tables t ON t.table_schema = c.table_schema AND t.table_name = c.table_name " +
        "WHERE c.table_schema = ? AND t.table_type = 'BASE TABLE' ORDER BY c.table_name, c.ordinal_position";
  }

  @Override
  protected String tableColumnsQuery() {
    return "SELECT c.column_name, " + typeExpr("c") + " FROM information_schema.columns c " +
        "WHERE c.table_schema = ? AND c.table_name = ? ORDER BY c.ordinal_position";
  }

  @Override
  protected String foreignKeysQuery() {
    return "SELECT rc.constraint_name, kcu.table_name, kcu.column_name, ref.table_name, ref.column_name " +
        "FROM information_schema.referential_constraints rc " +
        "JOIN information_schema.key_column_usage kcu ON kcu.constraint_schema = rc.constraint_schema " +
        "AND kcu.constraint_name = rc.constraint_name " +
        "JOIN information_schema.key_column_usage ref ON ref.constraint_schema = rc.unique_constraint_schema " +
        "AND ref.constraint_name = rc.unique_constraint_name AND ref.ordinal_position = kcu.position_in_unique_constraint " +
        "WHERE kcu.table_schema = ? ORDER BY kcu.table_name, rc.constraint_name, kcu.ordinal_position";
  }

  @Override
  protected String uniqueKeysQuery() {
    return "SELECT tc.constraint_name, kcu.table_name, kcu.column_name FROM information_schema.table_constraints tc " +
        "JOIN information_schema.key_column_usage kcu ON kcu.constraint_schema = tc.constraint_schema " +
        "AND kcu.constraint_name = tc.constraint_name AND kcu.table_name = tc.table_name " +
        "WHERE tc.table_schema = ? AND tc.constraint_type IN ('PRIMARY KEY', 'UNIQUE')";
  }

  /** Arrays and user-defined types report their udt name ({@code _int4}, {@code mood}). */
  private static String typeExpr(String alias) {
    return "CASE WHEN " + alias + ".data_type IN ('ARRAY', 'USER-DEFINED') THEN " + alias + ".udt_name ELSE " +
        alias + ".data_type END";
  }
}
