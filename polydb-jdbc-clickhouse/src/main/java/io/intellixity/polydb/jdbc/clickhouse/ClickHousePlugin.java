package io.intellixity.polydb.jdbc.clickhouse;

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
 * ClickHouse adapter over the HTTP JDBC driver.
 *
 * <p>Catalog from {@code system.databases} and {@code system.columns}. ClickHouse has no foreign keys,
 * so getGraph is unsupported. Mutations are queued by the server and report no row count: a mutation
 * that was accepted counts as applied.</p>
 */
public final class ClickHousePlugin extends AbstractJdbcPlugin {
  static final int DEFAULT_PORT = 8123;

  public ClickHousePlugin(JdbcConnector connector, ChatModel chatModel) {
    super(DatabaseType.CLICKHOUSE, new ClickHouseDialect(), connector, chatModel);
  }

  public ClickHousePlugin() {
    this(null, null);
  }

  @Override
  protected JdbcTarget target(PluginConfig config) {
    Credentials c = config.credentials();
    String db = c.database() == null || c.database().isBlank() ? "default" : JdbcUrls.database(c.database());
    String url = "jdbc:clickhouse://" + JdbcUrls.host(c.hostOr("localhost")) + ":" + c.portOr(DEFAULT_PORT) + "/" + db;
    Map<String, String> props = new LinkedHashMap<>(c.advanced());
    config.timeoutOpt().ifPresent(t -> {
      props.putIfAbsent("connect_timeout", String.valueOf(t.toMillis()));
      props.putIfAbsent("socket_timeout", String.valueOf(t.toMillis()));
    });
    props.putIfAbsent("client_name", "polydb");
    return new JdbcTarget(url, c.username(), c.password(), props);
  }

  @Override
  protected boolean supportsTransactions() { return false; }

  @Override
  protected boolean applied(int updateCount) { return true; }

  @Override
  protected List<String> primaryKey(Connection c, String schema, String table) throws SQLException {
    List<String> out = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement("SELECT name FROM system.columns " +
        "WHERE database = ? AND table = ? AND is_in_primary_key = 1 ORDER BY position")) {
      ps.setString(1, schema);
      ps.setString(2, table);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) out.add(rs.getString(1));
      }
    }
    return out;
  }

  @Override
  protected String databasesQuery() {
    return "SELECT name FROM system.databases ORDER BY name";
  }

  @Override
  protected String schemasQuery() {
    return "SELECT name FROM system.databases " +
        "WHERE name NOT IN ('system', 'INFORMATION_SCHEMA', 'information_schema') ORDER BY name";
  }

  @Override
  protected String columnsQuery() {
    return "SELECT table, name, type FROM system.columns WHERE database = ? ORDER BY table, position";
  }

  @Override
  protected String tableColumnsQuery() {
    return "SELECT name, type FROM system.columns WHERE database = ? AND table = ? ORDER BY position";
  }

  @Override
  protected String foreignKeysQuery() { return null; }

  @Override
  protected String uniqueKeysQuery() { return null; }
}
