package io.intellixity.polydb.jdbc.mysql;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.jdbc.connect.JdbcTarget;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import org.junit.jupiter.api.Test;

import java.sql.SQLNonTransientConnectionException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MySqlPluginTest {

  @Test
  void servesMariaDbUnderItsOwnType() {
    assertEquals(DatabaseType.MARIADB, new MySqlPlugin(DatabaseType.MARIADB).type());
    assertEquals(DatabaseType.MYSQL, new MySqlPlugin().type());
    assertThrows(IllegalArgumentException.class, () -> new MySqlPlugin(DatabaseType.POSTGRES));
  }

  @Test
  void buildsUrlFromCredentials() {
    Credentials c = new Credentials(DatabaseType.MYSQL, "db.local", null, "app", "pw", "shop");
    JdbcTarget t = new MySqlPlugin().target(PluginConfig.of(c).withTimeout(Duration.ofMillis(1500)));
    assertEquals("jdbc:mysql://db.local:3306/shop", t.url());
    assertEquals("1500", t.properties().get("connectTimeout"));
  }

  @Test
  void driverOptionsCannotBeSmuggledThroughHostOrDatabase() {
    MySqlPlugin plugin = new MySqlPlugin(DatabaseType.MYSQL, target -> {
      throw new AssertionError("must not connect to " + target.url());
    }, null);
    PluginConfig viaDatabase = PluginConfig.of(new Credentials(DatabaseType.MYSQL, "db.example", null, "app", "pw",
        "shop?allowLoadLocalInfile=true&allowUrlInLocalInfile=true"));
    PluginConfig viaHost = PluginConfig.of(new Credentials(DatabaseType.MYSQL,
        "evil.example:3306/x?allowLoadLocalInfile=true#", null, "app", "pw", "shop"));

    for (PluginConfig config : new PluginConfig[]{viaDatabase, viaHost}) {
      EngineException ex = assertThrows(EngineException.class, () -> plugin.getAllSchemas(config));
      assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
      assertEquals(DatabaseType.MYSQL, ex.type());
    }
  }

  @Test
  void advancedOptionsTravelAsProperties() {
    Credentials c = new Credentials(DatabaseType.MYSQL, "db.local", 3307, "app", "pw", "shop",
        Map.of("useSSL", "true"), false);
    JdbcTarget t = new MySqlPlugin().target(PluginConfig.of(c));
    assertEquals("jdbc:mysql://db.local:3307/shop", t.url());
    assertEquals("true", t.properties().get("useSSL"));
  }

  @Test
  void connectionFailureIsUnavailable() {
    MySqlPlugin plugin = new MySqlPlugin(DatabaseType.MARIADB, target -> {
      throw new SQLNonTransientConnectionException("Could not create connection");
    }, null);
    PluginConfig config = PluginConfig.of(new Credentials(DatabaseType.MARIADB, null, null, "app", "pw", null));

    assertFalse(plugin.isAvailable(config));
    EngineException ex = assertThrows(EngineException.class, () -> plugin.getAllSchemas(config));
    assertEquals(ErrorKind.UNAVAILABLE, ex.kind());
    assertEquals(DatabaseType.MARIADB, ex.type());
  }

  @Test
  void chatWithoutModelIsUnsupported() {
    PluginConfig config = PluginConfig.of(new Credentials(DatabaseType.MYSQL, null, null, "app", "pw", "shop"));
    EngineException ex = assertThrows(EngineException.class, () -> new MySqlPlugin().chat(config, "shop", null, "hi"));
    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, ex.kind());
  }
}
