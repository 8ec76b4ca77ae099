package io.intellixity.polydb.jdbc.connect;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class HikariJdbcConnectorTest {

  private static String h2Url() {
    return "jdbc:h2:mem:pool_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
  }

  @Test
  void reusesOnePoolPerTarget() throws Exception {
    JdbcTarget a = new JdbcTarget(h2Url(), "sa", "");
    JdbcTarget b = new JdbcTarget(h2Url(), "sa", "");
    try (HikariJdbcConnector connector = new HikariJdbcConnector(2, Duration.ofSeconds(5), null)) {
      for (int i = 0; i < 3; i++) {
        try (Connection c = connector.open(a); Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT 1")) {
          assertTrue(rs.next());
        }
      }
      try (Connection c = connector.open(b)) {
        assertFalse(c.isClosed());
      }
      assertEquals(2, connector.poolCount());

      connector.close();
      assertEquals(0, connector.poolCount());
    }
  }

  @Test
  void wrongPasswordIsRejectedAfterGoodOpen() throws Exception {
    String url = h2Url();
    try (HikariJdbcConnector connector = new HikariJdbcConnector(2, Duration.ofSeconds(1), null)) {
      try (Connection c = connector.open(new JdbcTarget(url, "app", "secret"))) {
        assertTrue(c.isValid(1));
      }

      assertThrows(SQLException.class, () -> connector.open(new JdbcTarget(url, "app", "wrong")));
      assertEquals(1, connector.poolCount());

      try (Connection c = connector.open(new JdbcTarget(url, "app", "secret"))) {
        assertTrue(c.isValid(1));
      }
    }
  }

  @Test
  void changedPasswordReplacesThePreviousPool() throws Exception {
    String url = h2Url();
    try (HikariJdbcConnector connector = new HikariJdbcConnector(2, Duration.ofSeconds(1), null)) {
      try (Connection c = connector.open(new JdbcTarget(url, "app", "old")); Statement st = c.createStatement()) {
        st.execute("ALTER USER app SET PASSWORD 'new'");
      }
      try (Connection c = connector.open(new JdbcTarget(url, "app", "new"))) {
        assertTrue(c.isValid(1));
      }
      assertEquals(1, connector.poolCount());
    }
  }

  @Test
  void rejectsNonPositivePoolSize() {
    assertThrows(IllegalArgumentException.class, () -> new HikariJdbcConnector(0, null, null));
  }

  @Test
  void keyDistinguishesCredentialsWithoutCarryingThem() {
    JdbcTarget t = new JdbcTarget("jdbc:h2:mem:x", "app", "s3cret");

    assertFalse(t.key().contains("s3cret"));
    assertTrue(t.key().startsWith(t.loginKey() + "|"));
    assertNotEquals(t.key(), new JdbcTarget("jdbc:h2:mem:x", "app", "other").key());
    assertNotEquals(t.key(), new JdbcTarget("jdbc:h2:mem:x", "app", "s3cret", Map.of("ssl", "false")).key());
    assertEquals(t.key(), new JdbcTarget("jdbc:h2:mem:x", "app", "s3cret").key());
    assertFalse(t.toString().contains("s3cret"));
    assertEquals("s3cret", t.toProperties().getProperty("password"));
  }
}
