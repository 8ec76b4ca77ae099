package io.intellixity.polydb.jdbc.connect;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pooled connector: one {@link HikariDataSource} per distinct URL, user, password and driver properties.
 *
 * <p>Closing a borrowed connection returns it to its pool. A pool that fails its first borrow is closed
 * again, and once a login (URL and user) opens through new credentials the pool for its previous
 * credentials is closed. Remaining pools are closed with the connector.</p>
 */
public final class HikariJdbcConnector implements JdbcConnector, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HikariJdbcConnector.class);

  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
  // login key -> pool key of the credentials that last opened successfully
  private final Map<String, String> current = new ConcurrentHashMap<>();
  private final AtomicInteger poolSeq = new AtomicInteger();
  private final int maximumPoolSize;
  private final Duration connectionTimeout;
  private final Duration idleTimeout;

  public HikariJdbcConnector(int maximumPoolSize, Duration connectionTimeout, Duration idleTimeout) {
    if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    this.maximumPoolSize = maximumPoolSize;
    this.connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(30) : connectionTimeout;
    this.idleTimeout = idleTimeout == null ? Duration.ofMinutes(10) : idleTimeout;
  }

  public HikariJdbcConnector() {
    this(10, null, null);
  }

  @Override
  public Connection open(JdbcTarget target) throws SQLException {
    String key = target.key();
    boolean[] created = {false};
    HikariDataSource ds = pools.computeIfAbsent(key, k -> {
      created[0] = true;
      return newPool(target);
    });
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      if (created[0]) evict(key, ds, "first_borrow_failed");
      throw e;
    }
    String previous = current.put(target.loginKey(), key);
    if (previous != null && !previous.equals(key)) {
      HikariDataSource old = pools.get(previous);
      if (old != null) evict(previous, old, "credentials_changed");
    }
    return c;
  }

  private HikariDataSource newPool(JdbcTarget target) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(target.url());
    hc.setUsername(target.username());
    hc.setPassword(target.password());
    target.properties().forEach(hc::addDataSourceProperty);
    hc.setMaximumPoolSize(maximumPoolSize);
    hc.setConnectionTimeout(connectionTimeout.toMillis());
    hc.setIdleTimeout(idleTimeout.toMillis());
    hc.setPoolName("polydb-" + poolSeq.incrementAndGet());
    // Fail on first use rather than at pool construction.
    hc.setInitializationFailTimeout(-1);
    log.debug("polydb.hikari pool_created pool={} login={} maxPoolSize={}",
        hc.getPoolName(), target.loginKey(), maximumPoolSize);
    return new HikariDataSource(hc);
  }

  private void evict(String key, HikariDataSource ds, String reason) {
    if (pools.remove(key, ds)) {
      log.debug("polydb.hikari pool_closed pool={} reason={}", ds.getPoolName(), reason);
      ds.close();
    }
  }

  int poolCount() { return pools.size(); }

  @Override
  public void close() {
    for (var e : pools.entrySet()) {
      log.debug("polydb.hikari pool_closed pool={} reason=shutdown", e.getValue().getPoolName());
      e.getValue().close();
    }
    pools.clear();
    current.clear();
  }
}
