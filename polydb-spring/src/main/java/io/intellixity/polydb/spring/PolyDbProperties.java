package io.intellixity.polydb.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "polydb")
public class PolyDbProperties {
  /** Engine identifiers to register; empty registers every supported engine. */
  private final List<String> engines = new ArrayList<>();

  /** Applied to calls that do not set their own timeout. */
  private Duration defaultTimeout;

  private final Redis redis = new Redis();
  private final Pool pool = new Pool();

  public List<String> getEngines() { return engines; }
  public Duration getDefaultTimeout() { return defaultTimeout; }
  public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
  public Redis getRedis() { return redis; }
  public Pool getPool() { return pool; }

  public static class Redis {
    private int scanLimit = 10_000;

    public int getScanLimit() { return scanLimit; }
    public void setScanLimit(int scanLimit) { this.scanLimit = scanLimit; }
  }

  /** HikariCP settings for the relational engines. */
  public static class Pool {
    private boolean enabled = true;
    private int maximumPoolSize = 10;
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofMinutes(10);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
  }
}
