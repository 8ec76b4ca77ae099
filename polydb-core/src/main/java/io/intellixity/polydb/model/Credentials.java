package io.intellixity.polydb.model;

import java.util.Map;
import java.util.Objects;

/**
 * Connection parameters for one engine instance.
 *
 * <p>{@code database} doubles as the file path for file-backed engines (SQLite). {@code advanced}
 * carries engine-specific connection flags (e.g. {@code sslmode}) that are passed to the connector
 * untouched.</p>
 */
public record Credentials(DatabaseType type,
                          String host,
                          Integer port,
                          String username,
                          String password,
                          String database,
                          Map<String, String> advanced,
                          boolean profile) {
  public Credentials {
    Objects.requireNonNull(type, "type");
    advanced = advanced == null ? Map.of() : Map.copyOf(advanced);
  }

  public Credentials(DatabaseType type, String host, Integer port, String username, String password, String database) {
    this(type, host, port, username, password, database, Map.of(), false);
  }

  public int portOr(int defaultPort) {
    return port == null || port <= 0 ? defaultPort : port;
  }

  public String hostOr(String defaultHost) {
    return host == null || host.isBlank() ? defaultHost : host;
  }

  public String advanced(String key) {
    return advanced.get(key);
  }

  @Override
  public String toString() {
    // Never print the password.
    return "Credentials[type=" + type + ", host=" + host + ", port=" + port +
        ", username=" + username + ", database=" + database + ", profile=" + profile + "]";
  }
}
