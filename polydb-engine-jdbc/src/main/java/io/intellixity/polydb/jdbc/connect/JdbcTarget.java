package io.intellixity.polydb.jdbc.connect;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;

/** Resolved JDBC URL plus login and driver properties for one call. */
public record JdbcTarget(String url, String username, String password, Map<String, String> properties) {
  public JdbcTarget {
    Objects.requireNonNull(url, "url");
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public JdbcTarget(String url, String username, String password) {
    this(url, username, password, Map.of());
  }

  public Properties toProperties() {
    Properties p = new Properties();
    p.putAll(properties);
    if (username != null && !username.isBlank()) p.setProperty("user", username);
    if (password != null) p.setProperty("password", password);
    return p;
  }

  /** URL and user; several pool keys share one login when the password or properties change. */
  public String loginKey() {
    return url + "|" + (username == null ? "" : username);
  }

  /** Pool key: the login plus a SHA-256 digest of password and properties, never the password itself. */
  public String key() {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      md.update((password == null ? "\0" : "p" + password).getBytes(StandardCharsets.UTF_8));
      for (var e : new TreeMap<>(properties).entrySet()) {
        md.update(("\0" + e.getKey() + "=" + e.getValue()).getBytes(StandardCharsets.UTF_8));
      }
      return loginKey() + "|" + HexFormat.of().formatHex(md.digest());
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  @Override
  public String toString() {
    return "JdbcTarget[url=" + url + ", username=" + username + "]";
  }
}
