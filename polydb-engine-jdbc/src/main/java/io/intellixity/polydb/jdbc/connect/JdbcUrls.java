package io.intellixity.polydb.jdbc.connect;

import io.intellixity.polydb.error.EngineException;

import java.util.regex.Pattern;

/**
 * Checks caller-supplied parts before they are placed into a JDBC URL.
 *
 * <p>Driver options travel only through {@link JdbcTarget#properties()}; a host or database that could
 * start a path, query or fragment in the URL is rejected as malformed input.</p>
 */
public final class JdbcUrls {
  private JdbcUrls() {}

  private static final Pattern HOSTNAME = Pattern.compile(
      "[A-Za-z0-9_](?:[A-Za-z0-9_-]{0,61}[A-Za-z0-9_])?(?:\\.[A-Za-z0-9_](?:[A-Za-z0-9_-]{0,61}[A-Za-z0-9_])?)*\\.?");
  private static final Pattern IPV6 = Pattern.compile("\\[?([0-9A-Fa-f:.]+)]?");
  private static final String DATABASE_FORBIDDEN = "?&#/:;\\%=@";

  /** Plain hostname, IPv4 or IPv6 literal; IPv6 comes back bracketed. */
  public static String host(String host) {
    String h = host == null ? "" : host.trim();
    if (h.length() <= 253 && HOSTNAME.matcher(h).matches()) return h;
    var m = IPV6.matcher(h);
    if (m.matches() && m.group(1).indexOf(':') >= 0) return "[" + m.group(1) + "]";
    throw EngineException.malformedInput(host, "host must be a plain hostname or IP address");
  }

  public static String database(String database) {
    String db = database == null ? "" : database.trim();
    for (int i = 0; i < db.length(); i++) {
      char ch = db.charAt(i);
      if (DATABASE_FORBIDDEN.indexOf(ch) >= 0 || Character.isWhitespace(ch) || Character.isISOControl(ch)) {
        throw EngineException.malformedInput(database, "database name contains '" + ch + "'");
      }
    }
    return db;
  }

  /** File paths keep their separators but may not carry URL options. */
  public static String filePath(String path) {
    String p = path == null ? "" : path.trim();
    if (p.indexOf('?') >= 0 || p.indexOf('#') >= 0 || p.chars().anyMatch(Character::isISOControl)) {
      throw EngineException.malformedInput(path, "file path may not contain '?' or '#'");
    }
    return p;
  }
}
