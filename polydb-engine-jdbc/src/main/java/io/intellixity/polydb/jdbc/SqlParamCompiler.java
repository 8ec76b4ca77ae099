package io.intellixity.polydb.jdbc;

/**
 * Rewrites named placeholders ({@code :b1}) into JDBC {@code ?} markers.
 *
 * Rules:
 * - Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*
 * - '::' is a cast and not a param
 * - Text inside single quotes, double quotes or backticks is copied untouched
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // Doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }
    return out.toString();
  }

  /** Number of named placeholders outside quoted text. */
  public static int countParams(String sql) {
    String jdbc = toJdbcSql(sql);
    int n = 0;
    char quote = 0;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
        continue;
      }
      if (ch == '\'' || ch == '"' || ch == '`') quote = ch;
      else if (ch == '?') n++;
    }
    return n;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
