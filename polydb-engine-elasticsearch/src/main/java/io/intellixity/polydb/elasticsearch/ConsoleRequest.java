package io.intellixity.polydb.elasticsearch;

import io.intellixity.polydb.error.EngineException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One request in Kibana console syntax: {@code METHOD /path?query} on the first line, optional JSON body
 * on the following lines.
 */
record ConsoleRequest(String method, String path, Map<String, String> parameters, String body) {
  private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "HEAD");

  static ConsoleRequest parse(String text) {
    if (text == null || text.isBlank()) throw EngineException.malformedInput("query", "query is required");
    String trimmed = text.strip();
    int nl = trimmed.indexOf('\n');
    String line = (nl < 0 ? trimmed : trimmed.substring(0, nl)).trim();
    String body = nl < 0 ? null : trimmed.substring(nl + 1).strip();

    String[] parts = line.split("\\s+", 2);
    String method = parts[0].toUpperCase(Locale.ROOT);
    if (!METHODS.contains(method) || parts.length < 2) {
      throw EngineException.malformedInput(line, "expected 'METHOD /path' with one of " + METHODS);
    }
    String target = parts[1].trim();
    if (!target.startsWith("/")) target = "/" + target;

    Map<String, String> params = new LinkedHashMap<>();
    int q = target.indexOf('?');
    String path = q < 0 ? target : target.substring(0, q);
    if (q >= 0) {
      for (String pair : target.substring(q + 1).split("&")) {
        if (pair.isEmpty()) continue;
        int eq = pair.indexOf('=');
        if (eq < 0) params.put(decode(pair), "");
        else params.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
      }
    }
    return new ConsoleRequest(method, path, params, body == null || body.isEmpty() ? null : body);
  }

  private static String decode(String s) {
    return URLDecoder.decode(s, StandardCharsets.UTF_8);
  }
}
