package io.intellixity.polydb.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call configuration handed to every adapter operation.
 *
 * <p>Immutable: credentials plus per-call options and an optional timeout that adapters propagate
 * into the native driver call.</p>
 */
public record PluginConfig(Credentials credentials, Map<String, String> options, Duration timeout) {
  public PluginConfig {
    Objects.requireNonNull(credentials, "credentials");
    options = options == null ? Map.of() : Map.copyOf(options);
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }

  public PluginConfig(Credentials credentials) {
    this(credentials, Map.of(), null);
  }

  public static PluginConfig of(Credentials credentials) {
    return new PluginConfig(credentials);
  }

  public DatabaseType type() { return credentials.type(); }

  public Optional<Duration> timeoutOpt() { return Optional.ofNullable(timeout); }

  public PluginConfig withTimeout(Duration timeout) {
    return new PluginConfig(credentials, options, timeout);
  }

  public PluginConfig withOption(String key, String value) {
    var copy = new java.util.LinkedHashMap<>(options);
    copy.put(key, value);
    return new PluginConfig(credentials, copy, timeout);
  }

  public String option(String key, String defaultValue) {
    String v = options.get(key);
    return v == null || v.isBlank() ? defaultValue : v;
  }

  public int intOption(String key, int defaultValue) {
    String v = options.get(key);
    if (v == null || v.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option '" + key + "' must be an integer: " + v, e);
    }
  }
}
