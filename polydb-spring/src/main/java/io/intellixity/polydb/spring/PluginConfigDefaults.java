package io.intellixity.polydb.spring;

import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.redis.RedisPlugin;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Builds per-call {@link PluginConfig}s carrying the process-wide defaults; explicit values win. */
public final class PluginConfigDefaults {
  private final Duration defaultTimeout;
  private final Map<String, String> defaultOptions;

  public PluginConfigDefaults(Duration defaultTimeout, Map<String, String> defaultOptions) {
    this.defaultTimeout = defaultTimeout;
    this.defaultOptions = Map.copyOf(defaultOptions);
  }

  static PluginConfigDefaults from(PolyDbProperties props) {
    return new PluginConfigDefaults(props.getDefaultTimeout(),
        Map.of(RedisPlugin.OPTION_SCAN_LIMIT, String.valueOf(props.getRedis().getScanLimit())));
  }

  public PluginConfig configFor(Credentials credentials) {
    return apply(PluginConfig.of(credentials));
  }

  public PluginConfig apply(PluginConfig config) {
    Objects.requireNonNull(config, "config");
    Map<String, String> options = new LinkedHashMap<>(defaultOptions);
    options.putAll(config.options());
    return new PluginConfig(config.credentials(), options, config.timeout() != null ? config.timeout() : defaultTimeout);
  }
}
