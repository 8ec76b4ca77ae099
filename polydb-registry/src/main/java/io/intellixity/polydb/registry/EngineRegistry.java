package io.intellixity.polydb.registry;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.exec.DatabasePlugin;
import io.intellixity.polydb.model.DatabaseType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lookup table from {@link DatabaseType} to its adapter.
 *
 * <p>Built once during bootstrap and read-only afterwards, so lookups need no synchronization. Adapters
 * are stateless dispatch targets: {@link #choose} never connects.</p>
 */
public final class EngineRegistry {
  private final Map<DatabaseType, DatabasePlugin> plugins;

  private EngineRegistry(Map<DatabaseType, DatabasePlugin> plugins) {
    this.plugins = Collections.unmodifiableMap(new EnumMap<>(plugins));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @throws EngineException {@code UNSUPPORTED_TYPE} when no adapter is registered for {@code type} */
  public DatabasePlugin choose(DatabaseType type) {
    Objects.requireNonNull(type, "type");
    DatabasePlugin p = plugins.get(type);
    if (p == null) throw EngineException.unsupportedType(type.id());
    return p;
  }

  /** Case-insensitive identifier lookup; unknown identifiers fail before any adapter is touched. */
  public DatabasePlugin choose(String typeId) {
    return choose(DatabaseType.fromId(typeId));
  }

  public boolean supports(DatabaseType type) {
    return plugins.containsKey(type);
  }

  public Set<DatabaseType> types() {
    return plugins.keySet();
  }

  public static final class Builder {
    private final Map<DatabaseType, DatabasePlugin> plugins = new EnumMap<>(DatabaseType.class);

    private Builder() {}

    public Builder register(DatabasePlugin plugin) {
      Objects.requireNonNull(plugin, "plugin");
      DatabaseType type = Objects.requireNonNull(plugin.type(), "plugin.type()");
      if (plugins.putIfAbsent(type, plugin) != null) {
        throw new IllegalArgumentException("Adapter already registered for " + type.id());
      }
      return this;
    }

    public EngineRegistry build() {
      return new EngineRegistry(plugins);
    }
  }
}
