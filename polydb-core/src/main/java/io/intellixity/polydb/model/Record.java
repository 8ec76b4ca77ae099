package io.intellixity.polydb.model;

import java.util.Map;
import java.util.Objects;

/**
 * Key/value pair used for attribute descriptions and row fields.
 * Values cross the boundary as strings; {@code extra} holds flags such as {@code Primary} or {@code Nullable}.
 */
public record Record(String key, String value, Map<String, String> extra) {
  public static final String PRIMARY = "Primary";
  public static final String NULLABLE = "Nullable";

  public Record {
    Objects.requireNonNull(key, "key");
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public Record(String key, String value) {
    this(key, value, Map.of());
  }

  public static Record of(String key, String value) {
    return new Record(key, value);
  }

  public boolean flag(String name) {
    return Boolean.parseBoolean(extra.get(name));
  }

  /** True unless {@code Nullable=false} was given explicitly. */
  public boolean nullable() {
    String v = extra.get(NULLABLE);
    return v == null || Boolean.parseBoolean(v);
  }
}
