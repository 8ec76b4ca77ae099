package io.intellixity.polydb.redis;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.spi.coerce.ColumnKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Row shape of each Redis value type. */
enum RedisKeyType {
  STRING("string", List.of(new Column("value", "string"))),
  HASH("hash", List.of(new Column("field", "string"), new Column("value", "string"))),
  LIST("list", List.of(new Column("index", "integer"), new Column("value", "string"))),
  SET("set", List.of(new Column("value", "string"))),
  ZSET("zset", List.of(new Column("member", "string"), new Column("score", "double")));

  private final String id;
  private final List<Column> columns;

  RedisKeyType(String id, List<Column> columns) {
    this.id = id;
    this.columns = columns;
  }

  String id() { return id; }
  List<Column> columns() { return columns; }

  Map<String, ColumnKind> kinds() {
    Map<String, ColumnKind> out = new LinkedHashMap<>();
    for (Column c : columns) out.put(c.name(), ColumnKind.classify(c.type()));
    return out;
  }

  /** Type reported by {@code TYPE}; {@code null} for a missing key. */
  static RedisKeyType fromRedis(String key, String type) {
    if (type == null || "none".equals(type)) return null;
    for (RedisKeyType t : values()) {
      if (t.id.equals(type)) return t;
    }
    throw EngineException.malformedInput(key, "unsupported redis type '" + type + "'");
  }

  static RedisKeyType parse(String raw) {
    if (raw != null) {
      String s = raw.trim().toLowerCase(Locale.ROOT);
      for (RedisKeyType t : values()) {
        if (t.id.equals(s)) return t;
      }
    }
    throw EngineException.malformedInput("Type", "expected one of string, hash, list, set, zset but got '" + raw + "'");
  }
}
