package io.intellixity.polydb.model;

import io.intellixity.polydb.error.EngineException;

import java.util.Locale;

/** Fixed enumeration of engine identifiers accepted at the registry boundary. */
public enum DatabaseType {
  POSTGRES("postgres", Family.RELATIONAL),
  MYSQL("mysql", Family.RELATIONAL),
  MARIADB("mariadb", Family.RELATIONAL),
  SQLITE("sqlite", Family.RELATIONAL),
  CLICKHOUSE("clickhouse", Family.RELATIONAL),
  MONGODB("mongodb", Family.DOCUMENT),
  REDIS("redis", Family.KEY_VALUE),
  ELASTICSEARCH("elasticsearch", Family.SEARCH);

  public enum Family { RELATIONAL, DOCUMENT, KEY_VALUE, SEARCH }

  private final String id;
  private final Family family;

  DatabaseType(String id, Family family) {
    this.id = id;
    this.family = family;
  }

  public String id() { return id; }
  public Family family() { return family; }

  /** Case-insensitive lookup by id or enum name. */
  public static DatabaseType fromId(String raw) {
    if (raw == null || raw.isBlank()) throw EngineException.unsupportedType(String.valueOf(raw));
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (DatabaseType t : values()) {
      if (t.id.equals(s) || t.name().toLowerCase(Locale.ROOT).equals(s)) return t;
    }
    // Common aliases.
    return switch (s) {
      case "postgresql", "pg" -> POSTGRES;
      case "sqlite3" -> SQLITE;
      case "mongo" -> MONGODB;
      case "elastic" -> ELASTICSEARCH;
      default -> throw EngineException.unsupportedType(raw);
    };
  }

  @Override
  public String toString() { return id; }
}
