package io.intellixity.polydb.registry;

import io.intellixity.polydb.elasticsearch.ElasticConnector;
import io.intellixity.polydb.elasticsearch.ElasticPlugin;
import io.intellixity.polydb.exec.DatabasePlugin;
import io.intellixity.polydb.jdbc.clickhouse.ClickHousePlugin;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.jdbc.mysql.MySqlPlugin;
import io.intellixity.polydb.jdbc.postgres.PostgresPlugin;
import io.intellixity.polydb.jdbc.sqlite.SqlitePlugin;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.mongo.MongoConnector;
import io.intellixity.polydb.mongo.MongoPlugin;
import io.intellixity.polydb.redis.RedisConnector;
import io.intellixity.polydb.redis.RedisPlugin;
import io.intellixity.polydb.spi.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/** Standard wiring of every supported engine. */
public final class EngineRegistries {
  private static final Logger log = LoggerFactory.getLogger(EngineRegistries.class);

  private EngineRegistries() {}

  /**
   * Connection seams shared by the adapters. {@code null} members fall back to each adapter's default
   * (unpooled JDBC, plain driver clients, no chat model).
   */
  public record Connectors(JdbcConnector jdbc,
                           MongoConnector mongo,
                           RedisConnector redis,
                           ElasticConnector elasticsearch,
                           ChatModel chatModel) {
    public static Connectors defaults() {
      return new Connectors(null, null, null, null, null);
    }

    public Connectors withJdbc(JdbcConnector jdbc) {
      return new Connectors(jdbc, mongo, redis, elasticsearch, chatModel);
    }

    public Connectors withChatModel(ChatModel chatModel) {
      return new Connectors(jdbc, mongo, redis, elasticsearch, chatModel);
    }
  }

  public static EngineRegistry standard() {
    return standard(EnumSet.allOf(DatabaseType.class), Connectors.defaults());
  }

  public static EngineRegistry standard(Connectors connectors) {
    return standard(EnumSet.allOf(DatabaseType.class), connectors);
  }

  public static EngineRegistry standard(Set<DatabaseType> enabled, Connectors connectors) {
    Connectors c = connectors == null ? Connectors.defaults() : connectors;
    EngineRegistry.Builder b = EngineRegistry.builder();
    for (DatabaseType t : DatabaseType.values()) {
      if (enabled.contains(t)) b.register(create(t, c));
    }
    EngineRegistry registry = b.build();
    log.info("polydb.registry built types={}", registry.types());
    return registry;
  }

  static DatabasePlugin create(DatabaseType type, Connectors c) {
    switch (type) {
      case POSTGRES: return new PostgresPlugin(c.jdbc(), c.chatModel());
      case MYSQL:
      case MARIADB: return new MySqlPlugin(type, c.jdbc(), c.chatModel());
      case SQLITE: return new SqlitePlugin(c.jdbc(), c.chatModel());
      case CLICKHOUSE: return new ClickHousePlugin(c.jdbc(), c.chatModel());
      case MONGODB: return new MongoPlugin(c.mongo());
      case REDIS: return new RedisPlugin(c.redis());
      case ELASTICSEARCH: return new ElasticPlugin(c.elasticsearch());
      default: throw new IllegalArgumentException("No adapter for " + type);
    }
  }
}
