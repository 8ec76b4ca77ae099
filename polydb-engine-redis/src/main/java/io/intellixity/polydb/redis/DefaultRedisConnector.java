package io.intellixity.polydb.redis;

import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.PluginConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;

/** Plain Jedis connection built from {@link Credentials}; advanced option {@code ssl=true} enables TLS. */
public final class DefaultRedisConnector implements RedisConnector {
  public static final DefaultRedisConnector INSTANCE = new DefaultRedisConnector();

  static final int DEFAULT_PORT = 6379;

  private DefaultRedisConnector() {}

  @Override
  public Jedis open(PluginConfig config) {
    Credentials c = config.credentials();
    return new Jedis(new HostAndPort(c.hostOr("localhost"), c.portOr(DEFAULT_PORT)), clientConfig(config));
  }

  static JedisClientConfig clientConfig(PluginConfig config) {
    Credentials c = config.credentials();
    DefaultJedisClientConfig.Builder b = DefaultJedisClientConfig.builder()
        .clientName("polydb")
        .ssl(Boolean.parseBoolean(c.advanced("ssl")));
    if (c.username() != null && !c.username().isBlank()) b.user(c.username());
    if (c.password() != null && !c.password().isEmpty()) b.password(c.password());
    config.timeoutOpt().ifPresent(t -> {
      int ms = (int) Math.min(Integer.MAX_VALUE, t.toMillis());
      b.connectionTimeoutMillis(ms).socketTimeoutMillis(ms);
    });
    return b.build();
  }
}
