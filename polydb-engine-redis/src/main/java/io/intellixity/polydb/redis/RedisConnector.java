package io.intellixity.polydb.redis;

import io.intellixity.polydb.model.PluginConfig;
import redis.clients.jedis.Jedis;

/** Opens a connection for one call; the plugin closes it when the call ends. */
@FunctionalInterface
public interface RedisConnector {
  Jedis open(PluginConfig config) throws Exception;
}
