package io.intellixity.polydb.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.polydb.model.PluginConfig;

/** Opens a client for one call; the plugin closes it when the call ends. */
@FunctionalInterface
public interface MongoConnector {
  MongoClient open(PluginConfig config) throws Exception;
}
