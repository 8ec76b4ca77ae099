package io.intellixity.polydb.elasticsearch;

import io.intellixity.polydb.model.PluginConfig;
import org.elasticsearch.client.RestClient;

/** Opens a REST client for one call; the plugin closes it when the call ends. */
@FunctionalInterface
public interface ElasticConnector {
  RestClient open(PluginConfig config) throws Exception;
}
