package io.intellixity.polydb.elasticsearch;

import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.PluginConfig;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

/**
 * Low-level REST client from {@link Credentials}.
 *
 * <p>Advanced options: {@code scheme} ({@code http}/{@code https}, or {@code ssl=true}) and {@code apiKey},
 * which replaces basic authentication.</p>
 */
public final class DefaultElasticConnector implements ElasticConnector {
  public static final DefaultElasticConnector INSTANCE = new DefaultElasticConnector();

  static final int DEFAULT_PORT = 9200;

  private DefaultElasticConnector() {}

  @Override
  public RestClient open(PluginConfig config) {
    Credentials c = config.credentials();
    RestClientBuilder builder = RestClient.builder(host(c));

    String apiKey = c.advanced("apiKey");
    if (apiKey != null && !apiKey.isBlank()) {
      builder.setDefaultHeaders(new Header[] {new BasicHeader("Authorization", "ApiKey " + apiKey)});
    } else if (c.username() != null && !c.username().isBlank()) {
      BasicCredentialsProvider credentials = new BasicCredentialsProvider();
      credentials.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(c.username(), c.password()));
      builder.setHttpClientConfigCallback(http -> http.setDefaultCredentialsProvider(credentials));
    }

    config.timeoutOpt().ifPresent(t -> {
      int ms = (int) Math.min(Integer.MAX_VALUE, t.toMillis());
      builder.setRequestConfigCallback(rc -> rc.setConnectTimeout(ms).setSocketTimeout(ms));
    });
    return builder.build();
  }

  static HttpHost host(Credentials c) {
    String scheme = c.advanced("scheme");
    if (scheme == null || scheme.isBlank()) scheme = Boolean.parseBoolean(c.advanced("ssl")) ? "https" : "http";
    return new HttpHost(c.hostOr("localhost"), c.portOr(DEFAULT_PORT), scheme);
  }
}
