package io.intellixity.polydb.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.PluginConfig;

import java.util.concurrent.TimeUnit;

/**
 * Builds client settings from {@link Credentials}.
 *
 * <p>Advanced options: {@code uri} (full connection string, e.g. {@code mongodb+srv://...}) and
 * {@code authSource} (defaults to the credential database, then {@code admin}).</p>
 */
public final class DefaultMongoConnector implements MongoConnector {
  public static final DefaultMongoConnector INSTANCE = new DefaultMongoConnector();

  static final int DEFAULT_PORT = 27017;

  private DefaultMongoConnector() {}

  @Override
  public MongoClient open(PluginConfig config) {
    return MongoClients.create(settings(config));
  }

  static MongoClientSettings settings(PluginConfig config) {
    Credentials c = config.credentials();
    String uri = c.advanced("uri");
    if (uri == null || uri.isBlank()) uri = "mongodb://" + c.hostOr("localhost") + ":" + c.portOr(DEFAULT_PORT);

    MongoClientSettings.Builder b = MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(uri))
        .applicationName("polydb");
    if (c.username() != null && !c.username().isBlank()) {
      String source = c.advanced("authSource");
      if (source == null || source.isBlank()) source = c.database() == null || c.database().isBlank() ? "admin" : c.database();
      char[] password = c.password() == null ? new char[0] : c.password().toCharArray();
      b.credential(MongoCredential.createCredential(c.username(), source, password));
    }
    config.timeoutOpt().ifPresent(t -> {
      long ms = t.toMillis();
      b.applyToClusterSettings(s -> s.serverSelectionTimeout(ms, TimeUnit.MILLISECONDS));
      b.applyToSocketSettings(s -> s.connectTimeout((int) Math.min(Integer.MAX_VALUE, ms), TimeUnit.MILLISECONDS)
          .readTimeout((int) Math.min(Integer.MAX_VALUE, ms), TimeUnit.MILLISECONDS));
    });
    return b.build();
  }
}
