package io.intellixity.polydb.mongo;

import com.mongodb.MongoClientSettings;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultMongoConnectorTest {

  @Test
  void credentialsBecomeClientSettings() {
    Credentials c = new Credentials(DatabaseType.MONGODB, "mongo.local", 27018, "app", "pw", "shop");
    MongoClientSettings s = DefaultMongoConnector.settings(PluginConfig.of(c).withTimeout(Duration.ofSeconds(3)));

    assertEquals("mongo.local:27018", s.getClusterSettings().getHosts().get(0).toString());
    assertEquals("app", s.getCredential().getUserName());
    assertEquals("shop", s.getCredential().getSource());
    assertEquals(3000, s.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
    assertEquals(3000, s.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
  }

  @Test
  void anonymousUsesUriAndNoCredential() {
    Credentials c = new Credentials(DatabaseType.MONGODB, null, null, null, null, null,
        Map.of("uri", "mongodb://a.local:1,b.local:2"), false);
    MongoClientSettings s = DefaultMongoConnector.settings(PluginConfig.of(c));
    assertNull(s.getCredential());
    assertEquals(2, s.getClusterSettings().getHosts().size());
  }
}
