package io.intellixity.polydb.spring;

import io.intellixity.polydb.jdbc.connect.HikariJdbcConnector;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.registry.EngineRegistries;
import io.intellixity.polydb.registry.EngineRegistry;
import io.intellixity.polydb.spi.chat.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Builds the {@link EngineRegistry} once at startup from {@link PolyDbProperties}.
 *
 * <p>Relational engines share one pooled {@link HikariJdbcConnector} unless {@code polydb.pool.enabled=false}
 * or the application defines its own {@link JdbcConnector}. A {@link ChatModel} bean, when present, backs
 * {@code chat} on the relational engines.</p>
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PolyDbProperties.class)
public class PolyDbConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(JdbcConnector.class)
  @ConditionalOnProperty(prefix = "polydb.pool", name = "enabled", havingValue = "true", matchIfMissing = true)
  public HikariJdbcConnector polydbJdbcConnector(PolyDbProperties props) {
    PolyDbProperties.Pool pool = props.getPool();
    return new HikariJdbcConnector(pool.getMaximumPoolSize(), pool.getConnectionTimeout(), pool.getIdleTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public EngineRegistry engineRegistry(PolyDbProperties props,
                                       ObjectProvider<JdbcConnector> jdbcConnector,
                                       ObjectProvider<ChatModel> chatModel) {
    EngineRegistries.Connectors connectors = EngineRegistries.Connectors.defaults()
        .withJdbc(jdbcConnector.getIfAvailable())
        .withChatModel(chatModel.getIfAvailable());
    return EngineRegistries.standard(enabledTypes(props), connectors);
  }

  @Bean
  @ConditionalOnMissingBean
  public PluginConfigDefaults pluginConfigDefaults(PolyDbProperties props) {
    return PluginConfigDefaults.from(props);
  }

  /** Unknown identifiers fail the startup with {@code UNSUPPORTED_TYPE}. */
  static Set<DatabaseType> enabledTypes(PolyDbProperties props) {
    if (props.getEngines().isEmpty()) return EnumSet.allOf(DatabaseType.class);
    Set<DatabaseType> out = EnumSet.noneOf(DatabaseType.class);
    for (String id : props.getEngines()) out.add(DatabaseType.fromId(id));
    return out;
  }
}
