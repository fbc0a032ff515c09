package chatbridge.spring.boot;

import chatbridge.ChatBridge;
import chatbridge.jdbc.ConnectionProvider;
import chatbridge.jdbc.DataSourceConnectionProvider;
import chatbridge.jdbc.JdbcConversationStore;
import chatbridge.jdbc.JdbcFilterStore;
import chatbridge.jdbc.store.AbstractJdbcKeyValueStore;
import chatbridge.jdbc.store.JdbcKeyValueStores;
import chatbridge.slack.SlackApiDelivery;
import chatbridge.slack.SlackWebhookDelivery;
import chatbridge.spi.CategoryRegistry;
import chatbridge.spi.ChatDelivery;
import chatbridge.spi.ConversationStore;
import chatbridge.spi.ExcerptFormatter;
import chatbridge.spi.FilterStore;
import chatbridge.spi.MetricsExporter;
import chatbridge.spi.PostVisibility;
import chatbridge.spi.TagRegistry;
import chatbridge.store.InMemoryConversationStore;
import chatbridge.store.InMemoryFilterStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.logging.Logger;

/**
 * Auto-configuration for the chat bridge.
 *
 * <p>Wires a {@link ChatBridge} from {@link ChatBridgeProperties}. Rules and conversation
 * state live in the JDBC key-value table when a {@link DataSource} is present and in
 * memory otherwise. Token mode is selected when {@code chatbridge.access-token} is set,
 * webhook mode when only {@code chatbridge.webhook-url} is.
 *
 * <p>The application must provide an {@link ExcerptFormatter} bean. {@link TagRegistry},
 * {@link CategoryRegistry}, {@link PostVisibility} and {@link Clock} beans are picked up
 * when present.
 *
 * @see ChatBridgeProperties
 * @see ChatBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ChatBridge.class)
@EnableConfigurationProperties(ChatBridgeProperties.class)
public class ChatBridgeAutoConfiguration {
  private static final Logger logger = Logger.getLogger(ChatBridgeAutoConfiguration.class.getName());

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean(DataSource.class)
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcKeyValueStore chatBridgeKeyValueStore(DataSource dataSource,
        ChatBridgeProperties props) {
      return JdbcKeyValueStores.detect(dataSource, props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider chatBridgeConnectionProvider(DataSource dataSource) {
      return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(FilterStore.class)
    public JdbcFilterStore jdbcFilterStore(ConnectionProvider connectionProvider,
        AbstractJdbcKeyValueStore table) {
      return new JdbcFilterStore(connectionProvider, table);
    }

    @Bean
    @ConditionalOnMissingBean(ConversationStore.class)
    public JdbcConversationStore jdbcConversationStore(ConnectionProvider connectionProvider,
        AbstractJdbcKeyValueStore table) {
      return new JdbcConversationStore(connectionProvider, table);
    }
  }

  @Bean
  @ConditionalOnMissingBean(FilterStore.class)
  public InMemoryFilterStore inMemoryFilterStore() {
    logger.warning("No DataSource available; chat bridge rules are kept in memory only");
    return new InMemoryFilterStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConversationStore.class)
  public InMemoryConversationStore inMemoryConversationStore() {
    return new InMemoryConversationStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public ChatDelivery chatDelivery(ChatBridgeProperties props) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(props.getTimeout())
        .build();
    if (hasText(props.getAccessToken())) {
      return new SlackApiDelivery(httpClient, URI.create(props.getApiBaseUrl()),
          props.getAccessToken(), props.getTimeout(), Clock.systemUTC());
    }
    if (hasText(props.getWebhookUrl())) {
      return new SlackWebhookDelivery(httpClient, URI.create(props.getWebhookUrl()),
          props.getTimeout(), Clock.systemUTC());
    }
    throw new IllegalStateException(
        "chatbridge.access-token or chatbridge.webhook-url must be set");
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ChatBridge chatBridge(ChatBridgeProperties props,
      FilterStore filterStore,
      ConversationStore conversationStore,
      ChatDelivery delivery,
      ExcerptFormatter excerptFormatter,
      ObjectProvider<TagRegistry> tagRegistryProvider,
      ObjectProvider<CategoryRegistry> categoryRegistryProvider,
      ObjectProvider<PostVisibility> visibilityProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {

    var builder = ChatBridge.builder()
        .filterStore(filterStore)
        .conversationStore(conversationStore)
        .delivery(delivery)
        .excerptFormatter(excerptFormatter)
        .settings(props.toSettings());
    tagRegistryProvider.ifAvailable(builder::tagRegistry);
    categoryRegistryProvider.ifAvailable(builder::categoryRegistry);
    visibilityProvider.ifAvailable(builder::visibility);
    metricsProvider.ifAvailable(builder::metrics);
    clockProvider.ifAvailable(builder::clock);
    return builder.build();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
