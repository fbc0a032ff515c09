package chatbridge.spring.boot;

import chatbridge.micrometer.MicrometerMetricsExporter;
import chatbridge.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code chatbridge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ChatBridgeAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the bridge.
 */
@AutoConfiguration(before = ChatBridgeAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "chatbridge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ChatBridgeProperties.class)
public class ChatBridgeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, ChatBridgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
