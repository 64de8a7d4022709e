package io.syncevents.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.syncevents.micrometer.MicrometerDispatchMetrics;
import io.syncevents.spi.DispatchMetrics;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerDispatchMetrics} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code syncevents.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link SyncEventsAutoConfiguration} so the {@link DispatchMetrics}
 * bean is available for injection into the {@link io.syncevents.SyncClient}.
 */
@AutoConfiguration(before = SyncEventsAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerDispatchMetrics.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "syncevents.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SyncEventsProperties.class)
public class SyncEventsMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(DispatchMetrics.class)
  public MicrometerDispatchMetrics micrometerDispatchMetrics(
      MeterRegistry meterRegistry, SyncEventsProperties props) {
    return new MicrometerDispatchMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
