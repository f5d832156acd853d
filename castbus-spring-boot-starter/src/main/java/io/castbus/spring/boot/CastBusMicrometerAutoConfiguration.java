package io.castbus.spring.boot;

import io.castbus.micrometer.MicrometerBusMetrics;
import io.castbus.spi.BusMetrics;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerBusMetrics} when Micrometer is on the classpath
 * and {@code castbus.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link CastBusAutoConfiguration} so the {@link BusMetrics} bean is
 * available for injection into the bus.
 */
@AutoConfiguration(before = CastBusAutoConfiguration.class)
@ConditionalOnClass({MicrometerBusMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "castbus.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CastBusProperties.class)
public class CastBusMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(BusMetrics.class)
  public MicrometerBusMetrics micrometerBusMetrics(MeterRegistry meterRegistry, CastBusProperties props) {
    return new MicrometerBusMetrics(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
