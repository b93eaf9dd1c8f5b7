package com.flamingo.ai.segmentation.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring: {@code @Timed} support and a common application tag. */
@Configuration
public class MetricsConfig {

  /** Backs {@code @Timed("segmentation.run")} on the segmentation service. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name so segmentation metrics can be told apart. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
      @Value("${spring.application.name}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
