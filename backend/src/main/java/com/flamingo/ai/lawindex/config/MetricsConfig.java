package com.flamingo.ai.lawindex.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics for the indexing pipeline. */
@Configuration
public class MetricsConfig {

  /**
   * Enables {@code @Timed} on {@link com.flamingo.ai.lawindex.indexing.LawIndexingService}.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag() {
    return registry -> registry.config().commonTags("application", "law-index");
  }
}
