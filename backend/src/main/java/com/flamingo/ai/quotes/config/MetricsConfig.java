package com.flamingo.ai.quotes.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for ingestion metrics. */
@Configuration
public class MetricsConfig {

  /** Enables @Timed on the ingestion run. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> pipelineTag() {
    return registry -> registry.config().commonTags("pipeline", "wikiquote");
  }
}
