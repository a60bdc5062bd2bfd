package com.flamingo.ai.nutrition.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for the advisor pipeline. Counters and timers inside the retrieval stages are recorded
 * directly on the {@link MeterRegistry}; service entry points are timed with {@code @Timed}.
 */
@Configuration
public class MetricsConfig {

  /** Publishes {@code @Timed} methods, such as the {@code rag.advice} timer, to the registry. */
  @Bean
  public TimedAspect adviceTimedAspect(MeterRegistry meterRegistry) {
    return new TimedAspect(meterRegistry);
  }
}
