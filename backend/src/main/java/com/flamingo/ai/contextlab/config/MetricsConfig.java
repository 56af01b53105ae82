package com.flamingo.ai.contextlab.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics and time. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Wall clock used for date-relative search filters and facets. */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
