package com.flamingo.ai.rfxintake.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for intake metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the pipeline and the model call.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Adds a {@code service} tag to every meter. */
  @Bean
  public MeterFilter intakeCommonTags() {
    return MeterFilter.commonTags(List.of(Tag.of("service", "rfx-intake")));
  }
}
