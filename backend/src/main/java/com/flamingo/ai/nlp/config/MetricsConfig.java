package com.flamingo.ai.nlp.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring for the preprocessing pipeline.
 *
 * <p>{@code NlpPreprocessorImpl} records its own counters ({@code nlp.preprocess.intent}, {@code
 * nlp.preprocess.llm_bypassed}, {@code nlp.deduplication.removed}); the {@code nlp.preprocess}
 * latency timer comes from its {@code @Timed} entry points and needs the aspect below.
 */
@Configuration
public class MetricsConfig {

  /**
   * Records the {@code nlp.preprocess} timer around every {@code NlpPreprocessor#preprocess} call
   * made through the Spring proxy.
   *
   * @param registry registry the timer is published to
   * @return the aspect handling {@code @Timed}
   */
  @Bean
  public TimedAspect preprocessTimedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
