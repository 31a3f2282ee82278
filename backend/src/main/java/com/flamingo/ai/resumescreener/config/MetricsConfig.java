package com.flamingo.ai.resumescreener.config;

import com.flamingo.ai.resumescreener.service.store.CandidateStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Screening metrics: {@code @Timed} support plus gauges for the store and extraction pool. */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Number of candidates currently held in memory. */
  @Bean
  public MeterBinder candidateStoreMetrics(CandidateStore candidateStore) {
    return registry ->
        Gauge.builder("candidate.store.size", candidateStore, CandidateStore::size)
            .description("Candidates currently stored")
            .register(registry);
  }

  /**
   * Active threads and queued documents of the extraction pool. A full queue means uploads are
   * falling back to extracting on the request thread.
   */
  @Bean
  public MeterBinder extractionPoolMetrics(
      @Qualifier("extractionExecutor") Executor extractionExecutor) {
    return registry -> {
      if (!(extractionExecutor instanceof ThreadPoolTaskExecutor pool)) {
        return;
      }
      Gauge.builder("extraction.pool.active", pool, ThreadPoolTaskExecutor::getActiveCount)
          .description("Extraction threads currently busy")
          .register(registry);
      Gauge.builder(
              "extraction.pool.queued", pool, p -> p.getThreadPoolExecutor().getQueue().size())
          .description("Documents waiting for an extraction thread")
          .register(registry);
    };
  }
}
