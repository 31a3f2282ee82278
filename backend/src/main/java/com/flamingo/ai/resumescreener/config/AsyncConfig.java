package com.flamingo.ai.resumescreener.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for parallel document extraction. */
@Configuration
public class AsyncConfig {

  @Bean(name = "extractionExecutor")
  public Executor extractionExecutor(ScreeningConfig screeningConfig) {
    ScreeningConfig.Extraction extraction = screeningConfig.getExtraction();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(extraction.getCorePoolSize());
    executor.setMaxPoolSize(extraction.getMaxPoolSize());
    executor.setQueueCapacity(extraction.getQueueCapacity());
    executor.setThreadNamePrefix("extract-");
    // A saturated pool runs the extraction on the uploading thread instead of rejecting it
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
