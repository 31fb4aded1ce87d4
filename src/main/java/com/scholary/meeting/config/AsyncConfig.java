package com.scholary.meeting.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code taskExecutor} runs whole meeting jobs, {@code analysisExecutor} runs
 * the per-chunk analyzer calls of those jobs. Its size is the cap on simultaneous analyzer calls.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("meeting-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "analysisExecutor")
  public ThreadPoolTaskExecutor analysisExecutor(PipelineProperties properties) {
    PipelineProperties.Analysis analysis = properties.analysis();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(analysis.maxConcurrency());
    executor.setMaxPoolSize(analysis.maxConcurrency());
    executor.setQueueCapacity(analysis.queueCapacity());
    executor.setThreadNamePrefix("chunk-analysis-");
    executor.initialize();
    return executor;
  }
}
