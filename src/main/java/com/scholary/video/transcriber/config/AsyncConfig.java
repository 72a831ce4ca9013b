package com.scholary.video.transcriber.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background task execution.
 *
 * <p>Sets up two bounded thread pools: one runs job pipelines, the other runs speech backends
 * when a request asks for several of them at once. Keeping them apart means a job never waits for
 * a thread from its own pool.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public ThreadPoolTaskExecutor taskExecutor(TranscriberProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "backendExecutor")
  public ThreadPoolTaskExecutor backendExecutor(TranscriberProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.backendExecutorThreads());
    executor.setMaxPoolSize(properties.backendExecutorThreads());
    executor.setThreadNamePrefix("speech-backend-");
    executor.initialize();
    return executor;
  }
}
