package com.scholary.narrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for pipeline work.
 *
 * <p>Step executors get their own bounded pool so that a job parked on speaker input never starves
 * request handling. Event streams push to their clients on a separate pool so a slow client never
 * holds an executor thread; a stream only occupies a stream thread while it has items to send, so
 * the pool size bounds concurrent writes, not the number of open streams. Scheduling is enabled
 * for the stream keepalive.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

  public static final String PIPELINE_EXECUTOR = "pipelineExecutor";
  public static final String STREAM_EXECUTOR = "streamExecutor";

  @Bean(name = PIPELINE_EXECUTOR)
  public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }

  @Bean(name = STREAM_EXECUTOR)
  public ThreadPoolTaskExecutor streamExecutor(
      @Value("${pipeline.stream-threads:16}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("stream-");
    executor.initialize();
    return executor;
  }
}
