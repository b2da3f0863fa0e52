package com.scholary.subtitle.batch.config;

import com.scholary.subtitle.batch.control.SingleThreadControlThread;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads of the application.
 *
 * <p>One control thread owns all orchestration state. Workers run on a bounded pool; the batch
 * runs one job at a time, so extra threads only serve workbench optimization and jobs started on
 * their own. A small scheduler runs completion countdowns.
 */
@Configuration
public class ExecutorConfig {

  @Bean(destroyMethod = "close")
  public SingleThreadControlThread controlThread() {
    return new SingleThreadControlThread("batch-control");
  }

  @Bean(name = "workerExecutor")
  public ThreadPoolTaskExecutor workerExecutor(BatchProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueSize());
    executor.setThreadNamePrefix("batch-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "completionScheduler")
  public ThreadPoolTaskScheduler completionScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("completion-");
    scheduler.initialize();
    return scheduler;
  }
}
