package com.flamingo.ai.batchplanner.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for concurrent per-file planning work. */
@Configuration
public class AsyncConfig {

  /**
   * Executor used to read and split large files in parallel. The pool never grows beyond the
   * configured file read concurrency, so at most that many files are held in memory at once. A
   * full queue runs the task on the submitting thread instead of rejecting it.
   */
  @Bean(name = "plannerFileExecutor")
  public Executor plannerFileExecutor(PlannerConfig plannerConfig) {
    int concurrency = Math.max(1, plannerConfig.getConcurrency().getFileReadConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(plannerConfig.getConcurrency().getQueueCapacity());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("planner-file-");
    executor.initialize();
    return executor;
  }
}
