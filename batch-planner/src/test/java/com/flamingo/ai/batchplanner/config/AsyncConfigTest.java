package com.flamingo.ai.batchplanner.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@DisplayName("AsyncConfig Tests")
class AsyncConfigTest {

  @Test
  @DisplayName("should size the file executor from configuration and run overflow on the caller")
  void shouldRunOnCaller_whenFileExecutorQueueIsFull() {
    PlannerConfig config = new PlannerConfig();
    config.getConcurrency().setFileReadConcurrency(3);
    config.getConcurrency().setQueueCapacity(7);

    ThreadPoolTaskExecutor executor =
        (ThreadPoolTaskExecutor) new AsyncConfig().plannerFileExecutor(config);
    try {
      ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
      assertThat(pool.getCorePoolSize()).isEqualTo(3);
      assertThat(pool.getMaximumPoolSize()).isEqualTo(3);
      assertThat(pool.getQueue().remainingCapacity()).isEqualTo(7);
      assertThat(pool.getRejectedExecutionHandler())
          .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    } finally {
      executor.shutdown();
    }
  }
}
