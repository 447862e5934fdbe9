package com.flamingo.ai.batchplanner;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.service.export.BatchPlanJsonWriter;
import com.flamingo.ai.batchplanner.service.planner.BatchPlanner;
import com.flamingo.ai.batchplanner.service.strategy.BatchStrategyRouter;
import com.flamingo.ai.batchplanner.service.strategy.CombinedFileBatchStrategy;
import com.flamingo.ai.batchplanner.service.strategy.LargeFileMultiBatchStrategy;
import com.flamingo.ai.batchplanner.service.strategy.SingleFileBatchStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies that the Spring application context wires the planner and its strategies. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core planner beans should be available")
  void corePlannerBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(BatchPlanner.class)).isNotNull();
    assertThat(applicationContext.getBean(BatchPlanJsonWriter.class)).isNotNull();
    assertThat(applicationContext.getBean(MeterRegistry.class)).isNotNull();
    assertThat(applicationContext.getBean("plannerFileExecutor", Executor.class)).isNotNull();
  }

  @Test
  @DisplayName("Strategies should be routed in size-band order")
  void strategiesShouldBeOrdered() {
    BatchStrategyRouter router = applicationContext.getBean(BatchStrategyRouter.class);

    assertThat(router.getStrategies())
        .hasExactlyElementsOfTypes(
            CombinedFileBatchStrategy.class,
            SingleFileBatchStrategy.class,
            LargeFileMultiBatchStrategy.class);
  }

  @Test
  @DisplayName("Planner settings should be bound from application.yml")
  void plannerSettingsShouldBeBound() {
    PlannerConfig config = applicationContext.getBean(PlannerConfig.class);

    assertThat(config.getBuckets().getSmallFileMaxTokens()).isEqualTo(15000);
    assertThat(config.getBuckets().getMediumFileMaxTokens()).isEqualTo(20000);
    assertThat(config.getLarge().getTargetChunkSize()).isEqualTo(18000);
    assertThat(config.getCombined().getWeights().getImportDependency()).isEqualTo(8);
  }
}
