package com.flamingo.ai.batchplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the batch planner. */
@SpringBootApplication
public class BatchPlannerApplication {

  public static void main(String[] args) {
    SpringApplication.run(BatchPlannerApplication.class, args);
  }
}
