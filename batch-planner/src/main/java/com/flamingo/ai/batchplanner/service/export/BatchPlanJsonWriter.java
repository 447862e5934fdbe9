package com.flamingo.ai.batchplanner.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.batchplanner.model.BatchPlan;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Renders a batch plan as indented JSON. Equal plans always render to identical text. */
@Component
@Slf4j
public class BatchPlanJsonWriter {

  private final ObjectWriter writer;

  public BatchPlanJsonWriter(ObjectMapper objectMapper) {
    this.writer =
        objectMapper
            .copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .writerWithDefaultPrettyPrinter();
  }

  /**
   * Renders the plan.
   *
   * @throws IllegalStateException if the plan cannot be serialized
   */
  public String toJson(BatchPlan plan) {
    try {
      return writer.writeValueAsString(plan);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize batch plan: {}", e.getMessage());
      throw new IllegalStateException("Failed to serialize batch plan", e);
    }
  }

  /** Writes the rendered plan to a UTF-8 file, replacing any existing content. */
  @Timed(value = "planner.plan.export", description = "Time to write a batch plan as JSON")
  public void write(BatchPlan plan, Path target) throws IOException {
    Files.writeString(target, toJson(plan), StandardCharsets.UTF_8);
    log.info("Wrote plan with {} batches to {}", plan.batches().size(), target);
  }
}
