package com.flamingo.ai.batchplanner.service.strategy;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a token count to the first {@link BatchStrategy} that supports it.
 *
 * <p>Strategies are injected by Spring in {@code @Order} order (ascending), which is also the
 * order their batches appear in a plan.
 */
@Service
@RequiredArgsConstructor
public class BatchStrategyRouter {

  private final List<BatchStrategy> strategies;

  /**
   * Returns the first strategy that supports the token count.
   *
   * @throws IllegalStateException if no strategy supports it
   */
  public BatchStrategy route(int tokenCount) {
    return find(tokenCount)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "No BatchStrategy found for token count: " + tokenCount));
  }

  /** Returns the first strategy that supports the token count, if any. */
  public Optional<BatchStrategy> find(int tokenCount) {
    return strategies.stream().filter(s -> s.supports(tokenCount)).findFirst();
  }

  /** Returns the first supporting strategy other than {@code excluded}, if any. */
  public Optional<BatchStrategy> rerouteFrom(BatchStrategy excluded, int tokenCount) {
    return strategies.stream()
        .filter(s -> s != excluded && s.supports(tokenCount))
        .findFirst();
  }

  /** Strategies in plan order. */
  public List<BatchStrategy> getStrategies() {
    return strategies;
  }
}
