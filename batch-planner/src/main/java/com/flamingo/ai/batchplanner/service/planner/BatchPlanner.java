package com.flamingo.ai.batchplanner.service.planner;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.RejectionReason;
import com.flamingo.ai.batchplanner.exception.PlanningCancelledException;
import com.flamingo.ai.batchplanner.model.Batch;
import com.flamingo.ai.batchplanner.model.BatchPlan;
import com.flamingo.ai.batchplanner.model.BatchValidator;
import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.PlanStats;
import com.flamingo.ai.batchplanner.model.RejectedFile;
import com.flamingo.ai.batchplanner.model.SourceFileRef;
import com.flamingo.ai.batchplanner.model.StrategyResult;
import com.flamingo.ai.batchplanner.service.reader.FileContentReader;
import com.flamingo.ai.batchplanner.service.strategy.BatchStrategy;
import com.flamingo.ai.batchplanner.service.strategy.BatchStrategyRouter;
import com.flamingo.ai.batchplanner.service.strategy.PlanningContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns analyzed files into an ordered batch plan.
 *
 * <p>Each file is routed by token count to the first strategy that supports it. Files a strategy
 * rejects for size are offered once to another supporting strategy; files nobody accepts are
 * reported as unplannable. The finished plan is checked so that every input path appears exactly
 * once, either in the batches or in the rejections.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchPlanner {

  private final BatchStrategyRouter strategyRouter;
  private final MeterRegistry meterRegistry;
  private final PlannerConfig plannerConfig;

  /**
   * Plans the given files.
   *
   * @param files analyzed files; paths should be unique
   * @param contentReader reads the content of large files
   * @return combined, then single, then chunk batches, plus rejections
   * @throws PlanningCancelledException if the calling thread is interrupted
   * @throws IllegalStateException if a strategy loses or duplicates a file
   */
  public BatchPlan plan(List<SourceFileRef> files, FileContentReader contentReader) {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(contentReader, "contentReader");
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      checkCancelled();
      log.info("Planning {} files", files.size());

      List<RejectedFile> rejections = new ArrayList<>();
      Map<BatchStrategy, List<IndexedFile>> assigned = new LinkedHashMap<>();
      strategyRouter.getStrategies().forEach(s -> assigned.put(s, new ArrayList<>()));
      Map<String, IndexedFile> byPath = new HashMap<>();
      for (int i = 0; i < files.size(); i++) {
        SourceFileRef file = Objects.requireNonNull(files.get(i), "file at index " + i);
        IndexedFile indexed = new IndexedFile(file, i);
        if (byPath.containsKey(file.path())) {
          log.warn("Duplicate path {} at index {}", file.path(), i);
          rejections.add(
              RejectedFile.of(
                  indexed,
                  RejectionReason.DUPLICATE_PATH,
                  "first seen at index " + byPath.get(file.path()).originalIndex()));
          continue;
        }
        byPath.put(file.path(), indexed);
        if (file.hasEstimationError()) {
          String error = file.tokenEstimate().metadata().error();
          log.warn("Skipping {}: token estimation failed: {}", file.path(), error);
          rejections.add(RejectedFile.of(indexed, RejectionReason.ESTIMATION_ERROR, error));
          continue;
        }
        Optional<BatchStrategy> strategy = strategyRouter.find(indexed.tokenCount());
        if (strategy.isEmpty()) {
          log.warn("No strategy supports {} ({} tokens)", file.path(), indexed.tokenCount());
          rejections.add(
              RejectedFile.of(indexed, RejectionReason.UNPLANNABLE, "no strategy supports it"));
          continue;
        }
        assigned.get(strategy.get()).add(indexed);
      }

      PlanningContext context = new PlanningContext(contentReader);
      Map<BatchStrategy, StrategyResult> results = new LinkedHashMap<>();
      for (Map.Entry<BatchStrategy, List<IndexedFile>> entry : assigned.entrySet()) {
        results.put(entry.getKey(), run(entry.getKey(), entry.getValue(), context));
      }
      reroute(assigned, results, byPath, context, rejections);

      List<Batch> batches = new ArrayList<>();
      results.values().forEach(result -> batches.addAll(result.batches()));
      int maxFilesPerBatch = plannerConfig.getCombined().getMaxFilesPerBatch();
      batches.forEach(batch -> BatchValidator.requireValid(batch, maxFilesPerBatch));
      verifyCoverage(byPath.keySet(), batches, rejections);

      BatchPlan plan = new BatchPlan(batches, rejections, stats(files.size(), batches, rejections));
      recordMetrics(plan);
      log.info(
          "Planned {} files into {} batches ({} combined, {} single, {} chunks), {} rejected",
          plan.stats().plannedFiles(),
          batches.size(),
          plan.stats().combinedBatches(),
          plan.stats().singleBatches(),
          plan.stats().chunkBatches(),
          rejections.size());
      return plan;
    } finally {
      sample.stop(meterRegistry.timer("planner.plan.duration"));
    }
  }

  private StrategyResult run(
      BatchStrategy strategy, List<IndexedFile> files, PlanningContext context) {
    if (files.isEmpty()) {
      return StrategyResult.empty();
    }
    StrategyResult result = strategy.generateBatches(List.copyOf(files), context);
    checkCancelled();
    return result;
  }

  /**
   * Offers every size rejection to another supporting strategy and reruns the strategies that
   * received files. Rejected files leave their original strategy's input, so a rerun only ever
   * rejects files that were re-routed into it.
   */
  private void reroute(
      Map<BatchStrategy, List<IndexedFile>> assigned,
      Map<BatchStrategy, StrategyResult> results,
      Map<String, IndexedFile> byPath,
      PlanningContext context,
      List<RejectedFile> rejections) {
    Set<BatchStrategy> affected = new LinkedHashSet<>();
    for (Map.Entry<BatchStrategy, StrategyResult> entry : results.entrySet()) {
      BatchStrategy origin = entry.getKey();
      for (RejectedFile rejected : entry.getValue().rejected()) {
        IndexedFile file = byPath.get(rejected.path());
        assigned.get(origin).remove(file);
        Optional<BatchStrategy> target = strategyRouter.rerouteFrom(origin, rejected.tokenCount());
        if (target.isPresent()) {
          log.info(
              "Re-routing {} from {} to {} strategy",
              rejected.path(),
              origin.kind().getStrategyTag(),
              target.get().kind().getStrategyTag());
          assigned.get(target.get()).add(file);
          affected.add(target.get());
        } else {
          rejections.add(unplannable(rejected));
        }
      }
    }

    for (BatchStrategy strategy : strategyRouter.getStrategies()) {
      if (!affected.contains(strategy)) {
        continue;
      }
      List<IndexedFile> inputs =
          assigned.get(strategy).stream()
              .sorted(Comparator.comparingInt(IndexedFile::originalIndex))
              .toList();
      StrategyResult rerun = run(strategy, inputs, context);
      rerun.rejected().forEach(rejected -> rejections.add(unplannable(rejected)));
      results.put(strategy, new StrategyResult(rerun.batches(), List.of()));
    }
  }

  private static RejectedFile unplannable(RejectedFile rejected) {
    log.warn("No strategy accepts {} ({} tokens)", rejected.path(), rejected.tokenCount());
    return new RejectedFile(
        rejected.path(),
        rejected.tokenCount(),
        RejectionReason.UNPLANNABLE,
        rejected.reason() + ": " + rejected.detail());
  }

  /** Every input path must be owned by exactly one batch, one chunk family or one rejection. */
  static void verifyCoverage(
      Set<String> inputPaths, List<Batch> batches, List<RejectedFile> rejections) {
    Map<String, String> owners = new HashMap<>();
    Map<String, Integer> chunkCounts = new HashMap<>();
    Set<String> batchIds = new HashSet<>();
    for (Batch batch : batches) {
      if (!batchIds.add(batch.id())) {
        throw new IllegalStateException("Duplicate batch id " + batch.id());
      }
      if (batch.isChunk()) {
        String path = batch.parentFileRef().path();
        claim(owners, path, "chunks of " + path);
        chunkCounts.merge(path, 1, Integer::sum);
        continue;
      }
      for (String path : batch.memberPaths()) {
        claim(owners, path, batch.id());
      }
    }
    for (Batch batch : batches) {
      if (batch.isChunk()
          && chunkCounts.get(batch.parentFileRef().path()) != batch.chunkInfo().totalChunks()) {
        throw new IllegalStateException(
            "Chunk family of " + batch.parentFileRef().path() + " is incomplete");
      }
    }
    for (RejectedFile rejected : rejections) {
      if (rejected.reason() != RejectionReason.DUPLICATE_PATH) {
        claim(owners, rejected.path(), "rejection");
      }
    }
    for (String path : inputPaths) {
      if (!owners.containsKey(path)) {
        throw new IllegalStateException("File " + path + " was dropped from the plan");
      }
    }
  }

  private static void claim(Map<String, String> owners, String path, String owner) {
    String previous = owners.putIfAbsent(path, owner);
    if (previous != null && !previous.equals(owner)) {
      throw new IllegalStateException(
          "File " + path + " appears in both " + previous + " and " + owner);
    }
  }

  private static PlanStats stats(int inputFiles, List<Batch> batches, List<RejectedFile> rejected) {
    Set<String> planned = new HashSet<>();
    int combined = 0;
    int single = 0;
    int chunks = 0;
    int fallback = 0;
    long tokens = 0;
    for (Batch batch : batches) {
      tokens += batch.estimatedTokens();
      switch (batch.kind()) {
        case COMBINED -> combined++;
        case SINGLE -> single++;
        case CHUNK -> {
          chunks++;
          if (batch.chunkInfo().fallback()) {
            fallback++;
          }
        }
      }
      planned.add(batch.primaryPath());
      planned.addAll(batch.memberPaths());
    }
    return new PlanStats(
        inputFiles, planned.size(), rejected.size(), combined, single, chunks, fallback, tokens);
  }

  private void recordMetrics(BatchPlan plan) {
    for (BatchKind kind : BatchKind.values()) {
      int count = plan.batchesOf(kind).size();
      if (count > 0) {
        meterRegistry
            .counter("planner.batches.created", "kind", kind.getTypeName())
            .increment(count);
      }
    }
    for (RejectedFile rejected : plan.rejections()) {
      String reason = rejected.reason().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("planner.files.rejected", "reason", reason).increment();
    }
    if (plan.stats().fallbackChunks() > 0) {
      meterRegistry.counter("planner.chunks.fallback").increment(plan.stats().fallbackChunks());
    }
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new PlanningCancelledException("Planning was cancelled");
    }
  }
}
