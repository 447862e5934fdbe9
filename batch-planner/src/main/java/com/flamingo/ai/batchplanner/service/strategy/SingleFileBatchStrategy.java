package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.AnalysisDepth;
import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.RejectionReason;
import com.flamingo.ai.batchplanner.model.Batch;
import com.flamingo.ai.batchplanner.model.BatchMember;
import com.flamingo.ai.batchplanner.model.BatchMetadata;
import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.ProcessingHints;
import com.flamingo.ai.batchplanner.model.RejectedFile;
import com.flamingo.ai.batchplanner.model.StrategyResult;
import com.flamingo.ai.batchplanner.model.StructuralSummary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Gives every medium-sized file a batch of its own.
 *
 * <p>Batches are ordered by file importance (descending, stable on input order) so entry points
 * and core modules are documented first.
 */
@Service
@Order(20)
@Slf4j
public class SingleFileBatchStrategy implements BatchStrategy {

  private final Bands bands;

  public SingleFileBatchStrategy(PlannerConfig plannerConfig) {
    this.bands = Bands.of(plannerConfig);
  }

  @Override
  public BatchKind kind() {
    return BatchKind.SINGLE;
  }

  @Override
  public boolean supports(int tokenCount) {
    return tokenCount >= bands.smallFileMaxTokens() && tokenCount < bands.mediumFileMaxTokens();
  }

  @Override
  public StrategyResult generateBatches(List<IndexedFile> files, PlanningContext context) {
    List<RejectedFile> rejected = new ArrayList<>();
    List<RankedFile> ranked = new ArrayList<>();

    for (IndexedFile file : files) {
      int tokens = file.tokenCount();
      if (tokens < bands.smallFileMaxTokens()) {
        log.warn(
            "File {} has {} tokens, below the single-file minimum of {}",
            file.path(),
            tokens,
            bands.smallFileMaxTokens());
        rejected.add(
            RejectedFile.of(
                file,
                RejectionReason.TOO_SMALL,
                "below " + bands.smallFileMaxTokens() + " tokens"));
        continue;
      }
      if (tokens >= bands.mediumFileMaxTokens()) {
        log.warn(
            "File {} has {} tokens, not below the single-file maximum of {}",
            file.path(),
            tokens,
            bands.mediumFileMaxTokens());
        rejected.add(
            RejectedFile.of(
                file,
                RejectionReason.TOO_LARGE,
                "not below " + bands.mediumFileMaxTokens() + " tokens"));
        continue;
      }
      StructuralSummary summary = file.file().summaryOrEmpty();
      ranked.add(
          new RankedFile(file, tokens, SingleFileHeuristics.importance(file.path(), summary)));
    }

    List<RankedFile> ordered =
        ranked.stream().sorted(Comparator.comparingInt(RankedFile::importance).reversed()).toList();

    List<Batch> batches = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      batches.add(buildBatch(ordered.get(i), i + 1));
    }
    log.info("Created {} single-file batches, rejected {} files", batches.size(), rejected.size());
    return new StrategyResult(batches, rejected);
  }

  private Batch buildBatch(RankedFile ranked, int ordinal) {
    IndexedFile file = ranked.file();
    StructuralSummary summary = file.file().summaryOrEmpty();
    int tokens = ranked.tokens();
    AnalysisDepth depth = analysisDepth(tokens);

    ProcessingHints hints =
        ProcessingHints.builder()
            .analysisDepth(depth)
            .focusAreas(SingleFileHeuristics.focusAreas(file.path()))
            .specialHandling(SingleFileHeuristics.specialHandling(tokens, summary))
            .documentationStyle(SingleFileHeuristics.documentationStyle(file.path()))
            .contextAware(true)
            .importance(ranked.importance())
            .complexity(SingleFileHeuristics.complexity(tokens, summary))
            .hasImports(!summary.imports().isEmpty())
            .hasExports(!summary.exports().isEmpty())
            .build();

    PathParts parts = PathParts.parse(file.path());
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("sizeCategory", sizeCategory(tokens));
    attributes.put("qualityScore", SingleFileHeuristics.qualityScore(tokens, summary));
    attributes.put("architecturalRole", SingleFileHeuristics.architecturalRole(file.path()));
    attributes.put("moduleContext", parts.directory().isEmpty() ? "root" : moduleName(parts));
    attributes.put("projectContext", SingleFileHeuristics.projectContext(file.path()));
    attributes.put("lineCount", summary.totalLines());

    Batch batch =
        Batch.builder()
            .id("single_batch_" + ordinal)
            .kind(BatchKind.SINGLE)
            .strategyTag(BatchKind.SINGLE.getStrategyTag())
            .estimatedTokens(tokens)
            .members(List.of(BatchMember.of(file, tokens, ranked.importance())))
            .metadata(
                new BatchMetadata(
                    describe(parts.fileName(), tokens, summary),
                    efficiency(tokens),
                    hints,
                    attributes))
            .processingOrder(ordinal)
            .build();
    log.debug("Built {} for {} ({} tokens, {})", batch.id(), file.path(), tokens, depth);
    return batch;
  }

  private AnalysisDepth analysisDepth(int tokens) {
    if (tokens < bands.basicBandMaxTokens()) {
      return AnalysisDepth.BASIC;
    }
    if (tokens < bands.comprehensiveBandMaxTokens()) {
      return AnalysisDepth.COMPREHENSIVE;
    }
    return AnalysisDepth.DETAILED;
  }

  private String sizeCategory(int tokens) {
    if (tokens < bands.basicBandMaxTokens()) {
      return "tiny";
    }
    if (tokens < bands.comprehensiveBandMaxTokens()) {
      return "medium";
    }
    return "large";
  }

  private int efficiency(int tokens) {
    double ratio = Math.min(tokens / (double) bands.idealBatchSize(), 1.0);
    return (int) Math.round(ratio * 100);
  }

  private static String moduleName(PathParts parts) {
    String directory = parts.directory();
    return directory.substring(directory.lastIndexOf('/') + 1);
  }

  private static String describe(String fileName, int tokens, StructuralSummary summary) {
    StringBuilder description =
        new StringBuilder(
            String.format(Locale.ROOT, "Single-file batch: %s (%,d tokens)", fileName, tokens));
    List<String> elements = new ArrayList<>();
    if (!summary.classes().isEmpty()) {
      elements.add(summary.classes().size() + " classes");
    }
    if (!summary.functions().isEmpty()) {
      elements.add(summary.functions().size() + " functions");
    }
    if (!summary.interfaces().isEmpty()) {
      elements.add(summary.interfaces().size() + " interfaces");
    }
    if (!elements.isEmpty()) {
      description.append(" - contains ").append(String.join(", ", elements));
    }
    return description.toString();
  }

  private record RankedFile(IndexedFile file, int tokens, int importance) {}

  /** Token bands copied from configuration when the strategy is built. */
  private record Bands(
      int smallFileMaxTokens,
      int mediumFileMaxTokens,
      int basicBandMaxTokens,
      int comprehensiveBandMaxTokens,
      int idealBatchSize) {

    static Bands of(PlannerConfig config) {
      PlannerConfig.Single single = config.getSingle();
      return new Bands(
          config.getBuckets().getSmallFileMaxTokens(),
          config.getBuckets().getMediumFileMaxTokens(),
          single.getBasicBandMaxTokens(),
          single.getComprehensiveBandMaxTokens(),
          single.getIdealBatchSize());
    }
  }
}
