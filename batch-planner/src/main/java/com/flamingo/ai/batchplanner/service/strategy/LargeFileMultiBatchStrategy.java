package com.flamingo.ai.batchplanner.service.strategy;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.AnalysisDepth;
import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import com.flamingo.ai.batchplanner.domain.enums.RejectionReason;
import com.flamingo.ai.batchplanner.exception.PlanningCancelledException;
import com.flamingo.ai.batchplanner.model.Batch;
import com.flamingo.ai.batchplanner.model.BatchMember;
import com.flamingo.ai.batchplanner.model.BatchMetadata;
import com.flamingo.ai.batchplanner.model.ChunkInfo;
import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.IntegrationPoint;
import com.flamingo.ai.batchplanner.model.ParentFileRef;
import com.flamingo.ai.batchplanner.model.ProcessingHints;
import com.flamingo.ai.batchplanner.model.ReconstructionInfo;
import com.flamingo.ai.batchplanner.model.RejectedFile;
import com.flamingo.ai.batchplanner.model.StrategyResult;
import com.flamingo.ai.batchplanner.model.StructuralSummary;
import com.flamingo.ai.batchplanner.service.boundary.BoundaryDetector;
import com.flamingo.ai.batchplanner.service.boundary.DetectedChunk;
import com.flamingo.ai.batchplanner.service.boundary.DetectionResult;
import com.flamingo.ai.batchplanner.service.boundary.LanguageRules;
import com.flamingo.ai.batchplanner.service.token.TokenEstimator;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Splits each large file into several chunk batches along code boundaries.
 *
 * <p>Files are read and split concurrently on the planner file executor, with at most
 * {@code fileReadConcurrency} files in flight; results are collected in input order, so the output
 * does not depend on thread timing. Chunk token counts are rescaled to
 * the upstream estimate of the whole file and always sum to it exactly. When a file cannot be read,
 * or boundary detection fails, the file is cut into equal line-count segments instead.
 */
@Service
@Order(30)
@Slf4j
public class LargeFileMultiBatchStrategy implements BatchStrategy {

  private static final int LOW_QUALITY_THRESHOLD = 70;
  private static final int MANY_CHUNKS_THRESHOLD = 3;
  private static final int DETAILED_CHUNK_TOKENS = 15000;

  private final Settings settings;
  private final BoundaryDetector boundaryDetector;
  private final TokenEstimator tokenEstimator;
  private final Executor fileExecutor;
  private final SplitQualityAssessor qualityAssessor;

  public LargeFileMultiBatchStrategy(
      PlannerConfig plannerConfig,
      BoundaryDetector boundaryDetector,
      TokenEstimator tokenEstimator,
      @Qualifier("plannerFileExecutor") Executor fileExecutor) {
    this.settings = Settings.of(plannerConfig);
    this.boundaryDetector = boundaryDetector;
    this.tokenEstimator = tokenEstimator;
    this.fileExecutor = fileExecutor;
    this.qualityAssessor = new SplitQualityAssessor(plannerConfig.getLarge().getQualityWeights());
  }

  @Override
  public BatchKind kind() {
    return BatchKind.CHUNK;
  }

  @Override
  public boolean supports(int tokenCount) {
    return tokenCount >= settings.mediumFileMaxTokens();
  }

  @Override
  public StrategyResult generateBatches(List<IndexedFile> files, PlanningContext context) {
    List<RejectedFile> rejected = new ArrayList<>();
    Deque<CompletableFuture<List<Batch>>> inFlight = new ArrayDeque<>();
    List<Batch> chunks = new ArrayList<>();
    int fileOrdinal = 0;
    try {
      for (IndexedFile file : files) {
        if (!supports(file.tokenCount())) {
          rejected.add(rejectTooSmall(file));
          continue;
        }
        if (inFlight.size() >= settings.fileReadConcurrency()) {
          chunks.addAll(inFlight.removeFirst().get());
        }
        int ordinal = ++fileOrdinal;
        inFlight.addLast(
            CompletableFuture.supplyAsync(() -> splitFile(file, ordinal, context), fileExecutor));
      }
      while (!inFlight.isEmpty()) {
        chunks.addAll(inFlight.removeFirst().get());
      }
    } catch (InterruptedException e) {
      inFlight.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new PlanningCancelledException("Interrupted while splitting large files", e);
    } catch (ExecutionException e) {
      inFlight.forEach(future -> future.cancel(true));
      throw new IllegalStateException("Splitting a large file failed", e.getCause());
    }

    List<Batch> ordered =
        chunks.stream()
            .sorted(
                Comparator.comparingInt((Batch b) -> b.parentFileRef().originalIndex())
                    .thenComparingInt(b -> b.chunkInfo().chunkIndex()))
            .toList();
    List<Batch> result = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      result.add(ordered.get(i).toBuilder().processingOrder(i + 1).build());
    }
    log.info("Split {} large files into {} chunks", fileOrdinal, result.size());
    return new StrategyResult(result, rejected);
  }

  private RejectedFile rejectTooSmall(IndexedFile file) {
    int minimum = settings.mediumFileMaxTokens();
    log.warn(
        "File {} has {} tokens, below the large-file minimum of {}",
        file.path(),
        file.tokenCount(),
        minimum);
    return RejectedFile.of(file, RejectionReason.TOO_SMALL, "below " + minimum + " tokens");
  }

  // ---- Per-file splitting ----

  private List<Batch> splitFile(IndexedFile file, int fileOrdinal, PlanningContext context) {
    String content;
    try {
      content = context.contentReader().read(file.path());
    } catch (IOException e) {
      log.warn("Could not read {}, using equal line-count split: {}", file.path(), e.getMessage());
      return fallback(file, fileOrdinal, null);
    }

    int parentTokens = file.tokenCount();
    int contentTokens = tokenEstimator.estimate(content);
    if (contentTokens == 0) {
      log.warn("File {} has no content to split, using equal line-count split", file.path());
      return fallback(file, fileOrdinal, content);
    }
    // The detector counts with its own estimator; translate the target into its units.
    int targetTokens = settings.targetChunkSize();
    int detectorTarget =
        (int) Math.max(1, Math.round((double) targetTokens * contentTokens / parentTokens));

    DetectionResult detection;
    try {
      detection =
          boundaryDetector.detect(
              file.path(), content, file.file().structuralSummary(), detectorTarget);
    } catch (RuntimeException e) {
      log.warn("Boundary detection threw for {}: {}", file.path(), e.getMessage());
      detection = DetectionResult.failure(null, e.getMessage());
    }
    if (!detection.success() || detection.chunks().isEmpty()) {
      log.warn(
          "Boundary detection failed for {}, using equal line-count split: {}",
          file.path(),
          detection.error());
      return fallback(file, fileOrdinal, content);
    }

    List<DetectedChunk> detected = detection.chunks();
    if (detected.size() > settings.maxChunksPerFile()) {
      log.warn(
          "File {} produced {} chunks, more than the expected maximum of {}",
          file.path(),
          detected.size(),
          settings.maxChunksPerFile());
    }
    long[] weights = detected.stream().mapToLong(DetectedChunk::estimatedTokens).toArray();
    log.debug(
        "Split {} into {} chunks ({} rules)", file.path(), detected.size(), detection.language());
    return toBatches(file, fileOrdinal, detected, weights, detection.language(), false);
  }

  /** Equal line-count segments; content is null when the file could not be read. */
  private List<Batch> fallback(IndexedFile file, int fileOrdinal, String content) {
    int parentTokens = file.tokenCount();
    int segments =
        (int) Math.max(1, Math.ceil(parentTokens / (double) settings.targetChunkSize()));
    String language = LanguageRules.detectLanguage(file.path(), file.file().structuralSummary());
    String marker = LanguageRules.forLanguage(language).lineComment();

    List<DetectedChunk> chunks = new ArrayList<>();
    long[] weights;
    if (content == null || content.isEmpty()) {
      for (int i = 1; i <= segments; i++) {
        chunks.add(
            new DetectedChunk(
                0, 0, "", 0, ChunkType.FALLBACK, List.of(), List.of(), 0, false));
      }
      weights = new long[segments];
      Arrays.fill(weights, 1);
    } else {
      String normalized =
          content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
      String[] lines = normalized.split("\r?\n", -1);
      int lineCount = lines.length;
      // Lines are spread evenly; the first lineCount % n segments take one extra line.
      int segmentCount = Math.min(segments, lineCount);
      int baseLines = lineCount / segmentCount;
      int extraLines = lineCount % segmentCount;
      weights = new long[segmentCount];
      int start = 0;
      for (int i = 0; i < segmentCount; i++) {
        int end = start + baseLines + (i < extraLines ? 1 : 0) - 1;
        String body = String.join("\n", Arrays.asList(lines).subList(start, end + 1));
        int bodyTokens = tokenEstimator.estimate(body);
        weights[i] = bodyTokens > 0 ? bodyTokens : end - start + 1;
        String header = marker + " Chunk " + (i + 1) + " - lines " + (start + 1) + "-" + (end + 1);
        String chunkContent = header + "\n" + body;
        chunks.add(
            new DetectedChunk(
                start + 1,
                end + 1,
                chunkContent,
                bodyTokens,
                ChunkType.FALLBACK,
                List.of(),
                List.of(),
                0,
                true));
        start = end + 1;
      }
    }
    return toBatches(file, fileOrdinal, chunks, weights, language, true);
  }

  // ---- Batch assembly ----

  private List<Batch> toBatches(
      IndexedFile file,
      int fileOrdinal,
      List<DetectedChunk> chunks,
      long[] weights,
      String language,
      boolean fallback) {
    int parentTokens = file.tokenCount();
    int targetTokens = settings.targetChunkSize();
    int[] allocated = allocate(parentTokens, weights);
    LanguageRules rules = LanguageRules.forLanguage(language);
    ParentFileRef parent = new ParentFileRef(file.path(), parentTokens, file.originalIndex());
    int total = chunks.size();

    List<Batch> batches = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      DetectedChunk chunk = chunks.get(i);
      int index = i + 1;
      int tokens = allocated[i];
      boolean hasComments = hasComments(chunk.content(), rules);
      int quality =
          fallback
              ? settings.fallbackSplitQuality()
              : qualityAssessor.assess(chunk, tokens, targetTokens, hasComments);
      double complexity =
          SplitQualityAssessor.chunkComplexity(chunk.type(), tokens, chunk.boundaries().size());

      ChunkInfo chunkInfo =
          new ChunkInfo(
              index,
              total,
              chunk.startLine(),
              chunk.endLine(),
              chunk.content(),
              chunk.type(),
              quality,
              fallback,
              chunk.overlapTokens());

      Batch batch =
          Batch.builder()
              .id("large_file_" + fileOrdinal + "_" + index)
              .kind(BatchKind.CHUNK)
              .strategyTag(BatchKind.CHUNK.getStrategyTag())
              .estimatedTokens(tokens)
              .members(List.of(BatchMember.of(file, tokens, complexity)))
              .metadata(metadata(file, chunk, chunkInfo, tokens, language, hasComments))
              .chunkInfo(chunkInfo)
              .parentFileRef(parent)
              .reconstructionInfo(reconstruction(chunk, chunkInfo, complexity))
              .build();
      batches.add(batch);
    }
    return batches;
  }

  private BatchMetadata metadata(
      IndexedFile file,
      DetectedChunk chunk,
      ChunkInfo chunkInfo,
      int tokens,
      String language,
      boolean hasComments) {
    PathParts parts = PathParts.parse(file.path());
    StructuralSummary summary = file.file().summaryOrEmpty();
    boolean hasImports = chunk.hasCarriedImports() || chunk.content().contains("import");
    boolean hasExports = chunk.content().contains("export");

    ProcessingHints hints =
        ProcessingHints.builder()
            .firstChunk(chunkInfo.isFirst())
            .lastChunk(chunkInfo.isLast())
            .analysisDepth(analysisDepth(chunk.type(), tokens))
            .focusAreas(focusAreas(chunk.type()))
            .specialInstructions(specialInstructions(chunkInfo))
            .contextAware(true)
            .requiresIntegration(chunkInfo.totalChunks() > 1)
            .hasImports(hasImports)
            .hasExports(hasExports)
            .build();

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("parentFileName", parts.fileName());
    attributes.put("directory", parts.directory());
    attributes.put("extension", parts.extension());
    attributes.put("language", language);
    attributes.put("parentTotalLines", summary.totalLines());
    attributes.put("hasComments", hasComments);
    attributes.put("boundaryCount", chunk.boundaries().size());
    attributes.put("chunkType", chunk.type());

    double ratio = Math.min(tokens / (double) settings.targetChunkSize(), 1.0);
    return new BatchMetadata(
        describe(parts.fileName(), chunkInfo, tokens),
        (int) Math.round(ratio * 100),
        hints,
        attributes);
  }

  private static ReconstructionInfo reconstruction(
      DetectedChunk chunk, ChunkInfo chunkInfo, double complexity) {
    List<IntegrationPoint> points =
        chunk.boundaries().stream()
            .map(b -> new IntegrationPoint(b.line(), b.type(), b.priority()))
            .toList();
    String lineRange =
        chunkInfo.startLine() > 0
            ? chunkInfo.startLine() + "-" + chunkInfo.endLine()
            : "unknown";
    double relativePosition =
        Math.round(chunkInfo.chunkIndex() * 100.0 / chunkInfo.totalChunks()) / 100.0;
    return new ReconstructionInfo(
        chunkInfo.chunkIndex(),
        chunkInfo.totalChunks(),
        !chunkInfo.isFirst(),
        !chunkInfo.isLast(),
        chunkInfo.overlapTokens() > 0,
        points,
        lineRange,
        relativePosition,
        complexity);
  }

  /**
   * Distributes {@code total} over the weights with largest-remainder rounding, so the parts sum
   * to {@code total} exactly. Equal weights are used when all weights are zero.
   */
  static int[] allocate(int total, long[] weights) {
    int[] parts = new int[weights.length];
    if (weights.length == 0) {
      return parts;
    }
    long weightSum = Arrays.stream(weights).sum();
    long[] effective = weights;
    if (weightSum <= 0) {
      effective = new long[weights.length];
      Arrays.fill(effective, 1);
      weightSum = weights.length;
    }
    double[] remainders = new double[weights.length];
    long assigned = 0;
    for (int i = 0; i < weights.length; i++) {
      double exact = (double) total * effective[i] / weightSum;
      parts[i] = (int) Math.floor(exact);
      remainders[i] = exact - parts[i];
      assigned += parts[i];
    }
    long leftover = total - assigned;
    Integer[] byRemainder = new Integer[weights.length];
    for (int i = 0; i < byRemainder.length; i++) {
      byRemainder[i] = i;
    }
    Arrays.sort(
        byRemainder,
        Comparator.comparingDouble((Integer i) -> remainders[i])
            .reversed()
            .thenComparingInt(i -> i));
    for (int i = 0; i < leftover; i++) {
      parts[byRemainder[i % byRemainder.length]]++;
    }
    return parts;
  }

  private static boolean hasComments(String content, LanguageRules rules) {
    String[] lines = content.split("\n");
    // the first line is the chunk marker
    for (int i = 1; i < lines.length; i++) {
      String stripped = lines[i].strip();
      if (!stripped.isEmpty() && rules.isComment(stripped)) {
        return true;
      }
    }
    return false;
  }

  private static AnalysisDepth analysisDepth(ChunkType type, int tokens) {
    return switch (type) {
      case CLASS_FOCUSED -> AnalysisDepth.DETAILED;
      case FUNCTION_FOCUSED, INTERFACE_FOCUSED -> AnalysisDepth.COMPREHENSIVE;
      default ->
          tokens > DETAILED_CHUNK_TOKENS ? AnalysisDepth.DETAILED : AnalysisDepth.COMPREHENSIVE;
    };
  }

  private static List<String> focusAreas(ChunkType type) {
    return switch (type) {
      case CLASS_FOCUSED -> List.of("class_structure", "method_analysis", "inheritance_patterns");
      case FUNCTION_FOCUSED -> List.of("function_logic", "parameter_analysis", "return_patterns");
      case INTERFACE_FOCUSED ->
          List.of("interface_design", "type_definitions", "contract_analysis");
      default -> List.of("code_structure", "logic_flow", "dependencies");
    };
  }

  private static List<String> specialInstructions(ChunkInfo chunkInfo) {
    List<String> instructions = new ArrayList<>();
    if (chunkInfo.isFirst()) {
      instructions.add(
          "First part of the file: describe the overall architecture and imported dependencies");
    }
    if (chunkInfo.isLast()) {
      instructions.add("Last part of the file: describe the exports and summarize the file");
    }
    if (chunkInfo.totalChunks() > MANY_CHUNKS_THRESHOLD) {
      instructions.add("The file is split into many parts: relate this part to the others");
    }
    if (chunkInfo.splitQuality() < LOW_QUALITY_THRESHOLD) {
      instructions.add("Split quality is low: pay extra attention to the surrounding context");
    }
    return instructions;
  }

  private static String describe(String fileName, ChunkInfo chunkInfo, int tokens) {
    String lines =
        chunkInfo.startLine() > 0
            ? "lines " + chunkInfo.startLine() + "-" + chunkInfo.endLine()
            : "line range unknown";
    return String.format(
        Locale.ROOT,
        "Large file chunk %d/%d - %s (%,d tokens, %s) - %s",
        chunkInfo.chunkIndex(),
        chunkInfo.totalChunks(),
        fileName,
        tokens,
        lines,
        chunkInfo.splitType().getLabel());
  }

  /** Thresholds copied from configuration when the strategy is built. */
  private record Settings(
      int mediumFileMaxTokens,
      int targetChunkSize,
      int maxChunksPerFile,
      int fallbackSplitQuality,
      int fileReadConcurrency) {

    static Settings of(PlannerConfig config) {
      PlannerConfig.Large large = config.getLarge();
      return new Settings(
          config.getBuckets().getMediumFileMaxTokens(),
          large.getTargetChunkSize(),
          large.getMaxChunksPerFile(),
          large.getFallbackSplitQuality(),
          Math.max(1, config.getConcurrency().getFileReadConcurrency()));
    }
  }
}
