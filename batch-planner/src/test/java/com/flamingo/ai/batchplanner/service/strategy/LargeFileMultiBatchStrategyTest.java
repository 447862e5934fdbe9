package com.flamingo.ai.batchplanner.service.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.batchplanner.config.AsyncConfig;
import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import com.flamingo.ai.batchplanner.domain.enums.RejectionReason;
import com.flamingo.ai.batchplanner.model.Batch;
import com.flamingo.ai.batchplanner.model.BatchValidator;
import com.flamingo.ai.batchplanner.model.ChunkInfo;
import com.flamingo.ai.batchplanner.model.IndexedFile;
import com.flamingo.ai.batchplanner.model.SourceFileRef;
import com.flamingo.ai.batchplanner.model.StrategyResult;
import com.flamingo.ai.batchplanner.service.boundary.BoundaryDetector;
import com.flamingo.ai.batchplanner.service.boundary.DetectionResult;
import com.flamingo.ai.batchplanner.service.boundary.FunctionBoundaryDetector;
import com.flamingo.ai.batchplanner.service.token.CharRatioTokenEstimator;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("LargeFileMultiBatchStrategy Tests")
class LargeFileMultiBatchStrategyTest {

  private static final String UNSTRUCTURED =
      String.join("\n", Collections.nCopies(1500, "a".repeat(119)));

  @Mock private BoundaryDetector failingDetector;

  private PlannerConfig config;
  private CharRatioTokenEstimator estimator;
  private LargeFileMultiBatchStrategy strategy;

  @BeforeEach
  void setUp() {
    config = new PlannerConfig();
    estimator = new CharRatioTokenEstimator();
    strategy =
        new LargeFileMultiBatchStrategy(
            config, new FunctionBoundaryDetector(estimator, config), estimator, Runnable::run);
  }

  private static IndexedFile file(String path, int tokens, int index) {
    return new IndexedFile(SourceFileRef.of(path, tokens), index);
  }

  private static PlanningContext contentOf(Map<String, String> files) {
    return new PlanningContext(
        path -> {
          String content = files.get(path);
          if (content == null) {
            throw new FileNotFoundException(path);
          }
          return content;
        });
  }

  private static int tokenSum(List<Batch> batches) {
    return batches.stream().mapToInt(Batch::estimatedTokens).sum();
  }

  @Test
  @DisplayName("should cut unstructured content at the size limit")
  void shouldForceCuts_whenContentHasNoBoundaries() {
    StrategyResult result =
        strategy.generateBatches(
            List.of(file("src/Big.java", 45000, 0)),
            contentOf(Map.of("src/Big.java", UNSTRUCTURED)));

    List<Batch> batches = result.batches();
    assertThat(batches).hasSize(3);
    assertThat(batches).extracting(Batch::id)
        .containsExactly("large_file_1_1", "large_file_1_2", "large_file_1_3");
    assertThat(batches).extracting(Batch::estimatedTokens).containsExactly(19800, 19800, 5400);
    assertThat(tokenSum(batches)).isEqualTo(45000);

    List<ChunkInfo> chunks = batches.stream().map(Batch::chunkInfo).toList();
    assertThat(chunks).extracting(ChunkInfo::startLine).containsExactly(1, 661, 1321);
    assertThat(chunks).extracting(ChunkInfo::endLine).containsExactly(660, 1320, 1500);
    assertThat(chunks).extracting(ChunkInfo::splitType)
        .containsExactly(ChunkType.MIXED, ChunkType.MIXED, ChunkType.REMAINDER);
    assertThat(chunks).noneMatch(ChunkInfo::fallback);
    assertThat(chunks.get(0).content()).startsWith("// Chunk 1 - lines 1-660\n");
    assertThat(batches).allMatch(BatchValidator::isValid);
  }

  @Test
  @DisplayName("should fill reconstruction info for each chunk")
  void shouldFillReconstructionInfo() {
    List<Batch> batches =
        strategy
            .generateBatches(
                List.of(file("src/Big.java", 45000, 4)),
                contentOf(Map.of("src/Big.java", UNSTRUCTURED)))
            .batches();

    Batch first = batches.get(0);
    Batch last = batches.get(2);
    assertThat(first.parentFileRef().path()).isEqualTo("src/Big.java");
    assertThat(first.parentFileRef().totalTokens()).isEqualTo(45000);
    assertThat(first.parentFileRef().originalIndex()).isEqualTo(4);
    assertThat(first.reconstructionInfo().needsContextFromPrevious()).isFalse();
    assertThat(first.reconstructionInfo().providesContextForNext()).isTrue();
    assertThat(first.reconstructionInfo().expectedLineRange()).isEqualTo("1-660");
    assertThat(last.reconstructionInfo().needsContextFromPrevious()).isTrue();
    assertThat(last.reconstructionInfo().providesContextForNext()).isFalse();
    assertThat(last.reconstructionInfo().relativePosition()).isEqualTo(1.0);
    assertThat(first.metadata().processingHints().firstChunk()).isTrue();
    assertThat(last.metadata().processingHints().lastChunk()).isTrue();
    assertThat(first.metadata().attributes()).containsEntry("parentFileName", "Big.java");
  }

  @Test
  @DisplayName("should rescale chunk sizes to the upstream estimate")
  void shouldRescaleChunks_whenUpstreamEstimateDiffers() {
    StrategyResult result =
        strategy.generateBatches(
            List.of(file("src/Big.java", 90000, 0)),
            contentOf(Map.of("src/Big.java", UNSTRUCTURED)));

    assertThat(result.batches()).hasSize(5);
    assertThat(result.batches()).extracting(Batch::estimatedTokens)
        .containsExactly(19800, 19800, 19800, 19800, 10800);
    assertThat(tokenSum(result.batches())).isEqualTo(90000);
  }

  @Test
  @DisplayName("should fall back to equal segments when the file cannot be read")
  void shouldFallBack_whenFileUnreadable() {
    StrategyResult result =
        strategy.generateBatches(
            List.of(file("src/Missing.java", 45000, 0)), contentOf(Map.of()));

    List<Batch> batches = result.batches();
    assertThat(batches).hasSize(3);
    assertThat(batches).extracting(Batch::estimatedTokens).containsExactly(15000, 15000, 15000);
    assertThat(batches).allMatch(batch -> batch.chunkInfo().fallback());
    assertThat(batches).allMatch(batch -> batch.chunkInfo().splitQuality() == 30);
    assertThat(batches).allMatch(batch -> batch.chunkInfo().splitType() == ChunkType.FALLBACK);
    assertThat(batches.get(0).chunkInfo().startLine()).isZero();
    assertThat(batches.get(0).reconstructionInfo().expectedLineRange()).isEqualTo("unknown");
    assertThat(batches).allMatch(BatchValidator::isValid);
  }

  @Test
  @DisplayName("should fall back to equal line segments when detection fails")
  void shouldFallBack_whenDetectionFails() {
    when(failingDetector.detect(anyString(), anyString(), any(), anyInt()))
        .thenReturn(DetectionResult.failure("java", "parser unavailable"));
    strategy = new LargeFileMultiBatchStrategy(config, failingDetector, estimator, Runnable::run);
    String content = String.join("\n", Collections.nCopies(90, "b".repeat(39)));

    List<Batch> batches =
        strategy
            .generateBatches(
                List.of(file("src/Data.java", 45000, 0)),
                contentOf(Map.of("src/Data.java", content)))
            .batches();

    assertThat(batches).hasSize(3);
    assertThat(batches).extracting(b -> b.chunkInfo().startLine()).containsExactly(1, 31, 61);
    assertThat(batches).extracting(b -> b.chunkInfo().endLine()).containsExactly(30, 60, 90);
    assertThat(batches).extracting(Batch::estimatedTokens).containsExactly(15000, 15000, 15000);
    assertThat(batches.get(1).chunkInfo().content()).startsWith("// Chunk 2 - lines 31-60\n");
    assertThat(batches).allMatch(batch -> batch.chunkInfo().fallback());
  }

  @Test
  @DisplayName("should make one fallback segment per target chunk even for a short file")
  void shouldSpreadLinesEvenly_whenShortFileFallsBack() {
    when(failingDetector.detect(anyString(), anyString(), any(), anyInt()))
        .thenReturn(DetectionResult.failure("java", "parser unavailable"));
    strategy = new LargeFileMultiBatchStrategy(config, failingDetector, estimator, Runnable::run);

    List<Batch> batches =
        strategy
            .generateBatches(
                List.of(file("src/Tiny.java", 45000, 0)),
                contentOf(Map.of("src/Tiny.java", "int a;\nint b;\nint c;\nint d;")))
            .batches();

    assertThat(batches).hasSize(3);
    assertThat(batches).extracting(b -> b.chunkInfo().startLine()).containsExactly(1, 3, 4);
    assertThat(batches).extracting(b -> b.chunkInfo().endLine()).containsExactly(2, 3, 4);
    assertThat(batches).extracting(b -> b.chunkInfo().totalChunks()).containsOnly(3);
    assertThat(tokenSum(batches)).isEqualTo(45000);
    assertThat(batches).allMatch(BatchValidator::isValid);
  }

  @Test
  @DisplayName("should fall back when the detector throws")
  void shouldFallBack_whenDetectorThrows() {
    when(failingDetector.detect(anyString(), anyString(), any(), anyInt()))
        .thenThrow(new IllegalArgumentException("bad pattern"));
    strategy = new LargeFileMultiBatchStrategy(config, failingDetector, estimator, Runnable::run);

    List<Batch> batches =
        strategy
            .generateBatches(
                List.of(file("src/Big.java", 45000, 0)),
                contentOf(Map.of("src/Big.java", UNSTRUCTURED)))
            .batches();

    assertThat(batches).hasSize(3);
    assertThat(batches).allMatch(batch -> batch.chunkInfo().fallback());
    assertThat(tokenSum(batches)).isEqualTo(45000);
  }

  @Test
  @DisplayName("should split structured code along methods with carried imports")
  void shouldSplitAlongMethods_whenCodeIsStructured() {
    config.getBuckets().setMediumFileMaxTokens(1000);
    config.getLarge().setTargetChunkSize(500);
    strategy =
        new LargeFileMultiBatchStrategy(
            config, new FunctionBoundaryDetector(estimator, config), estimator, Runnable::run);
    String content = javaClassWithMethods(8);
    int tokens = estimator.estimate(content);

    List<Batch> batches =
        strategy
            .generateBatches(
                List.of(file("src/Sample.java", tokens, 0)),
                contentOf(Map.of("src/Sample.java", content)))
            .batches();

    assertThat(batches).hasSize(4);
    assertThat(tokenSum(batches)).isEqualTo(tokens);
    assertThat(batches).noneMatch(batch -> batch.chunkInfo().fallback());
    assertThat(batches)
        .allMatch(
            batch -> batch.chunkInfo().splitQuality() >= 0
                && batch.chunkInfo().splitQuality() <= 100);
    Batch second = batches.get(1);
    assertThat(second.chunkInfo().splitType()).isEqualTo(ChunkType.FUNCTION_FOCUSED);
    assertThat(second.chunkInfo().overlapTokens()).isPositive();
    assertThat(second.reconstructionInfo().hasOverlap()).isTrue();
    assertThat(second.reconstructionInfo().integrationPoints()).isNotEmpty();
    assertThat(second.metadata().processingHints().focusAreas()).contains("function_logic");
    assertThat(batches).allMatch(BatchValidator::isValid);
  }

  @Test
  @DisplayName("should order chunks by input position regardless of thread timing")
  void shouldOrderChunksByInputPosition_whenSplitConcurrently() {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      strategy =
          new LargeFileMultiBatchStrategy(
              config, new FunctionBoundaryDetector(estimator, config), estimator, executor);

      List<Batch> batches =
          strategy
              .generateBatches(
                  List.of(file("src/B.java", 45000, 7), file("src/A.java", 45000, 3)),
                  contentOf(Map.of("src/A.java", UNSTRUCTURED, "src/B.java", UNSTRUCTURED)))
              .batches();

      assertThat(batches).hasSize(6);
      assertThat(batches).extracting(Batch::primaryPath)
          .containsExactly(
              "src/A.java", "src/A.java", "src/A.java", "src/B.java", "src/B.java", "src/B.java");
      assertThat(batches.get(0).id()).isEqualTo("large_file_2_1");
      assertThat(batches.get(3).id()).isEqualTo("large_file_1_1");
      assertThat(batches).extracting(Batch::processingOrder).containsExactly(1, 2, 3, 4, 5, 6);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("should split every file when there are more files than threads and queue slots")
  void shouldSplitAllFiles_whenFilesOutnumberExecutorCapacity() {
    config.getConcurrency().setFileReadConcurrency(2);
    config.getConcurrency().setQueueCapacity(1);
    ThreadPoolTaskExecutor executor =
        (ThreadPoolTaskExecutor) new AsyncConfig().plannerFileExecutor(config);
    try {
      strategy =
          new LargeFileMultiBatchStrategy(
              config, new FunctionBoundaryDetector(estimator, config), estimator, executor);
      List<IndexedFile> input = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        input.add(file("src/File" + i + ".java", 45000, i));
      }
      PlanningContext unreadable =
          new PlanningContext(
              path -> {
                LockSupport.parkNanos(1_000_000L);
                throw new IOException("disk unavailable: " + path);
              });

      StrategyResult result = strategy.generateBatches(input, unreadable);

      assertThat(result.rejected()).isEmpty();
      assertThat(result.batches()).hasSize(120);
      assertThat(result.batches()).allMatch(batch -> batch.chunkInfo().fallback());
      assertThat(result.batches().get(0).primaryPath()).isEqualTo("src/File0.java");
      assertThat(result.batches().get(119).primaryPath()).isEqualTo("src/File39.java");
    } finally {
      executor.shutdown();
    }
  }

  @Test
  @DisplayName("should reject files below the large-file minimum")
  void shouldRejectFile_whenBelowLargeMinimum() {
    StrategyResult result =
        strategy.generateBatches(
            List.of(file("src/Medium.java", 19000, 0)), PlanningContext.withoutContent());

    assertThat(result.batches()).isEmpty();
    assertThat(result.rejected()).hasSize(1);
    assertThat(result.rejected().get(0).reason()).isEqualTo(RejectionReason.TOO_SMALL);
    assertThat(strategy.kind()).isEqualTo(BatchKind.CHUNK);
  }

  @Test
  @DisplayName("should keep the thresholds it was built with when configuration changes later")
  void shouldKeepBuildTimeThresholds_whenConfigMutatedAfterConstruction() {
    config.getBuckets().setMediumFileMaxTokens(50000);
    config.getLarge().setTargetChunkSize(5000);

    List<Batch> batches =
        strategy
            .generateBatches(List.of(file("src/Big.java", 45000, 0)), contentOf(Map.of()))
            .batches();

    assertThat(strategy.supports(20000)).isTrue();
    assertThat(batches).hasSize(3);
  }

  @Test
  @DisplayName("should allocate totals exactly with largest remainders")
  void shouldAllocateExactly() {
    assertThat(LargeFileMultiBatchStrategy.allocate(10, new long[] {1, 1, 1}))
        .containsExactly(4, 3, 3);
    assertThat(LargeFileMultiBatchStrategy.allocate(100, new long[] {0, 0}))
        .containsExactly(50, 50);
    assertThat(LargeFileMultiBatchStrategy.allocate(7, new long[] {})).isEmpty();
    assertThat(LargeFileMultiBatchStrategy.allocate(1000, new long[] {1, 2}))
        .containsExactly(333, 667);
  }

  private static String javaClassWithMethods(int methodCount) {
    List<String> lines = new ArrayList<>();
    lines.add("package com.example;");
    lines.add("");
    lines.add("import java.util.List;");
    lines.add("import java.util.Map;");
    lines.add("");
    lines.add("public class Sample {");
    for (int m = 0; m < methodCount; m++) {
      lines.add("");
      lines.add("  public int method" + (char) ('A' + m) + "() {");
      lines.add("    int value = 0;");
      for (int i = 0; i < 20; i++) {
        lines.add("    value += compute(value, 12345678);");
      }
      lines.add("    return value;");
      lines.add("  }");
    }
    lines.add("}");
    return String.join("\n", lines);
  }
}
