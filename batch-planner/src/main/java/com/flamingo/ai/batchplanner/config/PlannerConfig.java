package com.flamingo.ai.batchplanner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for batch planning. */
@Configuration
@ConfigurationProperties(prefix = "planner")
@Getter
@Setter
public class PlannerConfig {

  private Buckets buckets = new Buckets();
  private Combined combined = new Combined();
  private Single single = new Single();
  private Large large = new Large();
  private Concurrency concurrency = new Concurrency();

  /** Token thresholds that route a file to a strategy. */
  @Getter
  @Setter
  public static class Buckets {
    /** Files strictly below this count are combined with other files. */
    private int smallFileMaxTokens = 15000;

    /** Files strictly below this count (and not small) get a batch of their own. */
    private int mediumFileMaxTokens = 20000;
  }

  @Getter
  @Setter
  public static class Combined {
    private int targetBatchSize = 18000;
    private int maxBatchSize = 22000;
    private int minBatchSize = 8000;
    private int maxFilesPerBatch = 12;

    /** When disabled, all small files are packed as one group in input order. */
    private boolean smartGrouping = true;

    /** Normalized Levenshtein similarity above which two base names count as similar. */
    private double nameSimilarityThreshold = 0.6;

    /** Smaller-to-larger token ratio above which two files count as similarly sized. */
    private double sizeSimilarityThreshold = 0.7;

    private Weights weights = new Weights();
  }

  /** Relationship score contributions used when grouping small files. */
  @Getter
  @Setter
  public static class Weights {
    private int sameDirectory = 5;
    private int similarName = 3;
    private int sameExtension = 2;
    private int importDependency = 8;
    private int sameModule = 6;
    private int similarSize = 1;
  }

  @Getter
  @Setter
  public static class Single {
    /** Files below this count get a basic analysis depth. */
    private int basicBandMaxTokens = 16000;

    /** Files below this count (and not basic) get a comprehensive analysis depth. */
    private int comprehensiveBandMaxTokens = 18000;

    /** Size at which a single-file batch is considered fully efficient. */
    private int idealBatchSize = 18000;
  }

  @Getter
  @Setter
  public static class Large {
    private int targetChunkSize = 18000;
    private int chunkOverlapTokens = 500;

    /** Fraction above the target a chunk may grow before a cut is forced. */
    private double boundaryTolerance = 0.1;

    /** Fraction of the target a chunk must reach before a boundary may close it. */
    private double minChunkRatio = 0.5;

    private int maxChunksPerFile = 10;
    private boolean preserveImports = true;
    private int fallbackSplitQuality = 30;
    private QualityWeights qualityWeights = new QualityWeights();
  }

  /** Weights of the split quality components. Expected to sum to 1. */
  @Getter
  @Setter
  public static class QualityWeights {
    private double structuralIntegrity = 0.30;
    private double contextPreservation = 0.25;
    private double sizeBalance = 0.20;
    private double dependencyHandling = 0.15;
    private double readability = 0.10;
  }

  @Getter
  @Setter
  public static class Concurrency {
    private int fileReadConcurrency = 4;
    private int queueCapacity = 500;
  }
}
