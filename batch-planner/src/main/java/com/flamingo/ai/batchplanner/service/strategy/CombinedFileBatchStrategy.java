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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Packs small files into shared batches.
 *
 * <p>Files are first grouped by relationship score (directory, name, extension, imports, module
 * and size), then each group is bin-packed in ascending token order. A final rebalancing pass
 * merges undersized batches into their successor. Rebalancing works on an assignment array from
 * file index to batch index; the file profiles themselves never change.
 *
 * <p>Packing and merging both check the token and file caps, so the only batch that can exceed
 * {@code maxBatchSize} is a single file that is larger than the budget on its own.
 */
@Service
@Order(10)
@Slf4j
public class CombinedFileBatchStrategy implements BatchStrategy {

  private static final int DESCRIPTION_FILE_LIMIT = 5;

  private final Limits limits;
  private final RelationshipScorer scorer;

  public CombinedFileBatchStrategy(PlannerConfig plannerConfig) {
    this.limits = Limits.of(plannerConfig);
    this.scorer = new RelationshipScorer(plannerConfig.getCombined());
  }

  @Override
  public BatchKind kind() {
    return BatchKind.COMBINED;
  }

  @Override
  public boolean supports(int tokenCount) {
    return tokenCount < limits.smallFileMaxTokens();
  }

  @Override
  public StrategyResult generateBatches(List<IndexedFile> files, PlanningContext context) {
    List<RejectedFile> rejected = new ArrayList<>();
    List<FileProfile> profiles = new ArrayList<>();
    for (IndexedFile file : files) {
      if (supports(file.tokenCount())) {
        profiles.add(FileProfile.of(file));
      } else {
        log.warn(
            "File {} has {} tokens, not below the combined limit of {}",
            file.path(),
            file.tokenCount(),
            limits.smallFileMaxTokens());
        rejected.add(
            RejectedFile.of(
                file,
                RejectionReason.TOO_LARGE,
                "not below " + limits.smallFileMaxTokens() + " tokens"));
      }
    }
    if (profiles.isEmpty()) {
      return new StrategyResult(List.of(), rejected);
    }

    List<List<Integer>> groups =
        limits.smartGrouping()
            ? groupRelatedFiles(profiles)
            : List.of(IntStream.range(0, profiles.size()).boxed().toList());
    Assignment assignment = pack(groups, profiles);
    mergeUndersized(assignment);

    List<Batch> batches = buildBatches(assignment, profiles);
    log.info(
        "Combined {} small files into {} batches from {} groups",
        profiles.size(),
        batches.size(),
        groups.size());
    return new StrategyResult(batches, rejected);
  }

  // ---- Grouping ----

  List<List<Integer>> groupRelatedFiles(List<FileProfile> profiles) {
    List<Integer> seeds =
        IntStream.range(0, profiles.size())
            .boxed()
            .sorted(
                Comparator.comparingDouble((Integer i) -> profiles.get(i).priority())
                    .reversed()
                    .thenComparingInt(i -> profiles.get(i).originalIndex()))
            .toList();

    boolean[] grouped = new boolean[profiles.size()];
    List<List<Integer>> groups = new ArrayList<>();
    for (int seed : seeds) {
      if (grouped[seed]) {
        continue;
      }
      grouped[seed] = true;
      List<Integer> group = new ArrayList<>();
      group.add(seed);
      long groupTokens = profiles.get(seed).tokens();

      for (ScoredFile candidate : relatedCandidates(seed, profiles, grouped)) {
        if (group.size() >= limits.maxFilesPerBatch()) {
          break;
        }
        int tokens = profiles.get(candidate.index()).tokens();
        if (groupTokens + tokens > limits.maxBatchSize()) {
          continue;
        }
        group.add(candidate.index());
        grouped[candidate.index()] = true;
        groupTokens += tokens;
      }
      groups.add(group);
    }
    return groups;
  }

  private List<ScoredFile> relatedCandidates(
      int seed, List<FileProfile> profiles, boolean[] grouped) {
    List<ScoredFile> candidates = new ArrayList<>();
    for (int i = 0; i < profiles.size(); i++) {
      if (grouped[i]) {
        continue;
      }
      int score = scorer.score(profiles.get(seed), profiles.get(i));
      if (score > 0) {
        candidates.add(new ScoredFile(i, score, profiles.get(i).originalIndex()));
      }
    }
    candidates.sort(
        Comparator.comparingInt(ScoredFile::score)
            .reversed()
            .thenComparingInt(ScoredFile::originalIndex));
    return candidates;
  }

  // ---- Packing and rebalancing ----

  private Assignment pack(List<List<Integer>> groups, List<FileProfile> profiles) {
    Assignment assignment = new Assignment(profiles);
    for (List<Integer> group : groups) {
      List<Integer> ascending =
          group.stream()
              .sorted(
                  Comparator.comparingInt((Integer i) -> profiles.get(i).tokens())
                      .thenComparingInt(i -> profiles.get(i).originalIndex()))
              .toList();
      int batch = -1;
      for (int file : ascending) {
        int tokens = profiles.get(file).tokens();
        if (batch < 0
            || assignment.tokens(batch) + tokens > limits.maxBatchSize()
            || assignment.count(batch) >= limits.maxFilesPerBatch()) {
          batch = assignment.openBatch();
        }
        assignment.assign(file, batch);
      }
    }
    return assignment;
  }

  private void mergeUndersized(Assignment assignment) {
    List<Integer> order = assignment.order();
    List<Integer> kept = new ArrayList<>();
    int i = 0;
    while (i < order.size()) {
      int current = order.get(i);
      if (i + 1 < order.size() && assignment.tokens(current) < limits.minBatchSize()) {
        int next = order.get(i + 1);
        if (assignment.tokens(current) + assignment.tokens(next) <= limits.maxBatchSize()
            && assignment.count(current) + assignment.count(next)
                <= limits.maxFilesPerBatch()) {
          assignment.members(next).forEach(file -> assignment.assign(file, current));
          log.debug("Merged undersized batch {} with batch {}", current, next);
          kept.add(current);
          i += 2;
          continue;
        }
      }
      kept.add(current);
      i++;
    }
    assignment.replaceOrder(kept);
  }

  // ---- Output ----

  private List<Batch> buildBatches(Assignment assignment, List<FileProfile> profiles) {
    List<Batch> batches = new ArrayList<>();
    int ordinal = 1;
    for (int batchIndex : assignment.order()) {
      List<FileProfile> members =
          assignment.members(batchIndex).stream().map(profiles::get).toList();
      int tokens = members.stream().mapToInt(FileProfile::tokens).sum();
      Batch batch =
          Batch.builder()
              .id("combined_batch_" + ordinal)
              .kind(BatchKind.COMBINED)
              .strategyTag(BatchKind.COMBINED.getStrategyTag())
              .estimatedTokens(tokens)
              .members(
                  members.stream()
                      .map(p -> BatchMember.of(p.file(), p.tokens(), p.priority()))
                      .toList())
              .metadata(metadata(members, tokens))
              .processingOrder(ordinal)
              .build();
      log.debug("Built {} with {} files and {} tokens", batch.id(), members.size(), tokens);
      batches.add(batch);
      ordinal++;
    }
    return batches;
  }

  private BatchMetadata metadata(List<FileProfile> members, int tokens) {
    Set<String> directories = new LinkedHashSet<>();
    Set<String> extensions = new LinkedHashSet<>();
    Set<String> modules = new LinkedHashSet<>();
    for (FileProfile member : members) {
      PathParts parts = member.parts();
      directories.add(parts.directory().isEmpty() ? "root" : parts.directory());
      extensions.add(parts.extension().isEmpty() ? "none" : parts.extension());
      modules.add(parts.module().isEmpty() ? "unknown" : parts.module());
    }

    ProcessingHints hints =
        ProcessingHints.builder()
            .analysisDepth(AnalysisDepth.COMPREHENSIVE)
            .contextAware(true)
            .crossFileReferences(true)
            .preserveRelationships(true)
            .avgTokensPerFile((int) Math.round(tokens / (double) members.size()))
            .directories(List.copyOf(directories))
            .extensions(List.copyOf(extensions))
            .modules(List.copyOf(modules))
            .build();

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("fileCount", members.size());
    attributes.put("groupedByRelationship", limits.smartGrouping());

    return new BatchMetadata(describe(members, tokens), efficiency(tokens), hints, attributes);
  }

  private int efficiency(int tokens) {
    double ratio = Math.min(tokens / (double) limits.targetBatchSize(), 1.0);
    return (int) Math.round(ratio * 100);
  }

  private static String describe(List<FileProfile> members, int tokens) {
    String names =
        members.stream()
            .limit(DESCRIPTION_FILE_LIMIT)
            .map(member -> member.parts().fileName())
            .collect(Collectors.joining(", "));
    if (members.size() > DESCRIPTION_FILE_LIMIT) {
      names += ", ...";
    }
    return String.format(
        Locale.ROOT,
        "Combined batch of %d files (%,d tokens): %s",
        members.size(),
        tokens,
        names);
  }

  private record ScoredFile(int index, int score, int originalIndex) {}

  /** Packing limits copied from configuration when the strategy is built. */
  private record Limits(
      int smallFileMaxTokens,
      int targetBatchSize,
      int maxBatchSize,
      int minBatchSize,
      int maxFilesPerBatch,
      boolean smartGrouping) {

    static Limits of(PlannerConfig config) {
      PlannerConfig.Combined combined = config.getCombined();
      return new Limits(
          config.getBuckets().getSmallFileMaxTokens(),
          combined.getTargetBatchSize(),
          combined.getMaxBatchSize(),
          combined.getMinBatchSize(),
          combined.getMaxFilesPerBatch(),
          combined.isSmartGrouping());
    }
  }

  /** Mutable file-to-batch assignment over an immutable list of file profiles. */
  private static final class Assignment {

    private final List<FileProfile> profiles;
    private final int[] batchOf;
    private final int[] sequence;
    private final long[] tokens;
    private final int[] counts;
    private List<Integer> order = new ArrayList<>();
    private int batchCount;
    private int nextSequence;

    Assignment(List<FileProfile> profiles) {
      this.profiles = profiles;
      this.batchOf = new int[profiles.size()];
      this.sequence = new int[profiles.size()];
      this.tokens = new long[profiles.size()];
      this.counts = new int[profiles.size()];
      Arrays.fill(batchOf, -1);
    }

    int openBatch() {
      int batch = batchCount++;
      order.add(batch);
      return batch;
    }

    void assign(int file, int batch) {
      int fileTokens = profiles.get(file).tokens();
      int previous = batchOf[file];
      if (previous >= 0) {
        tokens[previous] -= fileTokens;
        counts[previous]--;
      }
      batchOf[file] = batch;
      sequence[file] = nextSequence++;
      tokens[batch] += fileTokens;
      counts[batch]++;
    }

    long tokens(int batch) {
      return tokens[batch];
    }

    int count(int batch) {
      return counts[batch];
    }

    /** Files of the batch in the order they were assigned. */
    List<Integer> members(int batch) {
      return IntStream.range(0, batchOf.length)
          .filter(file -> batchOf[file] == batch)
          .boxed()
          .sorted(Comparator.comparingInt(file -> sequence[file]))
          .toList();
    }

    List<Integer> order() {
      return order;
    }

    void replaceOrder(List<Integer> newOrder) {
      order = new ArrayList<>(newOrder);
    }
  }
}
