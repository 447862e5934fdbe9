package com.flamingo.ai.batchplanner.service.boundary;

import com.flamingo.ai.batchplanner.config.PlannerConfig;
import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import com.flamingo.ai.batchplanner.model.CodeSymbol;
import com.flamingo.ai.batchplanner.model.StructuralSummary;
import com.flamingo.ai.batchplanner.service.token.TokenEstimator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Boundary detector that cuts large files at class, function and block ends.
 *
 * <p>Lines are accumulated greedily. When the running total would pass the target plus the
 * configured tolerance, the chunk is closed at the strongest boundary found after the minimum
 * chunk size, preferring the latest one on ties. Without any boundary in that window the cut
 * happens right before the overflowing line and the chunk is marked {@code mixed}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FunctionBoundaryDetector implements BoundaryDetector {

  private final TokenEstimator tokenEstimator;
  private final PlannerConfig plannerConfig;

  @Override
  public DetectionResult detect(
      String path, String content, StructuralSummary summary, int targetTokens) {
    String language = LanguageRules.detectLanguage(path, summary);
    if (content == null || content.isBlank()) {
      return DetectionResult.failure(language, "content is empty");
    }
    if (targetTokens <= 0) {
      return DetectionResult.failure(language, "target size must be positive");
    }
    try {
      List<DetectedChunk> chunks =
          split(content, summary, targetTokens, LanguageRules.forLanguage(language));
      log.debug("Detected {} chunks in {} ({} rules)", chunks.size(), path, language);
      return DetectionResult.success(language, chunks);
    } catch (RuntimeException e) {
      log.warn("Boundary detection failed for {}: {}", path, e.getMessage());
      return DetectionResult.failure(language, e.getMessage());
    }
  }

  private List<DetectedChunk> split(
      String content, StructuralSummary summary, int targetTokens, LanguageRules rules) {
    String[] lines = splitLines(content);
    int[] lineTokens = new int[lines.length];
    for (int i = 0; i < lines.length; i++) {
      lineTokens[i] =
          tokenEstimator.estimate(i < lines.length - 1 ? lines[i] + "\n" : lines[i]);
    }
    BoundaryCandidate[] candidates = scanCandidates(lines, summary, rules);

    PlannerConfig.Large large = plannerConfig.getLarge();
    long overflowLimit = (long) Math.floor(targetTokens * (1 + large.getBoundaryTolerance()));
    long minTokens = (long) Math.ceil(targetTokens * large.getMinChunkRatio());

    List<LineRange> ranges = new ArrayList<>();
    int start = 0;
    while (start < lines.length) {
      int overflow = findOverflow(lineTokens, start, overflowLimit);
      if (overflow < 0) {
        ranges.add(new LineRange(start, lines.length - 1, false));
        break;
      }
      int cut = pickCut(candidates, lineTokens, start, overflow, minTokens);
      boolean forced = cut < 0;
      if (forced) {
        cut = Math.max(start, overflow - 1);
      }
      ranges.add(new LineRange(start, cut, forced));
      start = cut + 1;
    }

    List<String> imports =
        large.isPreserveImports() ? extractHeaderImports(lines, rules) : List.of();
    List<DetectedChunk> chunks = new ArrayList<>(ranges.size());
    for (int i = 0; i < ranges.size(); i++) {
      chunks.add(
          buildChunk(
              ranges.get(i), i + 1, i == ranges.size() - 1, lines, lineTokens, candidates,
              imports, rules));
    }
    return chunks;
  }

  // ---- Cut selection ----

  private static int findOverflow(int[] lineTokens, int start, long overflowLimit) {
    long running = 0;
    for (int i = start; i < lineTokens.length; i++) {
      running += lineTokens[i];
      if (running > overflowLimit) {
        return i;
      }
    }
    return -1;
  }

  private static int pickCut(
      BoundaryCandidate[] candidates, int[] lineTokens, int start, int overflow, long minTokens) {
    long running = 0;
    int best = -1;
    for (int i = start; i < overflow; i++) {
      running += lineTokens[i];
      if (running < minTokens || candidates[i] == null) {
        continue;
      }
      if (best < 0 || candidates[i].priority() >= candidates[best].priority()) {
        best = i;
      }
    }
    return best;
  }

  // ---- Candidate scanning ----

  /** Returns, for each zero-based line, the strongest boundary that allows a cut after it. */
  BoundaryCandidate[] scanCandidates(
      String[] lines, StructuralSummary summary, LanguageRules rules) {
    BoundaryCandidate[] result = new BoundaryCandidate[lines.length];
    Deque<BoundaryType> openBlocks = new ArrayDeque<>();
    BoundaryType pending = null;
    boolean inBlockComment = false;

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        offer(result, i, BoundaryType.BLANK);
        continue;
      }

      BoundaryType declared = inBlockComment ? null : rules.declarationType(line);
      if (declared != null) {
        int anchor = decorationStart(lines, i, rules);
        if (anchor > 0) {
          offer(result, anchor - 1, declared);
        }
        if (declared != BoundaryType.COMMENT && declared != BoundaryType.MODULE) {
          pending = declared;
        }
      }

      if (!rules.braceDelimited()) {
        continue;
      }
      BlockScan scan = scanBraces(line, inBlockComment, openBlocks, pending);
      inBlockComment = scan.inBlockComment();
      pending = scan.pending();
      if (scan.closed() != null) {
        offer(result, i, scan.closed());
      }
    }

    if (summary != null) {
      offerSymbols(result, summary.classes(), BoundaryType.CLASS);
      offerSymbols(result, summary.interfaces(), BoundaryType.INTERFACE);
      offerSymbols(result, summary.functions(), BoundaryType.FUNCTION);
    }
    return result;
  }

  private static BlockScan scanBraces(
      String line, boolean inBlockComment, Deque<BoundaryType> openBlocks, BoundaryType pending) {
    BoundaryType closed = null;
    boolean inComment = inBlockComment;
    char quote = 0;
    for (int c = 0; c < line.length(); c++) {
      char ch = line.charAt(c);
      char next = c + 1 < line.length() ? line.charAt(c + 1) : 0;
      if (inComment) {
        if (ch == '*' && next == '/') {
          inComment = false;
          c++;
        }
        continue;
      }
      if (quote != 0) {
        if (ch == '\\') {
          c++;
        } else if (ch == quote) {
          quote = 0;
        }
        continue;
      }
      if (ch == '/' && next == '/') {
        break;
      }
      if (ch == '/' && next == '*') {
        inComment = true;
        c++;
        continue;
      }
      switch (ch) {
        case '"', '\'', '`' -> quote = ch;
        case '{' -> {
          openBlocks.push(pending != null ? pending : BoundaryType.BLOCK);
          pending = null;
        }
        case '}' -> {
          if (!openBlocks.isEmpty()) {
            BoundaryType block = openBlocks.pop();
            BoundaryType end = endType(block, openBlocks.size());
            if (end != null && (closed == null || end.getPriority() > closed.getPriority())) {
              closed = end;
            }
          }
        }
        case ';' -> pending = null;
        default -> {
          // other characters do not affect block structure
        }
      }
    }
    return new BlockScan(closed, pending, inComment);
  }

  /** Anonymous blocks only count as a boundary when they close near the top level. */
  private static BoundaryType endType(BoundaryType block, int depthAfterClose) {
    if (block != BoundaryType.BLOCK) {
      return block;
    }
    return depthAfterClose <= 1 ? BoundaryType.BLOCK : null;
  }

  /** Walks up over annotations, decorators and doc comments that belong to a declaration. */
  private static int decorationStart(String[] lines, int declarationLine, LanguageRules rules) {
    int start = declarationLine;
    while (start > 0) {
      String above = lines[start - 1].strip();
      if (above.isEmpty() || !(above.startsWith("@") || rules.isComment(above))) {
        break;
      }
      start--;
    }
    return start;
  }

  private static void offerSymbols(
      BoundaryCandidate[] result, List<CodeSymbol> symbols, BoundaryType type) {
    for (CodeSymbol symbol : symbols) {
      if (symbol.endLine() >= 1 && symbol.endLine() <= result.length) {
        offer(result, symbol.endLine() - 1, type);
      }
      if (symbol.startLine() >= 2 && symbol.startLine() <= result.length) {
        offer(result, symbol.startLine() - 2, type);
      }
    }
  }

  private static void offer(BoundaryCandidate[] result, int index, BoundaryType type) {
    if (index < 0 || index >= result.length) {
      return;
    }
    BoundaryCandidate current = result[index];
    if (current == null || type.getPriority() > current.priority()) {
      result[index] = new BoundaryCandidate(index + 1, type);
    }
  }

  // ---- Chunk assembly ----

  private DetectedChunk buildChunk(
      LineRange range,
      int chunkIndex,
      boolean last,
      String[] lines,
      int[] lineTokens,
      BoundaryCandidate[] candidates,
      List<String> imports,
      LanguageRules rules) {
    List<BoundaryCandidate> boundaries = new ArrayList<>();
    long tokens = 0;
    for (int i = range.start(); i <= range.end(); i++) {
      tokens += lineTokens[i];
      if (candidates[i] != null && candidates[i].priority() >= BoundaryType.STRUCTURAL_PRIORITY) {
        boundaries.add(candidates[i]);
      }
    }
    ChunkType type = range.forced() ? ChunkType.MIXED : classify(boundaries, chunkIndex, last);

    List<String> carried = new ArrayList<>();
    int overlapTokens = 0;
    if (chunkIndex > 1) {
      int budget = plannerConfig.getLarge().getChunkOverlapTokens();
      for (String importLine : imports) {
        int importTokens = tokenEstimator.estimate(importLine + "\n");
        if (overlapTokens + importTokens > budget) {
          break;
        }
        carried.add(importLine);
        overlapTokens += importTokens;
      }
    }

    int startLine = range.start() + 1;
    int endLine = range.end() + 1;
    StringBuilder content = new StringBuilder();
    content
        .append(rules.lineComment())
        .append(" Chunk ")
        .append(chunkIndex)
        .append(" - lines ")
        .append(startLine)
        .append('-')
        .append(endLine)
        .append('\n');
    if (!carried.isEmpty()) {
      content.append(rules.lineComment()).append(" Required imports\n");
      carried.forEach(importLine -> content.append(importLine).append('\n'));
      content.append('\n');
    }
    for (int i = range.start(); i <= range.end(); i++) {
      content.append(lines[i]);
      if (i < range.end()) {
        content.append('\n');
      }
    }

    return new DetectedChunk(
        startLine,
        endLine,
        content.toString(),
        (int) Math.min(Integer.MAX_VALUE, tokens),
        type,
        boundaries,
        carried,
        overlapTokens,
        true);
  }

  private static ChunkType classify(
      List<BoundaryCandidate> boundaries, int chunkIndex, boolean last) {
    if (has(boundaries, BoundaryType.CLASS)) {
      return ChunkType.CLASS_FOCUSED;
    }
    if (has(boundaries, BoundaryType.FUNCTION)) {
      return ChunkType.FUNCTION_FOCUSED;
    }
    if (has(boundaries, BoundaryType.INTERFACE) || has(boundaries, BoundaryType.TYPE)) {
      return ChunkType.INTERFACE_FOCUSED;
    }
    if (has(boundaries, BoundaryType.MODULE)) {
      return ChunkType.MODULE_FOCUSED;
    }
    return last && chunkIndex > 1 ? ChunkType.REMAINDER : ChunkType.MIXED;
  }

  private static boolean has(List<BoundaryCandidate> boundaries, BoundaryType type) {
    return boundaries.stream().anyMatch(boundary -> boundary.type() == type);
  }

  /** Import lines from the file header, up to the first line of other code. */
  static List<String> extractHeaderImports(String[] lines, LanguageRules rules) {
    List<String> imports = new ArrayList<>();
    for (String line : lines) {
      String stripped = line.strip();
      if (stripped.isEmpty() || rules.isComment(stripped) || stripped.startsWith("#!")) {
        continue;
      }
      if (!rules.isImport(stripped)) {
        break;
      }
      imports.add(stripped);
    }
    return imports;
  }

  private static String[] splitLines(String content) {
    String normalized = content.replace("\r\n", "\n");
    if (normalized.endsWith("\n")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized.split("\n", -1);
  }

  private record LineRange(int start, int end, boolean forced) {}

  private record BlockScan(BoundaryType closed, BoundaryType pending, boolean inBlockComment) {}
}
