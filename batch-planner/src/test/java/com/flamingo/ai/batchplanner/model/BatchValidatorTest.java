package com.flamingo.ai.batchplanner.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import com.flamingo.ai.batchplanner.domain.enums.ChunkType;
import com.flamingo.ai.batchplanner.exception.InvalidBatchException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BatchValidator Tests")
class BatchValidatorTest {

  private static Batch combined() {
    return Batch.builder()
        .id("combined_batch_1")
        .kind(BatchKind.COMBINED)
        .strategyTag("combined")
        .estimatedTokens(7000)
        .members(
            List.of(
                new BatchMember("src/a.js", 3000, 0, null, 0, 3.0),
                new BatchMember("src/b.js", 4000, 0, null, 1, 4.0)))
        .metadata(new BatchMetadata("two files", 39, null, null))
        .processingOrder(1)
        .build();
  }

  private static Batch chunk() {
    return Batch.builder()
        .id("large_file_1_1")
        .kind(BatchKind.CHUNK)
        .strategyTag("largeMulti")
        .estimatedTokens(15000)
        .members(List.of(new BatchMember("src/Big.java", 15000, 0, "java", 0, 0)))
        .metadata(new BatchMetadata("chunk", 83, null, null))
        .processingOrder(1)
        .chunkInfo(new ChunkInfo(1, 3, 1, 500, "", ChunkType.MIXED, 60, false, 0))
        .parentFileRef(new ParentFileRef("src/Big.java", 45000, 0))
        .reconstructionInfo(
            new ReconstructionInfo(1, 3, false, true, false, null, "1-500", 0.0, 3.0))
        .build();
  }

  @Test
  @DisplayName("should accept well-formed batches")
  void shouldAccept_whenBatchWellFormed() {
    assertThat(BatchValidator.validate(combined())).isEmpty();
    assertThat(BatchValidator.isValid(chunk())).isTrue();
  }

  @Test
  @DisplayName("should reject a strategy tag that does not match the kind")
  void shouldReject_whenStrategyTagMismatched() {
    Batch batch = combined().toBuilder().strategyTag("single").build();

    assertThat(BatchValidator.validate(batch))
        .anyMatch(problem -> problem.contains("does not match kind combined_batch"));
  }

  @Test
  @DisplayName("should reject token totals that differ from the member sum")
  void shouldReject_whenTokensNotConserved() {
    Batch batch = combined().toBuilder().estimatedTokens(8000).build();

    assertThat(BatchValidator.validate(batch))
        .containsExactly("estimatedTokens 8000 != member sum 7000");
  }

  @Test
  @DisplayName("should reject single batches with more than one member")
  void shouldReject_whenSingleBatchHasManyMembers() {
    Batch batch =
        combined().toBuilder().id("single_batch_1").kind(BatchKind.SINGLE).strategyTag("single")
            .build();

    assertThat(BatchValidator.validate(batch))
        .contains("single_batch must have exactly one member");
  }

  @Test
  @DisplayName("should reject chunk batches missing their chunk fields")
  void shouldReject_whenChunkFieldsMissing() {
    Batch batch = chunk().toBuilder().chunkInfo(null).reconstructionInfo(null).build();

    assertThat(BatchValidator.validate(batch))
        .contains("chunkInfo is missing", "reconstructionInfo is missing");
  }

  @Test
  @DisplayName("should reject chunk indexes outside the chunk count")
  void shouldReject_whenChunkIndexOutOfRange() {
    Batch batch =
        chunk().toBuilder()
            .chunkInfo(new ChunkInfo(4, 3, 1, 500, "", ChunkType.MIXED, 60, false, 0))
            .build();

    assertThat(BatchValidator.validate(batch)).contains("chunkIndex 4 outside 1..3");
  }

  @Test
  @DisplayName("should throw with every problem when validation is required")
  void shouldThrow_whenRequiredBatchInvalid() {
    Batch batch = combined().toBuilder().metadata(null).members(List.of()).build();

    assertThatThrownBy(() -> BatchValidator.requireValid(batch))
        .isInstanceOf(InvalidBatchException.class)
        .satisfies(
            error -> {
              InvalidBatchException invalid = (InvalidBatchException) error;
              assertThat(invalid.getBatchId()).isEqualTo("combined_batch_1");
              assertThat(invalid.getProblems())
                  .contains("metadata is missing", "batch has no members");
            });
  }

  @Test
  @DisplayName("should reject a combined batch with more members than the file cap")
  void shouldReject_whenCombinedBatchExceedsFileCap() {
    Batch batch = combined();

    assertThat(BatchValidator.validate(batch, 2)).isEmpty();
    assertThat(BatchValidator.validate(batch, 1))
        .containsExactly("combined batch has 2 members, more than 1");
    assertThatThrownBy(() -> BatchValidator.requireValid(batch, 1))
        .isInstanceOf(InvalidBatchException.class);
    assertThat(BatchValidator.validate(chunk(), 0)).isEmpty();
  }
}
