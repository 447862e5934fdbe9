package com.flamingo.ai.batchplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.batchplanner.domain.enums.BatchKind;
import java.util.List;
import lombok.Builder;

/**
 * The unit of work handed to the documentation generator. Every strategy produces this shape;
 * chunk-only fields are null for the other kinds.
 *
 * @param id identifier, unique within a plan
 * @param kind batch kind
 * @param strategyTag tag of the strategy that produced the batch, must match the kind
 * @param estimatedTokens tokens the batch is expected to consume
 * @param members files in processing order
 * @param metadata description, efficiency and hints
 * @param processingOrder 1-based position within the producing strategy's output
 * @param chunkInfo chunk position and content, chunk batches only
 * @param parentFileRef the split file, chunk batches only
 * @param reconstructionInfo stitching data, chunk batches only
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Batch(
    String id,
    BatchKind kind,
    String strategyTag,
    int estimatedTokens,
    List<BatchMember> members,
    BatchMetadata metadata,
    int processingOrder,
    ChunkInfo chunkInfo,
    ParentFileRef parentFileRef,
    ReconstructionInfo reconstructionInfo) {

  public Batch {
    members = members == null ? List.of() : List.copyOf(members);
  }

  @JsonIgnore
  public int memberCount() {
    return members.size();
  }

  @JsonIgnore
  public boolean isChunk() {
    return kind == BatchKind.CHUNK;
  }

  @JsonIgnore
  public List<String> memberPaths() {
    return members.stream().map(BatchMember::path).toList();
  }

  /** Path of the file this batch covers: the parent for chunks, otherwise the first member. */
  @JsonIgnore
  public String primaryPath() {
    if (parentFileRef != null) {
      return parentFileRef.path();
    }
    return members.isEmpty() ? null : members.get(0).path();
  }
}
