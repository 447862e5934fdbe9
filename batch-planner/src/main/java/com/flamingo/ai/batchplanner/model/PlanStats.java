package com.flamingo.ai.batchplanner.model;

/**
 * Summary counts of a plan.
 *
 * @param inputFiles files passed to the planner
 * @param plannedFiles distinct files present in at least one batch
 * @param rejectedFiles files reported as rejected
 * @param combinedBatches number of combined batches
 * @param singleBatches number of single-file batches
 * @param chunkBatches number of chunk batches
 * @param fallbackChunks chunk batches produced by equal line-count splitting
 * @param totalTokens sum of estimated tokens over all batches
 */
public record PlanStats(
    int inputFiles,
    int plannedFiles,
    int rejectedFiles,
    int combinedBatches,
    int singleBatches,
    int chunkBatches,
    int fallbackChunks,
    long totalTokens) {}
