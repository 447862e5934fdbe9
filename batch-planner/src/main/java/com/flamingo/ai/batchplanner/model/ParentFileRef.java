package com.flamingo.ai.batchplanner.model;

/**
 * The large file a chunk was cut from.
 *
 * @param path file path
 * @param totalTokens upstream token estimate of the whole file
 * @param originalIndex zero-based index of the file in the planner input
 */
public record ParentFileRef(String path, int totalTokens, int originalIndex) {}
