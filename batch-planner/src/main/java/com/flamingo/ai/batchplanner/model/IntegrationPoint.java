package com.flamingo.ai.batchplanner.model;

import com.flamingo.ai.batchplanner.service.boundary.BoundaryType;

/**
 * A structural boundary inside a chunk that the reassembled documentation should respect.
 *
 * @param line 1-based line in the parent file
 * @param type kind of boundary
 * @param priority boundary priority, higher is stronger
 */
public record IntegrationPoint(int line, BoundaryType type, int priority) {}
